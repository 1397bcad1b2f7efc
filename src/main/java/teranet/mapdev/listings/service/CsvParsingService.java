package teranet.mapdev.listings.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import teranet.mapdev.listings.config.EtlProperties;
import teranet.mapdev.listings.exception.CsvParseException;
import teranet.mapdev.listings.model.Table;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Service responsible for turning delimited text into a {@link Table}.
 *
 * Features:
 * - RFC 4180 quoting: delimiters, doubled quotes and line breaks inside quoted fields
 * - Header row required; UTF-8 byte order mark stripped
 * - Configured NA tokens read as null
 * - Per-column type inference: all integral → Long, all numeric → Double, else String
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class CsvParsingService {

    private static final Logger logger = LoggerFactory.getLogger(CsvParsingService.class);

    private static final char QUOTE = '"';
    private static final char BOM = '\uFEFF';

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private final EtlProperties properties;

    public CsvParsingService(EtlProperties properties) {
        this.properties = properties;
    }

    /**
     * Parse a delimited text stream using the configured encoding.
     *
     * @param inputStream decompressed text stream (not closed by this method)
     * @param delimiter   field delimiter, ',' or '\t'
     * @param sourceName  name used in log and error messages
     * @return typed raw table
     * @throws CsvParseException if the bytes are not valid in the configured encoding, the
     *                           header is missing, a quote is unbalanced or a row has more
     *                           fields than the header
     */
    public Table parse(InputStream inputStream, char delimiter, String sourceName) {
        Charset charset = Charset.forName(properties.getExtraction().getEncoding());
        // Bad bytes fail the parse instead of turning into U+FFFD
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        Reader reader = new BufferedReader(new InputStreamReader(inputStream, decoder));
        return parse(reader, delimiter, sourceName);
    }

    public Table parse(Reader reader, char delimiter, String sourceName) {
        logger.debug("Parsing delimited text from {}", sourceName);

        RecordReader records = new RecordReader(reader, delimiter);
        Set<String> naValues = new HashSet<>(properties.getExtraction().getNaValues());

        try {
            List<String> header = records.next();
            while (header != null && isBlankRecord(header)) {
                header = records.next();
            }
            if (header == null) {
                throw new CsvParseException("No header row found in " + sourceName, 1);
            }
            List<String> columns = buildColumnNames(header);

            List<List<String>> cells = new ArrayList<>();
            List<String> record;
            while ((record = records.next()) != null) {
                if (isBlankRecord(record)) {
                    continue;
                }
                if (record.size() > columns.size()) {
                    throw new CsvParseException(String.format(
                            "Expected %d fields but found %d", columns.size(), record.size()),
                            records.getRecordStartLine());
                }
                cells.add(record);
            }

            Table table = buildTable(columns, cells, naValues);
            logger.info("Parsed {} rows x {} columns from {}", table.rowCount(), table.columnCount(), sourceName);
            return table;

        } catch (IOException e) {
            throw new CsvParseException("Failed to read " + sourceName + ": " + e.getMessage(), e);
        }
    }

    /**
     * Trimmed cell text, or null when it is an NA token.
     */
    String toCellText(String raw, Set<String> naValues) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        if (naValues.contains(value)) {
            return null;
        }
        return value;
    }

    private Table buildTable(List<String> columns, List<List<String>> cells, Set<String> naValues) {
        int columnCount = columns.size();

        // Cell text with NA tokens resolved, padded to the header width
        List<String[]> text = new ArrayList<>(cells.size());
        for (List<String> record : cells) {
            String[] row = new String[columnCount];
            for (int i = 0; i < record.size(); i++) {
                row[i] = toCellText(record.get(i), naValues);
            }
            text.add(row);
        }

        List<Map<String, Object>> rows = new ArrayList<>(text.size());
        for (int r = 0; r < text.size(); r++) {
            rows.add(new LinkedHashMap<>());
        }

        for (int c = 0; c < columnCount; c++) {
            String column = columns.get(c);
            Kind kind = inferKind(text, c);
            for (int r = 0; r < text.size(); r++) {
                rows.get(r).put(column, convert(text.get(r)[c], kind));
            }
        }

        return new Table(columns, rows);
    }

    private enum Kind { LONG, DOUBLE, STRING }

    private Kind inferKind(List<String[]> text, int column) {
        Kind kind = Kind.LONG;
        boolean seen = false;
        for (String[] row : text) {
            String value = row[column];
            if (value == null) {
                continue;
            }
            seen = true;
            if (kind == Kind.LONG && !isLong(value)) {
                kind = Kind.DOUBLE;
            }
            if (kind == Kind.DOUBLE && !DECIMAL.matcher(value).matches()) {
                return Kind.STRING;
            }
        }
        return seen ? kind : Kind.STRING;
    }

    private boolean isLong(String value) {
        if (!INTEGER.matcher(value).matches()) {
            return false;
        }
        try {
            Long.parseLong(value.startsWith("+") ? value.substring(1) : value);
            return true;
        } catch (NumberFormatException e) {
            return false; // overflows long, read as double
        }
    }

    private Object convert(String value, Kind kind) {
        if (value == null) {
            return null;
        }
        switch (kind) {
            case LONG:
                return Long.parseLong(value.startsWith("+") ? value.substring(1) : value);
            case DOUBLE:
                return Double.parseDouble(value);
            default:
                return value;
        }
    }

    /**
     * Header names as read, made unique the way spreadsheet tools do:
     * blank names become "Unnamed: {index}", repeats get ".1", ".2" suffixes.
     */
    private List<String> buildColumnNames(List<String> header) {
        List<String> columns = new ArrayList<>(header.size());
        Set<String> used = new HashSet<>();
        boolean renamed = false;
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i) == null ? "" : header.get(i).trim();
            if (name.isEmpty()) {
                name = "Unnamed: " + i;
            }
            String unique = name;
            for (int k = 1; used.contains(unique); k++) {
                unique = name + "." + k;
                renamed = true;
            }
            used.add(unique);
            columns.add(unique);
        }
        if (renamed) {
            logger.warn("Header contained duplicate names, renamed: {}", columns);
        }
        return columns;
    }

    private boolean isBlankRecord(List<String> record) {
        return record.size() == 1 && record.get(0).trim().isEmpty();
    }

    /**
     * Reads one logical record at a time; a record may span several physical lines
     * when a quoted field contains line breaks.
     */
    private static final class RecordReader {

        private final Reader reader;
        private final char delimiter;
        private long line = 1;
        private long recordStartLine = 1;
        private int pushedBack = -1;
        private boolean atStart = true;

        RecordReader(Reader reader, char delimiter) {
            this.reader = reader;
            this.delimiter = delimiter;
        }

        long getRecordStartLine() {
            return recordStartLine;
        }

        List<String> next() throws IOException {
            int c = read();
            if (atStart) {
                atStart = false;
                if (c == BOM) {
                    c = read();
                }
            }
            if (c == -1) {
                return null;
            }
            recordStartLine = line;

            List<String> values = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            boolean inQuotes = false;
            boolean quoted = false;

            while (true) {
                if (c == -1) {
                    if (inQuotes) {
                        throw new CsvParseException("Unbalanced quote in record", recordStartLine);
                    }
                    values.add(finish(current, quoted));
                    return values;
                }
                char ch = (char) c;
                if (inQuotes) {
                    if (ch == QUOTE) {
                        int peek = read();
                        if (peek == QUOTE) {
                            current.append(QUOTE);
                        } else {
                            inQuotes = false;
                            unread(peek);
                        }
                    } else {
                        if (ch == '\n') {
                            line++;
                        }
                        current.append(ch);
                    }
                } else if (ch == QUOTE && current.toString().trim().isEmpty() && !quoted) {
                    current.setLength(0);
                    inQuotes = true;
                    quoted = true;
                } else if (ch == delimiter) {
                    values.add(finish(current, quoted));
                    current = new StringBuilder();
                    quoted = false;
                } else if (ch == '\r' || ch == '\n') {
                    if (ch == '\r') {
                        int peek = read();
                        if (peek != '\n') {
                            unread(peek);
                        }
                    }
                    line++;
                    values.add(finish(current, quoted));
                    return values;
                } else {
                    current.append(ch);
                }
                c = read();
            }
        }

        private String finish(StringBuilder current, boolean quoted) {
            // Quoted content is kept verbatim, anything after the closing quote is appended
            return quoted ? current.toString() : current.toString().trim();
        }

        private int read() throws IOException {
            if (pushedBack != -1) {
                int c = pushedBack;
                pushedBack = -1;
                return c;
            }
            return reader.read();
        }

        private void unread(int c) {
            pushedBack = c;
        }
    }
}
