package teranet.mapdev.listings.writer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import teranet.mapdev.listings.model.Table;

import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Comma-separated text with a header row, UTF-8, RFC 4180 quoting.
 *
 * Missing values are written as empty fields. Timestamps at midnight are written as
 * dates (yyyy-MM-dd), others as yyyy-MM-dd HH:mm:ss.
 */
@Component
public class CsvTableWriter implements TableWriter {

    private static final Logger logger = LoggerFactory.getLogger(CsvTableWriter.class);

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.CSV;
    }

    @Override
    public void write(Table table, Path target) throws IOException {
        List<String> columns = table.getColumns();

        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writeRecord(writer, columns);
            List<String> values = new ArrayList<>(columns.size());
            for (Map<String, Object> row : table.getRows()) {
                values.clear();
                for (String column : columns) {
                    values.add(format(row.get(column)));
                }
                writeRecord(writer, values);
            }
        }

        logger.debug("Wrote {} rows to {}", table.rowCount(), target);
    }

    private void writeRecord(BufferedWriter writer, List<String> values) throws IOException {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) line.append(',');
            line.append(escape(values.get(i)));
        }
        writer.write(line.toString());
        writer.write('\n');
    }

    static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double) {
            // Plain notation, no exponent
            String text = BigDecimal.valueOf((Double) value).toPlainString();
            return text.indexOf('.') >= 0 ? text : text + ".0";
        }
        if (value instanceof LocalDateTime) {
            LocalDateTime dateTime = (LocalDateTime) value;
            return dateTime.toLocalTime().equals(LocalTime.MIDNIGHT)
                    ? DATE.format(dateTime) : DATE_TIME.format(dateTime);
        }
        return value.toString();
    }

    static String escape(String value) {
        if (value.indexOf(',') >= 0 || value.indexOf('"') >= 0
                || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }
}
