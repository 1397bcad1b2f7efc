package teranet.mapdev.listings.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import teranet.mapdev.listings.config.EtlProperties;
import teranet.mapdev.listings.exception.CsvParseException;
import teranet.mapdev.listings.exception.EtlException;
import teranet.mapdev.listings.exception.NoTabularDataFoundException;
import teranet.mapdev.listings.exception.SourceNotFoundException;
import teranet.mapdev.listings.exception.UnsupportedSourceTypeException;
import teranet.mapdev.listings.model.SourceType;
import teranet.mapdev.listings.model.Table;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Reads the raw listings data set from an archive or a flat delimited file.
 *
 * Archive sources: entries are scanned in archive listing order and the first entry
 * whose name ends with .csv is used (not the alphabetically first one).
 */
@Service
public class SourceExtractor {

    private static final Logger logger = LoggerFactory.getLogger(SourceExtractor.class);

    private static final List<String> FLAT_EXTENSIONS = List.of(
            ".csv", ".tsv", ".txt", ".csv.gz", ".tsv.gz", ".txt.gz");

    private final CsvParsingService csvParsingService;
    private final FileChecksumService fileChecksumService;
    private final EtlProperties properties;

    public SourceExtractor(CsvParsingService csvParsingService,
                           FileChecksumService fileChecksumService,
                           EtlProperties properties) {
        this.csvParsingService = csvParsingService;
        this.fileChecksumService = fileChecksumService;
        this.properties = properties;
    }

    /**
     * Extract the raw table from a source file.
     *
     * @param source     path of the archive or flat file
     * @param sourceType ARCHIVE, FLAT, or AUTO/null to infer from the extension
     * @return raw table, columns typed by inference
     * @throws SourceNotFoundException         if the path does not exist
     * @throws UnsupportedSourceTypeException  if the type cannot be inferred
     * @throws NoTabularDataFoundException     if an archive holds no .csv entry
     * @throws CsvParseException               if the content is malformed
     */
    public Table extract(Path source, SourceType sourceType) {
        if (source == null || !Files.isRegularFile(source)) {
            throw new SourceNotFoundException("Source not found: " + source);
        }

        SourceType resolved = resolveSourceType(source, sourceType);
        logger.info("Extracting {} source: {}", resolved.name().toLowerCase(Locale.ROOT), source);

        Table table = resolved == SourceType.ARCHIVE ? extractArchive(source) : extractFlat(source);

        logger.info("Extracted raw table {} from {}", table.shape(), source.getFileName());
        return table;
    }

    /**
     * Decide the source type from the file extension when it is not given.
     */
    public SourceType resolveSourceType(Path source, SourceType sourceType) {
        if (sourceType != null && sourceType != SourceType.AUTO) {
            return sourceType;
        }
        String name = source.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".zip")) {
            return SourceType.ARCHIVE;
        }
        for (String extension : FLAT_EXTENSIONS) {
            if (name.endsWith(extension)) {
                return SourceType.FLAT;
            }
        }
        throw new UnsupportedSourceTypeException("Cannot infer source type from file name: " + source.getFileName());
    }

    private Table extractArchive(Path source) {
        try (ZipFile zipFile = new ZipFile(source.toFile())) {
            ZipEntry selected = selectFirstCsvEntry(zipFile);
            if (selected == null) {
                throw new NoTabularDataFoundException("No .csv entry found in archive: " + source.getFileName());
            }
            logger.info("Using archive entry: {}", selected.getName());

            if (properties.getExtraction().isStageArchiveEntries()) {
                stageEntry(zipFile, selected);
            }

            try (InputStream inputStream = zipFile.getInputStream(selected)) {
                return csvParsingService.parse(inputStream, delimiterFor(selected.getName()),
                        source.getFileName() + "!" + selected.getName());
            }
        } catch (ZipException e) {
            throw new CsvParseException("Not a readable archive: " + source.getFileName(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read archive " + source, e);
        }
    }

    /**
     * First non-directory entry, in listing order, whose name ends with .csv.
     */
    ZipEntry selectFirstCsvEntry(ZipFile zipFile) {
        ZipEntry selected = null;
        int csvCount = 0;
        Enumeration<? extends ZipEntry> entries = zipFile.entries();
        while (entries.hasMoreElements()) {
            ZipEntry entry = entries.nextElement();
            if (entry.isDirectory() || !entry.getName().toLowerCase(Locale.ROOT).endsWith(".csv")) {
                continue;
            }
            csvCount++;
            if (selected == null) {
                selected = entry;
            }
        }
        if (csvCount > 1) {
            logger.warn("Archive holds {} .csv entries, using the first listed: {}", csvCount, selected.getName());
        }
        return selected;
    }

    /**
     * Copy the selected entry under the raw data directory for traceability.
     */
    private void stageEntry(ZipFile zipFile, ZipEntry entry) throws IOException {
        Path rawDir = Paths.get(properties.getPaths().getRawData()).toAbsolutePath().normalize();
        Path target = rawDir.resolve(entry.getName()).normalize();

        // Zip-slip guard
        if (!target.startsWith(rawDir)) {
            throw new EtlException("Archive entry escapes the raw data directory: " + entry.getName());
        }

        Files.createDirectories(target.getParent());
        try (InputStream inputStream = zipFile.getInputStream(entry)) {
            Files.copy(inputStream, target, StandardCopyOption.REPLACE_EXISTING);
        }
        logger.debug("Staged archive entry {} to {}", entry.getName(), target);
    }

    private Table extractFlat(Path source) {
        String compression = properties.getExtraction().getCompression();
        try (InputStream inputStream = fileChecksumService.getDecompressedInputStream(source, compression)) {
            return csvParsingService.parse(inputStream, delimiterFor(source.getFileName().toString()),
                    source.getFileName().toString());
        } catch (ZipException e) {
            throw new CsvParseException("Not valid gzip content: " + source.getFileName(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + source, e);
        }
    }

    private char delimiterFor(String fileName) {
        String name = fileName.toLowerCase(Locale.ROOT);
        return name.endsWith(".tsv") || name.endsWith(".tsv.gz") ? '\t' : ',';
    }
}
