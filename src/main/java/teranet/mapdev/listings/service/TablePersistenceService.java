package teranet.mapdev.listings.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.listings.config.EtlProperties;
import teranet.mapdev.listings.exception.PersistenceException;
import teranet.mapdev.listings.model.PersistResult;
import teranet.mapdev.listings.model.Table;
import teranet.mapdev.listings.writer.OutputFormat;
import teranet.mapdev.listings.writer.TableWriter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes the enriched table in every configured output format.
 *
 * Per run, in the output directory:
 * - {base}_{yyyyMMdd_HHmmss}.{ext} for each configured format
 * - {base}_latest.csv, always
 * - metadata_{yyyyMMdd_HHmmss}.txt
 * - optionally {base}_table in the relational sink
 *
 * One format failing is logged and recorded; the remaining formats are still written.
 */
@Service
@Slf4j
public class TablePersistenceService {

    public static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Map<OutputFormat, TableWriter> writers = new EnumMap<>(OutputFormat.class);
    private final MetadataFileWriter metadataFileWriter;
    private final RelationalSinkService relationalSinkService;
    private final EtlProperties properties;
    private final Clock clock;

    public TablePersistenceService(List<TableWriter> tableWriters,
                                   MetadataFileWriter metadataFileWriter,
                                   RelationalSinkService relationalSinkService,
                                   EtlProperties properties,
                                   Clock clock) {
        for (TableWriter writer : tableWriters) {
            writers.put(writer.getFormat(), writer);
        }
        this.metadataFileWriter = metadataFileWriter;
        this.relationalSinkService = relationalSinkService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Persist to the configured processed-data directory, stamped with the current time.
     */
    public PersistResult persist(Table table, String baseName) {
        return persist(table, Paths.get(properties.getPaths().getProcessedData()), baseName,
                FILE_TIMESTAMP.format(LocalDateTime.now(clock)));
    }

    public PersistResult persist(Table table, Path outputDir, String baseName, String timestamp) {
        log.info("Saving processed data to: {}", outputDir);
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory " + outputDir, e);
        }

        PersistResult result = new PersistResult();
        Set<OutputFormat> done = EnumSet.noneOf(OutputFormat.class);

        for (String name : properties.getLoading().getOutputFormats()) {
            OutputFormat format = OutputFormat.fromName(name);
            if (format == null || !writers.containsKey(format)) {
                log.warn("Unknown output format '{}', skipping", name);
                result.getSkippedFormats().add(name);
                continue;
            }
            if (!done.add(format)) {
                log.debug("Output format {} already written, skipping duplicate '{}'", format, name);
                continue;
            }

            Path target = outputDir.resolve(baseName + "_" + timestamp + "." + format.getExtension());
            try {
                writers.get(format).write(table, target);
                result.getWrittenFiles().put(name, target);
                log.info("{} saved: {}", format, target);
            } catch (IOException | RuntimeException e) {
                recordFailure(result, name, e);
            }
        }

        Path latest = outputDir.resolve(baseName + "_latest.csv");
        try {
            writers.get(OutputFormat.CSV).write(table, latest);
            result.setLatestFile(latest);
            log.info("Latest copy saved: {}", latest);
        } catch (IOException | RuntimeException e) {
            recordFailure(result, "latest", e);
        }

        try {
            result.setMetadataFile(metadataFileWriter.writeMetadata(table, outputDir, timestamp));
        } catch (IOException | RuntimeException e) {
            recordFailure(result, "metadata", e);
        }

        result.setDatabaseResult(relationalSinkService.load(table, baseName));
        return result;
    }

    private void recordFailure(PersistResult result, String target, Exception cause) {
        PersistenceException failure = new PersistenceException(target,
                "Failed to write " + target + " output: " + cause.getMessage(), cause);
        log.error(failure.getMessage(), failure);
        result.getFailedFormats().put(target, String.valueOf(cause.getMessage()));
    }
}
