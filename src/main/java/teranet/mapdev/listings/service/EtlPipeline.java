package teranet.mapdev.listings.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.listings.config.EtlProperties;
import teranet.mapdev.listings.exception.QualityCheckFailedException;
import teranet.mapdev.listings.logging.RunLogSession;
import teranet.mapdev.listings.model.PersistResult;
import teranet.mapdev.listings.model.PhaseMetrics;
import teranet.mapdev.listings.model.PipelineRunResult;
import teranet.mapdev.listings.model.QualityReport;
import teranet.mapdev.listings.model.RunSummary;
import teranet.mapdev.listings.model.SourceType;
import teranet.mapdev.listings.model.Table;
import teranet.mapdev.listings.model.TransformResult;
import teranet.mapdev.listings.util.RunIdUtil;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs the listings ETL once: extract, transform, quality gate, persist, summarize.
 *
 * Extraction and transformation failures abort the run and propagate unchanged.
 * A failed quality gate aborts only in strict mode. Output failures never abort;
 * they are recorded in the run summary.
 */
@Service
@Slf4j
public class EtlPipeline {

    private static final String SEPARATOR = "=".repeat(60);

    private final SourceExtractor sourceExtractor;
    private final ListingTransformService transformService;
    private final QualityGateService qualityGateService;
    private final TablePersistenceService persistenceService;
    private final MetadataFileWriter metadataFileWriter;
    private final FileChecksumService fileChecksumService;
    private final EtlProperties properties;
    private final Clock clock;

    public EtlPipeline(SourceExtractor sourceExtractor,
                       ListingTransformService transformService,
                       QualityGateService qualityGateService,
                       TablePersistenceService persistenceService,
                       MetadataFileWriter metadataFileWriter,
                       FileChecksumService fileChecksumService,
                       EtlProperties properties,
                       Clock clock) {
        this.sourceExtractor = sourceExtractor;
        this.transformService = transformService;
        this.qualityGateService = qualityGateService;
        this.persistenceService = persistenceService;
        this.metadataFileWriter = metadataFileWriter;
        this.fileChecksumService = fileChecksumService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Run the pipeline and return the enriched table.
     *
     * @param source     archive or flat file
     * @param sourceType ARCHIVE, FLAT, or AUTO/null to infer from the extension
     * @param outputDir  output directory, or null for etl.paths.processed-data
     */
    public Table run(Path source, SourceType sourceType, Path outputDir) {
        return execute(source, sourceType, outputDir).getTable();
    }

    public PipelineRunResult execute(Path source, SourceType sourceType, Path outputDir) {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        long startNanos = System.nanoTime();
        String timestamp = TablePersistenceService.FILE_TIMESTAMP.format(startedAt);
        Path targetDir = outputDir != null ? outputDir : Paths.get(properties.getPaths().getProcessedData());
        String baseName = properties.getLoading().getBaseName();
        String runId = RunIdUtil.startRun();

        try (RunLogSession runLog = RunLogSession.open(Paths.get(properties.getPaths().getLogs()),
                properties.getLogging())) {

            log.info(SEPARATOR);
            log.info("STARTING LISTINGS ETL PIPELINE (run {})", runId);
            log.info(SEPARATOR);
            log.debug("Run log file: {}", runLog.getLogFile());

            List<PhaseMetrics> phases = new ArrayList<>();

            // 1. EXTRACTION
            long phaseStart = System.nanoTime();
            Table raw;
            try {
                raw = sourceExtractor.extract(source, sourceType);
            } catch (RuntimeException e) {
                log.error("Extraction error: {}", e.getMessage(), e);
                throw e;
            }
            phases.add(phase("extract", phaseStart, 0, 0, raw));

            // 2. TRANSFORMATION
            phaseStart = System.nanoTime();
            TransformResult transformed;
            try {
                transformed = transformService.transformWithStats(raw);
            } catch (RuntimeException e) {
                log.error("Transformation error: {}", e.getMessage(), e);
                throw e;
            }
            Table enriched = transformed.getTable();
            phases.add(phase("transform", phaseStart, raw.rowCount(), raw.columnCount(), enriched));

            // 3. QUALITY GATE
            phaseStart = System.nanoTime();
            QualityReport report = qualityGateService.check(enriched);
            phases.add(phase("quality", phaseStart, enriched.rowCount(), enriched.columnCount(), enriched));
            if (!report.isPassed()) {
                if (properties.getQualityChecks().isStrict()) {
                    QualityCheckFailedException failure = new QualityCheckFailedException(report);
                    log.error("{} - strict mode, nothing was persisted", failure.getMessage());
                    throw failure;
                }
                log.warn("Quality checks failed - advisory mode, continuing with load");
            }

            // 4. LOADING
            phaseStart = System.nanoTime();
            PersistResult persisted = persistenceService.persist(enriched, targetDir, baseName, timestamp);
            phases.add(phase("load", phaseStart, enriched.rowCount(), enriched.columnCount(), enriched));

            // 5. SUMMARY
            LocalDateTime finishedAt = LocalDateTime.now(clock);
            RunSummary summary = RunSummary.builder()
                    .runId(runId)
                    .runTimestamp(timestamp)
                    .source(source.toString())
                    .sourceType(sourceExtractor.resolveSourceType(source, sourceType).name().toLowerCase(Locale.ROOT))
                    .sourceChecksum(checksum(source))
                    .startedAt(startedAt)
                    .finishedAt(finishedAt)
                    .durationMs(Duration.ofNanos(System.nanoTime() - startNanos).toMillis())
                    .rawRows(raw.rowCount())
                    .rawColumns(raw.columnCount())
                    .processedRows(enriched.rowCount())
                    .processedColumns(enriched.columnCount())
                    .transformStats(transformed.getStats())
                    .phases(phases)
                    .qualityReport(report)
                    .persistResult(persisted)
                    .build();

            try {
                metadataFileWriter.writeRunSummary(summary, targetDir);
            } catch (IOException e) {
                log.error("Failed to write run summary to {}", targetDir, e);
            }

            logSummary(summary);
            return new PipelineRunResult(enriched, summary);

        } finally {
            RunIdUtil.clearRunId();
        }
    }

    private PhaseMetrics phase(String name, long startNanos, int rowsIn, int columnsIn, Table out) {
        long durationMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        PhaseMetrics metrics = new PhaseMetrics(name, durationMs, rowsIn, columnsIn, out.rowCount(), out.columnCount());
        log.info("Phase {} took {} ms: ({}, {}) -> ({}, {})",
                name, durationMs, rowsIn, columnsIn, out.rowCount(), out.columnCount());
        return metrics;
    }

    private String checksum(Path source) {
        try {
            return fileChecksumService.calculateFileChecksum(source);
        } catch (IOException e) {
            log.warn("Could not checksum {}: {}", source, e.getMessage());
            return null;
        }
    }

    private void logSummary(RunSummary summary) {
        log.info(SEPARATOR);
        log.info("PIPELINE COMPLETED SUCCESSFULLY");
        log.info(SEPARATOR);
        log.info("Summary:");
        log.info("  - Raw data: {} rows, {} columns", summary.getRawRows(), summary.getRawColumns());
        log.info("  - Processed data: {} rows, {} columns", summary.getProcessedRows(), summary.getProcessedColumns());
        log.info("  - Quality checks: {}", summary.getQualityReport().isSkipped() ? "skipped"
                : summary.getQualityReport().isPassed() ? "passed" : "failed");
        log.info("  - Generated files:");
        for (Path path : summary.getPersistResult().allPaths()) {
            log.info("      * {}", path);
        }
        if (!summary.getPersistResult().getFailedFormats().isEmpty()) {
            log.warn("  - Failed outputs: {}", summary.getPersistResult().getFailedFormats().keySet());
        }
        log.info("  - Database: {}", summary.getPersistResult().getDatabaseResult().getStatus());
        log.info(SEPARATOR);
    }
}
