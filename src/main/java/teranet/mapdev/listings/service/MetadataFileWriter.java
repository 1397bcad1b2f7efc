package teranet.mapdev.listings.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.listings.model.ColumnType;
import teranet.mapdev.listings.model.PersistResult;
import teranet.mapdev.listings.model.PhaseMetrics;
import teranet.mapdev.listings.model.QualityFinding;
import teranet.mapdev.listings.model.QualityReport;
import teranet.mapdev.listings.model.RunSummary;
import teranet.mapdev.listings.model.Table;
import teranet.mapdev.listings.model.TransformStats;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes the "key: value" side files of a run: the dataset metadata and the run summary.
 * These files are written for people and are never read back.
 */
@Service
@Slf4j
public class MetadataFileWriter {

    public static final String SUMMARY_LATEST = "run_summary_latest.txt";

    /**
     * Write metadata_{timestamp}.txt: timestamp, rows, columns, columns_list, data_types.
     */
    public Path writeMetadata(Table table, Path outputDir, String timestamp) throws IOException {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timestamp", timestamp);
        metadata.put("rows", table.rowCount());
        metadata.put("columns", table.columnCount());
        metadata.put("columns_list", table.getColumns());
        metadata.put("data_types", formatTypes(table.schema()));

        Path metadataPath = outputDir.resolve("metadata_" + timestamp + ".txt");
        writeKeyValues(metadataPath, metadata);
        log.info("Metadata saved: {}", metadataPath);
        return metadataPath;
    }

    /**
     * Write run_summary_{timestamp}.txt and refresh run_summary_latest.txt.
     *
     * @return path of the timestamped summary
     */
    public Path writeRunSummary(RunSummary summary, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);

        Map<String, Object> values = new LinkedHashMap<>();
        values.put("run_id", summary.getRunId());
        values.put("timestamp", summary.getRunTimestamp());
        values.put("source", summary.getSource());
        values.put("source_type", summary.getSourceType());
        values.put("source_sha256", summary.getSourceChecksum());
        values.put("started_at", summary.getStartedAt());
        values.put("finished_at", summary.getFinishedAt());
        values.put("duration_ms", summary.getDurationMs());
        values.put("raw_rows", summary.getRawRows());
        values.put("raw_columns", summary.getRawColumns());
        values.put("processed_rows", summary.getProcessedRows());
        values.put("processed_columns", summary.getProcessedColumns());

        TransformStats stats = summary.getTransformStats();
        if (stats != null) {
            values.put("renamed_columns", stats.getRenamedColumns());
            values.put("empty_rows_removed", stats.getEmptyRowsRemoved());
            values.put("duplicate_rows_removed", stats.getDuplicateRowsRemoved());
            values.put("pruned_columns", stats.getPrunedColumns());
            values.put("numeric_coercion_failures", stats.getNumericCoercionFailures());
            values.put("negative_price_rows_removed", stats.getNegativePriceRowsRemoved());
            values.put("out_of_range_price_rows_removed", stats.getOutOfRangePriceRowsRemoved());
            values.put("clipped_values", stats.getClippedValues());
            values.put("missing_categorical_values", stats.getMissingCategoricalValues());
            values.put("unparseable_dates", stats.getUnparseableDates());
            values.put("features_created", stats.getFeaturesCreated());
        }

        if (summary.getPhases() != null) {
            for (PhaseMetrics phase : summary.getPhases()) {
                values.put("phase_" + phase.getPhase() + "_ms", phase.getDurationMs());
                values.put("phase_" + phase.getPhase() + "_shape", String.format("(%d, %d) -> (%d, %d)",
                        phase.getRowsIn(), phase.getColumnsIn(), phase.getRowsOut(), phase.getColumnsOut()));
            }
        }

        QualityReport quality = summary.getQualityReport();
        if (quality != null) {
            values.put("quality_passed", quality.isPassed());
            values.put("quality_skipped", quality.isSkipped());
            values.put("quality_findings", quality.getFindings().stream()
                    .map(this::formatFinding)
                    .collect(Collectors.toList()));
        }

        PersistResult persisted = summary.getPersistResult();
        if (persisted != null) {
            values.put("written_files", persisted.allPaths());
            values.put("failed_formats", persisted.getFailedFormats());
            values.put("skipped_formats", persisted.getSkippedFormats());
            values.put("database_status", persisted.getDatabaseResult().getStatus());
            values.put("database_table", persisted.getDatabaseResult().getTableName());
            values.put("database_rows", persisted.getDatabaseResult().getRowsLoaded());
        }

        Path summaryPath = outputDir.resolve("run_summary_" + summary.getRunTimestamp() + ".txt");
        writeKeyValues(summaryPath, values);
        Files.copy(summaryPath, outputDir.resolve(SUMMARY_LATEST), StandardCopyOption.REPLACE_EXISTING);

        log.info("Run summary saved: {}", summaryPath);
        return summaryPath;
    }

    private String formatTypes(Map<String, ColumnType> schema) {
        return schema.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue().name().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private String formatFinding(QualityFinding finding) {
        return finding.getSeverity() + " " + finding.getCheckType() + " " + finding.getDescription();
    }

    private void writeKeyValues(Path path, Map<String, Object> values) throws IOException {
        StringBuilder content = new StringBuilder();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            content.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        Files.writeString(path, content.toString(), StandardCharsets.UTF_8);
    }
}
