package teranet.mapdev.listings.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Scalar statistics of one pipeline run, written to a side file at the end of the run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSummary {

    private String runId;

    private String runTimestamp;

    private String source;

    private String sourceType;

    private String sourceChecksum;

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    private long durationMs;

    private int rawRows;

    private int rawColumns;

    private int processedRows;

    private int processedColumns;

    private TransformStats transformStats;

    private List<PhaseMetrics> phases;

    private QualityReport qualityReport;

    private PersistResult persistResult;
}
