package teranet.mapdev.listings.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of the quality gate: a pass flag plus the findings behind it.
 * Only FAILURE findings affect the pass flag.
 */
public class QualityReport {

    private final boolean skipped;
    private final LocalDateTime checkedAt;
    private final List<QualityFinding> findings;

    private QualityReport(boolean skipped, LocalDateTime checkedAt, List<QualityFinding> findings) {
        this.skipped = skipped;
        this.checkedAt = checkedAt;
        this.findings = findings != null ? List.copyOf(findings) : Collections.emptyList();
    }

    public static QualityReport of(LocalDateTime checkedAt, List<QualityFinding> findings) {
        return new QualityReport(false, checkedAt, findings);
    }

    /**
     * Report for a run with quality checks disabled. Always passes.
     */
    public static QualityReport skipped(LocalDateTime checkedAt) {
        return new QualityReport(true, checkedAt, null);
    }

    public boolean isPassed() {
        return findings.stream().noneMatch(QualityFinding::isFailure);
    }

    public boolean isSkipped() {
        return skipped;
    }

    public LocalDateTime getCheckedAt() {
        return checkedAt;
    }

    public List<QualityFinding> getFindings() {
        return findings;
    }

    public List<QualityFinding> getFailures() {
        return findings.stream().filter(QualityFinding::isFailure).collect(Collectors.toList());
    }

    public List<QualityFinding> getWarnings() {
        return findings.stream().filter(f -> !f.isFailure()).collect(Collectors.toList());
    }

    public boolean hasFinding(QualityFinding.CheckType checkType) {
        return findings.stream().anyMatch(f -> f.getCheckType() == checkType);
    }
}
