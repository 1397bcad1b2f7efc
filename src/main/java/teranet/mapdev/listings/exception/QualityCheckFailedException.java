package teranet.mapdev.listings.exception;

import teranet.mapdev.listings.model.QualityReport;

/**
 * Raised only in strict quality mode, when the quality gate reports a failure
 * before anything is persisted.
 */
public class QualityCheckFailedException extends EtlException {

    private final transient QualityReport report;

    public QualityCheckFailedException(QualityReport report) {
        super("Quality checks failed: " + report.getFailures().size() + " failing check(s)");
        this.report = report;
    }

    public QualityReport getReport() {
        return report;
    }
}
