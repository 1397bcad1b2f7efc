package teranet.mapdev.listings.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.listings.config.EtlProperties;
import teranet.mapdev.listings.model.ColumnType;
import teranet.mapdev.listings.model.QualityFinding;
import teranet.mapdev.listings.model.QualityFinding.CheckType;
import teranet.mapdev.listings.model.QualityFinding.Severity;
import teranet.mapdev.listings.model.QualityReport;
import teranet.mapdev.listings.model.Table;
import teranet.mapdev.listings.transformer.TransformerUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the quality checks on the enriched table.
 *
 * Checks:
 * - identity: the id column has no missing values (FAILURE)
 * - range: no negative price (FAILURE)
 * - temporal: no timestamp column holds dates after now (WARNING)
 *
 * The gate only reports. It never modifies the table and never throws: a check that
 * fails unexpectedly is logged and recorded as a CHECK_ERROR failure. Whether a failed
 * report stops the run is decided by the caller (quality-checks.mode).
 */
@Service
@Slf4j
public class QualityGateService {

    private final EtlProperties properties;
    private final Clock clock;

    public QualityGateService(EtlProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public QualityReport check(Table table) {
        LocalDateTime now = LocalDateTime.now(clock);

        if (!properties.getQualityChecks().isEnabled()) {
            log.info("Quality checks disabled");
            return QualityReport.skipped(now);
        }

        log.info("Running quality checks on {}", table.shape());
        List<QualityFinding> findings = new ArrayList<>();

        runCheck("identity", findings, () -> checkIdentity(table, findings));
        runCheck("price-range", findings, () -> checkPriceRange(table, findings));
        runCheck("temporal", findings, () -> checkFutureDates(table, now, findings));

        QualityReport report = QualityReport.of(now, findings);
        for (QualityFinding finding : findings) {
            if (finding.isFailure()) {
                log.error("Quality check failed: {}", finding.getDescription());
            } else {
                log.warn("Quality warning: {}", finding.getDescription());
            }
        }
        log.info("Quality checks {}: {} failure(s), {} warning(s)",
                report.isPassed() ? "passed" : "failed",
                report.getFailures().size(), report.getWarnings().size());
        return report;
    }

    private void runCheck(String name, List<QualityFinding> findings, Runnable check) {
        try {
            check.run();
        } catch (RuntimeException e) {
            log.error("Quality check {} could not run", name, e);
            findings.add(new QualityFinding(CheckType.CHECK_ERROR, Severity.FAILURE, null, 0,
                    "Check " + name + " could not run: " + e.getMessage()));
        }
    }

    private void checkIdentity(Table table, List<QualityFinding> findings) {
        String idColumn = properties.getQualityChecks().getIdColumn();
        if (!table.hasColumn(idColumn)) {
            log.debug("Identity check skipped, column {} not present", idColumn);
            return;
        }
        long missing = table.columnValues(idColumn).stream().filter(Objects::isNull).count();
        if (missing > 0) {
            findings.add(new QualityFinding(CheckType.NULL_IDENTIFIER, Severity.FAILURE, idColumn, missing,
                    String.format("Column %s has %d missing value(s)", idColumn, missing)));
        }
    }

    private void checkPriceRange(Table table, List<QualityFinding> findings) {
        String priceColumn = properties.getTransformation().getPrice().getColumn();
        if (!table.hasColumn(priceColumn)) {
            log.debug("Price check skipped, column {} not present", priceColumn);
            return;
        }
        long negative = table.columnValues(priceColumn).stream()
                .map(TransformerUtils::toDouble)
                .filter(value -> value != null && value < 0)
                .count();
        if (negative > 0) {
            findings.add(new QualityFinding(CheckType.NEGATIVE_PRICE, Severity.FAILURE, priceColumn, negative,
                    String.format("Column %s has %d negative value(s)", priceColumn, negative)));
        }
    }

    private void checkFutureDates(Table table, LocalDateTime now, List<QualityFinding> findings) {
        for (String column : table.getColumns()) {
            if (table.columnType(column) != ColumnType.DATETIME) {
                continue;
            }
            long future = table.columnValues(column).stream()
                    .filter(value -> value instanceof LocalDateTime && ((LocalDateTime) value).isAfter(now))
                    .count();
            if (future > 0) {
                findings.add(new QualityFinding(CheckType.FUTURE_DATE, Severity.WARNING, column, future,
                        String.format("Column %s has %d date(s) in the future", column, future)));
            }
        }
    }
}
