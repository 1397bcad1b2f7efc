package teranet.mapdev.listings.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One result of a quality check run against the enriched table.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QualityFinding {

    public enum Severity {
        WARNING, // Reported, does not affect the pass flag
        FAILURE // Flips the report to failed
    }

    public enum CheckType {
        NULL_IDENTIFIER,
        NEGATIVE_PRICE,
        FUTURE_DATE,
        CHECK_ERROR // A check could not run
    }

    private CheckType checkType;

    private Severity severity;

    private String column;

    private long affectedRows;

    private String description;

    public boolean isFailure() {
        return severity == Severity.FAILURE;
    }
}
