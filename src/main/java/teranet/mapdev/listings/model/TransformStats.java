package teranet.mapdev.listings.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counters collected while a table moves through the transformation stages.
 * Feeds the run summary; never drives control flow.
 */
@Data
public class TransformStats {

    private int inputRows;
    private int inputColumns;

    private Map<String, String> renamedColumns = new LinkedHashMap<>();
    private int emptyRowsRemoved;
    private int duplicateRowsRemoved;
    private List<String> prunedColumns = new ArrayList<>();

    private Map<String, Integer> numericCoercionFailures = new LinkedHashMap<>();
    private int negativePriceRowsRemoved;
    private int outOfRangePriceRowsRemoved;
    private Map<String, Integer> clippedValues = new LinkedHashMap<>();

    private Map<String, Integer> missingCategoricalValues = new LinkedHashMap<>();
    private Map<String, Integer> unparseableDates = new LinkedHashMap<>();

    private List<String> featuresCreated = new ArrayList<>();

    private int outputRows;
    private int outputColumns;

    public int getRowsRemoved() {
        return inputRows - outputRows;
    }
}
