package teranet.mapdev.listings.transformer;

import lombok.extern.slf4j.Slf4j;
import teranet.mapdev.listings.config.EtlProperties;
import teranet.mapdev.listings.model.Table;
import teranet.mapdev.listings.model.TransformStats;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stage E: numeric cleaning of the configured numeric columns.
 *
 * For each configured column present, in configuration order:
 * 1. Coerce to a number; values that cannot be read become missing.
 * 2. Price column only: drop rows with a negative price, then rows outside
 *    [price.min, price.max] or without a price.
 * 3. With outlier-method iqr: clamp to [Q1 - 1.5*IQR, Q3 + 1.5*IQR] of the rows left.
 *
 * The range filter always runs before the clip, so the clip bounds are computed on
 * in-range prices only.
 */
@Slf4j
public class NumericColumnTransformer implements TableTransformer {

    private static final double IQR_FACTOR = 1.5;

    @Override
    public String getName() {
        return "clean-numeric-columns";
    }

    @Override
    public boolean requiresTransformation(Table table) {
        return table.rowCount() > 0;
    }

    @Override
    public Table transform(Table table, TransformContext context) {
        EtlProperties.Transformation settings = context.getSettings();
        TransformStats stats = context.getStats();
        List<Map<String, Object>> rows = table.mutableRows();

        for (String column : settings.getNumericCols()) {
            if (!table.hasColumn(column)) {
                log.debug("Numeric column {} not present, skipping", column);
                continue;
            }

            coerce(rows, column, stats);

            if (column.equals(settings.getPrice().getColumn())) {
                filterPrice(rows, column, settings.getPrice(), stats);
            }

            if (settings.isIqrOutlierHandling()) {
                clipOutliers(rows, column, stats);
            }

            TransformerUtils.widenNumericColumn(rows, column);
        }

        return table.withRows(rows);
    }

    private void coerce(List<Map<String, Object>> rows, String column, TransformStats stats) {
        int failures = 0;
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            Number number = TransformerUtils.toNumber(value);
            if (value != null && number == null) {
                failures++;
            }
            row.put(column, number);
        }
        if (failures > 0) {
            stats.getNumericCoercionFailures().merge(column, failures, Integer::sum);
            log.warn("Column {}: {} value(s) could not be read as numbers and were set to missing", column, failures);
        }
    }

    private void filterPrice(List<Map<String, Object>> rows, String column,
                             EtlProperties.Price price, TransformStats stats) {
        int negative = 0;
        Iterator<Map<String, Object>> iterator = rows.iterator();
        while (iterator.hasNext()) {
            Double value = TransformerUtils.toDouble(iterator.next().get(column));
            if (value != null && value < 0) {
                iterator.remove();
                negative++;
            }
        }

        int outOfRange = 0;
        iterator = rows.iterator();
        while (iterator.hasNext()) {
            Double value = TransformerUtils.toDouble(iterator.next().get(column));
            if (value == null || value < price.getMin() || value > price.getMax()) {
                iterator.remove();
                outOfRange++;
            }
        }

        stats.setNegativePriceRowsRemoved(stats.getNegativePriceRowsRemoved() + negative);
        stats.setOutOfRangePriceRowsRemoved(stats.getOutOfRangePriceRowsRemoved() + outOfRange);
        if (negative > 0 || outOfRange > 0) {
            log.info("Column {}: removed {} negative and {} missing or out-of-range [{}, {}] row(s)",
                    column, negative, outOfRange, price.getMin(), price.getMax());
        }
    }

    private void clipOutliers(List<Map<String, Object>> rows, String column, TransformStats stats) {
        List<Double> values = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            Double value = TransformerUtils.toDouble(row.get(column));
            if (value != null) {
                values.add(value);
            }
        }
        if (values.isEmpty()) {
            return;
        }

        double q1 = Objects.requireNonNull(TransformerUtils.quantile(values, 0.25));
        double q3 = Objects.requireNonNull(TransformerUtils.quantile(values, 0.75));
        double iqr = q3 - q1;
        double lower = q1 - IQR_FACTOR * iqr;
        double upper = q3 + IQR_FACTOR * iqr;

        int clipped = 0;
        for (Map<String, Object> row : rows) {
            Double value = TransformerUtils.toDouble(row.get(column));
            if (value == null) {
                continue;
            }
            if (value < lower) {
                row.put(column, lower);
                clipped++;
            } else if (value > upper) {
                row.put(column, upper);
                clipped++;
            }
        }

        if (clipped > 0) {
            stats.getClippedValues().merge(column, clipped, Integer::sum);
            log.info("Column {}: clipped {} value(s) to [{}, {}]", column, clipped, lower, upper);
        }
    }
}
