package teranet.mapdev.listings.transformer;

import lombok.extern.slf4j.Slf4j;
import teranet.mapdev.listings.model.Table;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stage F: categorical columns become trimmed text; "", "nan", "NaN" and "None"
 * become missing.
 */
@Slf4j
public class CategoricalColumnTransformer implements TableTransformer {

    private static final Set<String> MISSING_MARKERS = Set.of("", "nan", "NaN", "None");

    @Override
    public String getName() {
        return "clean-categorical-columns";
    }

    @Override
    public Table transform(Table table, TransformContext context) {
        List<Map<String, Object>> rows = table.mutableRows();

        for (String column : context.getSettings().getCategoricalCols()) {
            if (!table.hasColumn(column)) {
                log.debug("Categorical column {} not present, skipping", column);
                continue;
            }
            int markers = 0;
            for (Map<String, Object> row : rows) {
                Object value = row.get(column);
                if (value == null) {
                    continue;
                }
                String text = value.toString().trim();
                if (MISSING_MARKERS.contains(text)) {
                    row.put(column, null);
                    markers++;
                } else {
                    row.put(column, text);
                }
            }
            if (markers > 0) {
                context.getStats().getMissingCategoricalValues().merge(column, markers, Integer::sum);
                log.debug("Column {}: {} placeholder value(s) set to missing", column, markers);
            }
        }

        return table.withRows(rows);
    }
}
