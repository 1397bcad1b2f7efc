package teranet.mapdev.listings.transformer;

import lombok.extern.slf4j.Slf4j;
import teranet.mapdev.listings.model.Table;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Stage G: parse the configured date columns to timestamps. Unparseable values
 * become missing.
 */
@Slf4j
public class DateColumnTransformer implements TableTransformer {

    @Override
    public String getName() {
        return "parse-date-columns";
    }

    @Override
    public Table transform(Table table, TransformContext context) {
        List<Map<String, Object>> rows = table.mutableRows();

        for (String column : context.getSettings().getDateCols()) {
            if (!table.hasColumn(column)) {
                log.debug("Date column {} not present, skipping", column);
                continue;
            }
            int failures = 0;
            for (Map<String, Object> row : rows) {
                Object value = row.get(column);
                LocalDateTime parsed = TransformerUtils.toDateTime(value);
                if (value != null && parsed == null) {
                    failures++;
                }
                row.put(column, parsed);
            }
            if (failures > 0) {
                context.getStats().getUnparseableDates().merge(column, failures, Integer::sum);
                log.warn("Column {}: {} value(s) could not be parsed as dates and were set to missing", column, failures);
            } else {
                log.debug("Converted date column: {}", column);
            }
        }

        return table.withRows(rows);
    }
}
