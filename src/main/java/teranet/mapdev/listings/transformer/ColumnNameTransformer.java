package teranet.mapdev.listings.transformer;

import lombok.extern.slf4j.Slf4j;
import teranet.mapdev.listings.model.Table;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Stage A: normalize column names.
 *
 * Trim, lower-case, spaces and hyphens to underscores:
 *   "Minimum Nights" → "minimum_nights"
 *   " Host-ID " → "host_id"
 *
 * When two columns normalize to the same name, the later ones get _2, _3, ...
 * suffixes in column order. No column is dropped.
 */
@Slf4j
public class ColumnNameTransformer implements TableTransformer {

    @Override
    public String getName() {
        return "normalize-column-names";
    }

    public static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("[ \\-]", "_");
    }

    @Override
    public Table transform(Table table, TransformContext context) {
        List<String> newColumns = new ArrayList<>(table.columnCount());
        Map<String, String> mapping = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();

        for (String column : table.getColumns()) {
            String base = normalize(column);
            String name = base;
            for (int suffix = 2; used.contains(name); suffix++) {
                name = base + "_" + suffix;
            }
            if (!name.equals(base)) {
                log.warn("Column '{}' normalizes to existing name '{}', renamed to '{}'", column, base, name);
            }
            used.add(name);
            newColumns.add(name);
            mapping.put(column, name);
            if (!column.equals(name)) {
                context.getStats().getRenamedColumns().put(column, name);
            }
        }

        if (newColumns.equals(table.getColumns())) {
            return table;
        }

        List<Map<String, Object>> rows = new ArrayList<>(table.rowCount());
        for (Map<String, Object> row : table.getRows()) {
            Map<String, Object> renamed = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : mapping.entrySet()) {
                renamed.put(entry.getValue(), row.get(entry.getKey()));
            }
            rows.add(renamed);
        }
        log.debug("Renamed {} column(s)", context.getStats().getRenamedColumns().size());
        return new Table(newColumns, rows);
    }
}
