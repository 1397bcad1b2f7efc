package teranet.mapdev.listings.transformer;

import lombok.extern.slf4j.Slf4j;
import teranet.mapdev.listings.model.Table;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stage C: drop exact duplicate rows, keeping the first occurrence.
 * Two missing values count as equal.
 */
@Slf4j
public class DuplicateRowTransformer implements TableTransformer {

    @Override
    public String getName() {
        return "drop-duplicate-rows";
    }

    @Override
    public Table transform(Table table, TransformContext context) {
        Set<Map<String, Object>> seen = new HashSet<>();
        List<Map<String, Object>> kept = new ArrayList<>(table.rowCount());
        for (Map<String, Object> row : table.getRows()) {
            if (seen.add(row)) {
                kept.add(row);
            }
        }

        int removed = table.rowCount() - kept.size();
        context.getStats().setDuplicateRowsRemoved(context.getStats().getDuplicateRowsRemoved() + removed);
        if (removed == 0) {
            return table;
        }
        log.info("Removed {} duplicate row(s)", removed);
        return table.withRows(kept);
    }
}
