package teranet.mapdev.listings.transformer;

import lombok.extern.slf4j.Slf4j;
import teranet.mapdev.listings.model.Table;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Stage B: drop rows in which every field is missing.
 */
@Slf4j
public class EmptyRowTransformer implements TableTransformer {

    @Override
    public String getName() {
        return "drop-empty-rows";
    }

    @Override
    public Table transform(Table table, TransformContext context) {
        List<Map<String, Object>> kept = table.getRows().stream()
                .filter(row -> row.values().stream().anyMatch(Objects::nonNull))
                .collect(Collectors.toList());

        int removed = table.rowCount() - kept.size();
        context.getStats().setEmptyRowsRemoved(context.getStats().getEmptyRowsRemoved() + removed);
        if (removed == 0) {
            return table;
        }
        log.info("Removed {} empty row(s)", removed);
        return table.withRows(kept);
    }
}
