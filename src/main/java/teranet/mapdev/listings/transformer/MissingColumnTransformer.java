package teranet.mapdev.listings.transformer;

import lombok.extern.slf4j.Slf4j;
import teranet.mapdev.listings.model.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stage D: drop columns whose fraction of missing values is strictly above the
 * configured threshold. A table without rows keeps all of its columns.
 */
@Slf4j
public class MissingColumnTransformer implements TableTransformer {

    @Override
    public String getName() {
        return "drop-sparse-columns";
    }

    @Override
    public boolean requiresTransformation(Table table) {
        return table.rowCount() > 0;
    }

    @Override
    public Table transform(Table table, TransformContext context) {
        double threshold = context.getSettings().getMissingThreshold();

        List<String> kept = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        for (String column : table.getColumns()) {
            long missing = table.columnValues(column).stream().filter(Objects::isNull).count();
            double fraction = (double) missing / table.rowCount();
            if (fraction > threshold) {
                dropped.add(column);
                log.debug("Column {} is {}% missing", column, Math.round(fraction * 100));
            } else {
                kept.add(column);
            }
        }

        if (dropped.isEmpty()) {
            return table;
        }
        context.getStats().getPrunedColumns().addAll(dropped);
        log.info("Dropped {} column(s) above missing threshold {}: {}", dropped.size(), threshold, dropped);
        return new Table(kept, table.getRows());
    }
}
