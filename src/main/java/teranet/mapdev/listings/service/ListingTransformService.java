package teranet.mapdev.listings.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.listings.config.EtlProperties;
import teranet.mapdev.listings.model.Table;
import teranet.mapdev.listings.model.TransformResult;
import teranet.mapdev.listings.model.TransformStats;
import teranet.mapdev.listings.transformer.TableTransformer;
import teranet.mapdev.listings.transformer.TransformContext;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Cleans and enriches the raw listings table.
 *
 * Pure with respect to its input: the raw table is never modified and the same
 * input, configuration and clock always give the same output.
 */
@Service
@Slf4j
public class ListingTransformService {

    private final TransformerChainFactory chainFactory;
    private final EtlProperties properties;
    private final Clock clock;

    public ListingTransformService(TransformerChainFactory chainFactory, EtlProperties properties, Clock clock) {
        this.chainFactory = chainFactory;
        this.properties = properties;
        this.clock = clock;
    }

    public Table transform(Table table) {
        return transformWithStats(table).getTable();
    }

    /**
     * Run every stage and collect the per-stage counters.
     */
    public TransformResult transformWithStats(Table table) {
        log.info("Starting data transformation on {}", table.shape());

        TransformStats stats = new TransformStats();
        stats.setInputRows(table.rowCount());
        stats.setInputColumns(table.columnCount());

        TransformContext context = new TransformContext(
                LocalDateTime.now(clock), properties.getTransformation(), stats);

        Table current = table;
        for (TableTransformer stage : chainFactory.getChain()) {
            if (!stage.requiresTransformation(current)) {
                log.debug("Skipping stage {}", stage.getName());
                continue;
            }
            current = stage.transform(current, context);
            log.debug("After {}: {}", stage.getName(), current.shape());
        }

        stats.setOutputRows(current.rowCount());
        stats.setOutputColumns(current.columnCount());

        log.info("Transformation completed - Rows: {}, Columns: {} ({} row(s) removed)",
                current.rowCount(), current.columnCount(), stats.getRowsRemoved());
        return new TransformResult(current, stats);
    }
}
