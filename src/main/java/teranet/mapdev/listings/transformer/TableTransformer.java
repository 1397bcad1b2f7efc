package teranet.mapdev.listings.transformer;

import teranet.mapdev.listings.model.Table;

/**
 * One cleaning or enrichment stage of the listings transformation.
 *
 * Stages are chained by {@link teranet.mapdev.listings.service.TransformerChainFactory}
 * in a fixed order. A stage must not modify the table it receives; it returns a new
 * table (or the same instance when nothing changes) and records what it did in the
 * context's stats.
 */
public interface TableTransformer {

    /**
     * Short stage name used in log messages.
     */
    String getName();

    /**
     * Apply this stage.
     *
     * @param table   output of the previous stage
     * @param context clock reading, configuration and stats of the current pass
     * @return the transformed table
     */
    Table transform(Table table, TransformContext context);

    /**
     * Check if this stage has any work to do on the given table.
     *
     * This is an optimization: when false the stage is skipped entirely.
     *
     * @return true if transform() may change the table
     */
    default boolean requiresTransformation(Table table) {
        return true;
    }
}
