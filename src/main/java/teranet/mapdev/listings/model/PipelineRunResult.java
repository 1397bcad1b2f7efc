package teranet.mapdev.listings.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Enriched table of a run together with its summary.
 */
@Getter
@AllArgsConstructor
public class PipelineRunResult {

    private final Table table;

    private final RunSummary summary;
}
