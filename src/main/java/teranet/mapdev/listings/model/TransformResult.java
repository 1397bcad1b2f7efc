package teranet.mapdev.listings.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Enriched table together with the counters collected while producing it.
 */
@Getter
@AllArgsConstructor
public class TransformResult {

    private final Table table;

    private final TransformStats stats;
}
