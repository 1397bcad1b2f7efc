package teranet.mapdev.listings.transformer;

import lombok.AllArgsConstructor;
import lombok.Getter;
import teranet.mapdev.listings.config.EtlProperties;
import teranet.mapdev.listings.model.TransformStats;

import java.time.LocalDateTime;

/**
 * State shared by the stages of one transformation pass.
 */
@Getter
@AllArgsConstructor
public class TransformContext {

    /** Read once from the injected clock at the start of the pass. */
    private final LocalDateTime now;

    private final EtlProperties.Transformation settings;

    private final TransformStats stats;
}
