package teranet.mapdev.listings.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Telemetry captured at one pipeline phase boundary.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PhaseMetrics {

    private String phase;

    private long durationMs;

    private int rowsIn;

    private int columnsIn;

    private int rowsOut;

    private int columnsOut;
}
