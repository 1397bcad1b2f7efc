package teranet.mapdev.listings.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of mirroring the table into the relational sink.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseLoadResult {

    public enum Status {
        DISABLED, LOADED, FAILED
    }

    private Status status;

    private String tableName;

    private long rowsLoaded;

    private String errorMessage;

    public static DatabaseLoadResult disabled() {
        return new DatabaseLoadResult(Status.DISABLED, null, 0, null);
    }

    public static DatabaseLoadResult loaded(String tableName, long rowsLoaded) {
        return new DatabaseLoadResult(Status.LOADED, tableName, rowsLoaded, null);
    }

    public static DatabaseLoadResult failed(String tableName, String errorMessage) {
        return new DatabaseLoadResult(Status.FAILED, tableName, 0, errorMessage);
    }
}
