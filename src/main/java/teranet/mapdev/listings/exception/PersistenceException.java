package teranet.mapdev.listings.exception;

/**
 * Writing the table to one output format or to the relational sink failed.
 * The loader catches and logs these; they never abort a run.
 */
public class PersistenceException extends EtlException {

    private final String target;

    public PersistenceException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    /**
     * @return output format name or "database"
     */
    public String getTarget() {
        return target;
    }
}
