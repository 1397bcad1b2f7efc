package teranet.mapdev.listings.exception;

/**
 * Base class for all failures raised by the listings ETL job.
 */
public class EtlException extends RuntimeException {

    public EtlException(String message) {
        super(message);
    }

    public EtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
