package teranet.mapdev.listings.exception;

/**
 * An archive source holds no CSV entry.
 */
public class NoTabularDataFoundException extends EtlException {

    public NoTabularDataFoundException(String message) {
        super(message);
    }
}
