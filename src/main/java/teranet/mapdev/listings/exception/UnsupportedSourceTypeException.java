package teranet.mapdev.listings.exception;

/**
 * The source type is unknown, or could not be inferred from the file extension.
 */
public class UnsupportedSourceTypeException extends EtlException {

    public UnsupportedSourceTypeException(String message) {
        super(message);
    }
}
