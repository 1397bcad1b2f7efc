package teranet.mapdev.listings.exception;

/**
 * The source path given to the extractor does not exist or is not a regular file.
 */
public class SourceNotFoundException extends EtlException {

    public SourceNotFoundException(String message) {
        super(message);
    }
}
