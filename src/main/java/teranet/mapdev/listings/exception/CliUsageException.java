package teranet.mapdev.listings.exception;

/**
 * The command line is missing a required option or carries an invalid value.
 */
public class CliUsageException extends EtlException {

    public CliUsageException(String message) {
        super(message);
    }
}
