package teranet.mapdev.listings.exception;

/**
 * Delimited text content could not be parsed into a table.
 */
public class CsvParseException extends EtlException {

    private final long lineNumber;

    public CsvParseException(String message, long lineNumber) {
        super(lineNumber > 0 ? String.format("Line %d: %s", lineNumber, message) : message);
        this.lineNumber = lineNumber;
    }

    public CsvParseException(String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = -1;
    }

    /**
     * @return 1-based physical line where parsing failed, or -1 if unknown
     */
    public long getLineNumber() {
        return lineNumber;
    }
}
