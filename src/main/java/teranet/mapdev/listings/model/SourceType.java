package teranet.mapdev.listings.model;

import teranet.mapdev.listings.exception.UnsupportedSourceTypeException;

import java.util.Locale;

/**
 * Kind of container the raw data set is read from.
 */
public enum SourceType {
    /** Compressed archive holding one or more delimited text files. */
    ARCHIVE,
    /** A delimited text file, optionally gzip-compressed. */
    FLAT,
    /** Decide from the file extension. */
    AUTO;

    /**
     * Parses a CLI/config value. Accepts {@code archive}, {@code flat}, {@code auto}
     * and the aliases {@code zip} and {@code csv}. Null or blank means AUTO.
     *
     * @throws UnsupportedSourceTypeException for any other value
     */
    public static SourceType fromName(String name) {
        if (name == null || name.isBlank()) {
            return AUTO;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "archive":
            case "zip":
                return ARCHIVE;
            case "flat":
            case "csv":
                return FLAT;
            case "auto":
                return AUTO;
            default:
                throw new UnsupportedSourceTypeException("Unsupported source type: " + name);
        }
    }
}
