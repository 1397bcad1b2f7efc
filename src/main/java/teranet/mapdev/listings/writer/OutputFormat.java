package teranet.mapdev.listings.writer;

import java.util.Locale;

/**
 * File formats the loader can write.
 */
public enum OutputFormat {
    CSV("csv"),
    PARQUET("parquet"),
    JSON("json"),
    EXCEL("xlsx");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Look up a format by its configured name. "excel" and "xlsx" both mean EXCEL.
     *
     * @return the format, or null if the name is unknown
     */
    public static OutputFormat fromName(String name) {
        if (name == null) {
            return null;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "csv":
                return CSV;
            case "parquet":
                return PARQUET;
            case "json":
                return JSON;
            case "excel":
            case "xlsx":
                return EXCEL;
            default:
                return null;
        }
    }
}
