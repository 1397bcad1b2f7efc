package teranet.mapdev.listings.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Typed configuration of the ETL job.
 *
 * Maps to properties under the {@code etl} prefix in application.yml (or any other
 * Spring property source):
 * - etl.paths.*
 * - etl.extraction.*
 * - etl.transformation.*
 * - etl.loading.*
 * - etl.quality-checks.*
 * - etl.logging.*
 *
 * Bound and validated once at startup; an invalid value fails the context.
 */
@Configuration
@ConfigurationProperties(prefix = "etl")
@Validated
@Data
public class EtlProperties {

    // ========================================
    // PATHS (etl.paths.*)
    // ========================================

    @Valid
    private Paths paths = new Paths();

    @Data
    public static class Paths {
        /** Where archive entries are staged before parsing (etl.paths.raw-data) */
        @NotBlank
        private String rawData = "data/raw";

        /** Output directory for processed files (etl.paths.processed-data) */
        @NotBlank
        private String processedData = "data/processed";

        /** Directory of the per-run log file (etl.paths.logs) */
        @NotBlank
        private String logs = "logs";
    }

    // ========================================
    // EXTRACTION (etl.extraction.*)
    // ========================================

    @Valid
    private Extraction extraction = new Extraction();

    @Data
    public static class Extraction {
        /** Charset of the delimited text (etl.extraction.encoding) */
        @NotBlank
        private String encoding = "UTF-8";

        /** Compression of flat files: infer, gzip or none (etl.extraction.compression) */
        @NotBlank
        @Pattern(regexp = "(?i)infer|gzip|none")
        private String compression = "infer";

        /** Cell values read as missing (etl.extraction.na-values) */
        @NotNull
        private List<String> naValues = new ArrayList<>(Arrays.asList(
                "", "NA", "N/A", "n/a", "NaN", "nan", "NULL", "null", "None", "#N/A", "<NA>"));

        /** Copy the selected archive entry to paths.raw-data (etl.extraction.stage-archive-entries) */
        private boolean stageArchiveEntries = true;
    }

    // ========================================
    // TRANSFORMATION (etl.transformation.*)
    // ========================================

    @Valid
    private Transformation transformation = new Transformation();

    @Data
    public static class Transformation {
        /**
         * Columns whose missing fraction is above this value are dropped
         * (etl.transformation.missing-threshold). Required.
         */
        @NotNull
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double missingThreshold;

        @NotNull
        private List<String> numericCols = new ArrayList<>();

        @NotNull
        private List<String> categoricalCols = new ArrayList<>();

        @NotNull
        private List<String> dateCols = new ArrayList<>();

        /** none or iqr (etl.transformation.outlier-method) */
        @NotBlank
        @Pattern(regexp = "(?i)none|iqr")
        private String outlierMethod = "none";

        /** Derived features to add (etl.transformation.create-features) */
        @NotNull
        private List<String> createFeatures = new ArrayList<>();

        @Valid
        private Price price = new Price();

        public boolean isIqrOutlierHandling() {
            return "iqr".equalsIgnoreCase(outlierMethod);
        }

        public boolean isFeatureEnabled(String feature) {
            return createFeatures.contains(feature);
        }
    }

    @Data
    public static class Price {
        /** Column that carries the nightly price (etl.transformation.price.column) */
        @NotBlank
        private String column = "price";

        /** Lowest valid price, inclusive (etl.transformation.price.min) */
        @NotNull
        @DecimalMin("0.0")
        private Double min = 0.0;

        /** Highest valid price, inclusive (etl.transformation.price.max) */
        @NotNull
        private Double max = 10000.0;
    }

    // ========================================
    // LOADING (etl.loading.*)
    // ========================================

    @Valid
    private Loading loading = new Loading();

    @Data
    public static class Loading {
        /** Any of csv, parquet, json, excel (etl.loading.output-formats) */
        @NotNull
        private List<String> outputFormats = new ArrayList<>(List.of("csv", "parquet"));

        /** Prefix of every output file name (etl.loading.base-name) */
        @NotBlank
        private String baseName = "listings_processed";

        @Valid
        private Database database = new Database();
    }

    @Data
    public static class Database {
        /** Mirror the table into a relational database (etl.loading.database.enabled) */
        private boolean enabled = false;

        /** JDBC URL; a bare postgresql:// URL gets the jdbc: prefix added */
        private String connectionString;

        private String username;

        private String password;

        @Min(1)
        private int poolSize = 2;

        /** Rows per INSERT batch when COPY is not available */
        @Min(1)
        private int batchSize = 1000;

        public String getJdbcUrl() {
            if (connectionString == null || connectionString.isBlank()) {
                return connectionString;
            }
            String url = connectionString.trim();
            return url.startsWith("jdbc:") ? url : "jdbc:" + url;
        }
    }

    // ========================================
    // QUALITY CHECKS (etl.quality-checks.*)
    // ========================================

    @Valid
    private QualityChecks qualityChecks = new QualityChecks();

    @Data
    public static class QualityChecks {
        private boolean enabled = true;

        /**
         * advisory: failures are recorded and loading continues.
         * strict: a failure aborts the run before anything is written.
         */
        @NotBlank
        @Pattern(regexp = "(?i)advisory|strict")
        private String mode = "advisory";

        /** Column that must never be null (etl.quality-checks.id-column) */
        @NotBlank
        private String idColumn = "id";

        public boolean isStrict() {
            return "strict".equalsIgnoreCase(mode);
        }
    }

    // ========================================
    // LOGGING (etl.logging.*)
    // ========================================

    @Valid
    private Logging logging = new Logging();

    @Data
    public static class Logging {
        /** Level of the run log file (etl.logging.level) */
        @NotBlank
        @Pattern(regexp = "(?i)TRACE|DEBUG|INFO|WARN|ERROR")
        private String level = "INFO";

        /** Logback pattern of the run log file (etl.logging.format) */
        @NotBlank
        private String format = "%d{yyyy-MM-dd HH:mm:ss} | %-5level | %X{runId} | %logger{36} | %msg%n";

        /** Roll the log file at this size, e.g. "10 MB" (etl.logging.rotation) */
        @NotBlank
        @Pattern(regexp = "(?i)\\s*\\d+\\s*(KB|MB|GB)\\s*")
        private String rotation = "10 MB";

        /** Keep rolled files this long, e.g. "30 days" (etl.logging.retention) */
        @NotBlank
        @Pattern(regexp = "(?i)\\s*\\d+\\s*(day|days|week|weeks|month|months)\\s*")
        private String retention = "30 days";

        /**
         * Rotation size in Logback's FileSize notation ("10MB").
         */
        public String getRotationFileSize() {
            return rotation.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        }

        /**
         * Retention expressed in days, for a daily rolling pattern.
         */
        public int getRetentionDays() {
            String value = retention.trim().toLowerCase(Locale.ROOT);
            int amount = Integer.parseInt(value.replaceAll("[^0-9]", ""));
            if (value.contains("week")) {
                return amount * 7;
            }
            if (value.contains("month")) {
                return amount * 30;
            }
            return amount;
        }
    }
}
