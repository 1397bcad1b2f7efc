package teranet.mapdev.listings.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Service responsible for identifiers derived from table and column names.
 *
 * Features:
 * - Sink table name from the configured base name
 * - SQL and Avro safe identifiers for column names
 * - PostgreSQL 63-character identifier limit
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class TableNamingService {

    private static final Logger logger = LoggerFactory.getLogger(TableNamingService.class);

    // PostgreSQL identifier limit
    private static final int POSTGRESQL_MAX_IDENTIFIER_LENGTH = 63;

    /**
     * Name of the relational sink table for a base name.
     *
     * Examples:
     * - listings_processed → listings_processed_table
     * - NYC Airbnb → nyc_airbnb_table
     *
     * @param baseName the configured output base name
     * @return safe table name
     */
    public String generateTableName(String baseName) {
        if (baseName == null) {
            logger.error("Base name is null - cannot generate table name");
            throw new IllegalArgumentException("Base name cannot be null");
        }

        String sanitizedName = sanitizeIdentifier(baseName);
        if (sanitizedName.isEmpty()) {
            sanitizedName = "listings";
            logger.warn("Sanitized name was empty, using default: {}", sanitizedName);
        }

        String tableName = truncate(sanitizedName + "_table");
        logger.debug("Generated table name: {}", tableName);
        return tableName;
    }

    /**
     * Sanitize a name to a lower-case identifier safe for SQL and Avro.
     *
     * Transformation steps:
     * 1. Convert to lowercase
     * 2. Replace all non-alphanumeric characters (except underscore) with underscore
     * 3. Replace multiple consecutive underscores with single underscore
     * 4. Remove leading/trailing underscores
     * 5. Prepend "col_" if name starts with a number
     *
     * Examples:
     *   "Customer Name" → "customer_name"
     *   "Unnamed: 3" → "unnamed_3"
     *   "365_days" → "col_365_days"
     *
     * @param name the raw name
     * @return sanitized identifier, possibly empty
     */
    public String sanitizeIdentifier(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }

        String sanitized = name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9_]", "_")
                .replaceAll("_{2,}", "_")
                .replaceAll("^_|_$", "");

        // Ensure it doesn't start with a number (SQL and Avro requirement)
        if (sanitized.matches("^\\d.*")) {
            sanitized = "col_" + sanitized;
        }

        return sanitized;
    }

    /**
     * Safe, unique identifiers for a list of column names, in the same order.
     * Names that sanitize to an empty or already used identifier get a positional
     * or numeric suffix.
     */
    public List<String> toColumnIdentifiers(List<String> columns) {
        List<String> identifiers = new ArrayList<>(columns.size());
        Set<String> used = new HashSet<>();
        for (int i = 0; i < columns.size(); i++) {
            String base = truncate(sanitizeIdentifier(columns.get(i)));
            if (base.isEmpty()) {
                base = "col_" + (i + 1);
            }
            String identifier = base;
            for (int suffix = 2; used.contains(identifier); suffix++) {
                identifier = truncate(base) + "_" + suffix;
            }
            if (!identifier.equals(columns.get(i))) {
                logger.debug("Column {} mapped to identifier {}", columns.get(i), identifier);
            }
            used.add(identifier);
            identifiers.add(identifier);
        }
        return identifiers;
    }

    private String truncate(String name) {
        if (name.length() > POSTGRESQL_MAX_IDENTIFIER_LENGTH) {
            String truncated = name.substring(0, POSTGRESQL_MAX_IDENTIFIER_LENGTH);
            logger.debug("Truncated identifier from {} to {} characters: {} → {}",
                    name.length(), POSTGRESQL_MAX_IDENTIFIER_LENGTH, name, truncated);
            return truncated;
        }
        return name;
    }
}
