package teranet.mapdev.listings.transformer;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Value parsing helpers shared by the cleaning stages.
 */
public final class TransformerUtils {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"));

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"));

    private TransformerUtils() {
    }

    /**
     * Coerce a cell to a number.
     *
     * Numbers pass through unchanged. Text has currency symbols ($, €, £), thousands
     * separators and surrounding whitespace stripped before parsing.
     *
     * @return Long for integral text, Double otherwise, or null if the value is missing
     *         or cannot be read as a number
     */
    public static Number toNumber(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long || value instanceof Double) {
            return (Number) value;
        }
        if (value instanceof Number) {
            Number number = (Number) value;
            return value instanceof Integer || value instanceof Short || value instanceof Byte
                    ? (Number) number.longValue() : (Number) number.doubleValue();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1L : 0L;
        }

        String text = value.toString().trim()
                .replace("$", "")
                .replace("€", "")
                .replace("£", "")
                .replace(",", "")
                .trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            // not integral, try decimal
        }
        try {
            double parsed = Double.parseDouble(text);
            if (Double.isNaN(parsed) || Double.isInfinite(parsed)
                    || text.endsWith("d") || text.endsWith("D") || text.endsWith("f") || text.endsWith("F")) {
                return null;
            }
            return parsed;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Double toDouble(Object value) {
        Number number = toNumber(value);
        return number == null ? null : number.doubleValue();
    }

    /**
     * Parse a cell as a timestamp. Accepts ISO date-time, ISO date, yyyy-MM-dd HH:mm:ss,
     * yyyy/MM/dd and MM/dd/yyyy. Dates get midnight.
     *
     * @return the timestamp, or null if the value is missing or matches no format
     */
    public static LocalDateTime toDateTime(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(text, format);
            } catch (DateTimeParseException e) {
                // try next format
            }
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format).atStartOfDay();
            } catch (DateTimeParseException e) {
                // try next format
            }
        }
        return null;
    }

    /**
     * Quantile with linear interpolation between the two nearest ranks.
     *
     * @param values non-null values, any order
     * @param q      quantile in [0, 1]
     * @return the quantile, or null for an empty list
     */
    public static Double quantile(List<Double> values, double q) {
        if (values.isEmpty()) {
            return null;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);

        double position = q * (sorted.size() - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted.get(lower) + fraction * (sorted.get(upper) - sorted.get(lower));
    }

    /**
     * Make a numeric column homogeneous: if any value is a Double, every Long becomes a Double.
     */
    public static void widenNumericColumn(List<Map<String, Object>> rows, String column) {
        boolean hasDouble = rows.stream().anyMatch(row -> row.get(column) instanceof Double);
        if (!hasDouble) {
            return;
        }
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            if (value instanceof Long) {
                row.put(column, ((Long) value).doubleValue());
            }
        }
    }
}
