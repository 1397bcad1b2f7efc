package teranet.mapdev.listings.transformer;

import lombok.extern.slf4j.Slf4j;
import teranet.mapdev.listings.config.EtlProperties;
import teranet.mapdev.listings.model.Table;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static teranet.mapdev.listings.model.ListingColumns.*;

/**
 * Stage H: derived features, each enabled by name in create-features and only
 * computed when its input columns exist.
 *
 * - price_per_night: price / max(minimum_nights, 1)
 * - has_availability, is_available: availability_365 > 0
 * - review_recency, days_since_last_review: whole days since last_review, -1 if never reviewed
 * - is_superhost: number_of_reviews > 50 and calculated_host_listings_count <= 3
 *
 * Existing feature columns are recomputed in place.
 */
@Slf4j
public class FeatureTransformer implements TableTransformer {

    @Override
    public String getName() {
        return "create-features";
    }

    @Override
    public Table transform(Table table, TransformContext context) {
        EtlProperties.Transformation settings = context.getSettings();
        String priceColumn = settings.getPrice().getColumn();

        List<String> columns = new ArrayList<>(table.getColumns());
        List<Map<String, Object>> rows = table.mutableRows();
        List<String> created = context.getStats().getFeaturesCreated();

        if (settings.isFeatureEnabled(PRICE_PER_NIGHT)
                && table.hasColumn(priceColumn) && table.hasColumn(MINIMUM_NIGHTS)) {
            addColumn(columns, rows, created, PRICE_PER_NIGHT,
                    row -> pricePerNight(row.get(priceColumn), row.get(MINIMUM_NIGHTS)));
        }

        if (table.hasColumn(AVAILABILITY_365)) {
            for (String feature : List.of(HAS_AVAILABILITY, IS_AVAILABLE)) {
                if (settings.isFeatureEnabled(feature)) {
                    addColumn(columns, rows, created, feature, row -> isAvailable(row.get(AVAILABILITY_365)));
                }
            }
        }

        if (table.hasColumn(LAST_REVIEW)) {
            LocalDateTime now = context.getNow();
            for (String feature : List.of(REVIEW_RECENCY, DAYS_SINCE_LAST_REVIEW)) {
                if (settings.isFeatureEnabled(feature)) {
                    addColumn(columns, rows, created, feature, row -> daysSince(row.get(LAST_REVIEW), now));
                }
            }
        }

        if (settings.isFeatureEnabled(IS_SUPERHOST)
                && table.hasColumn(NUMBER_OF_REVIEWS) && table.hasColumn(CALCULATED_HOST_LISTINGS_COUNT)) {
            addColumn(columns, rows, created, IS_SUPERHOST,
                    row -> isSuperhost(row.get(NUMBER_OF_REVIEWS), row.get(CALCULATED_HOST_LISTINGS_COUNT)));
        }

        if (columns.size() == table.columnCount() && created.isEmpty()) {
            return table;
        }
        log.info("Feature engineering complete, features: {}", created);
        return new Table(columns, rows);
    }

    private void addColumn(List<String> columns, List<Map<String, Object>> rows, List<String> created,
                           String feature, Function<Map<String, Object>, Object> compute) {
        for (Map<String, Object> row : rows) {
            row.put(feature, compute.apply(row));
        }
        if (!columns.contains(feature)) {
            columns.add(feature);
        }
        if (!created.contains(feature)) {
            created.add(feature);
        }
    }

    static Double pricePerNight(Object price, Object minimumNights) {
        Double p = TransformerUtils.toDouble(price);
        Double nights = TransformerUtils.toDouble(minimumNights);
        if (p == null || nights == null) {
            return null;
        }
        return p / Math.max(nights, 1.0);
    }

    static Boolean isAvailable(Object availability) {
        Double days = TransformerUtils.toDouble(availability);
        return days != null && days > 0;
    }

    /**
     * Whole days from the review to now; -1 when there is no review, 0 for a review dated after now.
     */
    static Long daysSince(Object lastReview, LocalDateTime now) {
        LocalDateTime reviewed = TransformerUtils.toDateTime(lastReview);
        if (reviewed == null) {
            return NO_REVIEW_SENTINEL;
        }
        long days = Duration.between(reviewed, now).toDays();
        return Math.max(days, 0L);
    }

    static Boolean isSuperhost(Object numberOfReviews, Object hostListingsCount) {
        Double reviews = TransformerUtils.toDouble(numberOfReviews);
        Double listings = TransformerUtils.toDouble(hostListingsCount);
        if (reviews == null || listings == null) {
            return false;
        }
        return reviews > SUPERHOST_MIN_REVIEWS && listings <= SUPERHOST_MAX_HOST_LISTINGS;
    }
}
