package teranet.mapdev.listings.transformer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.listings.config.EtlProperties;
import teranet.mapdev.listings.model.Table;
import teranet.mapdev.listings.model.TransformStats;
import teranet.mapdev.listings.util.TestDataFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static teranet.mapdev.listings.util.TestDataFactory.columns;
import static teranet.mapdev.listings.util.TestDataFactory.row;

/**
 * Unit tests for FeatureTransformer
 */
class FeatureTransformerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 11, 12, 0);

    private FeatureTransformer transformer;
    private EtlProperties.Transformation settings;
    private TransformContext context;

    @BeforeEach
    void setUp() {
        transformer = new FeatureTransformer();
        settings = TestDataFactory.defaultProperties().getTransformation();
        context = new TransformContext(NOW, settings, new TransformStats());
    }

    @Test
    void testPricePerNight() {
        assertEquals(50.0, FeatureTransformer.pricePerNight(100L, 2L));
        // minimum nights below one counts as one night
        assertEquals(150.0, FeatureTransformer.pricePerNight(150L, 0L));
        assertNull(FeatureTransformer.pricePerNight(null, 2L));
        assertNull(FeatureTransformer.pricePerNight(100L, null));
    }

    @Test
    void testIsAvailable() {
        assertTrue(FeatureTransformer.isAvailable(365L));
        assertFalse(FeatureTransformer.isAvailable(0L));
        assertFalse(FeatureTransformer.isAvailable(null));
    }

    @Test
    void testDaysSince() {
        assertEquals(10L, FeatureTransformer.daysSince(LocalDateTime.of(2024, 1, 1, 0, 0), NOW));
        assertEquals(-1L, FeatureTransformer.daysSince(null, NOW));
        // review dated after now
        assertEquals(0L, FeatureTransformer.daysSince(LocalDateTime.of(2024, 3, 1, 0, 0), NOW));
    }

    @Test
    void testIsSuperhost() {
        assertTrue(FeatureTransformer.isSuperhost(51L, 3L));
        assertFalse(FeatureTransformer.isSuperhost(50L, 1L));
        assertFalse(FeatureTransformer.isSuperhost(100L, 4L));
        assertFalse(FeatureTransformer.isSuperhost(null, 1L));
    }

    @Test
    void testTransform_AllFeaturesAppended() {
        // Given: All input columns present
        Table table = TestDataFactory.table(
                columns("price", "minimum_nights", "availability_365", "last_review",
                        "number_of_reviews", "calculated_host_listings_count"),
                row(100L, 2L, 0L, LocalDateTime.of(2024, 1, 1, 0, 0), 60L, 1L));

        // When: Transform
        Table result = transformer.transform(table, context);

        // Then: Features appended in a fixed order
        assertEquals(List.of("price", "minimum_nights", "availability_365", "last_review",
                        "number_of_reviews", "calculated_host_listings_count",
                        "price_per_night", "has_availability", "is_available",
                        "review_recency", "days_since_last_review", "is_superhost"),
                result.getColumns());
        assertEquals(50.0, result.value(0, "price_per_night"));
        assertEquals(false, result.value(0, "has_availability"));
        assertEquals(10L, result.value(0, "days_since_last_review"));
        assertEquals(true, result.value(0, "is_superhost"));
    }

    @Test
    void testTransform_MissingInputsSkipFeature() {
        // Given: No minimum_nights and no last_review columns
        Table table = TestDataFactory.table(columns("price", "availability_365"), row(80L, 12L));

        // When: Transform
        Table result = transformer.transform(table, context);

        // Then: Only the availability features are added
        assertEquals(List.of("price", "availability_365", "has_availability", "is_available"), result.getColumns());
    }

    @Test
    void testTransform_DisabledFeatureNotCreated() {
        settings.setCreateFeatures(new ArrayList<>(List.of("is_available")));
        Table table = TestDataFactory.table(columns("price", "minimum_nights", "availability_365"), row(80L, 1L, 12L));

        Table result = transformer.transform(table, context);

        assertFalse(result.hasColumn("price_per_night"));
        assertFalse(result.hasColumn("has_availability"));
        assertTrue(result.hasColumn("is_available"));
    }

    @Test
    void testTransform_ExistingFeatureRecomputedInPlace() {
        Table table = TestDataFactory.table(columns("price_per_night", "price", "minimum_nights"), row(1.0, 90L, 3L));

        Table result = transformer.transform(table, context);

        assertEquals(List.of("price_per_night", "price", "minimum_nights"), result.getColumns());
        assertEquals(30.0, result.value(0, "price_per_night"));
    }
}
