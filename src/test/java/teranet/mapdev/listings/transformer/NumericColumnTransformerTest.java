package teranet.mapdev.listings.transformer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.listings.config.EtlProperties;
import teranet.mapdev.listings.model.Table;
import teranet.mapdev.listings.model.TransformStats;
import teranet.mapdev.listings.util.TestDataFactory;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static teranet.mapdev.listings.util.TestDataFactory.columns;
import static teranet.mapdev.listings.util.TestDataFactory.row;

/**
 * Unit tests for NumericColumnTransformer
 * Tests coercion, the price range filter and IQR clipping
 */
class NumericColumnTransformerTest {

    private NumericColumnTransformer transformer;
    private EtlProperties.Transformation settings;
    private TransformContext context;

    @BeforeEach
    void setUp() {
        transformer = new NumericColumnTransformer();
        settings = TestDataFactory.defaultProperties().getTransformation();
        context = new TransformContext(LocalDateTime.of(2024, 1, 1, 0, 0), settings, new TransformStats());
    }

    @Test
    void testTransform_CurrencyTextCoerced() {
        // Given: Price column read as text
        Table table = TestDataFactory.table(columns("id", "price"),
                row(1L, "$1,200"), row(2L, "85"), row(3L, "12.50"));

        // When: Transform
        Table result = transformer.transform(table, context);

        // Then: Numbers, widened to Double because one value is fractional
        assertEquals(Arrays.asList(1200.0, 85.0, 12.5), result.columnValues("price"));
    }

    @Test
    void testTransform_UnreadableNumberBecomesMissing() {
        Table table = TestDataFactory.table(columns("minimum_nights"), row("3"), row("three"));

        Table result = transformer.transform(table, context);

        assertEquals(Arrays.asList(3L, null), result.columnValues("minimum_nights"));
        assertEquals(1, context.getStats().getNumericCoercionFailures().get("minimum_nights"));
    }

    @Test
    void testTransform_PriceFilterDropsNegativeMissingAndOutOfRange() {
        // Given: Valid, negative, missing, too high and boundary prices
        Table table = TestDataFactory.table(columns("id", "price"),
                row(1L, 100L), row(2L, -5L), row(3L, null), row(4L, 9999999L),
                row(5L, 0L), row(6L, 10000L));

        // When: Transform
        Table result = transformer.transform(table, context);

        // Then: Bounds are inclusive
        assertEquals(Arrays.asList(1L, 5L, 6L), result.columnValues("id"));
        assertEquals(1, context.getStats().getNegativePriceRowsRemoved());
        assertEquals(2, context.getStats().getOutOfRangePriceRowsRemoved());
    }

    @Test
    void testTransform_MissingValueInOtherNumericColumnKeepsRow() {
        Table table = TestDataFactory.table(columns("price", "availability_365"), row(50L, null));

        Table result = transformer.transform(table, context);

        assertEquals(1, result.rowCount());
        assertNull(result.value(0, "availability_365"));
    }

    @Test
    void testTransform_IqrClipsToFences() {
        // Given: IQR handling on a column with one large outlier
        settings.setOutlierMethod("iqr");
        Table table = TestDataFactory.table(columns("number_of_reviews"),
                row(1L), row(2L), row(3L), row(4L), row(100L));

        // When: Transform
        Table result = transformer.transform(table, context);

        // Then: q1=2, q3=4, upper fence 4 + 1.5*2 = 7
        assertEquals(Arrays.asList(1.0, 2.0, 3.0, 4.0, 7.0), result.columnValues("number_of_reviews"));
        assertEquals(1, context.getStats().getClippedValues().get("number_of_reviews"));
    }

    @Test
    void testTransform_NoneMethodLeavesOutliers() {
        Table table = TestDataFactory.table(columns("number_of_reviews"), row(1L), row(2L), row(1000L));

        Table result = transformer.transform(table, context);

        assertEquals(List.of(1L, 2L, 1000L), result.columnValues("number_of_reviews"));
    }

    @Test
    void testTransform_InputTableUnchanged() {
        Table table = TestDataFactory.table(columns("price"), row("$10"), row("-1"));

        transformer.transform(table, context);

        assertEquals(Arrays.asList("$10", "-1"), table.columnValues("price"));
    }
}
