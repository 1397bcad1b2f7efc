package teranet.mapdev.listings.transformer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.listings.model.Table;
import teranet.mapdev.listings.model.TransformStats;
import teranet.mapdev.listings.util.TestDataFactory;

import java.time.LocalDateTime;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static teranet.mapdev.listings.util.TestDataFactory.columns;
import static teranet.mapdev.listings.util.TestDataFactory.row;

/**
 * Unit tests for CategoricalColumnTransformer and DateColumnTransformer
 */
class ValueColumnTransformerTest {

    private TransformContext context;

    @BeforeEach
    void setUp() {
        context = new TransformContext(LocalDateTime.of(2024, 1, 1, 0, 0),
                TestDataFactory.defaultProperties().getTransformation(), new TransformStats());
    }

    @Test
    void testCategorical_PlaceholdersBecomeMissing() {
        // Given: Room types with placeholder spellings and padding
        Table table = TestDataFactory.table(columns("room_type"),
                row(" Private room "), row("nan"), row("None"), row("NaN"), row((Object) null));

        // When: Transform
        Table result = new CategoricalColumnTransformer().transform(table, context);

        // Then: Trimmed text or missing
        assertEquals(Arrays.asList("Private room", null, null, null, null), result.columnValues("room_type"));
        assertEquals(3, context.getStats().getMissingCategoricalValues().get("room_type"));
    }

    @Test
    void testCategorical_NumericCategoryBecomesText() {
        Table table = TestDataFactory.table(columns("neighbourhood"), row(10L));

        Table result = new CategoricalColumnTransformer().transform(table, context);

        assertEquals("10", result.value(0, "neighbourhood"));
    }

    @Test
    void testDates_ParsedOrMissing() {
        // Given: Several date spellings and one unreadable value
        Table table = TestDataFactory.table(columns("last_review"),
                row("2019-05-21"), row("2019/05/21"), row("2019-05-21 13:45:00"), row("soon"));

        // When: Transform
        Table result = new DateColumnTransformer().transform(table, context);

        // Then: Timestamps, dates at midnight
        assertEquals(LocalDateTime.of(2019, 5, 21, 0, 0), result.value(0, "last_review"));
        assertEquals(LocalDateTime.of(2019, 5, 21, 0, 0), result.value(1, "last_review"));
        assertEquals(LocalDateTime.of(2019, 5, 21, 13, 45), result.value(2, "last_review"));
        assertNull(result.value(3, "last_review"));
        assertEquals(1, context.getStats().getUnparseableDates().get("last_review"));
    }

    @Test
    void testDates_AbsentColumnIgnored() {
        Table table = TestDataFactory.table(columns("id"), row(1L));

        Table result = new DateColumnTransformer().transform(table, context);

        assertEquals(table, result);
    }
}
