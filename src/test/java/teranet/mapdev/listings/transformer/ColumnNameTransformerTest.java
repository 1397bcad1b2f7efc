package teranet.mapdev.listings.transformer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.listings.model.Table;
import teranet.mapdev.listings.model.TransformStats;
import teranet.mapdev.listings.util.TestDataFactory;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static teranet.mapdev.listings.util.TestDataFactory.columns;
import static teranet.mapdev.listings.util.TestDataFactory.row;

/**
 * Unit tests for ColumnNameTransformer
 */
class ColumnNameTransformerTest {

    private ColumnNameTransformer transformer;
    private TransformContext context;

    @BeforeEach
    void setUp() {
        transformer = new ColumnNameTransformer();
        context = new TransformContext(LocalDateTime.of(2024, 1, 1, 0, 0),
                TestDataFactory.defaultProperties().getTransformation(), new TransformStats());
    }

    @Test
    void testNormalize() {
        assertEquals("minimum_nights", ColumnNameTransformer.normalize("Minimum Nights"));
        assertEquals("host_id", ColumnNameTransformer.normalize(" Host-ID "));
        assertEquals("price", ColumnNameTransformer.normalize("price"));
    }

    @Test
    void testTransform_RenamesAndKeepsValues() {
        // Given: Mixed-case header
        Table table = TestDataFactory.table(columns("ID", "Room Type"), row(1L, "Private room"));

        // When: Transform
        Table result = transformer.transform(table, context);

        // Then: Names normalized, values follow their column
        assertEquals(List.of("id", "room_type"), result.getColumns());
        assertEquals("Private room", result.value(0, "room_type"));
        assertEquals("room_type", context.getStats().getRenamedColumns().get("Room Type"));
    }

    @Test
    void testTransform_CollisionGetsSuffix() {
        // Given: Two names that normalize to the same value
        Table table = TestDataFactory.table(columns("Host ID", "host_id", "HOST-ID"), row(1L, 2L, 3L));

        // When: Transform
        Table result = transformer.transform(table, context);

        // Then: No column lost, later ones suffixed
        assertEquals(List.of("host_id", "host_id_2", "host_id_3"), result.getColumns());
        assertEquals(2L, result.value(0, "host_id_2"));
        assertEquals(3L, result.value(0, "host_id_3"));
    }

    @Test
    void testTransform_AlreadyNormalized_ReturnsSameInstance() {
        Table table = TestDataFactory.table(columns("id", "price"), row(1L, 10L));

        assertSame(table, transformer.transform(table, context));
        assertTrue(context.getStats().getRenamedColumns().isEmpty());
    }
}
