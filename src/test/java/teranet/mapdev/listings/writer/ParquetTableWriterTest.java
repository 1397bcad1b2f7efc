package teranet.mapdev.listings.writer;

import org.apache.avro.Schema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import teranet.mapdev.listings.model.ColumnType;
import teranet.mapdev.listings.model.Table;
import teranet.mapdev.listings.service.TableNamingService;
import teranet.mapdev.listings.util.TestDataFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static teranet.mapdev.listings.util.TestDataFactory.columns;
import static teranet.mapdev.listings.util.TestDataFactory.row;

/**
 * Unit tests for ParquetTableWriter
 */
class ParquetTableWriterTest {

    @TempDir
    Path tempDir;

    private final ParquetTableWriter writer = new ParquetTableWriter(new TableNamingService());

    @Test
    void testWrite_ProducesParquetFile() throws IOException {
        // Given: Typed table with nulls
        Table table = TestDataFactory.table(columns("id", "room_type", "price", "is_available", "last_review"),
                row(1L, "Private room", 150.0, true, LocalDateTime.of(2019, 5, 21, 0, 0)),
                row(2L, null, null, false, null));
        Path target = tempDir.resolve("out.parquet");

        // When: Write
        writer.write(table, target);

        // Then: File starts and ends with the Parquet magic
        byte[] bytes = Files.readAllBytes(target);
        assertTrue(bytes.length > 8);
        assertEquals("PAR1", new String(Arrays.copyOfRange(bytes, 0, 4), StandardCharsets.US_ASCII));
        assertEquals("PAR1", new String(Arrays.copyOfRange(bytes, bytes.length - 4, bytes.length), StandardCharsets.US_ASCII));
    }

    @Test
    void testWrite_OverwritesExistingFile() throws IOException {
        Path target = tempDir.resolve("out.parquet");
        Files.writeString(target, "stale");

        writer.write(TestDataFactory.table(columns("id"), row(1L)), target);

        assertNotEquals("stale", new String(Files.readAllBytes(target), StandardCharsets.ISO_8859_1));
    }

    @Test
    void testBuildSchema_NullableFieldsWithSanitizedNames() {
        Map<String, ColumnType> types = new LinkedHashMap<>();
        types.put("Unnamed: 0", ColumnType.LONG);
        types.put("last_review", ColumnType.DATETIME);
        types.put("empty", ColumnType.EMPTY);
        List<String> columnNames = List.copyOf(types.keySet());

        Schema schema = writer.buildSchema(columnNames,
                new TableNamingService().toColumnIdentifiers(columnNames), types);

        assertEquals("unnamed_0", schema.getFields().get(0).name());
        Schema reviewType = schema.getField("last_review").schema().getTypes().get(1);
        assertEquals("timestamp-millis", reviewType.getLogicalType().getName());
        assertEquals(Schema.Type.NULL, schema.getField("empty").schema().getTypes().get(0).getType());
        assertEquals(Schema.Type.STRING, schema.getField("empty").schema().getTypes().get(1).getType());
    }
}
