package teranet.mapdev.listings.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.listings.exception.CsvParseException;
import teranet.mapdev.listings.model.ColumnType;
import teranet.mapdev.listings.model.Table;
import teranet.mapdev.listings.util.TestDataFactory;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CsvParsingService
 * Tests quoting, NA handling, type inference and malformed input
 */
class CsvParsingServiceTest {

    private CsvParsingService csvParsingService;

    @BeforeEach
    void setUp() {
        csvParsingService = new CsvParsingService(TestDataFactory.defaultProperties());
    }

    private Table parse(String content) {
        return csvParsingService.parse(new StringReader(content), ',', "test.csv");
    }

    @Test
    void testParse_ListingsFile() {
        // Given: Listings CSV with header and three rows
        // When: Parse
        Table table = parse(TestDataFactory.listingsCsv());

        // Then: Shape and column order follow the header
        assertEquals(3, table.rowCount());
        assertEquals(11, table.columnCount());
        assertEquals("id", table.getColumns().get(0));
        assertEquals(2539L, table.value(0, "id"));
        assertEquals("Clean & quiet apt", table.value(0, "name"));
    }

    @Test
    void testParse_TypeInference() {
        // Given: Integral, decimal and text columns
        String csv = "a,b,c\n1,1.5,x\n2,2,y\n";

        // When: Parse
        Table table = parse(csv);

        // Then: Long, Double and String columns
        assertEquals(ColumnType.LONG, table.columnType("a"));
        assertEquals(ColumnType.DOUBLE, table.columnType("b"));
        assertEquals(ColumnType.STRING, table.columnType("c"));
        assertEquals(2.0, table.value(1, "b"));
    }

    @Test
    void testParse_CurrencyColumnStaysText() {
        // Given: Price column with a currency symbol
        Table table = parse("price\n$100\n200\n");

        // Then: Whole column is text, cleaning happens later
        assertEquals(ColumnType.STRING, table.columnType("price"));
        assertEquals("200", table.value(1, "price"));
    }

    @Test
    void testParse_NaTokensBecomeNull() {
        // Given: Several NA spellings
        Table table = parse("a,b\nNA,1\n,2\nnull,3\nN/A,4\n");

        // Then: All read as missing, column has no type
        for (int i = 0; i < 4; i++) {
            assertNull(table.value(i, "a"));
        }
        assertEquals(ColumnType.EMPTY, table.columnType("a"));
    }

    @Test
    void testParse_QuotedFields() {
        // Given: Quoted delimiter, doubled quote and a line break inside quotes
        String csv = "id,name\n1,\"Smith, Jr.\"\n2,\"Author \"\"John\"\" Doe\"\n3,\"two\nlines\"\n";

        // When: Parse
        Table table = parse(csv);

        // Then: Quoting is honored
        assertEquals(3, table.rowCount());
        assertEquals("Smith, Jr.", table.value(0, "name"));
        assertEquals("Author \"John\" Doe", table.value(1, "name"));
        assertEquals("two\nlines", table.value(2, "name"));
    }

    @Test
    void testParse_ShortRowPaddedWithNulls() {
        Table table = parse("a,b,c\n1,2\n");

        assertEquals(1L, table.value(0, "a"));
        assertNull(table.value(0, "c"));
    }

    @Test
    void testParse_TooManyFields_ThrowsWithLineNumber() {
        // Given: Third physical line has an extra field
        String csv = "a,b\n1,2\n3,4,5\n";

        // When/Then
        CsvParseException exception = assertThrows(CsvParseException.class, () -> parse(csv));
        assertEquals(3, exception.getLineNumber());
        assertTrue(exception.getMessage().startsWith("Line 3:"));
    }

    @Test
    void testParse_UnbalancedQuote_Throws() {
        CsvParseException exception = assertThrows(CsvParseException.class,
                () -> parse("a,b\n1,\"open\n2,3\n"));
        assertEquals(2, exception.getLineNumber());
    }

    @Test
    void testParse_EmptyInput_Throws() {
        assertThrows(CsvParseException.class, () -> parse(""));
    }

    @Test
    void testParse_HeaderOnly_EmptyTableKeepsColumns() {
        Table table = parse("a,b\n");

        assertEquals(0, table.rowCount());
        assertEquals(List.of("a", "b"), table.getColumns());
    }

    @Test
    void testParse_ByteOrderMarkStripped() {
        // Given: UTF-8 file starting with a BOM
        byte[] bytes = "\uFEFFid,name\n1,x\n".getBytes(StandardCharsets.UTF_8);

        // When: Parse from bytes
        Table table = csvParsingService.parse(new ByteArrayInputStream(bytes), ',', "bom.csv");

        // Then: First column name is clean
        assertEquals("id", table.getColumns().get(0));
    }

    @Test
    void testParse_InvalidUtf8_Throws() {
        // Given: A cell holding C3 28, which is not a valid UTF-8 sequence
        byte[] bytes = {'i', 'd', ',', 'n', 'a', 'm', 'e', '\n', '1', ',', (byte) 0xC3, 0x28, '\n'};

        // When/Then: Parse fails instead of loading a replacement character
        CsvParseException exception = assertThrows(CsvParseException.class,
                () -> csvParsingService.parse(new ByteArrayInputStream(bytes), ',', "bad.csv"));
        assertTrue(exception.getMessage().contains("bad.csv"));
    }

    @Test
    void testParse_DuplicateHeaderNamesMadeUnique() {
        Table table = parse("a,a,\n1,2,3\n");

        assertEquals(List.of("a", "a.1", "Unnamed: 2"), table.getColumns());
    }

    @Test
    void testParse_TabDelimiter() {
        Table table = csvParsingService.parse(new StringReader("a\tb\n1\tx y\n"), '\t', "test.tsv");

        assertEquals("x y", table.value(0, "b"));
    }

    @Test
    void testParse_CrLfLineEndingsAndBlankLines() {
        Table table = parse("a,b\r\n1,2\r\n\r\n3,4\r\n");

        assertEquals(2, table.rowCount());
        assertEquals(3L, table.value(1, "a"));
    }
}
