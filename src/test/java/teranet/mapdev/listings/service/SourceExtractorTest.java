package teranet.mapdev.listings.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import teranet.mapdev.listings.config.EtlProperties;
import teranet.mapdev.listings.exception.CsvParseException;
import teranet.mapdev.listings.exception.EtlException;
import teranet.mapdev.listings.exception.NoTabularDataFoundException;
import teranet.mapdev.listings.exception.SourceNotFoundException;
import teranet.mapdev.listings.exception.UnsupportedSourceTypeException;
import teranet.mapdev.listings.model.SourceType;
import teranet.mapdev.listings.model.Table;
import teranet.mapdev.listings.util.TestDataFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SourceExtractor
 * Tests archive entry selection, flat files and the error taxonomy
 */
class SourceExtractorTest {

    @TempDir
    Path tempDir;

    private EtlProperties properties;
    private SourceExtractor sourceExtractor;

    @BeforeEach
    void setUp() {
        properties = TestDataFactory.defaultProperties(tempDir);
        sourceExtractor = new SourceExtractor(
                new CsvParsingService(properties), new FileChecksumService(), properties);
    }

    @Test
    void testExtract_ArchiveSelectsFirstListedCsv() throws IOException {
        // Given: Archive listing b.csv before a.csv
        Path zip = TestDataFactory.createZip(tempDir.resolve("listings.zip"),
                "b.csv", "source\nfrom_b\n",
                "a.csv", "source\nfrom_a\n");

        // When: Extract
        Table table = sourceExtractor.extract(zip, SourceType.ARCHIVE);

        // Then: b.csv wins (listing order, not alphabetical)
        assertEquals("from_b", table.value(0, "source"));
    }

    @Test
    void testExtract_ArchiveSkipsNonCsvEntriesAndDirectories() throws IOException {
        Path zip = TestDataFactory.createZip(tempDir.resolve("mixed.zip"),
                "docs/", "",
                "docs/readme.txt", "not data",
                "data/LISTINGS.CSV", "id\n7\n");

        Table table = sourceExtractor.extract(zip, SourceType.AUTO);

        assertEquals(7L, table.value(0, "id"));
    }

    @Test
    void testExtract_ArchiveEntryStagedUnderRawDirectory() throws IOException {
        Path zip = TestDataFactory.createZip(tempDir.resolve("listings.zip"), "listings.csv", "id\n1\n");

        sourceExtractor.extract(zip, SourceType.ARCHIVE);

        assertTrue(Files.exists(tempDir.resolve("raw").resolve("listings.csv")));
    }

    @Test
    void testExtract_ArchiveEntryEscapingRawDirectory_Rejected() throws IOException {
        Path zip = TestDataFactory.createZip(tempDir.resolve("evil.zip"), "../../evil.csv", "id\n1\n");

        assertThrows(EtlException.class, () -> sourceExtractor.extract(zip, SourceType.ARCHIVE));
    }

    @Test
    void testExtract_ArchiveWithoutCsv_Throws() throws IOException {
        Path zip = TestDataFactory.createZip(tempDir.resolve("empty.zip"), "readme.txt", "hello");

        assertThrows(NoTabularDataFoundException.class, () -> sourceExtractor.extract(zip, SourceType.ARCHIVE));
    }

    @Test
    void testExtract_FlatCsv() throws IOException {
        Path csv = TestDataFactory.writeFile(tempDir.resolve("listings.csv"), TestDataFactory.listingsCsv());

        Table table = sourceExtractor.extract(csv, null);

        assertEquals(3, table.rowCount());
    }

    @Test
    void testExtract_FlatGzip() throws IOException {
        Path gz = TestDataFactory.createGzip(tempDir.resolve("listings.csv.gz"), "id,price\n1,10\n");

        Table table = sourceExtractor.extract(gz, SourceType.FLAT);

        assertEquals(List.of("id", "price"), table.getColumns());
        assertEquals(10L, table.value(0, "price"));
    }

    @Test
    void testExtract_TsvUsesTabDelimiter() throws IOException {
        Path tsv = TestDataFactory.writeFile(tempDir.resolve("listings.tsv"), "id\tname\n1\ta, b\n");

        Table table = sourceExtractor.extract(tsv, SourceType.AUTO);

        assertEquals("a, b", table.value(0, "name"));
    }

    @Test
    void testExtract_MissingSource_Throws() {
        assertThrows(SourceNotFoundException.class,
                () -> sourceExtractor.extract(tempDir.resolve("missing.zip"), SourceType.AUTO));
    }

    @Test
    void testExtract_UnknownExtension_Throws() throws IOException {
        Path file = TestDataFactory.writeFile(tempDir.resolve("listings.xml"), "<xml/>");

        assertThrows(UnsupportedSourceTypeException.class, () -> sourceExtractor.extract(file, SourceType.AUTO));
    }

    @Test
    void testExtract_MalformedCsv_Throws() throws IOException {
        Path csv = TestDataFactory.writeFile(tempDir.resolve("bad.csv"), "a,b\n1,2,3\n");

        assertThrows(CsvParseException.class, () -> sourceExtractor.extract(csv, SourceType.FLAT));
    }

    @Test
    void testResolveSourceType_ExplicitTypeWins() {
        Path path = tempDir.resolve("listings.dat");

        assertEquals(SourceType.FLAT, sourceExtractor.resolveSourceType(path, SourceType.FLAT));
        assertEquals(SourceType.ARCHIVE, sourceExtractor.resolveSourceType(tempDir.resolve("x.ZIP"), null));
    }
}
