package teranet.mapdev.listings.writer;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import teranet.mapdev.listings.model.Table;
import teranet.mapdev.listings.util.TestDataFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static teranet.mapdev.listings.util.TestDataFactory.columns;
import static teranet.mapdev.listings.util.TestDataFactory.row;

/**
 * Unit tests for ExcelTableWriter
 */
class ExcelTableWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testWrite_SheetWithHeaderAndTypedCells() throws IOException {
        // Given: Table with text, number, boolean, date and null values
        Table table = TestDataFactory.table(columns("id", "name", "is_available", "last_review"),
                row(1L, "Loft", true, LocalDateTime.of(2019, 5, 21, 0, 0)),
                row(2L, null, false, null));
        Path target = tempDir.resolve("out.xlsx");

        // When: Write
        new ExcelTableWriter().write(table, target);

        // Then: Readable workbook with one sheet
        try (InputStream in = Files.newInputStream(target);
             XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            Sheet sheet = workbook.getSheet(ExcelTableWriter.SHEET_NAME);
            assertNotNull(sheet);
            assertEquals("name", sheet.getRow(0).getCell(1).getStringCellValue());

            Row first = sheet.getRow(1);
            assertEquals(1.0, first.getCell(0).getNumericCellValue());
            assertEquals("Loft", first.getCell(1).getStringCellValue());
            assertTrue(first.getCell(2).getBooleanCellValue());
            assertEquals(LocalDateTime.of(2019, 5, 21, 0, 0), first.getCell(3).getLocalDateTimeCellValue());

            assertNull(sheet.getRow(2).getCell(1));
            assertEquals(2, sheet.getLastRowNum());
        }
    }
}
