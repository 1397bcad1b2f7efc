package teranet.mapdev.listings.writer;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import teranet.mapdev.listings.model.Table;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Spreadsheet output (.xlsx), one sheet with a bold header row.
 * Rows are streamed through SXSSF so only a small window is kept in memory.
 */
@Component
public class ExcelTableWriter implements TableWriter {

    private static final Logger logger = LoggerFactory.getLogger(ExcelTableWriter.class);

    static final String SHEET_NAME = "listings";

    private static final int ROW_WINDOW = 100;

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.EXCEL;
    }

    @Override
    public void write(Table table, Path target) throws IOException {
        int maxRows = SpreadsheetVersion.EXCEL2007.getMaxRows();
        if (table.rowCount() + 1 > maxRows) {
            throw new IOException(String.format(
                    "Table has %d rows, a worksheet holds at most %d", table.rowCount(), maxRows - 1));
        }

        List<String> columns = table.getColumns();
        SXSSFWorkbook workbook = new SXSSFWorkbook(ROW_WINDOW);
        try (OutputStream outputStream = Files.newOutputStream(target)) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);

            Font bold = workbook.createFont();
            bold.setBold(true);
            CellStyle headerStyle = workbook.createCellStyle();
            headerStyle.setFont(bold);

            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd hh:mm:ss"));

            Row header = sheet.createRow(0);
            for (int c = 0; c < columns.size(); c++) {
                Cell cell = header.createCell(c);
                cell.setCellValue(columns.get(c));
                cell.setCellStyle(headerStyle);
            }

            int rowIndex = 1;
            for (Map<String, Object> values : table.getRows()) {
                Row row = sheet.createRow(rowIndex++);
                for (int c = 0; c < columns.size(); c++) {
                    setCell(row, c, values.get(columns.get(c)), dateStyle);
                }
            }

            workbook.write(outputStream);
        } finally {
            workbook.dispose();
            workbook.close();
        }

        logger.debug("Wrote {} rows to {}", table.rowCount(), target);
    }

    private void setCell(Row row, int column, Object value, CellStyle dateStyle) {
        if (value == null) {
            return; // blank cell
        }
        Cell cell = row.createCell(column);
        if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            cell.setCellValue((Boolean) value);
        } else if (value instanceof LocalDateTime) {
            cell.setCellValue((LocalDateTime) value);
            cell.setCellStyle(dateStyle);
        } else {
            cell.setCellValue(value.toString());
        }
    }
}
