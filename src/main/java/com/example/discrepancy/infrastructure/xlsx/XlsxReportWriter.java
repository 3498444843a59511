package com.example.discrepancy.infrastructure.xlsx;

import com.example.discrepancy.domain.model.ReportRow;
import com.example.discrepancy.domain.model.ReportTable;
import com.example.discrepancy.infrastructure.exception.WorkbookProcessingException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * Infrastructure adapter that serializes a {@link ReportTable} into a single-sheet {@code .xlsx} workbook.
 * The header row is written first, no index column is added.
 */
@Component
public class XlsxReportWriter {

    static final String SHEET_NAME = "Sheet1";
    private static final String DATE_FORMAT = "yyyy-mm-dd hh:mm:ss";
    static final Instant CREATED = Instant.parse("2000-01-01T00:00:00Z");

    /**
     * Writes the table to the stream. The stream is not closed.
     *
     * @param table        table to serialize
     * @param outputStream target stream
     * @throws WorkbookProcessingException when POI cannot write the workbook
     */
    public void write(ReportTable table, OutputStream outputStream) {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            // same table, same workbook content
            workbook.getProperties().getCoreProperties().setCreated(Optional.of(Date.from(CREATED)));
            Sheet sheet = workbook.createSheet(SHEET_NAME);
            CellStyle headerStyle = headerStyle(workbook);
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat(DATE_FORMAT));

            List<String> columns = table.columns();
            Row headerRow = sheet.createRow(0);
            for (int columnIndex = 0; columnIndex < columns.size(); columnIndex++) {
                Cell cell = headerRow.createCell(columnIndex);
                cell.setCellValue(columns.get(columnIndex));
                cell.setCellStyle(headerStyle);
            }

            List<ReportRow> rows = table.rows();
            for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
                Row row = sheet.createRow(rowIndex + 1);
                ReportRow reportRow = rows.get(rowIndex);
                for (int columnIndex = 0; columnIndex < columns.size(); columnIndex++) {
                    writeCell(row, columnIndex, reportRow.get(columns.get(columnIndex)), dateStyle);
                }
            }

            workbook.write(outputStream);
        } catch (IOException ex) {
            throw new WorkbookProcessingException("Unable to write the result workbook.", ex);
        }
    }

    private void writeCell(Row row, int columnIndex, Object value, CellStyle dateStyle) {
        if (value == null) {
            return;
        }
        Cell cell = row.createCell(columnIndex);
        if (value instanceof Number number) {
            cell.setCellValue(number.doubleValue());
        } else if (value instanceof Boolean flag) {
            cell.setCellValue(flag);
        } else if (value instanceof LocalDateTime dateTime) {
            cell.setCellValue(dateTime);
            cell.setCellStyle(dateStyle);
        } else {
            cell.setCellValue(String.valueOf(value));
        }
    }

    private CellStyle headerStyle(XSSFWorkbook workbook) {
        Font font = workbook.createFont();
        font.setBold(true);
        CellStyle style = workbook.createCellStyle();
        style.setFont(font);
        return style;
    }
}
