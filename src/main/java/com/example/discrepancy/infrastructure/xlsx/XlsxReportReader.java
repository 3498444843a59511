package com.example.discrepancy.infrastructure.xlsx;

import com.example.discrepancy.domain.model.ReportTable;
import com.example.discrepancy.infrastructure.exception.WorkbookProcessingException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Infrastructure adapter that loads the first sheet of an {@code .xlsx} workbook into a {@link ReportTable}.
 * Hides the Apache POI cell model from the rest of the application.
 */
@Component
public class XlsxReportReader {

    private static final Logger log = LoggerFactory.getLogger(XlsxReportReader.class);

    private final DataFormatter headerFormatter = new DataFormatter();

    /**
     * Reads a workbook stored on disk.
     *
     * @param path workbook location
     * @return table built from the first sheet
     * @throws WorkbookProcessingException when the file cannot be opened as a workbook
     */
    public ReportTable read(Path path) {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return read(inputStream);
        } catch (IOException ex) {
            throw new WorkbookProcessingException("Unable to open the workbook.", path, ex);
        }
    }

    /**
     * Reads a workbook from a stream. The stream is consumed but not closed.
     *
     * @param inputStream workbook bytes
     * @return table built from the first sheet; empty when the workbook has no sheet or header
     * @throws WorkbookProcessingException when the bytes are not a readable {@code .xlsx} workbook
     */
    public ReportTable read(InputStream inputStream) {
        try (Workbook workbook = new XSSFWorkbook(inputStream)) {
            if (workbook.getNumberOfSheets() == 0) {
                return emptyTable();
            }
            return readSheet(workbook.getSheetAt(0));
        } catch (IOException | RuntimeException ex) {
            throw new WorkbookProcessingException("Unable to read the workbook.", ex);
        }
    }

    private ReportTable readSheet(Sheet sheet) {
        Row headerRow = sheet.getRow(0);
        if (headerRow == null) {
            return emptyTable();
        }

        int width = Math.max(headerRow.getLastCellNum(), 0);
        for (int rowIndex = 1; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
            Row row = sheet.getRow(rowIndex);
            if (row != null) {
                width = Math.max(width, row.getLastCellNum());
            }
        }
        if (width == 0) {
            return emptyTable();
        }

        List<String> columns = readHeader(headerRow, width);
        List<List<Object>> cells = new ArrayList<>();
        for (int rowIndex = 1; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
            cells.add(readRow(sheet.getRow(rowIndex), width));
        }
        // trailing rows that only carry formatting
        while (!cells.isEmpty() && cells.get(cells.size() - 1).stream().allMatch(value -> value == null)) {
            cells.remove(cells.size() - 1);
        }

        log.debug("Read sheet '{}' with {} columns and {} rows", sheet.getSheetName(), columns.size(), cells.size());
        return ReportTable.fromCells(columns, cells);
    }

    /**
     * Builds unique column names. Blank headers become {@code Unnamed: <index>}, repeated ones get a
     * {@code .1}, {@code .2} suffix.
     */
    private List<String> readHeader(Row headerRow, int width) {
        List<String> columns = new ArrayList<>(width);
        Set<String> seen = new HashSet<>();
        Map<String, Integer> duplicates = new HashMap<>();
        for (int columnIndex = 0; columnIndex < width; columnIndex++) {
            Cell cell = headerRow.getCell(columnIndex, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            String name = cell == null ? "" : headerFormatter.formatCellValue(cell);
            if (name.isBlank()) {
                name = "Unnamed: " + columnIndex;
            }
            String unique = name;
            while (!seen.add(unique)) {
                int suffix = duplicates.merge(name, 1, Integer::sum);
                unique = name + "." + suffix;
            }
            columns.add(unique);
        }
        return columns;
    }

    private List<Object> readRow(Row row, int width) {
        List<Object> values = new ArrayList<>(width);
        for (int columnIndex = 0; columnIndex < width; columnIndex++) {
            Cell cell = row == null ? null : row.getCell(columnIndex, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            values.add(cellValue(cell));
        }
        return values;
    }

    private Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        return switch (type) {
            case STRING -> {
                String text = cell.getStringCellValue();
                yield text == null || text.isBlank() ? null : text;
            }
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? cell.getLocalDateTimeCellValue()
                    : (Object) cell.getNumericCellValue();
            case BOOLEAN -> cell.getBooleanCellValue();
            default -> null;
        };
    }

    private ReportTable emptyTable() {
        return new ReportTable(List.of(), List.of());
    }
}
