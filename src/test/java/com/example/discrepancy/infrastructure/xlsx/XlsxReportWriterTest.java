package com.example.discrepancy.infrastructure.xlsx;

import com.example.discrepancy.domain.model.ReportTable;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for serializing report tables into workbooks.
 */
class XlsxReportWriterTest {

    private final XlsxReportWriter writer = new XlsxReportWriter();

    /**
     * Ensures the header comes first, no index column is added and cells keep their types.
     */
    @Test
    void writesHeaderAndTypedCells() throws IOException {
        ReportTable table = ReportTable.fromCells(
                List.of("ID Материала", "Кол-во по заявке", "Note", "Delivered", "Расхождение заявка-приход"),
                List.of(Arrays.asList("146872", 934.0, null, LocalDateTime.of(2024, 3, 1, 8, 30), 211.0)));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        writer.write(table, out);

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(out.toByteArray()))) {
            assertThat(workbook.getNumberOfSheets()).isEqualTo(1);
            Sheet sheet = workbook.getSheetAt(0);
            assertThat(sheet.getSheetName()).isEqualTo(XlsxReportWriter.SHEET_NAME);

            Row header = sheet.getRow(0);
            assertThat(header.getLastCellNum()).isEqualTo((short) 5);
            assertThat(header.getCell(0).getStringCellValue()).isEqualTo("ID Материала");
            assertThat(header.getCell(4).getStringCellValue()).isEqualTo("Расхождение заявка-приход");
            assertThat(workbook.getFontAt(header.getCell(0).getCellStyle().getFontIndex()).getBold()).isTrue();

            Row row = sheet.getRow(1);
            assertThat(row.getCell(0).getCellType()).isEqualTo(CellType.STRING);
            assertThat(row.getCell(0).getStringCellValue()).isEqualTo("146872");
            assertThat(row.getCell(1).getNumericCellValue()).isEqualTo(934.0);
            assertThat(row.getCell(2)).isNull();
            assertThat(DateUtil.isCellDateFormatted(row.getCell(3))).isTrue();
            assertThat(row.getCell(3).getLocalDateTimeCellValue()).isEqualTo(LocalDateTime.of(2024, 3, 1, 8, 30));
            assertThat(row.getCell(4).getNumericCellValue()).isEqualTo(211.0);
            assertThat(sheet.getLastRowNum()).isEqualTo(1);
        }
    }

    /**
     * Ensures a table without rows still produces a readable workbook with its header.
     */
    @Test
    void writesHeaderForEmptyResult() {
        ReportTable table = ReportTable.fromCells(List.of("a", "b"), List.of());
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        writer.write(table, out);

        ReportTable reread = new XlsxReportReader().read(new ByteArrayInputStream(out.toByteArray()));
        assertThat(reread.columns()).containsExactly("a", "b");
        assertThat(reread.isEmpty()).isTrue();
    }

    /**
     * Ensures written results read back into an equal table.
     */
    @Test
    void writtenTableReadsBackUnchanged() {
        ReportTable table = ReportTable.fromCells(List.of("id", "qty", "flag"),
                List.of(Arrays.asList("a", 1.5, true), Arrays.asList("b", null, false)));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        writer.write(table, out);

        assertThat(new XlsxReportReader().read(new ByteArrayInputStream(out.toByteArray()))).isEqualTo(table);
    }

    /**
     * Ensures writing the same table twice yields identical workbook parts with a fixed creation date.
     */
    @Test
    void repeatedWritesProduceIdenticalParts() throws IOException {
        ReportTable table = ReportTable.fromCells(List.of("id", "qty"),
                List.of(Arrays.asList("a", 1.5), Arrays.asList("b", 2.0)));
        ByteArrayOutputStream first = new ByteArrayOutputStream();
        ByteArrayOutputStream second = new ByteArrayOutputStream();

        writer.write(table, first);
        writer.write(table, second);

        assertThat(zipEntries(second.toByteArray())).isEqualTo(zipEntries(first.toByteArray()));
        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(first.toByteArray()))) {
            assertThat(workbook.getProperties().getCoreProperties().getCreated())
                    .isEqualTo(Date.from(XlsxReportWriter.CREATED));
        }
    }

    private static Map<String, String> zipEntries(byte[] workbook) throws IOException {
        Map<String, String> entries = new TreeMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(workbook))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                entries.put(entry.getName(), new String(zip.readAllBytes(), StandardCharsets.UTF_8));
            }
        }
        return entries;
    }
}
