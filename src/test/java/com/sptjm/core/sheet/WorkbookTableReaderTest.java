package com.sptjm.core.sheet;

import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WorkbookTableReaderTest {

    @TempDir
    Path tempDir;

    private final WorkbookTableReader reader = new WorkbookTableReader();

    @Test
    void readsLongNumericIdentifiersAsPlainText() throws Exception {
        Path file = tempDir.resolve("data.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            XSSFSheet sheet = workbook.createSheet("Data");
            header(sheet, "NIP", "Nama", "Jumlah_dana1", "Rasio");
            XSSFRow row = sheet.createRow(1);
            row.createCell(0).setCellValue(1970010120003d);
            row.createCell(1).setCellValue("  Ana  ");
            row.createCell(2).setCellValue(1500000d);
            row.createCell(3).setCellValue(0.25d);
            save(workbook, file);
        }

        SheetTable table = reader.read(file, null);

        assertEquals(List.of("NIP", "Nama", "Jumlah_dana1", "Rasio"), table.headers());
        List<SheetTable.Cell> cells = table.rows().get(0);
        assertEquals("1970010120003", cells.get(0).text());
        assertEquals("Ana", cells.get(1).text());
        assertEquals("1500000", cells.get(2).text());
        assertEquals(0, new BigDecimal("1500000").compareTo(cells.get(2).number()));
        assertEquals("0.25", cells.get(3).text());
    }

    @Test
    void selectsSheetByNameAndDropsTrailingBlankRows() throws Exception {
        Path file = tempDir.resolve("multi.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            header(workbook.createSheet("Ringkasan"), "Info");
            XSSFSheet data = workbook.createSheet("SPTJM");
            header(data, "NIP", "Nama");
            XSSFRow row = data.createRow(1);
            row.createCell(0).setCellValue("123");
            row.createCell(1).setCellValue("Ana");
            data.createRow(2).createCell(0).setCellValue(" ");
            data.createRow(3);
            save(workbook, file);
        }

        assertEquals(List.of("Ringkasan", "SPTJM"), reader.sheetNames(file));
        SheetTable table = reader.read(file, "SPTJM");
        assertEquals(1, table.rowCount());
        assertEquals("123", table.rows().get(0).get(0).text());
    }

    @Test
    void formulaCellsUseCachedValue() throws Exception {
        Path file = tempDir.resolve("formula.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            XSSFSheet sheet = workbook.createSheet("Data");
            header(sheet, "A", "B", "Total");
            XSSFRow row = sheet.createRow(1);
            row.createCell(0).setCellValue(2d);
            row.createCell(1).setCellValue(3d);
            row.createCell(2).setCellFormula("A2*B2");
            workbook.getCreationHelper().createFormulaEvaluator().evaluateAll();
            save(workbook, file);
        }

        SheetTable table = reader.read(file, null);

        assertEquals("6", table.rows().get(0).get(2).text());
    }

    @Test
    void unknownSheetIsASchemaError() throws Exception {
        Path file = tempDir.resolve("one.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            header(workbook.createSheet("Data"), "NIP");
            save(workbook, file);
        }

        assertThrows(SchemaException.class, () -> reader.read(file, "Missing"));
    }

    private static void header(XSSFSheet sheet, String... names) {
        XSSFRow row = sheet.createRow(0);
        for (int i = 0; i < names.length; i++) {
            row.createCell(i).setCellValue(names[i]);
        }
    }

    private static void save(XSSFWorkbook workbook, Path file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            workbook.write(out);
        }
    }
}
