package com.sptjm.core.sheet;

import com.sptjm.logging.AppLogger;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Loads worksheets from {@code .xlsx}/{@code .xls} files into {@link SheetTable}s.
 */
public final class WorkbookTableReader {
    private static final Logger LOGGER = AppLogger.get();

    private final DataFormatter formatter = new DataFormatter();

    public List<String> sheetNames(Path workbookFile) throws IOException {
        try (InputStream in = Files.newInputStream(workbookFile);
             Workbook workbook = WorkbookFactory.create(in)) {
            List<String> names = new ArrayList<>();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                names.add(workbook.getSheetName(i));
            }
            return names;
        }
    }

    /**
     * Reads one sheet. The first row is the header; trailing empty rows are dropped.
     *
     * @param sheetName sheet to read, or {@code null} for the first sheet
     */
    public SheetTable read(Path workbookFile, String sheetName) throws IOException, SchemaException {
        try (InputStream in = Files.newInputStream(workbookFile)) {
            return read(in, sheetName);
        }
    }

    public SheetTable read(InputStream in, String sheetName) throws IOException, SchemaException {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new SchemaException("Workbook has no sheets");
            }
            Sheet sheet = sheetName == null ? workbook.getSheetAt(0) : workbook.getSheet(sheetName);
            if (sheet == null) {
                throw new SchemaException("Sheet not found: " + sheetName);
            }
            return toTable(sheet);
        }
    }

    private SheetTable toTable(Sheet sheet) {
        Row headerRow = sheet.getRow(sheet.getFirstRowNum());
        if (headerRow == null) {
            return new SheetTable(List.of(), List.of());
        }
        List<String> headers = new ArrayList<>();
        int width = Math.max(headerRow.getLastCellNum(), 0);
        for (int c = 0; c < width; c++) {
            headers.add(readCell(headerRow.getCell(c)).text());
        }

        List<List<SheetTable.Cell>> rows = new ArrayList<>();
        int lastNonBlank = -1;
        for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            List<SheetTable.Cell> cells = new ArrayList<>(width);
            boolean blank = true;
            for (int c = 0; c < width; c++) {
                SheetTable.Cell cell = row == null ? SheetTable.Cell.EMPTY : readCell(row.getCell(c));
                blank &= cell.isBlank();
                cells.add(cell);
            }
            rows.add(cells);
            if (!blank) {
                lastNonBlank = rows.size() - 1;
            }
        }
        List<List<SheetTable.Cell>> trimmed = rows.subList(0, lastNonBlank + 1);
        LOGGER.fine(() -> "Read sheet '%s': %d columns, %d rows".formatted(sheet.getSheetName(), headers.size(), trimmed.size()));
        return new SheetTable(headers, trimmed);
    }

    private SheetTable.Cell readCell(Cell cell) {
        if (cell == null) {
            return SheetTable.Cell.EMPTY;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        if (type == CellType.NUMERIC && !DateUtil.isCellDateFormatted(cell)) {
            BigDecimal value = BigDecimal.valueOf(cell.getNumericCellValue());
            if (value.signum() == 0 || value.stripTrailingZeros().scale() <= 0) {
                // integral identifiers (NIP, account numbers) must not turn into 1.97E+17
                return new SheetTable.Cell(value.setScale(0).toPlainString(), value.setScale(0));
            }
            return new SheetTable.Cell(value.stripTrailingZeros().toPlainString(), value);
        }
        if (type == CellType.BLANK || type == CellType.ERROR) {
            return SheetTable.Cell.EMPTY;
        }
        if (cell.getCellType() == CellType.FORMULA) {
            // DataFormatter would print the formula itself without an evaluator
            return switch (type) {
                case STRING -> SheetTable.Cell.text(cell.getStringCellValue());
                case BOOLEAN -> SheetTable.Cell.text(String.valueOf(cell.getBooleanCellValue()));
                default -> SheetTable.Cell.text(formatter.formatCellValue(cell));
            };
        }
        return SheetTable.Cell.text(formatter.formatCellValue(cell));
    }
}
