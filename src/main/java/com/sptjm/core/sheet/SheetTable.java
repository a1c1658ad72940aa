package com.sptjm.core.sheet;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Header row plus data rows of one worksheet, detached from the workbook it came from.
 */
public final class SheetTable {

    /**
     * One cell: its display text and, for numeric cells, the exact value.
     */
    public record Cell(String text, BigDecimal number) {
        public static final Cell EMPTY = new Cell("", null);

        public Cell {
            text = text == null ? "" : text.trim();
        }

        public static Cell text(String value) {
            return value == null || value.isBlank() ? EMPTY : new Cell(value, null);
        }

        public boolean isBlank() {
            return text.isEmpty() && number == null;
        }
    }

    private final List<String> headers;
    private final List<List<Cell>> rows;

    public SheetTable(List<String> headers, List<List<Cell>> rows) {
        List<String> trimmed = new ArrayList<>(headers.size());
        for (String header : headers) {
            trimmed.add(header == null ? "" : header.trim());
        }
        this.headers = List.copyOf(trimmed);
        List<List<Cell>> copy = new ArrayList<>(rows.size());
        for (List<Cell> row : rows) {
            copy.add(List.copyOf(row));
        }
        this.rows = List.copyOf(copy);
    }

    /**
     * Builds a table from plain strings; every value is treated as text.
     */
    public static SheetTable ofText(List<String> headers, List<List<String>> rows) {
        List<List<Cell>> cells = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<Cell> converted = new ArrayList<>(row.size());
            for (String value : row) {
                converted.add(Cell.text(value));
            }
            cells.add(converted);
        }
        return new SheetTable(headers, cells);
    }

    public List<String> headers() {
        return headers;
    }

    public List<List<Cell>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * Index of the first header equal to {@code name}, or -1.
     */
    public int indexOf(String name) {
        return headers.indexOf(name);
    }

    /**
     * Index of the first header equal to {@code name} ignoring case, or -1.
     */
    public int indexOfIgnoreCase(String name) {
        for (int i = 0; i < headers.size(); i++) {
            if (headers.get(i).equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    static Cell cell(List<Cell> row, int index) {
        if (index < 0 || index >= row.size()) {
            return Cell.EMPTY;
        }
        Cell cell = row.get(index);
        return cell == null ? Cell.EMPTY : cell;
    }
}
