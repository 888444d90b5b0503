package com.eyelevel.labmigrator.service.transform.spreadsheet;

import java.util.List;
import java.util.Set;

/**
 * A rectangular-ish block of cell texts. Rows may differ in length; missing cells are empty.
 *
 * @param name         The sheet name as it came from Labfolder, not yet made safe for Excel.
 * @param numericCells Cells whose source value was a number; all other cells are text.
 */
public record SheetGrid(String name, List<List<String>> rows, Set<Position> numericCells) {

    public SheetGrid {
        rows = rows.stream().map(List::copyOf).toList();
        numericCells = Set.copyOf(numericCells);
    }

    public SheetGrid(String name, List<List<String>> rows) {
        this(name, rows, Set.of());
    }

    public boolean isNumeric(int row, int column) {
        return numericCells.contains(new Position(row, column));
    }

    public int columnCount() {
        return rows.stream().mapToInt(List::size).max().orElse(0);
    }

    public boolean isEmpty() {
        return rows.stream().flatMap(List::stream).allMatch(cell -> cell == null || cell.isEmpty());
    }

    public record Position(int row, int column) {
    }
}
