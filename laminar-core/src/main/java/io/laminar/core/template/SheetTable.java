package io.laminar.core.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Raw contents of one sheet: a header row and data rows of cell text.
///
/// Cells are stored as trimmed strings; null cells become empty strings. Rows may be
/// shorter than the header row.
///
/// @param name sheet name, not null
/// @param headers header row, not null
/// @param rows data rows in sheet order, not null
public record SheetTable(String name, List<String> headers, List<List<String>> rows) {

    public SheetTable {
        Objects.requireNonNull(name, "name must not be null");
        headers = clean(headers);
        List<List<String>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<String> row : rows) {
                copy.add(clean(row));
            }
        }
        rows = List.copyOf(copy);
    }

    /// Returns the cell at the given position, empty when out of range.
    public String cell(int row, int column) {
        List<String> cells = rows.get(row);
        return column >= 0 && column < cells.size() ? cells.get(column) : "";
    }

    private static List<String> clean(List<String> cells) {
        if (cells == null) {
            return List.of();
        }
        List<String> copy = new ArrayList<>(cells.size());
        for (String cell : cells) {
            copy.add(cell != null ? cell.trim() : "");
        }
        return List.copyOf(copy);
    }
}
