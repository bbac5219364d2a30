package io.laminar.core.extraction;

import io.laminar.core.template.SheetTable;
import java.util.List;

/// Renders a sheet as semicolon-separated text for prompts.
///
/// Blank cells are written as {@value #MISSING_VALUE} so the column structure stays
/// visible; semicolons and line breaks inside cells are replaced by commas and spaces.
public final class SheetCsv {

    /// Placeholder for blank cells.
    public static final String MISSING_VALUE = "--";

    private SheetCsv() {}

    public static String render(SheetTable sheet) {
        int width = sheet.headers().size();
        for (List<String> row : sheet.rows()) {
            width = Math.max(width, row.size());
        }

        StringBuilder sb = new StringBuilder();
        appendRow(sb, sheet.headers(), width);
        for (List<String> row : sheet.rows()) {
            if (row.stream().allMatch(String::isEmpty)) {
                continue;
            }
            appendRow(sb, row, width);
        }
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, List<String> cells, int width) {
        for (int i = 0; i < width; i++) {
            if (i > 0) {
                sb.append(';');
            }
            String cell = i < cells.size() ? cells.get(i) : "";
            sb.append(cell.isEmpty() ? MISSING_VALUE : clean(cell));
        }
        sb.append('\n');
    }

    private static String clean(String cell) {
        return cell.replace(';', ',').replaceAll("[\\r\\n]+", " ");
    }
}
