package io.laminar.core.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/// Outcome of resolving a header row.
///
/// @implNote Immutable.
/// @see ColumnResolver#resolve
public final class ColumnResolution {

    private final Map<LogicalField, Integer> columns;
    private final Set<LogicalField> unresolved;
    private final List<String> notes;
    private final List<String> unmatchedHeaders;

    ColumnResolution(
            Map<LogicalField, Integer> columns, List<String> notes, List<String> unmatchedHeaders) {
        EnumMap<LogicalField, Integer> copy = new EnumMap<>(LogicalField.class);
        copy.putAll(columns);
        this.columns = Collections.unmodifiableMap(copy);

        EnumSet<LogicalField> missing = EnumSet.allOf(LogicalField.class);
        missing.removeAll(columns.keySet());
        this.unresolved = Collections.unmodifiableSet(missing);

        this.notes = List.copyOf(notes);
        this.unmatchedHeaders = List.copyOf(unmatchedHeaders);
    }

    /// Returns the column index of a field.
    public OptionalInt columnOf(LogicalField field) {
        Integer index = columns.get(field);
        return index != null ? OptionalInt.of(index) : OptionalInt.empty();
    }

    public boolean isResolved(LogicalField field) {
        return columns.containsKey(field);
    }

    /// Returns the resolved columns by field.
    public Map<LogicalField, Integer> columns() {
        return columns;
    }

    /// Returns every field without a column, required or not.
    public Set<LogicalField> unresolved() {
        return unresolved;
    }

    /// Returns the required fields without a column, in declaration order.
    public List<LogicalField> missingRequired() {
        List<LogicalField> missing = new ArrayList<>();
        for (LogicalField field : LogicalField.required()) {
            if (!columns.containsKey(field)) {
                missing.add(field);
            }
        }
        return missing;
    }

    /// Returns ambiguity notes, one per column that lost to an earlier one.
    public List<String> notes() {
        return notes;
    }

    /// Returns headers that matched no field.
    public List<String> unmatchedHeaders() {
        return unmatchedHeaders;
    }

    /// Re-keys the data rows of a sheet by logical field, dropping blank rows.
    ///
    /// Row numbers count every data row of the sheet, blank ones included, so they match
    /// what a reader of the sheet sees.
    ///
    /// @param table sheet contents, not null
    /// @return non-blank canonical rows in sheet order, never null
    public List<CanonicalRow> canonicalize(SheetTable table) {
        List<CanonicalRow> result = new ArrayList<>();
        for (int r = 0; r < table.rows().size(); r++) {
            Map<LogicalField, String> values = new EnumMap<>(LogicalField.class);
            for (Map.Entry<LogicalField, Integer> entry : columns.entrySet()) {
                values.put(entry.getKey(), table.cell(r, entry.getValue()));
            }
            CanonicalRow row = new CanonicalRow(r + 1, values);
            if (!row.isBlank()) {
                result.add(row);
            }
        }
        return result;
    }
}
