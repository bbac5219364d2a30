package io.laminar.core.template;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/// A data row re-keyed by logical field.
///
/// @param rowNumber 1-based position of the row among the sheet's data rows
/// @param values non-empty cell values by field
public record CanonicalRow(int rowNumber, Map<LogicalField, String> values) {

    public CanonicalRow {
        EnumMap<LogicalField, String> copy = new EnumMap<>(LogicalField.class);
        if (values != null) {
            values.forEach(
                    (field, value) -> {
                        if (value != null && !value.isBlank()) {
                            copy.put(field, value.trim());
                        }
                    });
        }
        values = Collections.unmodifiableMap(copy);
    }

    /// Returns the trimmed value of a field, or an empty string.
    public String get(LogicalField field) {
        return values.getOrDefault(field, "");
    }

    public boolean has(LogicalField field) {
        return values.containsKey(field);
    }

    /// Returns whether every resolved column of this row was blank.
    public boolean isBlank() {
        return values.isEmpty();
    }
}
