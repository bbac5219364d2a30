package io.laminar.core.exception;

import io.laminar.core.template.LogicalField;
import java.io.Serial;
import java.util.List;

/// Thrown when a required column cannot be found in the header row and the caller
/// insisted on the template path.
public class ColumnResolutionException extends LaminarException {

    @Serial private static final long serialVersionUID = -2871566301984425113L;

    private final transient List<LogicalField> missingFields;

    /// Creates exception for the given unresolved required fields.
    ///
    /// @param missingFields required fields without a matching column, not null
    public ColumnResolutionException(List<LogicalField> missingFields) {
        super("Required columns not found: " + describe(missingFields));
        this.missingFields = List.copyOf(missingFields);
    }

    /// Returns the required fields that had no matching column.
    ///
    /// @return unmodifiable list, never null
    public List<LogicalField> getMissingFields() {
        return missingFields;
    }

    private static String describe(List<LogicalField> fields) {
        StringBuilder sb = new StringBuilder();
        for (LogicalField field : fields) {
            if (!sb.isEmpty()) {
                sb.append(", ");
            }
            sb.append(field.key()).append(" (\"").append(field.canonicalHeader()).append("\")");
        }
        return sb.toString();
    }
}
