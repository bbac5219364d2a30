package io.laminar.core.graph;

import io.laminar.core.model.TerminalKind;
import io.laminar.core.template.CanonicalRow;
import io.laminar.core.template.LogicalField;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/// Decides which step variant a row becomes.
///
/// Precedence, first match wins:
/// 1. **Condition**: the title ends with `?`, a yes/no branch is filled in, the id carries
///    the `CONDITION::` prefix, or the condition cell holds one of
///    `yes, true, 1, x, condition, decision`
/// 2. **Terminal**: the id or title is `START`, `END` or `ABORT`, bare or as sentinel id
/// 3. **Action**: everything else
public final class RowClassifier {

    static final Set<String> CONDITION_MARKERS =
            Set.of("yes", "true", "1", "x", "condition", "decision");

    private RowClassifier() {}

    /// Classifies a sheet row.
    public static RowKind classify(CanonicalRow row) {
        return classify(
                row.get(LogicalField.STEP_ID),
                row.get(LogicalField.STEP_TITLE),
                row.has(LogicalField.YES_NEXT) || row.has(LogicalField.NO_NEXT),
                row.get(LogicalField.IS_CONDITION));
    }

    /// Classifies a step from its parts.
    ///
    /// @param id step id, may be empty
    /// @param title step title, may be empty
    /// @param hasBranch whether a yes or no successor is given
    /// @param conditionMarker content of the condition column, may be null
    /// @return the variant, never null
    public static RowKind classify(
            String id, String title, boolean hasBranch, String conditionMarker) {
        String safeId = id != null ? id.trim() : "";
        String safeTitle = title != null ? title.trim() : "";

        if (safeTitle.endsWith("?")
                || hasBranch
                || safeId.toUpperCase(Locale.ROOT).startsWith(TerminalKind.CONDITION_PREFIX)
                || isConditionMarker(conditionMarker)) {
            return RowKind.CONDITION;
        }
        if (terminalKind(safeId, safeTitle).isPresent()) {
            return RowKind.TERMINAL;
        }
        return RowKind.ACTION;
    }

    /// Returns the terminal kind named by the id, or failing that by the title.
    public static Optional<TerminalKind> terminalKind(String id, String title) {
        Optional<TerminalKind> byId = TerminalKind.fromMarker(id);
        return byId.isPresent() ? byId : TerminalKind.fromMarker(title);
    }

    private static boolean isConditionMarker(String cell) {
        return cell != null && CONDITION_MARKERS.contains(cell.trim().toLowerCase(Locale.ROOT));
    }
}
