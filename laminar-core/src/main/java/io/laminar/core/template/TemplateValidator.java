package io.laminar.core.template;

import io.laminar.core.model.TerminalKind;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;

/// Scores a resolved sheet against the expected template shape.
///
/// | Component | Weight |
/// |-----------|--------|
/// | required fields resolved | 0.60 |
/// | rows with all resolved required cells filled | 0.15 |
/// | a START/END/ABORT marker present | 0.10 |
/// | next/yes/no references that match an id, row number, title or terminal | 0.15 |
///
/// The result is clamped to `[0, 1]` and capped at {@value #MISSING_REQUIRED_CEILING}
/// when any required field is unresolved. A sheet without data rows scores zero
/// completeness; a sheet without references scores full consistency.
public final class TemplateValidator {

    private static final Logger logger = Logger.getLogger(TemplateValidator.class.getName());

    static final double REQUIRED_WEIGHT = 0.60;
    static final double COMPLETENESS_WEIGHT = 0.15;
    static final double TERMINAL_WEIGHT = 0.10;
    static final double CONSISTENCY_WEIGHT = 0.15;

    /// Upper bound of the score when a required column is missing.
    public static final double MISSING_REQUIRED_CEILING = 0.3;

    private static final List<LogicalField> REFERENCE_FIELDS =
            List.of(LogicalField.NEXT_STEP, LogicalField.YES_NEXT, LogicalField.NO_NEXT);

    /// Computes the confidence of a resolved sheet.
    ///
    /// @param resolution header resolution, not null
    /// @param rows non-blank canonical rows, not null
    /// @return assessment, never null
    public TemplateAssessment assess(ColumnResolution resolution, List<CanonicalRow> rows) {
        List<LogicalField> required = LogicalField.required();
        List<LogicalField> missing = resolution.missingRequired();

        double requiredCoverage = (double) (required.size() - missing.size()) / required.size();
        double completeness = completeness(resolution, rows);
        double terminal = hasTerminalMarker(rows) ? 1.0 : 0.0;
        double consistency = consistency(rows);

        double score =
                REQUIRED_WEIGHT * requiredCoverage
                        + COMPLETENESS_WEIGHT * completeness
                        + TERMINAL_WEIGHT * terminal
                        + CONSISTENCY_WEIGHT * consistency;
        score = Math.max(0.0, Math.min(1.0, score));
        if (!missing.isEmpty()) {
            score = Math.min(score, MISSING_REQUIRED_CEILING);
        }

        double confidence = score;
        logger.fine(
                () ->
                        String.format(
                                Locale.ROOT,
                                "confidence=%.3f required=%.2f completeness=%.2f terminal=%.0f"
                                        + " consistency=%.2f",
                                confidence,
                                requiredCoverage,
                                completeness,
                                terminal,
                                consistency));
        return new TemplateAssessment(
                confidence, requiredCoverage, completeness, terminal, consistency, missing);
    }

    private double completeness(ColumnResolution resolution, List<CanonicalRow> rows) {
        List<LogicalField> present =
                LogicalField.required().stream().filter(resolution::isResolved).toList();
        if (rows.isEmpty() || present.isEmpty()) {
            return 0.0;
        }
        long complete = rows.stream().filter(row -> present.stream().allMatch(row::has)).count();
        return (double) complete / rows.size();
    }

    private boolean hasTerminalMarker(List<CanonicalRow> rows) {
        for (CanonicalRow row : rows) {
            if (TerminalKind.fromMarker(row.get(LogicalField.STEP_ID)).isPresent()) {
                return true;
            }
            for (LogicalField field : REFERENCE_FIELDS) {
                if (TerminalKind.fromMarker(row.get(field)).isPresent()) {
                    return true;
                }
            }
        }
        return false;
    }

    private double consistency(List<CanonicalRow> rows) {
        Set<String> ids = new HashSet<>();
        Set<String> titles = new HashSet<>();
        Set<String> rowNumbers = new HashSet<>();
        for (CanonicalRow row : rows) {
            String id = row.get(LogicalField.STEP_ID);
            if (!id.isEmpty()) {
                ids.add(id.toLowerCase(Locale.ROOT));
                ids.add(TerminalKind.stripPrefix(id).toLowerCase(Locale.ROOT));
            }
            String title = row.get(LogicalField.STEP_TITLE);
            if (!title.isEmpty()) {
                titles.add(title.toLowerCase(Locale.ROOT));
            }
            rowNumbers.add(Integer.toString(row.rowNumber()));
        }

        int references = 0;
        int matched = 0;
        for (CanonicalRow row : rows) {
            for (LogicalField field : REFERENCE_FIELDS) {
                String ref = row.get(field);
                if (ref.isEmpty()) {
                    continue;
                }
                references++;
                String lower = ref.toLowerCase(Locale.ROOT);
                if (TerminalKind.fromToken(ref).isPresent()
                        || ids.contains(lower)
                        || ids.contains(TerminalKind.stripPrefix(lower))
                        || rowNumbers.contains(ref)
                        || titles.contains(lower)) {
                    matched++;
                }
            }
        }
        return references == 0 ? 1.0 : (double) matched / references;
    }
}
