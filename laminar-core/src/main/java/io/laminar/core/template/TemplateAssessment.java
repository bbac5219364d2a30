package io.laminar.core.template;

import java.util.List;

/// Score of how well a sheet matches the expected template shape.
///
/// @param confidence weighted score in `[0, 1]`, capped when a required field is missing
/// @param requiredCoverage fraction of required fields resolved
/// @param completeness fraction of rows with every resolved required field filled in
/// @param terminalMarker `1` if a START/END/ABORT marker appears, else `0`
/// @param consistency fraction of references that match something in the sheet
/// @param missingRequired required fields without a column, not null
public record TemplateAssessment(
        double confidence,
        double requiredCoverage,
        double completeness,
        double terminalMarker,
        double consistency,
        List<LogicalField> missingRequired) {

    public TemplateAssessment {
        missingRequired = missingRequired != null ? List.copyOf(missingRequired) : List.of();
    }

    /// Returns whether the sheet should take the template path.
    ///
    /// @param threshold minimum confidence
    public boolean meets(double threshold) {
        return confidence >= threshold;
    }
}
