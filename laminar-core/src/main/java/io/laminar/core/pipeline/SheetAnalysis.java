package io.laminar.core.pipeline;

import io.laminar.core.extraction.ExtractionMethod;
import io.laminar.core.graph.Finding;
import io.laminar.core.graph.ValidationReport;
import io.laminar.core.model.Process;
import io.laminar.core.template.TemplateAssessment;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// A built and validated, but not yet compiled, sheet.
///
/// @param sheetName source sheet, not null
/// @param process built graph, not null
/// @param method extraction path taken, not null
/// @param assessment template score, null when scoring was skipped
/// @param buildFindings column and build notes, not null
/// @param report validation findings, not null
public record SheetAnalysis(
        String sheetName,
        Process process,
        ExtractionMethod method,
        TemplateAssessment assessment,
        List<Finding> buildFindings,
        ValidationReport report) {

    public SheetAnalysis {
        Objects.requireNonNull(sheetName, "sheetName must not be null");
        Objects.requireNonNull(process, "process must not be null");
        Objects.requireNonNull(method, "method must not be null");
        buildFindings = buildFindings != null ? List.copyOf(buildFindings) : List.of();
        Objects.requireNonNull(report, "report must not be null");
    }

    /// Returns build notes followed by validation findings.
    public List<Finding> allFindings() {
        List<Finding> all = new ArrayList<>(buildFindings);
        all.addAll(report.findings());
        return all;
    }
}
