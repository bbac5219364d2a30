package io.laminar.core.pipeline;

import io.laminar.core.exception.LaminarException;
import io.laminar.core.extraction.ExtractionMethod;
import io.laminar.core.graph.ValidationReport;
import io.laminar.core.model.Process;
import io.laminar.core.template.TemplateAssessment;

/// Listener for per-sheet pipeline events.
///
/// All methods have default no-op implementations, so listeners override only what they
/// need. For one sheet the callbacks arrive in this order:
///
/// ```
/// onSheetStarted(sheet)
/// onAssessed(sheet, assessment)     (skipped in forced-AI mode and for documents)
/// onRouted(sheet, method)
/// onGraphBuilt(sheet, process)
/// onValidated(sheet, report)
/// onSheetCompleted(result)          or onSheetFailed(sheet, error)
/// ```
///
/// @implNote Sheets run concurrently, so implementations must be thread-safe.
public interface PipelineListener {

    /// Listener that ignores every event.
    PipelineListener NONE = new PipelineListener() {};

    default void onSheetStarted(String sheetName) {}

    /// Called after the sheet was scored against the template shape.
    ///
    /// @param sheetName sheet being processed, not null
    /// @param assessment template score, not null
    default void onAssessed(String sheetName, TemplateAssessment assessment) {}

    /// Called once the extraction path is chosen.
    default void onRouted(String sheetName, ExtractionMethod method) {}

    default void onGraphBuilt(String sheetName, Process process) {}

    /// Called after validation, including when it found fatal problems.
    ///
    /// @param sheetName sheet being processed, not null
    /// @param report validation findings, not null
    default void onValidated(String sheetName, ValidationReport report) {}

    default void onSheetCompleted(SheetResult result) {}

    /// Called when the sheet fails.
    ///
    /// @param sheetName sheet being processed, not null
    /// @param error the failure, not null
    default void onSheetFailed(String sheetName, LaminarException error) {}
}
