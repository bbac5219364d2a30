package io.laminar.core.extraction;

/// How a sheet is turned into a process graph.
public enum ExtractionMode {
    /// Template path when the sheet scores at or above the threshold, AI otherwise.
    AUTO,
    /// Template path only; low confidence or missing columns fail the sheet.
    FORCE_TEMPLATE,
    /// AI path only; scoring is skipped.
    FORCE_AI
}
