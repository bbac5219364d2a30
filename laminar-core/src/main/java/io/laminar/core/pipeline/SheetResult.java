package io.laminar.core.pipeline;

import io.laminar.core.document.ProcessDocument;
import java.util.Objects;

/// Output of a successfully processed sheet.
///
/// @param analysis built and validated graph with its findings, not null
/// @param document canonical document to persist, not null
/// @param diagram compiled diagram text, not null
public record SheetResult(SheetAnalysis analysis, ProcessDocument document, String diagram) {

    public SheetResult {
        Objects.requireNonNull(analysis, "analysis must not be null");
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(diagram, "diagram must not be null");
    }

    public String sheetName() {
        return analysis.sheetName();
    }
}
