package io.laminar.core.pipeline;

import io.laminar.core.document.ProcessDocument;
import io.laminar.core.exception.LaminarException;
import io.laminar.core.extraction.ExtractionMode;
import io.laminar.core.template.SheetTable;

/// One unit of batch work: a sheet, or a canonical document standing in for one.
public interface SheetTask {

    /// Returns the name used for reporting and output files.
    String sheetName();

    /// Runs the task through a pipeline.
    ///
    /// @param pipeline shared pipeline, not null
    /// @return the processed sheet, never null
    /// @throws LaminarException if the sheet fails
    SheetResult run(SheetPipeline pipeline) throws LaminarException;

    /// Task for a spreadsheet sheet.
    static SheetTask of(SheetTable sheet, ExtractionMode mode) {
        return new SheetTask() {
            @Override
            public String sheetName() {
                return sheet.name();
            }

            @Override
            public SheetResult run(SheetPipeline pipeline) throws LaminarException {
                return pipeline.process(sheet, mode);
            }
        };
    }

    /// Task for a canonical document.
    static SheetTask of(String sheetName, ProcessDocument document) {
        return new SheetTask() {
            @Override
            public String sheetName() {
                return sheetName;
            }

            @Override
            public SheetResult run(SheetPipeline pipeline) throws LaminarException {
                return pipeline.process(sheetName, document);
            }
        };
    }
}
