package io.laminar.cli.commands;

import io.laminar.cli.exception.SheetReadException;
import io.laminar.cli.io.WorkbookReader;
import io.laminar.cli.visualizer.ProcessVisualizer;
import io.laminar.core.exception.LaminarException;
import io.laminar.core.extraction.ExtractionMode;
import io.laminar.core.graph.Finding;
import io.laminar.core.pipeline.SheetAnalysis;
import io.laminar.core.pipeline.SheetPipeline;
import io.laminar.core.template.SheetTable;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.util.List;
import picocli.CommandLine;

/// Prints one sheet as a diagram or a text listing.
///
/// Without `--sheet` the first sheet with content is shown. The output carries no banner
/// so it can be redirected straight into a `.mmd` file.
///
/// A Mermaid diagram is only printed for a graph without fatal findings. The text listing
/// is printed either way, which helps to locate a broken reference.
///
/// ### Usage
/// ```bash
/// laminar visualize process.xlsx --sheet Orders > orders.mmd
/// laminar visualize process.xlsx --format text
/// ```
@CommandLine.Command(name = "visualize", description = "Print a sheet as Mermaid or text")
class VisualizeCommand extends LaminarCommand {

    @CommandLine.Parameters(
            index = "0",
            arity = "0..1",
            description = "Input file: .xlsx, .xlsm, .xls, .csv or a canonical .json document")
    Path inputFile;

    @CommandLine.Option(
            names = "--format",
            defaultValue = "mermaid",
            description = "Output format: mermaid, text")
    String format;

    @Inject ProcessVisualizer visualizer;

    @Override
    protected boolean showBanner() {
        return false;
    }

    @Override
    protected int execute() {
        SheetPipeline pipeline = createPipeline(ExtractionMode.AUTO, false);
        SheetAnalysis analysis;
        try {
            requireInput(inputFile);
            analysis = analyze(pipeline);
        } catch (SheetReadException e) {
            printFailure("Input", e.getMessage());
            return EXIT_USAGE;
        } catch (LaminarException | RuntimeException e) {
            printFailure("Visualization failed", e.getMessage());
            return EXIT_SHEET_FAILED;
        }

        boolean valid = analysis.report().isValid();
        if (!valid) {
            printFailure(
                    analysis.sheetName(),
                    analysis.report().fatal().size() + " fatal finding(s)");
            for (Finding finding : analysis.report().fatal()) {
                System.err.println("   " + finding.describe());
            }
            if (!"text".equals(format)) {
                return EXIT_SHEET_FAILED;
            }
        }

        try {
            System.out.print(visualizer.visualize(analysis.process(), format, useColor()));
        } catch (IllegalArgumentException e) {
            printFailure("Usage", e.getMessage());
            return EXIT_USAGE;
        }
        return valid ? EXIT_OK : EXIT_SHEET_FAILED;
    }

    private SheetAnalysis analyze(SheetPipeline pipeline) throws LaminarException {
        if (reader.isDocument(inputFile)) {
            return pipeline.analyze(
                    WorkbookReader.sheetNameOf(inputFile), reader.readDocument(inputFile));
        }
        List<SheetTable> sheets = reader.readSheets(inputFile, sheetName);
        if (sheets.isEmpty()) {
            throw new SheetReadException("No sheets with content in " + inputFile);
        }
        if (sheets.size() > 1) {
            System.err.println(
                    "Showing sheet '"
                            + sheets.get(0).name()
                            + "' of "
                            + sheets.size()
                            + "; select another with --sheet");
        }
        return pipeline.analyze(sheets.get(0), ExtractionMode.AUTO);
    }
}
