package io.laminar.cli.commands;

import io.laminar.cli.exception.SheetReadException;
import io.laminar.cli.io.WorkbookReader;
import io.laminar.cli.ui.AnsiStyles;
import io.laminar.core.document.ProcessDocument;
import io.laminar.core.exception.LaminarException;
import io.laminar.core.extraction.ExtractionMode;
import io.laminar.core.graph.Finding;
import io.laminar.core.graph.Severity;
import io.laminar.core.pipeline.SheetAnalysis;
import io.laminar.core.pipeline.SheetPipeline;
import io.laminar.core.template.SheetTable;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import picocli.CommandLine;

/// Checks every sheet of an input file without writing any output.
///
/// Each sheet is resolved, routed, built and validated exactly as a conversion would,
/// then its findings are printed. Fatal findings go to stderr.
///
/// ### Usage
/// ```bash
/// laminar validate process.xlsx [--sheet Orders]
/// ```
///
/// @see LaminarCommand
@CommandLine.Command(name = "validate", description = "Report findings without writing output")
class ValidateCommand extends LaminarCommand {

    @CommandLine.Parameters(
            index = "0",
            arity = "0..1",
            description = "Input file: .xlsx, .xlsm, .xls, .csv or a canonical .json document")
    Path inputFile;

    @Override
    protected int execute() {
        AnsiStyles styles = AnsiStyles.of(useColor());
        SheetPipeline pipeline = createPipeline(ExtractionMode.AUTO, false);
        try {
            requireInput(inputFile);
            if (reader.isDocument(inputFile)) {
                ProcessDocument document = reader.readDocument(inputFile);
                String name = WorkbookReader.sheetNameOf(inputFile);
                boolean valid = report(name, () -> pipeline.analyze(name, document), styles);
                return valid ? EXIT_OK : EXIT_SHEET_FAILED;
            }

            List<SheetTable> sheets = reader.readSheets(inputFile, sheetName);
            if (sheets.isEmpty()) {
                printFailure("Input", "No sheets with content in " + inputFile);
                return EXIT_USAGE;
            }
            boolean allValid = true;
            for (SheetTable sheet : sheets) {
                allValid &=
                        report(
                                sheet.name(),
                                () -> pipeline.analyze(sheet, ExtractionMode.AUTO),
                                styles);
            }
            return allValid ? EXIT_OK : EXIT_SHEET_FAILED;
        } catch (SheetReadException e) {
            printFailure("Input", e.getMessage());
            return EXIT_USAGE;
        }
    }

    /// Analyzes one sheet and prints its findings.
    ///
    /// @return whether the sheet has no fatal findings
    private boolean report(String name, Analysis analysis, AnsiStyles styles) {
        SheetAnalysis result;
        try {
            result = analysis.run();
        } catch (LaminarException | RuntimeException e) {
            printFailure(name, e.getMessage());
            return false;
        }

        List<Finding> findings = result.allFindings();
        boolean valid = result.report().isValid();
        String confidence =
                result.assessment() != null
                        ? String.format(
                                Locale.ROOT, ", confidence %.2f", result.assessment().confidence())
                        : "";
        String summary =
                "("
                        + result.process().getSteps().size()
                        + " steps, "
                        + result.process().getRoles().size()
                        + " roles"
                        + confidence
                        + ", via "
                        + result.method()
                        + ")";
        if (valid) {
            System.out.println(
                    " "
                            + styles.success("[OK]")
                            + " "
                            + name
                            + " is valid "
                            + styles.gray(summary));
        } else {
            printFailure(name, result.report().fatal().size() + " fatal finding(s) " + summary);
        }

        for (Finding finding : findings) {
            if (finding.severity() == Severity.FATAL) {
                System.err.println("   " + finding.describe());
            } else if (finding.severity() == Severity.WARNING) {
                System.out.println(" " + styles.warn("[WARN]") + " " + finding.describe());
            } else if (verbose) {
                System.out.println("   " + styles.gray(finding.describe()));
            }
        }
        return valid;
    }

    @FunctionalInterface
    private interface Analysis {
        SheetAnalysis run() throws LaminarException;
    }
}
