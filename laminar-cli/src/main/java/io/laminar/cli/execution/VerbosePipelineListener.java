package io.laminar.cli.execution;

import io.laminar.cli.ui.AnsiStyles;
import io.laminar.core.exception.LaminarException;
import io.laminar.core.extraction.ExtractionMethod;
import io.laminar.core.graph.Finding;
import io.laminar.core.graph.ValidationReport;
import io.laminar.core.model.Process;
import io.laminar.core.pipeline.PipelineListener;
import io.laminar.core.pipeline.SheetResult;
import io.laminar.core.template.LogicalField;
import io.laminar.core.template.TemplateAssessment;
import java.io.PrintStream;
import java.util.Locale;
import java.util.stream.Collectors;

/// Pipeline listener that prints stage-by-stage progress to the terminal.
///
/// ### Output Format
/// ```
///   [Orders] started
///   [Orders] confidence 0.92 (coverage 1.00, complete 0.95, terminals 1, refs 0.88)
///   [Orders] route → TEMPLATE
///   [Orders] graph: 12 steps, 3 roles, 14 edges
///   [Orders] validation: 0 fatal, 1 warning(s)
///            UNREACHABLE_STEP at step '9': Step cannot be reached from START
/// ┌─────────────────────────────────────────────────────────────
///   * DIAGRAM [Orders]
///  ─────────────────────────────────────────────────────────────
///   flowchart TD
///   ...
/// └─────────────────────────────────────────────────────────────
/// ```
///
/// @implNote Thread-safe. Every event is printed under a lock, so lines of concurrent
/// sheets never interleave; events of different sheets may alternate.
/// @see VerbosePipelineListenerFactory
public class VerbosePipelineListener implements PipelineListener {

    private final PrintStream out;
    private final AnsiStyles styles;
    private final boolean showDiagram;

    /// Creates a verbose listener.
    ///
    /// @param out output stream, typically System.out, not null
    /// @param useColor whether to apply ANSI color codes
    /// @param showDiagram whether to print each compiled diagram
    public VerbosePipelineListener(PrintStream out, boolean useColor, boolean showDiagram) {
        this.out = out;
        this.styles = AnsiStyles.of(useColor);
        this.showDiagram = showDiagram;
    }

    @Override
    public synchronized void onSheetStarted(String sheetName) {
        out.printf("  %s started%n", tag(sheetName));
    }

    @Override
    public synchronized void onAssessed(String sheetName, TemplateAssessment assessment) {
        out.printf(
                Locale.ROOT,
                "  %s confidence %s %s%n",
                tag(sheetName),
                styles.bold(String.format(Locale.ROOT, "%.2f", assessment.confidence())),
                styles.gray(
                        String.format(
                                Locale.ROOT,
                                "(coverage %.2f, complete %.2f, terminals %.0f, refs %.2f)",
                                assessment.requiredCoverage(),
                                assessment.completeness(),
                                assessment.terminalMarker(),
                                assessment.consistency())));
        if (!assessment.missingRequired().isEmpty()) {
            out.printf(
                    "  %s %s%n",
                    tag(sheetName),
                    styles.warn(
                            "missing columns: "
                                    + assessment.missingRequired().stream()
                                            .map(LogicalField::canonicalHeader)
                                            .collect(Collectors.joining(", "))));
        }
    }

    @Override
    public synchronized void onRouted(String sheetName, ExtractionMethod method) {
        out.printf(
                "  %s route %s %s%n",
                tag(sheetName),
                styles.arrow(),
                styles.accent(method.name()));
    }

    @Override
    public synchronized void onGraphBuilt(String sheetName, Process process) {
        out.printf(
                "  %s graph: %d steps, %d roles, %d edges%n",
                tag(sheetName),
                process.getSteps().size(),
                process.getRoles().size(),
                process.edgeCount());
    }

    @Override
    public synchronized void onValidated(String sheetName, ValidationReport report) {
        String counts =
                report.fatal().size() + " fatal, " + report.warnings().size() + " warning(s)";
        out.printf(
                "  %s validation: %s%n",
                tag(sheetName),
                styles.successOrError(counts, report.isValid()));
        String indent = " ".repeat(sheetName.length() + 5);
        for (Finding finding : report.findings()) {
            out.println(indent + styles.finding(finding));
        }
    }

    @Override
    public synchronized void onSheetCompleted(SheetResult result) {
        out.printf("  %s %s%n", tag(result.sheetName()), styles.success("completed"));
        if (showDiagram) {
            out.println(styles.separatorTop());
            out.printf(
                    "  %s %s [%s]%n",
                    styles.accent("*"),
                    styles.bold("DIAGRAM"),
                    result.sheetName());
            out.println(styles.separatorMid());
            for (String line : result.diagram().split("\n")) {
                out.println("  " + styles.gray(line));
            }
            out.println(styles.separatorBottom());
            out.println();
        }
    }

    @Override
    public synchronized void onSheetFailed(String sheetName, LaminarException error) {
        out.printf("  %s %s %s%n", tag(sheetName), styles.error("failed:"), error.getMessage());
    }

    private String tag(String sheetName) {
        return styles.dim("[") + styles.bold(sheetName) + styles.dim("]");
    }
}
