package io.laminar.cli.commands;

import io.laminar.cli.exception.SheetReadException;
import io.laminar.cli.execution.BatchInterruptHook;
import io.laminar.cli.io.OutputDirectoryWriter;
import io.laminar.cli.ui.AnsiStyles;
import io.laminar.core.extraction.ExtractionMode;
import io.laminar.core.graph.Finding;
import io.laminar.core.graph.Severity;
import io.laminar.core.pipeline.BatchProcessor;
import io.laminar.core.pipeline.BatchSummary;
import io.laminar.core.pipeline.SheetAnalysis;
import io.laminar.core.pipeline.SheetOutcome;
import io.laminar.core.pipeline.SheetTask;
import io.quarkus.picocli.runtime.annotations.TopCommand;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Main entry point: converts every sheet of an input file into a process document and
/// a flowchart.
///
/// ### Usage
/// ```bash
/// laminar process.xlsx
/// laminar process.xlsx --sheet Orders -o ./diagrams
/// laminar free_form.xlsx --force-ai --verbose
/// ```
///
/// Subcommands:
/// - `validate` - report findings without writing files
/// - `visualize` - print one sheet as Mermaid or text
/// - `template` - print the expected sheet layout
///
/// Each sheet is processed independently; a failed sheet is reported and the others are
/// still written. On Ctrl+C no further sheets are started, finished sheets keep their
/// files and the summary lists the rest as cancelled. See {@link LaminarCommand} for exit
/// codes.
///
/// @see ValidateCommand
/// @see VisualizeCommand
/// @see TemplateCommand
@TopCommand
@Command(
        name = "laminar",
        mixinStandardHelpOptions = true,
        version = "laminar 0.1.0",
        description = "Convert spreadsheet process descriptions into swim-lane flowcharts",
        subcommands = {ValidateCommand.class, VisualizeCommand.class, TemplateCommand.class})
public class LaminarCLI extends LaminarCommand {

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    @Parameters(
            index = "0",
            arity = "0..1",
            description = "Input file: .xlsx, .xlsm, .xls, .csv or a canonical .json document")
    Path inputFile;

    @Option(
            names = {"-o", "--output"},
            description = "Output directory (default: laminar.output.dir)")
    Path outputDir;

    @Option(names = "--force-template", description = "Use the template path only")
    boolean forceTemplate;

    @Option(names = "--force-ai", description = "Use AI extraction for every sheet")
    boolean forceAi;

    @Inject
    @ConfigProperty(name = "laminar.output.dir", defaultValue = "output")
    String defaultOutputDir;

    @Override
    protected int execute() {
        if (forceTemplate && forceAi) {
            printFailure("Usage", "--force-template and --force-ai are mutually exclusive");
            return EXIT_USAGE;
        }
        ExtractionMode mode =
                forceTemplate
                        ? ExtractionMode.FORCE_TEMPLATE
                        : forceAi ? ExtractionMode.FORCE_AI : ExtractionMode.AUTO;

        List<SheetTask> tasks;
        try {
            requireInput(inputFile);
            tasks = reader.readTasks(inputFile, sheetName, mode);
        } catch (SheetReadException e) {
            printFailure("Input", e.getMessage());
            return EXIT_USAGE;
        }
        if (tasks.isEmpty()) {
            printFailure("Input", "No sheets with content in " + inputFile);
            return EXIT_USAGE;
        }

        OutputDirectoryWriter writer = new OutputDirectoryWriter(resolveOutputDir());
        System.out.println(
                "Processing " + tasks.size() + " sheet(s) from " + inputFile.getFileName());
        BatchProcessor processor =
                new BatchProcessor(createPipeline(mode, true), config.getWorkers());
        try (BatchInterruptHook hook = BatchInterruptHook.install(processor, SHUTDOWN_GRACE)) {
            BatchSummary summary = processor.run(tasks, writer);
            printSummary(summary, writer);
            return summary.exitCode();
        }
    }

    private Path resolveOutputDir() {
        if (outputDir != null) {
            return outputDir;
        }
        if (defaultOutputDir != null && !defaultOutputDir.isBlank()) {
            return Path.of(defaultOutputDir);
        }
        return Path.of("output");
    }

    private void printSummary(BatchSummary summary, OutputDirectoryWriter writer) {
        AnsiStyles styles = AnsiStyles.of(useColor());
        System.out.println();
        for (SheetOutcome outcome : summary.outcomes()) {
            switch (outcome.status()) {
                case SUCCEEDED -> {
                    SheetAnalysis analysis = outcome.result().analysis();
                    System.out.println(
                            " "
                                    + styles.success("[OK]")
                                    + " "
                                    + styles.bold(outcome.sheetName())
                                    + " "
                                    + styles.gray(
                                            "("
                                                    + analysis.process().getSteps().size()
                                                    + " steps, "
                                                    + analysis.process().getRoles().size()
                                                    + " roles, via "
                                                    + analysis.method()
                                                    + ")"));
                    System.out.println(
                            "   "
                                    + styles.arrow()
                                    + " "
                                    + writer.processFile(outcome.sheetName()));
                    System.out.println(
                            "   "
                                    + styles.arrow()
                                    + " "
                                    + writer.diagramFile(outcome.sheetName()));
                    for (Finding finding : analysis.allFindings()) {
                        if (finding.severity() == Severity.WARNING) {
                            System.out.println(
                                    " " + styles.warn("[WARN]") + " " + finding.describe());
                        }
                    }
                }
                case FAILED -> printFailure(outcome.sheetName(), outcome.error());
                case CANCELLED ->
                        System.out.println(
                                " "
                                        + styles.warn("[WARN]")
                                        + " "
                                        + outcome.sheetName()
                                        + ": cancelled");
            }
        }

        System.out.println();
        System.out.println(
                "Done: "
                        + summary.succeeded().size()
                        + " succeeded, "
                        + summary.failed().size()
                        + " failed, "
                        + summary.cancelled().size()
                        + " cancelled. Output: "
                        + writer.getDirectory().toAbsolutePath());
    }
}
