package io.laminar.cli.commands;

import io.laminar.cli.exception.SheetReadException;
import io.laminar.cli.execution.VerbosePipelineListenerFactory;
import io.laminar.cli.io.WorkbookReader;
import io.laminar.core.LaminarConfig;
import io.laminar.core.extraction.ExtractionCollaborator;
import io.laminar.core.extraction.ExtractionMode;
import io.laminar.core.pipeline.PipelineListener;
import io.laminar.core.pipeline.SheetPipeline;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine.Option;

/// Base class for the commands that read an input file.
///
/// Prints the banner, applies `--verbose`, then runs {@link #execute()} and returns its
/// result as the process exit code.
///
/// ### Exit Codes
/// | Code | Meaning |
/// |------|---------|
/// | `0` | every sheet succeeded |
/// | `1` | at least one sheet failed |
/// | `2` | usage error: missing or unreadable input, conflicting options |
///
/// @implNote Subclasses are package-private and annotated with `@Command`.
/// @see LaminarCLI
/// @see ValidateCommand
/// @see VisualizeCommand
public abstract class LaminarCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_SHEET_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String[] BANNER = {
        "",
        "  _                    _",
        " | |  __ _  _ __ ___  (_) _ __    __ _  _ __",
        " | | / _` || '_ ` _ \\ | || '_ \\  / _` || '__|",
        " | || (_| || | | | | || || | | || (_| || |",
        " |_| \\__,_||_| |_| |_||_||_| |_| \\__,_||_|",
        "",
        " Spreadsheet processes to swim-lane flowcharts",
        ""
    };

    @Option(
            names = "--sheet",
            description = "Process only this sheet of a workbook (default: every sheet)")
    protected String sheetName;

    @Option(
            names = {"-v", "--verbose"},
            description = "Print stage-by-stage progress and debug logging")
    protected boolean verbose;

    @Option(names = "--no-color", description = "Disable ANSI colors")
    protected boolean noColor;

    @Inject WorkbookReader reader;

    @Inject LaminarConfig config;

    @Inject ExtractionCollaborator collaborator;

    @Inject VerbosePipelineListenerFactory listenerFactory;

    @Override
    public final Integer call() {
        if (showBanner()) {
            for (String line : BANNER) {
                System.out.println(line);
            }
        }
        if (verbose) {
            Logger.getLogger("io.laminar").setLevel(Level.FINE);
        }
        return execute();
    }

    /// Runs the command.
    ///
    /// @return exit code, see the table above
    protected abstract int execute();

    /// Returns whether the banner is printed; commands whose output is meant for piping
    /// return false.
    protected boolean showBanner() {
        return true;
    }

    protected boolean useColor() {
        return !noColor;
    }

    /// Creates a pipeline for one command run.
    ///
    /// Forced-template runs get no collaborator, so a sheet that does not fit the template
    /// fails instead of reaching the model.
    ///
    /// @param mode extraction mode of this run, not null
    /// @param showDiagram whether a verbose listener prints each diagram
    /// @return new pipeline, never null
    protected SheetPipeline createPipeline(ExtractionMode mode, boolean showDiagram) {
        PipelineListener listener =
                verbose ? listenerFactory.create(useColor(), showDiagram) : PipelineListener.NONE;
        ExtractionCollaborator effective =
                mode == ExtractionMode.FORCE_TEMPLATE ? null : collaborator;
        return new SheetPipeline(config, effective, listener);
    }

    /// Checks that an input file was given.
    ///
    /// @param inputFile positional parameter, may be null
    /// @throws SheetReadException if it is missing
    protected static void requireInput(Path inputFile) throws SheetReadException {
        if (inputFile == null) {
            throw new SheetReadException(
                    "No input file specified. Usage: laminar <file> [--sheet NAME] [-o DIR]");
        }
    }

    /// Prints a failure line to stderr.
    protected void printFailure(String context, String message) {
        System.err.println(" [FAIL] " + context + ": " + message);
    }
}
