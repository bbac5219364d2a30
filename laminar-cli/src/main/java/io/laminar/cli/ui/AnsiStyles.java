package io.laminar.cli.ui;

import io.laminar.core.graph.Finding;
import io.laminar.core.graph.Severity;

/// ANSI styling for terminal output.
///
/// Every method returns the styled string; printing is left to the caller. With colors
/// disabled the text is returned unchanged, which keeps output usable in pipes and files.
///
/// ```java
/// AnsiStyles styles = AnsiStyles.of(true);
/// System.out.println(styles.success("[OK]") + " " + styles.bold("Orders"));
/// ```
///
/// @implNote Immutable and thread-safe.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String DIM = "\033[38;5;241m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private static final String RULE = "─".repeat(61);

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// Creates styles with or without ANSI codes.
    ///
    /// @param useColor true to apply ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public boolean isColorEnabled() {
        return useColor;
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    public String bold(String text) {
        return style(text, BOLD);
    }

    /// Secondary text such as ids and counts.
    public String gray(String text) {
        return style(text, GRAY);
    }

    public String dim(String text) {
        return style(text, DIM);
    }

    public String success(String text) {
        return style(text, GREEN);
    }

    public String error(String text) {
        return style(text, RED);
    }

    public String warn(String text) {
        return style(text, YELLOW);
    }

    /// Highlight for sheet names and chosen routes.
    public String accent(String text) {
        return style(text, BLUE);
    }

    /// Colors green on success, red on failure.
    public String successOrError(String text, boolean isSuccess) {
        return style(text, isSuccess ? GREEN : RED);
    }

    /// Colors a finding by severity: red for fatal, yellow for warnings, gray for notes.
    public String finding(Finding finding) {
        String text = finding.describe();
        if (finding.severity() == Severity.FATAL) {
            return error(text);
        }
        return finding.severity() == Severity.WARNING ? warn(text) : gray(text);
    }

    /// Right arrow between a step and its successor.
    public String arrow() {
        return style("→", BLUE);
    }

    public String bullet() {
        return style("•", GRAY);
    }

    public String separatorTop() {
        return style("┌" + RULE, DIM);
    }

    public String separatorMid() {
        return style(" " + RULE, DIM);
    }

    public String separatorBottom() {
        return style("└" + RULE, DIM);
    }
}
