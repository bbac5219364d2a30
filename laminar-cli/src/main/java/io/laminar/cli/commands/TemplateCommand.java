package io.laminar.cli.commands;

import io.laminar.cli.ui.AnsiStyles;
import io.laminar.core.LaminarConfig;
import io.laminar.core.template.AliasTable;
import io.laminar.core.template.LogicalField;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine;

/// Prints the sheet layout the template path expects.
///
/// The column table lists every logical column with the header texts accepted for it,
/// configured aliases included. With `--csv` only a ready-to-fill example sheet is
/// printed, which can be saved and opened in a spreadsheet application.
///
/// ### Usage
/// ```bash
/// laminar template
/// laminar template --csv > process.csv
/// ```
@CommandLine.Command(name = "template", description = "Print the expected template layout")
class TemplateCommand implements Callable<Integer> {

    static final List<String> EXAMPLE_HEADERS =
            List.of(
                    LogicalField.STEP_ID.canonicalHeader(),
                    LogicalField.ROLE.canonicalHeader(),
                    LogicalField.STEP_TITLE.canonicalHeader(),
                    LogicalField.NEXT_STEP.canonicalHeader(),
                    LogicalField.YES_NEXT.canonicalHeader(),
                    LogicalField.NO_NEXT.canonicalHeader(),
                    LogicalField.NOTES.canonicalHeader());

    static final List<List<String>> EXAMPLE_ROWS =
            List.of(
                    List.of("START", "", "Start", "1", "", "", ""),
                    List.of("1", "Customer", "Submit order", "2", "", "", "Via web form"),
                    List.of("2", "Sales Clerk", "Order complete?", "", "3", "4", ""),
                    List.of("3", "Warehouse", "Ship order", "END", "", "", "Same day; Tracked"),
                    List.of("4", "Customer", "Provide missing details", "2", "", "", ""),
                    List.of("END", "", "End", "", "", "", ""));

    @CommandLine.Option(names = "--csv", description = "Print an example sheet as CSV only")
    boolean csv;

    @CommandLine.Option(names = "--no-color", description = "Disable ANSI colors")
    boolean noColor;

    @Inject LaminarConfig config;

    @Override
    public Integer call() {
        if (csv) {
            System.out.print(exampleCsv());
            return LaminarCommand.EXIT_OK;
        }

        AnsiStyles styles = AnsiStyles.of(!noColor);
        AliasTable aliases = config.getAliases();
        System.out.println(styles.bold("Expected sheet layout") + " (first row holds the headers)");
        System.out.println();
        System.out.println(
                String.format(
                        Locale.ROOT, " %-15s %-9s %s", "Column", "Required", "Also accepted"));
        for (LogicalField field : LogicalField.values()) {
            List<String> accepted = new ArrayList<>(aliases.aliasesOf(field));
            String required = field.isRequired() ? "yes" : "";
            System.out.println(
                    " "
                            + styles.accent(
                                    String.format(Locale.ROOT, "%-15s", field.canonicalHeader()))
                            + " "
                            + String.format(Locale.ROOT, "%-9s", required)
                            + styles.gray(String.join(", ", accepted)));
        }

        System.out.println();
        System.out.println(
                " "
                        + styles.bullet()
                        + " Headers are matched ignoring case and repeated spaces");
        System.out.println(
                " "
                        + styles.bullet()
                        + " START, END and ABORT rows mark the terminals; missing ones are added");
        System.out.println(
                " "
                        + styles.bullet()
                        + " A step is a decision when its title ends with '?' or Yes/No is filled");
        System.out.println(
                " "
                        + styles.bullet()
                        + " References may use a step number, a step title or END/ABORT");
        System.out.println(
                " " + styles.bullet() + " Separate several notes in one cell with ';'");
        System.out.println();
        System.out.println(styles.bold("Example") + " (laminar template --csv):");
        System.out.print(exampleCsv());
        return LaminarCommand.EXIT_OK;
    }

    /// Renders the example sheet as `;`-separated CSV.
    static String exampleCsv() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.join(";", EXAMPLE_HEADERS)).append('\n');
        for (List<String> row : EXAMPLE_ROWS) {
            List<String> cells = new ArrayList<>();
            for (String cell : row) {
                cells.add(quote(cell));
            }
            sb.append(String.join(";", cells)).append('\n');
        }
        return sb.toString();
    }

    private static String quote(String cell) {
        if (cell.contains(";") || cell.contains("\"")) {
            return '"' + cell.replace("\"", "\"\"") + '"';
        }
        return cell;
    }
}
