package io.laminar.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import io.laminar.cli.TestInputs;
import io.laminar.core.exception.CollaboratorException;
import io.laminar.core.extraction.ExtractionCollaborator;
import io.laminar.core.template.SheetTable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ValidateCommandTest extends BaseCommandTest {

    @TempDir Path tempDir;

    @Mock private ExtractionCollaborator collaborator;

    private ValidateCommand command;
    private Level originalLevel;

    @BeforeEach
    void setUp() throws Exception {
        originalLevel = Logger.getLogger("io.laminar").getLevel();
        command = new ValidateCommand();
        injectCommon(command, collaborator);
    }

    @AfterEach
    void restoreLogLevel() {
        Logger.getLogger("io.laminar").setLevel(originalLevel);
    }

    @Test
    void shouldReportValidSheetWithConfidence() throws Exception {
        // Given
        injectField(command, "inputFile", TestInputs.copy("orders.csv", tempDir));

        // When
        int exitCode = command.call();

        // Then
        assertThat(exitCode).isZero();
        String output = output();
        assertThat(output).contains("[OK] orders is valid");
        assertThat(output).contains("confidence");
        assertThat(output).contains("via TEMPLATE");
        assertThat(errors()).isEmpty();
    }

    @Test
    void shouldPrintFatalFindingsToStderr() throws Exception {
        // Given
        injectField(command, "inputFile", TestInputs.copy("broken.csv", tempDir));

        // When
        int exitCode = command.call();

        // Then
        assertThat(exitCode).isEqualTo(LaminarCommand.EXIT_SHEET_FAILED);
        String errors = errors();
        assertThat(errors).contains("[FAIL] broken: 1 fatal finding(s)");
        assertThat(errors).contains("DANGLING_REFERENCE");
        assertThat(errors).contains("99");
    }

    @Test
    void shouldNotWriteAnyOutput() throws Exception {
        // Given
        Path input = TestInputs.copy("orders.csv", tempDir);
        injectField(command, "inputFile", input);

        // When
        command.call();

        // Then
        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(input);
        }
    }

    @Test
    void shouldValidateEveryWorkbookSheet() throws Exception {
        // Given
        Map<String, List<List<String>>> sheets = new LinkedHashMap<>();
        sheets.put("Orders", TestInputs.orderRows());
        sheets.put("Broken", TestInputs.brokenRows());
        injectField(
                command, "inputFile", TestInputs.workbook(tempDir.resolve("book.xlsx"), sheets));

        // When
        int exitCode = command.call();

        // Then
        assertThat(exitCode).isEqualTo(LaminarCommand.EXIT_SHEET_FAILED);
        assertThat(output()).contains("[OK] Orders is valid");
        assertThat(errors()).contains("[FAIL] Broken");
    }

    @Test
    void shouldReportCollaboratorFailureAsSheetFailure() throws Exception {
        // Given
        injectField(command, "inputFile", TestInputs.copy("free_form.csv", tempDir));
        when(collaborator.extract(any(SheetTable.class)))
                .thenThrow(new CollaboratorException("No API key for model", false));

        // When
        int exitCode = command.call();

        // Then
        assertThat(exitCode).isEqualTo(LaminarCommand.EXIT_SHEET_FAILED);
        assertThat(errors()).contains("[FAIL] free_form: No API key for model");
    }

    @Test
    void shouldValidateCanonicalDocument() throws Exception {
        // Given
        injectField(command, "inputFile", TestInputs.copy("invoice_process.json", tempDir));

        // When
        int exitCode = command.call();

        // Then
        assertThat(exitCode).isZero();
        assertThat(output()).contains("[OK] invoice_process is valid").contains("via AI");
    }

    @Test
    void shouldFailForUnknownSheet() throws Exception {
        // Given
        Map<String, List<List<String>>> sheets = new LinkedHashMap<>();
        sheets.put("Orders", TestInputs.orderRows());
        injectField(
                command, "inputFile", TestInputs.workbook(tempDir.resolve("book.xlsx"), sheets));
        injectField(command, "sheetName", "Invoices");

        // When
        int exitCode = command.call();

        // Then
        assertThat(exitCode).isEqualTo(LaminarCommand.EXIT_USAGE);
        assertThat(errors()).contains("Sheet 'Invoices' not found").contains("Available: Orders");
    }

    @Test
    void shouldPrintStageProgressWhenVerbose() throws Exception {
        // Given
        injectField(command, "inputFile", TestInputs.copy("orders.csv", tempDir));
        injectField(command, "verbose", true);

        // When
        int exitCode = command.call();

        // Then
        assertThat(exitCode).isZero();
        String output = output();
        assertThat(output).contains("[orders] started");
        assertThat(output).contains("route");
        assertThat(output).contains("TEMPLATE");
        assertThat(Logger.getLogger("io.laminar").getLevel()).isEqualTo(Level.FINE);
    }
}
