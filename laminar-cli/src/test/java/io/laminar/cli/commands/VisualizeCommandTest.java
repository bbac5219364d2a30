package io.laminar.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.laminar.cli.TestInputs;
import io.laminar.cli.visualizer.MermaidVisualizationFormat;
import io.laminar.cli.visualizer.ProcessVisualizer;
import io.laminar.cli.visualizer.TextVisualizationFormat;
import io.laminar.cli.visualizer.VisualizationFormat;
import io.laminar.core.LaminarConfig;
import io.laminar.core.extraction.ExtractionCollaborator;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VisualizeCommandTest extends BaseCommandTest {

    @TempDir Path tempDir;

    @Mock private ExtractionCollaborator collaborator;

    private VisualizeCommand command;

    @BeforeEach
    void setUp() throws Exception {
        command = new VisualizeCommand();
        injectCommon(command, collaborator);
        List<VisualizationFormat> formats =
                List.of(
                        new MermaidVisualizationFormat(LaminarConfig.defaults()),
                        new TextVisualizationFormat());
        injectField(command, "visualizer", new ProcessVisualizer(formats));
        injectField(command, "format", "mermaid");
    }

    @Test
    void shouldPrintMermaidWithoutBanner() throws Exception {
        // Given
        injectField(command, "inputFile", TestInputs.copy("orders.csv", tempDir));

        // When
        int exitCode = command.call();

        // Then
        assertThat(exitCode).isZero();
        String output = output();
        assertThat(output).startsWith("flowchart TD");
        assertThat(output).contains("subgraph");
        assertThat(output).doesNotContain("Spreadsheet processes to swim-lane flowcharts");
    }

    @Test
    void shouldPrintTextListing() throws Exception {
        // Given
        injectField(command, "inputFile", TestInputs.copy("orders.csv", tempDir));
        injectField(command, "format", "text");

        // When
        int exitCode = command.call();

        // Then
        assertThat(exitCode).isZero();
        String output = output();
        assertThat(output).contains("Process: orders (orders)");
        assertThat(output).contains("Sales Clerk");
        assertThat(output).contains("Yes → 3 | No → 4");
        assertThat(output).contains("Terminals");
    }

    @Test
    void shouldRefuseMermaidForInvalidGraph() throws Exception {
        // Given
        injectField(command, "inputFile", TestInputs.copy("broken.csv", tempDir));

        // When
        int exitCode = command.call();

        // Then
        assertThat(exitCode).isEqualTo(LaminarCommand.EXIT_SHEET_FAILED);
        assertThat(output()).isEmpty();
        assertThat(errors()).contains("DANGLING_REFERENCE");
    }

    @Test
    void shouldStillListInvalidGraphAsText() throws Exception {
        // Given
        injectField(command, "inputFile", TestInputs.copy("broken.csv", tempDir));
        injectField(command, "format", "text");

        // When
        int exitCode = command.call();

        // Then
        assertThat(exitCode).isEqualTo(LaminarCommand.EXIT_SHEET_FAILED);
        assertThat(output()).contains("?99");
    }

    @Test
    void shouldRejectUnknownFormat() throws Exception {
        // Given
        injectField(command, "inputFile", TestInputs.copy("orders.csv", tempDir));
        injectField(command, "format", "svg");

        // When
        int exitCode = command.call();

        // Then
        assertThat(exitCode).isEqualTo(LaminarCommand.EXIT_USAGE);
        assertThat(errors())
                .contains("Unsupported format: svg")
                .contains("Available: mermaid, text");
    }

    @Test
    void shouldShowFirstSheetAndHintAtOthers() throws Exception {
        // Given
        Map<String, List<List<String>>> sheets = new LinkedHashMap<>();
        sheets.put("Orders", TestInputs.orderRows());
        sheets.put("Broken", TestInputs.brokenRows());
        injectField(
                command, "inputFile", TestInputs.workbook(tempDir.resolve("book.xlsx"), sheets));

        // When
        int exitCode = command.call();

        // Then
        assertThat(exitCode).isZero();
        assertThat(errors()).contains("Showing sheet 'Orders' of 2");
    }

    @Test
    void shouldPrintSelectedSheet() throws Exception {
        // Given
        Map<String, List<List<String>>> sheets = new LinkedHashMap<>();
        sheets.put("Orders", TestInputs.orderRows());
        sheets.put("Broken", TestInputs.brokenRows());
        injectField(
                command, "inputFile", TestInputs.workbook(tempDir.resolve("book.xlsx"), sheets));
        injectField(command, "sheetName", "Broken");
        injectField(command, "format", "text");

        // When
        command.call();

        // Then
        assertThat(output()).contains("Process: Broken (broken)");
        assertThat(errors()).doesNotContain("Showing sheet");
    }
}
