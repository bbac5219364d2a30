package io.laminar.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.laminar.cli.io.WorkbookReader;
import io.laminar.core.LaminarConfig;
import io.laminar.core.extraction.ExtractionMethod;
import io.laminar.core.extraction.ExtractionMode;
import io.laminar.core.pipeline.SheetAnalysis;
import io.laminar.core.pipeline.SheetPipeline;
import io.laminar.core.template.AliasTable;
import io.laminar.core.template.LogicalField;
import io.laminar.core.template.SheetTable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TemplateCommandTest extends BaseCommandTest {

    @TempDir Path tempDir;

    private TemplateCommand command;

    @BeforeEach
    void setUp() throws Exception {
        command = new TemplateCommand();
        injectField(command, "config", LaminarConfig.defaults());
        injectField(command, "noColor", true);
    }

    @Test
    void shouldListEveryLogicalColumn() {
        // When
        int exitCode = command.call();

        // Then
        assertThat(exitCode).isZero();
        String output = output();
        for (LogicalField field : LogicalField.values()) {
            assertThat(output).contains(field.canonicalHeader());
        }
        assertThat(output).contains("Also accepted");
        assertThat(output).contains("Step #;Role;Step Title;Next Step;Yes;No;Notes");
    }

    @Test
    void shouldListConfiguredAliases() throws Exception {
        // Given
        LaminarConfig config =
                LaminarConfig.defaults().toBuilder()
                        .aliases(
                                AliasTable.defaults()
                                        .withAliases(LogicalField.ROLE, "Verantwortlich"))
                        .build();
        injectField(command, "config", config);

        // When
        command.call();

        // Then
        assertThat(output()).contains("verantwortlich");
    }

    @Test
    void shouldPrintOnlyCsvWhenRequested() throws Exception {
        // Given
        injectField(command, "csv", true);

        // When
        command.call();

        // Then
        assertThat(output()).isEqualTo(TemplateCommand.exampleCsv());
    }

    @Test
    void shouldQuoteCellsContainingSeparator() {
        // When
        String csv = TemplateCommand.exampleCsv();

        // Then
        assertThat(csv).contains("\"Same day; Tracked\"");
        assertThat(csv.lines()).hasSize(TemplateCommand.EXAMPLE_ROWS.size() + 1);
    }

    @Test
    void shouldProduceExampleThatPassesTheTemplatePath() throws Exception {
        // Given
        Path file = tempDir.resolve("example.csv");
        Files.writeString(file, TemplateCommand.exampleCsv(), StandardCharsets.UTF_8);
        List<SheetTable> sheets = new WorkbookReader().readSheets(file, null);

        // When
        SheetAnalysis analysis =
                new SheetPipeline(LaminarConfig.defaults())
                        .analyze(sheets.get(0), ExtractionMode.FORCE_TEMPLATE);

        // Then
        assertThat(analysis.method()).isEqualTo(ExtractionMethod.TEMPLATE);
        assertThat(analysis.report().isValid()).isTrue();
        assertThat(analysis.report().warnings()).isEmpty();
    }
}
