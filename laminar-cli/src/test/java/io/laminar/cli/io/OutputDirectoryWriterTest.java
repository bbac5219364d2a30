package io.laminar.cli.io;

import static org.assertj.core.api.Assertions.assertThat;

import io.laminar.cli.TestInputs;
import io.laminar.core.LaminarConfig;
import io.laminar.core.extraction.ExtractionMode;
import io.laminar.core.pipeline.SheetPipeline;
import io.laminar.core.pipeline.SheetResult;
import io.laminar.serialization.ProcessSerializer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OutputDirectoryWriterTest {

    @TempDir Path tempDir;

    @Test
    void shouldWriteDocumentAndDiagramIntoNewDirectory() throws Exception {
        // Given
        Path directory = tempDir.resolve("nested").resolve("out");
        OutputDirectoryWriter writer = new OutputDirectoryWriter(directory);
        SheetResult result = process("Orders");

        // When
        writer.accept(result);

        // Then
        Path json = directory.resolve("Orders_process.json");
        Path diagram = directory.resolve("Orders_flowchart.mmd");
        assertThat(writer.processFile("Orders")).isEqualTo(json);
        assertThat(writer.diagramFile("Orders")).isEqualTo(diagram);
        assertThat(Files.readString(diagram, StandardCharsets.UTF_8)).isEqualTo(result.diagram());
        assertThat(Files.readString(json, StandardCharsets.UTF_8))
                .isEqualTo(ProcessSerializer.toJson(result.document()));
    }

    @Test
    void shouldOverwriteExistingFiles() throws Exception {
        // Given
        OutputDirectoryWriter writer = new OutputDirectoryWriter(tempDir);
        Files.writeString(tempDir.resolve("Orders_flowchart.mmd"), "stale");

        // When
        writer.accept(process("Orders"));

        // Then
        assertThat(Files.readString(tempDir.resolve("Orders_flowchart.mmd")))
                .startsWith("flowchart TD");
    }

    @Test
    void shouldKeepSheetsWithCollidingStemsApart() throws Exception {
        // Given
        OutputDirectoryWriter writer = new OutputDirectoryWriter(tempDir);
        SheetResult slashed = process("A/B");
        SheetResult underscored = process("A_B");
        SheetResult lowercase = process("a_b");

        // When
        writer.accept(slashed);
        writer.accept(underscored);
        writer.accept(lowercase);

        // Then
        assertThat(writer.diagramFile("A/B")).isEqualTo(tempDir.resolve("A_B_flowchart.mmd"));
        assertThat(writer.diagramFile("A_B")).isEqualTo(tempDir.resolve("A_B_2_flowchart.mmd"));
        assertThat(writer.processFile("a_b")).isEqualTo(tempDir.resolve("a_b_3_process.json"));
        assertThat(Files.readString(tempDir.resolve("A_B_process.json")))
                .isEqualTo(ProcessSerializer.toJson(slashed.document()));
        assertThat(Files.readString(tempDir.resolve("A_B_2_process.json")))
                .isEqualTo(ProcessSerializer.toJson(underscored.document()));
        assertThat(Files.readString(tempDir.resolve("a_b_3_process.json")))
                .isEqualTo(ProcessSerializer.toJson(lowercase.document()));
    }

    @Test
    void shouldSanitizeFileStem() {
        assertThat(OutputDirectoryWriter.fileStem("Orders")).isEqualTo("Orders");
        assertThat(OutputDirectoryWriter.fileStem(" Q1/Q2: Review? ")).isEqualTo("Q1_Q2_ Review_");
        assertThat(OutputDirectoryWriter.fileStem("a\\b*c")).isEqualTo("a_b_c");
        assertThat(OutputDirectoryWriter.fileStem("..")).isEqualTo("sheet");
        assertThat(OutputDirectoryWriter.fileStem("   ")).isEqualTo("sheet");
    }

    private static SheetResult process(String name) throws Exception {
        return new SheetPipeline(LaminarConfig.defaults())
                .process(TestInputs.sheet(name, TestInputs.orderRows()), ExtractionMode.AUTO);
    }
}
