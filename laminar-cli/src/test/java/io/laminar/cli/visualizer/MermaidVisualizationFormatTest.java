package io.laminar.cli.visualizer;

import static org.assertj.core.api.Assertions.assertThat;

import io.laminar.cli.TestInputs;
import io.laminar.core.LaminarConfig;
import io.laminar.core.diagram.MermaidDiagramCompiler;
import io.laminar.core.model.Process;
import org.junit.jupiter.api.Test;

class MermaidVisualizationFormatTest {

    @Test
    void shouldReturnMermaidAsFormatName() {
        assertThat(new MermaidVisualizationFormat(LaminarConfig.defaults()).getName())
                .isEqualTo("mermaid");
    }

    @Test
    void shouldMatchWrittenDiagram() throws Exception {
        Process process = TestInputs.process("Orders", TestInputs.orderRows());
        LaminarConfig config = LaminarConfig.defaults();

        String result = new MermaidVisualizationFormat(config).render(process, true);

        assertThat(result).isEqualTo(new MermaidDiagramCompiler(config).compile(process));
        assertThat(result).doesNotContain("\033[");
    }

    @Test
    void shouldFollowConfiguredDirection() throws Exception {
        Process process = TestInputs.process("Orders", TestInputs.orderRows());
        LaminarConfig config = LaminarConfig.defaults().toBuilder().direction("LR").build();

        String result = new MermaidVisualizationFormat(config).render(process, false);

        assertThat(result).startsWith("flowchart LR");
    }
}
