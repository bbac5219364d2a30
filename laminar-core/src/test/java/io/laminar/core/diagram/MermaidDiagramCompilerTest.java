package io.laminar.core.diagram;

import static org.assertj.core.api.Assertions.assertThat;

import io.laminar.core.LaminarConfig;
import io.laminar.core.TestSheets;
import io.laminar.core.graph.GraphBuilder;
import io.laminar.core.model.Process;
import io.laminar.core.model.Role;
import io.laminar.core.model.Step;
import io.laminar.core.model.StepRef;
import io.laminar.core.model.TerminalKind;
import io.laminar.core.template.AliasTable;
import io.laminar.core.template.ColumnResolution;
import io.laminar.core.template.ColumnResolver;
import io.laminar.core.template.SheetTable;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MermaidDiagramCompilerTest {

    private MermaidDiagramCompiler compiler;
    private Process orderProcess;

    @BeforeEach
    void setUp() {
        compiler = new MermaidDiagramCompiler();
        SheetTable sheet = TestSheets.orderSheet();
        ColumnResolution resolution =
                new ColumnResolver(AliasTable.defaults()).resolve(sheet.headers());
        orderProcess =
                new GraphBuilder()
                        .fromRows("order_handling", sheet.name(), resolution.canonicalize(sheet))
                        .process();
    }

    @Test
    void shouldRenderHeaderAndNodesWithShapes() {
        String diagram = compiler.compile(orderProcess);

        assertThat(diagram).startsWith("flowchart TD\n    %% Order Handling\n");
        assertThat(diagram)
                .contains("    START([\"Start\"])\n")
                .contains("    step_1[\"Submit order\"]\n")
                .contains("    step_2{\"Order complete?\"}\n")
                .contains("    node_END([\"End\"])\n");
    }

    @Test
    void shouldEmitEdgesRightAfterTheirNodeWithColoredBranches() {
        String diagram = compiler.compile(orderProcess);

        assertThat(diagram)
                .contains(
                        "    step_2{\"Order complete?\"}\n"
                                + "    step_2 -->|\"Yes\"| step_3\n"
                                + "    step_2 -->|\"No\"| step_4\n")
                .contains("    START --> step_1\n")
                .contains("    step_3 --> node_END\n")
                .contains("    linkStyle 2 stroke:#2e7d32,stroke-width:2px\n")
                .contains("    linkStyle 3 stroke:#c62828,stroke-width:2px\n");
    }

    @Test
    void shouldDrawOneNodePerStepAndOneEdgePerReference() {
        String diagram = compiler.compile(orderProcess);

        long edges = diagram.lines().filter(line -> line.contains(" -->")).count();
        long nodes =
                diagram.lines()
                        .filter(line -> line.matches("    \\w+(\\(\\[|\\[|\\{)\".*"))
                        .count();

        assertThat(edges).isEqualTo(orderProcess.edgeCount()).isEqualTo(6);
        assertThat(nodes).isEqualTo(orderProcess.getSteps().size());
    }

    @Test
    void shouldGroupStepsIntoLanesInOrderOfFirstReference() {
        String diagram = compiler.compile(orderProcess);

        assertThat(diagram)
                .contains(
                        "    subgraph lane_customer[\"Customer\"]\n"
                                + "        step_1\n"
                                + "        step_4\n"
                                + "    end\n"
                                + "    subgraph lane_sales_clerk[\"Sales Clerk\"]\n"
                                + "        step_2\n"
                                + "    end\n"
                                + "    subgraph lane_warehouse[\"Warehouse\"]\n"
                                + "        step_3\n"
                                + "    end\n")
                .contains("    style lane_customer fill:#e8f4fc,stroke:#4a86c7,stroke-width:2px\n")
                .contains("    class START,node_END startEnd\n")
                .contains("    class step_2 condition\n");
    }

    @Test
    void shouldEmitNotesAsCommentsAfterEverythingElse() {
        String diagram = compiler.compile(orderProcess);

        assertThat(diagram)
                .endsWith(
                        "    %% Notes\n"
                                + "    %% N1 - Submit order: Via web form\n"
                                + "    %% N2 - Ship order: Same day\n"
                                + "    %% N3 - Ship order: Tracked\n");
        assertThat(diagram).doesNotContain("Via web form\"");
    }

    @Test
    void shouldBeDeterministic() {
        assertThat(compiler.compile(orderProcess)).isEqualTo(compiler.compile(orderProcess));
    }

    @Test
    void shouldEscapeLabelText() {
        Process process =
                Process.builder()
                        .id("p")
                        .name("P")
                        .step(Step.Terminal.of(TerminalKind.START, ref("a")))
                        .step(
                                new Step.Action(
                                        "a",
                                        null,
                                        "Say \"hi\" & <wave> #1\nagain",
                                        null,
                                        null,
                                        null,
                                        ref(TerminalKind.END.sentinelId())))
                        .step(Step.Terminal.of(TerminalKind.END, null))
                        .build();

        String diagram = compiler.compile(process);

        assertThat(diagram)
                .contains("    a[\"Say #quot;hi#quot; #amp; #lt;wave#gt; #35;1 again\"]\n")
                .contains("    subgraph lane_unassigned[\"Unassigned\"]\n        a\n    end\n");
    }

    @Test
    void shouldStripPrefixesAndAvoidCollisions() {
        Process process =
                Process.builder()
                        .id("p")
                        .step(Step.Terminal.of(TerminalKind.START, ref("CONDITION::ok")))
                        .step(
                                new Step.Condition(
                                        "CONDITION::ok",
                                        null,
                                        "Ok?",
                                        null,
                                        null,
                                        null,
                                        null,
                                        null,
                                        null,
                                        null,
                                        ref("ok"),
                                        ref(TerminalKind.ABORT.sentinelId())))
                        .step(
                                new Step.Action(
                                        "ok",
                                        null,
                                        "Fine",
                                        null,
                                        null,
                                        null,
                                        ref(TerminalKind.END.sentinelId())))
                        .step(Step.Terminal.of(TerminalKind.END, null))
                        .step(Step.Terminal.of(TerminalKind.ABORT, null))
                        .build();

        String diagram = compiler.compile(process);

        assertThat(diagram)
                .contains("    ok{\"Ok?\"}\n")
                .contains("    ok -->|\"Yes\"| ok_2\n")
                .contains("    ok -->|\"No\"| ABORT\n")
                .contains("    ok_2[\"Fine\"]\n");
    }

    @Test
    void shouldSanitizeIds() {
        assertThat(MermaidDiagramCompiler.sanitizeId("a-b c")).isEqualTo("a_b_c");
        assertThat(MermaidDiagramCompiler.sanitizeId("12")).isEqualTo("step_12");
        assertThat(MermaidDiagramCompiler.sanitizeId("class")).isEqualTo("node_class");
        assertThat(MermaidDiagramCompiler.sanitizeId("End")).isEqualTo("node_End");
        assertThat(MermaidDiagramCompiler.sanitizeId("")).isEqualTo("step");
    }

    @Test
    void shouldHonorDiagramOptions() {
        Process process =
                Process.builder()
                        .id("p")
                        .role(new Role("clerk", "Clerk", List.of()))
                        .step(Step.Terminal.of(TerminalKind.START, ref("a")))
                        .step(
                                new Step.Action(
                                        "a",
                                        "clerk",
                                        "Post",
                                        null,
                                        List.of("hidden"),
                                        Map.of(Step.MANUAL_SYSTEM, "SAP", "program_id", "FB60"),
                                        ref(TerminalKind.END.sentinelId())))
                        .step(Step.Terminal.of(TerminalKind.END, null))
                        .build();
        MermaidDiagramCompiler custom =
                new MermaidDiagramCompiler(
                        LaminarConfig.builder()
                                .includeNotes(false)
                                .includeMetadata(true)
                                .markdownFence(true)
                                .direction("LR")
                                .build());

        String diagram = custom.compile(process);

        assertThat(diagram).startsWith("```mermaid\nflowchart LR\n").endsWith("```\n");
        assertThat(diagram)
                .contains("    a[\"Post<br>[System: SAP]<br>[FB60]\"]\n")
                .contains("    class a systemStep\n")
                .doesNotContain("hidden");
    }

    private static StepRef ref(String target) {
        return StepRef.resolved(target, target);
    }
}
