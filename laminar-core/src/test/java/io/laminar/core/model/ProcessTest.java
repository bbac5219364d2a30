package io.laminar.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ProcessTest {

    @Test
    void shouldKeepFirstOccurrenceButRememberDuplicates() {
        Step first = action("a", "First");
        Step second = action("a", "Second");

        Process process = Process.builder().id("p").step(first).step(second).build();

        assertThat(process.getSteps()).containsOnlyKeys("a");
        assertThat(process.getStep("a")).contains(first);
        assertThat(process.getDeclaredSteps()).containsExactly(first, second);
    }

    @Test
    void shouldFallBackToIdForName() {
        Process process = Process.builder().id("order_handling").build();

        assertThat(process.getName()).isEqualTo("order_handling");
    }

    @Test
    void shouldKeepFirstRoleRegistration() {
        Process process =
                Process.builder()
                        .id("p")
                        .role(new Role("clerk", "Clerk", List.of()))
                        .role(new Role("clerk", "Other", List.of()))
                        .build();

        assertThat(process.getRoles().get("clerk").title()).isEqualTo("Clerk");
    }

    @Test
    void shouldCountEdgesOverAllSteps() {
        Process process =
                Process.builder()
                        .id("p")
                        .step(Step.Terminal.of(TerminalKind.START, StepRef.implicit("a")))
                        .step(action("a", "A"))
                        .step(Step.Terminal.of(TerminalKind.END, null))
                        .build();

        assertThat(process.edgeCount()).isEqualTo(2);
    }

    @Test
    void shouldRequireId() {
        assertThatThrownBy(() -> Process.builder().build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("Process ID required");
    }

    @Test
    void shouldRejectSuccessorOnEndTerminal() {
        assertThatThrownBy(() -> Step.Terminal.of(TerminalKind.END, StepRef.implicit("a")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDeriveRoleSlugFromTitle() {
        assertThat(Role.fromTitle(" Sales Clerk ").id()).isEqualTo("sales_clerk");
        assertThat(Role.fromTitle("R&D / QA").id()).isEqualTo("r_d___qa");
    }

    private static Step.Action action(String id, String title) {
        return new Step.Action(
                id,
                null,
                title,
                null,
                null,
                null,
                StepRef.resolved("END", TerminalKind.END.sentinelId()));
    }
}
