package io.laminar.cli.ui;

import static org.assertj.core.api.Assertions.assertThat;

import io.laminar.core.graph.Finding;
import io.laminar.core.graph.FindingKind;
import org.junit.jupiter.api.Test;

class AnsiStylesTest {

    @Test
    void shouldApplyBoldFormattingWhenColorEnabled() {
        AnsiStyles styles = AnsiStyles.of(true);

        String result = styles.bold("test");

        assertThat(result).startsWith("\033[1m");
        assertThat(result).contains("test");
        assertThat(result).endsWith("\033[0m");
    }

    @Test
    void shouldReturnPlainTextWhenColorDisabled() {
        AnsiStyles styles = AnsiStyles.of(false);

        assertThat(styles.bold("test")).isEqualTo("test");
        assertThat(styles.error("FAIL")).isEqualTo("FAIL");
        assertThat(styles.arrow()).isEqualTo("→");
        assertThat(styles.isColorEnabled()).isFalse();
    }

    @Test
    void shouldApplySuccessColor() {
        AnsiStyles styles = AnsiStyles.of(true);

        String result = styles.success("OK");

        assertThat(result).contains("\033[0;32m");
        assertThat(result).contains("OK");
        assertThat(result).endsWith("\033[0m");
    }

    @Test
    void shouldSwitchBetweenSuccessAndError() {
        AnsiStyles styles = AnsiStyles.of(true);

        assertThat(styles.successOrError("x", true)).isEqualTo(styles.success("x"));
        assertThat(styles.successOrError("x", false)).isEqualTo(styles.error("x"));
    }

    @Test
    void shouldColorFindingsBySeverity() {
        AnsiStyles styles = AnsiStyles.of(true);
        Finding fatal = Finding.of(FindingKind.DANGLING_REFERENCE, "1", "next", "Cannot resolve");
        Finding warning = Finding.of(FindingKind.UNREACHABLE_STEP, "9", null, "Unreachable");
        Finding note = Finding.of(FindingKind.ROLE_REGISTERED, null, null, "Registered Clerk");

        assertThat(styles.finding(fatal)).isEqualTo(styles.error(fatal.describe()));
        assertThat(styles.finding(warning)).isEqualTo(styles.warn(warning.describe()));
        assertThat(styles.finding(note)).isEqualTo(styles.gray(note.describe()));
    }

    @Test
    void shouldDrawSeparatorsOfEqualWidth() {
        AnsiStyles styles = AnsiStyles.of(false);

        assertThat(styles.separatorTop()).startsWith("┌").hasSize(62);
        assertThat(styles.separatorMid()).hasSize(62);
        assertThat(styles.separatorBottom()).startsWith("└").hasSize(62);
    }
}
