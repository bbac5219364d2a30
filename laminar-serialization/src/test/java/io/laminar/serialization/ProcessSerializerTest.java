package io.laminar.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.laminar.core.document.ProcessDocument;
import io.laminar.core.exception.InvalidProcessDocumentException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProcessSerializerTest {

    static String sampleJson() throws IOException {
        try (InputStream in =
                ProcessSerializerTest.class.getResourceAsStream("/sample_process.json")) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void shouldReadSampleDocument() throws Exception {
        ProcessDocument document = ProcessSerializer.fromJson(sampleJson());

        assertThat(document.processId()).isEqualTo("order_to_delivery");
        assertThat(document.processName()).isEqualTo("Order to Delivery");
        assertThat(document.roles()).hasSize(7);
        assertThat(document.roles().get(0).notes()).containsExactly("Inside sales team");
        assertThat(document.steps()).hasSize(15);

        ProcessDocument.StepEntry checkCredit = document.steps().get(4);
        assertThat(checkCredit.stepId()).isEqualTo("check_credit");
        assertThat(checkCredit.attributes())
                .containsExactly(
                        Map.entry("manual_system", "SAP"), Map.entry("program_id", "FD32"));
    }

    @Test
    void roundTrip_sampleDocument() throws Exception {
        ProcessDocument original = ProcessSerializer.fromJson(sampleJson());

        ProcessDocument restored = ProcessSerializer.fromJson(ProcessSerializer.toJson(original));

        assertThat(restored).isEqualTo(original);
    }

    @Test
    void shouldOmitAbsentOptionalFields() {
        ProcessDocument document =
                new ProcessDocument(
                        "p",
                        null,
                        List.of(new ProcessDocument.RoleEntry("clerk", "Clerk", null)),
                        List.of(
                                new ProcessDocument.StepEntry(
                                        "a", "clerk", "File", null, null, "SYSTEM::END", null,
                                        null, null, null, Map.of("user_id", "u17"))));

        String json = ProcessSerializer.toJson(document);

        assertThat(json)
                .contains("\"process_id\" : \"p\"")
                .contains("\"user_id\" : \"u17\"")
                .doesNotContain("process_name")
                .doesNotContain("role_notes")
                .doesNotContain("step_description")
                .doesNotContain("next_step_yes");
    }

    @Test
    void shouldReadLooselyTypedValues() throws Exception {
        String json =
                """
                {
                  "process_id": 42,
                  "process_roles": [{"role_id": "clerk", "role_notes": "Only one note"}],
                  "process_steps": [
                    {"step_id": 1, "step_role": "clerk", "step_title": "File",
                     "next_step": 2, "priority": 3, "tags": ["x"], "owner": null}
                  ],
                  "unrelated": true
                }
                """;

        ProcessDocument document = ProcessSerializer.fromJson(json);

        assertThat(document.processId()).isEqualTo("42");
        assertThat(document.roles().get(0).notes()).containsExactly("Only one note");
        ProcessDocument.StepEntry step = document.steps().get(0);
        assertThat(step.stepId()).isEqualTo("1");
        assertThat(step.nextStep()).isEqualTo("2");
        assertThat(step.attributes()).containsExactly(Map.entry("priority", "3"));
    }

    @Test
    void shouldKeepMissingStepsDistinctFromEmptySteps() throws Exception {
        assertThat(ProcessSerializer.fromJson("{\"process_id\": \"p\"}").steps()).isNull();
        assertThat(ProcessSerializer.fromJson("{\"process_steps\": []}").steps()).isEmpty();
    }

    @Test
    void shouldRejectMalformedDocuments() {
        assertThatThrownBy(() -> ProcessSerializer.fromJson("{\"process_steps\": \"none\"}"))
                .isInstanceOf(InvalidProcessDocumentException.class)
                .hasMessageContaining("process_steps");
        assertThatThrownBy(() -> ProcessSerializer.fromJson("[1, 2]"))
                .isInstanceOf(InvalidProcessDocumentException.class);
        assertThatThrownBy(() -> ProcessSerializer.fromJson("{not json"))
                .isInstanceOf(InvalidProcessDocumentException.class);
    }
}
