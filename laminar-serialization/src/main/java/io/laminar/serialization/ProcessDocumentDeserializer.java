package io.laminar.serialization;

import static io.laminar.serialization.DocumentFields.*;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.laminar.core.document.ProcessDocument;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Reads a {@link ProcessDocument} from the canonical snake_case layout.
///
/// The reader is lenient about shapes that language models commonly produce:
///
/// - scalar ids such as `"step_id": 3` are read as text
/// - a single string where a note list is expected becomes a one-element list
/// - unknown scalar step fields are kept as string attributes; nested values are ignored
///
/// Structural problems (root or `process_steps` not of the expected JSON type) are
/// reported as input mismatches. Semantic checks such as a missing `step_id` are left to
/// the graph builder.
///
/// @implNote Package-private. Registered by {@link LaminarJacksonModule}.
/// @see ProcessDocumentSerializer for the inverse operation
class ProcessDocumentDeserializer extends StdDeserializer<ProcessDocument> {

    @Serial private static final long serialVersionUID = -5502364178842067351L;

    ProcessDocumentDeserializer() {
        super(ProcessDocument.class);
    }

    @Override
    public ProcessDocument deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        if (root == null || !root.isObject()) {
            return ctxt.reportInputMismatch(
                    ProcessDocument.class, "Process document must be a JSON object");
        }

        List<ProcessDocument.RoleEntry> roles = new ArrayList<>();
        JsonNode rolesNode = root.path(PROCESS_ROLES);
        if (rolesNode.isArray()) {
            for (JsonNode role : rolesNode) {
                roles.add(
                        new ProcessDocument.RoleEntry(
                                textOrNull(role, ROLE_ID),
                                textOrNull(role, ROLE_TITLE),
                                notes(role.get(ROLE_NOTES))));
            }
        }

        List<ProcessDocument.StepEntry> steps = null;
        JsonNode stepsNode = root.get(PROCESS_STEPS);
        if (stepsNode != null && !stepsNode.isNull()) {
            if (!stepsNode.isArray()) {
                return ctxt.reportInputMismatch(
                        ProcessDocument.class, "'%s' must be an array", PROCESS_STEPS);
            }
            steps = new ArrayList<>();
            for (JsonNode step : stepsNode) {
                steps.add(step.isObject() ? readStep(step) : null);
            }
        }

        return new ProcessDocument(
                textOrNull(root, PROCESS_ID), textOrNull(root, PROCESS_NAME), roles, steps);
    }

    private ProcessDocument.StepEntry readStep(JsonNode step) {
        Map<String, String> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = step.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!KNOWN_STEP_FIELDS.contains(field.getKey()) && field.getValue().isValueNode()
                    && !field.getValue().isNull()) {
                attributes.put(field.getKey(), field.getValue().asText());
            }
        }

        return new ProcessDocument.StepEntry(
                textOrNull(step, STEP_ID),
                textOrNull(step, STEP_ROLE),
                textOrNull(step, STEP_TITLE),
                textOrNull(step, STEP_DESCRIPTION),
                notes(step.get(STEP_NOTES)),
                textOrNull(step, NEXT_STEP),
                textOrNull(step, YES_WHEN),
                textOrNull(step, NO_WHEN),
                textOrNull(step, NEXT_STEP_YES),
                textOrNull(step, NEXT_STEP_NO),
                attributes);
    }

    private static List<String> notes(JsonNode node) {
        List<String> notes = new ArrayList<>();
        if (node == null || node.isNull()) {
            return notes;
        }
        if (node.isArray()) {
            for (JsonNode note : node) {
                if (note.isValueNode() && !note.isNull() && !note.asText().isBlank()) {
                    notes.add(note.asText().trim());
                }
            }
        } else if (node.isValueNode() && !node.asText().isBlank()) {
            notes.add(node.asText().trim());
        }
        return notes;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }
}
