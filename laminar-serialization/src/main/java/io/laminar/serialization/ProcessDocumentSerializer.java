package io.laminar.serialization;

import static io.laminar.serialization.DocumentFields.*;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.laminar.core.document.ProcessDocument;
import java.io.IOException;
import java.io.Serial;
import java.util.List;
import java.util.Map;

/// Writes a {@link ProcessDocument} in the canonical snake_case layout.
///
/// Null strings and empty note lists are omitted. Extra step attributes follow the known
/// fields in their original order. Fields are written in a fixed order, so equal documents
/// produce equal text.
///
/// @implNote Package-private. Registered by {@link LaminarJacksonModule}.
/// @see ProcessDocumentDeserializer for the inverse operation
class ProcessDocumentSerializer extends StdSerializer<ProcessDocument> {

    @Serial private static final long serialVersionUID = 3870254416218337012L;

    ProcessDocumentSerializer() {
        super(ProcessDocument.class);
    }

    @Override
    public void serialize(ProcessDocument document, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        writeIfNotNull(gen, PROCESS_ID, document.processId());
        writeIfNotNull(gen, PROCESS_NAME, document.processName());

        gen.writeArrayFieldStart(PROCESS_ROLES);
        for (ProcessDocument.RoleEntry role : document.roles()) {
            gen.writeStartObject();
            writeIfNotNull(gen, ROLE_ID, role.roleId());
            writeIfNotNull(gen, ROLE_TITLE, role.roleTitle());
            writeNotes(gen, ROLE_NOTES, role.notes());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        if (document.steps() != null) {
            gen.writeArrayFieldStart(PROCESS_STEPS);
            for (ProcessDocument.StepEntry step : document.steps()) {
                writeStep(gen, step);
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
    }

    private void writeStep(JsonGenerator gen, ProcessDocument.StepEntry step) throws IOException {
        gen.writeStartObject();
        writeIfNotNull(gen, STEP_ID, step.stepId());
        writeIfNotNull(gen, STEP_ROLE, step.stepRole());
        writeIfNotNull(gen, STEP_TITLE, step.stepTitle());
        writeIfNotNull(gen, STEP_DESCRIPTION, step.stepDescription());
        writeNotes(gen, STEP_NOTES, step.stepNotes());
        writeIfNotNull(gen, NEXT_STEP, step.nextStep());
        writeIfNotNull(gen, YES_WHEN, step.yesWhen());
        writeIfNotNull(gen, NO_WHEN, step.noWhen());
        writeIfNotNull(gen, NEXT_STEP_YES, step.nextStepYes());
        writeIfNotNull(gen, NEXT_STEP_NO, step.nextStepNo());
        for (Map.Entry<String, String> attribute : step.attributes().entrySet()) {
            if (!KNOWN_STEP_FIELDS.contains(attribute.getKey())) {
                writeIfNotNull(gen, attribute.getKey(), attribute.getValue());
            }
        }
        gen.writeEndObject();
    }

    private static void writeNotes(JsonGenerator gen, String field, List<String> notes)
            throws IOException {
        if (notes.isEmpty()) {
            return;
        }
        gen.writeArrayFieldStart(field);
        for (String note : notes) {
            gen.writeString(note);
        }
        gen.writeEndArray();
    }

    private static void writeIfNotNull(JsonGenerator gen, String field, String value)
            throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }
}
