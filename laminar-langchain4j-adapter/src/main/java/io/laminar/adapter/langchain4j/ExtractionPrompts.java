package io.laminar.adapter.langchain4j;

import io.laminar.core.exception.CollaboratorException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/// Prompt texts sent to the model for process extraction.
final class ExtractionPrompts {

    static final String SYSTEM_PROMPT =
            """
            You are an expert business process analyst. You convert process descriptions \
            kept in spreadsheets into structured JSON documents.

            Work from the semicolon-separated sheet data you are given. Follow the flow of \
            steps, decisions, branches and loops, assign every step to the role that \
            performs it, and detect decisions even when they are only implied by a step \
            description. Do not drop any information from the source.""";

    static final String INSTRUCTIONS =
            """
            Produce a JSON document for the sheet above in exactly the format of the sample.

            Rules:
            - Step SYSTEM::START must exist and point to the first real step via next_step.
            - Every successful path ends in SYSTEM::END; a path stopped by a failed check \
            ends in SYSTEM::ABORT.
            - Decisions get step ids prefixed with CONDITION:: and use next_step_yes and \
            next_step_no. Add yes_when / no_when when the outcome needs explaining.
            - Every step other than the SYSTEM:: steps has a step_role that is declared in \
            process_roles.
            - Step ids are unique; an id and the same id with CONDITION:: count as a clash.
            - Notes referenced as [1], [2] belong in the step_notes of the step that \
            references them, with their definition resolved.
            - Keep extra columns such as manual_system, system_name, user_id and \
            program_id as plain string fields on the step.

            Return only the JSON object, without Markdown and without explanations.""";

    private static final String SAMPLE_RESOURCE = "sample_process.json";

    private ExtractionPrompts() {}

    /// Builds the user message for one sheet.
    ///
    /// @param sheetName name of the sheet, not null
    /// @param csv sheet rendered as semicolon-separated text, not null
    /// @param sample sample document in the canonical format, not null
    /// @return message text, never null
    static String userMessage(String sheetName, String csv, String sample) {
        return "Sheet name: "
                + sheetName
                + "\n\nSheet data (';' separated, '--' marks an empty cell):\n"
                + csv
                + "\nSample document:\n"
                + sample
                + "\n\n"
                + INSTRUCTIONS;
    }

    /// Loads the bundled sample document.
    ///
    /// @return sample JSON text, never null
    /// @throws CollaboratorException permanent, if the resource is missing
    static String loadSample() throws CollaboratorException {
        try (InputStream in = ExtractionPrompts.class.getResourceAsStream(SAMPLE_RESOURCE)) {
            if (in == null) {
                throw new CollaboratorException("Missing resource " + SAMPLE_RESOURCE, false);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CollaboratorException("Cannot read " + SAMPLE_RESOURCE, e, false);
        }
    }
}
