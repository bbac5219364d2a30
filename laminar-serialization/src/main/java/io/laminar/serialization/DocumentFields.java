package io.laminar.serialization;

import java.util.Set;

/// Field names of the canonical process document.
final class DocumentFields {

    static final String PROCESS_ID = "process_id";
    static final String PROCESS_NAME = "process_name";
    static final String PROCESS_ROLES = "process_roles";
    static final String PROCESS_STEPS = "process_steps";

    static final String ROLE_ID = "role_id";
    static final String ROLE_TITLE = "role_title";
    static final String ROLE_NOTES = "role_notes";

    static final String STEP_ID = "step_id";
    static final String STEP_ROLE = "step_role";
    static final String STEP_TITLE = "step_title";
    static final String STEP_DESCRIPTION = "step_description";
    static final String STEP_NOTES = "step_notes";
    static final String NEXT_STEP = "next_step";
    static final String YES_WHEN = "yes_when";
    static final String NO_WHEN = "no_when";
    static final String NEXT_STEP_YES = "next_step_yes";
    static final String NEXT_STEP_NO = "next_step_no";

    /// Step fields with a dedicated slot; everything else is an extra attribute.
    static final Set<String> KNOWN_STEP_FIELDS =
            Set.of(
                    STEP_ID,
                    STEP_ROLE,
                    STEP_TITLE,
                    STEP_DESCRIPTION,
                    STEP_NOTES,
                    NEXT_STEP,
                    YES_WHEN,
                    NO_WHEN,
                    NEXT_STEP_YES,
                    NEXT_STEP_NO);

    private DocumentFields() {}
}
