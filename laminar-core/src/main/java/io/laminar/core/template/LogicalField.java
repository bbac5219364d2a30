package io.laminar.core.template;

import java.util.List;
import java.util.Locale;

/// Canonical columns of a process sheet.
///
/// Declaration order matters: when a header matches several fields, it is assigned to
/// the first one (in this order) that has not been claimed yet. That is how a sheet with
/// both `Step #` and `No` columns ends up with `No` as the no-branch column. Likewise a
/// single `Type` column is read as {@link #IS_CONDITION}; only a second `Type` column goes
/// to {@link #MANUAL_SYSTEM}. Sheets that mean manual/system should name the column
/// `Manual/System` or `Execution Type`.
public enum LogicalField {
    STEP_ID(
            "Step #",
            true,
            List.of("step #", "step#", "step", "step no", "step no.", "#", "no", "no.", "id")),
    ROLE(
            "Role",
            true,
            List.of(
                    "role",
                    "actor",
                    "responsible",
                    "owner",
                    "assigned to",
                    "performer",
                    "swimlane")),
    STEP_TITLE(
            "Step Title",
            true,
            List.of(
                    "title", "step title", "name", "step name", "action", "activity", "task")),
    DESCRIPTION(
            "Description",
            false,
            List.of("description", "desc", "details", "step description", "explanation")),
    NEXT_STEP(
            "Next Step",
            false,
            List.of("next", "next step", "goes to", "then", "flow to", "->")),
    IS_CONDITION(
            "Condition",
            false,
            List.of(
                    "condition",
                    "is condition",
                    "decision",
                    "condition?",
                    "is decision",
                    "type")),
    YES_NEXT(
            "Yes",
            false,
            List.of(
                    "yes", "yes next", "yes ->", "yes→", "if yes", "true", "yes path", "on yes")),
    NO_NEXT(
            "No",
            false,
            List.of("no", "no next", "no ->", "no→", "if no", "false", "no path", "on no")),
    YES_WHEN(
            "Yes When",
            false,
            List.of("yes when", "yes condition", "yes if", "condition for yes")),
    NO_WHEN(
            "No When", false, List.of("no when", "no condition", "no if", "condition for no")),
    NOTES("Notes", false, List.of("notes", "note", "comments", "remarks", "annotations")),
    MANUAL_SYSTEM(
            "Manual/System",
            false,
            List.of("manual/system", "manual or system", "type", "execution type", "mode")),
    SYSTEM_NAME(
            "System", false, List.of("system", "system name", "application", "app", "tool")),
    USER_ID("User", false, List.of("user", "user id", "login", "username", "user name")),
    PROGRAM_ID(
            "Program",
            false,
            List.of("program", "program id", "t-code", "tcode", "screen", "transaction"));

    private final String canonicalHeader;
    private final boolean required;
    private final List<String> defaultAliases;

    LogicalField(String canonicalHeader, boolean required, List<String> defaultAliases) {
        this.canonicalHeader = canonicalHeader;
        this.required = required;
        this.defaultAliases = defaultAliases;
    }

    /// Returns the header the blank template uses for this field.
    public String canonicalHeader() {
        return canonicalHeader;
    }

    public boolean isRequired() {
        return required;
    }

    /// Returns the built-in aliases, already normalized.
    public List<String> defaultAliases() {
        return defaultAliases;
    }

    /// Returns the snake_case field name, e.g. `step_id`.
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Returns the required fields in declaration order.
    public static List<LogicalField> required() {
        return List.of(STEP_ID, ROLE, STEP_TITLE);
    }
}
