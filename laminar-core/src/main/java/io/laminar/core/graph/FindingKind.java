package io.laminar.core.graph;

/// Categories of build and validation findings with their default severity.
public enum FindingKind {
    DUPLICATE_STEP_ID(Severity.FATAL),
    DANGLING_REFERENCE(Severity.FATAL),
    UNKNOWN_ROLE(Severity.FATAL),
    MISSING_START(Severity.FATAL),
    MULTIPLE_START(Severity.FATAL),
    START_HAS_INCOMING(Severity.FATAL),
    INCOMPLETE_CONDITION(Severity.FATAL),
    UNREACHABLE_STEP(Severity.WARNING),
    NON_TERMINATING_PATH(Severity.WARNING),
    AMBIGUOUS_TITLE_REFERENCE(Severity.WARNING),
    AMBIGUOUS_COLUMN(Severity.INFO),
    ROLE_REGISTERED(Severity.INFO);

    private final Severity defaultSeverity;

    FindingKind(Severity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }
}
