package io.laminar.core.graph;

import java.util.Objects;

/// One problem or note about a process.
///
/// @param kind category, not null
/// @param severity severity, not null
/// @param stepId step the finding is about, null for process-level findings
/// @param field field of the step involved (`next`, `yes`, `no`, `role`), may be null
/// @param message human-readable explanation, not null
public record Finding(
        FindingKind kind, Severity severity, String stepId, String field, String message) {

    public Finding {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        severity = severity != null ? severity : kind.defaultSeverity();
    }

    /// Creates a finding with the kind's default severity.
    public static Finding of(FindingKind kind, String stepId, String field, String message) {
        return new Finding(kind, kind.defaultSeverity(), stepId, field, message);
    }

    public boolean isFatal() {
        return severity == Severity.FATAL;
    }

    /// Renders the finding as a single line, e.g.
    /// `DANGLING_REFERENCE at step '4' (next): cannot resolve 'Step 9'`.
    public String describe() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (stepId != null) {
            sb.append(" at step '").append(stepId).append('\'');
            if (field != null) {
                sb.append(" (").append(field).append(')');
            }
        }
        return sb.append(": ").append(message).toString();
    }
}
