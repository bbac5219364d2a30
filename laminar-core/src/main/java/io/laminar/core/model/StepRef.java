package io.laminar.core.model;

/// Reference from one step to another.
///
/// Keeps the text the reference was written as next to the id it resolved to. An
/// unresolved reference has a null target and is reported by the validator; it never
/// survives validation.
///
/// @param raw reference text as written, empty for implicit fall-through references
/// @param targetId resolved step id or terminal sentinel id, null if unresolved
public record StepRef(String raw, String targetId) {

    public StepRef {
        raw = raw != null ? raw : "";
    }

    public static StepRef resolved(String raw, String targetId) {
        return new StepRef(raw, targetId);
    }

    /// Reference that was not written anywhere but follows from row order.
    public static StepRef implicit(String targetId) {
        return new StepRef("", targetId);
    }

    public static StepRef unresolved(String raw) {
        return new StepRef(raw, null);
    }

    public boolean isResolved() {
        return targetId != null;
    }
}
