package io.laminar.core.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/// The three terminal step kinds and the sentinel ids they are stored under.
///
/// Two recognition levels exist. {@link #fromMarker(String)} is strict and accepts only
/// the kind name or its sentinel id; it is used to classify rows. {@link #fromToken(String)}
/// also accepts common synonyms (`done`, `cancel`, ...) and is used to resolve
/// references, where the text is known to name a target.
public enum TerminalKind {
    START("Start", Set.of("start", "begin")),
    END("End", Set.of("end", "finish", "finished", "done", "complete", "completed")),
    ABORT("Abort", Set.of("abort", "cancel", "cancelled", "fail", "error", "reject"));

    /// Prefix shared by terminal sentinel ids.
    public static final String SYSTEM_PREFIX = "SYSTEM::";

    /// Prefix that marks condition step ids in canonical documents.
    public static final String CONDITION_PREFIX = "CONDITION::";

    private final String displayTitle;
    private final Set<String> synonyms;

    TerminalKind(String displayTitle, Set<String> synonyms) {
        this.displayTitle = displayTitle;
        this.synonyms = synonyms;
    }

    /// Returns the sentinel step id, e.g. `SYSTEM::END`.
    public String sentinelId() {
        return SYSTEM_PREFIX + name();
    }

    /// Returns the default label of a synthesized terminal step.
    public String displayTitle() {
        return displayTitle;
    }

    /// Recognizes the kind name or sentinel id, ignoring case and surrounding space.
    ///
    /// @param text cell or id text, may be null
    /// @return matching kind, or empty
    public static Optional<TerminalKind> fromMarker(String text) {
        String bare = strip(text);
        if (bare == null) {
            return Optional.empty();
        }
        for (TerminalKind kind : values()) {
            if (kind.name().equalsIgnoreCase(bare)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /// Recognizes a reference to a terminal, synonyms included.
    ///
    /// @param text reference text, may be null
    /// @return matching kind, or empty
    public static Optional<TerminalKind> fromToken(String text) {
        String bare = strip(text);
        if (bare == null) {
            return Optional.empty();
        }
        String lower = bare.toLowerCase(Locale.ROOT);
        for (TerminalKind kind : values()) {
            if (kind.synonyms.contains(lower)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /// Removes a leading `SYSTEM::` or `CONDITION::` prefix, case-insensitively.
    ///
    /// @param id step id, not null
    /// @return id without prefix, never null
    public static String stripPrefix(String id) {
        String upper = id.toUpperCase(Locale.ROOT);
        if (upper.startsWith(SYSTEM_PREFIX)) {
            return id.substring(SYSTEM_PREFIX.length());
        }
        if (upper.startsWith(CONDITION_PREFIX)) {
            return id.substring(CONDITION_PREFIX.length());
        }
        return id;
    }

    private static String strip(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.toUpperCase(Locale.ROOT).startsWith(SYSTEM_PREFIX)) {
            trimmed = trimmed.substring(SYSTEM_PREFIX.length()).trim();
        }
        return trimmed;
    }
}
