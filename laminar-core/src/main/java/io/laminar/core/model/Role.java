package io.laminar.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/// A participant responsible for steps; rendered as one swimlane.
///
/// @param id unique identifier within a process, not null
/// @param title display name, not null
/// @param notes free-form annotations in declared order, not null
public record Role(String id, String title, List<String> notes) {

    public Role {
        Objects.requireNonNull(id, "id must not be null");
        title = title != null && !title.isBlank() ? title : id;
        notes = notes != null ? List.copyOf(notes) : List.of();
    }

    /// Creates a role whose id is derived from its title.
    ///
    /// @param title display name, not blank
    /// @return role with a slug id, never null
    public static Role fromTitle(String title) {
        return new Role(slug(title), title.trim(), List.of());
    }

    /// Derives an identifier from free text: lowercase, every character outside
    /// `[a-z0-9_]` replaced by an underscore.
    ///
    /// @param text source text, not null
    /// @return slug, never null
    public static String slug(String text) {
        return text.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
    }
}
