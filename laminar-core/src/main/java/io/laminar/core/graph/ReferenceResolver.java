package io.laminar.core.graph;

import io.laminar.core.model.StepRef;
import io.laminar.core.model.TerminalKind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/// Resolves next/yes/no text to step ids.
///
/// Lookup order, first hit wins:
/// 1. terminal token, synonyms included (`done` resolves to `SYSTEM::END`)
/// 2. exact step id, declared or final
/// 3. step id ignoring case
/// 4. step id without `CONDITION::` / `SYSTEM::` prefix
/// 5. row number
/// 6. step title ignoring case; the first declared step wins and a collision is reported
///
/// Anything else stays unresolved and is left to the validator.
final class ReferenceResolver {

    private static final Pattern ROW_NUMBER = Pattern.compile("\\d{1,9}");

    private final Map<String, String> byId = new HashMap<>();
    private final Map<String, String> byLowerId = new HashMap<>();
    private final Map<String, String> byBareId = new HashMap<>();
    private final Map<Integer, String> byPosition = new HashMap<>();
    private final Map<String, List<String>> byTitle = new HashMap<>();

    /// Registers a step as a possible target. Earlier registrations win.
    ///
    /// @param id final step id
    /// @param declaredId id as written in the source
    /// @param position 1-based row position
    /// @param title step title, may be empty
    void register(String id, String declaredId, int position, String title) {
        for (String key : List.of(declaredId, id)) {
            byId.putIfAbsent(key, id);
            byLowerId.putIfAbsent(key.toLowerCase(Locale.ROOT), id);
            byBareId.putIfAbsent(bare(key), id);
        }
        byPosition.putIfAbsent(position, id);
        if (title != null && !title.isBlank()) {
            String key = title.trim().toLowerCase(Locale.ROOT);
            List<String> ids = byTitle.computeIfAbsent(key, k -> new ArrayList<>());
            if (!ids.contains(id)) {
                ids.add(id);
            }
        }
    }

    /// Resolves reference text.
    ///
    /// @param sourceId id of the referring step, for findings
    /// @param field field the reference was read from, for findings
    /// @param raw reference text, not blank
    /// @param findings sink for ambiguity findings
    /// @return resolved or unresolved reference, never null
    StepRef resolve(String sourceId, String field, String raw, List<Finding> findings) {
        String text = raw.trim();

        Optional<TerminalKind> terminal = TerminalKind.fromToken(text);
        if (terminal.isPresent()) {
            return StepRef.resolved(raw, terminal.get().sentinelId());
        }

        String hit = byId.get(text);
        if (hit == null) {
            hit = byLowerId.get(text.toLowerCase(Locale.ROOT));
        }
        if (hit == null) {
            hit = byBareId.get(bare(text));
        }
        if (hit == null && ROW_NUMBER.matcher(text).matches()) {
            hit = byPosition.get(Integer.parseInt(text));
        }
        if (hit != null) {
            return StepRef.resolved(raw, hit);
        }

        List<String> titled = byTitle.get(text.toLowerCase(Locale.ROOT));
        if (titled != null && !titled.isEmpty()) {
            if (titled.size() > 1) {
                findings.add(
                        Finding.of(
                                FindingKind.AMBIGUOUS_TITLE_REFERENCE,
                                sourceId,
                                field,
                                "'"
                                        + text
                                        + "' matches the titles of steps "
                                        + titled
                                        + "; using '"
                                        + titled.get(0)
                                        + "'"));
            }
            return StepRef.resolved(raw, titled.get(0));
        }
        return StepRef.unresolved(raw);
    }

    private static String bare(String id) {
        return TerminalKind.stripPrefix(id.trim()).toLowerCase(Locale.ROOT);
    }
}
