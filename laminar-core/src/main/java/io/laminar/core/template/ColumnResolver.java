package io.laminar.core.template;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Maps arbitrary header text to logical fields.
///
/// Matching is exact after normalization (lowercase, trimmed, internal whitespace
/// collapsed to one space). There is no fuzzy matching: a header either is an alias of a
/// field or it is reported as unmatched.
///
/// ### Assignment rules
/// - Each header goes to the first candidate field, in {@link LogicalField} order, that is
///   still unresolved.
/// - A header whose candidates are all resolved already keeps nothing; the first column
///   wins and an ambiguity note is recorded.
/// - Blank headers and spreadsheet placeholders (`Unnamed: 3`) are skipped silently.
///
/// @see AliasTable for the alias sets
public final class ColumnResolver {

    private static final Logger logger = Logger.getLogger(ColumnResolver.class.getName());

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final AliasTable aliases;

    public ColumnResolver(AliasTable aliases) {
        this.aliases = aliases;
    }

    /// Resolves a header row.
    ///
    /// @param headers header cells in column order, not null
    /// @return resolution with column indexes, unresolved fields and notes, never null
    public ColumnResolution resolve(List<String> headers) {
        Map<LogicalField, Integer> columns = new EnumMap<>(LogicalField.class);
        List<String> notes = new ArrayList<>();
        List<String> unmatched = new ArrayList<>();

        for (int index = 0; index < headers.size(); index++) {
            String raw = headers.get(index);
            String normalized = normalize(raw);
            if (normalized.isEmpty() || normalized.startsWith("unnamed")) {
                continue;
            }

            List<LogicalField> candidates = aliases.candidates(normalized);
            if (candidates.isEmpty()) {
                unmatched.add(raw.trim());
                continue;
            }

            LogicalField assigned = null;
            for (LogicalField candidate : candidates) {
                if (!columns.containsKey(candidate)) {
                    assigned = candidate;
                    break;
                }
            }

            if (assigned != null) {
                columns.put(assigned, index);
            } else {
                LogicalField taken = candidates.get(0);
                notes.add(
                        "Column '"
                                + raw.trim()
                                + "' (index "
                                + index
                                + ") also matches "
                                + taken.key()
                                + "; keeping column "
                                + columns.get(taken));
            }
        }

        ColumnResolution resolution = new ColumnResolution(columns, notes, unmatched);
        logger.fine(
                () ->
                        "Resolved "
                                + columns.size()
                                + " of "
                                + LogicalField.values().length
                                + " fields; missing required: "
                                + resolution.missingRequired());
        return resolution;
    }

    /// Normalizes header text for alias lookup.
    ///
    /// @param header raw header, may be null
    /// @return lowercase text with collapsed whitespace, never null
    public static String normalize(String header) {
        if (header == null) {
            return "";
        }
        return WHITESPACE.matcher(header.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }
}
