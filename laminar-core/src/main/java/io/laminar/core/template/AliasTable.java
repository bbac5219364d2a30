package io.laminar.core.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Maps each {@link LogicalField} to the set of normalized header texts that select it.
///
/// Every field always accepts its canonical header, its snake_case key and the key with
/// spaces instead of underscores, besides the configured aliases.
///
/// @implNote Immutable. {@link #withAliases} returns a new table.
public final class AliasTable {

    private final Map<LogicalField, Set<String>> aliases;

    private AliasTable(Map<LogicalField, Set<String>> aliases) {
        this.aliases = aliases;
    }

    /// Returns the table with the built-in aliases of every field.
    public static AliasTable defaults() {
        Map<LogicalField, Set<String>> table = new EnumMap<>(LogicalField.class);
        for (LogicalField field : LogicalField.values()) {
            Set<String> set = new LinkedHashSet<>();
            set.add(ColumnResolver.normalize(field.canonicalHeader()));
            set.add(field.key());
            set.add(field.key().replace('_', ' '));
            set.add(field.key().replace("_", ""));
            for (String alias : field.defaultAliases()) {
                set.add(ColumnResolver.normalize(alias));
            }
            table.put(field, Collections.unmodifiableSet(set));
        }
        return new AliasTable(table);
    }

    /// Returns a copy of this table with extra aliases for one field.
    ///
    /// @param field field to extend, not null
    /// @param extra additional header texts, normalized on insertion
    /// @return new table, never null
    public AliasTable withAliases(LogicalField field, String... extra) {
        Map<LogicalField, Set<String>> copy = new EnumMap<>(aliases);
        Set<String> set = new LinkedHashSet<>(copy.get(field));
        for (String alias : extra) {
            String normalized = ColumnResolver.normalize(alias);
            if (!normalized.isEmpty()) {
                set.add(normalized);
            }
        }
        copy.put(field, Collections.unmodifiableSet(set));
        return new AliasTable(copy);
    }

    /// Returns the aliases of a field.
    public Set<String> aliasesOf(LogicalField field) {
        return aliases.get(field);
    }

    /// Returns every field selected by a normalized header, in declaration order.
    ///
    /// @param normalizedHeader header after {@link ColumnResolver#normalize}
    /// @return candidate fields, possibly empty, never null
    public List<LogicalField> candidates(String normalizedHeader) {
        List<LogicalField> result = new ArrayList<>();
        for (LogicalField field : LogicalField.values()) {
            if (aliases.get(field).contains(normalizedHeader)) {
                result.add(field);
            }
        }
        return result;
    }
}
