package io.laminar.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Sealed hierarchy of process steps.
///
/// - {@link Action}: a unit of work with a single successor
/// - {@link Condition}: a yes/no decision with two successors
/// - {@link Terminal}: the START, END or ABORT marker
///
/// Every step exposes its outgoing references as {@link Edge}s in a fixed order
/// (next, or yes before no), which is the order in which the diagram draws them.
public sealed interface Step permits Step.Action, Step.Condition, Step.Terminal {

    /// Attribute key for the manual/system execution marker.
    String MANUAL_SYSTEM = "manual_system";

    /// Returns the unique step id.
    String id();

    /// Returns the display title.
    String title();

    /// Returns the owning role id, or null for role-less and terminal steps.
    String roleId();

    /// Returns the outgoing references; missing references are omitted.
    List<Edge> edges();

    /// Outgoing reference tagged with the field it was read from.
    ///
    /// @param kind which branch the edge represents, not null
    /// @param ref the reference, not null
    record Edge(EdgeKind kind, StepRef ref) {
        public Edge {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(ref, "ref must not be null");
        }
    }

    /// Branch an edge belongs to; doubles as the field name used in findings.
    enum EdgeKind {
        NEXT("next"),
        YES("yes"),
        NO("no");

        private final String field;

        EdgeKind(String field) {
            this.field = field;
        }

        public String field() {
            return field;
        }
    }

    /// A unit of work performed by a role.
    ///
    /// @param id unique step id, not null
    /// @param roleId owning role, null if none
    /// @param title display title, not null
    /// @param description longer explanation, may be null
    /// @param notes annotations, not null
    /// @param attributes extra string attributes such as `manual_system`, not null
    /// @param next successor, null only when the source omitted it
    record Action(
            String id,
            String roleId,
            String title,
            String description,
            List<String> notes,
            Map<String, String> attributes,
            StepRef next)
            implements Step {

        public Action {
            Objects.requireNonNull(id, "id must not be null");
            title = title != null ? title : "";
            notes = notes != null ? List.copyOf(notes) : List.of();
            attributes = copy(attributes);
        }

        @Override
        public List<Edge> edges() {
            return next != null ? List.of(new Edge(EdgeKind.NEXT, next)) : List.of();
        }
    }

    /// A yes/no decision.
    ///
    /// @param yesLabel short label drawn on the yes edge, not null
    /// @param noLabel short label drawn on the no edge, not null
    /// @param yesWhen full explanation of the yes outcome, may be null
    /// @param noWhen full explanation of the no outcome, may be null
    /// @param yesNext yes successor, null if missing
    /// @param noNext no successor, null if missing
    record Condition(
            String id,
            String roleId,
            String title,
            String description,
            List<String> notes,
            Map<String, String> attributes,
            String yesLabel,
            String noLabel,
            String yesWhen,
            String noWhen,
            StepRef yesNext,
            StepRef noNext)
            implements Step {

        public Condition {
            Objects.requireNonNull(id, "id must not be null");
            title = title != null ? title : "";
            notes = notes != null ? List.copyOf(notes) : List.of();
            attributes = copy(attributes);
            yesLabel = yesLabel != null && !yesLabel.isBlank() ? yesLabel : "Yes";
            noLabel = noLabel != null && !noLabel.isBlank() ? noLabel : "No";
        }

        @Override
        public List<Edge> edges() {
            List<Edge> edges = new ArrayList<>(2);
            if (yesNext != null) {
                edges.add(new Edge(EdgeKind.YES, yesNext));
            }
            if (noNext != null) {
                edges.add(new Edge(EdgeKind.NO, noNext));
            }
            return List.copyOf(edges);
        }
    }

    /// START, END or ABORT. Only START has a successor.
    ///
    /// @param id sentinel id of the kind, not null
    /// @param kind terminal kind, not null
    /// @param title display title, not null
    /// @param next entry edge for START, always null for END and ABORT
    record Terminal(String id, TerminalKind kind, String title, StepRef next) implements Step {

        public Terminal {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
            title = title != null && !title.isBlank() ? title : kind.displayTitle();
            if (kind != TerminalKind.START && next != null) {
                throw new IllegalArgumentException(kind + " terminal cannot have a successor");
            }
        }

        /// Creates a terminal stored under the sentinel id of its kind.
        public static Terminal of(TerminalKind kind, StepRef next) {
            return new Terminal(kind.sentinelId(), kind, kind.displayTitle(), next);
        }

        @Override
        public String roleId() {
            return null;
        }

        @Override
        public List<Edge> edges() {
            return next != null ? List.of(new Edge(EdgeKind.NEXT, next)) : List.of();
        }
    }

    private static Map<String, String> copy(Map<String, String> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
