package io.laminar.core.graph;

import io.laminar.core.document.ProcessDocument;
import io.laminar.core.exception.InvalidProcessDocumentException;
import io.laminar.core.model.Process;
import io.laminar.core.model.Role;
import io.laminar.core.model.Step;
import io.laminar.core.model.StepRef;
import io.laminar.core.model.TerminalKind;
import io.laminar.core.template.CanonicalRow;
import io.laminar.core.template.LogicalField;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Turns canonical rows or a canonical document into a {@link Process}.
///
/// Both inputs are first reduced to the same intermediate drafts, so classification,
/// reference resolution and terminal synthesis follow identical rules on both paths.
///
/// ### Graph completion
/// - An action or START without a successor falls through to the next declared step;
///   the last one falls through to END.
/// - A START terminal is synthesized in front when none is declared.
/// - END and ABORT terminals are appended when referenced but not declared.
///
/// The builder never rejects a graph for structural reasons. Unresolved references,
/// duplicate ids and missing branches are left in place for {@link GraphValidator}.
///
/// @implNote Stateless and thread-safe.
/// @see RowClassifier for the classification rules
/// @see ReferenceResolver for the lookup order
public final class GraphBuilder {

    private static final Logger logger = Logger.getLogger(GraphBuilder.class.getName());

    /// Maximum length of an edge label derived from a yes/no explanation.
    static final int LABEL_LIMIT = 30;

    private static final Map<LogicalField, String> ATTRIBUTE_FIELDS =
            Map.of(
                    LogicalField.MANUAL_SYSTEM, Step.MANUAL_SYSTEM,
                    LogicalField.SYSTEM_NAME, "system_name",
                    LogicalField.USER_ID, "user_id",
                    LogicalField.PROGRAM_ID, "program_id");

    /// Builds a process from the rows of a template sheet.
    ///
    /// @param processId process identifier, not null
    /// @param processName display name, not null
    /// @param rows non-blank canonical rows in sheet order, not null
    /// @return process plus build notes, never null
    public GraphBuild fromRows(String processId, String processName, List<CanonicalRow> rows) {
        List<Finding> findings = new ArrayList<>();
        Map<String, Role> roles = new LinkedHashMap<>();
        List<Draft> drafts = new ArrayList<>();

        for (CanonicalRow row : rows) {
            String declaredId =
                    row.has(LogicalField.STEP_ID)
                            ? row.get(LogicalField.STEP_ID)
                            : "row_" + row.rowNumber();
            String title = row.get(LogicalField.STEP_TITLE);
            RowKind kind = RowClassifier.classify(row);
            TerminalKind terminal =
                    kind == RowKind.TERMINAL
                            ? RowClassifier.terminalKind(declaredId, title).orElseThrow()
                            : null;

            String roleId = null;
            if (terminal == null && row.has(LogicalField.ROLE)) {
                Role role = Role.fromTitle(row.get(LogicalField.ROLE));
                roles.putIfAbsent(role.id(), role);
                roleId = role.id();
            }

            Map<String, String> attributes = new LinkedHashMap<>();
            for (LogicalField field :
                    List.of(
                            LogicalField.MANUAL_SYSTEM,
                            LogicalField.SYSTEM_NAME,
                            LogicalField.USER_ID,
                            LogicalField.PROGRAM_ID)) {
                if (row.has(field)) {
                    attributes.put(ATTRIBUTE_FIELDS.get(field), row.get(field));
                }
            }

            drafts.add(
                    new Draft(
                            terminal != null ? terminal.sentinelId() : declaredId,
                            declaredId,
                            row.rowNumber(),
                            kind,
                            terminal,
                            roleId,
                            title.isEmpty() ? defaultTitle(terminal, declaredId) : title,
                            blankToNull(row.get(LogicalField.DESCRIPTION)),
                            splitNotes(row.get(LogicalField.NOTES)),
                            attributes,
                            blankToNull(row.get(LogicalField.NEXT_STEP)),
                            blankToNull(row.get(LogicalField.YES_NEXT)),
                            blankToNull(row.get(LogicalField.NO_NEXT)),
                            blankToNull(row.get(LogicalField.YES_WHEN)),
                            blankToNull(row.get(LogicalField.NO_WHEN))));
        }

        return assemble(processId, processName, roles, drafts, findings);
    }

    /// Builds a process from a canonical document.
    ///
    /// Steps whose role is not declared in `process_roles` get the role registered with its
    /// id as title, and an {@link FindingKind#ROLE_REGISTERED} note.
    ///
    /// @param document parsed document, not null
    /// @return process plus build notes, never null
    /// @throws InvalidProcessDocumentException if steps are missing or a step has no id
    public GraphBuild fromDocument(ProcessDocument document)
            throws InvalidProcessDocumentException {
        if (document.steps() == null) {
            throw new InvalidProcessDocumentException("Document has no process_steps");
        }

        List<Finding> findings = new ArrayList<>();
        Map<String, Role> roles = new LinkedHashMap<>();
        for (ProcessDocument.RoleEntry entry : document.roles()) {
            if (entry == null || blankToNull(entry.roleId()) == null) {
                throw new InvalidProcessDocumentException("Role without role_id");
            }
            String roleId = entry.roleId().trim();
            roles.putIfAbsent(roleId, new Role(roleId, entry.roleTitle(), entry.notes()));
        }

        List<Draft> drafts = new ArrayList<>();
        List<ProcessDocument.StepEntry> steps = document.steps();
        for (int i = 0; i < steps.size(); i++) {
            ProcessDocument.StepEntry entry = steps.get(i);
            if (entry == null || blankToNull(entry.stepId()) == null) {
                throw new InvalidProcessDocumentException(
                        "Step " + (i + 1) + " of process_steps has no step_id");
            }
            String stepId = entry.stepId().trim();
            String title = entry.stepTitle() != null ? entry.stepTitle().trim() : "";
            boolean hasBranch =
                    blankToNull(entry.nextStepYes()) != null
                            || blankToNull(entry.nextStepNo()) != null;
            RowKind kind = RowClassifier.classify(stepId, title, hasBranch, null);
            TerminalKind terminal =
                    kind == RowKind.TERMINAL
                            ? RowClassifier.terminalKind(stepId, title).orElseThrow()
                            : null;

            String roleId = terminal == null ? blankToNull(entry.stepRole()) : null;
            if (roleId != null && !roles.containsKey(roleId)) {
                roles.put(roleId, new Role(roleId, roleId, List.of()));
                findings.add(
                        Finding.of(
                                FindingKind.ROLE_REGISTERED,
                                stepId,
                                "role",
                                "Role '" + roleId + "' was not declared and has been added"));
            }

            drafts.add(
                    new Draft(
                            terminal != null ? terminal.sentinelId() : stepId,
                            stepId,
                            i + 1,
                            kind,
                            terminal,
                            roleId,
                            title.isEmpty() ? defaultTitle(terminal, stepId) : title,
                            blankToNull(entry.stepDescription()),
                            entry.stepNotes(),
                            entry.attributes(),
                            blankToNull(entry.nextStep()),
                            blankToNull(entry.nextStepYes()),
                            blankToNull(entry.nextStepNo()),
                            blankToNull(entry.yesWhen()),
                            blankToNull(entry.noWhen())));
        }

        String processId = blankToNull(document.processId());
        String processName = blankToNull(document.processName());
        if (processId == null) {
            processId = processName != null ? Role.slug(processName) : "process";
        }
        return assemble(processId, processName, roles, drafts, findings);
    }

    private GraphBuild assemble(
            String processId,
            String processName,
            Map<String, Role> roles,
            List<Draft> drafts,
            List<Finding> findings) {
        ReferenceResolver resolver = new ReferenceResolver();
        for (Draft draft : drafts) {
            resolver.register(draft.id(), draft.declaredId(), draft.position(), draft.title());
        }

        List<Step> steps = new ArrayList<>();
        Set<TerminalKind> declared = EnumSet.noneOf(TerminalKind.class);
        for (int i = 0; i < drafts.size(); i++) {
            Draft draft = drafts.get(i);
            String fallThrough =
                    i + 1 < drafts.size() ? drafts.get(i + 1).id() : TerminalKind.END.sentinelId();
            steps.add(toStep(draft, fallThrough, resolver, findings));
            if (draft.terminal() != null) {
                declared.add(draft.terminal());
            }
        }

        if (!declared.contains(TerminalKind.START)) {
            String first = drafts.isEmpty() ? TerminalKind.END.sentinelId() : drafts.get(0).id();
            steps.add(0, Step.Terminal.of(TerminalKind.START, StepRef.implicit(first)));
            logger.fine(() -> "Synthesized START in front of '" + first + "'");
        }

        Set<String> referenced = new HashSet<>();
        for (Step step : steps) {
            for (Step.Edge edge : step.edges()) {
                if (edge.ref().isResolved()) {
                    referenced.add(edge.ref().targetId());
                }
            }
        }
        for (TerminalKind kind : List.of(TerminalKind.END, TerminalKind.ABORT)) {
            if (!declared.contains(kind) && referenced.contains(kind.sentinelId())) {
                steps.add(Step.Terminal.of(kind, null));
                logger.fine(() -> "Synthesized " + kind + " terminal");
            }
        }

        Process process =
                Process.builder()
                        .id(processId)
                        .name(processName)
                        .roles(roles.values())
                        .steps(steps)
                        .build();
        return new GraphBuild(process, findings);
    }

    private Step toStep(
            Draft draft, String fallThrough, ReferenceResolver resolver, List<Finding> findings) {
        switch (draft.kind()) {
            case CONDITION -> {
                String yes = draft.yes() != null ? draft.yes() : draft.next();
                return new Step.Condition(
                        draft.id(),
                        draft.roleId(),
                        draft.title(),
                        draft.description(),
                        draft.notes(),
                        draft.attributes(),
                        label(draft.yesWhen(), "Yes"),
                        label(draft.noWhen(), "No"),
                        draft.yesWhen(),
                        draft.noWhen(),
                        yes != null ? resolver.resolve(draft.id(), "yes", yes, findings) : null,
                        draft.no() != null
                                ? resolver.resolve(draft.id(), "no", draft.no(), findings)
                                : null);
            }
            case TERMINAL -> {
                StepRef next = null;
                if (draft.terminal() == TerminalKind.START) {
                    next =
                            draft.next() != null
                                    ? resolver.resolve(draft.id(), "next", draft.next(), findings)
                                    : StepRef.implicit(fallThrough);
                }
                return new Step.Terminal(draft.id(), draft.terminal(), draft.title(), next);
            }
            default -> {
                StepRef next =
                        draft.next() != null
                                ? resolver.resolve(draft.id(), "next", draft.next(), findings)
                                : StepRef.implicit(fallThrough);
                return new Step.Action(
                        draft.id(),
                        draft.roleId(),
                        draft.title(),
                        draft.description(),
                        draft.notes(),
                        draft.attributes(),
                        next);
            }
        }
    }

    /// Shortens a yes/no explanation to an edge label.
    static String label(String when, String fallback) {
        if (when == null) {
            return fallback;
        }
        String flat = when.replaceAll("\\s+", " ").trim();
        return flat.length() > LABEL_LIMIT ? flat.substring(0, LABEL_LIMIT) + "..." : flat;
    }

    private static String defaultTitle(TerminalKind terminal, String id) {
        return terminal != null ? terminal.displayTitle() : id;
    }

    private static List<String> splitNotes(String cell) {
        List<String> notes = new ArrayList<>();
        for (String part : cell.split(";")) {
            if (!part.isBlank()) {
                notes.add(part.trim());
            }
        }
        return notes;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /// Source-independent step description used during assembly.
    private record Draft(
            String id,
            String declaredId,
            int position,
            RowKind kind,
            TerminalKind terminal,
            String roleId,
            String title,
            String description,
            List<String> notes,
            Map<String, String> attributes,
            String next,
            String yes,
            String no,
            String yesWhen,
            String noWhen) {}
}
