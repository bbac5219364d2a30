package io.laminar.core.document;

import io.laminar.core.model.Process;
import io.laminar.core.model.Role;
import io.laminar.core.model.Step;
import io.laminar.core.model.StepRef;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Typed form of the canonical process document.
///
/// This is the contract of the AI extraction collaborator and the persisted
/// `{sheet}_process.json` artifact of both extraction paths. Loosely-typed JSON is
/// parsed into these records at the serialization boundary; the core never sees raw
/// JSON.
///
/// ```json
/// {
///   "process_id": "...", "process_name": "...",
///   "process_roles": [{"role_id": "...", "role_title": "...", "role_notes": ["..."]}],
///   "process_steps": [{"step_id": "...", "step_role": "...", "step_title": "...",
///                      "next_step": "...", "next_step_yes": "...", "next_step_no": "..."}]
/// }
/// ```
///
/// @param processId process identifier, may be null
/// @param processName display name, may be null
/// @param roles declared roles, not null
/// @param steps declared steps in order, null when the source omitted them
public record ProcessDocument(
        String processId, String processName, List<RoleEntry> roles, List<StepEntry> steps) {

    public ProcessDocument {
        roles = roles != null ? Collections.unmodifiableList(new ArrayList<>(roles)) : List.of();
        steps = steps != null ? Collections.unmodifiableList(new ArrayList<>(steps)) : null;
    }

    /// Role entry of `process_roles`.
    public record RoleEntry(String roleId, String roleTitle, List<String> notes) {
        public RoleEntry {
            notes = notes != null ? List.copyOf(notes) : List.of();
        }
    }

    /// Step entry of `process_steps`.
    ///
    /// @param attributes extra string attributes, such as `manual_system`, in source order
    public record StepEntry(
            String stepId,
            String stepRole,
            String stepTitle,
            String stepDescription,
            List<String> stepNotes,
            String nextStep,
            String yesWhen,
            String noWhen,
            String nextStepYes,
            String nextStepNo,
            Map<String, String> attributes) {

        public StepEntry {
            stepNotes = stepNotes != null ? List.copyOf(stepNotes) : List.of();
            attributes =
                    attributes != null
                            ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                            : Map.of();
        }
    }

    /// Renders a built process as a canonical document.
    ///
    /// Implicit fall-through references are written out as explicit `next_step` values, so
    /// reading the document back yields the same graph.
    ///
    /// @param process process to render, not null
    /// @return document, never null
    public static ProcessDocument from(Process process) {
        List<RoleEntry> roles = new ArrayList<>();
        for (Role role : process.getRoles().values()) {
            roles.add(new RoleEntry(role.id(), role.title(), role.notes()));
        }

        List<StepEntry> steps = new ArrayList<>();
        for (Step step : process.getDeclaredSteps()) {
            steps.add(entryOf(step));
        }
        return new ProcessDocument(process.getId(), process.getName(), roles, steps);
    }

    private static StepEntry entryOf(Step step) {
        if (step instanceof Step.Action action) {
            return new StepEntry(
                    action.id(),
                    action.roleId(),
                    action.title(),
                    action.description(),
                    action.notes(),
                    target(action.next()),
                    null,
                    null,
                    null,
                    null,
                    action.attributes());
        }
        if (step instanceof Step.Condition condition) {
            return new StepEntry(
                    condition.id(),
                    condition.roleId(),
                    condition.title(),
                    condition.description(),
                    condition.notes(),
                    null,
                    condition.yesWhen(),
                    condition.noWhen(),
                    target(condition.yesNext()),
                    target(condition.noNext()),
                    condition.attributes());
        }
        Step.Terminal terminal = (Step.Terminal) step;
        return new StepEntry(
                terminal.id(),
                null,
                terminal.title(),
                null,
                List.of(),
                target(terminal.next()),
                null,
                null,
                null,
                null,
                Map.of());
    }

    private static String target(StepRef ref) {
        if (ref == null) {
            return null;
        }
        return ref.isResolved() ? ref.targetId() : ref.raw();
    }
}
