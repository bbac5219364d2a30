package io.laminar.core.graph;

import io.laminar.core.exception.ProcessValidationException;
import io.laminar.core.model.Process;
import io.laminar.core.model.Step;
import io.laminar.core.model.StepRef;
import io.laminar.core.model.TerminalKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.logging.Logger;

/// Checks the structural invariants of a process graph.
///
/// Checks run in a fixed order and stop early when later checks would be meaningless:
///
/// 1. duplicate step ids (fatal, stops)
/// 2. dangling references and unknown roles (fatal, stops)
/// 3. exactly one START without incoming edges (fatal, stops)
/// 4. reachability from START (warning per unreachable step)
/// 5. every reachable step can reach END or ABORT (warning per step)
/// 6. conditions have both branches (fatal)
///
/// Cycles are ordinary edges. Only a step from which no terminal can be reached is
/// reported, and only as a warning.
///
/// @implNote Stateless and thread-safe.
public final class GraphValidator {

    private static final Logger logger = Logger.getLogger(GraphValidator.class.getName());

    /// Validates a process.
    ///
    /// @param process graph to check, not null
    /// @return findings in detection order, never null
    public ValidationReport validate(Process process) {
        List<Finding> findings = new ArrayList<>();

        checkDuplicates(process, findings);
        if (hasFatal(findings)) {
            return new ValidationReport(findings);
        }

        checkReferences(process, findings);
        checkRoles(process, findings);
        if (hasFatal(findings)) {
            return new ValidationReport(findings);
        }

        String startId = checkEntryPoint(process, findings);
        if (hasFatal(findings)) {
            return new ValidationReport(findings);
        }

        Set<String> reachable = findReachable(process, startId);
        for (Step step : process.getSteps().values()) {
            if (!reachable.contains(step.id())) {
                findings.add(
                        Finding.of(
                                FindingKind.UNREACHABLE_STEP,
                                step.id(),
                                null,
                                "Step cannot be reached from START"));
            }
        }

        checkTermination(process, reachable, findings);
        checkConditions(process, findings);

        ValidationReport report = new ValidationReport(findings);
        if (!report.warnings().isEmpty()) {
            logger.fine(
                    () ->
                            "Process '"
                                    + process.getId()
                                    + "' has "
                                    + report.warnings().size()
                                    + " warning(s)");
        }
        return report;
    }

    /// Validates a process and fails on the first fatal finding.
    ///
    /// @param process graph to check, not null
    /// @return the report, containing warnings only, never null
    /// @throws ProcessValidationException if any fatal finding was produced
    public ValidationReport validateOrThrow(Process process) throws ProcessValidationException {
        ValidationReport report = validate(process);
        if (!report.isValid()) {
            throw ProcessValidationException.from(report);
        }
        return report;
    }

    private void checkDuplicates(Process process, List<Finding> findings) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Step step : process.getDeclaredSteps()) {
            counts.merge(step.id(), 1, Integer::sum);
        }
        counts.forEach(
                (id, count) -> {
                    if (count > 1) {
                        findings.add(
                                Finding.of(
                                        FindingKind.DUPLICATE_STEP_ID,
                                        id,
                                        null,
                                        "Step id is declared " + count + " times"));
                    }
                });
    }

    private void checkReferences(Process process, List<Finding> findings) {
        Map<String, Step> steps = process.getSteps();
        for (Step step : steps.values()) {
            if (step instanceof Step.Action action && action.next() == null) {
                findings.add(
                        Finding.of(
                                FindingKind.DANGLING_REFERENCE,
                                step.id(),
                                Step.EdgeKind.NEXT.field(),
                                "Action has no next step"));
            }
            if (step instanceof Step.Terminal terminal
                    && terminal.kind() == TerminalKind.START
                    && terminal.next() == null) {
                findings.add(
                        Finding.of(
                                FindingKind.DANGLING_REFERENCE,
                                step.id(),
                                Step.EdgeKind.NEXT.field(),
                                "START has no next step"));
            }
            for (Step.Edge edge : step.edges()) {
                StepRef ref = edge.ref();
                if (!ref.isResolved()) {
                    findings.add(
                            Finding.of(
                                    FindingKind.DANGLING_REFERENCE,
                                    step.id(),
                                    edge.kind().field(),
                                    "Cannot resolve '" + ref.raw() + "'"));
                } else if (!steps.containsKey(ref.targetId())) {
                    findings.add(
                            Finding.of(
                                    FindingKind.DANGLING_REFERENCE,
                                    step.id(),
                                    edge.kind().field(),
                                    "Target '" + ref.targetId() + "' does not exist"));
                }
            }
        }
    }

    private void checkRoles(Process process, List<Finding> findings) {
        for (Step step : process.getSteps().values()) {
            String roleId = step.roleId();
            if (roleId != null && !process.getRoles().containsKey(roleId)) {
                findings.add(
                        Finding.of(
                                FindingKind.UNKNOWN_ROLE,
                                step.id(),
                                "role",
                                "Role '" + roleId + "' is not declared"));
            }
        }
    }

    private String checkEntryPoint(Process process, List<Finding> findings) {
        List<String> starts = new ArrayList<>();
        for (Step step : process.getSteps().values()) {
            if (step instanceof Step.Terminal terminal && terminal.kind() == TerminalKind.START) {
                starts.add(step.id());
            }
        }
        if (starts.isEmpty()) {
            findings.add(
                    Finding.of(FindingKind.MISSING_START, null, null, "Process has no START"));
            return null;
        }
        if (starts.size() > 1) {
            findings.add(
                    Finding.of(
                            FindingKind.MULTIPLE_START,
                            null,
                            null,
                            "Process has " + starts.size() + " START steps: " + starts));
            return null;
        }

        String startId = starts.get(0);
        for (Step step : process.getSteps().values()) {
            for (Step.Edge edge : step.edges()) {
                if (startId.equals(edge.ref().targetId())) {
                    findings.add(
                            Finding.of(
                                    FindingKind.START_HAS_INCOMING,
                                    step.id(),
                                    edge.kind().field(),
                                    "START must not be the target of any step"));
                }
            }
        }
        return startId;
    }

    private Set<String> findReachable(Process process, String startId) {
        Set<String> visited = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.add(startId);
        visited.add(startId);

        while (!queue.isEmpty()) {
            Step step = process.getSteps().get(queue.poll());
            for (Step.Edge edge : step.edges()) {
                String target = edge.ref().targetId();
                if (visited.add(target)) {
                    queue.add(target);
                }
            }
        }
        return visited;
    }

    private void checkTermination(Process process, Set<String> reachable, List<Finding> findings) {
        int bound = 2 * process.getSteps().size();
        for (Step step : process.getSteps().values()) {
            if (step instanceof Step.Terminal || !reachable.contains(step.id())) {
                continue;
            }
            if (!reachesExit(process, step.id(), bound)) {
                findings.add(
                        Finding.of(
                                FindingKind.NON_TERMINATING_PATH,
                                step.id(),
                                null,
                                "No path from this step reaches END or ABORT"));
            }
        }
    }

    /// Breadth-first search bounded to `bound` hops for an END or ABORT step.
    private boolean reachesExit(Process process, String fromId, int bound) {
        Map<String, Integer> depth = new HashMap<>();
        Queue<String> queue = new ArrayDeque<>();
        depth.put(fromId, 0);
        queue.add(fromId);

        while (!queue.isEmpty()) {
            String id = queue.poll();
            Step step = process.getSteps().get(id);
            if (step instanceof Step.Terminal terminal && terminal.kind() != TerminalKind.START) {
                return true;
            }
            int hops = depth.get(id);
            if (hops >= bound) {
                continue;
            }
            for (Step.Edge edge : step.edges()) {
                String target = edge.ref().targetId();
                if (!depth.containsKey(target)) {
                    depth.put(target, hops + 1);
                    queue.add(target);
                }
            }
        }
        return false;
    }

    private void checkConditions(Process process, List<Finding> findings) {
        for (Step step : process.getSteps().values()) {
            if (step instanceof Step.Condition condition) {
                if (condition.yesNext() == null) {
                    findings.add(
                            Finding.of(
                                    FindingKind.INCOMPLETE_CONDITION,
                                    step.id(),
                                    Step.EdgeKind.YES.field(),
                                    "Condition has no yes branch"));
                }
                if (condition.noNext() == null) {
                    findings.add(
                            Finding.of(
                                    FindingKind.INCOMPLETE_CONDITION,
                                    step.id(),
                                    Step.EdgeKind.NO.field(),
                                    "Condition has no no branch"));
                }
            }
        }
    }

    private static boolean hasFatal(List<Finding> findings) {
        return findings.stream().anyMatch(Finding::isFatal);
    }
}
