package io.laminar.cli.visualizer;

import io.laminar.cli.ui.AnsiStyles;
import io.laminar.core.model.Process;
import io.laminar.core.model.Role;
import io.laminar.core.model.Step;
import io.laminar.core.model.StepRef;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Plain-text listing of a process, one block per lane.
///
/// ```
/// Process: Order Handling (order_handling)
/// ──────────────────────────────────────────────────
///
/// Customer
///   1  Submit order  → 2
///   4  Provide missing details  → 2
/// Sales Clerk
///   2  Order complete? ◆  Yes → 3 | No → 4
///
/// Terminals
///   SYSTEM::START  Start  → 1
///   SYSTEM::END  End
/// ```
///
/// Lanes follow role declaration order; steps keep their declaration order within a
/// lane. Steps without a role are listed under "Unassigned".
///
/// @implNote Thread-safe. Each render call creates its own {@link AnsiStyles}.
@ApplicationScoped
public class TextVisualizationFormat implements VisualizationFormat {

    static final String UNASSIGNED = "Unassigned";

    @Override
    public String getName() {
        return "text";
    }

    @Override
    public String render(Process process, boolean useColor) {
        AnsiStyles styles = AnsiStyles.of(useColor);
        StringBuilder sb = new StringBuilder();
        sb.append(styles.bold("Process: "))
                .append(styles.accent(process.getName()))
                .append(' ')
                .append(styles.gray("(" + process.getId() + ")"))
                .append(System.lineSeparator());
        sb.append(styles.gray("─".repeat(50))).append(System.lineSeparator());

        Map<String, List<Step>> lanes = new LinkedHashMap<>();
        for (String roleId : process.getRoles().keySet()) {
            lanes.put(roleId, new ArrayList<>());
        }
        List<Step> unassigned = new ArrayList<>();
        List<Step> terminals = new ArrayList<>();
        for (Step step : process.getSteps().values()) {
            if (step instanceof Step.Terminal) {
                terminals.add(step);
            } else if (step.roleId() == null || !lanes.containsKey(step.roleId())) {
                unassigned.add(step);
            } else {
                lanes.get(step.roleId()).add(step);
            }
        }

        sb.append(System.lineSeparator());
        for (Map.Entry<String, List<Step>> lane : lanes.entrySet()) {
            Role role = process.getRoles().get(lane.getKey());
            appendLane(sb, role.title(), lane.getValue(), styles);
        }
        if (!unassigned.isEmpty()) {
            appendLane(sb, UNASSIGNED, unassigned, styles);
        }
        sb.append(System.lineSeparator());
        appendLane(sb, "Terminals", terminals, styles);
        return sb.toString();
    }

    private void appendLane(StringBuilder sb, String title, List<Step> steps, AnsiStyles styles) {
        sb.append(styles.bold(title)).append(System.lineSeparator());
        if (steps.isEmpty()) {
            sb.append("  ").append(styles.dim("(no steps)")).append(System.lineSeparator());
        }
        for (Step step : steps) {
            sb.append("  ")
                    .append(styles.gray(step.id()))
                    .append("  ")
                    .append(step.title());
            if (step instanceof Step.Condition condition) {
                sb.append(' ').append(styles.warn("◆")).append("  ");
                sb.append(branch(condition.yesLabel(), condition.yesNext(), styles));
                sb.append(styles.dim(" | "));
                sb.append(branch(condition.noLabel(), condition.noNext(), styles));
            } else {
                for (Step.Edge edge : step.edges()) {
                    sb.append("  ").append(styles.arrow()).append(' ').append(target(edge.ref()));
                }
            }
            sb.append(System.lineSeparator());
        }
    }

    private String branch(String label, StepRef ref, AnsiStyles styles) {
        String target = ref != null ? target(ref) : styles.error("(missing)");
        return label + " " + styles.arrow() + " " + target;
    }

    private static String target(StepRef ref) {
        return ref.isResolved() ? ref.targetId() : "?" + ref.raw();
    }
}
