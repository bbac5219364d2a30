package io.laminar.core.diagram;

import io.laminar.core.LaminarConfig;
import io.laminar.core.model.Process;
import io.laminar.core.model.Role;
import io.laminar.core.model.Step;
import io.laminar.core.model.TerminalKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Compiles a process into a swim-laned Mermaid flowchart.
///
/// ### Layout
/// - one `subgraph` lane per role, in order of first reference by a step
/// - role-less actions and conditions share an "Unassigned" lane
/// - START, END and ABORT sit outside every lane
/// - roles no step refers to get no lane
///
/// ### Node Shape Mapping
/// - **Terminal**: stadium `id(["label"])`
/// - **Condition**: diamond `id{"label"}`
/// - **Action**: rectangle `id["label"]`
///
/// ### Output order
/// Nodes in step insertion order, each followed by its outgoing edges (yes before no),
/// then lane blocks, link styles for yes/no edges, class definitions and assignments,
/// lane styles and finally the notes as `%%` comments.
///
/// Labels are always double-quoted and `#`, `"`, `<`, `>`, `&` are written as Mermaid
/// entity codes, so step text can never break the diagram structure.
///
/// @implNote Stateless and thread-safe. Output is byte-identical for equal input.
public final class MermaidDiagramCompiler implements DiagramCompiler {

    private static final Set<String> RESERVED_KEYWORDS =
            Set.of(
                    "end",
                    "subgraph",
                    "graph",
                    "flowchart",
                    "direction",
                    "click",
                    "style",
                    "classdef",
                    "class",
                    "linkstyle");

    private static final String INDENT = "    ";
    private static final String UNASSIGNED_LANE = "unassigned";
    private static final String UNASSIGNED_TITLE = "Unassigned";

    private final DiagramPalette palette;
    private final boolean includeNotes;
    private final boolean includeMetadata;
    private final boolean markdownFence;
    private final String direction;

    /// Creates a compiler with default settings.
    public MermaidDiagramCompiler() {
        this(LaminarConfig.defaults());
    }

    /// Creates a compiler using the diagram settings of a configuration.
    ///
    /// @param config shared configuration, not null
    public MermaidDiagramCompiler(LaminarConfig config) {
        this.palette = config.getPalette();
        this.includeNotes = config.isIncludeNotes();
        this.includeMetadata = config.isIncludeMetadata();
        this.markdownFence = config.isMarkdownFence();
        this.direction = config.getDirection();
    }

    @Override
    public String compile(Process process) {
        Map<String, String> nodeIds = allocateNodeIds(process);
        Map<String, List<String>> lanes = partitionLanes(process, nodeIds);
        Map<String, String> laneIds = allocateLaneIds(lanes.keySet(), nodeIds.values());

        StringBuilder sb = new StringBuilder();
        if (markdownFence) {
            sb.append("```mermaid\n");
        }
        sb.append("flowchart ").append(direction).append('\n');
        sb.append(INDENT).append("%% ").append(flatten(process.getName())).append('\n');

        List<String> linkStyles = new ArrayList<>();
        int edgeIndex = 0;
        for (Step step : process.getSteps().values()) {
            String id = nodeIds.get(step.id());
            sb.append(INDENT).append(declareNode(id, step)).append('\n');

            for (Step.Edge edge : step.edges()) {
                String target = nodeIdOf(edge.ref().targetId(), edge.ref().raw(), nodeIds);
                sb.append(INDENT).append(id);
                switch (edge.kind()) {
                    case YES -> {
                        sb.append(" -->|\"")
                                .append(escape(((Step.Condition) step).yesLabel()))
                                .append("\"| ");
                        linkStyles.add(linkStyle(edgeIndex, palette.yesEdge()));
                    }
                    case NO -> {
                        sb.append(" -->|\"")
                                .append(escape(((Step.Condition) step).noLabel()))
                                .append("\"| ");
                        linkStyles.add(linkStyle(edgeIndex, palette.noEdge()));
                    }
                    default -> sb.append(" --> ");
                }
                sb.append(target).append('\n');
                edgeIndex++;
            }
        }

        sb.append('\n');
        for (Map.Entry<String, List<String>> lane : lanes.entrySet()) {
            sb.append(INDENT)
                    .append("subgraph ")
                    .append(laneIds.get(lane.getKey()))
                    .append("[\"")
                    .append(escape(laneTitle(process, lane.getKey())))
                    .append("\"]\n");
            for (String member : lane.getValue()) {
                sb.append(INDENT).append(INDENT).append(member).append('\n');
            }
            sb.append(INDENT).append("end\n");
        }

        for (String linkStyle : linkStyles) {
            sb.append(INDENT).append(linkStyle).append('\n');
        }

        appendClasses(sb, process, nodeIds);

        for (String laneId : laneIds.values()) {
            sb.append(INDENT)
                    .append("style ")
                    .append(laneId)
                    .append(" fill:")
                    .append(palette.laneFill())
                    .append(",stroke:")
                    .append(palette.laneStroke())
                    .append(",stroke-width:2px\n");
        }

        if (includeNotes) {
            appendNotes(sb, process);
        }

        if (markdownFence) {
            sb.append("```\n");
        }
        return sb.toString();
    }

    private String declareNode(String id, Step step) {
        String label = escape(step.title());
        if (step instanceof Step.Terminal) {
            return id + "([\"" + label + "\"])";
        }
        if (step instanceof Step.Condition) {
            return id + "{\"" + label + "\"}";
        }
        if (includeMetadata) {
            label += metadata((Step.Action) step);
        }
        return id + "[\"" + label + "\"]";
    }

    private String metadata(Step.Action action) {
        StringBuilder sb = new StringBuilder();
        String mode = action.attributes().get(Step.MANUAL_SYSTEM);
        if (mode != null && !mode.isBlank()) {
            sb.append("<br>[")
                    .append(isManual(mode) ? escape(mode) : "System: " + escape(mode))
                    .append(']');
        }
        String program = action.attributes().get("program_id");
        if (program != null && !program.isBlank()) {
            sb.append("<br>[").append(escape(program)).append(']');
        }
        return sb.toString();
    }

    private void appendClasses(StringBuilder sb, Process process, Map<String, String> nodeIds) {
        String border = palette.border();
        sb.append(INDENT)
                .append("classDef startEnd fill:")
                .append(palette.terminalFill())
                .append(",stroke:")
                .append(border)
                .append(",stroke-width:2px,color:#333\n");
        sb.append(INDENT)
                .append("classDef condition fill:#fff,stroke:")
                .append(border)
                .append(",stroke-width:1px,color:#333\n");
        sb.append(INDENT)
                .append("classDef systemStep fill:")
                .append(palette.systemStepFill())
                .append(",stroke:")
                .append(border)
                .append(",stroke-width:1px,color:#333\n");
        sb.append(INDENT)
                .append("classDef default fill:#fff,stroke:")
                .append(border)
                .append(",stroke-width:1px,color:#333\n");

        List<String> terminals = new ArrayList<>();
        List<String> conditions = new ArrayList<>();
        List<String> systemSteps = new ArrayList<>();
        for (Step step : process.getSteps().values()) {
            String id = nodeIds.get(step.id());
            if (step instanceof Step.Terminal) {
                terminals.add(id);
            } else if (step instanceof Step.Condition) {
                conditions.add(id);
            } else if (isSystemStep((Step.Action) step)) {
                systemSteps.add(id);
            }
        }
        appendClassAssignment(sb, terminals, "startEnd");
        appendClassAssignment(sb, conditions, "condition");
        appendClassAssignment(sb, systemSteps, "systemStep");
    }

    private void appendClassAssignment(StringBuilder sb, List<String> ids, String className) {
        if (!ids.isEmpty()) {
            sb.append(INDENT)
                    .append("class ")
                    .append(String.join(",", ids))
                    .append(' ')
                    .append(className)
                    .append('\n');
        }
    }

    private void appendNotes(StringBuilder sb, Process process) {
        List<String> lines = new ArrayList<>();
        int counter = 1;
        for (Step step : process.getSteps().values()) {
            List<String> notes = notesOf(step);
            for (String note : notes) {
                lines.add(
                        "%% N" + counter++ + " - " + flatten(step.title()) + ": " + flatten(note));
            }
        }
        if (lines.isEmpty()) {
            return;
        }
        sb.append('\n').append(INDENT).append("%% Notes\n");
        for (String line : lines) {
            sb.append(INDENT).append(line).append('\n');
        }
    }

    private static List<String> notesOf(Step step) {
        if (step instanceof Step.Action action) {
            return action.notes();
        }
        if (step instanceof Step.Condition condition) {
            return condition.notes();
        }
        return List.of();
    }

    /// Assigns lane members in order of first reference; the map key is the role id or
    /// {@value #UNASSIGNED_LANE}.
    private Map<String, List<String>> partitionLanes(Process process, Map<String, String> nodeIds) {
        Map<String, List<String>> lanes = new LinkedHashMap<>();
        for (Step step : process.getSteps().values()) {
            if (step instanceof Step.Terminal) {
                continue;
            }
            String lane = step.roleId() != null ? step.roleId() : UNASSIGNED_LANE;
            lanes.computeIfAbsent(lane, k -> new ArrayList<>()).add(nodeIds.get(step.id()));
        }
        return lanes;
    }

    private String laneTitle(Process process, String laneKey) {
        Role role = process.getRoles().get(laneKey);
        if (role != null) {
            return role.title();
        }
        return UNASSIGNED_LANE.equals(laneKey) ? UNASSIGNED_TITLE : laneKey;
    }

    private Map<String, String> allocateNodeIds(Process process) {
        Set<String> used = new HashSet<>();
        Map<String, String> ids = new LinkedHashMap<>();
        for (Step step : process.getSteps().values()) {
            ids.put(step.id(), unique(sanitizeId(TerminalKind.stripPrefix(step.id())), used));
        }
        return ids;
    }

    private Map<String, String> allocateLaneIds(Set<String> laneKeys, Iterable<String> nodeIds) {
        Set<String> used = new HashSet<>();
        for (String nodeId : nodeIds) {
            used.add(nodeId);
        }
        Map<String, String> ids = new LinkedHashMap<>();
        for (String key : laneKeys) {
            ids.put(key, unique("lane_" + sanitizeId(key), used));
        }
        return ids;
    }

    private static String nodeIdOf(String targetId, String raw, Map<String, String> nodeIds) {
        if (targetId != null && nodeIds.containsKey(targetId)) {
            return nodeIds.get(targetId);
        }
        return sanitizeId(TerminalKind.stripPrefix(targetId != null ? targetId : raw));
    }

    private static String unique(String base, Set<String> used) {
        String candidate = base;
        int suffix = 2;
        while (!used.add(candidate)) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    /// Turns free text into a Mermaid node id.
    ///
    /// Characters outside `[A-Za-z0-9_]` become underscores, a leading digit gets a
    /// `step_` prefix and Mermaid keywords get a `node_` prefix.
    static String sanitizeId(String text) {
        String id = text.replaceAll("[^a-zA-Z0-9_]", "_");
        if (id.isEmpty()) {
            return "step";
        }
        if (Character.isDigit(id.charAt(0))) {
            return "step_" + id;
        }
        if (RESERVED_KEYWORDS.contains(id.toLowerCase(Locale.ROOT))) {
            return "node_" + id;
        }
        return id;
    }

    /// Escapes label text for use inside double quotes.
    static String escape(String text) {
        String flat = flatten(text);
        StringBuilder sb = new StringBuilder(flat.length());
        for (int i = 0; i < flat.length(); i++) {
            char c = flat.charAt(i);
            switch (c) {
                case '#' -> sb.append("#35;");
                case '"' -> sb.append("#quot;");
                case '<' -> sb.append("#lt;");
                case '>' -> sb.append("#gt;");
                case '&' -> sb.append("#amp;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String flatten(String text) {
        return text == null ? "" : text.replaceAll("\\s*[\\r\\n]+\\s*", " ").trim();
    }

    private static String linkStyle(int index, String color) {
        return "linkStyle " + index + " stroke:" + color + ",stroke-width:2px";
    }

    private static boolean isSystemStep(Step.Action action) {
        String mode = action.attributes().get(Step.MANUAL_SYSTEM);
        return mode != null && !mode.isBlank() && !isManual(mode);
    }

    private static boolean isManual(String mode) {
        return "MANUAL".equalsIgnoreCase(mode.trim());
    }
}
