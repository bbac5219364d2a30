package io.laminar.core.diagram;

import java.util.Objects;

/// Colors used by the diagram compiler.
///
/// @param yesEdge stroke of yes edges
/// @param noEdge stroke of no edges
/// @param laneFill swimlane background
/// @param laneStroke swimlane border
/// @param systemStepFill background of system-executed steps
/// @param terminalFill background of START/END/ABORT
/// @param border default node border
public record DiagramPalette(
        String yesEdge,
        String noEdge,
        String laneFill,
        String laneStroke,
        String systemStepFill,
        String terminalFill,
        String border) {

    public DiagramPalette {
        Objects.requireNonNull(yesEdge, "yesEdge must not be null");
        Objects.requireNonNull(noEdge, "noEdge must not be null");
        Objects.requireNonNull(laneFill, "laneFill must not be null");
        Objects.requireNonNull(laneStroke, "laneStroke must not be null");
        Objects.requireNonNull(systemStepFill, "systemStepFill must not be null");
        Objects.requireNonNull(terminalFill, "terminalFill must not be null");
        Objects.requireNonNull(border, "border must not be null");
    }

    /// Green yes, red no, light blue lanes.
    public static DiagramPalette defaults() {
        return new DiagramPalette(
                "#2e7d32", "#c62828", "#e8f4fc", "#4a86c7", "#b8d4e8", "#e8f4fc", "#333");
    }
}
