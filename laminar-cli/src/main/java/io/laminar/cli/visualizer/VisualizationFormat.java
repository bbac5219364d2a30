package io.laminar.cli.visualizer;

import io.laminar.core.model.Process;

/// Strategy for rendering a process graph in one output format.
///
/// Implementations are discovered via CDI and registered in {@link ProcessVisualizer}.
///
/// ### Built-in Formats
/// - `mermaid` - swim-laned Mermaid flowchart ({@link MermaidVisualizationFormat})
/// - `text` - lane-by-lane listing with ANSI colors ({@link TextVisualizationFormat})
public interface VisualizationFormat {

    /// Returns the name used to select this format on the command line.
    ///
    /// @return format name, e.g. "text" or "mermaid", never null
    String getName();

    /// Renders a process.
    ///
    /// @param process built process, not null
    /// @param useColor whether ANSI codes may be used; formats meant for files ignore it
    /// @return rendered text, never null
    String render(Process process, boolean useColor);
}
