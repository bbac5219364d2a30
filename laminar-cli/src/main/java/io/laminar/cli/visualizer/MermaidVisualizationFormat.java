package io.laminar.cli.visualizer;

import io.laminar.core.LaminarConfig;
import io.laminar.core.diagram.DiagramCompiler;
import io.laminar.core.diagram.MermaidDiagramCompiler;
import io.laminar.core.model.Process;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/// Mermaid flowchart output, identical to the `_flowchart.mmd` file written by a conversion.
///
/// The text can be pasted into GitHub or GitLab Markdown or rendered at
/// [mermaid.live](https://mermaid.live).
///
/// @implNote Thread-safe. Colors are never applied.
/// @see MermaidDiagramCompiler
@ApplicationScoped
public class MermaidVisualizationFormat implements VisualizationFormat {

    private final DiagramCompiler compiler;

    @Inject
    public MermaidVisualizationFormat(LaminarConfig config) {
        this.compiler = new MermaidDiagramCompiler(config);
    }

    @Override
    public String getName() {
        return "mermaid";
    }

    @Override
    public String render(Process process, boolean useColor) {
        return compiler.compile(process);
    }
}
