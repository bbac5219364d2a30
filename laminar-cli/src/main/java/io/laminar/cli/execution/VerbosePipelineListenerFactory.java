package io.laminar.cli.execution;

import io.laminar.core.pipeline.PipelineListener;
import jakarta.enterprise.context.ApplicationScoped;

/// Creates {@link VerbosePipelineListener} instances for a command run.
///
/// @implNote Application-scoped. Creates a new listener per call.
@ApplicationScoped
public class VerbosePipelineListenerFactory {

    /// Creates a listener printing to System.out.
    ///
    /// @param useColor whether to apply ANSI color codes
    /// @param showDiagram whether to print each compiled diagram
    /// @return new listener, never null
    public PipelineListener create(boolean useColor, boolean showDiagram) {
        return new VerbosePipelineListener(System.out, useColor, showDiagram);
    }
}
