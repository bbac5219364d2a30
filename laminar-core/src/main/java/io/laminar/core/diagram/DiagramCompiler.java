package io.laminar.core.diagram;

import io.laminar.core.model.Process;

/// Compiles a validated process into diagram source text.
///
/// Implementations must be pure: the same process always yields byte-identical output.
@FunctionalInterface
public interface DiagramCompiler {

    /// Compiles a process.
    ///
    /// @param process validated process, not null
    /// @return diagram definition, never null
    String compile(Process process);
}
