package io.laminar.core.graph;

import io.laminar.core.model.Process;
import java.util.List;
import java.util.Objects;

/// Result of building a process graph: the graph and the notes collected on the way.
///
/// @param process the built graph, not yet validated, not null
/// @param findings ambiguity and registration notes, not null
public record GraphBuild(Process process, List<Finding> findings) {

    public GraphBuild {
        Objects.requireNonNull(process, "process must not be null");
        findings = findings != null ? List.copyOf(findings) : List.of();
    }
}
