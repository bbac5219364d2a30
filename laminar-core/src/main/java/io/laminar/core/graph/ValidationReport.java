package io.laminar.core.graph;

import java.util.List;

/// Ordered findings of a validation run.
///
/// @param findings findings in detection order, not null
public record ValidationReport(List<Finding> findings) {

    public ValidationReport {
        findings = findings != null ? List.copyOf(findings) : List.of();
    }

    /// Returns whether no fatal finding was produced.
    public boolean isValid() {
        return findings.stream().noneMatch(Finding::isFatal);
    }

    public List<Finding> fatal() {
        return findings.stream().filter(Finding::isFatal).toList();
    }

    public List<Finding> warnings() {
        return findings.stream().filter(f -> f.severity() == Severity.WARNING).toList();
    }

    /// Returns findings of one kind.
    public List<Finding> ofKind(FindingKind kind) {
        return findings.stream().filter(f -> f.kind() == kind).toList();
    }
}
