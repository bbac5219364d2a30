package io.laminar.core.graph;

/// How much a finding matters.
public enum Severity {
    /// Informational note; nothing is wrong.
    INFO,
    /// Suspicious structure; the diagram is still produced.
    WARNING,
    /// Broken structure; the sheet fails.
    FATAL
}
