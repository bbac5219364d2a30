package io.laminar.core.graph;

/// Step variant a row or document entry is classified as.
public enum RowKind {
    ACTION,
    CONDITION,
    TERMINAL
}
