package io.laminar.core.extraction;

/// Path a sheet actually took.
public enum ExtractionMethod {
    TEMPLATE,
    AI
}
