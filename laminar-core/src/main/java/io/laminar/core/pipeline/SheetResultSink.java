package io.laminar.core.pipeline;

import java.io.IOException;

/// Receives every successfully processed sheet, e.g. to write its files.
///
/// @implNote Called from worker threads; implementations serialize their own writes.
@FunctionalInterface
public interface SheetResultSink {

    /// Ignores every result.
    SheetResultSink DISCARD = result -> {};

    /// Accepts a result.
    ///
    /// @param result processed sheet, not null
    /// @throws IOException if the result cannot be stored; the sheet then counts as failed
    void accept(SheetResult result) throws IOException;
}
