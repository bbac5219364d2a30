package io.laminar.core.exception;

import java.io.Serial;

/// Base type for every recoverable failure raised while turning a sheet into a diagram.
///
/// Failures are scoped to a single sheet. Batch processing catches this type per sheet,
/// records the message and continues with the remaining sheets.
///
/// @see io.laminar.core.pipeline.SheetPipeline
public class LaminarException extends Exception {

    @Serial private static final long serialVersionUID = 4418301675230199514L;

    /// Creates exception with message.
    ///
    /// @param message description of the failure, not null
    public LaminarException(String message) {
        super(message);
    }

    /// Creates exception with message and cause.
    ///
    /// @param message description of the failure, not null
    /// @param cause the underlying exception
    public LaminarException(String message, Throwable cause) {
        super(message, cause);
    }
}
