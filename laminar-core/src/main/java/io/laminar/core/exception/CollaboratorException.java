package io.laminar.core.exception;

import java.io.Serial;

/// Thrown when the AI extraction collaborator fails to produce a process document.
///
/// A failure is either transient (network error, timeout, malformed or non-JSON answer)
/// and worth retrying, or permanent (missing credentials, unsupported model) and
/// reported immediately.
///
/// @see io.laminar.core.extraction.RetryingExtractionCollaborator
public class CollaboratorException extends LaminarException {

    @Serial private static final long serialVersionUID = -3324780115264018557L;

    private final boolean transientFailure;

    /// Creates exception with message.
    ///
    /// @param message description of the failure, not null
    /// @param transientFailure `true` if a retry may succeed
    public CollaboratorException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    /// Creates exception with message and cause.
    ///
    /// @param message description of the failure, not null
    /// @param cause the underlying exception
    /// @param transientFailure `true` if a retry may succeed
    public CollaboratorException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    /// Returns whether the failure may go away on retry.
    ///
    /// @return `true` for transient failures
    public boolean isTransient() {
        return transientFailure;
    }
}
