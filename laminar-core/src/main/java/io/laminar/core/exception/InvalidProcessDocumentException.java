package io.laminar.core.exception;

import java.io.Serial;

/// Thrown when a canonical process document cannot be mapped onto the process model,
/// for example when `process_steps` is missing or a step has no `step_id`.
public class InvalidProcessDocumentException extends LaminarException {

    @Serial private static final long serialVersionUID = 6610472958826103347L;

    public InvalidProcessDocumentException(String message) {
        super(message);
    }

    public InvalidProcessDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
