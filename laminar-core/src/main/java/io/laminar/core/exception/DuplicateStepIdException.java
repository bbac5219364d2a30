package io.laminar.core.exception;

import io.laminar.core.graph.Finding;
import java.io.Serial;
import java.util.List;

/// Two or more steps share an identifier.
public class DuplicateStepIdException extends ProcessValidationException {

    @Serial private static final long serialVersionUID = -5521093338217402181L;

    public DuplicateStepIdException(String message, List<Finding> findings) {
        super(message, findings);
    }
}
