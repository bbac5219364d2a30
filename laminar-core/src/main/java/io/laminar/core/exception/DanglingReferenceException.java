package io.laminar.core.exception;

import io.laminar.core.graph.Finding;
import java.io.Serial;
import java.util.List;

/// A step refers to a step that does not exist or could not be resolved.
public class DanglingReferenceException extends ProcessValidationException {

    @Serial private static final long serialVersionUID = 3190556254129835617L;

    public DanglingReferenceException(String message, List<Finding> findings) {
        super(message, findings);
    }
}
