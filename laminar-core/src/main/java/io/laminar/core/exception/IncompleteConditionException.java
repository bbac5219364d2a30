package io.laminar.core.exception;

import io.laminar.core.graph.Finding;
import java.io.Serial;
import java.util.List;

/// A condition step lacks its yes or no branch.
public class IncompleteConditionException extends ProcessValidationException {

    @Serial private static final long serialVersionUID = -8045717208931376490L;

    public IncompleteConditionException(String message, List<Finding> findings) {
        super(message, findings);
    }
}
