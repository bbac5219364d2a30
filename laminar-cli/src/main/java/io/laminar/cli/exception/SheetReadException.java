package io.laminar.cli.exception;

import io.laminar.core.exception.LaminarException;
import java.io.Serial;

/// Thrown when an input file cannot be opened or a requested sheet does not exist.
///
/// Unlike per-sheet failures this ends the command before any sheet is processed.
public class SheetReadException extends LaminarException {

    @Serial private static final long serialVersionUID = 2873015549120776301L;

    public SheetReadException(String message) {
        super(message);
    }

    public SheetReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
