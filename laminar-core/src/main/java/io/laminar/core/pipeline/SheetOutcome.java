package io.laminar.core.pipeline;

import java.util.Objects;

/// Final state of one sheet in a batch.
///
/// @param sheetName sheet name, not null
/// @param status how the sheet ended, not null
/// @param result processed sheet, only for {@link Status#SUCCEEDED}
/// @param error failure message, only for {@link Status#FAILED}
public record SheetOutcome(String sheetName, Status status, SheetResult result, String error) {

    public SheetOutcome {
        Objects.requireNonNull(sheetName, "sheetName must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public enum Status {
        SUCCEEDED,
        FAILED,
        CANCELLED
    }

    public static SheetOutcome succeeded(SheetResult result) {
        return new SheetOutcome(result.sheetName(), Status.SUCCEEDED, result, null);
    }

    public static SheetOutcome failed(String sheetName, String error) {
        return new SheetOutcome(sheetName, Status.FAILED, null, error);
    }

    public static SheetOutcome cancelled(String sheetName) {
        return new SheetOutcome(sheetName, Status.CANCELLED, null, null);
    }
}
