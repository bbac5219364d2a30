package io.laminar.core.pipeline;

import java.util.List;

/// Outcome of a batch, one entry per sheet in submission order.
///
/// @param outcomes per-sheet outcomes, not null
public record BatchSummary(List<SheetOutcome> outcomes) {

    public BatchSummary {
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
    }

    public List<SheetOutcome> succeeded() {
        return withStatus(SheetOutcome.Status.SUCCEEDED);
    }

    public List<SheetOutcome> failed() {
        return withStatus(SheetOutcome.Status.FAILED);
    }

    public List<SheetOutcome> cancelled() {
        return withStatus(SheetOutcome.Status.CANCELLED);
    }

    /// Returns the process exit status: `0` when every sheet succeeded, `1` otherwise.
    public int exitCode() {
        return succeeded().size() == outcomes.size() ? 0 : 1;
    }

    private List<SheetOutcome> withStatus(SheetOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).toList();
    }
}
