package io.laminar.core.exception;

import io.laminar.core.graph.Finding;
import io.laminar.core.graph.FindingKind;
import io.laminar.core.graph.ValidationReport;
import java.io.Serial;
import java.util.List;

/// Thrown when a process graph violates a structural invariant.
///
/// Carries every finding produced by the validator, warnings included, so callers can
/// report the complete picture. The concrete subclass reflects the first fatal finding:
///
/// | First fatal finding | Exception |
/// |---------------------|-----------|
/// | duplicate step id | {@link DuplicateStepIdException} |
/// | dangling reference | {@link DanglingReferenceException} |
/// | incomplete condition | {@link IncompleteConditionException} |
/// | anything else | this class |
///
/// @see io.laminar.core.graph.GraphValidator#validateOrThrow
public class ProcessValidationException extends LaminarException {

    @Serial private static final long serialVersionUID = 1960817384410723150L;

    private final transient List<Finding> findings;

    public ProcessValidationException(String message, List<Finding> findings) {
        super(message);
        this.findings = List.copyOf(findings);
    }

    /// Returns all findings of the failed validation run.
    ///
    /// @return unmodifiable list in detection order, never null
    public List<Finding> getFindings() {
        return findings;
    }

    /// Creates the exception matching the first fatal finding of a report.
    ///
    /// @param report a report containing at least one fatal finding, not null
    /// @return the most specific exception type, never null
    /// @throws IllegalArgumentException if the report has no fatal finding
    public static ProcessValidationException from(ValidationReport report) {
        Finding first =
                report.fatal().stream()
                        .findFirst()
                        .orElseThrow(
                                () -> new IllegalArgumentException("Report has no fatal finding"));
        String message = first.describe();
        int more = report.fatal().size() - 1;
        if (more > 0) {
            message += " (and " + more + " more)";
        }
        FindingKind kind = first.kind();
        if (kind == FindingKind.DUPLICATE_STEP_ID) {
            return new DuplicateStepIdException(message, report.findings());
        }
        if (kind == FindingKind.DANGLING_REFERENCE) {
            return new DanglingReferenceException(message, report.findings());
        }
        if (kind == FindingKind.INCOMPLETE_CONDITION) {
            return new IncompleteConditionException(message, report.findings());
        }
        return new ProcessValidationException(message, report.findings());
    }
}
