package io.laminar.core.exception;

import java.io.Serial;
import java.util.Locale;

/// Thrown in forced-template mode when the sheet scores below the confidence threshold.
public class LowConfidenceException extends LaminarException {

    @Serial private static final long serialVersionUID = 7310259481135702236L;

    private final double confidence;
    private final double threshold;

    /// @param confidence computed template confidence in `[0, 1]`
    /// @param threshold configured minimum confidence
    public LowConfidenceException(double confidence, double threshold) {
        super(
                String.format(
                        Locale.ROOT,
                        "Template confidence %.2f is below threshold %.2f",
                        confidence,
                        threshold));
        this.confidence = confidence;
        this.threshold = threshold;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getThreshold() {
        return threshold;
    }
}
