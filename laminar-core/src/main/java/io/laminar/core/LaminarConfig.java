package io.laminar.core;

import io.laminar.core.diagram.DiagramPalette;
import io.laminar.core.template.AliasTable;
import java.time.Duration;
import java.util.Objects;

/// Immutable settings shared by every stage of the pipeline.
///
/// One instance is created at startup and passed explicitly to the stages that need it.
/// Worker threads of a batch share it without synchronization.
///
/// ### Default Values
/// - `confidenceThreshold`: `0.7`
/// - `workers`: `4`
/// - `collaboratorTimeout`: 120 seconds
/// - `collaboratorMaxAttempts`: `3`
/// - `collaboratorBackoff`: 2 seconds, doubled per retry
/// - `includeNotes`: `true`, `includeMetadata`: `false`, `markdownFence`: `false`
/// - `direction`: `TD`
///
/// @implNote Immutable and thread-safe.
/// @see Builder
public final class LaminarConfig {

    private final AliasTable aliases;
    private final double confidenceThreshold;
    private final int workers;
    private final Duration collaboratorTimeout;
    private final int collaboratorMaxAttempts;
    private final Duration collaboratorBackoff;
    private final DiagramPalette palette;
    private final boolean includeNotes;
    private final boolean includeMetadata;
    private final boolean markdownFence;
    private final String direction;

    private LaminarConfig(Builder builder) {
        this.aliases = Objects.requireNonNull(builder.aliases, "aliases required");
        this.confidenceThreshold = builder.confidenceThreshold;
        this.workers = builder.workers;
        this.collaboratorTimeout =
                Objects.requireNonNull(builder.collaboratorTimeout, "timeout required");
        this.collaboratorMaxAttempts = builder.collaboratorMaxAttempts;
        this.collaboratorBackoff =
                Objects.requireNonNull(builder.collaboratorBackoff, "backoff required");
        this.palette = Objects.requireNonNull(builder.palette, "palette required");
        this.includeNotes = builder.includeNotes;
        this.includeMetadata = builder.includeMetadata;
        this.markdownFence = builder.markdownFence;
        this.direction = Objects.requireNonNull(builder.direction, "direction required");

        if (Double.isNaN(confidenceThreshold)
                || confidenceThreshold < 0.0
                || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException(
                    "confidenceThreshold must be within [0, 1]: " + confidenceThreshold);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be positive: " + workers);
        }
        if (collaboratorMaxAttempts < 1) {
            throw new IllegalArgumentException(
                    "collaboratorMaxAttempts must be positive: " + collaboratorMaxAttempts);
        }
        if (!direction.matches("TD|TB|BT|LR|RL")) {
            throw new IllegalArgumentException("Unsupported flowchart direction: " + direction);
        }
    }

    /// Returns a configuration with every default.
    public static LaminarConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder pre-filled with this configuration.
    public Builder toBuilder() {
        return new Builder()
                .aliases(aliases)
                .confidenceThreshold(confidenceThreshold)
                .workers(workers)
                .collaboratorTimeout(collaboratorTimeout)
                .collaboratorMaxAttempts(collaboratorMaxAttempts)
                .collaboratorBackoff(collaboratorBackoff)
                .palette(palette)
                .includeNotes(includeNotes)
                .includeMetadata(includeMetadata)
                .markdownFence(markdownFence)
                .direction(direction);
    }

    /// Returns the header alias table used by column resolution.
    public AliasTable getAliases() {
        return aliases;
    }

    /// Returns the minimum template confidence for taking the template path.
    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    /// Returns the number of sheets processed concurrently.
    public int getWorkers() {
        return workers;
    }

    public Duration getCollaboratorTimeout() {
        return collaboratorTimeout;
    }

    public int getCollaboratorMaxAttempts() {
        return collaboratorMaxAttempts;
    }

    /// Returns the delay before the first retry; each further retry doubles it.
    public Duration getCollaboratorBackoff() {
        return collaboratorBackoff;
    }

    public DiagramPalette getPalette() {
        return palette;
    }

    /// Returns whether step notes are emitted as diagram annotations.
    public boolean isIncludeNotes() {
        return includeNotes;
    }

    /// Returns whether manual/system and program metadata are appended to step labels.
    public boolean isIncludeMetadata() {
        return includeMetadata;
    }

    /// Returns whether the diagram is wrapped in a Markdown code fence.
    public boolean isMarkdownFence() {
        return markdownFence;
    }

    /// Returns the flowchart direction keyword, e.g. `TD`.
    public String getDirection() {
        return direction;
    }

    /// Fluent builder for {@link LaminarConfig}.
    public static final class Builder {
        private AliasTable aliases = AliasTable.defaults();
        private double confidenceThreshold = 0.7;
        private int workers = 4;
        private Duration collaboratorTimeout = Duration.ofSeconds(120);
        private int collaboratorMaxAttempts = 3;
        private Duration collaboratorBackoff = Duration.ofSeconds(2);
        private DiagramPalette palette = DiagramPalette.defaults();
        private boolean includeNotes = true;
        private boolean includeMetadata;
        private boolean markdownFence;
        private String direction = "TD";

        private Builder() {}

        public Builder aliases(AliasTable aliases) {
            this.aliases = aliases;
            return this;
        }

        /// Sets the minimum template confidence.
        ///
        /// @param confidenceThreshold value within `[0, 1]`
        /// @return this builder for chaining
        public Builder confidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
            return this;
        }

        /// Sets the worker pool size for batch processing.
        ///
        /// @param workers positive thread count
        /// @return this builder for chaining
        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder collaboratorTimeout(Duration collaboratorTimeout) {
            this.collaboratorTimeout = collaboratorTimeout;
            return this;
        }

        public Builder collaboratorMaxAttempts(int collaboratorMaxAttempts) {
            this.collaboratorMaxAttempts = collaboratorMaxAttempts;
            return this;
        }

        public Builder collaboratorBackoff(Duration collaboratorBackoff) {
            this.collaboratorBackoff = collaboratorBackoff;
            return this;
        }

        public Builder palette(DiagramPalette palette) {
            this.palette = palette;
            return this;
        }

        public Builder includeNotes(boolean includeNotes) {
            this.includeNotes = includeNotes;
            return this;
        }

        public Builder includeMetadata(boolean includeMetadata) {
            this.includeMetadata = includeMetadata;
            return this;
        }

        public Builder markdownFence(boolean markdownFence) {
            this.markdownFence = markdownFence;
            return this;
        }

        public Builder direction(String direction) {
            this.direction = direction;
            return this;
        }

        /// Builds the configuration.
        ///
        /// @return new instance, never null
        /// @throws IllegalArgumentException if a value is out of range
        public LaminarConfig build() {
            return new LaminarConfig(this);
        }
    }
}
