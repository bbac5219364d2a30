package io.laminar.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable process graph built from one sheet.
///
/// A process holds its roles and steps in insertion order. Step insertion order is the
/// layout tie-break used by the diagram compiler, so it is preserved exactly as the
/// source declared it.
///
/// ### Duplicates
/// The builder does not reject duplicate step ids. The full declared sequence is kept in
/// {@link #getDeclaredSteps()} so the validator can report them; {@link #getSteps()} keeps
/// the first occurrence of each id.
///
/// @implNote Immutable and thread-safe after construction.
/// @see io.laminar.core.graph.GraphBuilder
/// @see io.laminar.core.graph.GraphValidator
public final class Process {

    private final String id;
    private final String name;
    private final Map<String, Role> roles;
    private final List<Step> declaredSteps;
    private final Map<String, Step> steps;

    private Process(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Process ID required");
        this.name = builder.name != null ? builder.name : builder.id;
        this.roles = Collections.unmodifiableMap(new LinkedHashMap<>(builder.roles));
        this.declaredSteps = List.copyOf(builder.steps);

        Map<String, Step> byId = new LinkedHashMap<>();
        for (Step step : declaredSteps) {
            byId.putIfAbsent(step.id(), step);
        }
        this.steps = Collections.unmodifiableMap(byId);
    }

    /// Returns the process identifier.
    ///
    /// @return process id, never null
    public String getId() {
        return id;
    }

    /// Returns the human-readable process name.
    ///
    /// @return name, falls back to the id, never null
    public String getName() {
        return name;
    }

    /// Returns roles by id in registration order.
    ///
    /// @return unmodifiable map, never null
    public Map<String, Role> getRoles() {
        return roles;
    }

    /// Returns steps by id in insertion order, first occurrence of each id.
    ///
    /// @return unmodifiable map, never null
    public Map<String, Step> getSteps() {
        return steps;
    }

    /// Returns every step as declared, duplicates included.
    ///
    /// @return unmodifiable list, never null
    public List<Step> getDeclaredSteps() {
        return declaredSteps;
    }

    public Optional<Step> getStep(String stepId) {
        return Optional.ofNullable(steps.get(stepId));
    }

    /// Counts outgoing references over all steps.
    ///
    /// @return number of edges a diagram of this process draws
    public int edgeCount() {
        int count = 0;
        for (Step step : steps.values()) {
            count += step.edges().size();
        }
        return count;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link Process}.
    ///
    /// Required field: `id`. Roles are keyed by id; registering the same id twice keeps
    /// the first registration.
    public static final class Builder {
        private String id;
        private String name;
        private final Map<String, Role> roles = new LinkedHashMap<>();
        private final List<Step> steps = new ArrayList<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /// Registers a role unless one with the same id exists.
        ///
        /// @param role role to add, not null
        /// @return this builder for chaining
        public Builder role(Role role) {
            roles.putIfAbsent(role.id(), role);
            return this;
        }

        public Builder roles(Iterable<Role> roles) {
            for (Role role : roles) {
                role(role);
            }
            return this;
        }

        /// Appends a step to the declared sequence.
        ///
        /// @param step step to add, not null
        /// @return this builder for chaining
        public Builder step(Step step) {
            steps.add(Objects.requireNonNull(step, "step must not be null"));
            return this;
        }

        public Builder steps(Iterable<? extends Step> steps) {
            for (Step step : steps) {
                step(step);
            }
            return this;
        }

        /// Builds the immutable process.
        ///
        /// @return new Process, never null
        /// @throws NullPointerException if id is null
        public Process build() {
            return new Process(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Process other)) return false;
        return id.equals(other.id)
                && name.equals(other.name)
                && roles.equals(other.roles)
                && declaredSteps.equals(other.declaredSteps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, roles, declaredSteps);
    }

    @Override
    public String toString() {
        return "Process{id='" + id + "', roles=" + roles.size() + ", steps=" + steps.size() + "}";
    }
}
