/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.core;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Indicates that one or more Scopes failed to clean up (i.e. their after hooks failed) during the drain phase of a
 * {@link FlagMan} run. Every individual failure is available through {@link #getFailures()} and is also attached as a
 * suppressed exception.
 */
public class DrainException extends RuntimeException {
    private static final long serialVersionUID = 1;

    // Scopes aren't Serializable, so this is null after deserialization
    private final transient List<ScopeFailure> failures;

    public DrainException(List<ScopeFailure> failures) {
        super(createMessage(failures));
        this.failures = List.copyOf(failures);
        this.failures.forEach(failure -> addSuppressed(failure.getFailure()));
    }

    private static String createMessage(List<ScopeFailure> failures) {
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("DrainExceptions require at least one failure");
        }
        String scopes = failures.stream()
                .map(failure -> "'" + failure.getScope().getDescription() + "'")
                .collect(Collectors.joining(", "));
        return String.format("%d scope(s) failed to clean up: %s", failures.size(), scopes);
    }

    /**
     * Returns each failed clean-up, in the order the Scopes were drained. A deserialized DrainException has lost its
     * Scopes, so this returns an empty list for it; the failures themselves are still available as
     * {@link #getSuppressed()}.
     */
    public List<ScopeFailure> getFailures() {
        return (failures == null) ? List.of() : failures;
    }

    /** Pairs a Scope with the failure of its clean-up. */
    public static class ScopeFailure {
        private final Scope scope;
        private final Throwable failure;

        public ScopeFailure(Scope scope, Throwable failure) {
            this.scope = Objects.requireNonNull(scope);
            this.failure = Objects.requireNonNull(failure);
        }

        public Scope getScope() {
            return scope;
        }

        public Throwable getFailure() {
            return failure;
        }

        @Override
        public String toString() {
            return scope + " -> " + failure;
        }
    }
}
