/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.core;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import io.github.graydavid.dragrace.core.Hooks.Step;

/**
 * A single test (i.e. an "it" block): a unit of work bound to the Scope it was declared in. TestCases are leaves of the
 * scope tree, but Scopes don't know about them: {@link FlagMan} keeps all TestCases in a flat list in registration
 * order.
 * 
 * Besides its immutable declaration, a TestCase tracks two pieces of run state: how many times it's been retried and
 * the failure from its last failed attempt. Both are only ever modified by the single retry loop that FlagMan runs for
 * the TestCase, but they're readable by observers on any thread.
 */
public class TestCase {
    private final String description;
    private final Scope scope;
    private final Step body;
    private final boolean only;
    private final boolean skip;
    private volatile int retries;
    private volatile Throwable failure;

    /**
     * @param body the test body, or null for a pending test that is always skipped.
     */
    TestCase(String description, Scope scope, Step body, boolean only, boolean skip) {
        this.description = Objects.requireNonNull(description);
        this.scope = Objects.requireNonNull(scope);
        this.body = body;
        this.only = only;
        this.skip = skip;
    }

    public Scope getScope() {
        return scope;
    }

    /** Returns the owning scope's full description followed by this test's own description, trimmed. */
    public String getDescription() {
        return (scope.getDescription() + " " + description).trim();
    }

    /** Answers whether this test or any of its scopes is marked as only'ed. */
    public boolean isOnly() {
        return scope.isOnly() || only;
    }

    /** Answers whether this test should be skipped: it or any of its scopes is marked so, or it has no body. */
    public boolean isSkip() {
        return scope.isSkip() || skip || body == null;
    }

    /** Answers whether this test was declared without a body. */
    public boolean isPending() {
        return body == null;
    }

    /** Returns the number of times this test has been retried so far. */
    public int getRetries() {
        return retries;
    }

    void incrementRetries() {
        retries++;
    }

    void recordFailure(Throwable failure) {
        this.failure = Objects.requireNonNull(failure);
    }

    /**
     * Returns the failure from this test's latest attempt, if that attempt failed. While a new attempt is in progress,
     * there is no failure.
     */
    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Runs one attempt of this test: acquires a context from the owning scope, runs the body against it, and then, only
     * if the body succeeds, runs the scope's afterEach hooks against the same context. Any failure along the way (in a
     * before or beforeEach hook, the body, or an afterEach hook) is recorded on this test.
     * 
     * @return a future that completes when the attempt is done, failing with the original, unwrapped throwable if the
     *         attempt failed.
     * @throws IllegalStateException if this test has no body.
     */
    public CompletableFuture<Void> execute() {
        if (body == null) {
            throw new IllegalStateException("Pending tests have no body to execute: " + getDescription());
        }

        failure = null;
        CompletableFuture<Void> attempt = scope.context()
                .thenCompose(context -> body.invoke(context).thenCompose(ignore -> scope.applyAfterEach(context)));

        CompletableFuture<Void> result = new CompletableFuture<>();
        attempt.whenComplete((ignore, throwable) -> {
            if (throwable == null) {
                result.complete(null);
            } else {
                Throwable unwrapped = Failures.unwrap(throwable);
                recordFailure(unwrapped);
                result.completeExceptionally(unwrapped);
            }
        });
        return result;
    }

    @Override
    public String toString() {
        return "TestCase[" + getDescription() + "]";
    }
}
