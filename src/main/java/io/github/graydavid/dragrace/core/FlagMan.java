/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.dragrace.core.DrainException.ScopeFailure;
import io.github.graydavid.dragrace.core.RaceObservers.EventBus;
import io.github.graydavid.dragrace.core.RaceObservers.Observer;
/**
 * The test runner: the one who waves the flag. FlagMan owns the tree of Scopes and the flat list of TestCases declared
 * through its {@link Declarations}, decides which tests to run, runs them under bounded concurrency with retries, and
 * emits lifecycle events to its observers.
 * 
 * A run ({@link #go()}) proceeds through the following phases:<br>
 * 1. Selecting -- if any test is effectively only'ed, only those tests are selected; otherwise, all tests are.<br>
 * 2. Running -- "begin" is emitted, and then each selected test is admitted in registration order, with at most
 * "concurrency" tests in flight at any time. Skipped tests just emit "pending". Others emit "start", are executed
 * (and re-executed on failure while retries remain, emitting "retry" each time), emit "pass" or "fail" once settled,
 * and finally emit "finish". A test keeps its slot while retrying.<br>
 * 3. Draining -- once every selected test is done, every registered Scope is cleaned, one at a time in registration
 * order. A failed clean-up doesn't stop the others.<br>
 * 4. Done -- "end" is emitted, whether or not draining succeeded.
 * 
 * Concurrency here is about overlap, not threads. By default, every test attempt starts on the thread that happens to
 * be driving the run, so only hooks and bodies that suspend (i.e. callback-style ones that complete later) actually
 * overlap. Users who want blocking, direct-style bodies to overlap should supply an {@link Executor} through
 * {@link Builder#executor(Executor)}; every test attempt is then started on that executor.
 * 
 * Each FlagMan can only be run once. Declaring scopes and tests happens-before the run, and no more declarations are
 * allowed once the run starts.
 */
public class FlagMan {
    private static final Logger LOG = LoggerFactory.getLogger(FlagMan.class);

    private final int concurrency;
    private final int maxRetry;
    private final Executor executor;
    private final EventBus events;
    private final Scope root;
    private final List<Scope> scopes;
    private final List<TestCase> tests;
    private final Declarations declarations;
    private final AtomicBoolean started;

    private FlagMan(Builder builder) {
        this.concurrency = builder.concurrency;
        this.maxRetry = builder.maxRetry;
        this.executor = builder.executor;
        this.events = new EventBus();
        builder.observers.forEach(events::subscribe);
        this.root = Scope.root();
        this.scopes = new ArrayList<>();
        this.tests = new ArrayList<>();
        this.declarations = new Declarations(this, root);
        this.started = new AtomicBoolean();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Creates a FlagMan with the given config's settings, subscribing the config's observer, if any. */
    public static FlagMan fromConfig(RaceConfig config) {
        Builder builder = builder().concurrency(config.getConcurrency()).maxRetry(config.getMaxRetry());
        config.createObserver().ifPresent(builder::observer);
        return builder.build();
    }

    /** Returns the surface through which scopes, hooks, and tests are declared into this FlagMan. */
    public Declarations declarations() {
        return declarations;
    }

    /** Subscribes an observer to this FlagMan's events. */
    public void subscribe(Observer observer) {
        events.subscribe(observer);
    }

    /** Returns the maximum number of tests in flight at once, or {@link RaceConfig#UNBOUNDED}. */
    public int getConcurrency() {
        return concurrency;
    }

    public int getMaxRetry() {
        return maxRetry;
    }

    public List<Observer> getObservers() {
        return events.getObservers();
    }

    /** Returns every declared Scope in registration order. The hidden root Scope is not included. */
    public List<Scope> getScopes() {
        return List.copyOf(scopes);
    }

    /** Returns every declared TestCase in registration order. */
    public List<TestCase> getTests() {
        return List.copyOf(tests);
    }

    void register(Scope scope) {
        requireNotStarted();
        scopes.add(scope);
    }

    void register(TestCase test) {
        requireNotStarted();
        tests.add(test);
    }

    void requireNotStarted() {
        if (started.get()) {
            throw new IllegalStateException("Cannot declare scopes, hooks, or tests once a run has started");
        }
    }

    /**
     * Runs all selected tests and then drains all scopes, as described in the class javadoc.
     * 
     * @return a future that completes once "end" has been emitted. It fails with a {@link DrainException} if any Scope
     *         failed to clean up. Test failures don't affect it: they're only reported through events. If an observer
     *         throws an exception after "begin", the run stops short and the future fails with that exception.
     * @throws IllegalStateException if this FlagMan has already been run.
     */
    public CompletableFuture<Void> go() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("FlagMan can only be run once");
        }

        List<TestCase> selected = select();
        LOG.debug("Selected {} of {} tests to run with concurrency {} and maxRetry {}", selected.size(), tests.size(),
                (concurrency == RaceConfig.UNBOUNDED) ? "unbounded" : concurrency, maxRetry);

        events.emit(RaceEvent.BEGIN, null);
        CompletableFuture<Void> drained = runAll(selected).thenCompose(ignore -> drain());

        CompletableFuture<Void> result = new CompletableFuture<>();
        drained.whenComplete((ignore, throwable) -> {
            Throwable endFailure = emitEnd();
            if (throwable == null) {
                if (endFailure == null) {
                    result.complete(null);
                } else {
                    result.completeExceptionally(endFailure);
                }
            } else {
                Throwable failure = Failures.unwrap(throwable);
                if (endFailure != null) {
                    failure.addSuppressed(endFailure);
                }
                result.completeExceptionally(failure);
            }
        });
        return result;
    }

    /** Emits "end", returning whatever an observer threw while handling it, or null. */
    private Throwable emitEnd() {
        try {
            events.emit(RaceEvent.END, null);
            return null;
        } catch (Throwable t) {
            return t;
        }
    }

    private List<TestCase> select() {
        List<TestCase> only = tests.stream().filter(TestCase::isOnly).collect(Collectors.toUnmodifiableList());
        return only.isEmpty() ? List.copyOf(tests) : only;
    }

    private CompletableFuture<Void> runAll(List<TestCase> selected) {
        Queue<TestCase> queue = new ConcurrentLinkedQueue<>(selected);
        int laneCount = (concurrency == RaceConfig.UNBOUNDED) ? selected.size()
                : Math.min(concurrency, selected.size());
        CompletableFuture<?>[] lanes = IntStream.range(0, laneCount)
                .mapToObj(i -> new Lane(queue).start())
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(lanes);
    }

    /**
     * One of the "concurrency" slots that tests run in. A lane repeatedly takes the next test from the shared queue and
     * runs it to completion before taking another. Tests that complete synchronously are handled in a loop rather than
     * through recursive callbacks, so that long runs of synchronous tests don't grow the stack.
     */
    private class Lane {
        private final Queue<TestCase> queue;
        private final CompletableFuture<Void> done;

        private Lane(Queue<TestCase> queue) {
            this.queue = queue;
            this.done = new CompletableFuture<>();
        }

        CompletableFuture<Void> start() {
            advance();
            return done;
        }

        private void advance() {
            try {
                runUntilSuspended();
            } catch (Throwable t) {
                done.completeExceptionally(t);
            }
        }

        private void runUntilSuspended() {
            for (TestCase test = queue.poll(); test != null; test = queue.poll()) {
                CompletableFuture<Void> run = runTest(test);
                if (!run.isDone() || run.isCompletedExceptionally()) {
                    run.whenComplete((ignore, throwable) -> {
                        if (throwable == null) {
                            advance();
                        } else {
                            done.completeExceptionally(throwable);
                        }
                    });
                    return;
                }
            }
            done.complete(null);
        }
    }

    private CompletableFuture<Void> runTest(TestCase test) {
        if (test.isSkip()) {
            events.emit(RaceEvent.PENDING, test);
            return CompletableFuture.completedFuture(null);
        }

        events.emit(RaceEvent.START, test);
        return runAttempts(test).thenRun(() -> events.emit(RaceEvent.FINISH, test));
    }

    private CompletableFuture<Void> runAttempts(TestCase test) {
        return attempt(test).handle((ignore, throwable) -> throwable).thenCompose(failure -> {
            if (failure == null) {
                events.emit(RaceEvent.PASS, test);
                return CompletableFuture.completedFuture(null);
            }
            if (test.getRetries() < maxRetry) {
                test.incrementRetries();
                LOG.debug("Retrying '{}' (retry {} of {})", test.getDescription(), test.getRetries(), maxRetry);
                events.emit(RaceEvent.RETRY, test);
                return runAttempts(test);
            }
            events.emit(RaceEvent.FAIL, test);
            return CompletableFuture.completedFuture(null);
        });
    }

    /** Starts one attempt of test on the executor. An executor that refuses the attempt fails it. */
    private CompletableFuture<Void> attempt(TestCase test) {
        try {
            return CompletableFuture.supplyAsync(test::execute, executor).thenCompose(Function.identity());
        } catch (RejectedExecutionException e) {
            test.recordFailure(e);
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<Void> drain() {
        LOG.debug("Draining {} scopes", scopes.size());
        List<ScopeFailure> failures = new ArrayList<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Scope scope : scopes) {
            chain = chain.thenCompose(ignore -> cleanRecordingFailure(scope, failures));
        }
        return chain.thenCompose(ignore -> failures.isEmpty() ? CompletableFuture.completedFuture(null)
                : CompletableFuture.failedFuture(new DrainException(failures)));
    }

    private static CompletableFuture<Void> cleanRecordingFailure(Scope scope, List<ScopeFailure> failures) {
        return scope.clean().handle((ignore, throwable) -> {
            if (throwable != null) {
                Throwable failure = Failures.unwrap(throwable);
                LOG.warn("Failed to clean up scope '{}'", scope.getDescription(), failure);
                failures.add(new ScopeFailure(scope, failure));
            }
            return null;
        });
    }

    public static class Builder {
        private int concurrency = RaceConfig.UNBOUNDED;
        private int maxRetry = 0;
        private Executor executor = Runnable::run;
        private final List<Observer> observers = new ArrayList<>();

        private Builder() {}

        /** Sets the maximum number of tests in flight at once. Any value <= 0 means unbounded, which is the default. */
        public Builder concurrency(int concurrency) {
            this.concurrency = Math.max(concurrency, RaceConfig.UNBOUNDED);
            return this;
        }

        /**
         * Sets how many times a failing test is retried. The default is 0.
         * 
         * @throws IllegalArgumentException if maxRetry is negative.
         */
        public Builder maxRetry(int maxRetry) {
            if (maxRetry < 0) {
                throw new IllegalArgumentException("maxRetry must be non-negative but was " + maxRetry);
            }
            this.maxRetry = maxRetry;
            return this;
        }

        /**
         * Sets the executor on which every test attempt is started. The default runs attempts on the calling thread.
         */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor);
            return this;
        }

        /** Adds an observer to subscribe to the built FlagMan. Can be called multiple times. */
        public Builder observer(Observer observer) {
            observers.add(Objects.requireNonNull(observer));
            return this;
        }

        public FlagMan build() {
            return new FlagMan(this);
        }
    }
}
