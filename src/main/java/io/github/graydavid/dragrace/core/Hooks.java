/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.core;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Houses definitions of the different styles that hooks (before, beforeEach, afterEach, after) and test bodies can be
 * written in, plus the adapter that normalizes them into a single, future-producing form.
 * 
 * There are two styles. A {@link Hook} is "direct": it does its work on the calling thread, and returning normally
 * means success while throwing means failure. A {@link CallbackHook} is "callback-style": it's handed a
 * {@link Completion} in addition to the Context, and it's done when (and only when) it signals that completion. The
 * latter style is what allows hooks and bodies to wait on asynchronous work without blocking a thread. Users register
 * either kind through overloads that differ in the lambda's arity, so the style is decided at registration time.
 */
public class Hooks {
    private static final Logger LOG = LoggerFactory.getLogger(Hooks.class);

    private Hooks() {}

    /** A direct-style hook or body. */
    @FunctionalInterface
    public interface Hook {
        /**
         * Runs the hook against the given context. The hook may modify the context: all changes are visible to
         * whatever runs after this hook against the same context.
         * 
         * @throws Exception to signal failure.
         */
        void run(Context context) throws Exception;
    }

    /** A callback-style hook or body. */
    @FunctionalInterface
    public interface CallbackHook {
        /**
         * Starts the hook against the given context. The hook is not considered done until completion is signalled,
         * which it must be exactly once. Throwing an exception before signalling completion is equivalent to
         * signalling failure with that exception.
         */
        void run(Context context, Completion completion) throws Exception;
    }

    /**
     * The completion signal handed to each {@link CallbackHook}. Only the first signal counts. Signalling again while
     * the hook is still running also fails the hook with the resulting {@link MisbehaviorException}.
     */
    public interface Completion {
        /**
         * Signals successful completion.
         * 
         * @throws MisbehaviorException if completion has already been signalled.
         */
        void succeed();

        /**
         * Signals failed completion.
         * 
         * @throws NullPointerException if failure is null.
         * @throws MisbehaviorException if completion has already been signalled.
         */
        void fail(Throwable failure);
    }

    /**
     * Adapts a function that returns a CompletionStage (e.g. a CompletableFuture) into a CallbackHook. The hook is
     * done when the returned stage is. A function that throws or returns null fails the hook.
     */
    public static CallbackHook fromStage(Function<? super Context, ? extends CompletionStage<?>> function) {
        Objects.requireNonNull(function);
        return (context, completion) -> {
            CompletionStage<?> stage = Objects.requireNonNull(function.apply(context),
                    "CompletionStage-returning hooks must not return null");
            stage.whenComplete((result, throwable) -> {
                if (throwable == null) {
                    completion.succeed();
                } else {
                    completion.fail(Failures.unwrap(throwable));
                }
            });
        };
    }

    /**
     * The normalized form of every hook and body, regardless of the style it was written in. Running a step always
     * yields a single CompletableFuture.
     */
    public abstract static class Step {
        private Step() {}

        /** Creates a Step from a direct-style hook. */
        public static Step of(Hook hook) {
            return new DirectStep(hook);
        }

        /** Creates a Step from a callback-style hook. */
        public static Step of(CallbackHook hook) {
            return new CallbackStep(hook);
        }

        /**
         * Runs the underlying hook against context. Any exception thrown by the hook is captured in the returned future
         * rather than thrown from this method.
         * 
         * @return a future that completes, unwrapped, with the hook's failure or with null on success.
         */
        public abstract CompletableFuture<Void> invoke(Context context);
    }

    private static class DirectStep extends Step {
        private final Hook hook;

        private DirectStep(Hook hook) {
            this.hook = Objects.requireNonNull(hook);
        }

        @Override
        public CompletableFuture<Void> invoke(Context context) {
            try {
                hook.run(context);
                return CompletableFuture.completedFuture(null);
            } catch (Throwable t) {
                return CompletableFuture.failedFuture(t);
            }
        }
    }

    private static class CallbackStep extends Step {
        private final CallbackHook hook;

        private CallbackStep(CallbackHook hook) {
            this.hook = Objects.requireNonNull(hook);
        }

        /**
         * {@inheritDoc}
         * 
         * If the hook signals completion more than once before it returns, the step fails with the resulting
         * MisbehaviorException, whatever the first signal was. Extra signals given after the hook returns can only be
         * reported to whoever gave them, as a thrown MisbehaviorException.
         */
        @Override
        public CompletableFuture<Void> invoke(Context context) {
            SignallingCompletion completion = new SignallingCompletion();
            try {
                hook.run(context, completion);
            } catch (Throwable t) {
                if (!completion.signalFromThrow(t) && t != completion.misbehavior) {
                    LOG.warn("Callback-style hook threw after already signalling its completion", t);
                }
            }

            MisbehaviorException misbehavior = completion.misbehavior;
            return (misbehavior == null) ? completion.future : CompletableFuture.failedFuture(misbehavior);
        }
    }

    /** A Completion backed by a CompletableFuture, which only accepts a single signal. */
    private static class SignallingCompletion implements Completion {
        private final CompletableFuture<Void> future = new CompletableFuture<>();
        private final AtomicBoolean signalled = new AtomicBoolean();
        private volatile MisbehaviorException misbehavior;

        @Override
        public void succeed() {
            requireFirstSignal();
            future.complete(null);
        }

        @Override
        public void fail(Throwable failure) {
            Objects.requireNonNull(failure);
            requireFirstSignal();
            future.completeExceptionally(failure);
        }

        private void requireFirstSignal() {
            if (!signalled.compareAndSet(false, true)) {
                MisbehaviorException exception = new MisbehaviorException(
                        "Callback-style hooks must signal completion exactly once");
                if (misbehavior == null) {
                    misbehavior = exception;
                }
                throw exception;
            }
        }

        /** Fails the completion if no signal has been given yet, answering whether that happened. */
        private boolean signalFromThrow(Throwable failure) {
            if (signalled.compareAndSet(false, true)) {
                future.completeExceptionally(failure);
                return true;
            }
            return false;
        }
    }
}
