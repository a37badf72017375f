package io.github.graydavid.dragrace.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import io.github.graydavid.dragrace.core.Hooks.CallbackHook;
import io.github.graydavid.dragrace.core.Hooks.Completion;
import io.github.graydavid.dragrace.core.Hooks.Hook;
import io.github.graydavid.dragrace.core.Hooks.Step;

public class HooksTest {
    private final Context context = Context.empty();

    private static Throwable failureOf(CompletableFuture<Void> future) {
        CompletionException thrown = assertThrows(CompletionException.class, future::join);
        return thrown.getCause();
    }

    @Test
    public void stepOfThrowsExceptionGivenNullHook() {
        assertThrows(NullPointerException.class, () -> Step.of((Hook) null));
        assertThrows(NullPointerException.class, () -> Step.of((CallbackHook) null));
    }

    @Test
    public void directStepRunsHookAgainstContextAndSucceeds() throws Exception {
        Hook hook = mock(Hook.class);

        CompletableFuture<Void> result = Step.of(hook).invoke(context);

        verify(hook).run(context);
        assertTrue(result.isDone());
        result.join();
    }

    @Test
    public void directStepFailsWithWhateverHookThrows() {
        Exception checked = new Exception("checked");
        Error error = new AssertionError("assertion");

        assertThat(failureOf(Step.of(ctx -> {
            throw checked;
        }).invoke(context)), sameInstance(checked));
        assertThat(failureOf(Step.of(ctx -> {
            throw error;
        }).invoke(context)), sameInstance(error));
    }

    @Test
    public void directStepAllowsHookToModifyContext() {
        Step.of(ctx -> ctx.put("key", "value")).invoke(context).join();

        assertThat(context.require("key", String.class), is("value"));
    }

    @Test
    public void callbackStepCompletesOnlyWhenSignalled() {
        AtomicReference<Completion> completion = new AtomicReference<>();

        CompletableFuture<Void> result = Step.of((ctx, done) -> completion.set(done)).invoke(context);

        assertFalse(result.isDone());
        completion.get().succeed();
        assertTrue(result.isDone());
        result.join();
    }

    @Test
    public void callbackStepFailsWithSignalledFailure() {
        IllegalStateException failure = new IllegalStateException("failure");

        CompletableFuture<Void> result = Step.of((ctx, done) -> done.fail(failure)).invoke(context);

        assertThat(failureOf(result), sameInstance(failure));
    }

    @Test
    public void callbackStepFailsWithExceptionThrownBeforeSignalling() {
        IllegalStateException failure = new IllegalStateException("failure");

        CompletableFuture<Void> result = Step.of((ctx, done) -> {
            throw failure;
        }).invoke(context);

        assertThat(failureOf(result), sameInstance(failure));
    }

    @Test
    public void callbackStepIgnoresExceptionThrownAfterSignalling() {
        CompletableFuture<Void> result = Step.of((ctx, done) -> {
            done.succeed();
            throw new IllegalStateException("too late");
        }).invoke(context);

        result.join();
    }

    @Test
    public void callbackStepFailsWhenHookSignalsTwiceBeforeReturning() {
        AtomicReference<Throwable> secondSignal = new AtomicReference<>();

        CompletableFuture<Void> result = Step.of((ctx, done) -> {
            done.succeed();
            try {
                done.fail(new IllegalStateException("second"));
            } catch (MisbehaviorException e) {
                secondSignal.set(e);
            }
        }).invoke(context);

        assertThat(secondSignal.get(), instanceOf(MisbehaviorException.class));
        assertThat(failureOf(result), sameInstance(secondSignal.get()));
    }

    @Test
    public void callbackStepFailsWithMisbehaviorWhenHookLetsItPropagate() {
        CompletableFuture<Void> result = Step.of((ctx, done) -> {
            done.succeed();
            done.succeed();
        }).invoke(context);

        assertThat(failureOf(result), instanceOf(MisbehaviorException.class));
    }

    @Test
    public void completionThrowsExceptionWhenSignalledTwiceAfterHookReturns() {
        AtomicReference<Completion> completion = new AtomicReference<>();
        CompletableFuture<Void> result = Step.of((ctx, done) -> completion.set(done)).invoke(context);

        completion.get().succeed();

        assertThrows(MisbehaviorException.class, completion.get()::succeed);
        result.join();
    }

    @Test
    public void completionFailThrowsExceptionGivenNullFailure() {
        CompletableFuture<Void> result = Step.of((ctx, done) -> done.fail(null)).invoke(context);

        assertThat(failureOf(result), instanceOf(NullPointerException.class));
    }

    @Test
    public void fromStageCompletesWithReturnedStage() {
        CompletableFuture<String> stage = new CompletableFuture<>();

        CompletableFuture<Void> result = Step.of(Hooks.fromStage(ctx -> stage)).invoke(context);

        assertFalse(result.isDone());
        stage.complete("done");
        result.join();
    }

    @Test
    public void fromStageFailsWithUnwrappedFailureOfReturnedStage() {
        IllegalArgumentException failure = new IllegalArgumentException("failure");
        CompletableFuture<Object> stage = CompletableFuture.completedFuture(null)
                .thenApply(ignore -> {
                    throw failure;
                });

        CompletableFuture<Void> result = Step.of(Hooks.fromStage(ctx -> stage)).invoke(context);

        assertThat(failureOf(result), sameInstance(failure));
    }

    @Test
    public void fromStageFailsGivenNullStage() {
        CompletableFuture<Void> result = Step.of(Hooks.fromStage(ctx -> null)).invoke(context);

        assertThat(failureOf(result), instanceOf(NullPointerException.class));
    }

    @Test
    public void fromStageThrowsExceptionGivenNullFunction() {
        assertThrows(NullPointerException.class, () -> Hooks.fromStage(null));
    }
}
