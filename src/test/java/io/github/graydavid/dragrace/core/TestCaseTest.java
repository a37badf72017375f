package io.github.graydavid.dragrace.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

import io.github.graydavid.dragrace.core.Hooks.Step;

public class TestCaseTest {
    private final Scope root = Scope.root();
    private final Scope scope = Scope.nested("foo bar", root, false, false);
    private final ConcurrentLinkedQueue<String> calls = new ConcurrentLinkedQueue<>();

    private Step recording(String call) {
        return Step.of(context -> calls.add(call));
    }

    private static Step failing(RuntimeException failure) {
        return Step.of(context -> {
            throw failure;
        });
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        CompletionException thrown = assertThrows(CompletionException.class, future::join);
        return thrown.getCause();
    }

    @Test
    public void descriptionIncludesScopeDescription() {
        TestCase test = new TestCase("baz test", scope, recording("body"), false, false);

        assertThat(test.getDescription(), is("foo bar baz test"));
        assertThat(test.getScope(), is(scope));
        assertThat(test.toString(), is("TestCase[foo bar baz test]"));
    }

    @Test
    public void descriptionAtRootIsJustOwnDescription() {
        TestCase test = new TestCase("alone", root, recording("body"), false, false);

        assertThat(test.getDescription(), is("alone"));
    }

    @Test
    public void onlyAndSkipComeFromTestOrScope() {
        Scope onlyScope = Scope.nested("only", root, true, false);
        Scope skipScope = Scope.nested("skip", root, false, true);

        assertTrue(new TestCase("t", scope, recording("body"), true, false).isOnly());
        assertTrue(new TestCase("t", onlyScope, recording("body"), false, false).isOnly());
        assertFalse(new TestCase("t", scope, recording("body"), false, false).isOnly());
        assertTrue(new TestCase("t", scope, recording("body"), false, true).isSkip());
        assertTrue(new TestCase("t", skipScope, recording("body"), false, false).isSkip());
        assertFalse(new TestCase("t", scope, recording("body"), false, false).isSkip());
    }

    @Test
    public void testWithoutBodyIsPendingAndSkipped() {
        TestCase test = new TestCase("pending", scope, null, false, false);

        assertTrue(test.isPending());
        assertTrue(test.isSkip());
        assertThrows(IllegalStateException.class, test::execute);
    }

    @Test
    public void executeRunsHooksAroundBodyInOrder() {
        root.setBefore(recording("before root"));
        root.setBeforeEach(recording("beforeEach root"));
        root.setAfterEach(recording("afterEach root"));
        scope.setBefore(recording("before scope"));
        scope.setBeforeEach(recording("beforeEach scope"));
        scope.setAfterEach(recording("afterEach scope"));
        TestCase test = new TestCase("test", scope, recording("body"), false, false);

        test.execute().join();

        assertThat(calls, contains("before root", "beforeEach root", "before scope", "beforeEach root",
                "beforeEach scope", "body", "afterEach scope", "afterEach root"));
        assertThat(test.getFailure(), is(Optional.empty()));
    }

    @Test
    public void executeGivesBodyAndAfterEachTheSameContext() {
        scope.setBeforeEach(Step.of(context -> context.put("value", "fromBeforeEach")));
        scope.setAfterEach(Step.of(context -> calls.add(context.require("value", String.class))));
        TestCase test = new TestCase("test", scope, Step.of(context -> context.put("value", "fromBody")), false,
                false);

        test.execute().join();

        assertThat(calls, contains("fromBody"));
    }

    @Test
    public void executeSkipsAfterEachWhenBodyFails() {
        IllegalStateException failure = new IllegalStateException("body failed");
        scope.setAfterEach(recording("afterEach"));
        TestCase test = new TestCase("test", scope, failing(failure), false, false);

        assertThat(failureOf(test.execute()), sameInstance(failure));
        assertThat(test.getFailure(), is(Optional.of(failure)));
        assertThat(calls, empty());
    }

    @Test
    public void executeFailsWithAfterEachFailure() {
        IllegalStateException failure = new IllegalStateException("afterEach failed");
        scope.setAfterEach(failing(failure));
        TestCase test = new TestCase("test", scope, recording("body"), false, false);

        assertThat(failureOf(test.execute()), sameInstance(failure));
        assertThat(test.getFailure(), is(Optional.of(failure)));
        assertThat(calls, contains("body"));
    }

    @Test
    public void executeFailsWithBeforeFailureWithoutRunningBody() {
        IllegalStateException failure = new IllegalStateException("before failed");
        root.setBefore(failing(failure));
        TestCase test = new TestCase("test", scope, recording("body"), false, false);

        assertThat(failureOf(test.execute()), sameInstance(failure));
        assertThat(calls, empty());
    }

    @Test
    public void executeFailsWithBeforeEachFailureWithoutRunningBodyOrAfterEach() {
        IllegalStateException failure = new IllegalStateException("beforeEach failed");
        scope.setBeforeEach(failing(failure));
        scope.setAfterEach(recording("afterEach"));
        TestCase test = new TestCase("test", scope, recording("body"), false, false);

        assertThat(failureOf(test.execute()), sameInstance(failure));
        assertThat(test.getFailure(), is(Optional.of(failure)));
        assertThat(calls, empty());
    }

    @Test
    public void executeStopsBeforeEachChainAtFirstFailure() {
        IllegalStateException failure = new IllegalStateException("outer beforeEach failed");
        root.setBeforeEach(failing(failure));
        scope.setBeforeEach(recording("inner beforeEach"));
        TestCase test = new TestCase("test", scope, recording("body"), false, false);

        assertThat(failureOf(test.execute()), sameInstance(failure));
        assertThat(calls, empty());
    }

    @Test
    public void executeFailsWithUnwrappedFailureOfAsynchronousBody() {
        IllegalArgumentException failure = new IllegalArgumentException("async failure");
        TestCase test = new TestCase("test", scope,
                Step.of(Hooks.fromStage(context -> CompletableFuture.supplyAsync(() -> {
                    throw failure;
                }))), false, false);

        assertThat(failureOf(test.execute()), sameInstance(failure));
        assertThat(test.getFailure().get(), sameInstance(failure));
    }

    @Test
    public void executeClearsPreviousFailureOnNewAttempt() {
        AtomicBoolean fail = new AtomicBoolean(true);
        TestCase test = new TestCase("test", scope, Step.of(context -> {
            if (fail.getAndSet(false)) {
                throw new IllegalStateException("first attempt");
            }
        }), false, false);

        failureOf(test.execute());
        assertTrue(test.getFailure().isPresent());

        test.execute().join();
        assertThat(test.getFailure(), is(Optional.empty()));
    }

    @Test
    public void retriesAreCountedExplicitly() {
        TestCase test = new TestCase("test", scope, recording("body"), false, false);

        assertThat(test.getRetries(), is(0));
        test.incrementRetries();
        test.incrementRetries();
        assertThat(test.getRetries(), is(2));
    }
}
