package io.github.graydavid.dragrace.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.junit.jupiter.api.Test;

public class FailuresTest {
    @Test
    public void unwrapThrowsExceptionGivenNull() {
        assertThrows(NullPointerException.class, () -> Failures.unwrap(null));
    }

    @Test
    public void unwrapReturnsNonWrappersAsIs() {
        IllegalStateException cause = new IllegalStateException("cause");
        IllegalArgumentException failure = new IllegalArgumentException("failure", cause);

        assertThat(Failures.unwrap(failure), sameInstance(failure));
    }

    @Test
    public void unwrapStripsNestedWrappers() {
        IllegalArgumentException failure = new IllegalArgumentException("failure");
        CompletionException wrapped = new CompletionException(new ExecutionException(failure));

        assertThat(Failures.unwrap(wrapped), sameInstance(failure));
    }

    @Test
    public void unwrapReturnsWrapperWithoutCause() {
        CompletionException wrapper = new CompletionException("no cause", null);

        assertThat(Failures.unwrap(wrapper), sameInstance(wrapper));
    }
}
