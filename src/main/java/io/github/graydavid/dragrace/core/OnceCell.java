/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.core;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A guarded cell that is initialized at most once. The first caller of {@link #get(Supplier)} runs its initializer;
 * every other caller, concurrent or later, receives the value that initializer produced.
 * 
 * When the value is a CompletableFuture, this gives "first-caller-wins" memoization of an asynchronous computation, as
 * long as the initializer only creates the (pending) future rather than doing the computation itself: the future is
 * published before any work starts, so concurrent requesters attach to the pending future instead of recomputing, and
 * no requester ever blocks on the lock for longer than it takes to create the future.
 */
class OnceCell<T> {
    private volatile T value;

    /**
     * Returns the value of this cell, initializing it with initializer if this is the first call.
     * 
     * @throws NullPointerException if the initializer produces null. In that case, the cell remains uninitialized.
     */
    public T get(Supplier<? extends T> initializer) {
        T current = value;
        if (current == null) {
            synchronized (this) {
                current = value;
                if (current == null) {
                    current = Objects.requireNonNull(initializer.get());
                    value = current;
                }
            }
        }
        return current;
    }

    /** Returns the value of this cell without initializing it. */
    public Optional<T> getIfSet() {
        return Optional.ofNullable(value);
    }
}
