/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.core;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Utility to help accessing the throwables that hooks and bodies actually threw, beneath any future wrappers. */
class Failures {
    private Failures() {}

    /**
     * Strips away CompletionException and ExecutionException wrappers (which CompletableFuture adds as failures move
     * through dependent stages) and returns the first throwable in base's causal chain that is not such a wrapper. If
     * a wrapper has no cause, the wrapper itself is returned.
     */
    public static Throwable unwrap(Throwable base) {
        Objects.requireNonNull(base);

        // Guard against malicious overrides of Throwable.equals by using a Set with identity equality semantics.
        Set<Throwable> alreadySeen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = base;
        while (isWrapper(current) && current.getCause() != null && alreadySeen.add(current)) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean isWrapper(Throwable throwable) {
        return throwable instanceof CompletionException || throwable instanceof ExecutionException;
    }
}
