/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The value threaded through a Scope's hooks and into its tests' bodies. Hooks communicate with tests (and with hooks
 * in nested scopes) by putting values into the Context they're handed.
 * 
 * Contexts are not thread safe. That's fine in practice: a given Context instance is only ever mutated by one hook at a
 * time, and each hand-off between hooks is ordered through the completion of CompletableFutures. The one exception is
 * a Scope's before-context, which is shared by all tests and nested scopes under it. That's why the Scope only ever
 * hands out {@link #copy()}s of it to anything that might run concurrently.
 */
public class Context {
    private final Map<String, Object> values;

    private Context(Map<String, Object> values) {
        this.values = values;
    }

    /** Creates a new Context with no values: the context that the root of every scope tree starts with. */
    public static Context empty() {
        return new Context(new HashMap<>());
    }

    /** Returns an independent, shallow copy of this Context. */
    public Context copy() {
        return new Context(new HashMap<>(values));
    }

    /**
     * Associates value with key, replacing any previous association.
     * 
     * @return this Context, for chaining.
     * @throws NullPointerException if key is null. Null values are allowed.
     */
    public Context put(String key, Object value) {
        values.put(Objects.requireNonNull(key), value);
        return this;
    }

    /** Returns the value associated with key, if any. */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Returns the value associated with key cast to the given type.
     * 
     * @throws IllegalArgumentException if there's no value for key.
     * @throws ClassCastException if the value is not of the requested type.
     */
    public <T> T require(String key, Class<T> type) {
        Object value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("No value found in context for key: " + key);
        }
        return type.cast(value);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /** Returns an unmodifiable view of all of the values in this Context. */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "Context" + values;
    }
}
