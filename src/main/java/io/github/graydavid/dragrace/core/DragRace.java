/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.core;

import java.util.Objects;

import io.github.graydavid.dragrace.core.Hooks.CallbackHook;
import io.github.graydavid.dragrace.core.Hooks.Hook;

/**
 * A static facade over {@link Declarations}, so that test suites can declare scopes and tests with statically-imported
 * functions (describe, it, before, etc.) instead of passing a Declarations instance around.
 * 
 * The facade has no state of its own: it delegates to whichever Declarations is active on the current thread. A
 * Declarations becomes active through {@link #activate(Declarations)} and stays active until the returned Activation is
 * closed, at which point whatever was active before is restored:
 * 
 * <pre>
 * try (DragRace.Activation activation = DragRace.activate(flagMan.declarations())) {
 *     describe("suite", () -&gt; it("works", context -&gt; {}));
 * }
 * </pre>
 */
public class DragRace {
    private static final ThreadLocal<Declarations> ACTIVE = new ThreadLocal<>();

    private DragRace() {}

    /** Makes declarations the target of this facade's functions on the current thread until the result is closed. */
    public static Activation activate(Declarations declarations) {
        Objects.requireNonNull(declarations);
        Activation activation = new Activation(ACTIVE.get());
        ACTIVE.set(declarations);
        return activation;
    }

    /** Answers whether any Declarations is active on the current thread. */
    public static boolean isActive() {
        return ACTIVE.get() != null;
    }

    /** A binding of a Declarations to the current thread. Closing it more than once has no further effect. */
    public static class Activation implements AutoCloseable {
        private final Declarations previous;
        private boolean closed;

        private Activation(Declarations previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (previous == null) {
                ACTIVE.remove();
            } else {
                ACTIVE.set(previous);
            }
        }
    }

    private static Declarations active() {
        Declarations declarations = ACTIVE.get();
        if (declarations == null) {
            throw new IllegalStateException("No Declarations are active on this thread. See DragRace#activate.");
        }
        return declarations;
    }

    public static void describe(String description, Runnable block) {
        active().describe(description, block);
    }

    public static void odescribe(String description, Runnable block) {
        active().odescribe(description, block);
    }

    public static void xdescribe(String description, Runnable block) {
        active().xdescribe(description, block);
    }

    public static void before(Hook hook) {
        active().before(hook);
    }

    public static void before(CallbackHook hook) {
        active().before(hook);
    }

    public static void beforeEach(Hook hook) {
        active().beforeEach(hook);
    }

    public static void beforeEach(CallbackHook hook) {
        active().beforeEach(hook);
    }

    public static void afterEach(Hook hook) {
        active().afterEach(hook);
    }

    public static void afterEach(CallbackHook hook) {
        active().afterEach(hook);
    }

    public static void after(Hook hook) {
        active().after(hook);
    }

    public static void after(CallbackHook hook) {
        active().after(hook);
    }

    public static void it(String description) {
        active().it(description);
    }

    public static void it(String description, Hook body) {
        active().it(description, body);
    }

    public static void it(String description, CallbackHook body) {
        active().it(description, body);
    }

    public static void oit(String description, Hook body) {
        active().oit(description, body);
    }

    public static void oit(String description, CallbackHook body) {
        active().oit(description, body);
    }

    public static void xit(String description, Hook body) {
        active().xit(description, body);
    }

    public static void xit(String description, CallbackHook body) {
        active().xit(description, body);
    }
}
