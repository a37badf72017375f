/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.core;

import java.util.Objects;

import io.github.graydavid.dragrace.core.Hooks.CallbackHook;
import io.github.graydavid.dragrace.core.Hooks.Hook;
import io.github.graydavid.dragrace.core.Hooks.Step;

/**
 * The surface through which test suites declare scopes, hooks, and tests into a {@link FlagMan}. Declaration is a
 * synchronous, single-threaded tree-building pass: {@link #describe(String, Runnable)} opens a new Scope nested in the
 * currently-open one, runs the given block (which declares that Scope's contents), and then closes it again. Hooks and
 * tests always attach to whichever Scope is open when they're declared. Outside of any describe block, that's the
 * hidden root Scope, so hooks declared there apply to every test.
 * 
 * Each hook slot holds one hook per Scope: declaring the same kind of hook twice in a Scope replaces the first.
 * 
 * Hooks and bodies come in two styles (see {@link Hooks}); the overload called, chosen by the lambda's arity,
 * determines which. For example:
 * 
 * <pre>
 * declarations.describe("outer", () -&gt; {
 *     declarations.before(context -&gt; context.put("connection", connect()));
 *     declarations.it("runs synchronously", context -&gt; check(context));
 *     declarations.it("runs asynchronously", (context, completion) -&gt; callLater(completion::succeed));
 * });
 * </pre>
 * 
 * Instances are not thread safe.
 */
public class Declarations {
    private final FlagMan flagMan;
    private Scope current;

    Declarations(FlagMan flagMan, Scope root) {
        this.flagMan = Objects.requireNonNull(flagMan);
        this.current = Objects.requireNonNull(root);
    }

    /** Returns the Scope that hooks and tests currently attach to. */
    public Scope currentScope() {
        return current;
    }

    /**
     * Declares a scope nested in the current one, then runs block to declare its contents.
     * 
     * @param block declares the scope's contents. May be null, resulting in an empty scope.
     */
    public void describe(String description, Runnable block) {
        describe(description, block, false, false);
    }

    /** Declares a scope, like {@link #describe(String, Runnable)}, marked as only'ed. */
    public void describeOnly(String description, Runnable block) {
        describe(description, block, true, false);
    }

    /** Declares a scope, like {@link #describe(String, Runnable)}, marked as skipped. */
    public void describeSkip(String description, Runnable block) {
        describe(description, block, false, true);
    }

    /** Alias of {@link #describeOnly(String, Runnable)}. */
    public void odescribe(String description, Runnable block) {
        describeOnly(description, block);
    }

    /** Alias of {@link #describeSkip(String, Runnable)}. */
    public void xdescribe(String description, Runnable block) {
        describeSkip(description, block);
    }

    private void describe(String description, Runnable block, boolean only, boolean skip) {
        Scope parent = current;
        Scope scope = Scope.nested(description, parent, only, skip);
        flagMan.register(scope);
        current = scope;
        try {
            if (block != null) {
                block.run();
            }
        } finally {
            current = parent;
        }
    }

    /** Sets the current scope's before hook: run once, before the first test in the scope needs it. */
    public void before(Hook hook) {
        flagMan.requireNotStarted();
        current.setBefore(Step.of(hook));
    }

    public void before(CallbackHook hook) {
        flagMan.requireNotStarted();
        current.setBefore(Step.of(hook));
    }

    /** Sets the current scope's beforeEach hook: run before every test in the scope (and in nested scopes). */
    public void beforeEach(Hook hook) {
        flagMan.requireNotStarted();
        current.setBeforeEach(Step.of(hook));
    }

    public void beforeEach(CallbackHook hook) {
        flagMan.requireNotStarted();
        current.setBeforeEach(Step.of(hook));
    }

    /** Sets the current scope's afterEach hook: run after every passing test in the scope (and in nested scopes). */
    public void afterEach(Hook hook) {
        flagMan.requireNotStarted();
        current.setAfterEach(Step.of(hook));
    }

    public void afterEach(CallbackHook hook) {
        flagMan.requireNotStarted();
        current.setAfterEach(Step.of(hook));
    }

    /** Sets the current scope's after hook: run when scopes are drained at the end of a run. */
    public void after(Hook hook) {
        flagMan.requireNotStarted();
        current.setAfter(Step.of(hook));
    }

    public void after(CallbackHook hook) {
        flagMan.requireNotStarted();
        current.setAfter(Step.of(hook));
    }

    /** Declares a pending test: one without a body, which is always reported as pending. */
    public void it(String description) {
        addTest(description, null, false, false);
    }

    /**
     * Declares a test in the current scope.
     * 
     * @param body the test body. May be null, resulting in a pending test.
     */
    public void it(String description, Hook body) {
        addTest(description, stepOrNull(body), false, false);
    }

    public void it(String description, CallbackHook body) {
        addTest(description, stepOrNull(body), false, false);
    }

    /** Declares a test, like {@link #it(String, Hook)}, marked as only'ed. */
    public void itOnly(String description, Hook body) {
        addTest(description, stepOrNull(body), true, false);
    }

    public void itOnly(String description, CallbackHook body) {
        addTest(description, stepOrNull(body), true, false);
    }

    /** Declares a test, like {@link #it(String, Hook)}, marked as skipped. */
    public void itSkip(String description, Hook body) {
        addTest(description, stepOrNull(body), false, true);
    }

    public void itSkip(String description, CallbackHook body) {
        addTest(description, stepOrNull(body), false, true);
    }

    /** Alias of {@link #itOnly(String, Hook)}. */
    public void oit(String description, Hook body) {
        itOnly(description, body);
    }

    public void oit(String description, CallbackHook body) {
        itOnly(description, body);
    }

    /** Alias of {@link #itSkip(String, Hook)}. */
    public void xit(String description, Hook body) {
        itSkip(description, body);
    }

    public void xit(String description, CallbackHook body) {
        itSkip(description, body);
    }

    private static Step stepOrNull(Hook body) {
        return (body == null) ? null : Step.of(body);
    }

    private static Step stepOrNull(CallbackHook body) {
        return (body == null) ? null : Step.of(body);
    }

    private void addTest(String description, Step body, boolean only, boolean skip) {
        flagMan.register(new TestCase(description, current, body, only, skip));
    }
}
