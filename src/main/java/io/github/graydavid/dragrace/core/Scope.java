/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.core;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import io.github.graydavid.dragrace.core.Hooks.Step;

/**
 * A node in the tree of nested scopes (i.e. a "describe" block). Each Scope owns up to four hooks and is responsible for
 * providing the tests nested under it with their Contexts.
 * 
 * Scopes are built during a single-threaded declaration phase (see {@link Declarations}) and are only read once a run
 * starts. The one piece of state that's shared and lazily computed during the run is the before-context: the result of
 * this Scope's before hook applied on top of its parent's context. That's computed at most once, no matter how many
 * tests or nested scopes ask for it or how concurrently they do so. Similarly, the ordered chains of beforeEach and
 * afterEach hooks are collected at most once per Scope.
 */
public class Scope {
    private final String description;
    private final Scope parent;
    private final boolean only;
    private final boolean skip;
    // Set only during the declaration phase, which happens-before any run reads them
    private Step before;
    private Step beforeEach;
    private Step afterEach;
    private Step after;
    private final OnceCell<CompletableFuture<Context>> beforeContext = new OnceCell<>();
    private final OnceCell<List<Step>> beforeEaches = new OnceCell<>();
    private final OnceCell<List<Step>> afterEaches = new OnceCell<>();

    private Scope(String description, Scope parent, boolean only, boolean skip) {
        this.description = Objects.requireNonNull(description);
        this.parent = parent;
        this.only = only;
        this.skip = skip;
    }

    /** Creates the hidden scope at the root of every scope tree. It has an empty description and no parent. */
    static Scope root() {
        return new Scope("", null, false, false);
    }

    /**
     * Creates a scope nested under parent.
     * 
     * @param only whether this scope itself is marked as only'ed. Effective only-ness also depends on ancestors.
     * @param skip whether this scope itself is marked as skipped. Effective skip-ness also depends on ancestors.
     */
    static Scope nested(String description, Scope parent, boolean only, boolean skip) {
        return new Scope(description, Objects.requireNonNull(parent), only, skip);
    }

    public Optional<Scope> getParent() {
        return Optional.ofNullable(parent);
    }

    /** Returns the descriptions of all ancestors and this scope, from the root down, space-joined and trimmed. */
    public String getDescription() {
        String full = (parent == null) ? description : parent.getDescription() + " " + description;
        return full.trim();
    }

    /** Answers whether this scope or any of its ancestors is marked as only'ed. */
    public boolean isOnly() {
        return only || (parent != null && parent.isOnly());
    }

    /** Answers whether this scope or any of its ancestors is marked as skipped. */
    public boolean isSkip() {
        return skip || (parent != null && parent.isSkip());
    }

    void setBefore(Step before) {
        this.before = Objects.requireNonNull(before);
    }

    void setBeforeEach(Step beforeEach) {
        this.beforeEach = Objects.requireNonNull(beforeEach);
    }

    void setAfterEach(Step afterEach) {
        this.afterEach = Objects.requireNonNull(afterEach);
    }

    void setAfter(Step after) {
        this.after = Objects.requireNonNull(after);
    }

    /**
     * Provides the context resulting from this scope's before hook. On the first call, this resolves the parent's
     * {@link #context()} (or an empty Context for the root), and then applies this scope's before hook (if any) to a
     * copy of it. The resulting future, successful or failed, is memoized and returned to every caller.
     */
    public CompletableFuture<Context> beforeContext() {
        CompletableFuture<Context> fresh = new CompletableFuture<>();
        CompletableFuture<Context> shared = beforeContext.get(() -> fresh);
        if (shared == fresh) {
            computeBeforeContext().whenComplete((context, throwable) -> {
                if (throwable == null) {
                    fresh.complete(context);
                } else {
                    fresh.completeExceptionally(Failures.unwrap(throwable));
                }
            });
        }
        return shared;
    }

    private CompletableFuture<Context> computeBeforeContext() {
        CompletableFuture<Context> parentContext = (parent == null) ? CompletableFuture.completedFuture(Context.empty())
                : parent.context();
        return parentContext.thenCompose(context -> {
            Context copy = context.copy();
            if (before == null) {
                return CompletableFuture.completedFuture(copy);
            }
            return before.invoke(copy).thenApply(ignore -> copy);
        });
    }

    /**
     * Applies every beforeEach hook from the outermost ancestor down to this scope, in that order, to a fresh copy of
     * parentContext. The chain of hooks is collected once, but the hooks themselves run anew on every call.
     * 
     * @return the context after every hook has been applied.
     */
    public CompletableFuture<Context> beforeEachContext(Context parentContext) {
        Context context = parentContext.copy();
        List<Step> chain = beforeEaches.get(this::collectBeforeEaches);
        return runInOrder(chain, context).thenApply(ignore -> context);
    }

    private List<Step> collectBeforeEaches() {
        LinkedList<Step> chain = new LinkedList<>();
        for (Scope scope = this; scope != null; scope = scope.parent) {
            if (scope.beforeEach != null) {
                chain.addFirst(scope.beforeEach);
            }
        }
        return List.copyOf(chain);
    }

    /** Provides a test's context: {@link #beforeContext()} followed by {@link #beforeEachContext(Context)}. */
    public CompletableFuture<Context> context() {
        return beforeContext().thenCompose(this::beforeEachContext);
    }

    /**
     * Runs this scope's afterEach hook and then every ancestor's, innermost first, against the given context. The first
     * failure stops the chain: later hooks are not run.
     */
    public CompletableFuture<Void> applyAfterEach(Context context) {
        List<Step> chain = afterEaches.get(this::collectAfterEaches);
        return runInOrder(chain, context);
    }

    private List<Step> collectAfterEaches() {
        List<Step> chain = new ArrayList<>();
        for (Scope scope = this; scope != null; scope = scope.parent) {
            if (scope.afterEach != null) {
                chain.add(scope.afterEach);
            }
        }
        return List.copyOf(chain);
    }

    /**
     * Runs this scope's after hook and then every ancestor's, innermost first, against this scope's before-context. If
     * the before-context was never computed (i.e. no test under this scope ever ran) or there are no after hooks, this
     * does nothing. Otherwise, the first failure (including a failed before-context) fails the clean-up and stops the
     * chain.
     * 
     * Note: because ancestors' after hooks are included, cleaning every scope in a tree runs an ancestor's after hook
     * once for each of its cleaned descendants (as well as for the ancestor itself).
     */
    public CompletableFuture<Void> clean() {
        List<Step> afters = new ArrayList<>();
        for (Scope scope = this; scope != null; scope = scope.parent) {
            if (scope.after != null) {
                afters.add(scope.after);
            }
        }

        Optional<CompletableFuture<Context>> computed = beforeContext.getIfSet();
        if (afters.isEmpty() || computed.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return computed.get().thenCompose(context -> runInOrder(afters, context));
    }

    private static CompletableFuture<Void> runInOrder(List<Step> steps, Context context) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Step step : steps) {
            chain = chain.thenCompose(ignore -> step.invoke(context));
        }
        return chain;
    }

    @Override
    public String toString() {
        return "Scope[" + getDescription() + "]";
    }
}
