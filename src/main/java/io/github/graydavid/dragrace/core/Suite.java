/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.core;

/**
 * A loadable unit of test declarations: the equivalent of a test file. Implementations must have a public no-argument
 * constructor to be loadable by name or through {@link java.util.ServiceLoader} (see {@link SuiteLoader}).
 */
@FunctionalInterface
public interface Suite {
    /**
     * Declares this suite's scopes, hooks, and tests. While this method runs, declarations is also active on the
     * {@link DragRace} facade, so implementations may use either.
     */
    void declare(Declarations declarations);
}
