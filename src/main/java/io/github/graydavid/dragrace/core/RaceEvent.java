/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.core;

/**
 * The lifecycle events that {@link FlagMan} emits during a run. Each corresponds to one method on
 * {@link RaceObservers.Observer}.
 * 
 * Note: to facilitate evolution of this enum, users should not rely on the absolute value of each enum's ordinal value
 * but can be assured that the relative ordering will be maintained.
 */
public enum RaceEvent {
    /** All tests are about to start. Emitted once per run, before anything else. Carries no TestCase. */
    BEGIN(false),
    /** A non-skipped test is starting. */
    START(true),
    /** A test is skipped. */
    PENDING(true),
    /** A test attempt failed and the test will be attempted again. */
    RETRY(true),
    /** A test passed. */
    PASS(true),
    /** A test failed and will not be attempted again. */
    FAIL(true),
    /** A non-skipped test is done, after it passed or failed. */
    FINISH(true),
    /** All tests are done and every scope has been cleaned. Emitted once per run, last. Carries no TestCase. */
    END(false);

    private final boolean carriesTestCase;

    private RaceEvent(boolean carriesTestCase) {
        this.carriesTestCase = carriesTestCase;
    }

    /** Answers whether this event is about a specific TestCase. */
    public boolean carriesTestCase() {
        return carriesTestCase;
    }
}
