/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.observers;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.dragrace.core.RaceObservers.Observer;
import io.github.graydavid.dragrace.core.TestCase;

/**
 * An Observer that turns run events into log lines and keeps a running tally of outcomes. Passing and pending tests are
 * logged at info, retries at info, failures at warn (along with their failure), and everything else at debug. The tally
 * is summarized when the run ends.
 */
public class LoggingObserver implements Observer {
    private final Logger logger;
    private final AtomicInteger passed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicInteger retried = new AtomicInteger();

    /** Creates an observer logging to this class's logger. Usable as a configured observer class. */
    public LoggingObserver() {
        this(LoggerFactory.getLogger(LoggingObserver.class));
    }

    public LoggingObserver(Logger logger) {
        this.logger = Objects.requireNonNull(logger);
    }

    @Override
    public void begin() {
        logger.debug("Beginning run");
    }

    @Override
    public void start(TestCase test) {
        logger.debug("Starting '{}'", test.getDescription());
    }

    @Override
    public void pending(TestCase test) {
        pending.incrementAndGet();
        logger.info("- {}", test.getDescription());
    }

    @Override
    public void retry(TestCase test) {
        retried.incrementAndGet();
        logger.info("~ {} (retry {}): {}", test.getDescription(), test.getRetries(),
                test.getFailure().map(Throwable::toString).orElse("unknown failure"));
    }

    @Override
    public void pass(TestCase test) {
        passed.incrementAndGet();
        logger.info("✓ {}", test.getDescription());
    }

    @Override
    public void fail(TestCase test) {
        failed.incrementAndGet();
        logger.warn("✗ {}", test.getDescription(), test.getFailure().orElse(null));
    }

    @Override
    public void finish(TestCase test) {
        logger.debug("Finished '{}'", test.getDescription());
    }

    @Override
    public void end() {
        logger.info("{} passing, {} failing, {} pending, {} retries", passed.get(), failed.get(), pending.get(),
                retried.get());
    }

    public int getPassed() {
        return passed.get();
    }

    public int getFailed() {
        return failed.get();
    }

    public int getPending() {
        return pending.get();
    }

    public int getRetried() {
        return retried.get();
    }
}
