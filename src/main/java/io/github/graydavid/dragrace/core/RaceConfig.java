/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import io.github.graydavid.dragrace.core.RaceObservers.Observer;

/**
 * The tunable settings of a {@link FlagMan} run. Settings can be built directly or read from Properties, where the
 * following keys are recognized:<br>
 * * {@value #CONCURRENCY_KEY} -- the maximum number of tests in flight at once. Anything that's not a positive integer
 * (including the key's absence) means unbounded.<br>
 * * {@value #MAX_RETRY_KEY} -- how many times a failing test is retried. Defaults to 0.<br>
 * * {@value #OBSERVER_KEY} -- the fully-qualified name of an {@link Observer} class with a public no-argument
 * constructor, to be subscribed to the run.
 */
public class RaceConfig {
    /** The name of the classpath resource read by {@link #loadDefault()}. */
    public static final String DEFAULT_RESOURCE = "dragrace.properties";
    public static final String CONCURRENCY_KEY = "dragrace.concurrency";
    public static final String MAX_RETRY_KEY = "dragrace.maxRetry";
    public static final String OBSERVER_KEY = "dragrace.observer";
    /** The concurrency value meaning "no limit". */
    public static final int UNBOUNDED = 0;

    private final int concurrency;
    private final int maxRetry;
    private final String observerClassName;

    private RaceConfig(Builder builder) {
        this.concurrency = Math.max(builder.concurrency, UNBOUNDED);
        this.maxRetry = builder.maxRetry;
        this.observerClassName = builder.observerClassName;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a config with every setting at its default. */
    public static RaceConfig defaults() {
        return builder().build();
    }

    /**
     * Reads a config from the given properties. Unrecognized keys are ignored.
     * 
     * @throws IllegalArgumentException if {@value #MAX_RETRY_KEY} is present but not a non-negative integer.
     */
    public static RaceConfig fromProperties(Properties properties) {
        Builder builder = builder().concurrency(parseConcurrency(properties.getProperty(CONCURRENCY_KEY)));
        String maxRetry = properties.getProperty(MAX_RETRY_KEY);
        if (maxRetry != null) {
            builder.maxRetry(parseMaxRetry(maxRetry));
        }
        String observer = properties.getProperty(OBSERVER_KEY);
        if (StringUtils.isNotBlank(observer)) {
            builder.observerClassName(observer.trim());
        }
        return builder.build();
    }

    private static int parseConcurrency(String value) {
        return Math.max(NumberUtils.toInt(StringUtils.trim(value), UNBOUNDED), UNBOUNDED);
    }

    private static int parseMaxRetry(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("%s must be a non-negative integer but found '%s'", MAX_RETRY_KEY, value), e);
        }
    }

    /**
     * Reads the config from the {@value #DEFAULT_RESOURCE} classpath resource, if it exists; otherwise, returns
     * {@link #defaults()}.
     * 
     * @throws UncheckedIOException if the resource exists but can't be read.
     */
    public static RaceConfig loadDefault() {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = RaceConfig.class.getClassLoader();
        }
        try (InputStream stream = classLoader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (stream == null) {
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(stream);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + DEFAULT_RESOURCE, e);
        }
    }

    /** Returns the maximum number of tests in flight at once, or {@link #UNBOUNDED}. */
    public int getConcurrency() {
        return concurrency;
    }

    public boolean isUnbounded() {
        return concurrency == UNBOUNDED;
    }

    public int getMaxRetry() {
        return maxRetry;
    }

    public Optional<String> getObserverClassName() {
        return Optional.ofNullable(observerClassName);
    }

    /**
     * Creates a new instance of the configured observer class, if there is one.
     * 
     * @throws IllegalArgumentException if the class can't be found, isn't an Observer, or can't be instantiated through
     *         a public no-argument constructor.
     */
    public Optional<Observer> createObserver() {
        return getObserverClassName().map(RaceConfig::instantiateObserver);
    }

    private static Observer instantiateObserver(String className) {
        Class<?> observerClass;
        try {
            observerClass = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Unable to find observer class: " + className, e);
        }
        if (!Observer.class.isAssignableFrom(observerClass)) {
            throw new IllegalArgumentException("Observer classes must implement Observer but found: " + className);
        }
        try {
            return (Observer) observerClass.getConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Unable to instantiate observer class: " + className, e);
        }
    }

    @Override
    public String toString() {
        return String.format("RaceConfig[concurrency=%s, maxRetry=%d, observer=%s]",
                isUnbounded() ? "unbounded" : concurrency, maxRetry, observerClassName);
    }

    public static class Builder {
        private int concurrency = UNBOUNDED;
        private int maxRetry = 0;
        private String observerClassName;

        private Builder() {}

        /** Sets the maximum number of tests in flight at once. Any value <= 0 means unbounded. */
        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        /**
         * Sets how many times a failing test is retried.
         * 
         * @throws IllegalArgumentException if maxRetry is negative.
         */
        public Builder maxRetry(int maxRetry) {
            if (maxRetry < 0) {
                throw new IllegalArgumentException("maxRetry must be non-negative but was " + maxRetry);
            }
            this.maxRetry = maxRetry;
            return this;
        }

        public Builder observerClassName(String observerClassName) {
            this.observerClassName = Objects.requireNonNull(observerClassName);
            return this;
        }

        public RaceConfig build() {
            return new RaceConfig(this);
        }
    }
}
