/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.core;

import java.util.Collection;
import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link Suite}s and declares them into a {@link FlagMan}. Suites are either named explicitly, by
 * fully-qualified class name, or discovered through {@link ServiceLoader} registrations (META-INF/services).
 */
public class SuiteLoader {
    private static final Logger LOG = LoggerFactory.getLogger(SuiteLoader.class);

    private SuiteLoader() {}

    /**
     * Instantiates each named Suite class and declares them all, in order, into flagMan. Every name is resolved before
     * anything is declared, so a bad name leaves flagMan untouched.
     * 
     * @throws IllegalArgumentException if any name is not a loadable Suite implementation with a public no-argument
     *         constructor.
     */
    public static void load(FlagMan flagMan, Collection<String> classNames) {
        List<Suite> suites = classNames.stream().map(SuiteLoader::instantiate).collect(Collectors.toList());
        declareAll(flagMan, suites);
    }

    /** Declares every Suite registered with {@link ServiceLoader} into flagMan. */
    public static void loadInstalled(FlagMan flagMan) {
        List<Suite> suites = ServiceLoader.load(Suite.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .collect(Collectors.toList());
        declareAll(flagMan, suites);
    }

    private static Suite instantiate(String className) {
        Class<?> suiteClass;
        try {
            suiteClass = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Only Suite implementations are allowed: " + className, e);
        }
        if (!Suite.class.isAssignableFrom(suiteClass)) {
            throw new IllegalArgumentException("Only Suite implementations are allowed: " + className);
        }
        try {
            return (Suite) suiteClass.getConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Unable to instantiate Suite: " + className, e);
        }
    }

    private static void declareAll(FlagMan flagMan, List<Suite> suites) {
        Declarations declarations = flagMan.declarations();
        try (DragRace.Activation activation = DragRace.activate(declarations)) {
            for (Suite suite : suites) {
                LOG.debug("Declaring suite {}", suite.getClass().getName());
                suite.declare(declarations);
            }
        }
    }
}
