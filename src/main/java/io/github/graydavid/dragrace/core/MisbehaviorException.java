/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.core;

/**
 * Indicates that some user-provided hook or body is not meeting its contract with the drag-race engine (e.g. completing
 * a callback-style hook more than once). The presence of this exception should be treated seriously, since it means
 * the engine can't guarantee its ordering and reporting contracts while the faulty implementations exist.
 */
public class MisbehaviorException extends RuntimeException {
    private static final long serialVersionUID = 1;

    public MisbehaviorException(String message) {
        super(message);
    }
}
