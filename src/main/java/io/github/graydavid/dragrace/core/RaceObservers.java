/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.dragrace.core;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Houses definitions of observers of a {@link FlagMan} run and the bus that delivers events to them.
 */
public class RaceObservers {
    private RaceObservers() {}

    /**
     * Observes the lifecycle events of a run. Each method corresponds to a {@link RaceEvent} of the same name. The
     * default implementation of each method does nothing, so implementors can override only what they care about.
     * 
     * All implementations should be thread safe, since tests run concurrently and each test's events are emitted on
     * whatever thread happens to be driving that test at the time. Implementations should also be quick executing, in
     * order to avoid slowing down the tests they're observing.
     * 
     * Exceptions thrown by observers are not caught by FlagMan. Since an exception can interrupt the run at an
     * arbitrary point, implementations should take care not to throw.
     */
    public interface Observer {
        /** Called once when all tests are about to begin. */
        default void begin() {}

        /** Called when each non-skipped test starts. */
        default void start(TestCase test) {}

        /** Called when a test is skipped. */
        default void pending(TestCase test) {}

        /** Called when a test's attempt fails and the test is about to be retried. The attempt's failure is available. */
        default void retry(TestCase test) {}

        /** Called when a test passes. */
        default void pass(TestCase test) {}

        /** Called when a test fails its last attempt. The failure is available through {@link TestCase#getFailure()}. */
        default void fail(TestCase test) {}

        /** Called after each non-skipped test passes or fails. */
        default void finish(TestCase test) {}

        /** Called once all tests have finished and all scopes have been cleaned. */
        default void end() {}

        /** Returns an Observer that does nothing. */
        static Observer doNothing() {
            return DO_NOTHING;
        }
    }

    private static final Observer DO_NOTHING = new Observer() {};

    /**
     * Returns a builder that can create an Observer in parts: one handler per event. Events without a handler are
     * ignored.
     */
    public static Builder builder() {
        return new Builder();
    }

    /** A builder of Observers with a handler per event. */
    public static class Builder {
        private final Map<RaceEvent, Consumer<? super TestCase>> handlers = new EnumMap<>(RaceEvent.class);

        private Builder() {}

        /**
         * Sets the handler for the given event, replacing any previous one. For {@link RaceEvent#BEGIN} and
         * {@link RaceEvent#END}, the handler will receive null.
         */
        public Builder on(RaceEvent event, Consumer<? super TestCase> handler) {
            handlers.put(Objects.requireNonNull(event), Objects.requireNonNull(handler));
            return this;
        }

        /** Sets the handler for {@link RaceEvent#BEGIN}. */
        public Builder onBegin(Runnable handler) {
            Objects.requireNonNull(handler);
            return on(RaceEvent.BEGIN, ignore -> handler.run());
        }

        /** Sets the handler for {@link RaceEvent#END}. */
        public Builder onEnd(Runnable handler) {
            Objects.requireNonNull(handler);
            return on(RaceEvent.END, ignore -> handler.run());
        }

        public Observer build() {
            return new HandlerObserver(new EnumMap<>(handlers));
        }
    }

    /** An Observer which dispatches each event to the handler registered for it. */
    private static class HandlerObserver implements Observer {
        private final Map<RaceEvent, Consumer<? super TestCase>> handlers;

        private HandlerObserver(Map<RaceEvent, Consumer<? super TestCase>> handlers) {
            this.handlers = handlers;
        }

        private void handle(RaceEvent event, TestCase test) {
            Consumer<? super TestCase> handler = handlers.get(event);
            if (handler != null) {
                handler.accept(test);
            }
        }

        @Override
        public void begin() {
            handle(RaceEvent.BEGIN, null);
        }

        @Override
        public void start(TestCase test) {
            handle(RaceEvent.START, test);
        }

        @Override
        public void pending(TestCase test) {
            handle(RaceEvent.PENDING, test);
        }

        @Override
        public void retry(TestCase test) {
            handle(RaceEvent.RETRY, test);
        }

        @Override
        public void pass(TestCase test) {
            handle(RaceEvent.PASS, test);
        }

        @Override
        public void fail(TestCase test) {
            handle(RaceEvent.FAIL, test);
        }

        @Override
        public void finish(TestCase test) {
            handle(RaceEvent.FINISH, test);
        }

        @Override
        public void end() {
            handle(RaceEvent.END, null);
        }
    }

    /**
     * A publish/subscribe channel for run events. Every emitted event is delivered to every subscribed Observer, in
     * subscription order, on the emitting thread. Observers may subscribe at any time, but those subscribing in the
     * middle of a run will only see subsequent events.
     */
    public static class EventBus {
        private final List<Observer> observers = new CopyOnWriteArrayList<>();

        public void subscribe(Observer observer) {
            observers.add(Objects.requireNonNull(observer));
        }

        public void unsubscribe(Observer observer) {
            observers.remove(observer);
        }

        public List<Observer> getObservers() {
            return List.copyOf(observers);
        }

        /**
         * Delivers an event to every subscribed Observer.
         * 
         * @param test the test the event is about. Must be non-null for every event that
         *        {@link RaceEvent#carriesTestCase()} and null otherwise.
         * @throws IllegalArgumentException if test's presence doesn't match the event.
         */
        public void emit(RaceEvent event, TestCase test) {
            if (event.carriesTestCase() != (test != null)) {
                throw new IllegalArgumentException(
                        String.format("Event %s %s a TestCase", event, event.carriesTestCase() ? "requires" : "forbids"));
            }
            for (Observer observer : observers) {
                deliver(observer, event, test);
            }
        }

        private static void deliver(Observer observer, RaceEvent event, TestCase test) {
            switch (event) {
                case BEGIN:
                    observer.begin();
                    break;
                case START:
                    observer.start(test);
                    break;
                case PENDING:
                    observer.pending(test);
                    break;
                case RETRY:
                    observer.retry(test);
                    break;
                case PASS:
                    observer.pass(test);
                    break;
                case FAIL:
                    observer.fail(test);
                    break;
                case FINISH:
                    observer.finish(test);
                    break;
                case END:
                    observer.end();
                    break;
                default:
                    throw new IllegalArgumentException("Unknown event: " + event);
            }
        }
    }
}
