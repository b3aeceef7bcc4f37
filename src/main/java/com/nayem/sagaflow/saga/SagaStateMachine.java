package com.nayem.sagaflow.saga;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compiled transition table of a saga definition.
 * <p>
 * States are {@code initial} plus {@code step_<name>} per step; each step is entered
 * through the {@code execute_<name>} event from the state of the previous step.
 * The table is immutable and shared; every instance walks it through its own {@link Cursor}.
 * </p>
 */
public final class SagaStateMachine {

    public static final String INITIAL = "initial";

    private final List<String> states;
    private final Map<String, Map<String, String>> transitions;

    private SagaStateMachine(List<String> states, Map<String, Map<String, String>> transitions) {
        this.states = states;
        this.transitions = transitions;
    }

    static SagaStateMachine compile(List<SagaStep> steps) {
        if (steps.isEmpty()) {
            throw new IllegalStateException("saga must have at least one step");
        }
        List<String> states = new ArrayList<>();
        Map<String, Map<String, String>> transitions = new LinkedHashMap<>();
        states.add(INITIAL);
        String previous = INITIAL;
        for (SagaStep step : steps) {
            String state = stateFor(step.getName());
            states.add(state);
            transitions.computeIfAbsent(previous, k -> new LinkedHashMap<>())
                    .put(eventFor(step.getName()), state);
            previous = state;
        }
        Map<String, Map<String, String>> frozen = new LinkedHashMap<>();
        transitions.forEach((from, edges) -> frozen.put(from, Collections.unmodifiableMap(edges)));
        return new SagaStateMachine(List.copyOf(states), Collections.unmodifiableMap(frozen));
    }

    public static String stateFor(String stepName) {
        return "step_" + stepName;
    }

    public static String eventFor(String stepName) {
        return "execute_" + stepName;
    }

    public List<String> getStates() {
        return states;
    }

    public Optional<String> next(String from, String event) {
        return Optional.ofNullable(transitions.getOrDefault(from, Map.of()).get(event));
    }

    public Cursor start() {
        return new Cursor();
    }

    /**
     * Position of one saga instance in the machine.
     */
    public final class Cursor {
        private String current = INITIAL;

        /**
         * @return {@code true} when the event was valid from the current state
         */
        public synchronized boolean fire(String event) {
            Optional<String> target = next(current, event);
            target.ifPresent(state -> current = state);
            return target.isPresent();
        }

        public synchronized String current() {
            return current;
        }

        public synchronized void reset() {
            current = INITIAL;
        }
    }
}
