package com.nayem.sagaflow.saga;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregate failure of a {@link ParallelSagaStep}; lists every failing child.
 */
public class ParallelStepException extends Exception {

    private final Map<String, Throwable> failures;

    public ParallelStepException(String phase, Map<String, Throwable> failures) {
        super("parallel " + phase + " failed: " + describe(failures));
        this.failures = Map.copyOf(failures);
        failures.values().forEach(this::addSuppressed);
    }

    /**
     * @return failing child names mapped to their errors
     */
    public Map<String, Throwable> getFailures() {
        return failures;
    }

    public List<String> getFailedSteps() {
        return failures.keySet().stream().sorted().collect(Collectors.toList());
    }

    private static String describe(Map<String, Throwable> failures) {
        return failures.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> "step " + e.getKey() + " failed: " + SagaStepException.describe(e.getValue()))
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
