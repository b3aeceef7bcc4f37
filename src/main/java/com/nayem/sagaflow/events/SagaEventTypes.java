package com.nayem.sagaflow.events;

import java.util.Set;

/**
 * Event type names and metadata keys. Projections and recovery depend on these values.
 */
public final class SagaEventTypes {

    public static final String SAGA_STARTED = "SagaStarted";
    public static final String SAGA_COMPLETED = "SagaCompleted";
    public static final String SAGA_FAILED = "SagaFailed";
    public static final String SAGA_COMPENSATING = "SagaCompensating";
    public static final String SAGA_COMPENSATED = "SagaCompensated";

    public static final String STEP_STARTED = "StepStarted";
    public static final String STEP_COMPLETED = "StepCompleted";
    public static final String STEP_FAILED = "StepFailed";
    public static final String STEP_COMPENSATING = "StepCompensating";
    public static final String STEP_COMPENSATED = "StepCompensated";

    public static final String SAGA_STATE_CHANGED = "SagaStateChanged";
    public static final String SAGA_STATE_CHECKPOINT = "SagaStateCheckpoint";

    public static final Set<String> STEP_EVENTS = Set.of(
            STEP_STARTED, STEP_COMPLETED, STEP_FAILED, STEP_COMPENSATING, STEP_COMPENSATED);

    public static final String SAGA_ID = "saga_id";
    public static final String DEFINITION_NAME = "definition_name";
    public static final String STEP_NAME = "step_name";
    public static final String STARTED_AT = "started_at";
    public static final String COMPLETED_AT = "completed_at";
    public static final String DURATION_MS = "duration_ms";
    public static final String RETRY_ATTEMPT = "retry_attempt";
    public static final String ERROR = "error";
    public static final String ERROR_MESSAGE = "error_message";
    public static final String FAILED_STEP = "failed_step";
    public static final String STEPS_COMPLETED = "steps_completed";
    public static final String COMPENSATED_STEPS = "compensated_steps";
    public static final String REASON = "reason";

    public static final String STATUS = "status";
    public static final String STEP = "step";
    public static final String CONTEXT = "context";
    public static final String SAVED_HISTORY_COUNT = "saved_history_count";
    public static final String LAST_SAVED_VERSION = "last_saved_version";

    private SagaEventTypes() {
    }

    public static boolean isStepEvent(String eventType) {
        return STEP_EVENTS.contains(eventType);
    }
}
