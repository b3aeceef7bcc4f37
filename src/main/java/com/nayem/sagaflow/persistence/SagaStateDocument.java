package com.nayem.sagaflow.persistence;

import com.nayem.sagaflow.saga.SagaHistory;
import com.nayem.sagaflow.saga.SagaInstance;
import com.nayem.sagaflow.saga.SagaMetadata;
import com.nayem.sagaflow.saga.StepStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of a saga's full state, used for snapshots.
 */
public record SagaStateDocument(
        String id,
        String definitionName,
        String status,
        String currentStep,
        Map<String, Object> context,
        List<HistoryDocument> history,
        Instant startedAt,
        Instant completedAt,
        Instant createdAt,
        Instant updatedAt) {

    public static SagaStateDocument from(SagaInstance saga) {
        SagaMetadata metadata = saga.getContext().metadata();
        List<HistoryDocument> history = new ArrayList<>();
        for (SagaHistory entry : saga.getHistory()) {
            history.add(HistoryDocument.from(entry));
        }
        return new SagaStateDocument(
                saga.getId(),
                saga.getDefinition().getName(),
                saga.getStatus().value(),
                saga.getCurrentStep(),
                saga.getContext().toMap(),
                history,
                saga.getStartedAt(),
                saga.getCompletedAt(),
                metadata.createdAt(),
                metadata.updatedAt());
    }

    public List<SagaHistory> toHistory() {
        List<SagaHistory> result = new ArrayList<>();
        if (history != null) {
            for (HistoryDocument entry : history) {
                result.add(entry.toHistory());
            }
        }
        return result;
    }

    public record HistoryDocument(
            String stepName,
            String status,
            Instant startedAt,
            Instant completedAt,
            String error,
            int retryAttempt) {

        static HistoryDocument from(SagaHistory entry) {
            return new HistoryDocument(entry.stepName(), entry.status().value(), entry.startedAt(),
                    entry.completedAt(), entry.error(), entry.retryAttempt());
        }

        SagaHistory toHistory() {
            return new SagaHistory(stepName, StepStatus.fromValue(status), startedAt, completedAt, error,
                    retryAttempt);
        }
    }
}
