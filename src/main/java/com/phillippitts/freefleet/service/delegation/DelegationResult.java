package com.phillippitts.freefleet.service.delegation;

import com.phillippitts.freefleet.domain.ModelCategory;
import com.phillippitts.freefleet.domain.TaskType;

import java.util.Objects;

/**
 * Outcome of a successful delegation.
 *
 * @param winner      id of the model whose result was used
 * @param latencyMs   wall time of the whole delegation
 * @param modelsRaced size of the primary wave
 */
public record DelegationResult<T>(
        TaskType taskType,
        ModelCategory category,
        String winner,
        T result,
        long latencyMs,
        int modelsRaced
) {
    public DelegationResult {
        Objects.requireNonNull(taskType, "taskType");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(winner, "winner");
    }
}
