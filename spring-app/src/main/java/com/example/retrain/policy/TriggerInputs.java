package com.example.retrain.policy;

import java.time.Instant;
import java.util.List;

/**
 * Everything {@link TriggerPolicy#decide} looks at.
 *
 * @param now            evaluation time
 * @param pendingCount   samples accumulated since the last successful run
 * @param modelTrainedAt training time of the current artifact, {@code null} when none serves
 * @param attemptStarts  start times of executed attempts (at least those inside the rate window)
 * @param manual         operator request, {@code null} for automatic evaluation
 */
public record TriggerInputs(
        Instant now,
        long pendingCount,
        Instant modelTrainedAt,
        List<Instant> attemptStarts,
        ManualTrigger manual) {

    public TriggerInputs {
        attemptStarts = List.copyOf(attemptStarts);
    }
}
