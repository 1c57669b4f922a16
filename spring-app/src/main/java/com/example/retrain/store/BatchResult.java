package com.example.retrain.store;

import java.util.List;

/**
 * Per-item results of a batch submission, in request order, plus summary counts.
 */
public record BatchResult(List<SubmitResult> items, long pendingAfter) {

    public BatchResult {
        items = List.copyOf(items);
    }

    public int acceptedCount() {
        return (int) items.stream().filter(SubmitResult::isAccepted).count();
    }

    public int failedCount() {
        return items.size() - acceptedCount();
    }
}
