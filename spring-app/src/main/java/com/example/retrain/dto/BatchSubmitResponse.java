package com.example.retrain.dto;

import java.util.List;

/**
 * Result of a batch submission. Invalid items never abort the batch; each is
 * listed in {@code errors} with its position in the request.
 */
public record BatchSubmitResponse(
        int accepted_count,
        int failed_count,
        List<ItemError> errors,
        long total_pending) {

    public record ItemError(int index, List<String> violations) {}
}
