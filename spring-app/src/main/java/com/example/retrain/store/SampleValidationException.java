package com.example.retrain.store;

import java.util.List;

/**
 * A submitted sample failed feature-range or label checks. It never reaches the store.
 */
public class SampleValidationException extends IllegalArgumentException {

    private final List<String> violations;

    public SampleValidationException(List<String> violations) {
        super("Invalid training sample: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
