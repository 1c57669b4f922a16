package com.example.retrain.lifecycle;

/**
 * Post-promotion check run against the artifact that was just made current.
 * A failing report makes the lifecycle manager revert to the prior artifact.
 */
@FunctionalInterface
public interface HealthCheck {

    HealthReport check(ModelArtifact current);
}
