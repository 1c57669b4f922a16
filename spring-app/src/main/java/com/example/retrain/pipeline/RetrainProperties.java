package com.example.retrain.pipeline;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Every retraining threshold in one place, bound from {@code retrain.*}.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "retrain")
public class RetrainProperties {

    /** Pending samples that justify a retrain. */
    private int minSamples = 50;

    /** Model age (whole days) after which a best-effort refresh runs. */
    private int maxModelAgeDays = 7;

    /** Executed attempts allowed per {@link #rateWindow}. */
    private int maxDailyAttempts = 2;

    private Duration rateWindow = Duration.ofHours(24);

    /** Accept a candidate when its RMSE is at most baseline x (1 + tolerance). */
    private double regressionTolerance = 0.02;

    /** Candidates evaluated on fewer hold-out rows are rejected. */
    private int minValidationSamples = 10;

    /** Prior current artifacts kept for rollback. */
    private int backupRetentionCount = 5;

    private Duration trainingTimeout = Duration.ofMinutes(10);

    /** Whether a forced manual trigger also ignores the rate limit. */
    private boolean forceBypassesRateLimit = false;

    /** Ledger entries returned by status. */
    private int recentAttempts = 5;

    /** Upper plausibility bound for labels (thousands USD). */
    private double maxLabel = 500.0;

    private String dataDir = "data";

    private String seedCsv = "classpath:seed/housing-seed.csv";

    /** Evaluate the trigger policy after submissions, on a schedule and at start-up. */
    private boolean autoTrigger = true;

    private Duration checkInterval = Duration.ofMinutes(15);

    private double holdoutFraction = 0.2;

    private long splitSeed = 42L;
}
