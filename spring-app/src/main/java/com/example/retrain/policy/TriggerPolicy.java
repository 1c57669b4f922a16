package com.example.retrain.policy;

import com.example.retrain.lifecycle.ModelArtifact;
import com.example.retrain.pipeline.RetrainProperties;
import com.example.retrain.policy.TriggerDecision.Cause;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Decides whether a retrain should run now, and why.
 *
 * <h2>Rules, in priority order</h2>
 * <ol>
 *   <li><b>Forced manual trigger</b> – runs regardless of data and model age. It honours the
 *       rate limit unless {@code retrain.force-bypasses-rate-limit} is set.</li>
 *   <li><b>Rate limit</b> – executed attempts started inside the trailing window
 *       {@code (now - rate-window, now]} at or above {@code max-daily-attempts} suppress everything else.</li>
 *   <li><b>Manual trigger</b> – runs when at least one sample is pending or the model is stale.</li>
 *   <li><b>Data sufficiency</b> – {@code pending >= min-samples}.</li>
 *   <li><b>Staleness</b> – model age in whole days {@code >= max-model-age-days}, or no model at all.</li>
 *   <li>Otherwise insufficient data.</li>
 * </ol>
 *
 * Pure: the outcome depends only on the {@link TriggerInputs} and the configured limits.
 */
@Component
public class TriggerPolicy {

    private final RetrainProperties props;

    public TriggerPolicy(RetrainProperties props) {
        this.props = props;
    }

    public TriggerDecision decide(TriggerInputs in) {
        Instant now = in.now();
        int inWindow = attemptsInWindow(in);
        Long ageDays = in.modelTrainedAt() == null ? null : ModelArtifact.ageDays(in.modelTrainedAt(), now);
        boolean stale = ageDays == null || ageDays >= props.getMaxModelAgeDays();
        boolean limited = inWindow >= props.getMaxDailyAttempts();
        String window = inWindow + "/" + props.getMaxDailyAttempts() + " attempts in window";

        if (in.manual() != null && in.manual().force()) {
            if (limited && !props.isForceBypassesRateLimit()) {
                return new TriggerDecision(Cause.RATE_LIMITED, "forced trigger refused: " + window, inWindow, ageDays);
            }
            return new TriggerDecision(Cause.FORCED, "forced by operator (" + window + ")", inWindow, ageDays);
        }
        if (limited) {
            return new TriggerDecision(Cause.RATE_LIMITED, "maximum attempts reached: " + window, inWindow, ageDays);
        }
        if (in.manual() != null) {
            if (in.pendingCount() > 0 || stale) {
                return new TriggerDecision(Cause.MANUAL,
                        "manual trigger with " + in.pendingCount() + " pending samples", inWindow, ageDays);
            }
            return new TriggerDecision(Cause.INSUFFICIENT_DATA,
                    "manual trigger refused: no pending samples and model is fresh", inWindow, ageDays);
        }
        if (in.pendingCount() >= props.getMinSamples()) {
            return new TriggerDecision(Cause.THRESHOLD_MET,
                    "pending samples " + in.pendingCount() + " >= " + props.getMinSamples(), inWindow, ageDays);
        }
        if (stale) {
            String age = ageDays == null ? "no current model" : "model age " + ageDays + "d >= " + props.getMaxModelAgeDays() + "d";
            return new TriggerDecision(Cause.STALE_MODEL, age, inWindow, ageDays);
        }
        return new TriggerDecision(Cause.INSUFFICIENT_DATA,
                "pending samples " + in.pendingCount() + " < " + props.getMinSamples(), inWindow, ageDays);
    }

    int attemptsInWindow(TriggerInputs in) {
        Instant from = in.now().minus(props.getRateWindow());
        int n = 0;
        for (Instant s : in.attemptStarts()) {
            if (s.isAfter(from) && !s.isAfter(in.now())) n++;
        }
        return n;
    }
}
