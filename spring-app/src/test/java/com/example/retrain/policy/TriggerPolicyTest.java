package com.example.retrain.policy;

import com.example.retrain.Fixtures;
import com.example.retrain.ledger.AttemptOutcome;
import com.example.retrain.ledger.TriggerReason;
import com.example.retrain.lifecycle.ModelArtifact;
import com.example.retrain.pipeline.RetrainProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TriggerPolicyTest {

    private static final Instant NOW = Fixtures.T0;
    private static final Instant FRESH = NOW.minus(Duration.ofDays(1));

    private RetrainProperties props;
    private TriggerPolicy policy;

    @BeforeEach
    void setUp() {
        props = new RetrainProperties();
        policy = new TriggerPolicy(props);
    }

    private TriggerDecision auto(long pending, Instant trainedAt, List<Instant> starts) {
        return policy.decide(new TriggerInputs(NOW, pending, trainedAt, starts, null));
    }

    @Test
    void oneSampleShortOfThresholdIsInsufficient() {
        TriggerDecision d = auto(49, FRESH, List.of());
        assertFalse(d.shouldRetrain());
        assertEquals("insufficient data", d.reason());
        assertEquals(AttemptOutcome.INSUFFICIENT_DATA, d.suppression());
    }

    @Test
    void reachingThresholdTriggers() {
        TriggerDecision d = auto(50, FRESH, List.of());
        assertTrue(d.shouldRetrain());
        assertEquals("threshold met", d.reason());
        assertEquals(TriggerReason.THRESHOLD_MET, d.triggerReason());
        assertEquals(1L, d.modelAgeDays());
    }

    @Test
    void modelOlderThanMaxAgeIsStale() {
        TriggerDecision d = auto(0, NOW.minus(Duration.ofDays(7)), List.of());
        assertTrue(d.shouldRetrain());
        assertEquals("stale model", d.reason());
        assertEquals(7L, d.modelAgeDays());
        assertEquals(ModelArtifact.ageDays(NOW.minus(Duration.ofDays(7)), NOW), d.modelAgeDays());

        assertFalse(auto(0, NOW.minus(Duration.ofDays(7)).plusSeconds(1), List.of()).shouldRetrain());
    }

    @Test
    void missingModelCountsAsStale() {
        TriggerDecision d = auto(0, null, List.of());
        assertEquals(TriggerDecision.Cause.STALE_MODEL, d.cause());
        assertNull(d.modelAgeDays());
    }

    @Test
    void thresholdTakesPrecedenceOverStaleness() {
        assertEquals("threshold met", auto(80, NOW.minus(Duration.ofDays(30)), List.of()).reason());
    }

    @Test
    void rateLimitSuppressesEverything() {
        List<Instant> starts = List.of(NOW.minus(Duration.ofHours(3)), NOW.minus(Duration.ofHours(1)));
        TriggerDecision d = auto(500, null, starts);
        assertFalse(d.shouldRetrain());
        assertEquals("rate limited", d.reason());
        assertEquals(AttemptOutcome.RATE_LIMITED, d.suppression());
        assertEquals(2, d.attemptsInWindow());

        TriggerDecision manual = policy.decide(new TriggerInputs(NOW, 500, null, starts, new ManualTrigger("ops", false)));
        assertEquals(TriggerDecision.Cause.RATE_LIMITED, manual.cause());
    }

    @Test
    void windowExcludesItsLowerBound() {
        List<Instant> starts = List.of(NOW.minus(Duration.ofHours(24)), NOW.minus(Duration.ofHours(1)));
        TriggerDecision d = auto(50, FRESH, starts);
        assertEquals(1, d.attemptsInWindow());
        assertTrue(d.shouldRetrain());
    }

    @Test
    void futureStartsAreNotCounted() {
        List<Instant> starts = List.of(NOW.plusSeconds(5), NOW.plusSeconds(6));
        assertTrue(auto(50, FRESH, starts).shouldRetrain());
    }

    @Test
    void forceOverridesDataAndAgeButNotRateLimit() {
        ManualTrigger force = new ManualTrigger("ops", true);
        TriggerDecision ok = policy.decide(new TriggerInputs(NOW, 0, FRESH, List.of(), force));
        assertEquals(TriggerReason.FORCED, ok.triggerReason());

        List<Instant> full = List.of(NOW.minusSeconds(10), NOW.minusSeconds(20));
        TriggerDecision limited = policy.decide(new TriggerInputs(NOW, 0, FRESH, full, force));
        assertEquals(TriggerDecision.Cause.RATE_LIMITED, limited.cause());
    }

    @Test
    void forceMayBypassRateLimitWhenConfigured() {
        props.setForceBypassesRateLimit(true);
        List<Instant> full = List.of(NOW.minusSeconds(10), NOW.minusSeconds(20));
        TriggerDecision d = policy.decide(new TriggerInputs(NOW, 0, FRESH, full, new ManualTrigger("ops", true)));
        assertTrue(d.shouldRetrain());
        assertEquals("forced", d.reason());
    }

    @Test
    void manualTriggerNeedsPendingDataOrStaleModel() {
        ManualTrigger manual = new ManualTrigger("ops", false);
        assertEquals(TriggerReason.MANUAL,
                policy.decide(new TriggerInputs(NOW, 1, FRESH, List.of(), manual)).triggerReason());
        assertEquals(TriggerReason.MANUAL,
                policy.decide(new TriggerInputs(NOW, 0, null, List.of(), manual)).triggerReason());

        TriggerDecision refused = policy.decide(new TriggerInputs(NOW, 0, FRESH, List.of(), manual));
        assertEquals(TriggerDecision.Cause.INSUFFICIENT_DATA, refused.cause());
    }

    @Test
    void decisionIsAPureFunctionOfItsInputs() {
        TriggerInputs in = new TriggerInputs(NOW, 12, FRESH, List.of(NOW.minusSeconds(60)), null);
        assertEquals(policy.decide(in), policy.decide(in));
        assertEquals(policy.decide(in), new TriggerPolicy(props).decide(in));
    }

    @Test
    void configuredLimitsAreHonoured() {
        props.setMinSamples(5);
        props.setMaxModelAgeDays(1);
        props.setMaxDailyAttempts(1);
        assertEquals("threshold met", auto(5, FRESH, List.of()).reason());
        assertEquals("stale model", auto(0, FRESH, List.of()).reason());
        assertEquals("rate limited", auto(5, FRESH, List.of(NOW.minusSeconds(1))).reason());
    }
}
