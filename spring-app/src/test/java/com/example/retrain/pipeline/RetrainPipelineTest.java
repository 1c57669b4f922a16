package com.example.retrain.pipeline;

import com.example.retrain.DefaultConfiguration;
import com.example.retrain.Fixtures;
import com.example.retrain.dto.BatchSubmitResponse;
import com.example.retrain.dto.StatusView;
import com.example.retrain.dto.SubmitResponse;
import com.example.retrain.dto.TriggerResponse;
import com.example.retrain.gate.ValidationGate;
import com.example.retrain.ledger.AttemptLedger;
import com.example.retrain.ledger.AttemptOutcome;
import com.example.retrain.ledger.RetrainAttempt;
import com.example.retrain.ledger.TriggerReason;
import com.example.retrain.lifecycle.CanaryHealthCheck;
import com.example.retrain.lifecycle.FileSystemArtifactStore;
import com.example.retrain.lifecycle.HealthCheck;
import com.example.retrain.lifecycle.HealthReport;
import com.example.retrain.lifecycle.ModelLifecycleManager;
import com.example.retrain.ml.ModelTrainer;
import com.example.retrain.ml.TrainingOrchestrator;
import com.example.retrain.policy.TriggerPolicy;
import com.example.retrain.store.AppendOnlyLog;
import com.example.retrain.store.ConsumptionMark;
import com.example.retrain.store.JsonLinesLog;
import com.example.retrain.store.SampleStore;
import com.example.retrain.store.SampleValidationException;
import com.example.retrain.store.SampleValidator;
import com.example.retrain.store.SeedDataset;
import com.example.retrain.store.TrainingSample;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RetrainPipelineTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir
    Path tmp;

    private final Fixtures.MutableClock clock = new Fixtures.MutableClock(Fixtures.T0);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final AtomicReference<Double> nextRmse = new AtomicReference<>(10.0);
    private final AtomicBoolean failFit = new AtomicBoolean();
    private final AtomicBoolean failHealth = new AtomicBoolean();

    private RetrainProperties props;
    private SampleStore store;
    private AttemptLedger ledger;
    private ModelLifecycleManager lifecycle;
    private RetrainPipeline pipeline;

    private final ModelTrainer stubTrainer = rows -> {
        if (failFit.get()) throw new IllegalStateException("fit exploded");
        return Fixtures.fit(nextRmse.get());
    };

    private final HealthCheck switchableCheck = a -> failHealth.get()
            ? HealthReport.failed("canary refused")
            : new CanaryHealthCheck(500.0).check(a);

    @BeforeEach
    void setUp() {
        props = new RetrainProperties();
        props.setAutoTrigger(false);
        props.setDataDir(tmp.toString());
        pipeline = build(stubTrainer);
    }

    private RetrainPipeline build(ModelTrainer trainer) {
        return build(trainer, new JsonLinesLog<>(tmp.resolve("consumed.jsonl"),
                DefaultConfiguration.storageMapper(), ConsumptionMark.class, ConsumptionMark::consumedAt));
    }

    private RetrainPipeline build(ModelTrainer trainer, AppendOnlyLog<ConsumptionMark> consumption) {
        ObjectMapper om = DefaultConfiguration.storageMapper();
        store = new SampleStore(
                new JsonLinesLog<>(tmp.resolve("samples.jsonl"), om, TrainingSample.class, TrainingSample::receivedAt),
                consumption,
                new SampleValidator(props.getMaxLabel()),
                clock);
        ledger = new AttemptLedger(new JsonLinesLog<>(tmp.resolve("attempts.jsonl"), om,
                RetrainAttempt.class, RetrainAttempt::startedAt));
        lifecycle = new ModelLifecycleManager(new FileSystemArtifactStore(tmp.resolve("models"), om),
                switchableCheck, props.getBackupRetentionCount());
        return new RetrainPipeline(store, ledger, new TriggerPolicy(props),
                new TrainingOrchestrator(trainer, props.getTrainingTimeout(), clock),
                new ValidationGate(props), lifecycle, new SeedDataset(Fixtures.syntheticRows(50, 1)),
                props, clock, registry);
    }

    private TriggerResponse bootstrap() {
        TriggerResponse r = pipeline.trigger("bootstrap", true, true).block(WAIT);
        assertEquals("success", r.outcome());
        return r;
    }

    private void submit(int n) {
        for (int i = 0; i < n; i++) pipeline.submit(Fixtures.validSample(i));
    }

    private static void awaitIdle(RetrainPipeline p) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (p.attemptInProgress()) {
            if (System.nanoTime() > deadline) fail("attempt did not finish");
            Thread.sleep(10);
        }
    }

    private RetrainAttempt lastEntry() {
        List<RetrainAttempt> all = ledger.all();
        return all.get(all.size() - 1);
    }

    @Test
    void fortyNineSamplesAreInsufficientAndTheFiftiethMeetsThreshold() {
        bootstrap();
        submit(49);

        StatusView s = pipeline.status();
        assertEquals(49, s.pending_count());
        assertFalse(s.should_retrain());
        assertEquals("insufficient data", s.reason());
        assertEquals(0L, s.model_age_days());

        SubmitResponse r = pipeline.submit(Fixtures.validSample(49));
        assertEquals(50, r.total_pending());
        assertTrue(r.should_retrain());
        assertEquals("threshold met", r.reason());
    }

    @Test
    void noModelIsReportedAsStale() {
        StatusView s = pipeline.status();
        assertTrue(s.should_retrain());
        assertEquals("stale model", s.reason());
        assertNull(s.model_age_days());
        assertNull(s.current_version());
    }

    @Test
    void automaticThresholdRunPromotesAndConsumesPending() throws Exception {
        bootstrap();
        submit(50);
        nextRmse.set(9.0);

        TriggerResponse r = pipeline.autoTrigger().block(WAIT);
        assertEquals(TriggerResponse.STARTED, r.outcome());
        awaitIdle(pipeline);

        RetrainAttempt a = lastEntry();
        assertEquals(AttemptOutcome.SUCCESS, a.outcome());
        assertEquals(TriggerReason.THRESHOLD_MET, a.reason());
        assertEquals(50, a.samplesUsed());
        assertEquals(2L, a.promotedVersion());
        assertEquals(9.0, a.candidateMetrics().rmse());
        assertEquals(10.0, a.baselineMetrics().rmse());
        assertEquals(0, store.pendingCount());
        assertEquals(2L, lifecycle.current().orElseThrow().version());
        assertEquals(50, store.historicalSamples().size());
        assertEquals(2.0, registry.counter("retrain.attempts", "outcome", "success").count());
    }

    @Test
    void negativeAutomaticDecisionIsNotRecorded() {
        bootstrap();
        TriggerResponse r = pipeline.autoTrigger().block(WAIT);
        assertEquals("insufficient-data", r.outcome());
        assertEquals(1, ledger.all().size());
    }

    @Test
    void gateRejectionKeepsCurrentModelAndPendingSamples() {
        bootstrap();
        submit(5);
        nextRmse.set(10.5);

        TriggerResponse r = pipeline.trigger("ops", false, true).block(WAIT);

        assertEquals("rejected-by-gate", r.outcome());
        assertEquals(10.5, r.candidate_metrics().rmse());
        assertEquals(10.0, r.baseline_metrics().rmse());
        assertTrue(r.detail().startsWith("REGRESSION"), r.detail());
        assertEquals(1L, lifecycle.current().orElseThrow().version());
        assertEquals(5, store.pendingCount());
        assertEquals(TriggerReason.MANUAL, lastEntry().reason());
    }

    @Test
    void trainingFailureKeepsCurrentModelAndPendingSamples() {
        bootstrap();
        submit(3);
        failFit.set(true);

        TriggerResponse r = pipeline.trigger("ops", false, true).block(WAIT);

        assertEquals("training-failed", r.outcome());
        assertTrue(r.detail().contains("fit exploded"), r.detail());
        assertNull(r.candidate_metrics());
        assertEquals(1L, lifecycle.current().orElseThrow().version());
        assertEquals(3, store.pendingCount());
        assertFalse(pipeline.attemptInProgress());
    }

    @Test
    void failedPromotionIsRecordedAndKeepsPriorModel() {
        bootstrap();
        submit(3);
        failHealth.set(true);

        TriggerResponse r = pipeline.trigger("ops", false, true).block(WAIT);

        assertEquals("promotion-failed", r.outcome());
        assertEquals(AttemptOutcome.PROMOTION_FAILED, lastEntry().outcome());
        assertTrue(r.detail().startsWith("HEALTH_CHECK"), r.detail());
        assertEquals(1L, lifecycle.current().orElseThrow().version());
        assertEquals(3, store.pendingCount());
    }

    @Test
    void rateLimitIsNeverExceeded() {
        bootstrap();
        assertEquals("success", pipeline.trigger("again", true, true).block(WAIT).outcome());

        TriggerResponse third = pipeline.trigger("third", true, true).block(WAIT);

        assertEquals("rate-limited", third.outcome());
        assertEquals(AttemptOutcome.RATE_LIMITED, lastEntry().outcome());
        assertEquals(2, ledger.executedStartsSince(clock.instant().minus(props.getRateWindow())).size());
        assertEquals(2, pipeline.status().attempts_in_window());

        clock.advance(Duration.ofHours(24));
        assertEquals("success", pipeline.trigger("next day", true, true).block(WAIT).outcome());
    }

    @Test
    void waitingTriggerFreesTheSlotBeforeReturning() {
        props.setMaxDailyAttempts(100);
        for (int i = 0; i < 30; i++) {
            TriggerResponse r = pipeline.trigger("round " + i, true, true).block(WAIT);

            assertEquals("success", r.outcome(), "round " + i);
            assertFalse(pipeline.attemptInProgress(), "round " + i);
            assertFalse(pipeline.status().attempt_in_progress(), "round " + i);
        }
        assertEquals(30, ledger.all().size());
    }

    @Test
    void promotionIsRecordedEvenWhenWatermarkCannotBeSaved() {
        AppendOnlyLog<ConsumptionMark> full = new AppendOnlyLog<>() {
            @Override public void append(ConsumptionMark record) {
                throw new UncheckedIOException(new IOException("disk full"));
            }
            @Override public List<ConsumptionMark> readSince(Instant since) { return List.of(); }
            @Override public List<ConsumptionMark> readAll() { return List.of(); }
        };
        pipeline = build(stubTrainer, full);
        submit(3);

        TriggerResponse r = pipeline.trigger("ops", true, true).block(WAIT);

        assertEquals("success", r.outcome());
        assertTrue(r.detail().contains("consumption watermark not saved"), r.detail());
        assertEquals(1, ledger.all().size());
        assertEquals(1L, lifecycle.current().orElseThrow().version());
        assertEquals(3, store.pendingCount());
        assertEquals(1, pipeline.status().attempts_in_window());
        assertFalse(pipeline.attemptInProgress());
    }

    @Test
    void refusedManualTriggerIsRecordedButNotCounted() {
        bootstrap();

        TriggerResponse r = pipeline.trigger("ops", false, true).block(WAIT);

        assertEquals("insufficient-data", r.outcome());
        assertEquals(2, ledger.all().size());
        assertEquals(AttemptOutcome.INSUFFICIENT_DATA, lastEntry().outcome());
        assertEquals(1, pipeline.status().attempts_in_window());
    }

    @Test
    void modelBecomesStaleWithAge() {
        bootstrap();
        clock.advance(Duration.ofDays(7));

        StatusView s = pipeline.status();

        assertTrue(s.should_retrain());
        assertEquals("stale model", s.reason());
        assertEquals(7L, s.model_age_days());
    }

    @Test
    void concurrentTriggersStartExactlyOneAttempt() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        pipeline = build(rows -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Fixtures.fit(10.0);
        });
        CyclicBarrier barrier = new CyclicBarrier(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Future<String>> calls = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            calls.add(pool.submit(() -> {
                barrier.await(5, TimeUnit.SECONDS);
                return pipeline.trigger("race", true, false).block(WAIT).outcome();
            }));
        }
        List<String> outcomes = new ArrayList<>();
        for (Future<String> f : calls) outcomes.add(f.get(10, TimeUnit.SECONDS));
        pool.shutdown();

        assertTrue(outcomes.contains(TriggerResponse.STARTED), outcomes.toString());
        assertTrue(outcomes.contains(TriggerResponse.ALREADY_IN_PROGRESS), outcomes.toString());

        StatusView during = pipeline.status();
        assertTrue(during.attempt_in_progress());
        assertTrue(ledger.all().isEmpty());

        release.countDown();
        awaitIdle(pipeline);
        assertEquals(1, ledger.all().size());
        assertEquals(AttemptOutcome.SUCCESS, lastEntry().outcome());
    }

    @Test
    void samplesArrivingDuringTrainingStayPending() throws Exception {
        bootstrap();
        submit(4);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        pipeline = build(rows -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Fixtures.fit(10.0);
        });

        assertEquals(TriggerResponse.STARTED, pipeline.trigger("ops", false, false).block(WAIT).outcome());
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        pipeline.submit(Fixtures.validSample(100));
        pipeline.submit(Fixtures.validSample(101));
        release.countDown();
        awaitIdle(pipeline);

        assertEquals(AttemptOutcome.SUCCESS, lastEntry().outcome());
        assertEquals(4, lastEntry().samplesUsed());
        assertEquals(2, store.pendingCount());
    }

    @Test
    void invalidSubmissionThrowsAndIsCounted() {
        SampleValidationException ex = assertThrows(SampleValidationException.class,
                () -> pipeline.submit(Fixtures.outOfRangeSample()));
        assertFalse(ex.violations().isEmpty());
        assertEquals(0, store.pendingCount());
        assertEquals(1.0, registry.counter("retrain.samples.rejected").count());
    }

    @Test
    void batchReportsItemErrorsByIndex() {
        BatchSubmitResponse r = pipeline.submitBatch(List.of(
                Fixtures.validSample(1), Fixtures.outOfRangeSample(), Fixtures.validSample(2)));

        assertEquals(2, r.accepted_count());
        assertEquals(1, r.failed_count());
        assertEquals(1, r.errors().get(0).index());
        assertEquals(2, r.total_pending());
    }

    @Test
    void statusListsOnlyRecentAttempts() {
        props.setMaxDailyAttempts(100);
        for (int i = 0; i < 7; i++) pipeline.trigger("run " + i, true, true).block(WAIT);

        List<RetrainAttempt> recent = pipeline.status().recent_attempts();

        assertEquals(5, recent.size());
        assertEquals(ledger.all().get(6).id(), recent.get(4).id());
    }

    @Test
    void stateSurvivesRestart() {
        bootstrap();
        submit(3);

        RetrainPipeline restarted = build(stubTrainer);

        StatusView s = restarted.status();
        assertEquals(3, s.pending_count());
        assertEquals(1L, s.current_version());
        assertEquals(1, s.attempts_in_window());
    }
}
