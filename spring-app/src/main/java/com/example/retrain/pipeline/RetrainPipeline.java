package com.example.retrain.pipeline;

import com.example.retrain.dto.BatchSubmitResponse;
import com.example.retrain.dto.SampleRequest;
import com.example.retrain.dto.StatusView;
import com.example.retrain.dto.SubmitResponse;
import com.example.retrain.dto.TriggerResponse;
import com.example.retrain.gate.GateVerdict;
import com.example.retrain.gate.ValidationGate;
import com.example.retrain.ledger.AttemptLedger;
import com.example.retrain.ledger.AttemptOutcome;
import com.example.retrain.ledger.RetrainAttempt;
import com.example.retrain.ledger.TriggerReason;
import com.example.retrain.lifecycle.ModelArtifact;
import com.example.retrain.lifecycle.ModelLifecycleManager;
import com.example.retrain.lifecycle.PromotionResult;
import com.example.retrain.ml.ModelMetrics;
import com.example.retrain.ml.TrainingOrchestrator;
import com.example.retrain.ml.TrainingOutcome;
import com.example.retrain.ml.TrainingRow;
import com.example.retrain.policy.ManualTrigger;
import com.example.retrain.policy.TriggerDecision;
import com.example.retrain.policy.TriggerInputs;
import com.example.retrain.policy.TriggerPolicy;
import com.example.retrain.store.BatchResult;
import com.example.retrain.store.PendingSnapshot;
import com.example.retrain.store.SampleStore;
import com.example.retrain.store.SampleValidationException;
import com.example.retrain.store.SeedDataset;
import com.example.retrain.store.SubmitResult;
import com.example.retrain.store.TrainingSample;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The automated retraining pipeline: submit → decide → train → validate → promote → record.
 *
 * <h2>Operations</h2>
 * <ul>
 *   <li>{@link #submit} / {@link #submitBatch} – validate and store labeled samples; an accepted
 *       submission asks for an automatic policy evaluation in the background.</li>
 *   <li>{@link #status} – pending count, model age, the current policy decision and recent attempts.
 *       Never waits for a running attempt.</li>
 *   <li>{@link #trigger} – manual request, judged by the {@link TriggerPolicy}.</li>
 *   <li>{@link #autoTrigger} – automatic evaluation, used after submissions, by the scheduler and at start-up.</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * At most one attempt runs at a time. The in-progress check, the rate-limit read of the ledger
 * and the reservation of the attempt slot happen under one lock, and the slot is released only
 * once the attempt's ledger entry is appended and before its result is emitted, so two callers can
 * never both pass the limiter and a caller that waited can trigger again at once.
 * A trigger arriving while an attempt runs is answered {@code already-in-progress} at once.
 * Attempts run on {@code boundedElastic}; a waiting caller that goes away does not cancel them.
 */
@Slf4j
@Service
public class RetrainPipeline {

    private final SampleStore store;
    private final AttemptLedger ledger;
    private final TriggerPolicy policy;
    private final TrainingOrchestrator orchestrator;
    private final ValidationGate gate;
    private final ModelLifecycleManager lifecycle;
    private final SeedDataset seed;
    private final RetrainProperties props;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Timer trainingTimer;

    private final ReentrantLock decisionLock = new ReentrantLock();
    private final AtomicBoolean inProgress = new AtomicBoolean(false);

    public RetrainPipeline(SampleStore store,
                           AttemptLedger ledger,
                           TriggerPolicy policy,
                           TrainingOrchestrator orchestrator,
                           ValidationGate gate,
                           ModelLifecycleManager lifecycle,
                           SeedDataset seed,
                           RetrainProperties props,
                           Clock clock,
                           MeterRegistry meterRegistry) {
        this.store = store;
        this.ledger = ledger;
        this.policy = policy;
        this.orchestrator = orchestrator;
        this.gate = gate;
        this.lifecycle = lifecycle;
        this.seed = seed;
        this.props = props;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.trainingTimer = meterRegistry.timer("retrain.training.duration");
        Gauge.builder("retrain.samples.pending", store, SampleStore::pendingCount).register(meterRegistry);
    }

    @PostConstruct
    void initAsyncCheck() {
        if (!props.isAutoTrigger()) return;
        Mono.defer(this::autoTrigger)
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSubscribe(s -> log.info("Start-up retrain policy check… current model={}",
                        lifecycle.current().map(ModelArtifact::version).orElse(null)))
                .subscribe(r -> log.info("Start-up retrain check: outcome={}, reason={}", r.outcome(), r.reason()),
                        e -> log.error("Start-up retrain check failed", e));
    }

    /* ===================== SUBMISSION ===================== */

    /**
     * Validate and store one sample.
     *
     * @throws SampleValidationException if any feature or the label is out of range
     */
    public SubmitResponse submit(SampleRequest request) {
        SubmitResult r = store.submit(request);
        if (!r.isAccepted()) {
            meterRegistry.counter("retrain.samples.rejected").increment();
            throw new SampleValidationException(r.violations());
        }
        meterRegistry.counter("retrain.samples.accepted").increment();
        TriggerDecision d = decide(clock.instant(), null);
        afterSubmission();
        return new SubmitResponse(true, store.pendingCount(), d.shouldRetrain(), d.reason());
    }

    /** Store every valid item; invalid items are reported individually. */
    public BatchSubmitResponse submitBatch(List<SampleRequest> requests) {
        BatchResult r = store.submitBatch(requests);
        List<BatchSubmitResponse.ItemError> errors = new ArrayList<>();
        for (int i = 0; i < r.items().size(); i++) {
            SubmitResult item = r.items().get(i);
            if (!item.isAccepted()) errors.add(new BatchSubmitResponse.ItemError(i, item.violations()));
        }
        meterRegistry.counter("retrain.samples.accepted").increment(r.acceptedCount());
        meterRegistry.counter("retrain.samples.rejected").increment(r.failedCount());
        if (r.acceptedCount() > 0) afterSubmission();
        return new BatchSubmitResponse(r.acceptedCount(), r.failedCount(), errors, r.pendingAfter());
    }

    private void afterSubmission() {
        if (!props.isAutoTrigger()) return;
        Mono.defer(this::autoTrigger)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(r -> log.debug("Post-submission check: {}", r.outcome()),
                        e -> log.error("Post-submission retrain check failed", e));
    }

    /* ===================== STATUS ===================== */

    public StatusView status() {
        return status(clock.instant());
    }

    public StatusView status(Instant now) {
        TriggerDecision d = decide(now, null);
        return new StatusView(
                store.pendingCount(),
                d.modelAgeDays(),
                d.shouldRetrain(),
                d.reason(),
                d.detail(),
                d.attemptsInWindow(),
                props.getMaxDailyAttempts(),
                inProgress.get(),
                lifecycle.current().map(ModelArtifact::version).orElse(null),
                ledger.recent(props.getRecentAttempts()));
    }

    public boolean attemptInProgress() {
        return inProgress.get();
    }

    /* ===================== TRIGGERS ===================== */

    /**
     * Manual trigger.
     *
     * @param note  caller's reason, recorded in the ledger
     * @param force bypass data sufficiency and staleness (not the rate limit, unless configured)
     * @param wait  emit the finished attempt rather than {@code started}
     */
    public Mono<TriggerResponse> trigger(String note, boolean force, boolean wait) {
        return Mono.defer(() -> start(new ManualTrigger(note, force), wait));
    }

    /** Automatic evaluation. Negative decisions are not written to the ledger. */
    public Mono<TriggerResponse> autoTrigger() {
        return Mono.defer(() -> start(null, false));
    }

    private Mono<TriggerResponse> start(ManualTrigger manual, boolean wait) {
        Instant now = clock.instant();
        Attempt attempt;
        decisionLock.lock();
        try {
            if (inProgress.get()) {
                log.info("Retrain request ignored: attempt already in progress");
                return Mono.just(TriggerResponse.alreadyInProgress());
            }
            TriggerDecision d = decide(now, manual);
            if (!d.shouldRetrain()) {
                if (manual != null) recordSuppressed(now, manual, d);
                return Mono.just(TriggerResponse.suppressed(d));
            }
            inProgress.set(true);
            try {
                String detail = manual == null ? d.detail() : d.detail() + " [" + manual.note() + "]";
                attempt = new Attempt(UUID.randomUUID().toString(), now, d.triggerReason(), detail,
                        store.drainForTraining());
            } catch (RuntimeException e) {
                inProgress.set(false);
                throw e;
            }
        } finally {
            decisionLock.unlock();
        }

        log.info("Retrain attempt {} started: reason={} ({}), pending samples={}",
                attempt.id(), attempt.reason().label(), attempt.detail(), attempt.snapshot().size());
        Mono<TriggerResponse> run = execute(attempt)
                .doOnError(e -> inProgress.set(false))
                .doOnCancel(() -> inProgress.set(false))
                .subscribeOn(Schedulers.boundedElastic())
                .cache();
        run.subscribe(r -> { }, e -> log.error("Retrain attempt {} aborted", attempt.id(), e));
        return wait ? run : Mono.just(TriggerResponse.started(attempt.id(), attempt.reason().label(), attempt.detail()));
    }

    private TriggerDecision decide(Instant now, ManualTrigger manual) {
        Instant trainedAt = lifecycle.current().map(ModelArtifact::trainedAt).orElse(null);
        List<Instant> starts = ledger.executedStartsSince(now.minus(props.getRateWindow()));
        return policy.decide(new TriggerInputs(now, store.pendingCount(), trainedAt, starts, manual));
    }

    private void recordSuppressed(Instant now, ManualTrigger manual, TriggerDecision d) {
        RetrainAttempt a = RetrainAttempt.builder()
                .id(UUID.randomUUID().toString())
                .startedAt(now)
                .finishedAt(now)
                .reason(manual.force() ? TriggerReason.FORCED : TriggerReason.MANUAL)
                .outcome(d.suppression())
                .detail(d.detail() + " [" + manual.note() + "]")
                .baselineMetrics(lifecycle.current().map(ModelArtifact::metrics).orElse(null))
                .build();
        ledger.record(a);
        meterRegistry.counter("retrain.attempts", "outcome", a.outcome().label()).increment();
    }

    /* ===================== ATTEMPT ===================== */

    private Mono<TriggerResponse> execute(Attempt attempt) {
        return Mono.fromCallable(this::historicalRows)
                .flatMap(history -> orchestrator.run(history, attempt.snapshot().samples()))
                .map(outcome -> conclude(attempt, outcome));
    }

    private List<TrainingRow> historicalRows() {
        List<TrainingSample> consumed = store.historicalSamples();
        List<TrainingRow> rows = new ArrayList<>(seed.size() + consumed.size());
        rows.addAll(seed.rows());
        for (TrainingSample s : consumed) rows.add(s.toRow());
        return rows;
    }

    private TriggerResponse conclude(Attempt attempt, TrainingOutcome outcome) {
        ModelMetrics baseline = lifecycle.current().map(ModelArtifact::metrics).orElse(null);
        RetrainAttempt.RetrainAttemptBuilder entry = RetrainAttempt.builder()
                .id(attempt.id())
                .startedAt(attempt.startedAt())
                .reason(attempt.reason())
                .samplesUsed(attempt.snapshot().size())
                .baselineMetrics(baseline);

        if (outcome instanceof TrainingOutcome.Failure f) {
            trainingTimer.record(f.took());
            entry.outcome(AttemptOutcome.TRAINING_FAILED).detail(f.cause() + ": " + f.message());
        } else {
            TrainingOutcome.Candidate c = (TrainingOutcome.Candidate) outcome;
            trainingTimer.record(c.took());
            entry.candidateMetrics(c.metrics());
            GateVerdict verdict = gate.evaluate(c.metrics(), baseline);
            if (!verdict.accepted()) {
                entry.outcome(AttemptOutcome.REJECTED_BY_GATE).detail(verdict.code() + ": " + verdict.detail());
            } else {
                PromotionResult p = lifecycle.promote(c);
                if (p.promoted()) {
                    entry.outcome(AttemptOutcome.SUCCESS)
                            .promotedVersion(p.version())
                            .detail(verdict.detail() + "; " + p.detail() + consume(attempt));
                } else {
                    entry.outcome(AttemptOutcome.PROMOTION_FAILED).detail(p.failure() + ": " + p.detail());
                }
            }
        }

        Instant end = clock.instant();
        RetrainAttempt a = entry.finishedAt(end)
                .durationMs(Duration.between(attempt.startedAt(), end).toMillis())
                .build();
        try {
            ledger.record(a);
        } finally {
            inProgress.set(false);
        }
        meterRegistry.counter("retrain.attempts", "outcome", a.outcome().label()).increment();
        log.info("Retrain attempt {} finished: outcome={}, candidate={}, baseline={}, version={}",
                a.id(), a.outcome().label(), a.candidateMetrics(), a.baselineMetrics(), a.promotedVersion());
        return TriggerResponse.of(a);
    }

    /** @return suffix for the ledger detail, empty when the watermark was committed */
    private String consume(Attempt attempt) {
        try {
            store.markConsumed(attempt.snapshot(), attempt.id());
            return "";
        } catch (RuntimeException e) {
            log.error("Attempt {} promoted a model but its samples could not be marked consumed; they stay pending",
                    attempt.id(), e);
            return "; consumption watermark not saved: " + e;
        }
    }

    private record Attempt(String id, Instant startedAt, TriggerReason reason, String detail, PendingSnapshot snapshot) {}
}
