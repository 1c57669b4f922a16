package com.example.retrain.ml;

import com.example.retrain.store.TrainingSample;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Runs the pluggable {@link ModelTrainer} over historical data plus new samples.
 *
 * <ul>
 *   <li>Merge policy: append, no de-duplication. Repeated feature vectors with different
 *       labels are all kept with equal weight.</li>
 *   <li>The fit runs on {@code boundedElastic}, bounded by {@code timeout}. A late result is
 *       discarded; since the trainer only returns an in-memory model, nothing partial is left
 *       where the lifecycle manager could see it.</li>
 *   <li>On timeout the worker thread is interrupted, but Java cannot stop a running computation.
 *       The attempt slot is released right away, so a trainer that ignores interruption may still
 *       be computing when the next attempt's fit starts. Trainers should check
 *       {@link Thread#isInterrupted()} between expensive steps, as {@link OlsModelTrainer} does.</li>
 *   <li>Every error becomes a {@link TrainingOutcome.Failure}. No automatic retry.</li>
 * </ul>
 */
@Slf4j
public class TrainingOrchestrator {

    private final ModelTrainer trainer;
    private final Duration timeout;
    private final Clock clock;
    private final Scheduler scheduler;

    public TrainingOrchestrator(ModelTrainer trainer, Duration timeout, Clock clock) {
        this(trainer, timeout, clock, Schedulers.boundedElastic());
    }

    TrainingOrchestrator(ModelTrainer trainer, Duration timeout, Clock clock, Scheduler scheduler) {
        this.trainer = trainer;
        this.timeout = timeout;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    public Mono<TrainingOutcome> run(List<TrainingRow> historical, List<TrainingSample> newSamples) {
        return Mono.defer(() -> {
            List<TrainingRow> combined = new ArrayList<>(historical.size() + newSamples.size());
            combined.addAll(historical);
            for (TrainingSample s : newSamples) combined.add(s.toRow());
            log.info("Training on {} rows (historical={}, new={})", combined.size(), historical.size(), newSamples.size());
            long t0 = System.nanoTime();

            return Mono.fromCallable(() -> trainer.fit(combined))
                    .subscribeOn(scheduler)
                    .timeout(timeout)
                    .map(fit -> judge(fit, combined.size(), elapsed(t0)))
                    .onErrorResume(e -> Mono.just(failure(e, elapsed(t0))));
        });
    }

    private TrainingOutcome judge(FitResult fit, int rows, Duration took) {
        if (fit == null || fit.model() == null || fit.metrics() == null || !fit.model().isFinite()) {
            log.warn("Training returned degenerate output after {} ms", took.toMillis());
            return new TrainingOutcome.Failure(TrainingOutcome.Cause.DEGENERATE_OUTPUT,
                    "fit returned no model, no metrics or non-finite coefficients", took);
        }
        log.info("Training finished in {} ms: rmse={}, r2={}", took.toMillis(),
                fit.metrics().rmse(), fit.metrics().r2());
        return new TrainingOutcome.Candidate(fit.model(), fit.metrics(), clock.instant(), took, rows);
    }

    private TrainingOutcome failure(Throwable e, Duration took) {
        if (e instanceof TimeoutException) {
            log.warn("Training exceeded timeout of {}", timeout);
            return new TrainingOutcome.Failure(TrainingOutcome.Cause.TIMEOUT,
                    "training exceeded " + timeout, took);
        }
        log.warn("Training failed after {} ms: {}", took.toMillis(), e.toString());
        return new TrainingOutcome.Failure(TrainingOutcome.Cause.FIT_ERROR, e.toString(), took);
    }

    private static Duration elapsed(long t0) {
        return Duration.ofNanos(System.nanoTime() - t0);
    }
}
