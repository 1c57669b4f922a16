package com.example.retrain.store;

import com.example.retrain.dto.SampleRequest;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable, append-only collection of accepted labeled samples.
 *
 * <h2>Pending samples</h2>
 * Every accepted sample gets the next sequence number. A separate consumption log
 * holds the watermark of the last <em>successful</em> training run; samples above
 * it are pending. Failed attempts never move the watermark, so their samples stay
 * pending. Consumed samples remain in the samples log for audit and become
 * historical training data.
 *
 * <h2>Threading</h2>
 * Appends, watermark commits and {@link #pendingCount()} are serialized by one lock
 * per store instance. Validation runs outside the lock.
 */
@Slf4j
public class SampleStore {

    private final AppendOnlyLog<TrainingSample> samples;
    private final AppendOnlyLog<ConsumptionMark> consumption;
    private final SampleValidator validator;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private long lastSeq;
    private long consumedThrough;

    public SampleStore(AppendOnlyLog<TrainingSample> samples,
                       AppendOnlyLog<ConsumptionMark> consumption,
                       SampleValidator validator,
                       Clock clock) {
        this.samples = samples;
        this.consumption = consumption;
        this.validator = validator;
        this.clock = clock;
        recover();
    }

    private void recover() {
        for (TrainingSample s : samples.readAll()) lastSeq = Math.max(lastSeq, s.seq());
        for (ConsumptionMark m : consumption.readAll()) consumedThrough = Math.max(consumedThrough, m.throughSeq());
        log.info("Sample store recovered: samples={}, consumedThrough={}, pending={}",
                lastSeq, consumedThrough, lastSeq - consumedThrough);
    }

    /** Validate and durably append one sample. Rejections leave the store untouched. */
    public SubmitResult submit(SampleRequest request) {
        List<String> violations = validator.violations(request.features(), request.label());
        if (!violations.isEmpty()) {
            log.warn("Rejected training sample: {}", violations);
            return SubmitResult.rejected(violations);
        }
        lock.lock();
        try {
            return SubmitResult.accepted(appendLocked(request));
        } finally {
            lock.unlock();
        }
    }

    /** Partial-failure tolerant: each item is judged on its own, valid items are stored. */
    public BatchResult submitBatch(List<SampleRequest> requests) {
        List<List<String>> checks = new ArrayList<>(requests.size());
        for (SampleRequest r : requests) {
            checks.add(r == null ? List.of("sample: required") : validator.violations(r.features(), r.label()));
        }
        List<SubmitResult> results = new ArrayList<>(requests.size());
        lock.lock();
        try {
            for (int i = 0; i < requests.size(); i++) {
                List<String> v = checks.get(i);
                results.add(v.isEmpty()
                        ? SubmitResult.accepted(appendLocked(requests.get(i)))
                        : SubmitResult.rejected(v));
            }
            BatchResult out = new BatchResult(results, lastSeq - consumedThrough);
            log.info("Batch submission: accepted={}, failed={}, pending={}",
                    out.acceptedCount(), out.failedCount(), out.pendingAfter());
            return out;
        } finally {
            lock.unlock();
        }
    }

    private TrainingSample appendLocked(SampleRequest r) {
        TrainingSample s = new TrainingSample(lastSeq + 1, r.features(), r.label(), clock.instant());
        samples.append(s);
        lastSeq = s.seq();
        return s;
    }

    /** Samples accumulated since the last successful training consumption. */
    public long pendingCount() {
        lock.lock();
        try {
            return lastSeq - consumedThrough;
        } finally {
            lock.unlock();
        }
    }

    /** Snapshot of the pending samples. Does not consume them. */
    public PendingSnapshot drainForTraining() {
        lock.lock();
        try {
            long from = consumedThrough;
            long through = lastSeq;
            List<TrainingSample> pending = samples.readAll().stream()
                    .filter(s -> s.seq() > from && s.seq() <= through)
                    .toList();
            return new PendingSnapshot(pending, through);
        } finally {
            lock.unlock();
        }
    }

    /** Samples consumed by earlier successful runs. */
    public List<TrainingSample> historicalSamples() {
        long through;
        lock.lock();
        try {
            through = consumedThrough;
        } finally {
            lock.unlock();
        }
        return samples.readAll().stream().filter(s -> s.seq() <= through).toList();
    }

    /** Commit the watermark of a successful attempt. Samples accepted after the snapshot stay pending. */
    public void markConsumed(PendingSnapshot snapshot, String attemptId) {
        lock.lock();
        try {
            if (snapshot.throughSeq() <= consumedThrough) return;
            consumption.append(new ConsumptionMark(snapshot.throughSeq(), clock.instant(), attemptId));
            consumedThrough = snapshot.throughSeq();
            log.info("Consumed samples through seq={} (attempt {}); pending={}",
                    consumedThrough, attemptId, lastSeq - consumedThrough);
        } finally {
            lock.unlock();
        }
    }
}
