package com.example.retrain.ledger;

import com.example.retrain.store.AppendOnlyLog;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;

/**
 * Ordered log of every retrain attempt; the source of truth for rate limiting and status.
 */
@Slf4j
public class AttemptLedger {

    private final AppendOnlyLog<RetrainAttempt> entries;

    public AttemptLedger(AppendOnlyLog<RetrainAttempt> entries) {
        this.entries = entries;
    }

    public void record(RetrainAttempt attempt) {
        entries.append(attempt);
        log.info("Ledger: attempt={} reason={} outcome={} detail={}",
                attempt.id(), attempt.reason(), attempt.outcome(), attempt.detail());
    }

    /** Start times of executed attempts started at or after {@code since}. */
    public List<Instant> executedStartsSince(Instant since) {
        return entries.readSince(since).stream()
                .filter(a -> a.outcome().executed())
                .map(RetrainAttempt::startedAt)
                .toList();
    }

    /** The newest {@code n} entries, oldest first. */
    public List<RetrainAttempt> recent(int n) {
        List<RetrainAttempt> all = entries.readAll();
        return List.copyOf(all.subList(Math.max(0, all.size() - n), all.size()));
    }

    public List<RetrainAttempt> all() {
        return entries.readAll();
    }
}
