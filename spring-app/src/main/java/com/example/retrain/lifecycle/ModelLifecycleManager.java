package com.example.retrain.lifecycle;

import com.example.retrain.ml.TrainingOutcome;
import com.example.retrain.store.StorageCorruptedException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the "current" model pointer and the backup set.
 *
 * <h2>Promotion</h2>
 * <ol>
 *   <li>Write the candidate as a new immutable version (atomic rename into the version arena).</li>
 *   <li>Secure the prior current artifact as a backup.</li>
 *   <li>Swap the on-disk pointer, then publish the in-memory reference.</li>
 *   <li>Run the {@link HealthCheck}; on failure revert the pointer and discard the candidate.</li>
 *   <li>Prune backups beyond {@code retention}, oldest first.</li>
 * </ol>
 * A storage failure before the pointer swap leaves the prior artifact serving untouched.
 *
 * <h2>Threading</h2>
 * Prediction paths read {@link #current()} lock-free through an {@link AtomicReference};
 * promotion and rollback are serialized on this instance.
 */
@Slf4j
public class ModelLifecycleManager {

    private final ArtifactStore store;
    private final HealthCheck healthCheck;
    private final int retention;

    private final AtomicReference<ModelArtifact> current = new AtomicReference<>();
    private final List<Long> served = new ArrayList<>();
    private long lastIssued;

    public ModelLifecycleManager(ArtifactStore store, HealthCheck healthCheck, int retention) {
        this.store = store;
        this.healthCheck = healthCheck;
        this.retention = Math.max(0, retention);
        load();
    }

    private synchronized void load() {
        try {
            ArtifactHistory h = store.readHistory();
            served.addAll(h.served());
            lastIssued = h.lastIssuedVersion();
            for (long v : store.listVersions()) lastIssued = Math.max(lastIssued, v);

            OptionalLong ptr = store.readPointer();
            if (ptr.isPresent()) {
                long v = ptr.getAsLong();
                ModelArtifact a = store.read(v).orElseThrow(() ->
                        new StorageCorruptedException("Model pointer references missing version " + v, null));
                current.set(a);
                if (served.isEmpty() || served.get(served.size() - 1) != v) {
                    served.remove(Long.valueOf(v));
                    served.add(v);
                }
                log.info("Serving model v{} (trained {}), backups={}", v, a.trainedAt(), backupVersions());
            } else {
                log.info("No current model artifact; waiting for the first promotion.");
            }
        } catch (IOException e) {
            throw new StorageCorruptedException("Cannot load model lifecycle state", e);
        }
    }

    public Optional<ModelArtifact> current() {
        return Optional.ofNullable(current.get());
    }

    /** Retained prior current versions, oldest first. */
    public synchronized List<Long> backupVersions() {
        return served.isEmpty() ? List.of() : List.copyOf(served.subList(0, served.size() - 1));
    }

    public synchronized PromotionResult promote(TrainingOutcome.Candidate candidate) {
        ModelArtifact prior = current.get();
        Long priorVersion = prior == null ? null : prior.version();
        long version = lastIssued + 1;

        ModelArtifact stored;
        try {
            stored = store.write(new ModelArtifact(version, candidate.trainedAt(), candidate.metrics(), null, candidate.model()));
        } catch (IOException e) {
            log.warn("Promotion of v{} aborted: writing artifact failed: {}", version, e.toString());
            return PromotionResult.failed(PromotionResult.Failure.STORAGE, priorVersion, "writing artifact failed: " + e);
        }
        lastIssued = version;

        if (prior != null) {
            try {
                secureBackup(prior);
            } catch (IOException e) {
                log.warn("Promotion of v{} aborted: backup of v{} failed: {}", version, priorVersion, e.toString());
                discard(version);
                persistHistory();
                return PromotionResult.failed(PromotionResult.Failure.BACKUP, priorVersion, "backup failed: " + e);
            }
        }

        try {
            store.swapPointer(version);
        } catch (IOException e) {
            log.warn("Promotion of v{} aborted: pointer swap failed: {}", version, e.toString());
            discard(version);
            persistHistory();
            return PromotionResult.failed(PromotionResult.Failure.POINTER_SWAP, priorVersion, "pointer swap failed: " + e);
        }
        current.set(stored);

        HealthReport report = runHealthCheck(stored);
        if (!report.healthy()) {
            log.warn("Post-promotion check failed for v{}: {}; reverting to v{}", version, report.detail(), priorVersion);
            String revert = revertTo(prior);
            discard(version);
            persistHistory();
            return PromotionResult.failed(PromotionResult.Failure.HEALTH_CHECK, priorVersion, report.detail() + revert);
        }

        served.add(version);
        prune();
        persistHistory();
        log.info("Promoted model v{} (previous v{}), rmse={}, {}", version, priorVersion,
                stored.metrics().rmse(), report.detail());
        return PromotionResult.promoted(version, priorVersion, report.detail());
    }

    /** Restore the previous current artifact and discard the one serving now. */
    public synchronized RollbackResult rollback() {
        if (served.size() < 2) {
            return new RollbackResult(false, versionOrNull(), null, "no backup to roll back to");
        }
        long from = served.get(served.size() - 1);
        long to = served.get(served.size() - 2);
        try {
            ModelArtifact target = store.read(to)
                    .orElseThrow(() -> new IOException("backup v" + to + " is missing"));
            store.swapPointer(to);
            current.set(target);
        } catch (IOException e) {
            log.warn("Rollback from v{} to v{} failed: {}", from, to, e.toString());
            return new RollbackResult(false, from, to, "rollback failed: " + e);
        }
        served.remove(served.size() - 1);
        discard(from);
        persistHistory();
        log.info("Rolled back model v{} -> v{}", from, to);
        return new RollbackResult(true, from, to, "restored v" + to);
    }

    private void secureBackup(ModelArtifact prior) throws IOException {
        if (store.read(prior.version()).isEmpty()) {
            store.write(prior);
        }
    }

    private HealthReport runHealthCheck(ModelArtifact a) {
        try {
            return healthCheck.check(a);
        } catch (RuntimeException e) {
            return HealthReport.failed("health check threw " + e);
        }
    }

    /** @return suffix for the failure detail, empty when the revert succeeded */
    private String revertTo(ModelArtifact prior) {
        try {
            if (prior != null) store.swapPointer(prior.version());
            else store.clearPointer();
            return "";
        } catch (IOException e) {
            log.error("Pointer revert failed; stored pointer still names the rejected version while v{} serves: {}",
                    prior == null ? null : prior.version(), e.toString());
            return "; pointer revert failed: " + e;
        } finally {
            current.set(prior);
        }
    }

    private void prune() {
        while (served.size() > retention + 1) {
            long old = served.remove(0);
            discard(old);
            log.info("Pruned backup model v{}", old);
        }
    }

    private void discard(long version) {
        try {
            store.delete(version);
        } catch (IOException e) {
            log.warn("Could not delete model v{}: {}", version, e.toString());
        }
    }

    private void persistHistory() {
        try {
            store.writeHistory(new ArtifactHistory(served, lastIssued));
        } catch (IOException e) {
            log.error("Could not persist model history (current pointer is unaffected): {}", e.toString());
        }
    }

    private Long versionOrNull() {
        ModelArtifact a = current.get();
        return a == null ? null : a.version();
    }
}
