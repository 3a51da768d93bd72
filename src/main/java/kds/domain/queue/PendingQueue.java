package kds.domain.queue;

import kds.dal.RetryConfig;
import kds.domain.model.DispatchJob;
import kds.domain.transport.ETransmissionFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Holding area for dispatch jobs whose delivery failed.
 *
 * <p>Entries carry the full job (items and rendered ticket) so a replay never needs the order again. Each failed
 * replay pushes the next attempt out according to the {@link RetryPolicy}; after {@code maxAttempts} failed
 * replays the entry becomes a dead letter and waits for an operator. All methods are synchronized.</p>
 *
 * @since 07/10/2026
 */
@Singleton
public class PendingQueue {
    private static final Logger logger = LoggerFactory.getLogger(PendingQueue.class);

    private final RetryPolicy retryPolicy;
    private final int maxAttempts;
    private final PendingQueueJournal journal;

    private final Map<String, PendingQueueEntry> pending = new LinkedHashMap<>();
    private final Map<String, PendingQueueEntry> deadLetters = new LinkedHashMap<>();

    @Inject
    public PendingQueue(RetryPolicy retryPolicy, RetryConfig config, PendingQueueJournal journal) {
        this.retryPolicy = retryPolicy;
        this.maxAttempts = config.maxAttempts();
        this.journal = journal;
    }

    /**
     * Queue a job after a delivery attempt failed.
     *
     * <p>Attempts already made are taken from {@link DispatchJob#attempt()}: a first send counts none, a replay that
     * failed after leaving the queue keeps its count, and a job that already used {@code maxAttempts} replays goes
     * straight to dead letters.</p>
     */
    public synchronized PendingQueueEntry enqueue(DispatchJob job, ETransmissionFailure failure, String error) {
        long now = System.currentTimeMillis();
        int retries = Math.max(0, job.attempt() - 1);
        long nextAttempt = now + retryPolicy.computeDelayMs(retries + 1);
        PendingQueueEntry entry = new PendingQueueEntry(job, now, retries, nextAttempt, failure, error, false);

        if (retries >= maxAttempts) {
            PendingQueueEntry dead = entry.asDeadLetter();
            pending.remove(job.jobId());
            deadLetters.put(job.jobId(), dead);
            persist();
            logger.error("Job {} (order {}, printer {}) failed again after {} retries, moved to dead letters: {}",
                    job.jobId(), job.order().orderNumber(), job.targetId(), retries, error);
            return dead;
        }

        pending.put(job.jobId(), entry);
        persist();

        logger.warn("Queued job {} (order {}, printer {}) for retry {}: {} - {}",
                job.jobId(), job.order().orderNumber(), job.targetId(), retries + 1, failure, error);
        return entry;
    }

    /**
     * @param force ignore the backoff schedule and return every pending entry
     */
    public synchronized List<PendingQueueEntry> dueEntries(long now, boolean force) {
        return pending.values().stream()
                .filter(entry -> force || entry.isDue(now))
                .collect(Collectors.toList());
    }

    /**
     * Replay delivered, the entry leaves the queue
     */
    public synchronized boolean markSucceeded(String jobId) {
        PendingQueueEntry removed = pending.remove(jobId);
        if (removed == null) {
            return false;
        }
        persist();
        logger.info("Job {} delivered on retry {}, removed from queue", jobId, removed.retryCount() + 1);
        return true;
    }

    /**
     * Replay failed: schedule the next attempt or move the entry to dead letters
     * @return updated entry, empty when the job was no longer queued
     */
    public synchronized Optional<PendingQueueEntry> markFailed(String jobId, ETransmissionFailure failure, String error) {
        PendingQueueEntry entry = pending.get(jobId);
        if (entry == null) {
            return Optional.empty();
        }

        long now = System.currentTimeMillis();
        int attempts = entry.retryCount() + 1;
        PendingQueueEntry updated = entry.afterFailedRetry(failure, error, now + retryPolicy.computeDelayMs(attempts + 1));

        if (updated.retryCount() >= maxAttempts) {
            PendingQueueEntry dead = updated.asDeadLetter();
            pending.remove(jobId);
            deadLetters.put(jobId, dead);
            logger.error("Job {} (order {}, printer {}) gave up after {} retries, moved to dead letters: {}",
                    jobId, dead.job().order().orderNumber(), dead.job().targetId(), dead.retryCount(), error);
            persist();
            return Optional.of(dead);
        }

        pending.put(jobId, updated);
        persist();
        logger.warn("Retry {} of job {} failed ({}), next attempt in {}ms",
                updated.retryCount(), jobId, failure, updated.nextAttemptAt() - now);
        return Optional.of(updated);
    }

    public synchronized boolean requeueDeadLetter(String jobId) {
        PendingQueueEntry dead = deadLetters.remove(jobId);
        if (dead == null) {
            return false;
        }
        pending.put(jobId, dead.requeued(System.currentTimeMillis()));
        persist();
        logger.info("Dead letter {} requeued by operator", jobId);
        return true;
    }

    public synchronized boolean discardDeadLetter(String jobId) {
        PendingQueueEntry dead = deadLetters.remove(jobId);
        if (dead == null) {
            return false;
        }
        persist();
        logger.info("Dead letter {} (order {}, printer {}) discarded by operator",
                jobId, dead.job().order().orderNumber(), dead.job().targetId());
        return true;
    }

    public synchronized Optional<PendingQueueEntry> find(String jobId) {
        PendingQueueEntry entry = pending.get(jobId);
        return Optional.ofNullable(entry != null ? entry : deadLetters.get(jobId));
    }

    public synchronized List<PendingQueueEntry> listPending() {
        return new ArrayList<>(pending.values());
    }

    public synchronized List<PendingQueueEntry> listDeadLetters() {
        return new ArrayList<>(deadLetters.values());
    }

    public synchronized int size() {
        return pending.size();
    }

    public synchronized int deadLetterCount() {
        return deadLetters.size();
    }

    /**
     * Reload entries saved by a previous run
     * @return number of entries restored (pending + dead letters)
     */
    public synchronized int restore() {
        PendingQueueJournal.Snapshot snapshot = journal.load();
        for (PendingQueueEntry entry : snapshot.pending()) {
            pending.put(entry.jobId(), entry);
        }
        for (PendingQueueEntry entry : snapshot.deadLetters()) {
            deadLetters.put(entry.jobId(), entry);
        }
        int restored = snapshot.pending().size() + snapshot.deadLetters().size();
        if (restored > 0) {
            logger.info("Restored {} pending jobs and {} dead letters from journal",
                    snapshot.pending().size(), snapshot.deadLetters().size());
        }
        return restored;
    }

    /**
     * Write the current state to the journal (also used on shutdown)
     */
    public synchronized void persist() {
        journal.save(new ArrayList<>(pending.values()), new ArrayList<>(deadLetters.values()));
    }
}
