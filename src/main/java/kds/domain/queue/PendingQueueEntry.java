package kds.domain.queue;

import kds.domain.model.DispatchJob;
import kds.domain.transport.ETransmissionFailure;

/**
 * A failed dispatch job waiting for replay, with its retry bookkeeping
 *
 * @param job the job as last attempted, its {@code attempt} is always {@code retryCount + 1}
 * @param retryCount replays attempted from the queue so far (the original send is not counted)
 * @param nextAttemptAt epoch millis before which the drain skips this entry
 * @since 07/10/2026
 */
public record PendingQueueEntry(DispatchJob job, long firstFailedAt, int retryCount, long nextAttemptAt,
                                ETransmissionFailure lastFailure, String lastError, boolean deadLettered) {

    public String jobId() {
        return job.jobId();
    }

    public boolean isDue(long now) {
        return !deadLettered && nextAttemptAt <= now;
    }

    PendingQueueEntry afterFailedRetry(ETransmissionFailure failure, String error, long nextAttempt) {
        return new PendingQueueEntry(job.withAttempt(job.attempt() + 1), firstFailedAt, retryCount + 1, nextAttempt,
                failure, error, false);
    }

    PendingQueueEntry asDeadLetter() {
        return new PendingQueueEntry(job, firstFailedAt, retryCount, nextAttemptAt, lastFailure, lastError, true);
    }

    PendingQueueEntry requeued(long now) {
        return new PendingQueueEntry(job.withAttempt(1), firstFailedAt, 0, now, lastFailure, lastError, false);
    }
}
