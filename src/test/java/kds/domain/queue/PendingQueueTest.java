package kds.domain.queue;

import kds.dal.RetryConfig;
import kds.domain.model.DispatchJob;
import kds.domain.transport.ETransmissionFailure;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static kds.domain.queue.QueueFixtures.job;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for PendingQueue
 * @since 14/10/2026
 */
class PendingQueueTest {

    private static final RetryConfig CONFIG = new RetryConfig(1000, 0, 0, 3, false, false, null);

    private final PendingQueue queue = new PendingQueue(attempts -> 60_000L, CONFIG, PendingQueueJournal.disabled());

    @Test
    @DisplayName("Enqueued job should wait for its backoff unless forced")
    void enqueuedJobShouldHonourBackoff() {
        // Given
        DispatchJob job = job("o-1", "bar");

        // When
        PendingQueueEntry entry = queue.enqueue(job, ETransmissionFailure.NETWORK_ERROR, "Connection refused");

        // Then
        long now = System.currentTimeMillis();
        assertThat(entry.retryCount()).isZero();
        assertThat(entry.nextAttemptAt()).isGreaterThan(now);
        assertThat(queue.dueEntries(now, false)).isEmpty();
        assertThat(queue.dueEntries(now, true)).containsExactly(entry);
        assertThat(queue.dueEntries(now + 60_000, false)).hasSize(1);
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Re-queued replay should keep the retries it already used")
    void enqueueShouldCarryAttempts() {
        // Given
        DispatchJob replayed = job("o-1", "bar").withAttempt(3);
        DispatchJob exhausted = job("o-2", "bar").withAttempt(4);

        // When
        PendingQueueEntry kept = queue.enqueue(replayed, ETransmissionFailure.NON_SUCCESS_STATUS, "paper out");
        PendingQueueEntry dead = queue.enqueue(exhausted, ETransmissionFailure.NON_SUCCESS_STATUS, "paper out");

        // Then
        assertThat(kept.retryCount()).isEqualTo(2);
        assertThat(kept.deadLettered()).isFalse();
        assertThat(dead.retryCount()).isEqualTo(3);
        assertThat(dead.deadLettered()).isTrue();
        assertThat(queue.listPending()).containsExactly(kept);
        assertThat(queue.listDeadLetters()).containsExactly(dead);
    }

    @Test
    @DisplayName("Successful replay should remove the entry")
    void successShouldRemoveEntry() {
        // Given
        DispatchJob job = job("o-1", "bar");
        queue.enqueue(job, ETransmissionFailure.TIMEOUT, "Print timeout after 15000ms");

        // When
        boolean removed = queue.markSucceeded(job.jobId());

        // Then
        assertThat(removed).isTrue();
        assertThat(queue.size()).isZero();
        assertThat(queue.markSucceeded(job.jobId())).isFalse();
    }

    @Test
    @DisplayName("Failed replays should count attempts and dead-letter at the cap")
    void failedReplaysShouldDeadLetterAtCap() {
        // Given
        DispatchJob job = job("o-1", "bar");
        queue.enqueue(job, ETransmissionFailure.NETWORK_ERROR, "refused");

        // When
        Optional<PendingQueueEntry> first = queue.markFailed(job.jobId(), ETransmissionFailure.NETWORK_ERROR, "refused");
        queue.markFailed(job.jobId(), ETransmissionFailure.NETWORK_ERROR, "refused");
        Optional<PendingQueueEntry> third = queue.markFailed(job.jobId(), ETransmissionFailure.TIMEOUT, "timeout");

        // Then
        assertThat(first).get().satisfies(e -> {
            assertThat(e.retryCount()).isEqualTo(1);
            assertThat(e.deadLettered()).isFalse();
            assertThat(e.job().attempt()).isEqualTo(2);
        });
        assertThat(third).get().satisfies(e -> {
            assertThat(e.retryCount()).isEqualTo(3);
            assertThat(e.deadLettered()).isTrue();
            assertThat(e.lastFailure()).isEqualTo(ETransmissionFailure.TIMEOUT);
        });
        assertThat(queue.size()).isZero();
        assertThat(queue.deadLetterCount()).isEqualTo(1);
        assertThat(queue.dueEntries(Long.MAX_VALUE, true)).isEmpty();
        assertThat(queue.markFailed(job.jobId(), ETransmissionFailure.TIMEOUT, "late")).isEmpty();
    }

    @Test
    @DisplayName("Operator should be able to requeue or discard dead letters")
    void shouldRequeueAndDiscardDeadLetters() {
        // Given
        DispatchJob kept = job("o-1", "bar");
        DispatchJob dropped = job("o-2", "bar");
        for (DispatchJob job : List.of(kept, dropped)) {
            queue.enqueue(job, ETransmissionFailure.NETWORK_ERROR, "refused");
            for (int i = 0; i < 3; i++) {
                queue.markFailed(job.jobId(), ETransmissionFailure.NETWORK_ERROR, "refused");
            }
        }

        // When
        boolean requeued = queue.requeueDeadLetter(kept.jobId());
        boolean discarded = queue.discardDeadLetter(dropped.jobId());

        // Then
        assertThat(requeued).isTrue();
        assertThat(discarded).isTrue();
        assertThat(queue.deadLetterCount()).isZero();
        assertThat(queue.listPending()).singleElement().satisfies(e -> {
            assertThat(e.jobId()).isEqualTo(kept.jobId());
            assertThat(e.retryCount()).isZero();
            assertThat(e.job().attempt()).isEqualTo(1);
            assertThat(e.isDue(System.currentTimeMillis())).isTrue();
        });
        assertThat(queue.find(dropped.jobId())).isEmpty();
        assertThat(queue.requeueDeadLetter("unknown")).isFalse();
        assertThat(queue.discardDeadLetter("unknown")).isFalse();
    }
}
