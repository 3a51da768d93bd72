package kds.domain.queue;

/**
 * Delay before the next replay of a failed dispatch job
 * @since 07/10/2026
 */
public interface RetryPolicy {

    /**
     * @param attempts number of attempts so far (1-based)
     * @return delay in milliseconds, never negative
     */
    long computeDelayMs(int attempts);
}
