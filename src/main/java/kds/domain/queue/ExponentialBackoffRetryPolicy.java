package kds.domain.queue;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: {@code base * 2^(attempt-1)} capped at {@code max}, optionally spread by a random
 * factor in [0.5, 1.5) so printers coming back online are not hit by every queued job at once.
 * @since 07/10/2026
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final boolean jitter;

    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, boolean jitter) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitter = jitter;
    }

    @Override
    public long computeDelayMs(int attempts) {
        if (attempts <= 0 || baseDelayMs == 0) {
            return 0L;
        }

        long exponential;
        if (attempts >= 31) {
            exponential = Long.MAX_VALUE;
        } else {
            long factor = 1L << (attempts - 1);
            // overflow guard
            exponential = factor > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * factor;
        }
        long capped = Math.min(maxDelayMs, exponential);
        if (!jitter) {
            return capped;
        }

        double spread = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        return Math.min(maxDelayMs, Math.max(0L, (long) (capped * spread)));
    }
}
