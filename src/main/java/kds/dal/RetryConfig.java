package kds.dal;

import kds.common.DispatchConstants;

/**
 * Retry queue settings: drain schedule, exponential backoff and journal location
 * @since 04/10/2026
 */
public record RetryConfig(long drainIntervalMs, long baseDelayMs, long maxDelayMs, int maxAttempts,
                          boolean jitter, boolean journalEnabled, String journalPath) {

    public static RetryConfig defaults() {
        return new RetryConfig(
                DispatchConstants.DEFAULT_DRAIN_INTERVAL,
                DispatchConstants.DEFAULT_BACKOFF_BASE,
                DispatchConstants.DEFAULT_BACKOFF_MAX,
                DispatchConstants.DEFAULT_MAX_ATTEMPTS,
                true,
                false,
                null);
    }

    public void validate() throws ConfigurationException {
        if (drainIntervalMs < 1000) {
            throw new ConfigurationException("Retry drain interval must be at least 1000ms");
        }
        if (baseDelayMs < 0) {
            throw new ConfigurationException("Retry base delay cannot be negative");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new ConfigurationException("Retry max delay must be >= base delay");
        }
        if (maxAttempts < 1) {
            throw new ConfigurationException("Retry max attempts must be at least 1");
        }
        if (journalEnabled && (journalPath == null || journalPath.trim().isEmpty())) {
            throw new ConfigurationException("Retry journal is enabled but retry.journal.path is empty");
        }
    }
}
