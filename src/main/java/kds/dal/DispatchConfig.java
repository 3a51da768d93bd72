package kds.dal;

import kds.common.DispatchConstants;

/**
 * Timing and pool settings of the dispatch pipeline
 *
 * @param transmitTimeoutMs hard limit for one delivery attempt to one printer
 * @param interTargetDelayMs pause between consecutive printers of one dispatch
 * @param connectTimeoutMs TCP connect timeout, also used by reachability checks
 * @param workerThreads size of the transmission worker pool
 * @param simulatedDelayMs print time of simulated printers
 * @since 03/10/2026
 */
public record DispatchConfig(int transmitTimeoutMs, int interTargetDelayMs, int connectTimeoutMs,
                             int workerThreads, int simulatedDelayMs) {

    public static DispatchConfig defaults() {
        return new DispatchConfig(
                DispatchConstants.DEFAULT_TRANSMIT_TIMEOUT,
                DispatchConstants.DEFAULT_INTER_TARGET_DELAY_MS,
                DispatchConstants.DEFAULT_CONNECT_TIMEOUT,
                DispatchConstants.DEFAULT_WORKER_THREADS,
                DispatchConstants.DEFAULT_SIMULATED_DELAY_MS);
    }

    public void validate() throws ConfigurationException {
        if (transmitTimeoutMs < 1) {
            throw new ConfigurationException("Transmit timeout must be positive");
        }
        if (interTargetDelayMs < 0) {
            throw new ConfigurationException("Inter-target delay cannot be negative");
        }
        if (connectTimeoutMs < 1) {
            throw new ConfigurationException("Connect timeout must be positive");
        }
        if (connectTimeoutMs > transmitTimeoutMs) {
            throw new ConfigurationException("Connect timeout cannot exceed transmit timeout");
        }
        if (workerThreads < 1) {
            throw new ConfigurationException("Dispatch needs at least one worker thread");
        }
        if (simulatedDelayMs < 0) {
            throw new ConfigurationException("Simulated print delay cannot be negative");
        }
    }
}
