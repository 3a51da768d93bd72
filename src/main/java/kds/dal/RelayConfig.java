package kds.dal;

import kds.common.DispatchConstants;

/**
 * Cloud relay settings
 * <p>Broker endpoints are resolved against {@code baseUrl}. Intervals are in milliseconds.</p>
 * @since 06/10/2026
 */
public record RelayConfig(
        boolean enabled,
        String baseUrl,
        String apiToken,
        String restaurantId,
        String deviceName,
        int requestTimeoutMs,
        int heartbeatIntervalMs,
        int heartbeatTimeoutMs,
        int statusPollIntervalMs,
        int maxHeartbeatRetries,
        int reconnectStepMs,
        int maxReconnectDelayMs,
        int maxReconnectAttempts,
        boolean agentEnabled,
        String agentPrinterId,
        int agentPollIntervalMs) {

    /**
     * Factory method: relay switched off, CLOUD targets are never reachable
     */
    public static RelayConfig disabled() {
        return new RelayConfig(false, null, null, null, null,
                DispatchConstants.DEFAULT_RELAY_REQUEST_TIMEOUT,
                DispatchConstants.DEFAULT_HEARTBEAT_INTERVAL,
                DispatchConstants.DEFAULT_HEARTBEAT_TIMEOUT,
                DispatchConstants.DEFAULT_STATUS_POLL_INTERVAL,
                DispatchConstants.DEFAULT_MAX_HEARTBEAT_RETRIES,
                DispatchConstants.DEFAULT_RECONNECT_STEP,
                DispatchConstants.DEFAULT_MAX_RECONNECT_DELAY,
                DispatchConstants.DEFAULT_MAX_RECONNECT_ATTEMPTS,
                false, null,
                DispatchConstants.DEFAULT_AGENT_POLL_INTERVAL);
    }

    @Override
    public String toString() {
        if (!enabled) {
            return "RelayConfiguration{enabled=false}";
        }
        // token intentionally left out
        return String.format("RelayConfiguration{url='%s', restaurant='%s', device='%s', agent=%s}",
                baseUrl, restaurantId, deviceName, agentEnabled ? agentPrinterId : "off");
    }

    public void validate() throws ConfigurationException {
        if (!enabled) {
            return;
        }
        if (baseUrl == null || !(baseUrl.startsWith("http://") || baseUrl.startsWith("https://"))) {
            throw new ConfigurationException("Relay base URL must start with http:// or https://");
        }
        if (restaurantId == null || restaurantId.trim().isEmpty()) {
            throw new ConfigurationException("Relay restaurant id cannot be empty");
        }
        if (requestTimeoutMs < 1 || heartbeatTimeoutMs < 1) {
            throw new ConfigurationException("Relay timeouts must be positive");
        }
        if (heartbeatIntervalMs < 1 || statusPollIntervalMs < 1 || agentPollIntervalMs < 1) {
            throw new ConfigurationException("Relay intervals must be positive");
        }
        if (maxHeartbeatRetries < 1 || maxReconnectAttempts < 1) {
            throw new ConfigurationException("Relay retry caps must be at least 1");
        }
        if (reconnectStepMs < 1 || maxReconnectDelayMs < reconnectStepMs) {
            throw new ConfigurationException("Relay reconnect delay must be positive and max >= step");
        }
        if (agentEnabled && (agentPrinterId == null || agentPrinterId.trim().isEmpty())) {
            throw new ConfigurationException("Relay agent is enabled but relay.agent.printer.id is empty");
        }
    }
}
