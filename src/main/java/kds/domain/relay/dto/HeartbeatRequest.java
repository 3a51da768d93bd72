package kds.domain.relay.dto;

/**
 * @since 09/10/2026
 */
public record HeartbeatRequest(String timestamp, String status, int pendingOrders, int failedOrders) {
}
