package kds.domain.relay.dto;

/**
 * @since 09/10/2026
 */
public record FailedOrder(String orderId, String printerId, String error) {
}
