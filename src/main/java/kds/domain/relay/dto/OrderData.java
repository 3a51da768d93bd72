package kds.domain.relay.dto;

/**
 * Order header fields the relay agent needs to rebuild a ticket
 * @since 09/10/2026
 */
public record OrderData(String tableId, String customerName, String userId, String orderTime, boolean isUrgent,
                        int priority) {
}
