package kds.domain.relay.dto;

/**
 * @since 09/10/2026
 */
public record RegisterRequest(String restaurantId, String deviceName, String timestamp) {
}
