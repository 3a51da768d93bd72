package kds.domain.relay.dto;

/**
 * @since 09/10/2026
 */
public record RegisterResponse(String sessionId) {
}
