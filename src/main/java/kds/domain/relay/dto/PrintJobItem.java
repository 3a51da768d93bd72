package kds.domain.relay.dto;

/**
 * @since 09/10/2026
 */
public record PrintJobItem(String id, String name, int quantity, String variant, String instructions, String notes) {
}
