package kds.domain.model;

/**
 * Frozen copy of an order item carried inside a dispatch job
 * @since 05/10/2026
 */
public record JobItem(String id, String menuItemId, String name, int quantity, String variant,
                      String specialInstructions, String notes) {

    public static JobItem from(OrderItem item) {
        return new JobItem(item.getId(), item.getMenuItemId(), item.getMenuItemName(), item.getQuantity(),
                item.getVariant(), item.getSpecialInstructions(), item.getNotes());
    }
}
