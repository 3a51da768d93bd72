package kds.domain.model;

/**
 * One order line as seen by the kitchen.
 * <p>{@code sentToKitchen} only ever moves from false to true here; resetting it is an administrative action
 * outside this service.</p>
 * @since 03/10/2026
 */
public class OrderItem {
    private final String id;
    private final String menuItemId;
    private final String menuItemName;
    private final String categoryId;
    private final int quantity;
    private final String variant;
    private final String specialInstructions;
    private final String notes;
    private volatile boolean sentToKitchen;

    public OrderItem(String id, String menuItemId, String menuItemName, String categoryId, int quantity,
                     String variant, String specialInstructions, String notes, boolean sentToKitchen) {
        this.id = id;
        this.menuItemId = menuItemId;
        this.menuItemName = menuItemName;
        this.categoryId = categoryId;
        this.quantity = quantity;
        this.variant = variant;
        this.specialInstructions = specialInstructions;
        this.notes = notes;
        this.sentToKitchen = sentToKitchen;
    }

    public static OrderItem of(String id, String menuItemId, String menuItemName, String categoryId, int quantity) {
        return new OrderItem(id, menuItemId, menuItemName, categoryId, quantity, null, null, null, false);
    }

    public String getId() {
        return id;
    }

    public String getMenuItemId() {
        return menuItemId;
    }

    public String getMenuItemName() {
        return menuItemName;
    }

    public String getCategoryId() {
        return categoryId;
    }

    public int getQuantity() {
        return quantity;
    }

    public String getVariant() {
        return variant;
    }

    public String getSpecialInstructions() {
        return specialInstructions;
    }

    public String getNotes() {
        return notes;
    }

    public boolean isSentToKitchen() {
        return sentToKitchen;
    }

    public void markSentToKitchen() {
        this.sentToKitchen = true;
    }

    @Override
    public String toString() {
        return String.format("OrderItem{id='%s', item='%s', qty=%d, sent=%s}", id, menuItemName, quantity, sentToKitchen);
    }
}
