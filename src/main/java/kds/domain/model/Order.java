package kds.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Order as handed over by the order-management side
 * @since 03/10/2026
 */
public class Order {
    private final String id;
    private final String number;
    private final String tableId;
    private final String customerName;
    private final String serverId;
    private final boolean urgent;
    private final int priority;
    private final long createdAt;
    private final List<OrderItem> items;

    public Order(String id, String number, String tableId, String customerName, String serverId,
                 boolean urgent, int priority, long createdAt, List<OrderItem> items) {
        this.id = id;
        this.number = number;
        this.tableId = tableId;
        this.customerName = customerName;
        this.serverId = serverId;
        this.urgent = urgent;
        this.priority = priority;
        this.createdAt = createdAt;
        this.items = items;
    }

    public String getId() {
        return id;
    }

    public String getNumber() {
        return number;
    }

    public String getTableId() {
        return tableId;
    }

    public String getCustomerName() {
        return customerName;
    }

    public String getServerId() {
        return serverId;
    }

    public boolean isUrgent() {
        return urgent;
    }

    public int getPriority() {
        return priority;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    /**
     * @return items in order, never null (Gson may leave the field unset)
     */
    public List<OrderItem> getItems() {
        return items == null ? Collections.emptyList() : Collections.unmodifiableList(items);
    }

    public List<OrderItem> getUnsentItems() {
        return getItems().stream()
                .filter(item -> !item.isSentToKitchen())
                .collect(Collectors.toList());
    }

    /**
     * Carry the sent flag over from a previously stored version of this order, matching items by id
     */
    public void keepSentFlags(Order previous) {
        Set<String> sentIds = previous.getItems().stream()
                .filter(OrderItem::isSentToKitchen)
                .map(OrderItem::getId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        for (OrderItem item : getItems()) {
            if (!item.isSentToKitchen() && sentIds.contains(item.getId())) {
                item.markSentToKitchen();
            }
        }
    }

    @Override
    public String toString() {
        return String.format("Order{id='%s', number='%s', items=%d, urgent=%s}", id, number, getItems().size(), urgent);
    }
}
