package kds.domain.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Order header plus the item subset of one dispatch job.
 * Jobs are replayed from the retry queue long after the order itself may have changed, so they carry this copy.
 * @since 05/10/2026
 */
public record OrderSnapshot(String orderId, String orderNumber, String tableId, String customerName,
                            String serverId, boolean urgent, int priority, long orderTime, List<JobItem> items) {

    public static OrderSnapshot of(Order order, List<OrderItem> subset) {
        List<JobItem> jobItems = subset.stream().map(JobItem::from).collect(Collectors.toList());
        return new OrderSnapshot(order.getId(), order.getNumber(), order.getTableId(), order.getCustomerName(),
                order.getServerId(), order.isUrgent(), order.getPriority(), order.getCreatedAt(), List.copyOf(jobItems));
    }
}
