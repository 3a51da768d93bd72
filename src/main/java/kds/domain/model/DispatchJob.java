package kds.domain.model;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * One printer's share of a dispatch: target, items, rendered ticket and attempt number
 * @since 05/10/2026
 */
public record DispatchJob(String jobId, String targetId, OrderSnapshot order, String content, int attempt,
                          long createdAt) {

    public static DispatchJob create(String targetId, OrderSnapshot order, String content) {
        return new DispatchJob(UUID.randomUUID().toString(), targetId, order, content, 1, System.currentTimeMillis());
    }

    public DispatchJob withAttempt(int nextAttempt) {
        return new DispatchJob(jobId, targetId, order, content, nextAttempt, createdAt);
    }

    public String orderId() {
        return order.orderId();
    }

    public List<String> itemIds() {
        return order.items().stream().map(JobItem::id).collect(Collectors.toList());
    }

    public List<String> itemNames() {
        return order.items().stream().map(JobItem::name).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return String.format("DispatchJob{id=%s, order=%s, target=%s, items=%d, attempt=%d}",
                jobId, order.orderNumber(), targetId, order.items().size(), attempt);
    }
}
