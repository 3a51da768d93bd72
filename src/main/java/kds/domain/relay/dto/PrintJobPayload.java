package kds.domain.relay.dto;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Print job as exchanged with the relay broker.
 * {@code jobId} is assigned by the broker and is null on submission; polled jobs may carry it as {@code id}.
 *
 * @param priority 1 for urgent orders, otherwise the order priority, 5 when unset
 * @since 09/10/2026
 */
public record PrintJobPayload(@SerializedName(value = "jobId", alternate = "id") String jobId, String orderId,
                              String orderNumber, String restaurantId, String targetPrinterId, List<PrintJobItem> items, OrderData orderData, String content,
                              String timestamp, int priority) {
}
