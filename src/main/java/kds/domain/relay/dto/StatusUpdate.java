package kds.domain.relay.dto;

import java.util.List;
import java.util.Map;

/**
 * Answer of the broker status poll. Any field may be missing.
 * @since 09/10/2026
 */
public record StatusUpdate(Map<String, PrinterPresence> printerStatus, List<OrderConfirmation> orderConfirmations,
                           List<FailedOrder> failedOrders) {

    public Map<String, PrinterPresence> printerStatusOrEmpty() {
        return printerStatus == null ? Map.of() : printerStatus;
    }

    public List<OrderConfirmation> confirmationsOrEmpty() {
        return orderConfirmations == null ? List.of() : orderConfirmations;
    }

    public List<FailedOrder> failuresOrEmpty() {
        return failedOrders == null ? List.of() : failedOrders;
    }
}
