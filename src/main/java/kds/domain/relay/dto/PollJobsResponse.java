package kds.domain.relay.dto;

import java.util.List;

/**
 * @since 09/10/2026
 */
public record PollJobsResponse(List<PrintJobPayload> orders) {

    public List<PrintJobPayload> ordersOrEmpty() {
        return orders == null ? List.of() : orders;
    }
}
