package kds.domain.relay.dto;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Broker job ids processed by a printer. The broker reads them from {@code orderIds}.
 * @since 09/10/2026
 */
public record AcknowledgeRequest(@SerializedName("orderIds") List<String> jobIds, String printerId) {
}
