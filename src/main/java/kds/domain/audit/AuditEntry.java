package kds.domain.audit;

import java.util.List;

/**
 * One dispatch outcome for one printer, as written to the audit trail
 * @since 06/10/2026
 */
public record AuditEntry(long timestamp, String orderId, String orderNumber, List<String> items, String targetId,
                         EAuditOutcome outcome, String actor, String detail) {

    public static AuditEntry of(String orderId, String orderNumber, List<String> items, String targetId,
                                EAuditOutcome outcome, String actor, String detail) {
        return new AuditEntry(System.currentTimeMillis(), orderId, orderNumber, List.copyOf(items), targetId,
                outcome, actor, detail);
    }
}
