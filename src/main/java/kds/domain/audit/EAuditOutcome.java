package kds.domain.audit;

/**
 * @since 06/10/2026
 */
public enum EAuditOutcome {
    DELIVERED,
    FAILED,
    QUEUED,
    DEAD_LETTERED,
    CONFIRMED_BY_RELAY,
    FAILED_AT_RELAY
}
