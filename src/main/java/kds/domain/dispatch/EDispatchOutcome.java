package kds.domain.dispatch;

/**
 * @since 08/10/2026
 */
public enum EDispatchOutcome {
    /** Every printer got its ticket */
    ALL_DELIVERED,
    /** Some printers failed, their jobs are in the retry queue */
    PARTIAL,
    /** Items are marked sent but no printer got a ticket, all jobs are in the retry queue */
    ALL_FAILED,
    /** Nothing was sent and nothing was marked (validation, nothing new, already in flight) */
    REJECTED,
    /** Unexpected error */
    ERROR
}
