package kds.domain.dispatch;

/**
 * @since 08/10/2026
 */
public enum EDeliveryState {
    /** Item marked sent, ticket for this printer not confirmed yet */
    COMMITTED,
    DELIVERED,
    /** Last attempt failed, a retry is queued */
    FAILED
}
