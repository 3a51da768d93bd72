package kds.domain.dispatch;

/**
 * Per-order dispatch progress
 * @since 08/10/2026
 */
public enum EDispatchState {
    IDLE,
    DETECTING,
    VALIDATING,
    SEGREGATING,
    MARKING_SENT,
    DISPATCHING,
    AGGREGATING,
    COMPLETE
}
