package kds.domain.relay;

/**
 * Lifecycle of the broker session
 * @since 09/10/2026
 */
public enum ERelayState {
    DISCONNECTED,
    CONNECTED,
    /** heartbeats kept failing, a reconnect is scheduled */
    DOWN,
    RECONNECTING,
    /** reconnect attempts exhausted, only {@code reinitialize()} leaves this state */
    FAILED
}
