package kds.domain.transport;

/**
 * @since 05/10/2026
 */
public enum ETransmissionFailure {
    /** No answer within the transmit timeout */
    TIMEOUT,
    /** Connection refused, reset, unknown host and similar */
    NETWORK_ERROR,
    /** Destination answered but refused the job (printer error, relay HTTP status) */
    NON_SUCCESS_STATUS
}
