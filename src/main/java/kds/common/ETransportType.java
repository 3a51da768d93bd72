package kds.common;

/**
 * How a printer target is reached
 * @since 03/10/2026
 */
public enum ETransportType {
    /** Raw TCP (ESC/POS) on the local network */
    NETWORK,
    /** Print job pushed to the cloud relay broker */
    CLOUD,
    /** Simulated printer, no hardware */
    NONE
}
