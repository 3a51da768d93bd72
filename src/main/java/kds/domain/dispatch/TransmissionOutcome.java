package kds.domain.dispatch;

import kds.domain.transport.ETransmissionFailure;

/**
 * Result of one timed delivery attempt
 * @since 08/10/2026
 */
public record TransmissionOutcome(boolean delivered, ETransmissionFailure failure, String message, long durationMs) {

    public static TransmissionOutcome delivered(long durationMs) {
        return new TransmissionOutcome(true, null, null, durationMs);
    }

    public static TransmissionOutcome failed(ETransmissionFailure failure, String message, long durationMs) {
        return new TransmissionOutcome(false, failure, message, durationMs);
    }
}
