package kds.domain.transport;

/**
 * A single delivery attempt failed
 * @since 05/10/2026
 */
public class TransmissionException extends Exception {
    private final ETransmissionFailure failure;

    public TransmissionException(ETransmissionFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public TransmissionException(ETransmissionFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public ETransmissionFailure getFailure() {
        return failure;
    }
}
