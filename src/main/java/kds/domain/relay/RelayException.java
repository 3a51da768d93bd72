package kds.domain.relay;

/**
 * A broker call failed. Status code 0 means no HTTP response was received.
 * @since 09/10/2026
 */
public class RelayException extends RuntimeException {
    private final int statusCode;

    public RelayException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNetworkError() {
        return statusCode == 0;
    }
}
