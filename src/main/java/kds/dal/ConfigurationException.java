package kds.dal;

/**
 * Thrown when configuration (properties or printer catalog) is invalid or missing
 * @since 03/10/2026
 */
public class ConfigurationException extends Exception {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
