package kds.dal;

/**
 * Web server and scheduler settings
 * @since 03/10/2026
 */
public record ServerConfig(int port, String host, int threadPoolSize, StartupMode startupMode) {

    @Override
    public String toString() {
        return String.format("ServerConfiguration{port=%d, host='%s', threads=%d, startupMode=%s}",
                port, host, threadPoolSize, startupMode.name());
    }

    public void validate() throws ConfigurationException {
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("Server port must be between 1 and 65535");
        }
        if (host == null || host.trim().isEmpty()) {
            throw new ConfigurationException("Server host cannot be empty");
        }
        if (threadPoolSize < 1) {
            throw new ConfigurationException("Scheduler thread pool must have at least one thread");
        }
        if (startupMode == null) {
            throw new ConfigurationException("Startup mode cannot be null");
        }
    }
}
