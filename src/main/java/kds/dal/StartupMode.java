package kds.dal;

/**
 * Defines how strictly the application enforces service initialization
 * @since 03/10/2026
 */
public enum StartupMode {
    /**
     * All services (catalog, retry queue, relay) must initialize.
     * Use for production kitchens where every printer path is expected to work.
     */
    STRICT("All services must initialize"),

    /**
     * At least one service must initialize.
     */
    LENIENT("At least one service must initialize"),

    /**
     * Always start; the REST surface stays up even with nothing initialized.
     * Use for demos and troubleshooting.
     */
    PERMISSIVE("Application starts regardless of service status");

    private final String description;

    StartupMode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return name() + ": " + description;
    }
}
