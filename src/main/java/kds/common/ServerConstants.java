package kds.common;

/**
 * @since 03/10/2026
 */
public final class ServerConstants {
    private ServerConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static final int SERVER_PORT = 8090;
    public static final String SERVER_IP = "0.0.0.0";
    public static final int THREAD_POOL_SIZE = 4;
    public static final String DEFAULT_CATALOG_PATH = "config/printers.json";
    public static final String DEFAULT_JOURNAL_PATH = "data/pending-queue.json";
}
