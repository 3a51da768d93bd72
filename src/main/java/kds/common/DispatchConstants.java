package kds.common;

/**
 * @since 03/10/2026
 */
public final class DispatchConstants {
    private DispatchConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static final int DEFAULT_PRINTER_PORT = 9100;
    public static final int DEFAULT_TRANSMIT_TIMEOUT = 15000;
    public static final int DEFAULT_INTER_TARGET_DELAY_MS = 500;
    public static final int DEFAULT_CONNECT_TIMEOUT = 3000;
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final int DEFAULT_SIMULATED_DELAY_MS = 200;

    public static final int DEFAULT_DRAIN_INTERVAL = 120000;
    public static final int DEFAULT_BACKOFF_BASE = 30000;
    public static final int DEFAULT_BACKOFF_MAX = 300000;
    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    public static final int DEFAULT_RELAY_REQUEST_TIMEOUT = 15000;
    public static final int DEFAULT_HEARTBEAT_INTERVAL = 60000;
    public static final int DEFAULT_HEARTBEAT_TIMEOUT = 5000;
    public static final int DEFAULT_STATUS_POLL_INTERVAL = 10000;
    public static final int DEFAULT_MAX_HEARTBEAT_RETRIES = 5;
    public static final int DEFAULT_RECONNECT_STEP = 5000;
    public static final int DEFAULT_MAX_RECONNECT_DELAY = 60000;
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 10;
    public static final int DEFAULT_AGENT_POLL_INTERVAL = 5000;
    public static final int CONFIRMATION_TIMEOUT_MINUTES = 30;

    public static final int LEDGER_RETENTION_HOURS = 24;

    public static final int TICKET_WIDTH = 32;
    public static final String SYSTEM_ACTOR = "system";
}
