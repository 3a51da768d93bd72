package kds.domain.model;

import kds.common.ETransportType;

/**
 * A configured kitchen print destination. Read-only for the dispatch core.
 *
 * @param priority higher wins when targets are ordered for auto-assignment
 * @param transport how the printer is reached; null in JSON means NETWORK
 * @since 03/10/2026
 */
public record PrinterTarget(String id, String name, String host, int port, boolean active, int priority,
                            ETransportType transport) {

    public PrinterTarget {
        if (transport == null) {
            transport = ETransportType.NETWORK;
        }
    }

    public static PrinterTarget network(String id, String name, String host, int port, int priority) {
        return new PrinterTarget(id, name, host, port, true, priority, ETransportType.NETWORK);
    }

    public static PrinterTarget cloud(String id, String name, int priority) {
        return new PrinterTarget(id, name, null, 0, true, priority, ETransportType.CLOUD);
    }

    public static PrinterTarget simulated(String id, String name, int priority) {
        return new PrinterTarget(id, name, null, 0, true, priority, ETransportType.NONE);
    }

    public String getAddress() {
        return switch (transport) {
            case NETWORK -> host + ":" + port;
            case CLOUD -> "relay";
            case NONE -> "simulated";
        };
    }

    public boolean hasValidAddress() {
        if (transport != ETransportType.NETWORK) {
            return true;
        }
        return host != null && !host.trim().isEmpty() && port >= 1 && port <= 65535;
    }

    public PrinterTarget withActive(boolean isActive) {
        return new PrinterTarget(id, name, host, port, isActive, priority, transport);
    }
}
