package kds.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named loggers routed to dedicated appenders in log4j2.xml
 * @since 03/10/2026
 */
public enum ELogger {
    AUDIT("Audit"),
    RELAY("Relay"),
    ;

    private final String name;

    ELogger(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Logger getLogger() {
        return LoggerFactory.getLogger(name);
    }
}
