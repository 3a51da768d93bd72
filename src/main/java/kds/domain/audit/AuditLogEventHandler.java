package kds.domain.audit;

import com.google.common.eventbus.Subscribe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Forwards audit entries posted on the event bus to the audit sink.
 * A failing sink never affects dispatch.
 * @since 06/10/2026
 */
@Singleton
public class AuditLogEventHandler {
    private static final Logger logger = LoggerFactory.getLogger(AuditLogEventHandler.class);

    private final IAuditSink auditSink;

    @Inject
    public AuditLogEventHandler(IAuditSink auditSink) {
        this.auditSink = auditSink;
    }

    @Subscribe
    public void onAuditEntry(AuditEntry entry) {
        try {
            auditSink.record(entry);
        } catch (Exception e) {
            logger.warn("Failed to write audit entry for order {} / {}: {}",
                    entry.orderId(), entry.targetId(), e.getMessage());
        }
    }
}
