package kds.domain.audit;

import kds.common.ELogger;
import org.slf4j.Logger;

import javax.inject.Singleton;

/**
 * Writes audit entries to the dedicated "Audit" logger (own rolling file, see log4j2.xml)
 * @since 06/10/2026
 */
@Singleton
public class LoggingAuditSink implements IAuditSink {
    private static final Logger auditLogger = ELogger.AUDIT.getLogger();

    @Override
    public void record(AuditEntry entry) {
        auditLogger.info("order={} number={} target={} outcome={} actor={} items={} detail={}",
                entry.orderId(), entry.orderNumber(), entry.targetId(), entry.outcome(), entry.actor(),
                entry.items(), entry.detail());
    }
}
