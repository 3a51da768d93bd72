package kds.domain.audit;

/**
 * Write-only audit trail
 * @since 06/10/2026
 */
public interface IAuditSink {
    void record(AuditEntry entry);
}
