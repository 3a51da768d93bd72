package kds.domain.queue;

import kds.common.DispatchConstants;
import kds.dal.IPrinterTargetStore;
import kds.dal.RetryConfig;
import kds.domain.audit.AuditEntry;
import kds.domain.audit.DispatchEventBus;
import kds.domain.audit.EAuditOutcome;
import kds.domain.dispatch.DeliveryLedger;
import kds.domain.dispatch.DispatchStatistics;
import kds.domain.dispatch.TimedTransmitter;
import kds.domain.dispatch.TransmissionOutcome;
import kds.domain.model.DispatchJob;
import kds.domain.model.PrinterTarget;
import kds.domain.transport.ETransmissionFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background replay of the retry queue
 * @since 07/10/2026
 */
@Singleton
public class RetryDrainService {
    private static final Logger logger = LoggerFactory.getLogger(RetryDrainService.class);

    private final PendingQueue queue;
    private final TimedTransmitter transmitter;
    private final IPrinterTargetStore printerStore;
    private final DeliveryLedger ledger;
    private final DispatchStatistics statistics;
    private final DispatchEventBus eventBus;
    private final long drainIntervalMs;

    private final AtomicBoolean draining = new AtomicBoolean(false);
    private ScheduledFuture<?> drainTask;
    private boolean running = false;         // guarded by start/stop being synchronized

    @Inject
    public RetryDrainService(PendingQueue queue, TimedTransmitter transmitter, IPrinterTargetStore printerStore,
                             DeliveryLedger ledger, DispatchStatistics statistics, DispatchEventBus eventBus,
                             RetryConfig config) {
        this.queue = queue;
        this.transmitter = transmitter;
        this.printerStore = printerStore;
        this.ledger = ledger;
        this.statistics = statistics;
        this.eventBus = eventBus;
        this.drainIntervalMs = config.drainIntervalMs();
    }

    public synchronized void start(ScheduledExecutorService executor) {
        if (running) {
            logger.warn("Retry drain is already running");
            return;
        }
        running = true;
        drainTask = executor.scheduleWithFixedDelay(this::scheduledDrain, drainIntervalMs, drainIntervalMs,
                TimeUnit.MILLISECONDS);
        logger.info("Retry drain scheduled every {}ms", drainIntervalMs);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (drainTask != null) {
            drainTask.cancel(false);
            drainTask = null;
        }
        logger.info("Retry drain stopped");
    }

    public synchronized boolean isRunning() {
        return running;
    }

    private void scheduledDrain() {
        try {
            drain(false);
        } catch (Exception e) {
            logger.error("Error during retry drain", e);
        }
    }

    /**
     * Replay queued jobs once. Only one drain runs at a time, a concurrent call returns a skipped report.
     * @param force replay every pending job regardless of its backoff schedule
     */
    public DrainReport drain(boolean force) {
        if (!draining.compareAndSet(false, true)) {
            logger.debug("Drain already in progress, skipping");
            return DrainReport.skippedRun();
        }

        try {
            List<PendingQueueEntry> due = queue.dueEntries(System.currentTimeMillis(), force);
            if (due.isEmpty()) {
                return new DrainReport(0, 0, 0, 0, false);
            }
            logger.info("Replaying {} queued print jobs ({} pending in total)", due.size(), queue.size());

            int succeeded = 0;
            int failed = 0;
            int deadLettered = 0;
            for (PendingQueueEntry entry : due) {
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
                DispatchJob job = entry.job().withAttempt(entry.job().attempt() + 1);
                TransmissionOutcome outcome = replay(job);

                if (outcome.delivered()) {
                    queue.markSucceeded(job.jobId());
                    ledger.markDelivered(job.orderId(), job.itemIds(), job.targetId());
                    statistics.recordSuccess(job.targetId());
                    audit(job, EAuditOutcome.DELIVERED, "replayed on retry " + (entry.retryCount() + 1));
                    succeeded++;
                } else {
                    statistics.recordFailure(job.targetId());
                    Optional<PendingQueueEntry> updated = queue.markFailed(job.jobId(), outcome.failure(), outcome.message());
                    if (updated.isPresent() && updated.get().deadLettered()) {
                        audit(job, EAuditOutcome.DEAD_LETTERED, outcome.failure() + ": " + outcome.message());
                        deadLettered++;
                    } else {
                        failed++;
                    }
                }
            }

            DrainReport report = new DrainReport(succeeded + failed + deadLettered, succeeded, failed, deadLettered, false);
            logger.info("Drain finished: {} delivered, {} still failing, {} dead-lettered",
                    succeeded, failed, deadLettered);
            return report;
        } finally {
            draining.set(false);
        }
    }

    private TransmissionOutcome replay(DispatchJob job) {
        Optional<PrinterTarget> target = printerStore.findById(job.targetId());
        if (target.isEmpty()) {
            return TransmissionOutcome.failed(ETransmissionFailure.NETWORK_ERROR,
                    "Printer configuration not found: " + job.targetId(), 0);
        }
        return transmitter.transmit(target.get(), job);
    }

    private void audit(DispatchJob job, EAuditOutcome outcome, String detail) {
        eventBus.post(AuditEntry.of(job.orderId(), job.order().orderNumber(), job.itemNames(), job.targetId(),
                outcome, DispatchConstants.SYSTEM_ACTOR, detail));
    }
}
