package kds.domain.relay;

import kds.common.ELogger;
import kds.common.ETransportType;
import kds.dal.IPrinterTargetStore;
import kds.dal.RelayConfig;
import kds.domain.dispatch.TimedTransmitter;
import kds.domain.dispatch.TransmissionOutcome;
import kds.domain.model.DispatchJob;
import kds.domain.model.JobItem;
import kds.domain.model.OrderSnapshot;
import kds.domain.model.PrinterTarget;
import kds.domain.relay.dto.OrderData;
import kds.domain.relay.dto.PrintJobItem;
import kds.domain.relay.dto.PrintJobPayload;
import kds.domain.transport.TicketRenderer;
import org.slf4j.Logger;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Printer side of the relay: pulls jobs queued for one local printer, prints them and acknowledges
 * the ones that printed. Unacknowledged jobs are redelivered by the broker on a later poll.
 * @since 10/10/2026
 */
@Singleton
public class RelayPollingAgent {
    private static final Logger logger = ELogger.RELAY.getLogger();

    private final RelayClient client;
    private final IPrinterTargetStore printerStore;
    private final TimedTransmitter transmitter;
    private final TicketRenderer renderer;
    private final RelayConfig config;

    private ScheduledFuture<?> pollTask;

    @Inject
    public RelayPollingAgent(RelayClient client, IPrinterTargetStore printerStore, TimedTransmitter transmitter,
                             TicketRenderer renderer, RelayConfig config) {
        this.client = client;
        this.printerStore = printerStore;
        this.transmitter = transmitter;
        this.renderer = renderer;
        this.config = config;
    }

    public synchronized void start(ScheduledExecutorService executor) {
        if (!config.enabled() || !config.agentEnabled()) {
            logger.debug("Relay agent disabled");
            return;
        }
        if (pollTask != null) {
            logger.warn("Relay agent already running");
            return;
        }
        pollTask = executor.scheduleWithFixedDelay(this::scheduledPoll, config.agentPollIntervalMs(),
                config.agentPollIntervalMs(), TimeUnit.MILLISECONDS);
        logger.info("Relay agent polling for printer {} every {}ms", config.agentPrinterId(),
                config.agentPollIntervalMs());
    }

    public synchronized void stop() {
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
            logger.info("Relay agent stopped");
        }
    }

    public synchronized boolean isRunning() {
        return pollTask != null;
    }

    private void scheduledPoll() {
        try {
            pollOnce();
        } catch (RelayException e) {
            logger.debug("Relay agent poll failed: {}", e.getMessage());
        } catch (Exception e) {
            logger.error("Unexpected error in relay agent poll", e);
        }
    }

    /**
     * One poll-print-acknowledge round. Acknowledgements carry the broker job id, so a failed job of the same
     * order stays queued on the broker.
     * @return broker job ids printed and acknowledged
     */
    public List<String> pollOnce() {
        String printerId = config.agentPrinterId();
        Optional<PrinterTarget> local = printerStore.findById(printerId);
        if (local.isEmpty()) {
            logger.warn("Relay agent printer {} is not configured", printerId);
            return List.of();
        }
        PrinterTarget printer = local.get();
        if (printer.transport() == ETransportType.CLOUD) {
            logger.error("Relay agent printer {} is itself a CLOUD target, refusing to print", printerId);
            return List.of();
        }

        List<PrintJobPayload> jobs = client.pollJobs(printerId);
        if (jobs.isEmpty()) {
            return List.of();
        }
        logger.info("Relay agent received {} jobs for {}", jobs.size(), printer.name());

        List<String> printed = new ArrayList<>();
        for (PrintJobPayload payload : jobs) {
            TransmissionOutcome outcome = transmitter.transmit(printer, toJob(payload, printer));
            if (outcome.delivered()) {
                if (payload.jobId() == null) {
                    logger.warn("Relay job for order {} has no job id and cannot be acknowledged",
                            payload.orderNumber());
                } else {
                    printed.add(payload.jobId());
                }
            } else {
                logger.warn("Relay agent could not print order {}: {} - {}", payload.orderNumber(),
                        outcome.failure(), outcome.message());
            }
        }

        if (!printed.isEmpty()) {
            client.acknowledge(printerId, printed);
            logger.info("Relay agent acknowledged {} of {} jobs", printed.size(), jobs.size());
        }
        return printed;
    }

    DispatchJob toJob(PrintJobPayload payload, PrinterTarget printer) {
        OrderData data = payload.orderData();
        List<JobItem> items = payload.items() == null ? List.of() : payload.items().stream()
                .map(RelayPollingAgent::toJobItem)
                .collect(Collectors.toList());

        OrderSnapshot snapshot = new OrderSnapshot(payload.orderId(), payload.orderNumber(),
                data == null ? null : data.tableId(),
                data == null ? null : data.customerName(),
                data == null ? null : data.userId(),
                data != null && data.isUrgent(),
                data == null ? 0 : data.priority(),
                parseTime(data == null ? null : data.orderTime()),
                items);

        String content = payload.content();
        if (content == null || content.isEmpty()) {
            content = renderer.render(snapshot, printer.name());
        }
        String jobId = payload.jobId() == null ? UUID.randomUUID().toString() : payload.jobId();
        return new DispatchJob(jobId, printer.id(), snapshot, content, 1, System.currentTimeMillis());
    }

    private static JobItem toJobItem(PrintJobItem item) {
        return new JobItem(item.id(), null, item.name(), item.quantity(), item.variant(), item.instructions(),
                item.notes());
    }

    private static long parseTime(String isoTime) {
        if (isoTime == null) {
            return System.currentTimeMillis();
        }
        try {
            return Instant.parse(isoTime).toEpochMilli();
        } catch (DateTimeParseException e) {
            return System.currentTimeMillis();
        }
    }
}
