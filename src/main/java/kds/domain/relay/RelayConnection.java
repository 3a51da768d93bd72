package kds.domain.relay;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalCause;
import kds.common.DispatchConstants;
import kds.common.ELogger;
import kds.dal.RelayConfig;
import kds.domain.audit.AuditEntry;
import kds.domain.audit.DispatchEventBus;
import kds.domain.audit.EAuditOutcome;
import kds.domain.dispatch.DeliveryLedger;
import kds.domain.model.DispatchJob;
import kds.domain.queue.PendingQueue;
import kds.domain.relay.dto.FailedOrder;
import kds.domain.relay.dto.OrderConfirmation;
import kds.domain.relay.dto.PrinterPresence;
import kds.domain.relay.dto.StatusUpdate;
import kds.domain.transport.ETransmissionFailure;
import org.slf4j.Logger;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Session with the cloud print broker.
 *
 * <p>A heartbeat keeps the session alive; after {@code maxHeartbeatRetries} consecutive failures the session is
 * DOWN and a reconnect is scheduled with a linear, capped delay. Once {@code maxReconnectAttempts} reconnects have
 * failed the connection is FAILED and stays so until {@link #reinitialize()}.</p>
 *
 * <p>The status poll reports what the printer side did with submitted jobs. A confirmation only produces an audit
 * event (the job already counted as delivered when the broker accepted it); a reported failure flips the ledger to
 * FAILED and puts the job back into the retry queue. Jobs with no report after
 * {@link DispatchConstants#CONFIRMATION_TIMEOUT_MINUTES} minutes are dropped from tracking.</p>
 *
 * @since 09/10/2026
 */
@Singleton
public class RelayConnection {
    private static final Logger logger = ELogger.RELAY.getLogger();

    private final RelayClient client;
    private final RelayConfig config;
    private final PendingQueue pendingQueue;
    private final DeliveryLedger ledger;
    private final DispatchEventBus eventBus;

    // "orderId|printerId" -> job submitted through the broker, waiting for the printer side
    private final Cache<String, DispatchJob> awaitingConfirmation;
    private final Map<String, PrinterPresence> printerPresence = new ConcurrentHashMap<>();

    private volatile ERelayState state = ERelayState.DISCONNECTED;
    private volatile long lastHeartbeat = 0;
    private volatile int heartbeatFailures = 0;
    private volatile int reconnectAttempts = 0;

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> heartbeatTask;
    private ScheduledFuture<?> statusPollTask;
    private ScheduledFuture<?> reconnectTask;

    @Inject
    public RelayConnection(RelayClient client, RelayConfig config, PendingQueue pendingQueue, DeliveryLedger ledger,
                           DispatchEventBus eventBus) {
        this(client, config, pendingQueue, ledger, eventBus,
                Duration.ofMinutes(DispatchConstants.CONFIRMATION_TIMEOUT_MINUTES), Ticker.systemTicker());
    }

    RelayConnection(RelayClient client, RelayConfig config, PendingQueue pendingQueue, DeliveryLedger ledger,
                    DispatchEventBus eventBus, Duration confirmationTimeout, Ticker ticker) {
        this.client = client;
        this.config = config;
        this.pendingQueue = pendingQueue;
        this.ledger = ledger;
        this.eventBus = eventBus;
        this.awaitingConfirmation = CacheBuilder.newBuilder()
                .expireAfterWrite(confirmationTimeout)
                .ticker(ticker)
                .<String, DispatchJob>removalListener(notification -> {
                    if (notification.getCause() == RemovalCause.EXPIRED) {
                        DispatchJob job = notification.getValue();
                        logger.warn("No relay report for order {} on printer {}, no longer tracked",
                                job.order().orderNumber(), job.targetId());
                    }
                })
                .build();
    }

    /**
     * Register with the broker
     * @return true when a session is open
     */
    public synchronized boolean connect() {
        if (!config.enabled()) {
            return false;
        }
        try {
            client.register(config.restaurantId(), config.deviceName());
            state = ERelayState.CONNECTED;
            heartbeatFailures = 0;
            reconnectAttempts = 0;
            lastHeartbeat = System.currentTimeMillis();
            logger.info("✓ Connected to relay {}", config.baseUrl());
            return true;
        } catch (RelayException e) {
            logger.warn("⚠ Relay registration failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Connect (unless already connected) and schedule heartbeat and status poll.
     * A failed first connect goes through the reconnect path.
     */
    public synchronized void start(ScheduledExecutorService scheduler) {
        if (!config.enabled()) {
            logger.info("Relay disabled, not starting");
            return;
        }
        if (heartbeatTask != null) {
            logger.warn("Relay connection already started");
            return;
        }
        this.executor = scheduler;

        if (state != ERelayState.CONNECTED && !connect()) {
            state = ERelayState.DOWN;
            scheduleReconnect();
        }

        heartbeatTask = scheduler.scheduleWithFixedDelay(this::heartbeatTick,
                config.heartbeatIntervalMs(), config.heartbeatIntervalMs(), TimeUnit.MILLISECONDS);
        statusPollTask = scheduler.scheduleWithFixedDelay(this::pollStatusTick,
                config.statusPollIntervalMs(), config.statusPollIntervalMs(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        cancel(heartbeatTask);
        cancel(statusPollTask);
        cancel(reconnectTask);
        heartbeatTask = null;
        statusPollTask = null;
        reconnectTask = null;
        client.clearSession();
        if (config.enabled()) {
            state = ERelayState.DISCONNECTED;
            logger.info("Relay connection stopped");
        }
    }

    /**
     * Leave FAILED (or any other state): reset counters and connect again
     * @return true when the new session is open
     */
    public synchronized boolean reinitialize() {
        logger.info("Reinitializing relay connection (was {})", state);
        cancel(reconnectTask);
        reconnectTask = null;
        client.clearSession();
        heartbeatFailures = 0;
        reconnectAttempts = 0;
        state = ERelayState.DISCONNECTED;

        boolean connected = connect();
        if (!connected && executor != null) {
            state = ERelayState.DOWN;
            scheduleReconnect();
        }
        return connected;
    }

    public boolean isEnabled() {
        return config.enabled();
    }

    public boolean isConnected() {
        return state == ERelayState.CONNECTED;
    }

    public ERelayState getState() {
        return state;
    }

    /**
     * Remember a job the broker accepted until the printer side reports on it
     */
    public void awaitConfirmation(DispatchJob job) {
        awaitingConfirmation.put(key(job.orderId(), job.targetId()), job);
    }

    public int awaitingConfirmationCount() {
        awaitingConfirmation.cleanUp();
        return (int) awaitingConfirmation.size();
    }

    public Optional<PrinterPresence> getPrinterPresence(String printerId) {
        return Optional.ofNullable(printerPresence.get(printerId));
    }

    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("enabled", config.enabled());
        status.put("state", state);
        status.put("sessionId", client.getSessionId());
        status.put("heartbeatFailures", heartbeatFailures);
        status.put("reconnectAttempts", reconnectAttempts);
        status.put("lastHeartbeat", lastHeartbeat == 0 ? null : lastHeartbeat);
        status.put("awaitingConfirmation", awaitingConfirmationCount());
        status.put("printers", new LinkedHashMap<>(printerPresence));
        return status;
    }

    void heartbeatTick() {
        try {
            synchronized (this) {
                if (state != ERelayState.CONNECTED) {
                    return;
                }
            }
            client.heartbeat(pendingQueue.size(), pendingQueue.deadLetterCount());
            synchronized (this) {
                heartbeatFailures = 0;
                lastHeartbeat = System.currentTimeMillis();
            }
        } catch (RelayException e) {
            onHeartbeatFailure(e);
        } catch (Exception e) {
            logger.error("Unexpected error in relay heartbeat", e);
        }
    }

    private synchronized void onHeartbeatFailure(RelayException e) {
        heartbeatFailures++;
        logger.warn("⚠ Relay heartbeat failed ({}/{}): {}", heartbeatFailures, config.maxHeartbeatRetries(),
                e.getMessage());
        if (heartbeatFailures >= config.maxHeartbeatRetries() && state == ERelayState.CONNECTED) {
            logger.error("✗ Relay connection lost after {} failed heartbeats", heartbeatFailures);
            state = ERelayState.DOWN;
            client.clearSession();
            scheduleReconnect();
        }
    }

    void pollStatusTick() {
        try {
            if (!isConnected()) {
                return;
            }
            client.pollStatus().ifPresent(this::applyStatusUpdate);
        } catch (RelayException e) {
            logger.debug("Relay status poll failed: {}", e.getMessage());
        } catch (Exception e) {
            logger.error("Unexpected error in relay status poll", e);
        }
    }

    void applyStatusUpdate(StatusUpdate update) {
        printerPresence.putAll(update.printerStatusOrEmpty());

        for (OrderConfirmation confirmation : update.confirmationsOrEmpty()) {
            DispatchJob job = awaitingConfirmation.asMap()
                    .remove(key(confirmation.orderId(), confirmation.printerId()));
            if (job == null) {
                logger.debug("Confirmation for unknown job: order {}, printer {}",
                        confirmation.orderId(), confirmation.printerId());
                continue;
            }
            if (confirmation.success()) {
                logger.info("Relay confirmed order {} on printer {}", job.order().orderNumber(), job.targetId());
                audit(job, EAuditOutcome.CONFIRMED_BY_RELAY, "printed by relay agent");
            } else {
                relayFailed(job, "printer side reported failure");
            }
        }

        for (FailedOrder failed : update.failuresOrEmpty()) {
            DispatchJob job = awaitingConfirmation.asMap().remove(key(failed.orderId(), failed.printerId()));
            if (job == null) {
                logger.debug("Failure report for unknown job: order {}, printer {}",
                        failed.orderId(), failed.printerId());
                continue;
            }
            relayFailed(job, failed.error() == null ? "printer side reported failure" : failed.error());
        }
    }

    private void relayFailed(DispatchJob job, String error) {
        logger.warn("Relay failed order {} on printer {}: {}", job.order().orderNumber(), job.targetId(), error);
        ledger.markFailed(job.orderId(), job.itemIds(), job.targetId());
        pendingQueue.enqueue(job, ETransmissionFailure.NON_SUCCESS_STATUS, error);
        audit(job, EAuditOutcome.FAILED_AT_RELAY, error);
    }

    /**
     * Linear backoff: attempt x step, capped at the configured maximum
     */
    static long reconnectDelayMs(int attempt, long stepMs, long maxDelayMs) {
        return Math.min(stepMs * attempt, maxDelayMs);
    }

    private synchronized void scheduleReconnect() {
        if (executor == null) {
            return;
        }
        if (reconnectAttempts >= config.maxReconnectAttempts()) {
            state = ERelayState.FAILED;
            logger.error("✗ Relay reconnect gave up after {} attempts, manual reinitialization required",
                    reconnectAttempts);
            return;
        }
        reconnectAttempts++;
        long delay = reconnectDelayMs(reconnectAttempts, config.reconnectStepMs(), config.maxReconnectDelayMs());
        logger.info("Scheduling relay reconnect in {}ms (attempt {})", delay, reconnectAttempts);
        reconnectTask = executor.schedule(this::reconnectTick, delay, TimeUnit.MILLISECONDS);
    }

    /**
     * Registration runs outside the monitor so status reads are not blocked by a slow broker
     */
    void reconnectTick() {
        try {
            int attempt;
            synchronized (this) {
                if (state == ERelayState.CONNECTED || state == ERelayState.FAILED) {
                    return;
                }
                state = ERelayState.RECONNECTING;
                attempt = reconnectAttempts;
            }

            boolean registered = tryRegister();

            synchronized (this) {
                if (state != ERelayState.RECONNECTING) {
                    logger.debug("Relay state changed to {} during reconnect attempt {}", state, attempt);
                    return;
                }
                if (registered) {
                    heartbeatFailures = 0;
                    reconnectAttempts = 0;
                    state = ERelayState.CONNECTED;
                    lastHeartbeat = System.currentTimeMillis();
                    logger.info("✓ Relay reconnected on attempt {}", attempt);
                    return;
                }
                state = ERelayState.DOWN;
                scheduleReconnect();
            }
        } catch (Exception e) {
            logger.error("Unexpected error in relay reconnect", e);
        }
    }

    private boolean tryRegister() {
        try {
            client.register(config.restaurantId(), config.deviceName());
            return true;
        } catch (RelayException e) {
            logger.warn("⚠ Relay reconnect failed: {}", e.getMessage());
            return false;
        }
    }

    private void audit(DispatchJob job, EAuditOutcome outcome, String detail) {
        eventBus.post(AuditEntry.of(job.orderId(), job.order().orderNumber(), job.itemNames(), job.targetId(),
                outcome, DispatchConstants.SYSTEM_ACTOR, detail));
    }

    private static String key(String orderId, String printerId) {
        return orderId + "|" + printerId;
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }
}
