package kds.domain.orchestration;

import kds.domain.dispatch.TimedTransmitter;
import kds.domain.queue.PendingQueue;
import kds.domain.queue.RetryDrainService;
import kds.domain.relay.RelayConnection;
import kds.domain.relay.RelayPollingAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages graceful shutdown of the application
 * @since 11/10/2026
 */
@Singleton
public class ShutdownManager {
    private static final Logger logger = LoggerFactory.getLogger(ShutdownManager.class);

    private final WebServerManager webServerManager;
    private final RetryDrainService drainService;
    private final RelayConnection relayConnection;
    private final RelayPollingAgent relayAgent;
    private final PendingQueue pendingQueue;
    private final TimedTransmitter transmitter;
    private final ScheduledExecutorService executorService;

    private final AtomicBoolean shutDown = new AtomicBoolean(false);
    private volatile boolean shutdownHookRegistered = false;

    @Inject
    public ShutdownManager(WebServerManager webServerManager, RetryDrainService drainService,
                           RelayConnection relayConnection, RelayPollingAgent relayAgent, PendingQueue pendingQueue,
                           TimedTransmitter transmitter, ScheduledExecutorService executorService) {
        this.webServerManager = webServerManager;
        this.drainService = drainService;
        this.relayConnection = relayConnection;
        this.relayAgent = relayAgent;
        this.pendingQueue = pendingQueue;
        this.transmitter = transmitter;
        this.executorService = executorService;
    }

    public synchronized void registerShutdownHook() {
        if (!shutdownHookRegistered) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "kds-shutdown"));
            shutdownHookRegistered = true;
        }
    }

    /**
     * Graceful shutdown, runs once
     */
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down kitchen dispatch...");

        try {
            // Stop schedules first so nothing new starts
            drainService.stop();
            relayAgent.stop();
            relayConnection.stop();

            webServerManager.stop();

            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.warn("Executor did not terminate in time, forcing shutdown");
                    executorService.shutdownNow();
                    if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                        logger.error("Executor did not terminate");
                    }
                }
            } catch (InterruptedException e) {
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }

            transmitter.shutdown();

            pendingQueue.persist();
            if (pendingQueue.size() > 0 || pendingQueue.deadLetterCount() > 0) {
                logger.warn("⚠ Stopping with {} pending jobs and {} dead letters",
                        pendingQueue.size(), pendingQueue.deadLetterCount());
            }

            logger.info("Application shut down successfully");
        } catch (Exception e) {
            logger.error("Error during shutdown", e);
        }
    }

    public boolean isShutDown() {
        return shutDown.get();
    }
}
