package kds.domain.orchestration;

import kds.dal.PrinterCatalog;
import kds.dal.RelayConfig;
import kds.dal.RetryConfig;
import kds.dal.StartupMode;
import kds.domain.ServiceInitializationResult;
import kds.domain.StartupException;
import kds.domain.queue.PendingQueue;
import kds.domain.queue.RetryDrainService;
import kds.domain.relay.RelayConnection;
import kds.domain.relay.RelayPollingAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Orchestrates service initialization and the background schedules
 * @since 11/10/2026
 */
@Singleton
public class ServiceOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(ServiceOrchestrator.class);

    static final String CATALOG = "catalog";
    static final String RETRY_QUEUE = "retryQueue";
    static final String RELAY = "relay";

    private final PrinterCatalog catalog;
    private final PendingQueue pendingQueue;
    private final RetryDrainService drainService;
    private final RelayConnection relayConnection;
    private final RelayPollingAgent relayAgent;
    private final RetryConfig retryConfig;
    private final RelayConfig relayConfig;

    private final Map<String, ServiceInitializationResult> initializationResults = new LinkedHashMap<>();

    @Inject
    public ServiceOrchestrator(PrinterCatalog catalog, PendingQueue pendingQueue, RetryDrainService drainService,
                               RelayConnection relayConnection, RelayPollingAgent relayAgent, RetryConfig retryConfig,
                               RelayConfig relayConfig) {
        this.catalog = catalog;
        this.pendingQueue = pendingQueue;
        this.drainService = drainService;
        this.relayConnection = relayConnection;
        this.relayAgent = relayAgent;
        this.retryConfig = retryConfig;
        this.relayConfig = relayConfig;
    }

    /**
     * Initialize all services and track results
     * @return results in initialization order
     */
    public synchronized List<ServiceInitializationResult> initializeAllServices() {
        List<ServiceInitializationResult> results = new ArrayList<>();

        ServiceInitializationResult catalogResult = initializeCatalog();
        results.add(catalogResult);
        initializationResults.put(CATALOG, catalogResult);

        ServiceInitializationResult queueResult = initializeRetryQueue();
        results.add(queueResult);
        initializationResults.put(RETRY_QUEUE, queueResult);

        ServiceInitializationResult relayResult = initializeRelay();
        results.add(relayResult);
        initializationResults.put(RELAY, relayResult);

        return results;
    }

    private ServiceInitializationResult initializeCatalog() {
        logger.info("Loading printer catalog...");
        long startTime = System.currentTimeMillis();

        try {
            catalog.load();
            long duration = System.currentTimeMillis() - startTime;
            int active = catalog.listActive().size();
            if (active == 0) {
                logger.warn("⚠ Printer catalog loaded in {}ms but has no active printers", duration);
            } else {
                logger.info("✓ Printer catalog loaded in {}ms: {} active printers, {} assignments",
                        duration, active, catalog.listActiveAssignments().size());
            }
            return ServiceInitializationResult.success("Printer Catalog", duration);

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.error("✗ Printer catalog failed to load after {}ms: {}", duration, e.getMessage());
            logger.debug("Catalog load error details", e);
            return ServiceInitializationResult.failure("Printer Catalog", e, duration);
        }
    }

    private ServiceInitializationResult initializeRetryQueue() {
        logger.info("Initializing retry queue...");
        long startTime = System.currentTimeMillis();

        try {
            if (!retryConfig.journalEnabled()) {
                long duration = System.currentTimeMillis() - startTime;
                logger.info("✓ Retry queue ready in {}ms (in-memory, journal disabled)", duration);
                return ServiceInitializationResult.success("Retry Queue (In-Memory)", duration);
            }
            int restored = pendingQueue.restore();
            long duration = System.currentTimeMillis() - startTime;
            logger.info("✓ Retry queue ready in {}ms, {} entries restored from {}", duration, restored,
                    retryConfig.journalPath());
            return ServiceInitializationResult.success("Retry Queue", duration);

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.error("✗ Retry queue initialization failed after {}ms: {}", duration, e.getMessage());
            logger.debug("Retry queue error details", e);
            return ServiceInitializationResult.failure("Retry Queue", e, duration);
        }
    }

    private ServiceInitializationResult initializeRelay() {
        long startTime = System.currentTimeMillis();
        if (!relayConfig.enabled()) {
            logger.info("Cloud relay disabled, CLOUD printers will be reported offline");
            return ServiceInitializationResult.success("Relay (Disabled)", 0);
        }

        logger.info("Connecting to cloud relay...");
        try {
            boolean connected = relayConnection.connect();
            long duration = System.currentTimeMillis() - startTime;
            if (connected) {
                return ServiceInitializationResult.success("Relay", duration);
            }
            logger.error("✗ Cloud relay unavailable after {}ms, reconnect will be attempted in background", duration);
            return ServiceInitializationResult.failure("Relay", "Registration with relay failed", duration);

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.error("✗ Cloud relay initialization failed after {}ms: {}", duration, e.getMessage());
            return ServiceInitializationResult.failure("Relay", e, duration);
        }
    }

    /**
     * Evaluate if startup requirements are met based on mode
     * @throws StartupException if requirements not met
     */
    public void evaluateStartupRequirements(StartupMode mode, List<ServiceInitializationResult> results)
            throws StartupException {
        long successfulServices = results.stream().filter(ServiceInitializationResult::isSuccess).count();
        long totalServices = results.size();

        logger.info("Service initialization complete: {}/{} services successful", successfulServices, totalServices);

        switch (mode) {
            case STRICT:
                if (successfulServices != totalServices) {
                    String message = String.format(
                            "STRICT mode requires all services to initialize. Only %d/%d services initialized successfully.",
                            successfulServices, totalServices);
                    throw new StartupException(message, mode, results);
                }
                logger.info("✓ STRICT mode requirement met: all services initialized");
                break;

            case LENIENT:
                if (successfulServices == 0) {
                    throw new StartupException(
                            "LENIENT mode requires at least one service to initialize. All services failed to initialize.",
                            mode, results);
                }
                if (successfulServices < totalServices) {
                    logger.warn("⚠ LENIENT mode: {}/{} services initialized (some services unavailable)",
                            successfulServices, totalServices);
                } else {
                    logger.info("✓ LENIENT mode requirement met: all services initialized");
                }
                break;

            case PERMISSIVE:
                if (successfulServices == 0) {
                    logger.warn("⚠ PERMISSIVE mode: No services initialized - running in degraded mode");
                } else if (successfulServices < totalServices) {
                    logger.info("⚠ PERMISSIVE mode: {}/{} services initialized", successfulServices, totalServices);
                } else {
                    logger.info("✓ PERMISSIVE mode: all services initialized");
                }
                break;
        }
    }

    /**
     * Start the background schedules. The relay schedule starts even after a failed
     * initialization; its reconnect loop takes over from there.
     */
    public void startMonitoring(ScheduledExecutorService executorService) {
        drainService.start(executorService);

        if (relayConfig.enabled()) {
            relayConnection.start(executorService);
            relayAgent.start(executorService);
        } else {
            logger.info("Relay schedules skipped (relay disabled)");
        }
    }

    public void logStartupSummary(List<ServiceInitializationResult> results, int serverPort, String serverHost) {
        logger.info("========================================");
        logger.info("Startup Complete - Application Status:");
        logger.info("========================================");

        for (ServiceInitializationResult result : results) {
            logger.info(result.toString());
        }

        logger.info("Retry queue: {} pending, {} dead letters", pendingQueue.size(), pendingQueue.deadLetterCount());
        logger.info("Web Server: RUNNING on http://{}:{}/api", serverHost, serverPort);
        logger.info("========================================");
    }

    public synchronized Map<String, ServiceInitializationResult> getInitializationResults() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(initializationResults));
    }
}
