package kds.domain;

import kds.dal.ServerConfig;
import kds.dal.StartupMode;
import kds.domain.audit.AuditLogEventHandler;
import kds.domain.audit.DispatchEventBus;
import kds.domain.orchestration.ServiceOrchestrator;
import kds.domain.orchestration.ShutdownManager;
import kds.domain.orchestration.WebServerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Application lifecycle: service initialization, background schedules, web server and shutdown
 * @since 11/10/2026
 */
@Singleton
public class IntegratedController {
    private static final Logger logger = LoggerFactory.getLogger(IntegratedController.class);

    private final ServerConfig serverConfig;
    private final ServiceOrchestrator serviceOrchestrator;
    private final WebServerManager webServerManager;
    private final ShutdownManager shutdownManager;
    private final ScheduledExecutorService executorService;

    @Inject
    public IntegratedController(ServerConfig serverConfig, ServiceOrchestrator serviceOrchestrator,
                                WebServerManager webServerManager, ShutdownManager shutdownManager,
                                ScheduledExecutorService executorService, DispatchEventBus eventBus,
                                AuditLogEventHandler auditHandler) {
        this.serverConfig = serverConfig;
        this.serviceOrchestrator = serviceOrchestrator;
        this.webServerManager = webServerManager;
        this.shutdownManager = shutdownManager;
        this.executorService = executorService;

        eventBus.register(auditHandler);

        logger.info("IntegratedController initialized with startup mode: {}", serverConfig.startupMode());
    }

    /**
     * Start with the startup mode from configuration
     * @throws StartupException if startup requirements are not met
     */
    public void start() throws StartupException {
        start(serverConfig.startupMode());
    }

    public void start(StartupMode mode) throws StartupException {
        logger.info("========================================");
        logger.info("Starting Kitchen Dispatch");
        logger.info("Startup Mode: {}", mode);
        logger.info("========================================");

        try {
            // Step 1: Initialize catalog, retry queue and relay
            List<ServiceInitializationResult> results = serviceOrchestrator.initializeAllServices();

            // Step 2: Evaluate startup success based on mode
            serviceOrchestrator.evaluateStartupRequirements(mode, results);

            // Step 3: Retry drain, relay heartbeat/status poll, relay agent
            serviceOrchestrator.startMonitoring(executorService);

            // Step 4: Start web server
            webServerManager.start();

            // Step 5: Register shutdown hook
            shutdownManager.registerShutdownHook();

            serviceOrchestrator.logStartupSummary(results, webServerManager.getPort(), serverConfig.host());

        } catch (StartupException e) {
            logger.error("Startup failed: {}", e.getMessage());
            shutdownManager.shutdown();
            throw e;
        } catch (Exception e) {
            logger.error("Unexpected error during startup", e);
            shutdownManager.shutdown();
            throw new StartupException("Unexpected startup failure: " + e.getMessage(), mode,
                    new ArrayList<>(serviceOrchestrator.getInitializationResults().values()));
        }
    }

    public void stop() {
        shutdownManager.shutdown();
    }

    public Map<String, ServiceInitializationResult> getInitializationResults() {
        return serviceOrchestrator.getInitializationResults();
    }

    public int getPort() {
        return webServerManager.getPort();
    }
}
