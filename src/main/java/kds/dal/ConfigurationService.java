package kds.dal;

import kds.common.DispatchConstants;
import kds.common.ServerConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main configuration service - entry point for all configuration needs
 * @since 03/10/2026
 */
public class ConfigurationService {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationService.class);

    private final ConfigurationLoader loader;
    private ServerConfig serverConfig;
    private CatalogConfig catalogConfig;
    private DispatchConfig dispatchConfig;
    private RetryConfig retryConfig;
    private RelayConfig relayConfig;

    public ConfigurationService() throws ConfigurationException {
        this(new ConfigurationLoader());
    }

    public ConfigurationService(ConfigurationLoader loader) throws ConfigurationException {
        this.loader = loader;
        loadAll();
    }

    private void loadAll() throws ConfigurationException {
        this.serverConfig = loadServerConfiguration();
        this.catalogConfig = loadCatalogConfiguration();
        this.dispatchConfig = loadDispatchConfiguration();
        this.retryConfig = loadRetryConfiguration();
        this.relayConfig = loadRelayConfiguration();
    }

    private ServerConfig loadServerConfiguration() throws ConfigurationException {
        int port = loader.getInt("server.port", ServerConstants.SERVER_PORT);
        String host = loader.getString("server.host", ServerConstants.SERVER_IP);
        int threadPoolSize = loader.getInt("server.thread.pool", ServerConstants.THREAD_POOL_SIZE);

        String modeStr = loader.getString("server.startup.mode", "LENIENT");
        StartupMode startupMode;
        try {
            startupMode = StartupMode.valueOf(modeStr.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid startup mode '{}', using LENIENT", modeStr);
            startupMode = StartupMode.LENIENT;
        }

        ServerConfig config = new ServerConfig(port, host, threadPoolSize, startupMode);
        config.validate();
        return config;
    }

    private CatalogConfig loadCatalogConfiguration() throws ConfigurationException {
        CatalogConfig config = new CatalogConfig(loader.getString("catalog.path", ServerConstants.DEFAULT_CATALOG_PATH));
        config.validate();
        return config;
    }

    private DispatchConfig loadDispatchConfiguration() throws ConfigurationException {
        DispatchConfig config = new DispatchConfig(
                loader.getInt("dispatch.transmit.timeout", DispatchConstants.DEFAULT_TRANSMIT_TIMEOUT),
                loader.getInt("dispatch.inter.target.delay", DispatchConstants.DEFAULT_INTER_TARGET_DELAY_MS),
                loader.getInt("dispatch.connect.timeout", DispatchConstants.DEFAULT_CONNECT_TIMEOUT),
                loader.getInt("dispatch.worker.threads", DispatchConstants.DEFAULT_WORKER_THREADS),
                loader.getInt("dispatch.simulated.delay", DispatchConstants.DEFAULT_SIMULATED_DELAY_MS));
        config.validate();
        logger.info("Dispatch: timeout={}ms, inter-target delay={}ms, workers={}",
                config.transmitTimeoutMs(), config.interTargetDelayMs(), config.workerThreads());
        return config;
    }

    private RetryConfig loadRetryConfiguration() throws ConfigurationException {
        RetryConfig config = new RetryConfig(
                loader.getLong("retry.drain.interval", DispatchConstants.DEFAULT_DRAIN_INTERVAL),
                loader.getLong("retry.backoff.base", DispatchConstants.DEFAULT_BACKOFF_BASE),
                loader.getLong("retry.backoff.max", DispatchConstants.DEFAULT_BACKOFF_MAX),
                loader.getInt("retry.max.attempts", DispatchConstants.DEFAULT_MAX_ATTEMPTS),
                loader.getBoolean("retry.backoff.jitter", true),
                loader.getBoolean("retry.journal.enabled", false),
                loader.getString("retry.journal.path", ServerConstants.DEFAULT_JOURNAL_PATH));
        config.validate();
        return config;
    }

    private RelayConfig loadRelayConfiguration() throws ConfigurationException {
        if (!loader.getBoolean("relay.enabled", false)) {
            logger.info("Cloud relay disabled");
            return RelayConfig.disabled();
        }

        RelayConfig config = new RelayConfig(
                true,
                loader.getRequiredString("relay.base.url"),
                loader.getString("relay.api.token", ""),
                loader.getRequiredString("relay.restaurant.id"),
                loader.getString("relay.device.name", "kitchen-dispatch"),
                loader.getInt("relay.request.timeout", DispatchConstants.DEFAULT_RELAY_REQUEST_TIMEOUT),
                loader.getInt("relay.heartbeat.interval", DispatchConstants.DEFAULT_HEARTBEAT_INTERVAL),
                loader.getInt("relay.heartbeat.timeout", DispatchConstants.DEFAULT_HEARTBEAT_TIMEOUT),
                loader.getInt("relay.status.poll.interval", DispatchConstants.DEFAULT_STATUS_POLL_INTERVAL),
                loader.getInt("relay.heartbeat.max.retries", DispatchConstants.DEFAULT_MAX_HEARTBEAT_RETRIES),
                loader.getInt("relay.reconnect.step", DispatchConstants.DEFAULT_RECONNECT_STEP),
                loader.getInt("relay.reconnect.max.delay", DispatchConstants.DEFAULT_MAX_RECONNECT_DELAY),
                loader.getInt("relay.reconnect.max.attempts", DispatchConstants.DEFAULT_MAX_RECONNECT_ATTEMPTS),
                loader.getBoolean("relay.agent.enabled", false),
                loader.getString("relay.agent.printer.id", null),
                loader.getInt("relay.agent.poll.interval", DispatchConstants.DEFAULT_AGENT_POLL_INTERVAL));
        config.validate();
        logger.info("Configured cloud relay: {}", config);
        return config;
    }

    public ServerConfig getServerConfiguration() {
        return serverConfig;
    }

    public CatalogConfig getCatalogConfiguration() {
        return catalogConfig;
    }

    public DispatchConfig getDispatchConfiguration() {
        return dispatchConfig;
    }

    public RetryConfig getRetryConfiguration() {
        return retryConfig;
    }

    public RelayConfig getRelayConfiguration() {
        return relayConfig;
    }

    public void reload() throws ConfigurationException {
        logger.info("Reloading configuration...");
        loader.reload();
        loadAll();
        logger.info("Configuration reloaded successfully");
        logger.info("Server: {}", serverConfig);
        logger.info("Relay: {}", relayConfig);
    }
}
