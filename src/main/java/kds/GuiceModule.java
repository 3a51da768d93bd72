package kds;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import kds.common.DaemonThreadFactory;
import kds.common.ETransportType;
import kds.dal.CatalogConfig;
import kds.dal.ConfigurationService;
import kds.dal.DispatchConfig;
import kds.dal.IAssignmentStore;
import kds.dal.IOrderStore;
import kds.dal.IPrinterTargetStore;
import kds.dal.InMemoryOrderStore;
import kds.dal.PrinterCatalog;
import kds.dal.RelayConfig;
import kds.dal.RetryConfig;
import kds.dal.ServerConfig;
import kds.domain.audit.IAuditSink;
import kds.domain.audit.LoggingAuditSink;
import kds.domain.queue.ExponentialBackoffRetryPolicy;
import kds.domain.queue.PendingQueueJournal;
import kds.domain.queue.RetryPolicy;
import kds.domain.relay.RelayPrinterTransport;
import kds.domain.transport.IPrinterTransport;
import kds.domain.transport.NetworkPrinterTransport;
import kds.domain.transport.SimulatedPrinterTransport;
import kds.domain.transport.TransportRouter;

import javax.inject.Singleton;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * @since 11/10/2026
 */
public class GuiceModule extends AbstractModule {
    private final ConfigurationService configService;

    public GuiceModule(ConfigurationService configService) {
        this.configService = configService;
    }

    @Override
    protected void configure() {
        bind(ServerConfig.class).toInstance(configService.getServerConfiguration());
        bind(CatalogConfig.class).toInstance(configService.getCatalogConfiguration());
        bind(DispatchConfig.class).toInstance(configService.getDispatchConfiguration());
        bind(RetryConfig.class).toInstance(configService.getRetryConfiguration());
        bind(RelayConfig.class).toInstance(configService.getRelayConfiguration());

        // One catalog serves both printer and assignment lookups
        bind(IPrinterTargetStore.class).to(PrinterCatalog.class);
        bind(IAssignmentStore.class).to(PrinterCatalog.class);
        bind(IOrderStore.class).to(InMemoryOrderStore.class);
        bind(IAuditSink.class).to(LoggingAuditSink.class);
    }

    @Provides
    @Singleton
    public Gson provideGson() {
        return new GsonBuilder().setPrettyPrinting().serializeNulls().create();
    }

    @Provides
    @Singleton
    public RetryPolicy provideRetryPolicy(RetryConfig config) {
        return new ExponentialBackoffRetryPolicy(config.baseDelayMs(), config.maxDelayMs(), config.jitter());
    }

    @Provides
    @Singleton
    public PendingQueueJournal provideJournal(RetryConfig config, Gson gson) {
        if (!config.journalEnabled() || config.journalPath() == null || config.journalPath().isBlank()) {
            return PendingQueueJournal.disabled();
        }
        return new PendingQueueJournal(Paths.get(config.journalPath()), gson);
    }

    @Provides
    @Singleton
    public TransportRouter provideTransportRouter(NetworkPrinterTransport network, RelayPrinterTransport cloud,
                                                  SimulatedPrinterTransport simulated) {
        Map<ETransportType, IPrinterTransport> transports = new EnumMap<>(ETransportType.class);
        transports.put(ETransportType.NETWORK, network);
        transports.put(ETransportType.CLOUD, cloud);
        transports.put(ETransportType.NONE, simulated);
        return new TransportRouter(transports);
    }

    @Provides
    @Singleton
    public ScheduledExecutorService provideScheduler(ServerConfig config) {
        return Executors.newScheduledThreadPool(config.threadPoolSize(), new DaemonThreadFactory("kds-scheduler"));
    }
}
