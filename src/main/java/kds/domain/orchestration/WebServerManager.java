package kds.domain.orchestration;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.json.JsonMapper;
import kds.dal.IPrinterTargetStore;
import kds.dal.ServerConfig;
import kds.domain.ApiResponse;
import kds.domain.dispatch.DispatchController;
import kds.domain.queue.PendingQueue;
import kds.domain.queue.QueueController;
import kds.domain.relay.RelayConnection;
import kds.domain.relay.RelayController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.javalin.apibuilder.ApiBuilder.get;

/**
 * Manages web server (Javalin) configuration and lifecycle
 * @since 11/10/2026
 */
@Singleton
public class WebServerManager {
    private static final Logger logger = LoggerFactory.getLogger(WebServerManager.class);

    private final ServerConfig serverConfig;
    private final Gson gson;
    private final DispatchController dispatchController;
    private final QueueController queueController;
    private final RelayController relayController;
    private final ServiceOrchestrator serviceOrchestrator;
    private final IPrinterTargetStore printerStore;
    private final PendingQueue pendingQueue;
    private final RelayConnection relayConnection;

    private Javalin javalinApp;

    @Inject
    public WebServerManager(ServerConfig serverConfig, Gson gson, DispatchController dispatchController,
                            QueueController queueController, RelayController relayController,
                            ServiceOrchestrator serviceOrchestrator, IPrinterTargetStore printerStore,
                            PendingQueue pendingQueue, RelayConnection relayConnection) {
        this.serverConfig = serverConfig;
        this.gson = gson;
        this.dispatchController = dispatchController;
        this.queueController = queueController;
        this.relayController = relayController;
        this.serviceOrchestrator = serviceOrchestrator;
        this.printerStore = printerStore;
        this.pendingQueue = pendingQueue;
        this.relayConnection = relayConnection;
    }

    public synchronized void start() {
        logger.info("Starting web server on {}:{}...", serverConfig.host(), serverConfig.port());
        javalinApp = createJavalinApp().start(serverConfig.host(), serverConfig.port());
        logger.info("✓ Web server started successfully on port {}", javalinApp.port());
    }

    public synchronized void stop() {
        if (javalinApp != null) {
            javalinApp.stop();
            javalinApp = null;
        }
    }

    /**
     * @return bound port, -1 when not running
     */
    public synchronized int getPort() {
        return javalinApp == null ? -1 : javalinApp.port();
    }

    Javalin createJavalinApp() {
        Javalin app = Javalin.create(config -> {
            config.jsonMapper(createGsonMapper());
            config.showJavalinBanner = false;

            config.bundledPlugins.enableCors(cors -> cors.addRule(corsRule -> {
                corsRule.anyHost();
                corsRule.allowCredentials = false;
            }));

            config.router.apiBuilder(() -> {
                get("/api/health", this::health);
                dispatchController.registerRoutes();
                queueController.registerRoutes();
                relayController.registerRoutes();
            });
        });

        app.exception(Exception.class, (exception, ctx) -> {
            logger.error("Unhandled exception on {} {}", ctx.method(), ctx.path(), exception);
            ctx.status(500).json(ApiResponse.error("Internal server error: " + exception.getMessage()));
        });

        return app;
    }

    private void health(Context ctx) {
        Map<String, Object> health = new LinkedHashMap<>();
        boolean catalogReady = printerStore.isInitialized();
        health.put("catalogLoaded", catalogReady);
        health.put("activePrinters", printerStore.listActive().size());
        health.put("pendingJobs", pendingQueue.size());
        health.put("deadLetters", pendingQueue.deadLetterCount());
        health.put("relay", relayConnection.isEnabled() ? relayConnection.getState().name() : "DISABLED");
        health.put("services", serviceOrchestrator.getInitializationResults());

        if (catalogReady) {
            ctx.json(ApiResponse.success("Kitchen dispatch is healthy", health));
        } else {
            ctx.status(503).json(new ApiResponse<>(false, "Printer catalog not loaded", health));
        }
    }

    private JsonMapper createGsonMapper() {
        return new JsonMapper() {
            @Override
            public String toJsonString(Object obj, Type type) {
                return gson.toJson(obj, type);
            }

            @Override
            public <T> T fromJsonString(String json, Type targetType) {
                return gson.fromJson(json, targetType);
            }
        };
    }
}
