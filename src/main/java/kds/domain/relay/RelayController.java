package kds.domain.relay;

import io.javalin.http.Context;
import kds.domain.ApiResponse;

import javax.inject.Inject;
import javax.inject.Singleton;

import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;

/**
 * @since 11/10/2026
 */
@Singleton
public class RelayController {
    private final RelayConnection connection;
    private final RelayPollingAgent agent;

    @Inject
    public RelayController(RelayConnection connection, RelayPollingAgent agent) {
        this.connection = connection;
        this.agent = agent;
    }

    public void registerRoutes() {
        path("/api/relay", () -> {
            get("/status", this::getStatus);
            post("/reinitialize", this::reinitialize);
        });
    }

    private void getStatus(Context ctx) {
        var status = connection.getStatus();
        status.put("agentRunning", agent.isRunning());
        ctx.json(ApiResponse.success(status));
    }

    private void reinitialize(Context ctx) {
        if (!connection.isEnabled()) {
            ctx.status(409).json(ApiResponse.error("Relay is disabled"));
            return;
        }
        boolean connected = connection.reinitialize();
        if (connected) {
            ctx.json(ApiResponse.success("Relay reconnected", connection.getState()));
        } else {
            ctx.status(503).json(new ApiResponse<>(false, "Relay still unavailable", connection.getState()));
        }
    }
}
