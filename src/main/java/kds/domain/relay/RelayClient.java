package kds.domain.relay;

import com.google.gson.Gson;
import com.google.gson.JsonSyntaxException;
import kds.common.ELogger;
import kds.dal.RelayConfig;
import kds.domain.relay.dto.AcknowledgeRequest;
import kds.domain.relay.dto.HeartbeatRequest;
import kds.domain.relay.dto.PollJobsResponse;
import kds.domain.relay.dto.PrintJobPayload;
import kds.domain.relay.dto.RegisterRequest;
import kds.domain.relay.dto.RegisterResponse;
import kds.domain.relay.dto.StatusUpdate;
import kds.domain.relay.dto.SubmitResponse;
import org.slf4j.Logger;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JSON-over-HTTP client of the cloud print broker.
 *
 * <p>Every call is a single request. Non-200 answers (204 for the status poll excepted) and transport errors
 * are thrown as {@link RelayException}; the caller decides whether to retry.</p>
 *
 * @since 09/10/2026
 */
@Singleton
public class RelayClient {
    private static final Logger logger = ELogger.RELAY.getLogger();

    private static final int HTTP_OK = 200;
    private static final int HTTP_NO_CONTENT = 204;

    private final HttpClient httpClient;
    private final Gson gson;
    private final String baseUrl;
    private final String apiToken;
    private final String restaurantId;
    private final Duration requestTimeout;
    private final Duration heartbeatTimeout;

    private volatile String sessionId;

    @Inject
    public RelayClient(RelayConfig config, Gson gson) {
        this(config, gson, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.requestTimeoutMs()))
                .build());
    }

    public RelayClient(RelayConfig config, Gson gson, HttpClient httpClient) {
        this.httpClient = httpClient;
        this.gson = gson;
        this.baseUrl = trimTrailingSlash(config.baseUrl());
        this.apiToken = config.apiToken();
        this.restaurantId = config.restaurantId();
        this.requestTimeout = Duration.ofMillis(config.requestTimeoutMs());
        this.heartbeatTimeout = Duration.ofMillis(config.heartbeatTimeoutMs());
    }

    /**
     * Open a broker session. The returned id is sent with every later request.
     */
    public String register(String restaurant, String deviceName) {
        RegisterRequest body = new RegisterRequest(restaurant, deviceName, Instant.now().toString());
        HttpResponse<String> response = execute(post("/restaurants/register", body, requestTimeout));
        RegisterResponse registered = parse(response, RegisterResponse.class);
        if (registered == null || registered.sessionId() == null) {
            throw new RelayException("Broker registration returned no session id", response.statusCode());
        }
        this.sessionId = registered.sessionId();
        logger.info("Registered with relay as {} (session {})", deviceName, sessionId);
        return sessionId;
    }

    /**
     * @return broker job id
     */
    public String submitPrintJob(PrintJobPayload payload) {
        HttpResponse<String> response = execute(post("/print-jobs", payload, requestTimeout));
        requireOk(response, "print job submission");
        SubmitResponse submitted = parse(response, SubmitResponse.class);
        String jobId = submitted == null ? null : submitted.jobId();
        logger.debug("Submitted order {} for printer {} (broker job {})",
                payload.orderNumber(), payload.targetPrinterId(), jobId);
        return jobId;
    }

    public void heartbeat(int pendingOrders, int failedOrders) {
        HeartbeatRequest body = new HeartbeatRequest(Instant.now().toString(), "online", pendingOrders, failedOrders);
        requireOk(execute(post("/heartbeat", body, heartbeatTimeout)), "heartbeat");
    }

    /**
     * @return empty when the broker has nothing new (204)
     */
    public Optional<StatusUpdate> pollStatus() {
        HttpResponse<String> response = execute(get("/status/poll?restaurantId=" + encode(restaurantId)));
        if (response.statusCode() == HTTP_NO_CONTENT) {
            return Optional.empty();
        }
        requireOk(response, "status poll");
        return Optional.ofNullable(parse(response, StatusUpdate.class));
    }

    public List<PrintJobPayload> pollJobs(String printerId) {
        HttpResponse<String> response = execute(get("/orders/poll?printerId=" + encode(printerId)));
        if (response.statusCode() == HTTP_NO_CONTENT) {
            return List.of();
        }
        requireOk(response, "job poll");
        PollJobsResponse jobs = parse(response, PollJobsResponse.class);
        return jobs == null ? List.of() : jobs.ordersOrEmpty();
    }

    /**
     * @param jobIds broker job ids, as received in {@link PrintJobPayload#jobId()}
     */
    public void acknowledge(String printerId, List<String> jobIds) {
        AcknowledgeRequest body = new AcknowledgeRequest(List.copyOf(jobIds), printerId);
        requireOk(execute(post("/orders/acknowledge", body, requestTimeout)), "acknowledge");
    }

    /**
     * @return true when the broker answers its health endpoint with 200
     */
    public boolean health() {
        try {
            return execute(get("/health")).statusCode() == HTTP_OK;
        } catch (RelayException e) {
            logger.debug("Relay health check failed: {}", e.getMessage());
            return false;
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public void clearSession() {
        this.sessionId = null;
    }

    private HttpRequest post(String path, Object body, Duration timeout) {
        return headers(HttpRequest.newBuilder(uri(path)))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(gson.toJson(body), StandardCharsets.UTF_8))
                .build();
    }

    private HttpRequest get(String path) {
        return headers(HttpRequest.newBuilder(uri(path)))
                .timeout(requestTimeout)
                .GET()
                .build();
    }

    private HttpRequest.Builder headers(HttpRequest.Builder builder) {
        builder.header("Accept", "application/json");
        if (apiToken != null && !apiToken.isEmpty()) {
            builder.header("Authorization", "Bearer " + apiToken);
        }
        if (restaurantId != null) {
            builder.header("X-Restaurant-ID", restaurantId);
        }
        String session = sessionId;
        if (session != null) {
            builder.header("X-Session-ID", session);
        }
        return builder;
    }

    private HttpResponse<String> execute(HttpRequest request) {
        try {
            HttpResponse<String> response = httpClient.send(request,
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            logger.trace("{} {} -> {}", request.method(), request.uri().getPath(), response.statusCode());
            return response;
        } catch (IOException e) {
            throw new RelayException("Relay unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelayException("Relay request interrupted", e);
        }
    }

    private static void requireOk(HttpResponse<String> response, String operation) {
        if (response.statusCode() != HTTP_OK) {
            throw new RelayException("Relay " + operation + " failed with HTTP " + response.statusCode(),
                    response.statusCode());
        }
    }

    private <T> T parse(HttpResponse<String> response, Class<T> type) {
        requireOk(response, type.getSimpleName());
        String body = response.body();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return gson.fromJson(body, type);
        } catch (JsonSyntaxException e) {
            throw new RelayException("Malformed relay response: " + e.getMessage(), response.statusCode());
        }
    }

    private URI uri(String path) {
        return URI.create(baseUrl + path);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
