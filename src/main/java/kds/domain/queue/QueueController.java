package kds.domain.queue;

import io.javalin.http.Context;
import kds.domain.ApiResponse;

import javax.inject.Inject;
import javax.inject.Singleton;

import static io.javalin.apibuilder.ApiBuilder.delete;
import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;

/**
 * Operator endpoints of the retry queue
 * @since 11/10/2026
 */
@Singleton
public class QueueController {
    private final PendingQueue queue;
    private final RetryDrainService drainService;

    @Inject
    public QueueController(PendingQueue queue, RetryDrainService drainService) {
        this.queue = queue;
        this.drainService = drainService;
    }

    public void registerRoutes() {
        path("/api/queue", () -> {
            get(ctx -> ctx.json(ApiResponse.success(queue.listPending())));
            post("/drain", this::drainNow);
            path("/dead-letters", () -> {
                get(ctx -> ctx.json(ApiResponse.success(queue.listDeadLetters())));
                post("/{jobId}/requeue", this::requeue);
                delete("/{jobId}", this::discard);
            });
        });
    }

    /**
     * Replays every pending job now unless {@code force=false} is given
     */
    private void drainNow(Context ctx) {
        boolean force = !"false".equalsIgnoreCase(ctx.queryParam("force"));
        DrainReport report = drainService.drain(force);
        if (report.skipped()) {
            ctx.status(409).json(new ApiResponse<>(false, "A drain is already running", report));
            return;
        }
        ctx.json(ApiResponse.success(report));
    }

    private void requeue(Context ctx) {
        String jobId = ctx.pathParam("jobId");
        if (!queue.requeueDeadLetter(jobId)) {
            ctx.status(404).json(ApiResponse.error("Dead letter not found: " + jobId));
            return;
        }
        ctx.json(ApiResponse.success("Dead letter requeued", jobId));
    }

    private void discard(Context ctx) {
        String jobId = ctx.pathParam("jobId");
        if (!queue.discardDeadLetter(jobId)) {
            ctx.status(404).json(ApiResponse.error("Dead letter not found: " + jobId));
            return;
        }
        ctx.json(ApiResponse.success("Dead letter discarded", jobId));
    }
}
