package kds.domain.dispatch;

import kds.common.DaemonThreadFactory;
import kds.dal.DispatchConfig;
import kds.domain.model.DispatchJob;
import kds.domain.model.PrinterTarget;
import kds.domain.transport.ETransmissionFailure;
import kds.domain.transport.TransmissionException;
import kds.domain.transport.TransportRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a single transport call on a worker thread under a hard deadline.
 * <p>When the deadline passes the worker is cancelled with interruption, which tears down the connection
 * of interruptible transports. The caller always gets a definite outcome.</p>
 * @since 08/10/2026
 */
@Singleton
public class TimedTransmitter {
    private static final Logger logger = LoggerFactory.getLogger(TimedTransmitter.class);

    private final TransportRouter router;
    private final ExecutorService workers;
    private final long timeoutMs;

    @Inject
    public TimedTransmitter(TransportRouter router, DispatchConfig config) {
        this(router, Executors.newFixedThreadPool(config.workerThreads(), new DaemonThreadFactory("kds-transmit")),
                config.transmitTimeoutMs());
    }

    public TimedTransmitter(TransportRouter router, ExecutorService workers, long timeoutMs) {
        this.router = router;
        this.workers = workers;
        this.timeoutMs = timeoutMs;
    }

    public TransmissionOutcome transmit(PrinterTarget target, DispatchJob job) {
        long start = System.currentTimeMillis();
        Future<Boolean> future;
        try {
            future = workers.submit(() -> router.send(target, job));
        } catch (Exception e) {
            return TransmissionOutcome.failed(ETransmissionFailure.NETWORK_ERROR,
                    "Transmission rejected: " + e.getMessage(), 0);
        }

        try {
            boolean accepted = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            long duration = System.currentTimeMillis() - start;
            if (accepted) {
                return TransmissionOutcome.delivered(duration);
            }
            return TransmissionOutcome.failed(ETransmissionFailure.NON_SUCCESS_STATUS,
                    "Printer " + target.name() + " rejected the ticket", duration);

        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Transmission to {} timed out after {}ms, cancelled", target.name(), timeoutMs);
            return TransmissionOutcome.failed(ETransmissionFailure.TIMEOUT,
                    "Print timeout after " + timeoutMs + "ms", System.currentTimeMillis() - start);

        } catch (ExecutionException e) {
            long duration = System.currentTimeMillis() - start;
            Throwable cause = e.getCause();
            if (cause instanceof TransmissionException) {
                TransmissionException te = (TransmissionException) cause;
                return TransmissionOutcome.failed(te.getFailure(), te.getMessage(), duration);
            }
            logger.error("Unexpected error sending to {}", target.name(), cause);
            return TransmissionOutcome.failed(ETransmissionFailure.NETWORK_ERROR,
                    cause == null ? "Unknown error" : cause.getMessage(), duration);

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return TransmissionOutcome.failed(ETransmissionFailure.NETWORK_ERROR,
                    "Interrupted while waiting for " + target.name(), System.currentTimeMillis() - start);
        }
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void shutdown() {
        workers.shutdownNow();
    }
}
