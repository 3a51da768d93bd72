package kds.domain.transport;

import kds.dal.DispatchConfig;
import kds.domain.model.DispatchJob;
import kds.domain.model.PrinterTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Simulated printer - used for targets configured with transport NONE.
 * Keeps the dispatch flow working without hardware; individual printers can be switched offline for demos.
 * @since 05/10/2026
 */
@Singleton
public class SimulatedPrinterTransport implements IPrinterTransport {
    private static final Logger logger = LoggerFactory.getLogger(SimulatedPrinterTransport.class);

    private final int printDelayMs;
    private final Set<String> offlinePrinters = ConcurrentHashMap.newKeySet();
    private final List<String> printedJobs = new CopyOnWriteArrayList<>();

    @Inject
    public SimulatedPrinterTransport(DispatchConfig config) {
        this.printDelayMs = config.simulatedDelayMs();
    }

    @Override
    public boolean send(PrinterTarget target, DispatchJob job) throws TransmissionException {
        if (offlinePrinters.contains(target.id())) {
            throw new TransmissionException(ETransmissionFailure.NETWORK_ERROR,
                    "Simulated printer " + target.name() + " is offline");
        }

        logger.info("[SIMULATED] {} <- order {} ({} items)", target.name(), job.order().orderNumber(),
                job.order().items().size());
        logger.debug("[SIMULATED] Ticket:\n{}", job.content());

        // Simulate print delay
        try {
            Thread.sleep(printDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransmissionException(ETransmissionFailure.TIMEOUT, "Simulated print interrupted", e);
        }

        printedJobs.add(job.jobId());
        return true;
    }

    @Override
    public boolean isReachable(PrinterTarget target) {
        return !offlinePrinters.contains(target.id());
    }

    public void setOffline(String printerId, boolean offline) {
        if (offline) {
            offlinePrinters.add(printerId);
        } else {
            offlinePrinters.remove(printerId);
        }
        logger.info("[SIMULATED] Printer {} is now {}", printerId, offline ? "OFFLINE" : "ONLINE");
    }

    public List<String> getPrintedJobs() {
        return List.copyOf(printedJobs);
    }
}
