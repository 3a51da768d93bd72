package kds.domain.transport;

import kds.common.ETransportType;
import kds.domain.model.DispatchJob;
import kds.domain.model.PrinterTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Picks the transport for a printer based on its configured transport type
 * @since 05/10/2026
 */
public class TransportRouter {
    private static final Logger logger = LoggerFactory.getLogger(TransportRouter.class);

    private final Map<ETransportType, IPrinterTransport> transports;

    public TransportRouter(Map<ETransportType, IPrinterTransport> transports) {
        this.transports = new EnumMap<>(transports);
    }

    public boolean send(PrinterTarget target, DispatchJob job) throws TransmissionException {
        return transportFor(target).send(target, job);
    }

    public boolean isReachable(PrinterTarget target) {
        IPrinterTransport transport = transports.get(target.transport());
        if (transport == null) {
            logger.warn("No transport registered for {} (printer {})", target.transport(), target.name());
            return false;
        }
        try {
            return transport.isReachable(target);
        } catch (Exception e) {
            logger.warn("Reachability check for {} failed: {}", target.name(), e.getMessage());
            return false;
        }
    }

    private IPrinterTransport transportFor(PrinterTarget target) throws TransmissionException {
        IPrinterTransport transport = transports.get(target.transport());
        if (transport == null) {
            throw new TransmissionException(ETransmissionFailure.NETWORK_ERROR,
                    "No transport registered for " + target.transport());
        }
        return transport;
    }
}
