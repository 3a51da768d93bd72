package kds.domain.transport;

import kds.domain.model.DispatchJob;
import kds.domain.model.PrinterTarget;

/**
 * Delivers a rendered ticket to one printer, exactly one attempt per call.
 * Retrying is up to the caller.
 * @since 05/10/2026
 */
public interface IPrinterTransport {

    /**
     * @return true when the printer (or broker) accepted the ticket
     * @throws TransmissionException when the attempt could not be completed
     */
    boolean send(PrinterTarget target, DispatchJob job) throws TransmissionException;

    /**
     * Cheap live check used by validation. Must not print anything.
     */
    boolean isReachable(PrinterTarget target);
}
