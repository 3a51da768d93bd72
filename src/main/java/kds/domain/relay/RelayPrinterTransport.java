package kds.domain.relay;

import kds.common.ELogger;
import kds.dal.RelayConfig;
import kds.domain.model.DispatchJob;
import kds.domain.model.JobItem;
import kds.domain.model.OrderSnapshot;
import kds.domain.model.PrinterTarget;
import kds.domain.relay.dto.OrderData;
import kds.domain.relay.dto.PrintJobItem;
import kds.domain.relay.dto.PrintJobPayload;
import kds.domain.transport.ETransmissionFailure;
import kds.domain.transport.IPrinterTransport;
import kds.domain.transport.TransmissionException;
import org.slf4j.Logger;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * CLOUD transport: hands the ticket to the relay broker, a printer-side agent prints it.
 * Broker acceptance counts as delivery; later printer-side failures come back through the status poll.
 * @since 09/10/2026
 */
@Singleton
public class RelayPrinterTransport implements IPrinterTransport {
    private static final Logger logger = ELogger.RELAY.getLogger();

    static final int URGENT_PRIORITY = 1;
    static final int DEFAULT_PRIORITY = 5;

    private final RelayClient client;
    private final RelayConnection connection;
    private final String restaurantId;

    @Inject
    public RelayPrinterTransport(RelayClient client, RelayConnection connection, RelayConfig config) {
        this.client = client;
        this.connection = connection;
        this.restaurantId = config.restaurantId();
    }

    @Override
    public boolean send(PrinterTarget target, DispatchJob job) throws TransmissionException {
        if (!connection.isConnected()) {
            throw new TransmissionException(ETransmissionFailure.NETWORK_ERROR,
                    "Relay not connected (" + connection.getState() + ")");
        }
        try {
            String brokerJobId = client.submitPrintJob(toPayload(target, job));
            connection.awaitConfirmation(job);
            logger.info("Order {} submitted to relay for {} (broker job {})",
                    job.order().orderNumber(), target.name(), brokerJobId);
            return true;
        } catch (RelayException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new TransmissionException(ETransmissionFailure.TIMEOUT, e.getMessage(), e);
            }
            ETransmissionFailure failure = e.isNetworkError()
                    ? ETransmissionFailure.NETWORK_ERROR
                    : ETransmissionFailure.NON_SUCCESS_STATUS;
            throw new TransmissionException(failure, e.getMessage(), e);
        }
    }

    @Override
    public boolean isReachable(PrinterTarget target) {
        return connection.isConnected();
    }

    PrintJobPayload toPayload(PrinterTarget target, DispatchJob job) {
        OrderSnapshot order = job.order();
        List<PrintJobItem> items = order.items().stream()
                .map(RelayPrinterTransport::toItem)
                .collect(Collectors.toList());
        OrderData orderData = new OrderData(order.tableId(), order.customerName(), order.serverId(),
                Instant.ofEpochMilli(order.orderTime()).toString(), order.urgent(), order.priority());

        return new PrintJobPayload(null, order.orderId(), order.orderNumber(), restaurantId, target.id(), items,
                orderData, job.content(), Instant.now().toString(), relayPriority(order));
    }

    static int relayPriority(OrderSnapshot order) {
        if (order.urgent()) {
            return URGENT_PRIORITY;
        }
        return order.priority() > 0 ? order.priority() : DEFAULT_PRIORITY;
    }

    private static PrintJobItem toItem(JobItem item) {
        return new PrintJobItem(item.id(), item.name(), item.quantity(), item.variant(), item.specialInstructions(),
                item.notes());
    }
}
