package kds.domain.dispatch;

import kds.common.DispatchConstants;
import kds.dal.DispatchConfig;
import kds.dal.IOrderStore;
import kds.dal.IPrinterTargetStore;
import kds.domain.assignment.AssignmentResolver;
import kds.domain.audit.AuditEntry;
import kds.domain.audit.DispatchEventBus;
import kds.domain.audit.EAuditOutcome;
import kds.domain.model.DispatchJob;
import kds.domain.model.Order;
import kds.domain.model.OrderItem;
import kds.domain.model.OrderSnapshot;
import kds.domain.model.PrinterTarget;
import kds.domain.queue.PendingQueue;
import kds.domain.transport.ETransmissionFailure;
import kds.domain.transport.TicketRenderer;
import kds.domain.validation.DispatchValidator;
import kds.domain.validation.EValidationFailure;
import kds.domain.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Sends the new items of an order to the kitchen printers.
 *
 * <p>Flow per order: detect unsent items, validate, split items by printer, mark items sent, transmit to each
 * printer in turn, aggregate. Items are marked sent (and the order saved) before the first transmission, so a
 * repeated request never prints them twice; failed printers are recovered by the retry queue, not by calling
 * dispatch again.</p>
 *
 * <p>Only one dispatch per order id runs at a time. A second request for the same order is rejected immediately,
 * other orders are not affected. Order updates take the same per-order token, so an update never interleaves with
 * the read-mark-save of a dispatch.</p>
 *
 * @since 08/10/2026
 */
@Singleton
public class DispatchOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(DispatchOrchestrator.class);

    private final IOrderStore orderStore;
    private final IPrinterTargetStore printerStore;
    private final AssignmentResolver resolver;
    private final DispatchValidator validator;
    private final TicketRenderer renderer;
    private final TimedTransmitter transmitter;
    private final PendingQueue pendingQueue;
    private final DeliveryLedger ledger;
    private final DispatchStatistics statistics;
    private final DispatchEventBus eventBus;
    private final int interTargetDelayMs;

    private final Map<String, EDispatchState> inFlight = new ConcurrentHashMap<>();

    @Inject
    public DispatchOrchestrator(IOrderStore orderStore, IPrinterTargetStore printerStore, AssignmentResolver resolver,
                                DispatchValidator validator, TicketRenderer renderer, TimedTransmitter transmitter,
                                PendingQueue pendingQueue, DeliveryLedger ledger, DispatchStatistics statistics,
                                DispatchEventBus eventBus, DispatchConfig config) {
        this.orderStore = orderStore;
        this.printerStore = printerStore;
        this.resolver = resolver;
        this.validator = validator;
        this.renderer = renderer;
        this.transmitter = transmitter;
        this.pendingQueue = pendingQueue;
        this.ledger = ledger;
        this.statistics = statistics;
        this.eventBus = eventBus;
        this.interTargetDelayMs = config.interTargetDelayMs();
    }

    public DispatchResult dispatch(String orderId) {
        if (orderId == null) {
            return DispatchResult.rejected("Order id is required", null);
        }
        return guarded(orderId, orderId, () -> {
            Optional<Order> order = orderStore.findById(orderId);
            if (order.isEmpty()) {
                return DispatchResult.rejected("Order " + orderId + " not found", null);
            }
            return runDispatch(order.get());
        });
    }

    public DispatchResult dispatch(Order order) {
        return guarded(order.getId(), order.getNumber(), () -> runDispatch(order));
    }

    /**
     * Store an order handed over by the order-management side. An item already sent to the kitchen stays sent
     * even when the caller resends it with the flag cleared.
     *
     * @return false when a dispatch of the same order is running; nothing is stored then
     */
    public boolean saveOrder(Order order) {
        String orderId = order.getId();
        if (inFlight.putIfAbsent(orderId, EDispatchState.IDLE) != null) {
            logger.warn("Order {} is being sent to kitchen, update rejected", order.getNumber());
            return false;
        }
        try {
            orderStore.findById(orderId).ifPresent(order::keepSentFlags);
            orderStore.save(order);
            logger.debug("Stored order {} with {} items ({} unsent)", order.getNumber(), order.getItems().size(),
                    order.getUnsentItems().size());
            return true;
        } finally {
            inFlight.remove(orderId);
        }
    }

    /**
     * Run under the order's in-flight token; the store is read and written only while the token is held
     */
    private DispatchResult guarded(String orderId, String orderNumber, Supplier<DispatchResult> body) {
        if (inFlight.putIfAbsent(orderId, EDispatchState.IDLE) != null) {
            logger.warn("Order {} is already being sent to kitchen, request rejected", orderNumber);
            return DispatchResult.rejected("Order is already being sent to kitchen", null);
        }

        try {
            DispatchResult result = body.get();
            logger.info("Order {}: {} ({})", orderNumber, result.message(), result.outcome());
            return result;
        } catch (Exception e) {
            logger.error("Error sending order {} to kitchen", orderNumber, e);
            return DispatchResult.error("Error sending to kitchen: " + e.getMessage());
        } finally {
            inFlight.remove(orderId);
        }
    }

    /**
     * @return current step of an in-flight dispatch, IDLE when none is running
     */
    public EDispatchState getState(String orderId) {
        return inFlight.getOrDefault(orderId, EDispatchState.IDLE);
    }

    public DispatchStatistics.Snapshot getStatistics() {
        return statistics.snapshot();
    }

    public void resetStatistics() {
        statistics.reset();
        logger.info("Dispatch statistics reset");
    }

    private DispatchResult runDispatch(Order order) {
        // Detecting
        transition(order, EDispatchState.DETECTING);
        List<OrderItem> newItems = order.getUnsentItems();
        if (newItems.isEmpty()) {
            if (order.getItems().isEmpty()) {
                return DispatchResult.rejected("Order has no items to send to kitchen.", EValidationFailure.NO_ITEMS);
            }
            return DispatchResult.rejected("No new items to send to kitchen. All items have already been sent.",
                    EValidationFailure.ALL_ITEMS_SENT);
        }
        logger.debug("Order {}: {} new items detected", order.getNumber(), newItems.size());

        // Validating: coverage and readiness only, an offline printer is handled as a failed transmission
        transition(order, EDispatchState.VALIDATING);
        ValidationResult validation = validator.validateForDispatch(order);
        if (!validation.isSuccess()) {
            logger.warn("Order {} failed validation: {}", order.getNumber(), validation.getFailure());
            return DispatchResult.rejected(validation.getMessage(), validation.getFailure());
        }

        // Segregating
        transition(order, EDispatchState.SEGREGATING);
        Map<String, List<OrderItem>> itemsByPrinter = segregate(newItems);
        if (itemsByPrinter.isEmpty()) {
            return DispatchResult.rejected("No printer assignments found for the new items.",
                    EValidationFailure.MISSING_ASSIGNMENTS);
        }

        // Marking sent, strictly before any transmission
        transition(order, EDispatchState.MARKING_SENT);
        markSent(order, newItems, itemsByPrinter);

        // Dispatching
        transition(order, EDispatchState.DISPATCHING);
        Map<String, Boolean> perTarget = transmitAll(order, itemsByPrinter);

        // Aggregating
        transition(order, EDispatchState.AGGREGATING);
        DispatchResult result = DispatchResult.completed(newItems.size(), perTarget);
        if (result.printerCount() > 0) {
            statistics.recordDispatch(newItems.size());
        }

        transition(order, EDispatchState.COMPLETE);
        return result;
    }

    /**
     * Group items by printer in first-seen order; an item with several printers appears under each of them
     */
    private Map<String, List<OrderItem>> segregate(List<OrderItem> items) {
        Map<String, List<OrderItem>> itemsByPrinter = new LinkedHashMap<>();
        for (OrderItem item : items) {
            for (String printerId : resolver.resolveTargets(item.getMenuItemId(), item.getCategoryId())) {
                itemsByPrinter.computeIfAbsent(printerId, k -> new ArrayList<>()).add(item);
            }
        }
        return itemsByPrinter;
    }

    private void markSent(Order order, List<OrderItem> newItems, Map<String, List<OrderItem>> itemsByPrinter) {
        for (OrderItem item : newItems) {
            item.markSentToKitchen();
        }
        itemsByPrinter.forEach((printerId, items) ->
                items.forEach(item -> ledger.commit(order.getId(), item.getId(), printerId)));
        orderStore.save(order);
        logger.debug("Order {}: {} items marked as sent", order.getNumber(), newItems.size());
    }

    private Map<String, Boolean> transmitAll(Order order, Map<String, List<OrderItem>> itemsByPrinter) {
        Map<String, Boolean> results = new LinkedHashMap<>();
        String actor = order.getServerId() == null ? DispatchConstants.SYSTEM_ACTOR : order.getServerId();

        boolean first = true;
        for (Map.Entry<String, List<OrderItem>> entry : itemsByPrinter.entrySet()) {
            if (!first) {
                pauseBetweenPrinters();
            }
            first = false;

            String printerId = entry.getKey();
            OrderSnapshot snapshot = OrderSnapshot.of(order, entry.getValue());
            Optional<PrinterTarget> target = printerStore.findById(printerId);

            DispatchJob job;
            TransmissionOutcome outcome;
            if (target.isPresent() && target.get().active()) {
                job = DispatchJob.create(printerId, snapshot, renderer.render(snapshot, target.get().name()));
                outcome = transmitter.transmit(target.get(), job);
            } else if (target.isPresent()) {
                job = DispatchJob.create(printerId, snapshot, renderer.render(snapshot, target.get().name()));
                outcome = TransmissionOutcome.failed(ETransmissionFailure.NETWORK_ERROR,
                        "Printer " + target.get().name() + " is disabled", 0);
            } else {
                job = DispatchJob.create(printerId, snapshot, renderer.render(snapshot, printerId));
                outcome = TransmissionOutcome.failed(ETransmissionFailure.NETWORK_ERROR,
                        "Printer configuration not found: " + printerId, 0);
            }

            recordOutcome(job, outcome, actor);
            results.put(printerId, outcome.delivered());
        }
        return results;
    }

    private void recordOutcome(DispatchJob job, TransmissionOutcome outcome, String actor) {
        if (outcome.delivered()) {
            ledger.markDelivered(job.orderId(), job.itemIds(), job.targetId());
            statistics.recordSuccess(job.targetId());
            eventBus.post(AuditEntry.of(job.orderId(), job.order().orderNumber(), job.itemNames(), job.targetId(),
                    EAuditOutcome.DELIVERED, actor, "printed in " + outcome.durationMs() + "ms"));
            return;
        }

        logger.warn("Printer {} failed for order {}: {} - {}", job.targetId(), job.order().orderNumber(),
                outcome.failure(), outcome.message());
        ledger.markFailed(job.orderId(), job.itemIds(), job.targetId());
        statistics.recordFailure(job.targetId());
        pendingQueue.enqueue(job, outcome.failure(), outcome.message());
        eventBus.post(AuditEntry.of(job.orderId(), job.order().orderNumber(), job.itemNames(), job.targetId(),
                EAuditOutcome.QUEUED, actor, outcome.failure() + ": " + outcome.message()));
    }

    private void pauseBetweenPrinters() {
        if (interTargetDelayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(interTargetDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Inter-printer delay interrupted");
        }
    }

    private void transition(Order order, EDispatchState state) {
        inFlight.put(order.getId(), state);
        logger.trace("Order {} -> {}", order.getNumber(), state);
    }
}
