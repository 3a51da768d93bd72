package kds.domain.dispatch;

import com.google.gson.Gson;
import kds.common.ETransportType;
import kds.dal.CatalogConfig;
import kds.dal.DispatchConfig;
import kds.dal.InMemoryOrderStore;
import kds.dal.PrinterCatalog;
import kds.dal.RetryConfig;
import kds.domain.assignment.AssignmentResolver;
import kds.domain.audit.AuditEntry;
import kds.domain.audit.DispatchEventBus;
import kds.domain.audit.EAuditOutcome;
import kds.domain.model.Assignment;
import kds.domain.model.DispatchJob;
import kds.domain.model.Order;
import kds.domain.model.OrderItem;
import kds.domain.model.PrinterTarget;
import kds.domain.queue.PendingQueue;
import kds.domain.queue.PendingQueueEntry;
import kds.domain.queue.PendingQueueJournal;
import kds.domain.transport.ETransmissionFailure;
import kds.domain.transport.IPrinterTransport;
import kds.domain.transport.TicketRenderer;
import kds.domain.transport.TransmissionException;
import kds.domain.transport.TransportRouter;
import kds.domain.validation.DispatchValidator;
import kds.domain.validation.EValidationFailure;
import kds.domain.validation.ValidationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for DispatchOrchestrator
 * @since 13/10/2026
 */
@ExtendWith(MockitoExtension.class)
class DispatchOrchestratorTest {

    private static final long TRANSMIT_TIMEOUT_MS = 1000;

    @Mock
    private IPrinterTransport transport;

    @Mock
    private DispatchEventBus eventBus;

    private ExecutorService workers;
    private PrinterCatalog catalog;
    private DispatchValidator validator;
    private InMemoryOrderStore orderStore;
    private PendingQueue pendingQueue;
    private DeliveryLedger ledger;
    private DispatchStatistics statistics;
    private DispatchOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws Exception {
        catalog = new PrinterCatalog(new CatalogConfig("unused.json"), new Gson());
        catalog.replace(
                List.of(PrinterTarget.network("kitchen", "Kitchen", "10.0.0.5", 9100, 2),
                        PrinterTarget.network("bar", "Bar", "10.0.0.6", 9100, 1)),
                List.of(Assignment.forCategory("a-1", "mains", "kitchen", 1, 1L),
                        Assignment.forCategory("a-2", "drinks", "bar", 1, 1L),
                        Assignment.forItem("a-3", "burger", "kitchen", 2, 1L),
                        Assignment.forItem("a-4", "burger", "bar", 1, 1L)));

        lenient().when(transport.isReachable(any())).thenReturn(true);
        lenient().when(transport.send(any(), any())).thenReturn(true);

        TransportRouter router = new TransportRouter(Map.of(ETransportType.NETWORK, transport));
        workers = Executors.newCachedThreadPool();
        TimedTransmitter transmitter = new TimedTransmitter(router, workers, TRANSMIT_TIMEOUT_MS);
        AssignmentResolver resolver = new AssignmentResolver(catalog, catalog);
        validator = new DispatchValidator(resolver, catalog, catalog, router);

        orderStore = new InMemoryOrderStore();
        pendingQueue = new PendingQueue(attempts -> 60_000L,
                new RetryConfig(1000, 0, 0, 3, false, false, null), PendingQueueJournal.disabled());
        ledger = new DeliveryLedger();
        statistics = new DispatchStatistics();

        orchestrator = new DispatchOrchestrator(orderStore, catalog, resolver,
                validator, new TicketRenderer(), transmitter,
                pendingQueue, ledger, statistics, eventBus, new DispatchConfig(1000, 0, 100, 2, 0));
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    private Order storeOrder(String number, OrderItem... items) {
        Order order = new Order("order-" + number, number, "T3", "Ana", "srv-7", false, 0, 1L, List.of(items));
        orderStore.save(order);
        return order;
    }

    private static OrderItem steak() {
        return OrderItem.of("i-1", "steak", "Steak", "mains", 1);
    }

    private static OrderItem beer() {
        return OrderItem.of("i-2", "beer", "Beer", "drinks", 2);
    }

    @Test
    @DisplayName("Should print every printer's share and mark items sent")
    void shouldDeliverToAllPrinters() throws Exception {
        // Given
        OrderItem steak = steak();
        OrderItem beer = beer();
        storeOrder("41", steak, beer);

        // When
        DispatchResult result = orchestrator.dispatch("order-41");

        // Then
        assertThat(result.outcome()).isEqualTo(EDispatchOutcome.ALL_DELIVERED);
        assertThat(result.success()).isTrue();
        assertThat(result.itemsSent()).isEqualTo(2);
        assertThat(result.printerCount()).isEqualTo(2);
        assertThat(result.message()).isEqualTo("2 items sent to kitchen successfully! Printed to 2 printer(s).");
        assertThat(result.perTargetResults()).containsExactly(Map.entry("kitchen", true), Map.entry("bar", true));

        assertThat(steak.isSentToKitchen()).isTrue();
        assertThat(beer.isSentToKitchen()).isTrue();
        assertThat(ledger.stateOf("order-41", "i-1", "kitchen")).contains(EDeliveryState.DELIVERED);
        assertThat(ledger.stateOf("order-41", "i-2", "bar")).contains(EDeliveryState.DELIVERED);
        assertThat(pendingQueue.size()).isZero();
        assertThat(orchestrator.getStatistics().totalOrdersSent()).isEqualTo(1);
        assertThat(orchestrator.getStatistics().totalItemsSent()).isEqualTo(2);
        assertThat(orchestrator.getState("order-41")).isEqualTo(EDispatchState.IDLE);
        verify(transport, times(2)).send(any(), any());
        verify(eventBus, times(2)).post(argThat(e -> e instanceof AuditEntry
                && ((AuditEntry) e).outcome() == EAuditOutcome.DELIVERED));
    }

    @Test
    @DisplayName("Repeating a dispatch should not print anything twice")
    void shouldNotResendSentItems() throws Exception {
        // Given
        storeOrder("41", steak(), beer());
        orchestrator.dispatch("order-41");

        // When
        DispatchResult second = orchestrator.dispatch("order-41");

        // Then
        assertThat(second.outcome()).isEqualTo(EDispatchOutcome.REJECTED);
        assertThat(second.validationFailure()).isEqualTo(EValidationFailure.ALL_ITEMS_SENT);
        assertThat(second.message()).isEqualTo("No new items to send to kitchen. All items have already been sent.");
        verify(transport, times(2)).send(any(), any());
    }

    @Test
    @DisplayName("Only items added after the last dispatch should be sent")
    void shouldSendOnlyNewItems() throws Exception {
        // Given
        OrderItem steak = steak();
        steak.markSentToKitchen();
        storeOrder("43", steak, beer());

        // When
        DispatchResult result = orchestrator.dispatch("order-43");

        // Then
        assertThat(result.itemsSent()).isEqualTo(1);
        assertThat(result.perTargetResults()).containsOnlyKeys("bar");
        verify(transport, never()).send(argThat(t -> t != null && t.id().equals("kitchen")), any());
    }

    @Test
    @DisplayName("Kitchen prints, bar refuses, bar ticket goes to the retry queue")
    void shouldQueueFailedPrinterOnPartialDelivery() throws Exception {
        // Given
        when(transport.send(argThat(t -> t != null && t.id().equals("bar")), any()))
                .thenThrow(new TransmissionException(ETransmissionFailure.NETWORK_ERROR, "Connection refused"));
        OrderItem steak = steak();
        OrderItem beer = beer();
        storeOrder("40", steak, beer);

        // When
        DispatchResult result = orchestrator.dispatch("order-40");

        // Then
        assertThat(result.outcome()).isEqualTo(EDispatchOutcome.PARTIAL);
        assertThat(result.success()).isTrue();
        assertThat(result.message()).isEqualTo("2 items sent to kitchen! Printed to 1 of 2 printers (some prints failed).");
        assertThat(result.perTargetResults()).containsEntry("kitchen", true).containsEntry("bar", false);

        assertThat(steak.isSentToKitchen()).isTrue();
        assertThat(beer.isSentToKitchen()).isTrue();
        assertThat(ledger.stateOf("order-40", "i-1", "kitchen")).contains(EDeliveryState.DELIVERED);
        assertThat(ledger.stateOf("order-40", "i-2", "bar")).contains(EDeliveryState.FAILED);

        List<PendingQueueEntry> queued = pendingQueue.listPending();
        assertThat(queued).hasSize(1);
        DispatchJob job = queued.get(0).job();
        assertThat(job.targetId()).isEqualTo("bar");
        assertThat(job.itemIds()).containsExactly("i-2");
        assertThat(job.content()).contains("2x Beer", "Order: 40");
        assertThat(queued.get(0).lastFailure()).isEqualTo(ETransmissionFailure.NETWORK_ERROR);

        assertThat(statistics.getFailureCount("bar")).isEqualTo(1);
        assertThat(statistics.getSuccessCount("kitchen")).isEqualTo(1);
        verify(eventBus).post(argThat(e -> e instanceof AuditEntry
                && ((AuditEntry) e).outcome() == EAuditOutcome.QUEUED
                && "bar".equals(((AuditEntry) e).targetId())));
    }

    @Test
    @DisplayName("Order #42: unassigned item blocks, then an unreachable bar ends in a partial delivery")
    void order42ShouldDeliverPartiallyWhenBarIsUnreachable() throws Exception {
        // Given
        when(transport.isReachable(argThat(t -> t != null && t.id().equals("bar")))).thenReturn(false);
        when(transport.send(argThat(t -> t != null && t.id().equals("bar")), any()))
                .thenThrow(new TransmissionException(ETransmissionFailure.NETWORK_ERROR, "Connection refused"));
        OrderItem a = OrderItem.of("A", "burger", "Burger", "mains", 1);
        OrderItem b = OrderItem.of("B", "steak", "Steak", "mains", 1);
        OrderItem c = OrderItem.of("C", "cake", "Cheesecake", "desserts", 1);
        Order order = storeOrder("42", a, b, c);

        ValidationResult unassigned = validator.validate(order);
        catalog.saveAssignment(Assignment.forItem("a-5", "cake", "kitchen", 1, 2L));
        ValidationResult offline = validator.validate(order);

        // When
        DispatchResult result = orchestrator.dispatch("order-42");

        // Then
        assertThat(unassigned.getFailure()).isEqualTo(EValidationFailure.MISSING_ASSIGNMENTS);
        assertThat(unassigned.getDetails()).containsEntry("unassignedItems", List.of("Cheesecake"));
        assertThat(offline.getFailure()).isEqualTo(EValidationFailure.PRINTERS_OFFLINE);

        assertThat(result.success()).isTrue();
        assertThat(result.outcome()).isEqualTo(EDispatchOutcome.PARTIAL);
        assertThat(result.itemsSent()).isEqualTo(3);
        assertThat(result.printerCount()).isEqualTo(1);
        assertThat(result.perTargetResults()).containsExactly(Map.entry("kitchen", true), Map.entry("bar", false));
        assertThat(a.isSentToKitchen() && b.isSentToKitchen() && c.isSentToKitchen()).isTrue();

        assertThat(pendingQueue.listPending()).singleElement().satisfies(entry -> {
            assertThat(entry.job().targetId()).isEqualTo("bar");
            assertThat(entry.job().itemIds()).containsExactly("A");
        });
        verify(transport).send(argThat(t -> t != null && t.id().equals("kitchen")),
                argThat(job -> job != null && job.itemIds().equals(List.of("A", "B", "C"))));
    }

    @Test
    @DisplayName("A disabled printer should not block the order, its ticket is queued")
    void shouldQueueTicketForDisabledPrinter() throws Exception {
        // Given
        catalog.replace(
                List.of(PrinterTarget.network("kitchen", "Kitchen", "10.0.0.5", 9100, 2),
                        PrinterTarget.network("bar", "Bar", "10.0.0.6", 9100, 1).withActive(false)),
                catalog.listAllAssignments());
        storeOrder("39", steak(), beer());

        // When
        DispatchResult result = orchestrator.dispatch("order-39");

        // Then
        assertThat(result.outcome()).isEqualTo(EDispatchOutcome.PARTIAL);
        assertThat(pendingQueue.listPending()).singleElement()
                .satisfies(entry -> assertThat(entry.lastError()).isEqualTo("Printer Bar is disabled"));
        verify(transport, never()).send(argThat(t -> t != null && t.id().equals("bar")), any());
    }

    @Test
    @DisplayName("An item assigned to two printers should print on both and count once")
    void shouldFanOutItemToSeveralPrinters() throws Exception {
        // Given
        storeOrder("44", OrderItem.of("i-9", "burger", "Burger", "mains", 1));

        // When
        DispatchResult result = orchestrator.dispatch("order-44");

        // Then
        assertThat(result.itemsSent()).isEqualTo(1);
        assertThat(result.printerCount()).isEqualTo(2);
        assertThat(result.perTargetResults()).containsOnlyKeys("kitchen", "bar");
        assertThat(ledger.isFullyDelivered("order-44", "i-9")).isTrue();
        assertThat(statistics.snapshot().totalItemsSent()).isEqualTo(1);
    }

    @Test
    @DisplayName("All printers failing should keep items sent, queue every job and skip totals")
    void shouldQueueEverythingWhenAllPrintsFail() throws Exception {
        // Given
        when(transport.send(any(), any()))
                .thenThrow(new TransmissionException(ETransmissionFailure.NETWORK_ERROR, "Connection refused"));
        OrderItem steak = steak();
        storeOrder("45", steak, beer());

        // When
        DispatchResult result = orchestrator.dispatch("order-45");

        // Then
        assertThat(result.outcome()).isEqualTo(EDispatchOutcome.ALL_FAILED);
        assertThat(result.success()).isFalse();
        assertThat(result.message())
                .isEqualTo("2 items marked as sent to kitchen, but all prints failed. Check printer connections.");
        assertThat(steak.isSentToKitchen()).isTrue();
        assertThat(pendingQueue.size()).isEqualTo(2);
        assertThat(statistics.snapshot().totalOrdersSent()).isZero();
    }

    @Test
    @DisplayName("A hanging printer should be cut off at the transmit timeout")
    void shouldBoundHangingPrinter() throws Exception {
        // Given
        when(transport.send(argThat(t -> t != null && t.id().equals("bar")), any())).thenAnswer(invocation -> {
            Thread.sleep(10_000);
            return true;
        });
        storeOrder("46", steak(), beer());

        // When
        long start = System.currentTimeMillis();
        DispatchResult result = orchestrator.dispatch("order-46");
        long elapsed = System.currentTimeMillis() - start;

        // Then
        assertThat(elapsed).isLessThan(5_000);
        assertThat(result.outcome()).isEqualTo(EDispatchOutcome.PARTIAL);
        PendingQueueEntry entry = pendingQueue.listPending().get(0);
        assertThat(entry.lastFailure()).isEqualTo(ETransmissionFailure.TIMEOUT);
        assertThat(entry.lastError()).isEqualTo("Print timeout after " + TRANSMIT_TIMEOUT_MS + "ms");
    }

    @Test
    @DisplayName("Validation failure should leave the order untouched")
    void shouldNotMarkItemsWhenValidationFails() throws Exception {
        // Given
        OrderItem cake = OrderItem.of("i-5", "cake", "Cheesecake", "desserts", 1);
        storeOrder("47", steak(), cake);

        // When
        DispatchResult result = orchestrator.dispatch("order-47");

        // Then
        assertThat(result.outcome()).isEqualTo(EDispatchOutcome.REJECTED);
        assertThat(result.validationFailure()).isEqualTo(EValidationFailure.MISSING_ASSIGNMENTS);
        assertThat(cake.isSentToKitchen()).isFalse();
        assertThat(ledger.snapshot("order-47")).isEmpty();
        verify(transport, never()).send(any(), any());
    }

    @Test
    @DisplayName("Should reject empty and unknown orders")
    void shouldRejectEmptyAndUnknownOrders() {
        // Given
        storeOrder("48");

        // When
        DispatchResult empty = orchestrator.dispatch("order-48");
        DispatchResult unknown = orchestrator.dispatch("missing");

        // Then
        assertThat(empty.validationFailure()).isEqualTo(EValidationFailure.NO_ITEMS);
        assertThat(empty.message()).isEqualTo("Order has no items to send to kitchen.");
        assertThat(unknown.outcome()).isEqualTo(EDispatchOutcome.REJECTED);
        assertThat(unknown.message()).isEqualTo("Order missing not found");
    }

    @Test
    @DisplayName("A second dispatch of the same order should be rejected while the first is running")
    void shouldRejectConcurrentDispatchOfSameOrder() throws Exception {
        // Given
        CountDownLatch printing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(transport.send(any(), any())).thenAnswer(invocation -> {
            printing.countDown();
            return release.await(5, TimeUnit.SECONDS);
        });
        storeOrder("49", steak());

        CompletableFuture<DispatchResult> first = CompletableFuture.supplyAsync(() -> orchestrator.dispatch("order-49"));
        assertThat(printing.await(5, TimeUnit.SECONDS)).isTrue();

        // When
        EDispatchState stateWhilePrinting = orchestrator.getState("order-49");
        DispatchResult second = orchestrator.dispatch("order-49");
        release.countDown();

        // Then
        assertThat(stateWhilePrinting).isEqualTo(EDispatchState.DISPATCHING);
        assertThat(second.outcome()).isEqualTo(EDispatchOutcome.REJECTED);
        assertThat(second.message()).isEqualTo("Order is already being sent to kitchen");
        assertThat(first.get(5, TimeUnit.SECONDS).outcome()).isEqualTo(EDispatchOutcome.ALL_DELIVERED);
        verify(transport, times(1)).send(any(), any());
    }

    @Test
    @DisplayName("Resending a stored order should keep the items already sent")
    void saveOrderShouldKeepSentFlags() throws Exception {
        // Given
        storeOrder("51", steak());
        orchestrator.dispatch("order-51");
        Order resent = new Order("order-51", "51", "T3", "Ana", "srv-7", false, 0, 1L, List.of(steak(), beer()));

        // When
        boolean stored = orchestrator.saveOrder(resent);
        DispatchResult result = orchestrator.dispatch("order-51");

        // Then
        assertThat(stored).isTrue();
        assertThat(result.itemsSent()).isEqualTo(1);
        assertThat(result.perTargetResults()).containsOnlyKeys("bar");
        verify(transport, times(1)).send(argThat(t -> t != null && t.id().equals("kitchen")), any());
    }

    @Test
    @DisplayName("An order update should be refused while the order is being dispatched")
    void saveOrderShouldBeRefusedDuringDispatch() throws Exception {
        // Given
        CountDownLatch printing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(transport.send(any(), any())).thenAnswer(invocation -> {
            printing.countDown();
            return release.await(5, TimeUnit.SECONDS);
        });
        storeOrder("52", steak());
        CompletableFuture<DispatchResult> running =
                CompletableFuture.supplyAsync(() -> orchestrator.dispatch("order-52"));
        assertThat(printing.await(5, TimeUnit.SECONDS)).isTrue();

        // When
        boolean stored = orchestrator.saveOrder(
                new Order("order-52", "52", "T3", "Ana", "srv-7", false, 0, 1L, List.of(steak(), beer())));
        release.countDown();

        // Then
        assertThat(stored).isFalse();
        assertThat(running.get(5, TimeUnit.SECONDS).outcome()).isEqualTo(EDispatchOutcome.ALL_DELIVERED);
        assertThat(orderStore.findById("order-52").orElseThrow().getItems()).extracting(OrderItem::getId)
                .containsExactly("i-1");
        assertThat(orchestrator.saveOrder(
                new Order("order-52", "52", "T3", "Ana", "srv-7", false, 0, 1L, List.of(steak(), beer())))).isTrue();
    }

    @Test
    @DisplayName("Reset should clear the counters")
    void shouldResetStatistics() {
        // Given
        storeOrder("50", steak());
        orchestrator.dispatch("order-50");

        // When
        orchestrator.resetStatistics();

        // Then
        DispatchStatistics.Snapshot snapshot = orchestrator.getStatistics();
        assertThat(snapshot.totalOrdersSent()).isZero();
        assertThat(snapshot.successCounts()).isEmpty();
        assertThat(snapshot.lastSuccessfulSend()).isNull();
    }
}
