package kds.domain.dispatch;

import io.javalin.http.Context;
import kds.dal.IOrderStore;
import kds.dal.IPrinterTargetStore;
import kds.domain.ApiResponse;
import kds.domain.assignment.AssignmentResolver;
import kds.domain.model.Order;
import kds.domain.model.PrinterTarget;
import kds.domain.validation.DispatchValidator;
import kds.domain.validation.ValidationResult;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;
import static io.javalin.apibuilder.ApiBuilder.put;

/**
 * REST API for orders, dispatch and printer routing
 * @since 11/10/2026
 */
@Singleton
public class DispatchController {

    private final IOrderStore orderStore;
    private final IPrinterTargetStore printerStore;
    private final AssignmentResolver resolver;
    private final DispatchValidator validator;
    private final DispatchOrchestrator orchestrator;
    private final DeliveryLedger ledger;

    @Inject
    public DispatchController(IOrderStore orderStore, IPrinterTargetStore printerStore, AssignmentResolver resolver,
                              DispatchValidator validator, DispatchOrchestrator orchestrator, DeliveryLedger ledger) {
        this.orderStore = orderStore;
        this.printerStore = printerStore;
        this.resolver = resolver;
        this.validator = validator;
        this.orchestrator = orchestrator;
        this.ledger = ledger;
    }

    /**
     * Register all REST API routes
     */
    public void registerRoutes() {
        path("/api", () -> {
            path("/orders/{orderId}", () -> {
                put(this::saveOrder);
                get(this::getOrder);
                get("/state", this::getDispatchState);
                post("/validate", this::validateOrder);
                post("/dispatch", this::dispatchOrder);
            });

            path("/dispatch", () -> {
                get("/statistics", this::getStatistics);
                post("/statistics/reset", this::resetStatistics);
                get("/ledger/{orderId}", this::getLedger);
            });

            path("/printers", () -> {
                get(this::listPrinters);
                get("/{id}/targets", this::previewTargets);
            });
        });
    }

    private void saveOrder(Context ctx) {
        String orderId = ctx.pathParam("orderId");
        Order order = ctx.bodyAsClass(Order.class);
        if (order == null) {
            ctx.status(400).json(ApiResponse.error("Invalid order"));
            return;
        }
        if (order.getId() == null || !order.getId().equals(orderId)) {
            ctx.status(400).json(ApiResponse.error("Order id in body must match path"));
            return;
        }
        if (!orchestrator.saveOrder(order)) {
            ctx.status(409).json(ApiResponse.error("Order is being sent to kitchen, try again"));
            return;
        }
        ctx.json(ApiResponse.success("Order stored", order));
    }

    private void getOrder(Context ctx) {
        Optional<Order> order = orderStore.findById(ctx.pathParam("orderId"));
        if (order.isEmpty()) {
            ctx.status(404).json(ApiResponse.error("Order not found"));
            return;
        }
        ctx.json(ApiResponse.success(order.get()));
    }

    private void getDispatchState(Context ctx) {
        ctx.json(ApiResponse.success(orchestrator.getState(ctx.pathParam("orderId"))));
    }

    private void validateOrder(Context ctx) {
        Optional<Order> order = orderStore.findById(ctx.pathParam("orderId"));
        if (order.isEmpty()) {
            ctx.status(404).json(ApiResponse.error("Order not found"));
            return;
        }
        ValidationResult result = validator.validate(order.get());
        ctx.json(new ApiResponse<>(result.isSuccess(), result.getMessage(), result));
    }

    private void dispatchOrder(Context ctx) {
        String orderId = ctx.pathParam("orderId");
        if (orderStore.findById(orderId).isEmpty()) {
            ctx.status(404).json(ApiResponse.error("Order not found"));
            return;
        }

        DispatchResult result = orchestrator.dispatch(orderId);
        switch (result.outcome()) {
            case REJECTED:
                ctx.status(409);
                break;
            case ERROR:
                ctx.status(500);
                break;
            default:
                ctx.status(200);
                break;
        }
        ctx.json(new ApiResponse<>(result.success(), result.message(), result));
    }

    private void getStatistics(Context ctx) {
        ctx.json(ApiResponse.success(orchestrator.getStatistics()));
    }

    private void resetStatistics(Context ctx) {
        orchestrator.resetStatistics();
        ctx.json(ApiResponse.success("Statistics reset", orchestrator.getStatistics()));
    }

    private void getLedger(Context ctx) {
        ctx.json(ApiResponse.success(ledger.snapshot(ctx.pathParam("orderId"))));
    }

    private void listPrinters(Context ctx) {
        List<PrinterTarget> printers = printerStore.listAll();
        ctx.json(ApiResponse.success(printers));
    }

    /**
     * Which printers an item would go to, and whether printer {id} is one of them
     */
    private void previewTargets(Context ctx) {
        String printerId = ctx.pathParam("id");
        if (printerStore.findById(printerId).isEmpty()) {
            ctx.status(404).json(ApiResponse.error("Printer not found: " + printerId));
            return;
        }
        String menuItemId = ctx.queryParam("menuItemId");
        String categoryId = ctx.queryParam("categoryId");
        if (menuItemId == null && categoryId == null) {
            ctx.status(400).json(ApiResponse.error("menuItemId or categoryId is required"));
            return;
        }

        List<String> targets = resolver.resolveTargets(menuItemId, categoryId);
        Map<String, Object> preview = new LinkedHashMap<>();
        preview.put("printerId", printerId);
        preview.put("menuItemId", menuItemId);
        preview.put("categoryId", categoryId);
        preview.put("targets", targets);
        preview.put("routedHere", targets.contains(printerId));
        ctx.json(ApiResponse.success(preview));
    }
}
