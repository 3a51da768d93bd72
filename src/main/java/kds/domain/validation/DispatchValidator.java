package kds.domain.validation;

import kds.dal.IAssignmentStore;
import kds.dal.IPrinterTargetStore;
import kds.domain.assignment.AssignmentResolver;
import kds.domain.model.Order;
import kds.domain.model.OrderItem;
import kds.domain.model.PrinterTarget;
import kds.domain.transport.TransportRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Pre-flight check run before an order is sent to the kitchen.
 *
 * <p>Checks run in a fixed order and stop at the first failure: items present, unsent items present,
 * assignment coverage, printer reachability, configuration sanity. Nothing here touches the order; the same
 * order can be validated any number of times.</p>
 *
 * <p>{@link #validate(Order)} is the full operator check. {@link #validateForDispatch(Order)} stops after
 * coverage and service readiness: an offline or misconfigured printer does not block a dispatch, its ticket
 * fails on transmission and waits in the retry queue.</p>
 *
 * @since 04/10/2026
 */
@Singleton
public class DispatchValidator {
    private static final Logger logger = LoggerFactory.getLogger(DispatchValidator.class);

    private final AssignmentResolver resolver;
    private final IPrinterTargetStore printerStore;
    private final IAssignmentStore assignmentStore;
    private final TransportRouter transportRouter;

    @Inject
    public DispatchValidator(AssignmentResolver resolver, IPrinterTargetStore printerStore,
                             IAssignmentStore assignmentStore, TransportRouter transportRouter) {
        this.resolver = resolver;
        this.printerStore = printerStore;
        this.assignmentStore = assignmentStore;
        this.transportRouter = transportRouter;
    }

    public ValidationResult validate(Order order) {
        return check(order, true);
    }

    public ValidationResult validateForDispatch(Order order) {
        return check(order, false);
    }

    private ValidationResult check(Order order, boolean checkPrinters) {
        try {
            return runChecks(order, checkPrinters);
        } catch (Exception e) {
            logger.error("Validation of order {} failed unexpectedly", order == null ? null : order.getId(), e);
            return ValidationResult.failure(EValidationFailure.SYSTEM_ERROR,
                    "Unexpected error while validating order: " + e.getMessage());
        }
    }

    private ValidationResult runChecks(Order order, boolean checkPrinters) {
        if (order.getItems().isEmpty()) {
            return ValidationResult.failure(EValidationFailure.NO_ITEMS,
                    "Order has no items. Add items before sending to kitchen.");
        }

        List<OrderItem> newItems = order.getUnsentItems();
        if (newItems.isEmpty()) {
            return ValidationResult.failure(EValidationFailure.ALL_ITEMS_SENT,
                    "All items have already been sent to the kitchen.");
        }

        // Assignment coverage
        List<String> unassigned = new ArrayList<>();
        Set<String> requiredPrinters = new LinkedHashSet<>();
        for (OrderItem item : newItems) {
            List<String> targets = resolver.resolveTargets(item.getMenuItemId(), item.getCategoryId());
            if (targets.isEmpty()) {
                unassigned.add(item.getMenuItemName());
            }
            requiredPrinters.addAll(targets);
        }

        if (!unassigned.isEmpty()) {
            StringBuilder sb = new StringBuilder("The following items have no printer assignments:\n");
            for (String name : unassigned) {
                sb.append("• ").append(name).append('\n');
            }
            sb.append("Assign these items or their categories to a printer before sending.");

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("unassignedItems", List.copyOf(unassigned));
            return ValidationResult.failure(EValidationFailure.MISSING_ASSIGNMENTS, sb.toString(), details);
        }

        // Reachability
        if (requiredPrinters.isEmpty()) {
            return ValidationResult.failure(EValidationFailure.NO_PRINTERS_FOUND,
                    "No printers found for the items in this order.");
        }

        if (checkPrinters) {
            Optional<ValidationResult> offline = checkReachability(requiredPrinters);
            if (offline.isPresent()) {
                return offline.get();
            }
        }

        // Configuration sanity
        if (!printerStore.isInitialized() || !assignmentStore.isInitialized()) {
            return ValidationResult.failure(EValidationFailure.SERVICE_NOT_READY,
                    "Printer services are not ready. Please wait and try again.");
        }

        if (!checkPrinters) {
            return ready(order, newItems, requiredPrinters);
        }

        if (printerStore.listActive().isEmpty()) {
            return ValidationResult.failure(EValidationFailure.NO_PRINTERS_CONFIGURED,
                    "No active printers are configured.");
        }

        List<String> issues = new ArrayList<>();
        for (String printerId : requiredPrinters) {
            PrinterTarget target = printerStore.findById(printerId).orElseThrow();
            if (!target.active()) {
                issues.add(target.name() + " is disabled");
            } else if (!target.hasValidAddress()) {
                issues.add(target.name() + " has an invalid address");
            }
        }

        if (!issues.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("issues", List.copyOf(issues));
            return ValidationResult.failure(EValidationFailure.CONFIGURATION_ISSUES,
                    "Printer configuration issues: " + String.join(", ", issues), details);
        }

        return ready(order, newItems, requiredPrinters);
    }

    private Optional<ValidationResult> checkReachability(Set<String> requiredPrinters) {
        List<String> offlineIds = new ArrayList<>();
        List<String> offlineLabels = new ArrayList<>();
        for (String printerId : requiredPrinters) {
            Optional<PrinterTarget> target = printerStore.findById(printerId);
            if (target.isEmpty()) {
                offlineIds.add(printerId);
                offlineLabels.add("Unknown Printer (" + printerId + ")");
            } else if (!transportRouter.isReachable(target.get())) {
                offlineIds.add(printerId);
                offlineLabels.add(target.get().name() + " (" + target.get().getAddress() + ")");
            }
        }

        if (offlineIds.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder sb = new StringBuilder("The following printers are offline:\n");
        for (String label : offlineLabels) {
            sb.append("• ").append(label).append('\n');
        }
        sb.append("Check printer power and network connections.");

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("offlinePrinters", List.copyOf(offlineIds));
        return Optional.of(ValidationResult.failure(EValidationFailure.PRINTERS_OFFLINE, sb.toString(), details));
    }

    private static ValidationResult ready(Order order, List<OrderItem> newItems, Set<String> requiredPrinters) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("totalItems", order.getItems().size());
        details.put("newItems", newItems.size());
        details.put("requiredPrinters", requiredPrinters.size());
        details.put("orderNumber", order.getNumber());

        return ValidationResult.success(
                String.format("Ready to send %d items to %d printer(s)", newItems.size(), requiredPrinters.size()),
                details);
    }
}
