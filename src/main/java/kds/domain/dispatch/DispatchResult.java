package kds.domain.dispatch;

import kds.domain.validation.EValidationFailure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Answer to "send this order to the kitchen"
 *
 * @param success true when at least one printer received its ticket
 * @param itemsSent number of items newly marked as sent (fan-out does not multiply it)
 * @param printerCount printers that received their ticket
 * @param totalTargets printers the order was split across
 * @param perTargetResults printer id to delivery result, in dispatch order
 * @param validationFailure set only for results rejected by validation
 * @since 08/10/2026
 */
public record DispatchResult(boolean success, String message, int itemsSent, int printerCount, int totalTargets,
                             Map<String, Boolean> perTargetResults, EDispatchOutcome outcome,
                             EValidationFailure validationFailure) {

    public DispatchResult {
        perTargetResults = perTargetResults == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(perTargetResults));
    }

    public static DispatchResult rejected(String message, EValidationFailure validationFailure) {
        return new DispatchResult(false, message, 0, 0, 0, null, EDispatchOutcome.REJECTED, validationFailure);
    }

    public static DispatchResult error(String message) {
        return new DispatchResult(false, message, 0, 0, 0, null, EDispatchOutcome.ERROR, null);
    }

    public static DispatchResult completed(int itemsSent, Map<String, Boolean> perTargetResults) {
        int total = perTargetResults.size();
        int delivered = (int) perTargetResults.values().stream().filter(Boolean::booleanValue).count();

        if (delivered == total) {
            return new DispatchResult(true,
                    String.format("%d items sent to kitchen successfully! Printed to %d printer(s).", itemsSent, delivered),
                    itemsSent, delivered, total, perTargetResults, EDispatchOutcome.ALL_DELIVERED, null);
        }
        if (delivered > 0) {
            return new DispatchResult(true,
                    String.format("%d items sent to kitchen! Printed to %d of %d printers (some prints failed).",
                            itemsSent, delivered, total),
                    itemsSent, delivered, total, perTargetResults, EDispatchOutcome.PARTIAL, null);
        }
        return new DispatchResult(false,
                String.format("%d items marked as sent to kitchen, but all prints failed. Check printer connections.",
                        itemsSent),
                itemsSent, 0, total, perTargetResults, EDispatchOutcome.ALL_FAILED, null);
    }
}
