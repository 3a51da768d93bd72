package kds.domain.validation;

/**
 * Why an order is not ready to be dispatched
 * @since 04/10/2026
 */
public enum EValidationFailure {
    NO_ITEMS("Order has no items"),
    ALL_ITEMS_SENT("All items already sent"),
    MISSING_ASSIGNMENTS("Items without printer assignment"),
    PRINTERS_OFFLINE("Printers offline"),
    NO_PRINTERS_FOUND("No printers found for items"),
    NO_PRINTERS_CONFIGURED("No printers configured"),
    CONFIGURATION_ISSUES("Printer configuration issues"),
    SERVICE_NOT_READY("Printer services not ready"),
    SYSTEM_ERROR("Unexpected error");

    private final String title;

    EValidationFailure(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }
}
