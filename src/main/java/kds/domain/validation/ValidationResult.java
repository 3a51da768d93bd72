package kds.domain.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a dispatch-readiness check: success with a summary, or failure with a kind and an operator message
 * @since 04/10/2026
 */
public class ValidationResult {
    private final boolean success;
    private final EValidationFailure failure;
    private final String message;
    private final Map<String, Object> details;

    private ValidationResult(boolean success, EValidationFailure failure, String message, Map<String, Object> details) {
        this.success = success;
        this.failure = failure;
        this.message = message;
        this.details = details == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ValidationResult success(String message, Map<String, Object> details) {
        return new ValidationResult(true, null, message, details);
    }

    public static ValidationResult failure(EValidationFailure failure, String message) {
        return new ValidationResult(false, failure, message, null);
    }

    public static ValidationResult failure(EValidationFailure failure, String message, Map<String, Object> details) {
        return new ValidationResult(false, failure, message, details);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return failure kind, null on success
     */
    public EValidationFailure getFailure() {
        return failure;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return success
                ? "ValidationResult{SUCCESS, " + details + "}"
                : "ValidationResult{" + failure + ", '" + message + "'}";
    }
}
