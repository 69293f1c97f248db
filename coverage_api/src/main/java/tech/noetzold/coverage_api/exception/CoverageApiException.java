package tech.noetzold.coverage_api.exception;

import lombok.Getter;

/**
 * Domain failure raised by the scenario and catalog services. The {@link ErrorKind}
 * decides the transport status; the message is safe to show to the caller except
 * for {@link ErrorKind#STORAGE_ERROR}, whose cause is only logged.
 */
@Getter
public class CoverageApiException extends RuntimeException {

    private final ErrorKind kind;

    public CoverageApiException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CoverageApiException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static CoverageApiException scenarioNotFound(Long scenarioId) {
        return new CoverageApiException(ErrorKind.NOT_FOUND, "Scenario not found: " + scenarioId);
    }

    public static CoverageApiException notFound(String what, String id) {
        return new CoverageApiException(ErrorKind.NOT_FOUND, what + " not found: " + id);
    }

    public static CoverageApiException forbidden() {
        return new CoverageApiException(ErrorKind.FORBIDDEN, "Access denied: scenario belongs to another user");
    }

    public static CoverageApiException duplicateName(String scenarioName) {
        return new CoverageApiException(ErrorKind.DUPLICATE_NAME,
                "Scenario name '" + scenarioName + "' already exists for this user. Please choose a different name.");
    }

    public static CoverageApiException validation(String field, String problem) {
        return new CoverageApiException(ErrorKind.VALIDATION_ERROR, "Invalid " + field + ": " + problem);
    }

    public static CoverageApiException storage(String operation, Throwable cause) {
        return new CoverageApiException(ErrorKind.STORAGE_ERROR, "Storage failure while " + operation, cause);
    }
}
