package in.questkeeper.domain.common;

import java.util.List;

/**
 * Tagged failure returned by every encounter operation.
 *
 * The kind drives control flow, the code is stable for API clients,
 * statusCode maps straight onto the HTTP response.
 */
public record ServiceError(
    ErrorKind kind,
    String code,
    String message,
    int statusCode,
    List<FieldError> details
) {
    public ServiceError {
        details = details == null ? List.of() : List.copyOf(details);
    }

    public static ServiceError of(ErrorCode code) {
        return of(code, code.defaultMessage());
    }

    public static ServiceError of(ErrorCode code, String message) {
        return new ServiceError(code.kind(), code.name(), message, code.statusCode(), List.of());
    }

    public static ServiceError of(ErrorCode code, String message, List<FieldError> details) {
        return new ServiceError(code.kind(), code.name(), message, code.statusCode(), details);
    }

    public static ServiceError encounterNotFound(String encounterId) {
        return of(ErrorCode.ENCOUNTER_NOT_FOUND, "Encounter not found: " + encounterId);
    }

    public static ServiceError participantNotFound(String participantId) {
        return of(ErrorCode.PARTICIPANT_NOT_FOUND, "Participant not found: " + participantId);
    }

    public static ServiceError permissionDenied(String message) {
        return of(ErrorCode.INSUFFICIENT_PERMISSIONS, message);
    }

    public static ServiceError validation(String message, List<FieldError> details) {
        return of(ErrorCode.ENCOUNTER_VALIDATION_ERROR, message, details);
    }

    public static ServiceError validation(String field, String message) {
        return validation(message, List.of(FieldError.of(field, message)));
    }

    /**
     * Combat transition rejected. Message always names the action and the reason.
     */
    public static ServiceError combatState(String action, String reason) {
        return of(ErrorCode.COMBAT_STATE_ERROR, "Cannot " + action + ": " + reason);
    }

    public static ServiceError format(String message) {
        return of(ErrorCode.MALFORMED_PAYLOAD, message);
    }

    public static ServiceError storage(ErrorCode code, Throwable cause) {
        String reason = cause == null || cause.getMessage() == null ? "" : " (" + cause.getMessage() + ")";
        return of(code, code.defaultMessage() + reason);
    }

    public boolean is(ErrorKind other) {
        return kind == other;
    }

    public boolean is(ErrorCode other) {
        return code.equals(other.name());
    }
}
