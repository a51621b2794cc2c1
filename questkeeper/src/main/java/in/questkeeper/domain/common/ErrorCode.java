package in.questkeeper.domain.common;

/**
 * Machine-readable error codes surfaced to callers.
 * Each code carries its kind, HTTP status and a default message.
 */
public enum ErrorCode {
    // Lookup
    ENCOUNTER_NOT_FOUND(ErrorKind.NOT_FOUND, 404, "Encounter not found"),
    PARTICIPANT_NOT_FOUND(ErrorKind.NOT_FOUND, 404, "Participant not found"),
    TEMPLATE_NOT_FOUND(ErrorKind.NOT_FOUND, 404, "Template not found"),

    // Access
    INSUFFICIENT_PERMISSIONS(ErrorKind.PERMISSION_DENIED, 403, "Insufficient permissions"),

    // Input
    ENCOUNTER_VALIDATION_ERROR(ErrorKind.VALIDATION, 400, "Encounter validation failed"),
    INVALID_IMPORT_FORMAT(ErrorKind.VALIDATION, 400, "Invalid import format"),
    MALFORMED_PAYLOAD(ErrorKind.FORMAT, 400, "Payload could not be parsed"),

    // Combat
    COMBAT_STATE_ERROR(ErrorKind.COMBAT_STATE, 409, "Invalid combat state"),

    // Storage
    PARTICIPANT_REORDER_FAILED(ErrorKind.STORAGE, 500, "Failed to reorder participants"),
    ENCOUNTER_SAVE_FAILED(ErrorKind.STORAGE, 500, "Failed to save encounter"),
    ENCOUNTER_EXPORT_FAILED(ErrorKind.STORAGE, 500, "Failed to export encounter"),
    ENCOUNTER_IMPORT_FAILED(ErrorKind.STORAGE, 500, "Failed to import encounter"),
    TEMPLATE_SAVE_FAILED(ErrorKind.STORAGE, 500, "Failed to save template"),
    DATABASE_ERROR(ErrorKind.STORAGE, 503, "Database unavailable");

    private final ErrorKind kind;
    private final int statusCode;
    private final String defaultMessage;

    ErrorCode(ErrorKind kind, int statusCode, String defaultMessage) {
        this.kind = kind;
        this.statusCode = statusCode;
        this.defaultMessage = defaultMessage;
    }

    public ErrorKind kind() {
        return kind;
    }

    public int statusCode() {
        return statusCode;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
