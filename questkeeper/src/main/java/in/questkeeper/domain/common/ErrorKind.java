package in.questkeeper.domain.common;

/**
 * Categories of failure returned by the encounter services.
 */
public enum ErrorKind {
    NOT_FOUND,
    VALIDATION,
    PERMISSION_DENIED,
    COMBAT_STATE,
    FORMAT,
    STORAGE
}
