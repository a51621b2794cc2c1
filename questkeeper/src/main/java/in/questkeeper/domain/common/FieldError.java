package in.questkeeper.domain.common;

/**
 * A single offending field: dotted path (array indices included) plus reason.
 */
public record FieldError(String field, String message) {

    public static FieldError of(String field, String message) {
        return new FieldError(field, message);
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
