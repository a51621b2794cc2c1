package in.questkeeper.domain.common;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulated field validation outcome. Never stops at the first error.
 */
public record ValidationResult(boolean passed, List<FieldError> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult pass() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<FieldError> errors) {
        return new ValidationResult(false, errors);
    }

    /**
     * Failure as a service error with every field listed.
     */
    public ServiceError toError(ErrorCode code, String message) {
        return ServiceError.of(code, message, errors);
    }

    /**
     * Builder for accumulating errors.
     */
    public static class Builder {
        private final List<FieldError> errors = new ArrayList<>();
        private final String prefix;

        public Builder() {
            this("");
        }

        /**
         * @param prefix path prefix prepended to every field, e.g. {@code participants.2.}
         */
        public Builder(String prefix) {
            this.prefix = prefix;
        }

        public Builder addError(String field, String message) {
            errors.add(FieldError.of(prefix + field, message));
            return this;
        }

        public Builder addAll(List<FieldError> more) {
            errors.addAll(more);
            return this;
        }

        public Builder requireText(String field, String value, int min, int max) {
            if (value == null || value.trim().length() < min) {
                addError(field, min <= 1 ? "Required" : "Must contain at least " + min + " character(s)");
            } else if (value.length() > max) {
                addError(field, "Must contain at most " + max + " character(s)");
            }
            return this;
        }

        public Builder maxLength(String field, String value, int max) {
            if (value != null && value.length() > max) {
                addError(field, "Must contain at most " + max + " character(s)");
            }
            return this;
        }

        public Builder range(String field, Integer value, int min, int max) {
            if (value != null && (value < min || value > max)) {
                addError(field, "Must be between " + min + " and " + max + ", got " + value);
            }
            return this;
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }

        public ValidationResult build() {
            return errors.isEmpty() ? ValidationResult.pass() : ValidationResult.fail(errors);
        }
    }
}
