package in.questkeeper.domain.common;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of an encounter operation: either data or a {@link ServiceError}.
 */
public record ServiceResult<T>(boolean success, T data, ServiceError error) {

    public static <T> ServiceResult<T> ok(T data) {
        return new ServiceResult<>(true, data, null);
    }

    public static <T> ServiceResult<T> fail(ServiceError error) {
        Objects.requireNonNull(error, "error");
        return new ServiceResult<>(false, null, error);
    }

    public static <T> ServiceResult<T> fail(ErrorCode code) {
        return fail(ServiceError.of(code));
    }

    public boolean failed() {
        return !success;
    }

    public <R> ServiceResult<R> map(Function<? super T, ? extends R> fn) {
        return success ? ok(fn.apply(data)) : fail(error);
    }

    public <R> ServiceResult<R> flatMap(Function<? super T, ServiceResult<R>> fn) {
        return success ? fn.apply(data) : fail(error);
    }

    /**
     * Re-types a failure. Only valid on failed results.
     */
    public <R> ServiceResult<R> propagate() {
        if (success) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return fail(error);
    }

    public ServiceResult<T> onSuccess(Consumer<? super T> action) {
        if (success) {
            action.accept(data);
        }
        return this;
    }

    public T orElseThrow() {
        if (!success) {
            throw new IllegalStateException(error.code() + ": " + error.message());
        }
        return data;
    }
}
