package org.example.evaluappclient.api;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value or an {@link ApiError}. A successful result may carry a null value
 * for calls that return nothing.
 */
public final class ApiResult<T> {

    private final T value;
    private final ApiError error;

    private ApiResult(T value, ApiError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ApiResult<T> success(T value) {
        return new ApiResult<>(value, null);
    }

    public static <T> ApiResult<T> failure(ApiError error) {
        return new ApiResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value on a failed result: " + error);
        }
        return value;
    }

    public ApiError getError() {
        return error;
    }

    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    public <U> ApiResult<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    public <U> ApiResult<U> flatMap(Function<? super T, ApiResult<U>> mapper) {
        if (error != null) {
            return failure(error);
        }
        return mapper.apply(value);
    }

    @Override
    public String toString() {
        return error == null ? "ApiResult[success: " + value + "]" : "ApiResult[failure: " + error + "]";
    }
}
