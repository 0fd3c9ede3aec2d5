package com.purchasingpower.blamelens.service.vcs;

import java.util.Objects;
import java.util.function.Function;

/**
 * Success value or {@link ProviderFailure}. Expected failures travel as values, never as exceptions.
 *
 * <p>A successful result may carry {@code null}: for change request lookups that means
 * "the commit has no change request", a valid and cacheable answer.
 */
public final class ProviderResult<T> {

    private final T value;
    private final ProviderFailure failure;

    private ProviderResult(T value, ProviderFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> ProviderResult<T> success(T value) {
        return new ProviderResult<>(value, null);
    }

    public static <T> ProviderResult<T> failure(ProviderFailure failure) {
        return new ProviderResult<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on a failed result: " + failure.getMessage());
        }
        return value;
    }

    public ProviderFailure getFailure() {
        if (isSuccess()) {
            throw new IllegalStateException("No failure on a successful result");
        }
        return failure;
    }

    /**
     * Maps the value of a successful result; a failure is passed through with its new type.
     */
    public <R> ProviderResult<R> map(Function<? super T, ? extends R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(failure);
    }

    @Override
    public String toString() {
        return isSuccess() ? "success(" + value + ")" : "failure(" + failure + ")";
    }
}
