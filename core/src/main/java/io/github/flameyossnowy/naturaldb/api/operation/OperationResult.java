package io.github.flameyossnowy.naturaldb.api.operation;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a query engine operation: either a value or the error that prevented it.
 *
 * @param <T> the value type
 */
public final class OperationResult<T> {
    private final @Nullable T value;
    private final @Nullable Throwable error;

    private OperationResult(@Nullable T value, @Nullable Throwable error) {
        this.value = value;
        this.error = error;
    }

    @Contract("_ -> new")
    public static <T> @NotNull OperationResult<T> success(@Nullable T value) {
        return new OperationResult<>(value, null);
    }

    @Contract("_ -> new")
    public static <T> @NotNull OperationResult<T> failure(@NotNull Throwable error) {
        return new OperationResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public @Nullable T getValue() {
        return value;
    }

    public @NotNull Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public @NotNull Optional<Throwable> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the value on success, {@code fallback} otherwise.
     */
    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }

    /**
     * Returns the value, or throws an {@link IllegalStateException} carrying {@code message}
     * and the failure cause.
     */
    public T expect(String message) {
        if (error != null) {
            throw new IllegalStateException(message, error);
        }
        return value;
    }

    public <R> @NotNull OperationResult<R> map(@NotNull Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    public @NotNull OperationResult<T> ifSuccess(@NotNull Consumer<? super T> action) {
        if (error == null) {
            action.accept(value);
        }
        return this;
    }

    public @NotNull OperationResult<T> ifFailure(@NotNull Consumer<Throwable> action) {
        if (error != null) {
            action.accept(error);
        }
        return this;
    }

    @Override
    public String toString() {
        return isSuccess() ? "OperationResult[success, value=" + value + ']' : "OperationResult[failure, error=" + error + ']';
    }
}
