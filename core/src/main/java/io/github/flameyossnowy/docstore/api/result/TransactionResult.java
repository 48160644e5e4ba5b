package io.github.flameyossnowy.docstore.api.result;

import io.github.flameyossnowy.docstore.api.exceptions.DocumentException;
import io.github.flameyossnowy.docstore.api.exceptions.ErrorKind;
import io.github.flameyossnowy.docstore.api.exceptions.RepositoryException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of a document operation: either a value or the throwable that made it fail.
 * <p>
 * A successful result may carry a {@code null} value; success is decided by the
 * absence of an error, never by the value.
 *
 * @param <T> the value type
 */
public final class TransactionResult<T> {
    private final T result;
    private final Throwable error;

    private TransactionResult(T result, Throwable error) {
        this.result = result;
        this.error = error;
    }

    /**
     * Returns a successful TransactionResult with the given value.
     *
     * @param value the value to be returned by the successful TransactionResult
     * @return a successful TransactionResult
     */
    @Contract(value = "_ -> new", pure = true)
    public static <T> @NotNull TransactionResult<T> success(T value) {
        return new TransactionResult<>(value, null);
    }

    /**
     * Returns a failed TransactionResult with the given error.
     *
     * @param error the error to be returned by the failed TransactionResult
     * @return a failed TransactionResult
     */
    @Contract(value = "_ -> new", pure = true)
    public static <T> @NotNull TransactionResult<T> failure(@NotNull Throwable error) {
        return new TransactionResult<>(null, Objects.requireNonNull(error, "error"));
    }

    /**
     * Runs the supplier and captures whatever it throws as a failure.
     *
     * @param supplier the computation
     * @return the supplied value, or a failure holding the thrown exception
     */
    public static <T> @NotNull TransactionResult<T> attempt(@NotNull Supplier<T> supplier) {
        try {
            return success(supplier.get());
        } catch (RuntimeException e) {
            return failure(e);
        }
    }

    /**
     * Checks if the transaction resulted in a success.
     * @return true if the transaction was successful, false otherwise
     */
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Checks if the transaction resulted in an error.
     *
     * @return true if the transaction resulted in an error, false otherwise
     */
    public boolean isError() {
        return error != null;
    }

    /**
     * Retrieves the result of the transaction if it was successful.
     *
     * @return an Optional containing the result if the transaction was successful,
     *         or an empty Optional if the transaction resulted in an error.
     */
    @Contract(pure = true)
    public @NotNull Optional<T> getResult() {
        return Optional.ofNullable(result);
    }

    /**
     * Retrieves the error of the transaction if it resulted in an error.
     *
     * @return an Optional containing the error if the transaction resulted in an error,
     *         or an empty Optional if the transaction was successful.
     */
    @Contract(pure = true)
    public @NotNull Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Classifies the error of a failed result.
     *
     * @return the error kind, or empty for a successful result
     */
    public @NotNull Optional<ErrorKind> errorKind() {
        return isError() ? Optional.of(DocumentException.kindOf(error)) : Optional.empty();
    }

    /**
     * Checks whether this result failed with the given kind.
     *
     * @param kind the kind to test for
     * @return true if this is a failure of that kind
     */
    public boolean isErrorOf(@NotNull ErrorKind kind) {
        return isError() && DocumentException.kindOf(error) == kind;
    }

    /**
     * Runs the given consumer on the result of the transaction if it was successful.
     * Does nothing if the transaction resulted in an error.
     *
     * @param runnable the consumer to be run on the result
     */
    public void ifSuccess(Consumer<T> runnable) {
        if (isSuccess()) runnable.accept(result);
    }

    /**
     * Runs the given consumer on the error of the transaction if it resulted in an error.
     * Does nothing if the transaction was successful.
     *
     * @param runnable the consumer to be run on the error
     */
    public void ifError(Consumer<Throwable> runnable) {
        if (isError()) runnable.accept(error);
    }

    /**
     * Applies the given function to the result of the transaction if it was successful,
     * or returns a failed TransactionResult with the same error if the transaction
     * resulted in an error.
     *
     * @param function the function to apply to the result of the transaction
     * @return a new TransactionResult containing the result of applying the given
     *         function, or a failed TransactionResult with the same error.
     */
    public <E> TransactionResult<E> map(Function<? super T, ? extends E> function) {
        if (isSuccess()) return TransactionResult.success(function.apply(result));
        return TransactionResult.failure(error);
    }

    /**
     * Applies the given function to the result of the transaction if it was successful,
     * or returns a failed TransactionResult with the same error.
     *
     * @param function the function to apply to the result of the transaction
     * @return the result of the function, or a failed TransactionResult with the same error
     */
    public <E> TransactionResult<E> flatMap(Function<? super T, TransactionResult<E>> function) {
        if (isSuccess()) return function.apply(result);
        return TransactionResult.failure(error);
    }

    /**
     * Replaces the error of a failed result. Successful results pass through unchanged.
     *
     * @param function maps the current error to the new one
     * @return a failure with the mapped error, or this result
     */
    public TransactionResult<T> mapError(Function<? super Throwable, ? extends Throwable> function) {
        if (isError()) return TransactionResult.failure(function.apply(error));
        return this;
    }

    /**
     * Maps the error of this transaction result to a new result value.
     * If the transaction resulted in an error, applies the given function to the
     * error and returns a successful TransactionResult with that value.
     *
     * @param function the function to apply to the error of the transaction
     * @return a recovered result, or this TransactionResult if it was successful
     */
    public TransactionResult<T> recover(Function<? super Throwable, ? extends T> function) {
        if (isError()) return TransactionResult.success(function.apply(error));
        return this;
    }

    /**
     * If this transaction result failed, returns the result produced from its error.
     *
     * @param function produces the fallback result from the error
     * @return this result if successful, otherwise the fallback
     */
    public TransactionResult<T> orElse(Function<? super Throwable, TransactionResult<T>> function) {
        if (isError()) return function.apply(error);
        return this;
    }

    /**
     * Collapses both branches into one value.
     *
     * @param onError applied to the error of a failed result
     * @param onSuccess applied to the value of a successful result
     * @return whichever function's result applies
     */
    public <E> E fold(Function<? super Throwable, ? extends E> onError, Function<? super T, ? extends E> onSuccess) {
        return isError() ? onError.apply(error) : onSuccess.apply(result);
    }

    /**
     * If this transaction result is successful, returns the given transaction result.
     * If this transaction result resulted in an error, returns this transaction result.
     *
     * @param other the transaction result to return if this transaction result was successful
     * @return the given transaction result if this one was successful, otherwise this one
     */
    public TransactionResult<T> and(TransactionResult<T> other) {
        if (isError()) return this;
        return other;
    }

    /**
     * If this transaction result was successful, returns this transaction result.
     * If this transaction result resulted in an error, returns the given transaction result.
     *
     * @param other the transaction result to return if this one resulted in an error
     * @return this transaction result if it was successful, otherwise the given one
     */
    public TransactionResult<T> or(TransactionResult<T> other) {
        if (isSuccess()) return this;
        return other;
    }

    /**
     * Retrieves the result of the transaction if it was successful, or returns the given
     * value if the transaction resulted in an error.
     *
     * @param result the value to return if the transaction resulted in an error
     * @return the result of the transaction if it was successful, or the given value
     */
    public T getOr(T result) {
        if (isSuccess()) return this.result;
        return result;
    }

    /**
     * Retrieves the result of the transaction if it was successful, or throws a
     * RepositoryException wrapping the error if the transaction resulted in an error.
     * A {@link DocumentException} is rethrown as is.
     *
     * @return the result of the transaction if successful
     * @throws RepositoryException if the transaction resulted in an error
     */
    public T expect() {
        if (isSuccess()) return result;
        if (error instanceof DocumentException documentException) throw documentException;
        throw new RepositoryException("Transaction failed", error);
    }

    /**
     * Retrieves the result of the transaction if it was successful, or throws a
     * RepositoryException with the given message wrapping the error.
     *
     * @param message the message to include in the RepositoryException
     * @return the result of the transaction if successful
     * @throws RepositoryException if the transaction resulted in an error
     */
    public T expect(String message) {
        if (isSuccess()) return result;
        throw new RepositoryException(message, error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransactionResult<?> that)) return false;
        return Objects.equals(result, that.result) && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(result, error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success[" + result + "]" : "Failure[" + error + "]";
    }
}
