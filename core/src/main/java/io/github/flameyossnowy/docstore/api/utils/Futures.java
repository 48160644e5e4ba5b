package io.github.flameyossnowy.docstore.api.utils;

import io.github.flameyossnowy.docstore.api.exceptions.DocumentException;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for futures of {@link TransactionResult}.
 */
@ApiStatus.Internal
public final class Futures {
    private Futures() {
    }

    public static <T> @NotNull CompletableFuture<TransactionResult<T>> success(T value) {
        return CompletableFuture.completedFuture(TransactionResult.success(value));
    }

    public static <T> @NotNull CompletableFuture<TransactionResult<T>> failure(@NotNull Throwable error) {
        return CompletableFuture.completedFuture(TransactionResult.failure(error));
    }

    /**
     * Turns the two arguments of a completion callback into a single result.
     * Exceptional completions become failures, a missing result becomes a backend failure.
     *
     * @param result the completed value, if any
     * @param error the completion error, if any
     * @return the settled result
     */
    public static <T> @NotNull TransactionResult<T> settle(@Nullable TransactionResult<T> result, @Nullable Throwable error) {
        if (error != null) return TransactionResult.failure(unwrap(error));
        if (result == null) return TransactionResult.failure(DocumentException.backendFailure("Backend completed without a result", null));
        return result;
    }

    public static @NotNull Throwable unwrap(@NotNull Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
