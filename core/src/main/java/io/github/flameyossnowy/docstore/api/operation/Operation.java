package io.github.flameyossnowy.docstore.api.operation;

import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.CompletableFuture;

/**
 * A single primitive action against a document store.
 * <p>
 * Operations only describe what to do. They carry the data needed to run and no
 * reference to a backend; running one means handing it to an
 * {@link OperationDispatcher}, which selects the matching backend call.
 * <p>
 * The set of operations is closed: every implementation lives in
 * {@code io.github.flameyossnowy.docstore.api.operation.operations} and has a
 * dedicated method on {@link OperationDispatcher}.
 *
 * @param <R> The result type of the operation
 */
public interface Operation<R> {
    /**
     * Gets the type of this operation.
     *
     * @return the operation type
     */
    @NotNull
    OperationType getOperationType();

    /**
     * Routes this operation to the dispatcher method handling its variant.
     *
     * @param dispatcher the dispatcher bound to a backend
     * @return the deferred outcome of the operation
     */
    @NotNull
    CompletableFuture<TransactionResult<R>> dispatch(@NotNull OperationDispatcher dispatcher);

    /**
     * Returns metadata about this operation.
     *
     * @return operation metadata
     */
    @NotNull
    OperationMetadata getMetadata();

    /**
     * The key this operation targets, if it targets exactly one.
     *
     * @return the key, or null for multi-document operations
     */
    @Nullable
    default Key getKey() {
        return null;
    }
}
