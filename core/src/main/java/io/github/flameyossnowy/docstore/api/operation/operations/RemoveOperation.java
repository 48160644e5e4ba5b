package io.github.flameyossnowy.docstore.api.operation.operations;

import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.operation.Operation;
import io.github.flameyossnowy.docstore.api.operation.OperationDispatcher;
import io.github.flameyossnowy.docstore.api.operation.OperationMetadata;
import io.github.flameyossnowy.docstore.api.operation.OperationType;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Operation for deleting a document or counter.
 *
 * @param key the key to remove
 */
public record RemoveOperation(@NotNull Key key) implements Operation<Boolean> {
    private static final OperationMetadata METADATA = OperationMetadata.builder("Remove document")
            .mutating(true)
            .idempotent(false)
            .build();

    public RemoveOperation {
        Objects.requireNonNull(key, "key");
    }

    @Override
    @NotNull
    public OperationType getOperationType() {
        return OperationType.DELETE;
    }

    @Override
    @NotNull
    public CompletableFuture<TransactionResult<Boolean>> dispatch(@NotNull OperationDispatcher dispatcher) {
        return dispatcher.remove(this);
    }

    @Override
    @NotNull
    public OperationMetadata getMetadata() {
        return METADATA;
    }

    @Override
    public Key getKey() {
        return key;
    }
}
