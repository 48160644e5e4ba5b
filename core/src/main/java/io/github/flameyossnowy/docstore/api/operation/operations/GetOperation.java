package io.github.flameyossnowy.docstore.api.operation.operations;

import io.github.flameyossnowy.docstore.api.model.DocumentValue;
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
 * Operation for reading one document.
 *
 * @param key the document key
 */
public record GetOperation(@NotNull Key key) implements Operation<DocumentValue> {
    private static final OperationMetadata METADATA = OperationMetadata.builder("Get document")
            .mutating(false)
            .idempotent(true)
            .build();

    public GetOperation {
        Objects.requireNonNull(key, "key");
    }

    @Override
    @NotNull
    public OperationType getOperationType() {
        return OperationType.READ;
    }

    @Override
    @NotNull
    public CompletableFuture<TransactionResult<DocumentValue>> dispatch(@NotNull OperationDispatcher dispatcher) {
        return dispatcher.get(this);
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
