package io.github.flameyossnowy.docstore.api.operation.operations;

import io.github.flameyossnowy.docstore.api.model.DocumentValue;
import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.model.RawContent;
import io.github.flameyossnowy.docstore.api.operation.Operation;
import io.github.flameyossnowy.docstore.api.operation.OperationDispatcher;
import io.github.flameyossnowy.docstore.api.operation.OperationMetadata;
import io.github.flameyossnowy.docstore.api.operation.OperationType;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Operation for inserting a new document. Fails if the key is taken.
 *
 * @param key the document key
 * @param content the content to store
 */
public record CreateOperation(@NotNull Key key, @NotNull RawContent content) implements Operation<DocumentValue> {
    private static final OperationMetadata METADATA = OperationMetadata.builder("Create document")
            .mutating(true)
            .idempotent(false)
            .build();

    public CreateOperation {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(content, "content");
    }

    @Override
    @NotNull
    public OperationType getOperationType() {
        return OperationType.WRITE;
    }

    @Override
    @NotNull
    public CompletableFuture<TransactionResult<DocumentValue>> dispatch(@NotNull OperationDispatcher dispatcher) {
        return dispatcher.create(this);
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
