package io.github.flameyossnowy.docstore.api.operation.operations;

import io.github.flameyossnowy.docstore.api.model.DocumentValue;
import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.model.RawContent;
import io.github.flameyossnowy.docstore.api.model.Version;
import io.github.flameyossnowy.docstore.api.operation.Operation;
import io.github.flameyossnowy.docstore.api.operation.OperationDispatcher;
import io.github.flameyossnowy.docstore.api.operation.OperationMetadata;
import io.github.flameyossnowy.docstore.api.operation.OperationType;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Operation for replacing an existing document, guarded by its CAS token.
 * A {@link Version#NONE} token replaces unconditionally.
 *
 * @param key the document key
 * @param content the replacement content
 * @param version the token the caller last read
 */
public record UpdateOperation(@NotNull Key key, @NotNull RawContent content, @NotNull Version version)
        implements Operation<DocumentValue> {
    private static final OperationMetadata METADATA = OperationMetadata.builder("Update document")
            .mutating(true)
            .idempotent(false)
            .build();

    public UpdateOperation {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(version, "version");
    }

    public boolean isUnconditional() {
        return version.isNone();
    }

    @Override
    @NotNull
    public OperationType getOperationType() {
        return OperationType.UPDATE;
    }

    @Override
    @NotNull
    public CompletableFuture<TransactionResult<DocumentValue>> dispatch(@NotNull OperationDispatcher dispatcher) {
        return dispatcher.update(this);
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
