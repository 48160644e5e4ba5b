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
 * Operation for reading a counter. An absent counter is not read as zero.
 *
 * @param key the counter key
 */
public record GetCounterOperation(@NotNull Key key) implements Operation<Long> {
    private static final OperationMetadata METADATA = OperationMetadata.builder("Get counter")
            .mutating(false)
            .idempotent(true)
            .build();

    public GetCounterOperation {
        Objects.requireNonNull(key, "key");
    }

    @Override
    @NotNull
    public OperationType getOperationType() {
        return OperationType.COUNTER;
    }

    @Override
    @NotNull
    public CompletableFuture<TransactionResult<Long>> dispatch(@NotNull OperationDispatcher dispatcher) {
        return dispatcher.getCounter(this);
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
