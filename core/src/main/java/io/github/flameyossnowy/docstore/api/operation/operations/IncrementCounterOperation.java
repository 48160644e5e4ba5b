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
 * Operation for atomically adding {@code delta} to a counter.
 * A missing counter starts at {@code delta}.
 *
 * @param key the counter key
 * @param delta the amount to add, may be negative
 */
public record IncrementCounterOperation(@NotNull Key key, long delta) implements Operation<Long> {
    private static final OperationMetadata METADATA = OperationMetadata.builder("Increment counter")
            .mutating(true)
            .idempotent(false)
            .build();

    public IncrementCounterOperation {
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
        return dispatcher.incrementCounter(this);
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
