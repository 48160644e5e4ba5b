package io.github.flameyossnowy.docstore.api.operation.operations;

import io.github.flameyossnowy.docstore.api.batch.BatchEntry;
import io.github.flameyossnowy.docstore.api.batch.BatchOutcome;
import io.github.flameyossnowy.docstore.api.operation.Operation;
import io.github.flameyossnowy.docstore.api.operation.OperationDispatcher;
import io.github.flameyossnowy.docstore.api.operation.OperationMetadata;
import io.github.flameyossnowy.docstore.api.operation.OperationType;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Operation for creating many documents in sequence.
 * <p>
 * The items are consumed lazily and in order. After each failed item the
 * continuation predicate decides whether the remaining items are consumed.
 *
 * @param items the entries to create, possibly already failed
 * @param continuation decides after a failure whether to keep going
 */
public record BatchCreateOperation(@NotNull Iterable<TransactionResult<BatchEntry>> items,
                                   @NotNull Predicate<Throwable> continuation) implements Operation<BatchOutcome> {
    private static final OperationMetadata METADATA = OperationMetadata.builder("Batch create documents")
            .mutating(true)
            .idempotent(false)
            .build();

    public BatchCreateOperation {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(continuation, "continuation");
    }

    @Override
    @NotNull
    public OperationType getOperationType() {
        return OperationType.BATCH;
    }

    @Override
    @NotNull
    public CompletableFuture<TransactionResult<BatchOutcome>> dispatch(@NotNull OperationDispatcher dispatcher) {
        return dispatcher.batchCreate(this);
    }

    @Override
    @NotNull
    public OperationMetadata getMetadata() {
        return METADATA;
    }
}
