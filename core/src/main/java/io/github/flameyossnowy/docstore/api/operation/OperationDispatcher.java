package io.github.flameyossnowy.docstore.api.operation;

import io.github.flameyossnowy.docstore.api.batch.BatchOutcome;
import io.github.flameyossnowy.docstore.api.model.DocumentValue;
import io.github.flameyossnowy.docstore.api.operation.operations.BatchCreateOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.CreateOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.GetCounterOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.GetOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.IncrementCounterOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.RemoveOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.UpdateOperation;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Executes each operation variant. One method per variant.
 */
public interface OperationDispatcher {
    @NotNull
    CompletableFuture<TransactionResult<DocumentValue>> get(@NotNull GetOperation operation);

    @NotNull
    CompletableFuture<TransactionResult<DocumentValue>> create(@NotNull CreateOperation operation);

    @NotNull
    CompletableFuture<TransactionResult<DocumentValue>> update(@NotNull UpdateOperation operation);

    @NotNull
    CompletableFuture<TransactionResult<Boolean>> remove(@NotNull RemoveOperation operation);

    @NotNull
    CompletableFuture<TransactionResult<Long>> getCounter(@NotNull GetCounterOperation operation);

    @NotNull
    CompletableFuture<TransactionResult<Long>> incrementCounter(@NotNull IncrementCounterOperation operation);

    @NotNull
    CompletableFuture<TransactionResult<BatchOutcome>> batchCreate(@NotNull BatchCreateOperation operation);
}
