package io.github.flameyossnowy.docstore.api.program;

import io.github.flameyossnowy.docstore.api.backend.DocumentBackend;
import io.github.flameyossnowy.docstore.api.batch.BatchEngine;
import io.github.flameyossnowy.docstore.api.batch.BatchOutcome;
import io.github.flameyossnowy.docstore.api.exceptions.DocumentException;
import io.github.flameyossnowy.docstore.api.model.DocumentValue;
import io.github.flameyossnowy.docstore.api.operation.Operation;
import io.github.flameyossnowy.docstore.api.operation.OperationDispatcher;
import io.github.flameyossnowy.docstore.api.operation.OperationMetadata;
import io.github.flameyossnowy.docstore.api.operation.operations.BatchCreateOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.CreateOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.GetCounterOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.GetOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.IncrementCounterOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.RemoveOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.UpdateOperation;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import io.github.flameyossnowy.docstore.api.utils.Futures;
import io.github.flameyossnowy.docstore.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Runs {@link Program}s against one {@link DocumentBackend}.
 * <p>
 * The interpreter holds no state between runs. Every primitive operation is checked
 * against {@link DocumentBackend#isConnected()} right before it is dispatched and fails
 * with {@code NOT_CONNECTED} without reaching the backend when the check fails.
 * Futures returned by {@link #execute(Program)} never complete exceptionally.
 */
public final class ProgramInterpreter {
    private final DocumentBackend backend;
    private final OperationDispatcher dispatcher;
    private final BatchEngine batchEngine;

    public ProgramInterpreter(@NotNull DocumentBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.dispatcher = new BackendDispatcher();
        this.batchEngine = new BatchEngine(this);
    }

    /**
     * Executes {@code program} against {@code backend}.
     *
     * @param program the program to run
     * @param backend the backend to run it on
     * @return the deferred result
     */
    public static <T> @NotNull CompletableFuture<TransactionResult<T>> execute(@NotNull Program<T> program, @NotNull DocumentBackend backend) {
        return new ProgramInterpreter(backend).execute(program);
    }

    /**
     * Blocking variant of {@link #execute(Program, DocumentBackend)}.
     */
    public static <T> @NotNull TransactionResult<T> run(@NotNull Program<T> program, @NotNull DocumentBackend backend) {
        return new ProgramInterpreter(backend).run(program);
    }

    public @NotNull DocumentBackend getBackend() {
        return backend;
    }

    public @NotNull BatchEngine getBatchEngine() {
        return batchEngine;
    }

    /**
     * Starts running a program. Returns as soon as the first backend call is pending.
     *
     * @param program the program to run
     * @return the deferred result
     */
    public <T> @NotNull CompletableFuture<TransactionResult<T>> execute(@NotNull Program<T> program) {
        Objects.requireNonNull(program, "program");
        return new ProgramRun<T>(dispatcher).start(program);
    }

    /**
     * Runs a program and waits for its result.
     * <p>
     * Do not call this from a thread that completes backend futures, for example
     * inside an {@code andThen} stage or a driver callback: the wait would block the
     * thread that is supposed to deliver the result.
     *
     * @param program the program to run
     * @return the result
     */
    public <T> @NotNull TransactionResult<T> run(@NotNull Program<T> program) {
        return execute(program).join();
    }

    private final class BackendDispatcher implements OperationDispatcher {
        @Override
        public @NotNull CompletableFuture<TransactionResult<DocumentValue>> get(@NotNull GetOperation operation) {
            return call(operation, () -> backend.get(operation.key()));
        }

        @Override
        public @NotNull CompletableFuture<TransactionResult<DocumentValue>> create(@NotNull CreateOperation operation) {
            return call(operation, () -> backend.create(operation.key(), operation.content()));
        }

        @Override
        public @NotNull CompletableFuture<TransactionResult<DocumentValue>> update(@NotNull UpdateOperation operation) {
            return call(operation, () -> backend.update(operation.key(), operation.content(), operation.version()));
        }

        @Override
        public @NotNull CompletableFuture<TransactionResult<Boolean>> remove(@NotNull RemoveOperation operation) {
            return call(operation, () -> backend.remove(operation.key()));
        }

        @Override
        public @NotNull CompletableFuture<TransactionResult<Long>> getCounter(@NotNull GetCounterOperation operation) {
            return call(operation, () -> backend.getCounter(operation.key()));
        }

        @Override
        public @NotNull CompletableFuture<TransactionResult<Long>> incrementCounter(@NotNull IncrementCounterOperation operation) {
            return call(operation, () -> backend.incrementCounter(operation.key(), operation.delta()));
        }

        @Override
        public @NotNull CompletableFuture<TransactionResult<BatchOutcome>> batchCreate(@NotNull BatchCreateOperation operation) {
            return call(operation, () -> batchEngine.runBatchAsync(operation.items(), operation.continuation())
                    .thenApply(TransactionResult::success));
        }

        private <R> CompletableFuture<TransactionResult<R>> call(Operation<R> operation,
                                                                 Supplier<CompletableFuture<TransactionResult<R>>> call) {
            OperationMetadata metadata = operation.getMetadata();
            String description = metadata.describe(operation.getKey());
            if (!backend.isConnected()) {
                Logging.deepInfo(() -> description + " rejected, backend [" + backend.getClass().getSimpleName() + "] is not connected");
                return Futures.failure(DocumentException.notConnected());
            }

            Logging.deepInfo(() -> "Dispatching " + description + (metadata.mutating() ? " (write)" : ""));
            try {
                CompletableFuture<TransactionResult<R>> future = call.get();
                if (future == null) {
                    return Futures.failure(DocumentException.backendFailure(operation.getKey(), description + " returned no future", null));
                }
                return future;
            } catch (RuntimeException e) {
                Logging.error(description + " failed in backend [" + backend.getClass().getSimpleName() + "]", e);
                return Futures.failure(DocumentException.backendFailure(operation.getKey(), description + " failed: " + e.getMessage(), e));
            }
        }
    }
}
