package io.github.flameyossnowy.docstore.api.batch;

import io.github.flameyossnowy.docstore.api.backend.DocumentBackend;
import io.github.flameyossnowy.docstore.api.exceptions.DocumentException;
import io.github.flameyossnowy.docstore.api.model.DocumentValue;
import io.github.flameyossnowy.docstore.api.program.Program;
import io.github.flameyossnowy.docstore.api.program.ProgramInterpreter;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import io.github.flameyossnowy.docstore.api.utils.Futures;
import io.github.flameyossnowy.docstore.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Creates documents from a lazy sequence of batch items, one at a time.
 * <p>
 * For each item, in input order:
 * <ol>
 *     <li>an item that is already failed is recorded as a failure at its index;</li>
 *     <li>otherwise its key program runs, then the document is created; either failure
 *     is recorded at the item's index;</li>
 *     <li>after a recorded failure the continuation predicate is asked whether to go on.
 *     When it answers {@code false} no further items are consumed, and the failure that
 *     stopped the batch is still part of the outcome.</li>
 * </ol>
 * Failures are never retried. An exception thrown by the item iterator itself is
 * recorded at the index being produced and ends the batch.
 */
public final class BatchEngine {
    private final ProgramInterpreter interpreter;

    public BatchEngine(@NotNull ProgramInterpreter interpreter) {
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
    }

    public BatchEngine(@NotNull DocumentBackend backend) {
        this(new ProgramInterpreter(backend));
    }

    /**
     * Runs a batch and waits for its outcome.
     * The same threading restriction as {@link ProgramInterpreter#run(Program)} applies.
     *
     * @param items the items to create
     * @param continuation decides after each failure whether to continue
     * @return the accumulated outcome
     */
    public @NotNull BatchOutcome runBatch(@NotNull Iterable<TransactionResult<BatchEntry>> items,
                                          @NotNull Predicate<Throwable> continuation) {
        return runBatchAsync(items, continuation).join();
    }

    /**
     * Starts a batch run.
     *
     * @param items the items to create
     * @param continuation decides after each failure whether to continue
     * @return the deferred outcome, which never completes exceptionally
     */
    public @NotNull CompletableFuture<BatchOutcome> runBatchAsync(@NotNull Iterable<TransactionResult<BatchEntry>> items,
                                                                  @NotNull Predicate<Throwable> continuation) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(continuation, "continuation");
        BatchRun run = new BatchRun(items, continuation);
        run.advance();
        return run.promise;
    }

    private final class BatchRun {
        private final Iterable<TransactionResult<BatchEntry>> items;
        private final Predicate<Throwable> continuation;
        private final CompletableFuture<BatchOutcome> promise = new CompletableFuture<>();
        private final SortedSet<Integer> succeeded = new TreeSet<>();
        private final List<BatchFailure> failures = new ArrayList<>();
        private Iterator<TransactionResult<BatchEntry>> iterator;
        private int index = 0;

        BatchRun(Iterable<TransactionResult<BatchEntry>> items, Predicate<Throwable> continuation) {
            this.items = items;
            this.continuation = continuation;
        }

        void advance() {
            while (true) {
                int current = index;
                TransactionResult<BatchEntry> item;
                try {
                    if (iterator == null) iterator = items.iterator();
                    if (!iterator.hasNext()) {
                        finish();
                        return;
                    }
                    item = iterator.next();
                } catch (RuntimeException e) {
                    Logging.error("Batch input failed while producing item " + current, e);
                    failures.add(new BatchFailure(current, e));
                    finish();
                    return;
                }
                index++;

                CompletableFuture<TransactionResult<DocumentValue>> step = attempt(current, item);
                if (!step.isDone()) {
                    step.whenComplete((result, error) -> {
                        if (record(current, Futures.settle(result, error))) advance();
                        else finish();
                    });
                    return;
                }

                if (!record(current, step.handle(Futures::settle).join())) {
                    finish();
                    return;
                }
            }
        }

        private CompletableFuture<TransactionResult<DocumentValue>> attempt(int current, TransactionResult<BatchEntry> item) {
            if (item == null) {
                return Futures.failure(DocumentException.backendFailure("Batch item " + current + " is null", null));
            }
            if (item.isError()) {
                return Futures.failure(item.getError().orElseThrow());
            }

            BatchEntry entry = item.getOr(null);
            return interpreter.execute(entry.key().andThen(key -> Program.create(key, entry.content())));
        }

        /**
         * @return whether the next item should be consumed
         */
        private boolean record(int current, TransactionResult<DocumentValue> result) {
            if (result.isSuccess()) {
                succeeded.add(current);
                return true;
            }

            Throwable cause = result.getError().orElseThrow();
            failures.add(new BatchFailure(current, cause));
            Logging.deepInfo(() -> "Batch item " + current + " failed: " + cause.getMessage());

            boolean proceed;
            try {
                proceed = continuation.test(cause);
            } catch (RuntimeException e) {
                Logging.error("Batch continuation predicate threw at item " + current + ", stopping batch", e);
                return false;
            }

            if (!proceed) Logging.info("Batch stopped after item " + current + ": " + cause.getMessage());
            return proceed;
        }

        private void finish() {
            promise.complete(BatchOutcome.of(succeeded, failures));
        }
    }
}
