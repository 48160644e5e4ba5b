package io.github.flameyossnowy.docstore.api.program;

import io.github.flameyossnowy.docstore.api.exceptions.DocumentException;
import io.github.flameyossnowy.docstore.api.operation.OperationDispatcher;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import io.github.flameyossnowy.docstore.api.utils.Futures;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * One evaluation of a program.
 * <p>
 * Bind and recover nodes push frames on an explicit stack, leaves produce a result
 * which is then unwound through the frames. Already completed leaves are handled in
 * the same loop, so long chains over an in-memory backend do not grow the call stack.
 * Not thread safe; a run is only ever advanced by one thread at a time.
 */
@SuppressWarnings({ "unchecked", "rawtypes" })
final class ProgramRun<T> {
    private final OperationDispatcher dispatcher;
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final CompletableFuture<TransactionResult<T>> promise = new CompletableFuture<>();

    ProgramRun(OperationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    CompletableFuture<TransactionResult<T>> start(Program<T> program) {
        loop(program);
        return promise;
    }

    private void loop(Program<?> program) {
        Program<?> current = program;
        while (current != null) {
            if (current instanceof Program.Bind<?, ?> bind) {
                frames.push(new Frame((Function) bind.continuation, true));
                current = bind.source;
                continue;
            }
            if (current instanceof Program.Recover<?> recover) {
                frames.push(new Frame((Function) recover.fallback, false));
                current = recover.source;
                continue;
            }

            CompletableFuture<? extends TransactionResult<?>> step = leaf(current);
            if (!step.isDone()) {
                step.whenComplete((result, error) -> {
                    Program<?> next = unwind(Futures.settle((TransactionResult) result, error));
                    if (next != null) loop(next);
                });
                return;
            }
            current = unwind(step.handle((result, error) -> Futures.settle((TransactionResult) result, error)).join());
        }
    }

    private CompletableFuture<? extends TransactionResult<?>> leaf(Program<?> program) {
        if (program instanceof Program.Pure<?> pure) {
            return Futures.success(pure.value);
        }
        if (program instanceof Program.Failed<?> failed) {
            return Futures.failure(failed.error);
        }
        Program.Suspend<?> suspend = (Program.Suspend<?>) program;
        try {
            CompletableFuture<? extends TransactionResult<?>> future = suspend.operation.dispatch(dispatcher);
            return future == null
                ? Futures.failure(DocumentException.backendFailure(suspend.operation.getKey(), "Dispatcher returned no future", null))
                : future;
        } catch (RuntimeException e) {
            return Futures.failure(e);
        }
    }

    /**
     * Pops frames until one applies to the result.
     *
     * @return the program to continue with, or null once the run is complete
     */
    private Program<?> unwind(TransactionResult<?> result) {
        while (!frames.isEmpty()) {
            Frame frame = frames.pop();
            if (frame.onSuccess && result.isSuccess()) {
                return apply(frame.function, result.getOr(null));
            }
            if (!frame.onSuccess && result.isError()) {
                return apply(frame.function, result.getError().orElseThrow());
            }
        }
        promise.complete((TransactionResult<T>) result);
        return null;
    }

    private static Program<?> apply(Function<Object, Program<?>> function, Object argument) {
        try {
            Program<?> next = function.apply(argument);
            return next != null ? next : Program.fail(new IllegalStateException("Program stage returned null"));
        } catch (RuntimeException e) {
            return Program.fail(e);
        }
    }

    private record Frame(Function<Object, Program<?>> function, boolean onSuccess) {
    }
}
