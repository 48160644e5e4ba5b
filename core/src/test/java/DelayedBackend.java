import io.github.flameyossnowy.docstore.api.backend.DocumentBackend;
import io.github.flameyossnowy.docstore.api.model.DocumentValue;
import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.model.RawContent;
import io.github.flameyossnowy.docstore.api.model.Version;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Completes every call of the wrapped backend later, on another thread.
 */
class DelayedBackend implements DocumentBackend {
    private final DocumentBackend delegate;
    private final AtomicInteger calls = new AtomicInteger();

    DelayedBackend(DocumentBackend delegate) {
        this.delegate = delegate;
    }

    int calls() {
        return calls.get();
    }

    private <T> CompletableFuture<TransactionResult<T>> later(Supplier<CompletableFuture<TransactionResult<T>>> call) {
        calls.incrementAndGet();
        // the delegate is not thread safe; calls never overlap because a program waits for each one
        return CompletableFuture.supplyAsync(() -> call.get().join(),
            CompletableFuture.delayedExecutor(5, TimeUnit.MILLISECONDS));
    }

    @Override
    public boolean isConnected() {
        return delegate.isConnected();
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<DocumentValue>> get(@NotNull Key key) {
        return later(() -> delegate.get(key));
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<DocumentValue>> create(@NotNull Key key, @NotNull RawContent content) {
        return later(() -> delegate.create(key, content));
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<DocumentValue>> update(@NotNull Key key, @NotNull RawContent content, @NotNull Version version) {
        return later(() -> delegate.update(key, content, version));
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<Boolean>> remove(@NotNull Key key) {
        return later(() -> delegate.remove(key));
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<Long>> getCounter(@NotNull Key key) {
        return later(() -> delegate.getCounter(key));
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<Long>> incrementCounter(@NotNull Key key, long delta) {
        return later(() -> delegate.incrementCounter(key, delta));
    }
}
