package io.github.flameyossnowy.docstore.api.memory;

import io.github.flameyossnowy.docstore.api.backend.DocumentBackend;
import io.github.flameyossnowy.docstore.api.exceptions.DocumentException;
import io.github.flameyossnowy.docstore.api.model.DocumentValue;
import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.model.RawContent;
import io.github.flameyossnowy.docstore.api.model.Version;
import io.github.flameyossnowy.docstore.api.program.Program;
import io.github.flameyossnowy.docstore.api.program.ProgramInterpreter;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import io.github.flameyossnowy.docstore.api.utils.Futures;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A {@link DocumentBackend} over a plain map, for tests and local runs.
 * <p>
 * Counters are stored as decimal text, so {@code get} on a counter key returns the
 * number as content. Versions are derived with {@link Version#next(Version, RawContent, long)}
 * from a write counter that starts at the sum of the initial versions, which makes every run
 * reproducible from the same starting map without reissuing the tokens found in it.
 * <p>
 * Not thread safe; callers serialize concurrent use.
 */
public class InMemoryDocumentBackend implements DocumentBackend {
    private final Map<Key, DocumentValue> documents;
    private long writes;

    public InMemoryDocumentBackend() {
        this.documents = new HashMap<>();
    }

    public InMemoryDocumentBackend(@NotNull Map<Key, DocumentValue> initial) {
        this.documents = new HashMap<>(Objects.requireNonNull(initial, "initial"));
        for (DocumentValue value : documents.values()) {
            writes += value.version().value();
        }
    }

    /**
     * Runs a program against a copy of {@code start}.
     *
     * @param start the initial contents, left untouched
     * @param program the program to run
     * @return the result together with the resulting map
     */
    public static <T> @NotNull MemoryRun<T> run(@NotNull Map<Key, DocumentValue> start, @NotNull Program<T> program) {
        InMemoryDocumentBackend backend = new InMemoryDocumentBackend(start);
        TransactionResult<T> result = ProgramInterpreter.run(program, backend);
        return new MemoryRun<>(result, backend.snapshot());
    }

    /**
     * @return an immutable copy of the current contents
     */
    public @NotNull Map<Key, DocumentValue> snapshot() {
        return Map.copyOf(documents);
    }

    @Override
    public boolean isConnected() {
        return true;
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<DocumentValue>> get(@NotNull Key key) {
        DocumentValue value = documents.get(key);
        if (value == null) return Futures.failure(DocumentException.notFound(key));
        return Futures.success(value);
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<DocumentValue>> create(@NotNull Key key, @NotNull RawContent content) {
        if (documents.containsKey(key)) return Futures.failure(DocumentException.alreadyExists(key));
        return Futures.success(store(key, content, Version.NONE));
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<DocumentValue>> update(@NotNull Key key, @NotNull RawContent content, @NotNull Version version) {
        DocumentValue current = documents.get(key);
        if (current == null) return Futures.failure(DocumentException.notFound(key));
        if (!version.isNone() && !version.equals(current.version())) {
            return Futures.failure(DocumentException.versionConflict(key, version, current.version()));
        }
        return Futures.success(store(key, content, current.version()));
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<Boolean>> remove(@NotNull Key key) {
        if (documents.remove(key) == null) return Futures.failure(DocumentException.notFound(key));
        return Futures.success(true);
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<Long>> getCounter(@NotNull Key key) {
        DocumentValue value = documents.get(key);
        if (value == null) return Futures.failure(DocumentException.notFound(key));
        return CompletableFuture.completedFuture(parseCounter(key, value));
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<Long>> incrementCounter(@NotNull Key key, long delta) {
        DocumentValue current = documents.get(key);
        if (current == null) {
            store(key, RawContent.of(Long.toString(delta)), Version.NONE);
            return Futures.success(delta);
        }

        TransactionResult<Long> parsed = parseCounter(key, current);
        if (parsed.isError()) return CompletableFuture.completedFuture(parsed);

        long updated;
        try {
            updated = Math.addExact(parsed.getOr(0L), delta);
        } catch (ArithmeticException e) {
            return Futures.failure(DocumentException.backendFailure(key, "Incrementing [" + key + "] by " + delta + " overflows", e));
        }
        store(key, RawContent.of(Long.toString(updated)), current.version());
        return Futures.success(updated);
    }

    private DocumentValue store(Key key, RawContent content, Version previous) {
        DocumentValue value = DocumentValue.of(content, Version.next(previous, content, writes++));
        documents.put(key, value);
        return value;
    }

    private static TransactionResult<Long> parseCounter(Key key, DocumentValue value) {
        String text = value.content().value().trim();
        try {
            return TransactionResult.success(Long.parseLong(text));
        } catch (NumberFormatException e) {
            return TransactionResult.failure(DocumentException.decodeError(key, "Content of [" + key + "] is not a counter", e));
        }
    }

    @Override
    public String toString() {
        return "InMemoryDocumentBackend{" + documents.size() + " documents}";
    }
}
