package io.github.flameyossnowy.docstore.api.backend;

import io.github.flameyossnowy.docstore.api.model.DocumentValue;
import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.model.RawContent;
import io.github.flameyossnowy.docstore.api.model.Version;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Storage capability a {@link io.github.flameyossnowy.docstore.api.program.ProgramInterpreter} runs programs against.
 * <p>
 * Implementations report failures through the returned {@link TransactionResult},
 * using {@link io.github.flameyossnowy.docstore.api.exceptions.DocumentException} for every
 * failure the store itself detects. Futures should not complete exceptionally; the
 * interpreter still converts such completions into failed results.
 */
public interface DocumentBackend {
    /**
     * Whether the backend can currently serve requests.
     * <p>
     * This reflects the last known session state only. A remote store may have become
     * unreachable since, in which case operations fail with a backend failure.
     *
     * @return true if operations may be dispatched
     */
    boolean isConnected();

    /**
     * Reads a document.
     *
     * @param key the document key
     * @return the content and current version, or {@code NOT_FOUND}
     */
    @NotNull
    CompletableFuture<TransactionResult<DocumentValue>> get(@NotNull Key key);

    /**
     * Inserts a document that must not exist yet.
     *
     * @param key the document key
     * @param content the content to store
     * @return the stored value with its fresh version, or {@code ALREADY_EXISTS}
     */
    @NotNull
    CompletableFuture<TransactionResult<DocumentValue>> create(@NotNull Key key, @NotNull RawContent content);

    /**
     * Replaces a document if its stored version equals {@code version}.
     * {@link Version#NONE} replaces whatever is stored.
     *
     * @param key the document key
     * @param content the replacement content
     * @param version the version the caller expects to replace
     * @return the stored value with its new version, {@code NOT_FOUND} or {@code VERSION_CONFLICT}
     */
    @NotNull
    CompletableFuture<TransactionResult<DocumentValue>> update(@NotNull Key key, @NotNull RawContent content, @NotNull Version version);

    /**
     * Deletes a document or counter.
     *
     * @param key the key to remove
     * @return {@code true}, or {@code NOT_FOUND}
     */
    @NotNull
    CompletableFuture<TransactionResult<Boolean>> remove(@NotNull Key key);

    /**
     * Reads a counter.
     *
     * @param key the counter key
     * @return the counter value, {@code NOT_FOUND} or {@code DECODE_ERROR}
     */
    @NotNull
    CompletableFuture<TransactionResult<Long>> getCounter(@NotNull Key key);

    /**
     * Atomically adds {@code delta} to a counter, creating it with value {@code delta} if absent.
     *
     * @param key the counter key
     * @param delta the amount to add
     * @return the new value, or {@code DECODE_ERROR} if the key holds non-numeric content
     */
    @NotNull
    CompletableFuture<TransactionResult<Long>> incrementCounter(@NotNull Key key, long delta);
}
