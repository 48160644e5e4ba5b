package io.github.flameyossnowy.docstore.api.batch;

import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.model.RawContent;
import io.github.flameyossnowy.docstore.api.program.Program;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * One document to create in a batch. The key is itself a program, so it can be
 * derived from the store (for example from a counter) when the item is processed.
 *
 * @param key produces the key of the new document
 * @param content the content to store
 */
public record BatchEntry(@NotNull Program<Key> key, @NotNull RawContent content) {
    public BatchEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(content, "content");
    }

    public static @NotNull BatchEntry of(@NotNull Key key, @NotNull RawContent content) {
        return new BatchEntry(Program.pure(key), content);
    }

    /**
     * A batch item ready to be created under a fixed key.
     */
    public static @NotNull TransactionResult<BatchEntry> item(@NotNull Key key, @NotNull RawContent content) {
        return TransactionResult.success(of(key, content));
    }

    /**
     * A batch item whose key is computed by a program when the item is reached.
     */
    public static @NotNull TransactionResult<BatchEntry> item(@NotNull Program<Key> key, @NotNull RawContent content) {
        return TransactionResult.success(new BatchEntry(key, content));
    }

    /**
     * A batch item that failed before reaching the store.
     */
    public static @NotNull TransactionResult<BatchEntry> failedItem(@NotNull Throwable cause) {
        return TransactionResult.failure(cause);
    }
}
