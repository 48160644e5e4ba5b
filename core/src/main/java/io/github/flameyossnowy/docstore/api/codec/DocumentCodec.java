package io.github.flameyossnowy.docstore.api.codec;

import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.model.RawContent;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.jetbrains.annotations.NotNull;

/**
 * Converts between typed values and stored content.
 *
 * @param <T> the document type
 */
public interface DocumentCodec<T> {
    /**
     * Serializes a value.
     *
     * @param value the value
     * @return the content, or a {@code DECODE_ERROR} failure
     */
    @NotNull
    TransactionResult<RawContent> serialize(@NotNull T value);

    /**
     * Reads a value back from stored content.
     *
     * @param key the key the content was stored under, used for error reporting
     * @param content the stored content
     * @return the value, or a {@code DECODE_ERROR} failure
     */
    @NotNull
    TransactionResult<T> deserialize(@NotNull Key key, @NotNull RawContent content);

    /**
     * @param value the value
     * @return the key the value is stored under
     */
    @NotNull
    Key keyFor(@NotNull T value);
}
