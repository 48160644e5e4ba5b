package io.github.flameyossnowy.docstore.api.model;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Serialized payload of a document, usually JSON text.
 * The store never looks inside it.
 *
 * @param value the serialized content
 */
public record RawContent(@NotNull String value) {
    public RawContent {
        if (value == null) {
            throw new IllegalArgumentException("Document content must not be null.");
        }
    }

    @Contract(value = "_ -> new", pure = true)
    public static @NotNull RawContent of(@NotNull String value) {
        return new RawContent(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
