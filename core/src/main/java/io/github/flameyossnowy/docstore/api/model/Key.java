package io.github.flameyossnowy.docstore.api.model;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Identifier of a document in the store.
 * <p>
 * Keys are compared by value and are never blank.
 *
 * @param value the raw key string
 */
public record Key(@NotNull String value) {
    public Key {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Document key must not be null or blank.");
        }
    }

    @Contract(value = "_ -> new", pure = true)
    public static @NotNull Key of(@NotNull String value) {
        return new Key(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
