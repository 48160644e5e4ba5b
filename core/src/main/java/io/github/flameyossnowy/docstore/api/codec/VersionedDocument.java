package io.github.flameyossnowy.docstore.api.codec;

import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.model.Version;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A decoded document together with the version it was read or written at.
 *
 * @param key the document key
 * @param value the decoded value
 * @param version the CAS token to pass to the next update
 */
public record VersionedDocument<T>(@NotNull Key key, @NotNull T value, @NotNull Version version) {
    public VersionedDocument {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(version, "version");
    }

    /**
     * Same key and version, new value. Nothing is written until the result is passed to an update.
     */
    public @NotNull VersionedDocument<T> with(@NotNull T newValue) {
        return new VersionedDocument<>(key, newValue, version);
    }

    public @NotNull VersionedDocument<T> map(@NotNull UnaryOperator<T> function) {
        return with(function.apply(value));
    }
}
