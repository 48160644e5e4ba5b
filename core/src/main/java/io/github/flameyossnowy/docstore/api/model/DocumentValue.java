package io.github.flameyossnowy.docstore.api.model;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A stored document as seen by a reader: its content and the CAS token of the revision read.
 *
 * @param content the serialized content
 * @param version the revision token
 */
public record DocumentValue(@NotNull RawContent content, @NotNull Version version) {
    @Contract(value = "_, _ -> new", pure = true)
    public static @NotNull DocumentValue of(@NotNull RawContent content, @NotNull Version version) {
        return new DocumentValue(content, version);
    }

    @Contract(value = "_, _ -> new", pure = true)
    public static @NotNull DocumentValue of(@NotNull String content, long version) {
        return new DocumentValue(RawContent.of(content), Version.of(version));
    }
}
