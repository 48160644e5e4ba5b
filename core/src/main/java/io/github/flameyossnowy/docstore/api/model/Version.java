package io.github.flameyossnowy.docstore.api.model;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * CAS token assigned by the backend on every successful write.
 * <p>
 * {@link #NONE} stands for "no document yet" when returned, and for an
 * unconditional write when passed to an update.
 *
 * @param value the token
 */
public record Version(long value) {
    public static final Version NONE = new Version(0L);

    @Contract(value = "_ -> new", pure = true)
    public static @NotNull Version of(long value) {
        return new Version(value);
    }

    public boolean isNone() {
        return value == 0L;
    }

    /**
     * Derives the token that follows {@code previous} when {@code content} is written as
     * write number {@code sequence} of a backend. The result depends only on its arguments,
     * is never zero and never equals {@code previous}.
     * <p>
     * The sequence keeps a document that is removed and created again with the same content
     * from getting its old token back, so a writer still holding that token is rejected.
     *
     * @param previous the token being replaced, or {@link #NONE}
     * @param content the content being written
     * @param sequence the backend's write counter
     * @return the next token
     */
    public static @NotNull Version next(@NotNull Version previous, @NotNull RawContent content, long sequence) {
        long mixed = previous.value * 0x9E3779B97F4A7C15L + content.value().hashCode();
        mixed += sequence * 0xC2B2AE3D27D4EB4FL;
        mixed ^= (mixed >>> 33);
        mixed *= 0xFF51AFD7ED558CCDL;
        mixed ^= (mixed >>> 33);
        if (mixed == 0L || mixed == previous.value) {
            mixed = previous.value + 1;
            if (mixed == 0L) mixed = 1L;
        }
        return new Version(mixed);
    }
}
