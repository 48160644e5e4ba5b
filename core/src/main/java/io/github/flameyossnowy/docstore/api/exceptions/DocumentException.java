package io.github.flameyossnowy.docstore.api.exceptions;

import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.model.Version;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Failure of a document operation, tagged with its {@link ErrorKind}.
 * <p>
 * Every failed {@code TransactionResult} produced by the store carries either
 * one of these or a foreign throwable, which {@link #kindOf(Throwable)} classifies
 * as {@link ErrorKind#BACKEND_FAILURE}.
 */
public class DocumentException extends RepositoryException {
    private final ErrorKind kind;
    private final Key key;

    public DocumentException(@NotNull ErrorKind kind, @Nullable Key key, String message) {
        super(message);
        this.kind = kind;
        this.key = key;
    }

    public DocumentException(@NotNull ErrorKind kind, @Nullable Key key, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.key = key;
    }

    public @NotNull ErrorKind getKind() {
        return kind;
    }

    public @NotNull Optional<Key> getKey() {
        return Optional.ofNullable(key);
    }

    public boolean is(@NotNull ErrorKind kind) {
        return this.kind == kind;
    }

    public static @NotNull ErrorKind kindOf(@Nullable Throwable throwable) {
        return throwable instanceof DocumentException documentException
            ? documentException.kind
            : ErrorKind.BACKEND_FAILURE;
    }

    @Contract(value = "-> new", pure = true)
    public static @NotNull DocumentException notConnected() {
        return new DocumentException(ErrorKind.NOT_CONNECTED, null, "Not connected");
    }

    @Contract(value = "_ -> new", pure = true)
    public static @NotNull DocumentException notFound(@NotNull Key key) {
        return new DocumentException(ErrorKind.NOT_FOUND, key, "No document found for key [" + key + "]");
    }

    @Contract(value = "_ -> new", pure = true)
    public static @NotNull DocumentException alreadyExists(@NotNull Key key) {
        return new DocumentException(ErrorKind.ALREADY_EXISTS, key, "A document already exists for key [" + key + "]");
    }

    @Contract(value = "_, _, _ -> new", pure = true)
    public static @NotNull DocumentException versionConflict(@NotNull Key key, @NotNull Version expected, @Nullable Version actual) {
        String stored = actual == null ? "unknown" : Long.toString(actual.value());
        return new DocumentException(ErrorKind.VERSION_CONFLICT, key,
            "Version mismatch for key [" + key + "]: supplied " + expected.value() + ", stored " + stored);
    }

    @Contract(value = "_, _, _ -> new", pure = true)
    public static @NotNull DocumentException decodeError(@Nullable Key key, String message, @Nullable Throwable cause) {
        return new DocumentException(ErrorKind.DECODE_ERROR, key, message, cause);
    }

    @Contract(value = "_, _ -> new", pure = true)
    public static @NotNull DocumentException backendFailure(String message, @Nullable Throwable cause) {
        return new DocumentException(ErrorKind.BACKEND_FAILURE, null, message, cause);
    }

    @Contract(value = "_, _, _ -> new", pure = true)
    public static @NotNull DocumentException backendFailure(@Nullable Key key, String message, @Nullable Throwable cause) {
        return new DocumentException(ErrorKind.BACKEND_FAILURE, key, message, cause);
    }

    @Contract(value = "_, _ -> new", pure = true)
    public static @NotNull DocumentException batchItemFailure(int index, @NotNull Throwable cause) {
        return new DocumentException(ErrorKind.BATCH_ITEM_FAILURE, null,
            "Batch item " + index + " failed: " + cause.getMessage(), cause);
    }
}
