package io.github.flameyossnowy.docstore.api.batch;

import io.github.flameyossnowy.docstore.api.exceptions.DocumentException;
import io.github.flameyossnowy.docstore.api.exceptions.ErrorKind;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A failed batch item.
 *
 * @param index position of the item in the input sequence
 * @param cause why it failed
 */
public record BatchFailure(int index, @NotNull Throwable cause) {
    public BatchFailure {
        if (index < 0) throw new IllegalArgumentException("Batch index must not be negative: " + index);
        Objects.requireNonNull(cause, "cause");
    }

    public @NotNull ErrorKind kind() {
        return DocumentException.kindOf(cause);
    }

    public @NotNull DocumentException toException() {
        return DocumentException.batchItemFailure(index, cause);
    }
}
