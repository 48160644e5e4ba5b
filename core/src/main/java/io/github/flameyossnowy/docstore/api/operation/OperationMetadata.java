package io.github.flameyossnowy.docstore.api.operation;

import io.github.flameyossnowy.docstore.api.model.Key;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Descriptive facts about an operation, used when logging dispatches.
 *
 * @param description human readable name of the operation
 * @param mutating whether running the operation may change stored data
 * @param idempotent whether running it twice in a row has the same outcome as running it once
 */
public record OperationMetadata(@NotNull String description, boolean mutating, boolean idempotent) {
    public OperationMetadata {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Operation description must not be blank.");
        }
    }

    public static @NotNull Builder builder(@NotNull String description) {
        return new Builder(description);
    }

    /**
     * @param key the targeted key, if any
     * @return the description followed by the key
     */
    public @NotNull String describe(@Nullable Key key) {
        return key == null ? description : description + " [" + key + "]";
    }

    public static class Builder {
        private final String description;
        private boolean mutating = false;
        private boolean idempotent = false;

        private Builder(String description) {
            this.description = description;
        }

        public Builder mutating(boolean mutating) {
            this.mutating = mutating;
            return this;
        }

        public Builder idempotent(boolean idempotent) {
            this.idempotent = idempotent;
            return this;
        }

        public OperationMetadata build() {
            return new OperationMetadata(description, mutating, idempotent);
        }
    }
}
