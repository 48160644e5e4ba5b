package io.github.flameyossnowy.docstore.mongodb;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.Optional;

/**
 * Session state of a {@link MongoDocumentStore}.
 */
public sealed interface ConnectionState permits ConnectionState.Disconnected, ConnectionState.Connected {
    static @NotNull ConnectionState disconnected() {
        return Disconnected.INSTANCE;
    }

    static @NotNull ConnectionState connected(@NotNull MongoConnection connection) {
        return new Connected(connection);
    }

    boolean isConnected();

    @NotNull
    Optional<MongoConnection> connection();

    final class Disconnected implements ConnectionState {
        static final Disconnected INSTANCE = new Disconnected();

        private Disconnected() {
        }

        @Override
        public boolean isConnected() {
            return false;
        }

        @Override
        public @NotNull Optional<MongoConnection> connection() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "Disconnected";
        }
    }

    record Connected(@NotNull MongoConnection current) implements ConnectionState {
        public Connected {
            Objects.requireNonNull(current, "current");
        }

        @Override
        public boolean isConnected() {
            return true;
        }

        @Override
        public @NotNull Optional<MongoConnection> connection() {
            return Optional.of(current);
        }
    }
}
