package io.github.flameyossnowy.docstore.mongodb;

import io.github.flameyossnowy.docstore.api.backend.DocumentBackend;
import io.github.flameyossnowy.docstore.api.batch.BatchEntry;
import io.github.flameyossnowy.docstore.api.batch.BatchOutcome;
import io.github.flameyossnowy.docstore.api.exceptions.DocumentException;
import io.github.flameyossnowy.docstore.api.model.DocumentValue;
import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.model.RawContent;
import io.github.flameyossnowy.docstore.api.model.Version;
import io.github.flameyossnowy.docstore.api.program.Program;
import io.github.flameyossnowy.docstore.api.program.ProgramInterpreter;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import io.github.flameyossnowy.docstore.api.utils.Futures;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.TestOnly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Entry point for running programs against MongoDB.
 * <p>
 * A store holds at most one live connection. Programs executed while it is
 * disconnected fail with {@code NOT_CONNECTED}.
 * <pre>{@code
 * MongoDocumentStore store = new MongoDocumentStore();
 * store.connect().expect();
 * TransactionResult<DocumentValue> doc = store.run(Program.get(Key.of("user::1")));
 * store.disconnect();
 * }</pre>
 * {@link #isConnected()} reflects the last successful connect without a disconnect; it is
 * no guarantee the server is still reachable.
 */
public class MongoDocumentStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MongoDocumentStore.class);

    private final MongoConnector connector;
    private final MongoSettingsLoader settingsLoader;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.disconnected());
    private final AtomicReference<ConnectionState> suspended = new AtomicReference<>();
    private final ProgramInterpreter interpreter = new ProgramInterpreter(new CurrentConnectionBackend());

    public MongoDocumentStore() {
        this(new MongoConnector(), new MongoSettingsLoader());
    }

    public MongoDocumentStore(@NotNull MongoConnector connector, @NotNull MongoSettingsLoader settingsLoader) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.settingsLoader = Objects.requireNonNull(settingsLoader, "settingsLoader");
    }

    /**
     * Connects using the layered configuration files.
     *
     * @return {@code true}, or the reason the settings could not be loaded or the connection failed
     */
    public @NotNull TransactionResult<Boolean> connect() {
        return settingsLoader.load().flatMap(this::connect);
    }

    /**
     * Connects with explicit settings. Does nothing if a connection is already open.
     *
     * @param settings the settings to use
     * @return {@code true}, or a {@code BACKEND_FAILURE}
     */
    public synchronized @NotNull TransactionResult<Boolean> connect(@NotNull MongoStoreSettings settings) {
        if (state.get().isConnected()) {
            logger.warn("Already connected, ignoring connect to {}", settings.getHost());
            return TransactionResult.success(true);
        }

        TransactionResult<MongoConnection> connection = connector.connect(settings);
        connection.ifSuccess(open -> state.set(ConnectionState.connected(open)));
        connection.ifError(error -> state.set(ConnectionState.disconnected()));
        return connection.map(open -> true);
    }

    /**
     * Closes the current connection, if any. Safe to call repeatedly.
     */
    public synchronized void disconnect() {
        ConnectionState previous = state.getAndSet(ConnectionState.disconnected());
        previous.connection().ifPresent(MongoConnection::close);
        ConnectionState parked = suspended.getAndSet(null);
        if (parked != null) parked.connection().ifPresent(MongoConnection::close);
    }

    @Override
    public void close() {
        disconnect();
    }

    public boolean isConnected() {
        return state.get().isConnected();
    }

    public @NotNull ConnectionState getState() {
        return state.get();
    }

    public <T> @NotNull CompletableFuture<TransactionResult<T>> execute(@NotNull Program<T> program) {
        return interpreter.execute(program);
    }

    /**
     * Runs a program and waits for it. Must not be called from inside a program stage.
     */
    public <T> @NotNull TransactionResult<T> run(@NotNull Program<T> program) {
        return interpreter.run(program);
    }

    public @NotNull BatchOutcome runBatch(@NotNull Iterable<TransactionResult<BatchEntry>> items,
                                          @NotNull Predicate<Throwable> continuation) {
        return interpreter.getBatchEngine().runBatch(items, continuation);
    }

    public @NotNull CompletableFuture<BatchOutcome> runBatchAsync(@NotNull Iterable<TransactionResult<BatchEntry>> items,
                                                                  @NotNull Predicate<Throwable> continuation) {
        return interpreter.getBatchEngine().runBatchAsync(items, continuation);
    }

    /**
     * Makes the store behave as disconnected without closing the connection.
     */
    @TestOnly
    public synchronized void suspendConnection() {
        ConnectionState current = state.getAndSet(ConnectionState.disconnected());
        if (current.isConnected()) suspended.set(current);
    }

    /**
     * Restores the connection parked by {@link #suspendConnection()}.
     */
    @TestOnly
    public synchronized void resumeConnection() {
        ConnectionState parked = suspended.getAndSet(null);
        if (parked != null) state.set(parked);
    }

    private final class CurrentConnectionBackend implements DocumentBackend {
        @Override
        public boolean isConnected() {
            return state.get().connection().map(MongoConnection::isOpen).orElse(false);
        }

        @Override
        public @NotNull CompletableFuture<TransactionResult<DocumentValue>> get(@NotNull Key key) {
            return withBackend(backend -> backend.get(key));
        }

        @Override
        public @NotNull CompletableFuture<TransactionResult<DocumentValue>> create(@NotNull Key key, @NotNull RawContent content) {
            return withBackend(backend -> backend.create(key, content));
        }

        @Override
        public @NotNull CompletableFuture<TransactionResult<DocumentValue>> update(@NotNull Key key, @NotNull RawContent content, @NotNull Version version) {
            return withBackend(backend -> backend.update(key, content, version));
        }

        @Override
        public @NotNull CompletableFuture<TransactionResult<Boolean>> remove(@NotNull Key key) {
            return withBackend(backend -> backend.remove(key));
        }

        @Override
        public @NotNull CompletableFuture<TransactionResult<Long>> getCounter(@NotNull Key key) {
            return withBackend(backend -> backend.getCounter(key));
        }

        @Override
        public @NotNull CompletableFuture<TransactionResult<Long>> incrementCounter(@NotNull Key key, long delta) {
            return withBackend(backend -> backend.incrementCounter(key, delta));
        }

        private <T> CompletableFuture<TransactionResult<T>> withBackend(Function<MongoDocumentBackend, CompletableFuture<TransactionResult<T>>> call) {
            return state.get().connection()
                .map(connection -> call.apply(connection.getBackend()))
                .orElseGet(() -> Futures.failure(DocumentException.notConnected()));
        }
    }
}
