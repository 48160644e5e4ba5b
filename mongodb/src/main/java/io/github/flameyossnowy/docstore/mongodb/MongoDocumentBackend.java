package io.github.flameyossnowy.docstore.mongodb;

import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.reactivestreams.client.MongoCollection;
import io.github.flameyossnowy.docstore.api.backend.DocumentBackend;
import io.github.flameyossnowy.docstore.api.exceptions.DocumentException;
import io.github.flameyossnowy.docstore.api.exceptions.ErrorKind;
import io.github.flameyossnowy.docstore.api.model.DocumentValue;
import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.model.RawContent;
import io.github.flameyossnowy.docstore.api.model.Version;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import io.github.flameyossnowy.docstore.api.utils.Futures;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.jetbrains.annotations.NotNull;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.function.Supplier;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.exists;
import static com.mongodb.client.model.Updates.combine;
import static com.mongodb.client.model.Updates.inc;
import static com.mongodb.client.model.Updates.set;
import static com.mongodb.client.model.Updates.unset;

/**
 * {@link DocumentBackend} over a MongoDB collection, using the reactive-streams driver.
 * <p>
 * Documents are stored as {@code {_id, content, cas}} and counters as
 * {@code {_id, counter, cas}}. Every write assigns a new random non-zero {@code cas}.
 * Results are delivered on the completion executor, never on a driver thread.
 */
public class MongoDocumentBackend implements DocumentBackend {
    static final String ID = "_id";
    static final String CONTENT = "content";
    static final String COUNTER = "counter";
    static final String CAS = "cas";

    private static final Logger logger = LoggerFactory.getLogger(MongoDocumentBackend.class);
    private static final int MAX_COUNTER_ATTEMPTS = 5;
    private static final FindOneAndUpdateOptions RETURN_AFTER = new FindOneAndUpdateOptions().returnDocument(ReturnDocument.AFTER);
    private static final FindOneAndUpdateOptions UPSERT_RETURN_AFTER = new FindOneAndUpdateOptions().upsert(true).returnDocument(ReturnDocument.AFTER);

    private final MongoCollection<Document> collection;
    private final Executor completionExecutor;
    private final BooleanSupplier connected;

    public MongoDocumentBackend(@NotNull MongoCollection<Document> collection, @NotNull Executor completionExecutor) {
        this(collection, completionExecutor, () -> true);
    }

    public MongoDocumentBackend(@NotNull MongoCollection<Document> collection, @NotNull Executor completionExecutor, @NotNull BooleanSupplier connected) {
        this.collection = Objects.requireNonNull(collection, "collection");
        this.completionExecutor = Objects.requireNonNull(completionExecutor, "completionExecutor");
        this.connected = Objects.requireNonNull(connected, "connected");
    }

    @Override
    public boolean isConnected() {
        return connected.getAsBoolean();
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<DocumentValue>> get(@NotNull Key key) {
        return call(key, "get", () -> collection.find(byId(key)).first(), () -> DocumentException.notFound(key))
            .thenApply(result -> result.flatMap(document -> toValue(key, document)));
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<DocumentValue>> create(@NotNull Key key, @NotNull RawContent content) {
        long cas = newCas();
        Document document = new Document(ID, key.value()).append(CONTENT, content.value()).append(CAS, cas);
        return call(key, "create", () -> collection.insertOne(document),
            () -> DocumentException.backendFailure(key, "Insert of [" + key + "] was not acknowledged", null),
            error -> MongoErrors.isDuplicateKey(error) ? DocumentException.alreadyExists(key) : null)
            .thenApply(result -> result.map(inserted -> DocumentValue.of(content, Version.of(cas))));
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<DocumentValue>> update(@NotNull Key key, @NotNull RawContent content, @NotNull Version version) {
        Bson filter = version.isNone() ? byId(key) : and(byId(key), eq(CAS, version.value()));
        Bson change = combine(set(CONTENT, content.value()), set(CAS, newCas()), unset(COUNTER));

        CompletableFuture<TransactionResult<DocumentValue>> replaced =
            call(key, "update", () -> collection.findOneAndUpdate(filter, change, RETURN_AFTER), () -> DocumentException.notFound(key))
                .thenApply(result -> result.flatMap(document -> toValue(key, document)));
        if (version.isNone()) return replaced;

        return replaced.thenCompose(result -> result.isErrorOf(ErrorKind.NOT_FOUND)
            ? explainMissedUpdate(key, version)
            : CompletableFuture.completedFuture(result));
    }

    /**
     * A conditional update matched nothing: either the document is gone or its version moved on.
     */
    private CompletableFuture<TransactionResult<DocumentValue>> explainMissedUpdate(Key key, Version expected) {
        return call(key, "update", () -> collection.find(byId(key)).first(), () -> DocumentException.notFound(key))
            .thenApply(result -> result.flatMap(document -> {
                Object stored = document.get(CAS);
                Version actual = stored instanceof Number number ? Version.of(number.longValue()) : null;
                logger.debug("Conditional update of [{}] rejected, expected {} but found {}", key, expected.value(), actual);
                return TransactionResult.<DocumentValue>failure(DocumentException.versionConflict(key, expected, actual));
            }));
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<Boolean>> remove(@NotNull Key key) {
        return call(key, "remove", () -> collection.deleteOne(byId(key)),
            () -> DocumentException.backendFailure(key, "Delete of [" + key + "] was not acknowledged", null))
            .thenApply(result -> result.flatMap(deleted -> deletedAny(key, deleted)));
    }

    @Override
    public @NotNull CompletableFuture<TransactionResult<Long>> getCounter(@NotNull Key key) {
        return call(key, "getCounter", () -> collection.find(byId(key)).first(), () -> DocumentException.notFound(key))
            .thenApply(result -> result.flatMap(document -> toCounter(key, document)));
    }

    /**
     * Adds {@code delta} to a counter, creating it with {@code delta} when the key is absent.
     * <p>
     * The upsert skips documents holding content. When it collides on {@code _id}, the key is
     * read again: a counter created in the meantime is incremented by another upsert, a document
     * whose content is a number is turned into a counter under its current {@code cas}, and any
     * other content is a {@code DECODE_ERROR}.
     */
    @Override
    public @NotNull CompletableFuture<TransactionResult<Long>> incrementCounter(@NotNull Key key, long delta) {
        return incrementCounter(key, delta, 1);
    }

    private CompletableFuture<TransactionResult<Long>> incrementCounter(Key key, long delta, int attempt) {
        Bson filter = and(byId(key), exists(CONTENT, false));
        Bson change = combine(inc(COUNTER, delta), set(CAS, newCas()));
        return call(key, "incrementCounter", () -> collection.findOneAndUpdate(filter, change, UPSERT_RETURN_AFTER),
            () -> DocumentException.backendFailure(key, "Counter upsert of [" + key + "] returned nothing", null),
            error -> MongoErrors.isDuplicateKey(error) ? DocumentException.alreadyExists(key) : null)
            .thenCompose(result -> result.isErrorOf(ErrorKind.ALREADY_EXISTS)
                ? resolveCounterCollision(key, delta, attempt)
                : CompletableFuture.completedFuture(result.flatMap(document -> toCounter(key, document))));
    }

    private CompletableFuture<TransactionResult<Long>> resolveCounterCollision(Key key, long delta, int attempt) {
        if (attempt >= MAX_COUNTER_ATTEMPTS) {
            return Futures.failure(DocumentException.backendFailure(key,
                "Increment of [" + key + "] still contended after " + attempt + " attempts", null));
        }

        return call(key, "incrementCounter", () -> collection.find(byId(key)).first(), () -> DocumentException.notFound(key))
            .thenCompose(result -> {
                // Removed in between: try the upsert again.
                if (result.isErrorOf(ErrorKind.NOT_FOUND)) return incrementCounter(key, delta, attempt + 1);
                if (result.isError()) return Futures.<Long>failure(result.getError().orElseThrow());

                Document stored = result.getOr(null);
                if (!(stored.get(CONTENT) instanceof String)) {
                    logger.debug("Counter [{}] was created concurrently, retrying increment", key);
                    return incrementCounter(key, delta, attempt + 1);
                }
                return convertToCounter(key, stored, delta, attempt);
            });
    }

    private CompletableFuture<TransactionResult<Long>> convertToCounter(Key key, Document stored, long delta, int attempt) {
        TransactionResult<Long> current = toCounter(key, stored);
        if (current.isError()) return CompletableFuture.completedFuture(current);

        long updated;
        try {
            updated = Math.addExact(current.getOr(0L), delta);
        } catch (ArithmeticException e) {
            return Futures.failure(DocumentException.backendFailure(key, "Incrementing [" + key + "] by " + delta + " overflows", e));
        }

        Bson filter = and(byId(key), eq(CONTENT, stored.get(CONTENT)), eq(CAS, stored.get(CAS)));
        Bson change = combine(set(COUNTER, updated), set(CAS, newCas()), unset(CONTENT));
        return call(key, "incrementCounter", () -> collection.findOneAndUpdate(filter, change, RETURN_AFTER), () -> DocumentException.notFound(key))
            .thenCompose(result -> result.isErrorOf(ErrorKind.NOT_FOUND)
                ? incrementCounter(key, delta, attempt + 1)
                : CompletableFuture.completedFuture(result.flatMap(document -> toCounter(key, document))));
    }

    private <T> CompletableFuture<TransactionResult<T>> call(Key key, String operation,
                                                             Supplier<Publisher<T>> publisher,
                                                             Supplier<? extends Throwable> onEmpty) {
        return call(key, operation, publisher, onEmpty, error -> null);
    }

    /**
     * Runs one driver call and settles it on the completion executor.
     *
     * @param special maps driver errors that have a specific meaning for this call, or returns null
     */
    private <T> CompletableFuture<TransactionResult<T>> call(Key key, String operation,
                                                             Supplier<Publisher<T>> publisher,
                                                             Supplier<? extends Throwable> onEmpty,
                                                             Function<Throwable, DocumentException> special) {
        CompletableFuture<T> future;
        try {
            future = SingleResultSubscriber.first(publisher.get(), onEmpty);
        } catch (RuntimeException e) {
            logger.error("MongoDB {} failed for key [{}]", operation, key, e);
            return Futures.failure(MongoErrors.translate(key, operation, e));
        }

        return future.handleAsync((value, error) -> {
            if (error == null) return TransactionResult.success(value);

            Throwable cause = Futures.unwrap(error);
            DocumentException mapped = special.apply(cause);
            if (mapped != null) return TransactionResult.<T>failure(mapped);
            if (!(cause instanceof DocumentException)) {
                logger.warn("MongoDB {} failed for key [{}]: {}", operation, key, cause.getMessage());
            }
            return TransactionResult.<T>failure(MongoErrors.translate(key, operation, cause));
        }, completionExecutor);
    }

    private static Bson byId(Key key) {
        return eq(ID, key.value());
    }

    private static TransactionResult<Boolean> deletedAny(Key key, DeleteResult deleted) {
        return deleted.getDeletedCount() == 0
            ? TransactionResult.failure(DocumentException.notFound(key))
            : TransactionResult.success(true);
    }

    static TransactionResult<DocumentValue> toValue(Key key, Document document) {
        Version version = Version.of(casOf(document));
        Object content = document.get(CONTENT);
        if (content instanceof String text) {
            return TransactionResult.success(DocumentValue.of(RawContent.of(text), version));
        }
        Object counter = document.get(COUNTER);
        if (counter instanceof Number number) {
            return TransactionResult.success(DocumentValue.of(RawContent.of(Long.toString(number.longValue())), version));
        }
        return TransactionResult.failure(DocumentException.decodeError(key, "Stored document [" + key + "] has neither content nor counter", null));
    }

    static TransactionResult<Long> toCounter(Key key, Document document) {
        Object counter = document.get(COUNTER);
        if (counter instanceof Number number) return TransactionResult.success(number.longValue());

        Object content = document.get(CONTENT);
        if (content instanceof String text) {
            try {
                return TransactionResult.success(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return TransactionResult.failure(DocumentException.decodeError(key, "Content of [" + key + "] is not a counter", e));
            }
        }
        return TransactionResult.failure(DocumentException.decodeError(key, "Stored document [" + key + "] is not a counter", null));
    }

    private static long casOf(Document document) {
        Object cas = document.get(CAS);
        return cas instanceof Number number ? number.longValue() : 0L;
    }

    private static long newCas() {
        long cas;
        do {
            cas = ThreadLocalRandom.current().nextLong();
        } while (cas == 0L);
        return cas;
    }
}
