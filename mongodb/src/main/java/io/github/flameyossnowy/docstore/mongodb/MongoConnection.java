package io.github.flameyossnowy.docstore.mongodb;

import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoCollection;
import org.bson.Document;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One open session against a MongoDB deployment: the client, the collection documents
 * live in, and the executor backend completions are handed to.
 */
public class MongoConnection implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MongoConnection.class);

    private final MongoClient client;
    private final MongoCollection<Document> collection;
    private final ExecutorService completionExecutor;
    private final MongoDocumentBackend backend;
    private final AtomicBoolean closed = new AtomicBoolean();

    public MongoConnection(@NotNull MongoClient client,
                           @NotNull MongoCollection<Document> collection,
                           @NotNull ExecutorService completionExecutor) {
        this.client = Objects.requireNonNull(client, "client");
        this.collection = Objects.requireNonNull(collection, "collection");
        this.completionExecutor = Objects.requireNonNull(completionExecutor, "completionExecutor");
        this.backend = new MongoDocumentBackend(collection, completionExecutor, this::isOpen);
    }

    public @NotNull MongoClient getClient() {
        return client;
    }

    public @NotNull MongoCollection<Document> getCollection() {
        return collection;
    }

    public @NotNull ExecutorService getCompletionExecutor() {
        return completionExecutor;
    }

    public @NotNull MongoDocumentBackend getBackend() {
        return backend;
    }

    public boolean isOpen() {
        return !closed.get();
    }

    /**
     * Closes the client and stops the completion executor. Calling it again does nothing.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            client.close();
        } finally {
            completionExecutor.shutdown();
        }
        logger.info("Closed MongoDB connection to collection {}", collection.getNamespace());
    }
}
