package io.github.flameyossnowy.docstore.mongodb;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import com.mongodb.reactivestreams.client.MongoCollection;
import com.mongodb.reactivestreams.client.MongoDatabase;
import io.github.flameyossnowy.docstore.api.exceptions.DocumentException;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import io.github.flameyossnowy.docstore.api.utils.Futures;
import org.bson.Document;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Opens {@link MongoConnection}s.
 * <p>
 * The deployment is pinged before the connection is handed out, so an unreachable
 * host fails here rather than on the first operation.
 */
public class MongoConnector {
    private static final Logger logger = LoggerFactory.getLogger(MongoConnector.class);

    /**
     * Connects and verifies the deployment responds. Blocks until the ping completes
     * or server selection times out.
     *
     * @param settings the settings to connect with
     * @return the open connection, or a {@code BACKEND_FAILURE}
     */
    public @NotNull TransactionResult<MongoConnection> connect(@NotNull MongoStoreSettings settings) {
        logger.info("Attempting connection to {}", settings.getHost());

        MongoClient client;
        try {
            client = createClient(toClientSettings(settings));
        } catch (RuntimeException e) {
            logger.error("Failed to create MongoDB client for {}", settings.getHost(), e);
            return TransactionResult.failure(DocumentException.backendFailure("Failed to connect to " + settings.getHost() + ": " + e.getMessage(), e));
        }

        try {
            MongoDatabase database = client.getDatabase(settings.getDatabase());
            SingleResultSubscriber.first(database.runCommand(new Document("ping", 1)),
                () -> DocumentException.backendFailure("Ping to " + settings.getHost() + " returned nothing", null)).join();

            MongoCollection<Document> collection = database.getCollection(settings.getBucketName());
            MongoConnection connection = new MongoConnection(client, collection, createCompletionExecutor(settings.getComputationPoolSize()));
            logger.info("Connected to {} ({}.{})", settings.getHost(), settings.getDatabase(), settings.getBucketName());
            return TransactionResult.success(connection);
        } catch (RuntimeException e) {
            Throwable cause = Futures.unwrap(e);
            logger.error("Failed to connect to {}", settings.getHost(), cause);
            client.close();
            return TransactionResult.failure(DocumentException.backendFailure("Failed to connect to " + settings.getHost() + ": " + cause.getMessage(), cause));
        }
    }

    protected @NotNull MongoClient createClient(@NotNull MongoClientSettings clientSettings) {
        return MongoClients.create(clientSettings);
    }

    public static @NotNull MongoClientSettings toClientSettings(@NotNull MongoStoreSettings settings) {
        long connectTimeout = settings.getConnectTimeoutMillis();
        long operationTimeout = settings.getOperationTimeoutMillis();
        return MongoClientSettings.builder()
            .applyConnectionString(new ConnectionString(settings.getConnectionString()))
            .applyToConnectionPoolSettings(pool -> pool
                .maxSize(Math.max(1, settings.getKvEndpoints()))
                .maxConnecting(Math.max(1, settings.getIoPoolSize())))
            .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(connectTimeout, TimeUnit.MILLISECONDS))
            .applyToSocketSettings(socket -> {
                socket.connectTimeout((int) connectTimeout, TimeUnit.MILLISECONDS);
                if (operationTimeout > 0) socket.readTimeout((int) operationTimeout, TimeUnit.MILLISECONDS);
            })
            .build();
    }

    private static ExecutorService createCompletionExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "docstore-completion-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, threads), factory);
    }
}
