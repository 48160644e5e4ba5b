package io.github.flameyossnowy.docstore.mongodb;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;

/**
 * Connection settings for {@link MongoConnector}.
 * <p>
 * All values are optional. {@code host} is either {@code host[:port]} or a full
 * {@code mongodb://} / {@code mongodb+srv://} connection string.
 */
@SuppressWarnings("unused")
@JsonIgnoreProperties(ignoreUnknown = true)
public class MongoStoreSettings {
    private String host = "localhost";
    private String bucketName = "default";
    private String database = "docstore";
    private int ioPoolSize = 4;
    private int computationPoolSize = 4;
    private int kvEndpoints = 2;
    private long connectTimeoutMillis = 10000;
    private long operationTimeoutMillis = 0;

    @JsonSetter
    public MongoStoreSettings setHost(String host) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Host must be specified for MongoDB settings.");
        }
        this.host = host;
        return this;
    }

    @JsonSetter
    public MongoStoreSettings setBucketName(String bucketName) {
        if (bucketName == null || bucketName.isBlank()) {
            throw new IllegalArgumentException("Bucket name must be specified for MongoDB settings.");
        }
        this.bucketName = bucketName;
        return this;
    }

    @JsonSetter
    public MongoStoreSettings setDatabase(String database) {
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("Database must be specified for MongoDB settings.");
        }
        this.database = database;
        return this;
    }

    @JsonSetter
    public MongoStoreSettings setIoPoolSize(int ioPoolSize) {
        this.ioPoolSize = ioPoolSize;
        return this;
    }

    @JsonSetter
    public MongoStoreSettings setComputationPoolSize(int computationPoolSize) {
        this.computationPoolSize = computationPoolSize;
        return this;
    }

    @JsonSetter
    public MongoStoreSettings setKvEndpoints(int kvEndpoints) {
        this.kvEndpoints = kvEndpoints;
        return this;
    }

    @JsonSetter
    public MongoStoreSettings setConnectTimeoutMillis(long connectTimeoutMillis) {
        this.connectTimeoutMillis = connectTimeoutMillis;
        return this;
    }

    @JsonSetter
    public MongoStoreSettings setOperationTimeoutMillis(long operationTimeoutMillis) {
        this.operationTimeoutMillis = operationTimeoutMillis;
        return this;
    }

    /**
     * @return the host as a driver connection string
     */
    public String getConnectionString() {
        if (host.startsWith("mongodb://") || host.startsWith("mongodb+srv://")) return host;
        return "mongodb://" + host;
    }

    public String getHost() {
        return host;
    }

    public String getBucketName() {
        return bucketName;
    }

    public String getDatabase() {
        return database;
    }

    public int getIoPoolSize() {
        return ioPoolSize;
    }

    public int getComputationPoolSize() {
        return computationPoolSize;
    }

    public int getKvEndpoints() {
        return kvEndpoints;
    }

    public long getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public long getOperationTimeoutMillis() {
        return operationTimeoutMillis;
    }

    @Override
    public String toString() {
        return "MongoStoreSettings{" +
            "host='" + host + '\'' +
            ", bucketName='" + bucketName + '\'' +
            ", database='" + database + '\'' +
            ", ioPoolSize=" + ioPoolSize +
            ", computationPoolSize=" + computationPoolSize +
            ", kvEndpoints=" + kvEndpoints +
            ", connectTimeoutMillis=" + connectTimeoutMillis +
            ", operationTimeoutMillis=" + operationTimeoutMillis +
            '}';
    }
}
