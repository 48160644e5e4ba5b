import com.mongodb.MongoClientSettings;
import com.mongodb.ServerAddress;
import io.github.flameyossnowy.docstore.mongodb.MongoConnector;
import io.github.flameyossnowy.docstore.mongodb.MongoStoreSettings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MongoConnectorTest {
    @Test
    void settingsMapOntoDriverOptions() {
        MongoStoreSettings settings = new MongoStoreSettings()
            .setHost("db.internal:27018")
            .setIoPoolSize(3)
            .setKvEndpoints(7)
            .setConnectTimeoutMillis(1500)
            .setOperationTimeoutMillis(4000);

        MongoClientSettings clientSettings = MongoConnector.toClientSettings(settings);

        assertEquals(List.of(new ServerAddress("db.internal", 27018)), clientSettings.getClusterSettings().getHosts());
        assertEquals(7, clientSettings.getConnectionPoolSettings().getMaxSize());
        assertEquals(3, clientSettings.getConnectionPoolSettings().getMaxConnecting());
        assertEquals(1500, clientSettings.getClusterSettings().getServerSelectionTimeout(TimeUnit.MILLISECONDS));
        assertEquals(1500, clientSettings.getSocketSettings().getConnectTimeout(TimeUnit.MILLISECONDS));
        assertEquals(4000, clientSettings.getSocketSettings().getReadTimeout(TimeUnit.MILLISECONDS));
    }

    @Test
    void zeroOperationTimeoutKeepsDriverDefault() {
        MongoClientSettings clientSettings = MongoConnector.toClientSettings(new MongoStoreSettings());

        assertEquals(0, clientSettings.getSocketSettings().getReadTimeout(TimeUnit.MILLISECONDS));
        assertEquals(List.of(new ServerAddress("localhost", 27017)), clientSettings.getClusterSettings().getHosts());
    }
}
