import io.github.flameyossnowy.docstore.api.exceptions.ErrorKind;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import io.github.flameyossnowy.docstore.mongodb.MongoSettingsLoader;
import io.github.flameyossnowy.docstore.mongodb.MongoStoreSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MongoSettingsLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void missingSourcesGiveDefaults() {
        MongoStoreSettings settings = new MongoSettingsLoader("no-such-resource.json", tempDir.resolve("absent.json")).load().expect();

        assertEquals("localhost", settings.getHost());
        assertEquals("default", settings.getBucketName());
        assertEquals("docstore", settings.getDatabase());
        assertEquals(4, settings.getIoPoolSize());
        assertEquals(4, settings.getComputationPoolSize());
        assertEquals(2, settings.getKvEndpoints());
        assertEquals(10000, settings.getConnectTimeoutMillis());
        assertEquals(0, settings.getOperationTimeoutMillis());
    }

    @Test
    void bundledResourceIsRead() {
        MongoStoreSettings settings = new MongoSettingsLoader().load().expect();

        assertEquals("localhost", settings.getHost());
        assertEquals("default", settings.getBucketName());
    }

    @Test
    void classpathResourceOverridesOnlyPresentKeys() {
        MongoStoreSettings settings = new MongoSettingsLoader("docstore-test.json", tempDir.resolve("absent.json")).load().expect();

        assertEquals("users", settings.getBucketName());
        assertEquals(6, settings.getIoPoolSize());
        assertEquals(2500, settings.getConnectTimeoutMillis());
        assertEquals("docstore", settings.getDatabase());
    }

    @Test
    void devFileWinsOverClasspathResource() throws IOException {
        Path devFile = tempDir.resolve("docstore-dev.json");
        Files.writeString(devFile, "{\"host\":\"db.internal:27018\",\"ioPoolSize\":2}");

        MongoStoreSettings settings = new MongoSettingsLoader("docstore-test.json", devFile).load().expect();

        assertEquals("db.internal:27018", settings.getHost());
        assertEquals(2, settings.getIoPoolSize());
        assertEquals("users", settings.getBucketName());
        assertEquals("mongodb://db.internal:27018", settings.getConnectionString());
    }

    @Test
    void malformedDevFileIsBackendFailure() throws IOException {
        Path devFile = tempDir.resolve("docstore-dev.json");
        Files.writeString(devFile, "{\"host\": ");

        TransactionResult<MongoStoreSettings> result = new MongoSettingsLoader("docstore-test.json", devFile).load();

        assertTrue(result.isErrorOf(ErrorKind.BACKEND_FAILURE));
    }

    @Test
    void blankHostIsRejected() throws IOException {
        Path devFile = tempDir.resolve("docstore-dev.json");
        Files.writeString(devFile, "{\"host\":\"  \"}");

        assertTrue(new MongoSettingsLoader("no-such-resource.json", devFile).load().isErrorOf(ErrorKind.BACKEND_FAILURE));
    }

    @Test
    void fullConnectionStringIsKept() {
        MongoStoreSettings settings = new MongoStoreSettings().setHost("mongodb+srv://cluster0.example.net");

        assertEquals("mongodb+srv://cluster0.example.net", settings.getConnectionString());
    }
}
