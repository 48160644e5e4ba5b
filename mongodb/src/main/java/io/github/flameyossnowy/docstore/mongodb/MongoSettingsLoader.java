package io.github.flameyossnowy.docstore.mongodb;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.flameyossnowy.docstore.api.codec.JacksonDocumentCodec;
import io.github.flameyossnowy.docstore.api.exceptions.DocumentException;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads {@link MongoStoreSettings} from layered JSON sources.
 * <p>
 * The bundled classpath resource is read first, then the optional file in the working
 * directory; keys of a later source override earlier ones, absent keys keep their value.
 * A missing source is skipped. Unparseable JSON fails the load.
 */
public class MongoSettingsLoader {
    public static final String DEFAULT_RESOURCE = "docstore.json";
    public static final String DEFAULT_DEV_FILE = "docstore-dev.json";

    private static final Logger logger = LoggerFactory.getLogger(MongoSettingsLoader.class);

    private final String resourceName;
    private final Path devFile;
    private final ClassLoader classLoader;
    private final ObjectMapper objectMapper = JacksonDocumentCodec.createDefaultObjectMapper();

    public MongoSettingsLoader() {
        this(DEFAULT_RESOURCE, Path.of(DEFAULT_DEV_FILE));
    }

    public MongoSettingsLoader(@NotNull String resourceName, @NotNull Path devFile) {
        this(resourceName, devFile, MongoSettingsLoader.class.getClassLoader());
    }

    public MongoSettingsLoader(@NotNull String resourceName, @NotNull Path devFile, @NotNull ClassLoader classLoader) {
        this.resourceName = Objects.requireNonNull(resourceName, "resourceName");
        this.devFile = Objects.requireNonNull(devFile, "devFile");
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    public @NotNull TransactionResult<MongoStoreSettings> load() {
        MongoStoreSettings settings = new MongoStoreSettings();

        try (InputStream resource = classLoader.getResourceAsStream(resourceName)) {
            if (resource == null) {
                logger.debug("Settings resource {} not found on the classpath, skipping", resourceName);
            } else {
                settings = objectMapper.readerForUpdating(settings).readValue(resource);
                logger.debug("Applied settings from classpath resource {}", resourceName);
            }
        } catch (IOException | IllegalArgumentException e) {
            return TransactionResult.failure(DocumentException.backendFailure("Failed to read settings resource " + resourceName, e));
        }

        if (!Files.isRegularFile(devFile)) {
            logger.debug("Settings file {} not present, skipping", devFile.toAbsolutePath());
            return TransactionResult.success(settings);
        }

        try (InputStream file = Files.newInputStream(devFile)) {
            settings = objectMapper.readerForUpdating(settings).readValue(file);
            logger.info("Applied settings overrides from {}", devFile.toAbsolutePath());
        } catch (IOException | IllegalArgumentException e) {
            return TransactionResult.failure(DocumentException.backendFailure("Failed to read settings file " + devFile, e));
        }
        return TransactionResult.success(settings);
    }
}
