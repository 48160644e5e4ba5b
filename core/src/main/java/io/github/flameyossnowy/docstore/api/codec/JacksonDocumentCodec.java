package io.github.flameyossnowy.docstore.api.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.flameyossnowy.docstore.api.exceptions.DocumentException;
import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.model.RawContent;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Function;

/**
 * JSON codec backed by Jackson.
 *
 * @param <T> the document type
 */
public class JacksonDocumentCodec<T> implements DocumentCodec<T> {
    private final Class<T> type;
    private final Function<? super T, Key> keyFunction;
    private final ObjectMapper objectMapper;

    public JacksonDocumentCodec(@NotNull Class<T> type, @NotNull Function<? super T, Key> keyFunction) {
        this(type, keyFunction, createDefaultObjectMapper());
    }

    public JacksonDocumentCodec(@NotNull Class<T> type, @NotNull Function<? super T, Key> keyFunction, @NotNull ObjectMapper objectMapper) {
        this.type = Objects.requireNonNull(type, "type");
        this.keyFunction = Objects.requireNonNull(keyFunction, "keyFunction");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Override
    public @NotNull TransactionResult<RawContent> serialize(@NotNull T value) {
        try {
            return TransactionResult.success(RawContent.of(objectMapper.writeValueAsString(value)));
        } catch (JsonProcessingException e) {
            return TransactionResult.failure(DocumentException.decodeError(null,
                "Failed to serialize " + type.getSimpleName() + ": " + e.getOriginalMessage(), e));
        }
    }

    @Override
    public @NotNull TransactionResult<T> deserialize(@NotNull Key key, @NotNull RawContent content) {
        try {
            T value = objectMapper.readValue(content.value(), type);
            if (value == null) {
                return TransactionResult.failure(DocumentException.decodeError(key, "Content of [" + key + "] is null", null));
            }
            return TransactionResult.success(value);
        } catch (JsonProcessingException e) {
            return TransactionResult.failure(DocumentException.decodeError(key,
                "Content of [" + key + "] is not a valid " + type.getSimpleName() + ": " + e.getOriginalMessage(), e));
        }
    }

    @Override
    public @NotNull Key keyFor(@NotNull T value) {
        return keyFunction.apply(value);
    }

    public Class<T> getType() {
        return type;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
