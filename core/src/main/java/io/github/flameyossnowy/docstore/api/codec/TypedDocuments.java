package io.github.flameyossnowy.docstore.api.codec;

import io.github.flameyossnowy.docstore.api.batch.BatchEntry;
import io.github.flameyossnowy.docstore.api.model.DocumentValue;
import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.model.RawContent;
import io.github.flameyossnowy.docstore.api.model.Version;
import io.github.flameyossnowy.docstore.api.program.Program;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Builds programs over typed documents using a {@link DocumentCodec}.
 * <p>
 * Decoding happens inside the program, so a document that cannot be decoded
 * fails the program with {@code DECODE_ERROR} like any other stage.
 *
 * @param <T> the document type
 */
public class TypedDocuments<T> {
    private final DocumentCodec<T> codec;

    public TypedDocuments(@NotNull DocumentCodec<T> codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public @NotNull DocumentCodec<T> getCodec() {
        return codec;
    }

    public @NotNull Program<VersionedDocument<T>> get(@NotNull Key key) {
        return Program.get(key).andThen(stored -> decode(key, stored));
    }

    public @NotNull Program<VersionedDocument<T>> create(@NotNull T value) {
        return keyOf(value).andThen(key -> encode(value)
            .andThen(content -> Program.create(key, content).map(stored -> new VersionedDocument<T>(key, value, stored.version()))));
    }

    /**
     * Writes {@code document.value()} if the stored version still equals {@code document.version()}.
     */
    public @NotNull Program<VersionedDocument<T>> update(@NotNull VersionedDocument<T> document) {
        return write(document.key(), document.value(), document.version());
    }

    /**
     * Writes {@code value} regardless of the stored version.
     */
    public @NotNull Program<VersionedDocument<T>> replace(@NotNull T value) {
        return keyOf(value).andThen(key -> write(key, value, Version.NONE));
    }

    public @NotNull Program<Boolean> remove(@NotNull Key key) {
        return Program.remove(key);
    }

    /**
     * Reads, transforms and writes back a document, guarded by the version that was read.
     * A concurrent write in between makes the program fail with {@code VERSION_CONFLICT};
     * it is not retried.
     *
     * @param key the document key
     * @param function the transformation
     * @return the program
     */
    public @NotNull Program<VersionedDocument<T>> modify(@NotNull Key key, @NotNull UnaryOperator<T> function) {
        Objects.requireNonNull(function, "function");
        return get(key).andThen(current -> update(current.map(function)));
    }

    /**
     * Turns values into batch items lazily. A value that fails to serialize becomes a failed item.
     *
     * @param values the values to create
     * @return items for {@link Program#batchCreate}
     */
    public @NotNull Iterable<TransactionResult<BatchEntry>> batchItems(@NotNull Iterable<? extends T> values) {
        Objects.requireNonNull(values, "values");
        return () -> new Iterator<>() {
            private final Iterator<? extends T> source = values.iterator();

            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public TransactionResult<BatchEntry> next() {
                T value = source.next();
                return TransactionResult.attempt(() -> codec.keyFor(value))
                    .flatMap(key -> codec.serialize(value).map(content -> BatchEntry.of(key, content)));
            }
        };
    }

    private Program<VersionedDocument<T>> write(Key key, T value, Version version) {
        return encode(value).andThen(content -> Program.update(key, content, version).map(stored -> new VersionedDocument<T>(key, value, stored.version())));
    }

    /**
     * A key function that throws fails the program when it runs, not when it is built.
     */
    private Program<Key> keyOf(T value) {
        return Program.fromResult(TransactionResult.attempt(() -> codec.keyFor(value)));
    }

    private Program<RawContent> encode(T value) {
        return Program.fromResult(codec.serialize(value));
    }

    private Program<VersionedDocument<T>> decode(Key key, DocumentValue stored) {
        return Program.fromResult(codec.deserialize(key, stored.content()).map(value -> new VersionedDocument<T>(key, value, stored.version())));
    }
}
