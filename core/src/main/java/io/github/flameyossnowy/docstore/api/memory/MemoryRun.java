package io.github.flameyossnowy.docstore.api.memory;

import io.github.flameyossnowy.docstore.api.model.DocumentValue;
import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * Result of running a program against an in-memory map.
 *
 * @param result the program result
 * @param state the map after the run, unmodifiable
 */
public record MemoryRun<T>(@NotNull TransactionResult<T> result, @NotNull Map<Key, DocumentValue> state) {
    public MemoryRun {
        state = Map.copyOf(state);
    }
}
