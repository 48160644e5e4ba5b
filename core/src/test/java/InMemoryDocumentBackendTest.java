import io.github.flameyossnowy.docstore.api.exceptions.ErrorKind;
import io.github.flameyossnowy.docstore.api.memory.InMemoryDocumentBackend;
import io.github.flameyossnowy.docstore.api.memory.MemoryRun;
import io.github.flameyossnowy.docstore.api.model.DocumentValue;
import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.model.RawContent;
import io.github.flameyossnowy.docstore.api.model.Version;
import io.github.flameyossnowy.docstore.api.program.Program;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDocumentBackendTest {
    static final Key ORDER = Key.of("order::17");

    static Program<DocumentValue> placeAndAmend() {
        return Program.create(ORDER, RawContent.of("{\"items\":1}"))
            .andThen(doc -> Program.update(ORDER, RawContent.of("{\"items\":2}"), doc.version()))
            .andThen(doc -> Program.incrementCounter(Key.of("orders"), 1).then(Program.get(ORDER)));
    }

    @Test
    void runLeavesStartMapUntouched() {
        Map<Key, DocumentValue> start = new HashMap<>();
        start.put(Key.of("existing"), DocumentValue.of("{}", 7));

        MemoryRun<DocumentValue> run = InMemoryDocumentBackend.run(start, placeAndAmend());

        assertTrue(run.result().isSuccess());
        assertEquals(1, start.size());
        assertEquals(3, run.state().size());
        assertEquals(DocumentValue.of("{}", 7), run.state().get(Key.of("existing")));
    }

    @Test
    void replayFromSameStartIsDeterministic() {
        Map<Key, DocumentValue> start = Map.of(Key.of("orders"), DocumentValue.of("41", 3));

        MemoryRun<DocumentValue> first = InMemoryDocumentBackend.run(start, placeAndAmend());
        MemoryRun<DocumentValue> second = InMemoryDocumentBackend.run(start, placeAndAmend());

        assertEquals(first.state(), second.state());
        assertEquals(first.result().expect(), second.result().expect());
        assertEquals(RawContent.of("42"), first.state().get(Key.of("orders")).content());
    }

    @Test
    void resultingStateIsImmutable() {
        MemoryRun<DocumentValue> run = InMemoryDocumentBackend.run(Map.of(), placeAndAmend());

        assertThrows(UnsupportedOperationException.class, () -> run.state().remove(ORDER));
    }

    @Test
    void snapshotDoesNotFollowLaterWrites() {
        InMemoryDocumentBackend backend = new InMemoryDocumentBackend();
        backend.create(ORDER, RawContent.of("{}")).join();

        Map<Key, DocumentValue> snapshot = backend.snapshot();
        backend.remove(ORDER).join();

        assertTrue(snapshot.containsKey(ORDER));
        assertTrue(backend.snapshot().isEmpty());
    }

    @Test
    void everyWriteProducesANewNonZeroVersion() {
        InMemoryDocumentBackend backend = new InMemoryDocumentBackend();
        RawContent same = RawContent.of("{\"same\":true}");

        Version v1 = backend.create(ORDER, same).join().expect().version();
        Version v2 = backend.update(ORDER, same, v1).join().expect().version();
        Version v3 = backend.update(ORDER, same, Version.NONE).join().expect().version();

        assertFalse(v1.isNone());
        assertFalse(v2.isNone());
        assertNotEquals(v1, v2);
        assertNotEquals(v2, v3);
    }

    @Test
    void counterWithSurroundingWhitespaceStillParses() {
        InMemoryDocumentBackend backend = new InMemoryDocumentBackend(Map.of(Key.of("c"), DocumentValue.of(" 9 ", 1)));

        assertEquals(9L, backend.getCounter(Key.of("c")).join().expect());
        assertEquals(10L, backend.incrementCounter(Key.of("c"), 1).join().expect());
    }

    @Test
    void conflictLeavesDocumentUnchanged() {
        InMemoryDocumentBackend backend = new InMemoryDocumentBackend();
        DocumentValue created = backend.create(ORDER, RawContent.of("{\"a\":1}")).join().expect();

        assertTrue(backend.update(ORDER, RawContent.of("{\"a\":2}"), Version.of(created.version().value() + 1))
            .join().isErrorOf(ErrorKind.VERSION_CONFLICT));
        assertEquals(created, backend.get(ORDER).join().expect());
    }

    @Test
    void incrementPastLongRangeFailsAndKeepsCounter() {
        Key counter = Key.of("c");
        InMemoryDocumentBackend backend = new InMemoryDocumentBackend(Map.of(counter, DocumentValue.of(Long.toString(Long.MAX_VALUE), 1)));

        assertTrue(backend.incrementCounter(counter, 1).join().isErrorOf(ErrorKind.BACKEND_FAILURE));
        assertTrue(backend.incrementCounter(counter, -1).join().isSuccess());
        assertEquals(Long.MAX_VALUE - 1, backend.getCounter(counter).join().expect());
    }

    @Test
    void recreatedDocumentRejectsTokenOfItsPredecessor() {
        InMemoryDocumentBackend backend = new InMemoryDocumentBackend();
        RawContent content = RawContent.of("{\"a\":1}");
        Version stale = backend.create(ORDER, content).join().expect().version();

        backend.remove(ORDER).join().expect();
        DocumentValue recreated = backend.create(ORDER, content).join().expect();

        assertNotEquals(stale, recreated.version());
        assertTrue(backend.update(ORDER, RawContent.of("{\"a\":2}"), stale).join().isErrorOf(ErrorKind.VERSION_CONFLICT));
    }

    @Test
    void backendBuiltFromSnapshotDoesNotReissueTokens() {
        RawContent content = RawContent.of("{\"a\":1}");
        MemoryRun<DocumentValue> first = InMemoryDocumentBackend.run(Map.of(), Program.create(ORDER, content));
        Version stale = first.result().expect().version();

        MemoryRun<DocumentValue> second = InMemoryDocumentBackend.run(first.state(),
            Program.remove(ORDER).then(Program.create(ORDER, content)));

        assertNotEquals(stale, second.result().expect().version());
    }
}
