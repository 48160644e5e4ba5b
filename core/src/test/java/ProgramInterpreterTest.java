import io.github.flameyossnowy.docstore.api.backend.DocumentBackend;
import io.github.flameyossnowy.docstore.api.exceptions.DocumentException;
import io.github.flameyossnowy.docstore.api.exceptions.ErrorKind;
import io.github.flameyossnowy.docstore.api.memory.InMemoryDocumentBackend;
import io.github.flameyossnowy.docstore.api.model.DocumentValue;
import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.model.RawContent;
import io.github.flameyossnowy.docstore.api.model.Version;
import io.github.flameyossnowy.docstore.api.program.Program;
import io.github.flameyossnowy.docstore.api.program.ProgramInterpreter;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProgramInterpreterTest {
    static final Key KEY = Key.of("user::1");
    static final RawContent ALICE = RawContent.of("{\"name\":\"Alice\"}");
    static final RawContent BOB = RawContent.of("{\"name\":\"Bob\"}");

    @Mock
    DocumentBackend mockBackend;

    InMemoryDocumentBackend backend;
    ProgramInterpreter interpreter;

    @BeforeEach
    void setup() {
        backend = new InMemoryDocumentBackend();
        interpreter = new ProgramInterpreter(backend);
    }

    @Test
    void createThenGetReturnsSameContentAndVersion() {
        TransactionResult<DocumentValue> created = interpreter.run(Program.create(KEY, ALICE));
        TransactionResult<DocumentValue> read = interpreter.run(Program.get(KEY));

        assertTrue(created.isSuccess());
        assertFalse(created.expect().version().isNone());
        assertEquals(created.expect(), read.expect());
        assertEquals(ALICE, read.expect().content());
    }

    @Test
    void createOnExistingKeyFailsWithAlreadyExists() {
        interpreter.run(Program.create(KEY, ALICE));

        TransactionResult<DocumentValue> second = interpreter.run(Program.create(KEY, BOB));

        assertTrue(second.isErrorOf(ErrorKind.ALREADY_EXISTS));
        assertEquals(ALICE, interpreter.run(Program.get(KEY)).expect().content());
    }

    @Test
    void getMissingKeyFailsWithNotFound() {
        TransactionResult<DocumentValue> result = interpreter.run(Program.get(Key.of("missing")));

        assertEquals(ErrorKind.NOT_FOUND, result.errorKind().orElseThrow());
        DocumentException error = (DocumentException) result.getError().orElseThrow();
        assertEquals(Key.of("missing"), error.getKey().orElseThrow());
    }

    @Test
    void updateWithCurrentVersionSucceedsAndChangesVersion() {
        Version first = interpreter.run(Program.create(KEY, ALICE)).expect().version();

        DocumentValue updated = interpreter.run(Program.update(KEY, BOB, first)).expect();

        assertEquals(BOB, updated.content());
        assertNotEquals(first, updated.version());
        assertFalse(updated.version().isNone());
    }

    @Test
    void updateWithStaleVersionFailsWithVersionConflict() {
        Version first = interpreter.run(Program.create(KEY, ALICE)).expect().version();
        interpreter.run(Program.update(KEY, BOB, first)).expect();

        TransactionResult<DocumentValue> stale = interpreter.run(Program.update(KEY, ALICE, first));

        assertTrue(stale.isErrorOf(ErrorKind.VERSION_CONFLICT));
        assertEquals(BOB, interpreter.run(Program.get(KEY)).expect().content());
    }

    @Test
    void updateWithNoneVersionIsUnconditional() {
        interpreter.run(Program.create(KEY, ALICE)).expect();

        TransactionResult<DocumentValue> result = interpreter.run(Program.update(KEY, BOB, Version.NONE));

        assertTrue(result.isSuccess());
        assertEquals(BOB, interpreter.run(Program.get(KEY)).expect().content());
    }

    @Test
    void updateMissingKeyFailsWithNotFound() {
        assertTrue(interpreter.run(Program.update(KEY, BOB, Version.NONE)).isErrorOf(ErrorKind.NOT_FOUND));
        assertTrue(interpreter.run(Program.update(KEY, BOB, Version.of(42))).isErrorOf(ErrorKind.NOT_FOUND));
    }

    @Test
    void removeDeletesOnceThenReportsNotFound() {
        interpreter.run(Program.create(KEY, ALICE)).expect();

        assertTrue(interpreter.run(Program.remove(KEY)).expect());
        assertTrue(interpreter.run(Program.remove(KEY)).isErrorOf(ErrorKind.NOT_FOUND));
        assertTrue(interpreter.run(Program.get(KEY)).isErrorOf(ErrorKind.NOT_FOUND));
    }

    @Test
    void incrementCreatesCounterWithDeltaThenAdds() {
        Key counter = Key.of("counter::visits");

        assertEquals(10L, interpreter.run(Program.incrementCounter(counter, 10)).expect());
        assertEquals(15L, interpreter.run(Program.incrementCounter(counter, 5)).expect());
        assertEquals(12L, interpreter.run(Program.incrementCounter(counter, -3)).expect());
        assertEquals(12L, interpreter.run(Program.getCounter(counter)).expect());
        assertEquals("12", interpreter.run(Program.get(counter)).expect().content().value());
    }

    @Test
    void counterOperationsOnJsonDocumentFailWithDecodeError() {
        interpreter.run(Program.create(KEY, ALICE)).expect();

        assertTrue(interpreter.run(Program.getCounter(KEY)).isErrorOf(ErrorKind.DECODE_ERROR));
        assertTrue(interpreter.run(Program.incrementCounter(KEY, 1)).isErrorOf(ErrorKind.DECODE_ERROR));
        assertEquals(ALICE, interpreter.run(Program.get(KEY)).expect().content());
    }

    @Test
    void getCounterOnMissingKeyFailsWithNotFound() {
        assertTrue(interpreter.run(Program.getCounter(Key.of("nothing"))).isErrorOf(ErrorKind.NOT_FOUND));
    }

    @Test
    void failedStageSkipsLaterStages() {
        AtomicBoolean reached = new AtomicBoolean();

        Program<DocumentValue> program = Program.get(Key.of("missing"))
            .andThen(doc -> Program.create(KEY, doc.content()))
            .andThen(doc -> {
                reached.set(true);
                return Program.pure(doc);
            });

        TransactionResult<DocumentValue> result = interpreter.run(program);

        assertTrue(result.isErrorOf(ErrorKind.NOT_FOUND));
        assertFalse(reached.get());
        assertTrue(backend.snapshot().isEmpty());
    }

    @Test
    void stagesRunInDeclaredOrder() {
        List<String> order = new ArrayList<>();

        Program<Long> program = Program.incrementCounter(Key.of("seq"), 1)
            .andThen(first -> {
                order.add("first=" + first);
                return Program.incrementCounter(Key.of("seq"), 1);
            })
            .map(second -> {
                order.add("second=" + second);
                return second * 100;
            });

        assertEquals(200L, interpreter.run(program).expect());
        assertEquals(List.of("first=1", "second=2"), order);
    }

    @Test
    void readModifyWriteUsesReadVersion() {
        interpreter.run(Program.create(KEY, ALICE)).expect();

        Program<DocumentValue> rename = Program.get(KEY)
            .andThen(doc -> Program.update(KEY, BOB, doc.version()));

        assertEquals(BOB, interpreter.run(rename).expect().content());
    }

    @Test
    void orElseRecoversFromFailure() {
        Program<RawContent> program = Program.get(KEY)
            .map(DocumentValue::content)
            .orElse(error -> Program.pure(RawContent.of("{}")));

        assertEquals(RawContent.of("{}"), interpreter.run(program).expect());
    }

    @Test
    void orElseCanCreateMissingDocument() {
        Program<DocumentValue> program = Program.get(KEY)
            .orElse(error -> DocumentException.kindOf(error) == ErrorKind.NOT_FOUND
                ? Program.create(KEY, ALICE)
                : Program.fail(error));

        assertEquals(ALICE, interpreter.run(program).expect().content());
        assertEquals(ALICE, interpreter.run(program).expect().content());
    }

    @Test
    void mapErrorReplacesErrorOnly() {
        IllegalStateException replacement = new IllegalStateException("replaced");

        TransactionResult<DocumentValue> failed = interpreter.run(Program.get(KEY).mapError(error -> replacement));
        assertSame(replacement, failed.getError().orElseThrow());

        interpreter.run(Program.create(KEY, ALICE)).expect();
        TransactionResult<DocumentValue> succeeded = interpreter.run(Program.get(KEY).mapError(error -> replacement));
        assertTrue(succeeded.isSuccess());
    }

    @Test
    void throwingContinuationBecomesBackendFailure() {
        Program<Long> program = Program.incrementCounter(Key.of("c"), 1)
            .map(value -> {
                throw new IllegalArgumentException("bad stage");
            });

        TransactionResult<Long> result = interpreter.run(program);

        assertTrue(result.isErrorOf(ErrorKind.BACKEND_FAILURE));
        assertEquals("bad stage", result.getError().orElseThrow().getMessage());
    }

    @Test
    void programsAreReusableValues() {
        Program<Long> bump = Program.incrementCounter(Key.of("reuse"), 2);

        assertEquals(2L, interpreter.run(bump).expect());
        assertEquals(4L, interpreter.run(bump).expect());
    }

    @Test
    void longLeftNestedChainDoesNotOverflow() {
        Program<Long> program = Program.pure(0L);
        for (int i = 0; i < 100_000; i++) {
            program = program.map(value -> value + 1);
        }

        assertEquals(100_000L, interpreter.run(program).expect());
    }

    @Test
    void longRecursiveChainOverBackendDoesNotOverflow() {
        Key counter = Key.of("loop");

        assertEquals(20_000L, interpreter.run(countUp(counter, 20_000)).expect());
    }

    private static Program<Long> countUp(Key key, int remaining) {
        return Program.incrementCounter(key, 1)
            .andThen(value -> remaining == 1 ? Program.pure(value) : countUp(key, remaining - 1));
    }

    @Test
    void disconnectedBackendFailsWithoutBeingCalled() {
        when(mockBackend.isConnected()).thenReturn(false);

        TransactionResult<DocumentValue> result = ProgramInterpreter.run(Program.get(KEY), mockBackend);

        assertTrue(result.isErrorOf(ErrorKind.NOT_CONNECTED));
        verify(mockBackend, never()).get(any());
    }

    @Test
    void pureProgramsDoNotNeedAConnection() {
        TransactionResult<String> result = ProgramInterpreter.run(Program.pure("value"), mockBackend);

        assertEquals("value", result.expect());
        verifyNoInteractions(mockBackend);
    }

    @Test
    void backendThrowingIsConvertedToFailure() {
        when(mockBackend.isConnected()).thenReturn(true);
        when(mockBackend.get(any())).thenThrow(new IllegalStateException("driver exploded"));

        TransactionResult<DocumentValue> result = ProgramInterpreter.run(Program.get(KEY), mockBackend);

        assertTrue(result.isErrorOf(ErrorKind.BACKEND_FAILURE));
        assertInstanceOf(IllegalStateException.class, result.getError().orElseThrow().getCause());
    }

    @Test
    void exceptionallyCompletedFutureIsConvertedToFailure() {
        IllegalStateException failure = new IllegalStateException("connection reset");
        when(mockBackend.isConnected()).thenReturn(true);
        when(mockBackend.getCounter(any())).thenReturn(CompletableFuture.failedFuture(failure));

        TransactionResult<Long> result = ProgramInterpreter.run(Program.getCounter(KEY), mockBackend);

        assertSame(failure, result.getError().orElseThrow());
    }

    @Test
    void asynchronousBackendCompletesProgram() {
        DelayedBackend delayed = new DelayedBackend(backend);
        ProgramInterpreter async = new ProgramInterpreter(delayed);

        Program<DocumentValue> program = Program.create(KEY, ALICE)
            .andThen(doc -> Program.update(KEY, BOB, doc.version()))
            .andThen(doc -> Program.get(KEY));

        CompletableFuture<TransactionResult<DocumentValue>> future = async.execute(program);

        assertEquals(BOB, future.join().expect().content());
        assertEquals(3, delayed.calls());
    }
}
