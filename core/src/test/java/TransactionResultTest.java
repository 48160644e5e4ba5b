import io.github.flameyossnowy.docstore.api.exceptions.DocumentException;
import io.github.flameyossnowy.docstore.api.exceptions.ErrorKind;
import io.github.flameyossnowy.docstore.api.exceptions.RepositoryException;
import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransactionResultTest {
    @Test
    void successMayCarryNull() {
        TransactionResult<String> result = TransactionResult.success(null);

        assertTrue(result.isSuccess());
        assertTrue(result.getResult().isEmpty());
        assertTrue(result.errorKind().isEmpty());
    }

    @Test
    void mapAndFlatMapSkipFailures() {
        TransactionResult<Integer> failed = TransactionResult.failure(DocumentException.notFound(Key.of("k")));

        assertTrue(failed.map(value -> value + 1).isErrorOf(ErrorKind.NOT_FOUND));
        assertTrue(failed.flatMap(value -> TransactionResult.success(value * 2)).isErrorOf(ErrorKind.NOT_FOUND));
        assertEquals(3, TransactionResult.success(1).flatMap(value -> TransactionResult.success(value + 2)).expect());
    }

    @Test
    void recoverAndFold() {
        TransactionResult<Integer> failed = TransactionResult.failure(new IllegalStateException("x"));

        assertEquals(0, failed.recover(error -> 0).expect());
        String failedText = failed.fold(Throwable::getMessage, value -> Integer.toString(value));
        String successText = TransactionResult.success(5).fold(Throwable::getMessage, value -> Integer.toString(value));

        assertEquals("x", failedText);
        assertEquals("5", successText);
    }

    @Test
    void foreignErrorsClassifyAsBackendFailure() {
        assertEquals(ErrorKind.BACKEND_FAILURE, TransactionResult.failure(new RuntimeException()).errorKind().orElseThrow());
    }

    @Test
    void expectRethrowsDocumentExceptionsAndWrapsOthers() {
        DocumentException notFound = DocumentException.notFound(Key.of("k"));

        assertSame(notFound, assertThrows(DocumentException.class, () -> TransactionResult.failure(notFound).expect()));

        RepositoryException wrapped = assertThrows(RepositoryException.class,
            () -> TransactionResult.failure(new IllegalStateException("io")).expect("read failed"));
        assertEquals("read failed", wrapped.getMessage());
    }

    @Test
    void attemptCapturesThrownExceptions() {
        TransactionResult<Integer> result = TransactionResult.attempt(() -> Integer.parseInt("x"));

        assertInstanceOf(NumberFormatException.class, result.getError().orElseThrow());
    }
}
