package io.github.flameyossnowy.docstore.mongodb;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoTimeoutException;
import io.github.flameyossnowy.docstore.api.exceptions.DocumentException;
import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.utils.Futures;
import org.jetbrains.annotations.NotNull;

/**
 * Maps driver exceptions to {@link DocumentException}s.
 */
final class MongoErrors {
    private MongoErrors() {
    }

    static boolean isDuplicateKey(Throwable throwable) {
        return throwable instanceof MongoException mongoException
            && ErrorCategory.fromErrorCode(mongoException.getCode()) == ErrorCategory.DUPLICATE_KEY;
    }

    /**
     * @param key the key the failed call was about
     * @param operation short name of the call, used in the message
     * @param throwable what the driver reported
     * @return the error to fail the operation with
     */
    static @NotNull DocumentException translate(@NotNull Key key, @NotNull String operation, @NotNull Throwable throwable) {
        Throwable cause = Futures.unwrap(throwable);
        if (cause instanceof DocumentException documentException) return documentException;
        if (cause instanceof MongoTimeoutException) {
            return DocumentException.backendFailure(key, operation + " timed out for key [" + key + "]", cause);
        }
        return DocumentException.backendFailure(key, operation + " failed for key [" + key + "]: " + cause.getMessage(), cause);
    }
}
