package io.github.flameyossnowy.docstore.api.exceptions;

/**
 * Base unchecked exception of the document store API.
 */
public class RepositoryException extends RuntimeException {
    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
