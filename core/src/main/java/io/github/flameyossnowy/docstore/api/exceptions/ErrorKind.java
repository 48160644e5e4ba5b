package io.github.flameyossnowy.docstore.api.exceptions;

/**
 * Kinds of failure a document operation can end with.
 */
public enum ErrorKind {
    /**
     * The backend has no live connection.
     */
    NOT_CONNECTED,

    /**
     * No document or counter exists at the key.
     */
    NOT_FOUND,

    /**
     * A create hit a key that is already taken.
     */
    ALREADY_EXISTS,

    /**
     * The version supplied to an update is not the stored one.
     */
    VERSION_CONFLICT,

    /**
     * Stored content could not be read as the expected type.
     */
    DECODE_ERROR,

    /**
     * Opaque I/O or driver failure.
     */
    BACKEND_FAILURE,

    /**
     * One item of a batch failed.
     */
    BATCH_ITEM_FAILURE
}
