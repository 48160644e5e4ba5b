package io.github.flameyossnowy.docstore.api.operation;

/**
 * Enum representing the kinds of operations that can be performed on a document store.
 */
public enum OperationType {
    /**
     * Read operation (GET)
     */
    READ,

    /**
     * Write operation (CREATE)
     */
    WRITE,

    /**
     * Conditional replace of an existing document (UPDATE)
     */
    UPDATE,

    /**
     * Delete operation (REMOVE)
     */
    DELETE,

    /**
     * Counter read or atomic increment
     */
    COUNTER,

    /**
     * Sequential creation of many documents
     */
    BATCH
}
