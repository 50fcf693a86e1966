package com.architecture.memory.codegraph.exception;

/**
 * Failure of the underlying graph store. A commit that raises this exception leaves no partial
 * mutation behind.
 */
public class GraphStoreException extends CodeGraphException {

    public GraphStoreException(String message) {
        super(message);
    }

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
