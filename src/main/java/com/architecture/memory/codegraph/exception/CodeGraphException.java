package com.architecture.memory.codegraph.exception;

/**
 * Root of the operational failures raised by the code graph core.
 * Conservation-law findings are never exceptions; they are reported as violations.
 */
public class CodeGraphException extends RuntimeException {

    public CodeGraphException(String message) {
        super(message);
    }

    public CodeGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
