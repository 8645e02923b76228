package org.arcx.exception;

/**
 * Root of the unchecked exceptions raised by arcx.
 */
public class ArcxException extends RuntimeException {

    public ArcxException(String message) {
        super(message);
    }

    public ArcxException(String message, Throwable cause) {
        super(message, cause);
    }
}
