package org.arcx.exception;

/**
 * A polymorphic mapping declaration has an invalid shape.
 * Raised only while a mapping is being constructed or loaded.
 */
public class InvalidMappingException extends ArcxException {

    public InvalidMappingException(String message) {
        super(message);
    }

    public InvalidMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
