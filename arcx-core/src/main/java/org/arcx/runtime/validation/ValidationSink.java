package org.arcx.runtime.validation;

/**
 * Host save-pipeline hook receiving validation failures.
 */
@FunctionalInterface
public interface ValidationSink {
    void reject(String field, String message);
}
