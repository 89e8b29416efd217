package org.kal.runtime;

/**
 * Thrown when lowered IR cannot be executed, for example because it calls an
 * {@code extern} that has no native implementation.
 */
public class IrExecutionException extends RuntimeException {

    /**
     * @param message The detail message.
     */
    public IrExecutionException(String message) {
        super(message);
    }
}
