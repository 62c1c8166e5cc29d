package io.github.eutro.qdebug.assertion;

/**
 * Thrown when an assertion is malformed or fails validation.
 * <p>
 * These carry no location; the preprocessor locates them at the assertion's instruction.
 */
public class AssertionSyntaxException extends RuntimeException {
    public AssertionSyntaxException(String message) {
        super(message);
    }

    public AssertionSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
