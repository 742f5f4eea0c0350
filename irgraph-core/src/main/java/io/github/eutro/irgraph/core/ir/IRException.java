package io.github.eutro.irgraph.core.ir;

/**
 * Thrown when an IR primitive is used in a way that would leave the IR malformed,
 * such as erasing an operation whose results are still used.
 */
public class IRException extends RuntimeException {
    public IRException(String message) {
        super(message);
    }
}
