package io.github.eutro.irgraph.core.text;

/**
 * Thrown when IR text, or the text of a type or attribute, is malformed.
 */
public class IRParseException extends RuntimeException {
    public final int line;
    public final int column;

    public IRParseException(String message, int line, int column) {
        super(line + ":" + column + ": " + message);
        this.line = line;
        this.column = column;
    }
}
