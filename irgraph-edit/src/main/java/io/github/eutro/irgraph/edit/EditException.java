package io.github.eutro.irgraph.edit;

/**
 * The base class of errors raised by edits on a session.
 */
public abstract class EditException extends RuntimeException {
    protected EditException(String message) {
        super(message);
    }
}
