package io.github.eutro.irgraph.edit;

/**
 * Thrown when the structure around an operation does not allow an edit,
 * like adding a result to the output of an operation outside any function.
 */
public class EditFailedException extends EditException {
    public final String opId;

    public EditFailedException(String opId, String reason) {
        super(opId + ": " + reason);
        this.opId = opId;
    }
}
