package io.github.eutro.irgraph.edit;

/**
 * Thrown when an edit refers to an operand, result or position that does not exist.
 */
public class OutOfRangeException extends EditException {
    public final String what;
    public final int index;
    /**
     * The number of valid indices, which are {@code 0} to {@code size - 1}.
     */
    public final int size;

    public OutOfRangeException(String what, int index, int size) {
        super(what + " index " + index + " out of range [0, " + size + ")");
        this.what = what;
        this.index = index;
        this.size = size;
    }
}
