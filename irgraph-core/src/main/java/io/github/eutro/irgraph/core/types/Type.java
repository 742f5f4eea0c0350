package io.github.eutro.irgraph.core.types;

/**
 * A type in the IR.
 * <p>
 * Types are immutable and compare structurally, by their printed form.
 */
public abstract class Type {
    private String printed;

    /**
     * Append the textual form of this type.
     *
     * @param sb The builder to append to.
     */
    protected abstract void print(StringBuilder sb);

    @Override
    public final String toString() {
        if (printed == null) {
            StringBuilder sb = new StringBuilder();
            print(sb);
            printed = sb.toString();
        }
        return printed;
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Type)) return false;
        return getClass() == o.getClass() && toString().equals(o.toString());
    }

    @Override
    public final int hashCode() {
        return toString().hashCode();
    }

    /**
     * Whether this is a float type, or a shaped type of floats.
     *
     * @return Whether this is float-like.
     */
    public boolean isFloatLike() {
        return false;
    }

    /**
     * Whether this is an integer or index type, or a shaped type of them.
     *
     * @return Whether this is integer-like.
     */
    public boolean isIntegerLike() {
        return false;
    }
}
