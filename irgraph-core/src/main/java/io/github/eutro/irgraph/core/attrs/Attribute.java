package io.github.eutro.irgraph.core.attrs;

/**
 * An attribute: a compile-time constant attached to an operation.
 * <p>
 * Attributes are immutable and compare structurally, by their printed form.
 * Each has a {@link #kind() kind}, which names its class in a form that
 * can be shown to users.
 */
public abstract class Attribute {
    private String printed;

    /**
     * Get the kind of this attribute, such as {@code "integer"} or {@code "string"}.
     *
     * @return The kind.
     */
    public abstract String kind();

    /**
     * Append the textual form of this attribute.
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
        if (!(o instanceof Attribute)) return false;
        return getClass() == o.getClass() && toString().equals(o.toString());
    }

    @Override
    public final int hashCode() {
        return toString().hashCode();
    }
}
