package io.github.eutro.irgraph.edit.validate;

/**
 * A one-line summary of an operation, for listings.
 */
public final class OpDescription {
    public final String name;
    public final String dialect;
    public final String description;

    public OpDescription(String name, String dialect, String description) {
        this.name = name;
        this.dialect = dialect;
        this.description = description;
    }

    @Override
    public String toString() {
        return name + ": " + description;
    }
}
