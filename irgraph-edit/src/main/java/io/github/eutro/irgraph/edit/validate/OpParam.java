package io.github.eutro.irgraph.edit.validate;

/**
 * A parameter an operation can be built with.
 */
public final class OpParam {
    public enum Kind {
        OPERAND,
        ATTRIBUTE,
    }

    public final String name;
    public final Kind kind;
    public final boolean required;

    public OpParam(String name, Kind kind, boolean required) {
        this.name = name;
        this.kind = kind;
        this.required = required;
    }

    @Override
    public String toString() {
        return name + ": " + kind.name().toLowerCase() + (required ? "" : "?");
    }
}
