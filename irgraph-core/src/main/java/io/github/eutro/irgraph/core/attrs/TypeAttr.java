package io.github.eutro.irgraph.core.attrs;

import io.github.eutro.irgraph.core.types.Type;

/**
 * A type used as an attribute, such as the {@code function_type} of a function.
 */
public final class TypeAttr extends Attribute {
    public final Type value;

    public TypeAttr(Type value) {
        this.value = value;
    }

    @Override
    public String kind() {
        return "type";
    }

    @Override
    protected void print(StringBuilder sb) {
        sb.append(value);
    }
}
