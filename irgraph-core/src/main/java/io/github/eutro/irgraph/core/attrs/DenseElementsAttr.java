package io.github.eutro.irgraph.core.attrs;

import io.github.eutro.irgraph.core.types.Type;

/**
 * A dense constant of a shaped type, {@code dense<[1.0, 2.0]> : tensor<2xf32>}.
 * The literal between the angle brackets is kept verbatim.
 */
public final class DenseElementsAttr extends Attribute {
    public final String literal;
    public final Type type;

    public DenseElementsAttr(String literal, Type type) {
        this.literal = literal;
        this.type = type;
    }

    @Override
    public String kind() {
        return "dense";
    }

    @Override
    protected void print(StringBuilder sb) {
        sb.append("dense<").append(literal).append("> : ").append(type);
    }
}
