package io.github.eutro.irgraph.core.attrs;

import io.github.eutro.irgraph.core.types.Type;

import java.math.BigInteger;

/**
 * An integer constant of an integer or index type, {@code 42 : i32}.
 */
public final class IntegerAttr extends Attribute {
    public final BigInteger value;
    public final Type type;

    public IntegerAttr(BigInteger value, Type type) {
        this.value = value;
        this.type = type;
    }

    public static IntegerAttr of(long value, Type type) {
        return new IntegerAttr(BigInteger.valueOf(value), type);
    }

    @Override
    public String kind() {
        return "integer";
    }

    @Override
    protected void print(StringBuilder sb) {
        sb.append(value).append(" : ").append(type);
    }
}
