package io.github.eutro.irgraph.core.attrs;

import io.github.eutro.irgraph.core.types.Type;

/**
 * A floating point constant, {@code 1.5 : f32}.
 */
public final class FloatAttr extends Attribute {
    public final double value;
    public final Type type;

    public FloatAttr(double value, Type type) {
        this.value = value;
        this.type = type;
    }

    @Override
    public String kind() {
        return "float";
    }

    @Override
    protected void print(StringBuilder sb) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            // no decimal spelling
            sb.append("0x").append(Long.toHexString(Double.doubleToRawLongBits(value)).toUpperCase());
        } else {
            sb.append(value);
        }
        sb.append(" : ").append(type);
    }
}
