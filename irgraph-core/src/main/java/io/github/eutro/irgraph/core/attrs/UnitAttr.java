package io.github.eutro.irgraph.core.attrs;

/**
 * The unit attribute, whose presence alone is meaningful.
 */
public final class UnitAttr extends Attribute {
    public static final UnitAttr INSTANCE = new UnitAttr();

    private UnitAttr() {
    }

    @Override
    public String kind() {
        return "unit";
    }

    @Override
    protected void print(StringBuilder sb) {
        sb.append("unit");
    }
}
