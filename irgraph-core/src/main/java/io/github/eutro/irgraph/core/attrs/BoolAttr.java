package io.github.eutro.irgraph.core.attrs;

public final class BoolAttr extends Attribute {
    public static final BoolAttr TRUE = new BoolAttr(true);
    public static final BoolAttr FALSE = new BoolAttr(false);

    public final boolean value;

    private BoolAttr(boolean value) {
        this.value = value;
    }

    public static BoolAttr of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public String kind() {
        return "bool";
    }

    @Override
    protected void print(StringBuilder sb) {
        sb.append(value);
    }
}
