package io.github.eutro.irgraph.core.types;

/**
 * A floating point type.
 */
public final class FloatType extends Type {
    public static final FloatType F16 = new FloatType("f16", 16);
    public static final FloatType BF16 = new FloatType("bf16", 16);
    public static final FloatType F32 = new FloatType("f32", 32);
    public static final FloatType F64 = new FloatType("f64", 64);

    public final String keyword;
    public final int width;

    private FloatType(String keyword, int width) {
        this.keyword = keyword;
        this.width = width;
    }

    static FloatType forKeyword(String keyword) {
        switch (keyword) {
            // @formatter:off
            case "f16": return F16;
            case "bf16": return BF16;
            case "f32": return F32;
            case "f64": return F64;
            // @formatter:on
            default:
                return null;
        }
    }

    @Override
    protected void print(StringBuilder sb) {
        sb.append(keyword);
    }

    @Override
    public boolean isFloatLike() {
        return true;
    }
}
