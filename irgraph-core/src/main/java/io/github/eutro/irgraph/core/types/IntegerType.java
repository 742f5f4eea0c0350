package io.github.eutro.irgraph.core.types;

/**
 * An integer type of a fixed bit width, such as {@code i32}, {@code si8} or {@code ui64}.
 */
public final class IntegerType extends Type {
    public static final IntegerType I1 = new IntegerType(1, Signedness.SIGNLESS);
    public static final IntegerType I32 = new IntegerType(32, Signedness.SIGNLESS);
    public static final IntegerType I64 = new IntegerType(64, Signedness.SIGNLESS);

    public enum Signedness {
        SIGNLESS("i"),
        SIGNED("si"),
        UNSIGNED("ui");

        final String prefix;

        Signedness(String prefix) {
            this.prefix = prefix;
        }
    }

    public final int width;
    public final Signedness signedness;

    public IntegerType(int width, Signedness signedness) {
        if (width <= 0) throw new IllegalArgumentException("integer width must be positive");
        this.width = width;
        this.signedness = signedness;
    }

    public static IntegerType signless(int width) {
        return new IntegerType(width, Signedness.SIGNLESS);
    }

    @Override
    protected void print(StringBuilder sb) {
        sb.append(signedness.prefix).append(width);
    }

    @Override
    public boolean isIntegerLike() {
        return true;
    }
}
