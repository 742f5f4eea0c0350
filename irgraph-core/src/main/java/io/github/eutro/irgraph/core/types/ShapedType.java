package io.github.eutro.irgraph.core.types;

/**
 * A tensor, memref or vector type.
 * <p>
 * Dimensions are {@link #DYNAMIC} where the source spelled {@code ?}. An unranked
 * type ({@code tensor<*xf32>}) has a null shape.
 */
public final class ShapedType extends Type {
    public static final long DYNAMIC = -1;

    public enum Kind {
        TENSOR("tensor"),
        MEMREF("memref"),
        VECTOR("vector");

        public final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public static Kind forKeyword(String keyword) {
            for (Kind kind : values()) {
                if (kind.keyword.equals(keyword)) return kind;
            }
            return null;
        }
    }

    public final Kind kind;
    private final long[] shape;
    public final Type elementType;

    public ShapedType(Kind kind, long[] shape, Type elementType) {
        this.kind = kind;
        this.shape = shape == null ? null : shape.clone();
        this.elementType = elementType;
    }

    public boolean isRanked() {
        return shape != null;
    }

    public long[] getShape() {
        return shape == null ? null : shape.clone();
    }

    @Override
    protected void print(StringBuilder sb) {
        sb.append(kind.keyword).append('<');
        if (shape == null) {
            sb.append("*x");
        } else {
            for (long dim : shape) {
                if (dim == DYNAMIC) sb.append('?');
                else sb.append(dim);
                sb.append('x');
            }
        }
        sb.append(elementType).append('>');
    }

    @Override
    public boolean isFloatLike() {
        return elementType.isFloatLike();
    }

    @Override
    public boolean isIntegerLike() {
        return elementType.isIntegerLike();
    }
}
