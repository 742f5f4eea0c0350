package io.github.eutro.irgraph.edit.graph;

import java.util.Objects;

/**
 * A use of a value: the value {@link #fromValue} flows into operand {@link #toOperandIndex} of {@link #toOp}.
 */
public final class EdgeInfo {
    public final String fromValue;
    public final String toOp;
    public final int toOperandIndex;

    public EdgeInfo(String fromValue, String toOp, int toOperandIndex) {
        this.fromValue = fromValue;
        this.toOp = toOp;
        this.toOperandIndex = toOperandIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EdgeInfo edgeInfo = (EdgeInfo) o;
        return toOperandIndex == edgeInfo.toOperandIndex
                && fromValue.equals(edgeInfo.fromValue)
                && toOp.equals(edgeInfo.toOp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromValue, toOp, toOperandIndex);
    }

    @Override
    public String toString() {
        return fromValue + " -> " + toOp + "(" + toOperandIndex + ")";
    }
}
