package io.github.eutro.irgraph.core.ir;

import io.github.eutro.irgraph.core.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * The {@code index}th result of an operation.
 * <p>
 * There is exactly one result object per (owner, index), created with the operation,
 * so identity comparison is structural comparison.
 */
public final class OpResult extends Value {
    private final Operation owner;
    private final int index;

    OpResult(Operation owner, int index, Type type) {
        super(type);
        this.owner = owner;
        this.index = index;
    }

    public Operation getOwner() {
        return owner;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public @Nullable Block getParentBlock() {
        return owner.getBlock();
    }

    @Override
    public String toString() {
        return owner + "#" + index;
    }
}
