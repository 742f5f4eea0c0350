package io.github.eutro.irgraph.core.ir;

import io.github.eutro.irgraph.core.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * The {@code index}th argument of a block.
 */
public final class BlockArgument extends Value {
    private final Block owner;
    private final int index;

    BlockArgument(Block owner, int index, Type type) {
        super(type);
        this.owner = owner;
        this.index = index;
    }

    public Block getOwner() {
        return owner;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public @Nullable Block getParentBlock() {
        return owner;
    }

    @Override
    public String toString() {
        return owner + "[" + index + "]";
    }
}
