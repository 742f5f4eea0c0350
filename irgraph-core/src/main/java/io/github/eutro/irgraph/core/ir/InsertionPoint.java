package io.github.eutro.irgraph.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * A place in a block where a new operation can be inserted.
 */
public final class InsertionPoint {
    public final Block block;
    @Nullable
    public final Operation before;

    private InsertionPoint(Block block, @Nullable Operation before) {
        this.block = block;
        this.before = before;
    }

    /**
     * Insert immediately before {@code op}.
     *
     * @param op The operation.
     * @return The insertion point.
     */
    public static InsertionPoint before(Operation op) {
        Block block = op.getBlock();
        if (block == null) throw new IRException("'" + op.getName() + "' is not in a block");
        return new InsertionPoint(block, op);
    }

    /**
     * Insert at the end of {@code block}.
     *
     * @param block The block.
     * @return The insertion point.
     * @throws IRException If the block ends with a terminator.
     */
    public static InsertionPoint atEnd(Block block) {
        Operation terminator = block.getTerminator();
        if (terminator != null) {
            throw new IRException("cannot insert after the terminator '" + terminator.getName() + "'");
        }
        return new InsertionPoint(block, null);
    }

    /**
     * Insert before the terminator of {@code block}, or at its end if it has none.
     *
     * @param block The block.
     * @return The insertion point.
     */
    public static InsertionPoint atTerminator(Block block) {
        Operation terminator = block.getTerminator();
        return new InsertionPoint(block, terminator);
    }

    /**
     * Insert a detached operation here.
     *
     * @param op The operation.
     */
    public void insert(Operation op) {
        int index;
        if (before == null) {
            index = block.getOperations().size();
        } else {
            index = block.indexOf(before);
            if (index < 0) throw new IRException("'" + before.getName() + "' is no longer in the block");
        }
        block.getOperations().add(index, op);
    }
}
