package io.github.eutro.irgraph.core.ir;

import io.github.eutro.irgraph.core.ext.CommonExts;
import io.github.eutro.irgraph.core.ext.Ext;
import io.github.eutro.irgraph.core.ext.ExtHolder;
import io.github.eutro.irgraph.core.ext.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A region, an ordered list of {@link Block blocks} nested in an {@link Operation operation}.
 * The first block, if any, is the entry block.
 */
public final class Region extends ExtHolder {
    private final TrackedList<Block> blocks = new TrackedList<Block>(new ArrayList<>()) {
        @Override
        protected void onAdded(Block elt) {
            if (elt.getParent() != null) {
                throw new IRException("block is already in a region");
            }
            elt.attachExt(CommonExts.OWNING_REGION, Region.this);
        }

        @Override
        protected void onRemoved(Block elt) {
            elt.removeExt(CommonExts.OWNING_REGION);
        }
    };

    Region() {
    }

    public TrackedList<Block> getBlocks() {
        return blocks;
    }

    /**
     * Append a new, empty block to this region.
     *
     * @return The block.
     */
    public Block addBlock() {
        Block block = new Block();
        blocks.add(block);
        return block;
    }

    public @Nullable Block getEntryBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    /**
     * Move every block of {@code other} to the end of this region.
     *
     * @param other The region to take the blocks from.
     */
    public void takeBody(Region other) {
        if (other == this) return;
        List<Block> moved = new ArrayList<>(other.blocks);
        other.blocks.clear();
        blocks.addAll(moved);
    }

    public @Nullable Operation getParentOp() {
        return owner;
    }

    // exts
    private Operation owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_OPERATION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_OPERATION) {
            owner = (Operation) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_OPERATION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
