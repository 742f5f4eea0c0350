package io.github.eutro.irgraph.core.ir;

import io.github.eutro.irgraph.core.ext.CommonExts;
import io.github.eutro.irgraph.core.ext.Ext;
import io.github.eutro.irgraph.core.ext.ExtHolder;
import io.github.eutro.irgraph.core.ext.TrackedList;
import io.github.eutro.irgraph.core.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A block: a list of typed arguments, and a list of {@link Operation operations}.
 * <p>
 * If the last operation is a terminator, nothing may follow it.
 */
public final class Block extends ExtHolder {
    private final List<BlockArgument> arguments = new ArrayList<>();
    private final TrackedList<Operation> operations = new TrackedList<Operation>(new ArrayList<>()) {
        @Override
        protected void onAdded(Operation elt) {
            if (elt.getBlock() != null) {
                throw new IRException("'" + elt.getName() + "' is already in a block");
            }
            elt.attachExt(CommonExts.OWNING_BLOCK, Block.this);
        }

        @Override
        protected void onRemoved(Operation elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };

    public List<BlockArgument> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public BlockArgument getArgument(int index) {
        if (index < 0 || index >= arguments.size()) {
            throw new IRException("argument index " + index + " out of range for block with " + arguments.size() + " arguments");
        }
        return arguments.get(index);
    }

    public int getNumArguments() {
        return arguments.size();
    }

    /**
     * Append a new argument to this block.
     *
     * @param type The type of the argument.
     * @return The argument.
     */
    public BlockArgument addArgument(Type type) {
        BlockArgument arg = new BlockArgument(this, arguments.size(), type);
        arguments.add(arg);
        return arg;
    }

    /**
     * Get the operations in this block. Adding an operation to this list
     * makes this block its owner; it must not be in another block.
     *
     * @return The operations.
     */
    public TrackedList<Operation> getOperations() {
        return operations;
    }

    public int indexOf(Operation op) {
        return operations.identityIndexOf(op);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    /**
     * Get the terminator of this block.
     *
     * @return The last operation, if it is a terminator, otherwise null.
     */
    public @Nullable Operation getTerminator() {
        if (operations.isEmpty()) return null;
        Operation last = operations.get(operations.size() - 1);
        return last.isTerminator() ? last : null;
    }

    public @Nullable Region getParent() {
        return owner;
    }

    public @Nullable Operation getParentOp() {
        return owner == null ? null : owner.getParentOp();
    }

    public boolean isEntryBlock() {
        return owner != null && owner.getEntryBlock() == this;
    }

    @Override
    public String toString() {
        return String.format("^%08x", System.identityHashCode(this));
    }

    // exts
    private Region owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_REGION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_REGION) {
            owner = (Region) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_REGION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
