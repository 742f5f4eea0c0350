package io.github.eutro.irgraph.core.ir;

import io.github.eutro.irgraph.core.ext.ExtHolder;
import io.github.eutro.irgraph.core.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An SSA value: either the {@link OpResult result of an operation}, or a {@link BlockArgument block argument}.
 * <p>
 * Every value keeps track of the {@link OpOperand operand slots} that use it.
 */
public abstract class Value extends ExtHolder {
    private final Type type;
    final List<OpOperand> uses = new ArrayList<>();

    protected Value(Type type) {
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    /**
     * Get the operand slots currently holding this value.
     *
     * @return An unmodifiable view of the uses.
     */
    public List<OpOperand> getUses() {
        return Collections.unmodifiableList(uses);
    }

    public boolean hasUses() {
        return !uses.isEmpty();
    }

    /**
     * Point every use of this value at {@code other} instead.
     *
     * @param other The replacement value.
     */
    public void replaceAllUsesWith(Value other) {
        if (other == this) return;
        for (OpOperand use : new ArrayList<>(uses)) {
            use.set(other);
        }
    }

    /**
     * Get the block this value is defined in.
     *
     * @return The block, or null if the definition is detached.
     */
    public abstract @Nullable Block getParentBlock();
}
