package io.github.eutro.irgraph.core.ir;

import java.util.Objects;

/**
 * An operand slot of an operation, registered in the use list of the value it holds.
 */
public final class OpOperand {
    private final Operation owner;
    private final int index;
    private Value value;
    private boolean live = true;

    OpOperand(Operation owner, int index, Value value) {
        this.owner = owner;
        this.index = index;
        this.value = Objects.requireNonNull(value, "operand value");
        value.uses.add(this);
    }

    public Operation getOwner() {
        return owner;
    }

    public int getIndex() {
        return index;
    }

    public Value get() {
        return value;
    }

    /**
     * Make this slot hold another value, updating both use lists.
     *
     * @param newValue The new value.
     */
    public void set(Value newValue) {
        Objects.requireNonNull(newValue, "operand value");
        if (newValue == value) return;
        if (live) unlink();
        value = newValue;
        if (live) newValue.uses.add(this);
    }

    void drop() {
        if (live) {
            unlink();
            live = false;
        }
    }

    private void unlink() {
        value.uses.removeIf(use -> use == this);
    }

    @Override
    public String toString() {
        return owner + "(" + index + ") <- " + value;
    }
}
