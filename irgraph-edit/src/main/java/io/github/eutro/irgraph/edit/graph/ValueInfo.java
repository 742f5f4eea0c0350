package io.github.eutro.irgraph.edit.graph;

import org.jetbrains.annotations.Nullable;

/**
 * A value in the projected graph: the result of an operation, or the argument of a block.
 */
public final class ValueInfo {
    public enum Producer {
        OP_RESULT,
        BLOCK_ARGUMENT,
    }

    public final String id;
    /**
     * The printed type of the value.
     */
    public final String type;
    public final Producer producer;
    /**
     * The id of the producing operation or block, or null if the producer
     * is not part of the graph.
     */
    @Nullable
    public final String ownerId;
    /**
     * The result or argument index within the owner.
     */
    public final int index;

    public ValueInfo(String id, String type, Producer producer, @Nullable String ownerId, int index) {
        this.id = id;
        this.type = type;
        this.producer = producer;
        this.ownerId = ownerId;
        this.index = index;
    }

    @Override
    public String toString() {
        return id + ": " + type;
    }
}
