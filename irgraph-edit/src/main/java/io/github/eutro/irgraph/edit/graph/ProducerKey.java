package io.github.eutro.irgraph.edit.graph;

import java.util.Objects;

/**
 * The producer of a value: an operation or block id, and the result or argument index.
 */
final class ProducerKey {
    final String ownerId;
    final int index;

    ProducerKey(String ownerId, int index) {
        this.ownerId = ownerId;
        this.index = index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProducerKey that = (ProducerKey) o;
        return index == that.index && ownerId.equals(that.ownerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ownerId, index);
    }

    @Override
    public String toString() {
        return ownerId + "#" + index;
    }
}
