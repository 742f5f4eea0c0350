package io.github.eutro.irgraph.edit.graph;

import java.util.Objects;

/**
 * An attribute in the projected graph, as its kind and its printed value.
 */
public final class AttributeInfo {
    public final String kind;
    public final String value;

    public AttributeInfo(String kind, String value) {
        this.kind = kind;
        this.value = value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AttributeInfo that = (AttributeInfo) o;
        return kind.equals(that.kind) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return value;
    }
}
