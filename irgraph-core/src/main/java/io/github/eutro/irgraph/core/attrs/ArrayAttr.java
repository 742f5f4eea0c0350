package io.github.eutro.irgraph.core.attrs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ArrayAttr extends Attribute {
    public final List<Attribute> elements;

    public ArrayAttr(List<Attribute> elements) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    @Override
    public String kind() {
        return "array";
    }

    @Override
    protected void print(StringBuilder sb) {
        sb.append('[');
        for (int i = 0; i < elements.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(elements.get(i));
        }
        sb.append(']');
    }
}
