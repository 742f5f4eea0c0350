package io.github.eutro.irgraph.core.ir;

import io.github.eutro.irgraph.core.attrs.Attribute;
import io.github.eutro.irgraph.core.types.Type;

import java.util.*;

/**
 * Everything needed to {@link Operation#create(OperationState, io.github.eutro.irgraph.core.ops.OpKey) create}
 * an operation.
 */
public final class OperationState {
    public final String name;
    public final List<Type> resultTypes = new ArrayList<>();
    public final List<Value> operands = new ArrayList<>();
    public final SortedMap<String, Attribute> properties = new TreeMap<>();
    public final SortedMap<String, Attribute> attributes = new TreeMap<>();
    public int numRegions;

    public OperationState(String name) {
        if (name.indexOf('.') <= 0 || name.endsWith(".")) {
            throw new IRException("operation name '" + name + "' is not of the form 'dialect.op'");
        }
        this.name = name;
    }

    public OperationState addResultTypes(Collection<? extends Type> types) {
        resultTypes.addAll(types);
        return this;
    }

    public OperationState addOperands(Collection<? extends Value> values) {
        operands.addAll(values);
        return this;
    }

    public OperationState addAttribute(String name, Attribute value) {
        attributes.put(name, value);
        return this;
    }

    public OperationState setNumRegions(int numRegions) {
        this.numRegions = numRegions;
        return this;
    }
}
