package io.github.eutro.irgraph.core.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function type, {@code (inputs) -> results}.
 */
public final class FunctionType extends Type {
    public final List<Type> inputs;
    public final List<Type> results;

    public FunctionType(List<Type> inputs, List<Type> results) {
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
    }

    /**
     * Get a copy of this type with different results.
     *
     * @param results The new results.
     * @return The new function type.
     */
    public FunctionType withResults(List<Type> results) {
        return new FunctionType(inputs, results);
    }

    @Override
    protected void print(StringBuilder sb) {
        printList(sb, inputs);
        sb.append(" -> ");
        if (results.size() == 1 && !(results.get(0) instanceof FunctionType)) {
            sb.append(results.get(0));
        } else {
            printList(sb, results);
        }
    }

    private static void printList(StringBuilder sb, List<Type> types) {
        sb.append('(');
        for (int i = 0; i < types.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(types.get(i));
        }
        sb.append(')');
    }
}
