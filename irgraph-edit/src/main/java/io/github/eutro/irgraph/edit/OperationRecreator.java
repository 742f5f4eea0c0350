package io.github.eutro.irgraph.edit;

import io.github.eutro.irgraph.core.backend.IRBackend;
import io.github.eutro.irgraph.core.ir.InsertionPoint;
import io.github.eutro.irgraph.core.ir.Operation;
import io.github.eutro.irgraph.core.ir.OperationState;
import io.github.eutro.irgraph.core.ir.Value;

import java.util.List;

/**
 * Replaces an operation with a copy that has a different operand list.
 * <p>
 * The copy has the same name, result types, properties and attributes, and
 * takes over the blocks of the original's regions. Every use of an original
 * result is redirected to the matching new result before the original is erased.
 */
public final class OperationRecreator {
    private final IRBackend backend;

    public OperationRecreator(IRBackend backend) {
        this.backend = backend;
    }

    /**
     * Recreate {@code original} with {@code operands}, in its place.
     *
     * @param original The operation to replace.
     * @param operands The operands of the replacement.
     * @return The replacement.
     */
    public Operation recreate(Operation original, List<Value> operands) {
        OperationState state = new OperationState(original.getName())
                .addResultTypes(original.getResultTypes())
                .addOperands(operands)
                .setNumRegions(original.getNumRegions());
        state.properties.putAll(original.getProperties());
        state.attributes.putAll(original.getAttrs());
        Operation replacement = backend.createOperation(state, InsertionPoint.before(original));
        for (int i = 0; i < original.getNumRegions(); i++) {
            backend.moveBlocks(original.getRegion(i), replacement.getRegion(i));
        }
        for (int i = 0; i < original.getNumResults(); i++) {
            backend.replaceAllUsesWith(original.getResult(i), replacement.getResult(i));
        }
        backend.erase(original);
        return replacement;
    }
}
