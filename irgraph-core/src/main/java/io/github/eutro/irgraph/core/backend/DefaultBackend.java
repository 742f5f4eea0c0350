package io.github.eutro.irgraph.core.backend;

import io.github.eutro.irgraph.core.attrs.Attribute;
import io.github.eutro.irgraph.core.diag.Diagnostics;
import io.github.eutro.irgraph.core.ir.*;
import io.github.eutro.irgraph.core.ops.OpKey;
import io.github.eutro.irgraph.core.ops.OpRegistry;
import io.github.eutro.irgraph.core.passes.meta.VerifyIR;
import io.github.eutro.irgraph.core.text.IRParser;
import io.github.eutro.irgraph.core.text.IRPrinter;
import io.github.eutro.irgraph.core.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * The {@link IRBackend} over the in-memory IR of this library.
 */
public class DefaultBackend implements IRBackend {
    private final OpRegistry registry;

    public DefaultBackend(OpRegistry registry) {
        this.registry = registry;
    }

    public DefaultBackend() {
        this(OpRegistry.builtin());
    }

    public OpRegistry getRegistry() {
        return registry;
    }

    @Override
    public Operation parse(String text) {
        return IRParser.parseModule(text, registry);
    }

    @Override
    public String print(Operation root) {
        return IRPrinter.print(root);
    }

    @Override
    public VerificationResult verify(Operation root) {
        Diagnostics diags = VerifyIR.INSTANCE.run(root);
        return new VerificationResult(!diags.hasErrors(), diags.getDiagnostics());
    }

    @Override
    public Type parseType(String text) {
        return IRParser.parseType(text);
    }

    @Override
    public Attribute parseAttribute(String text) {
        return IRParser.parseAttribute(text);
    }

    @Override
    public boolean isRegisteredOperation(String name) {
        return registry.isRegistered(name);
    }

    @Override
    public Operation createOperation(OperationState state, InsertionPoint where) {
        Operation op = Operation.create(state, registry.lookup(state.name));
        where.insert(op);
        return op;
    }

    @Override
    public void erase(Operation op) {
        op.erase();
    }

    @Override
    public void replaceAllUsesWith(Value oldValue, Value newValue) {
        oldValue.replaceAllUsesWith(newValue);
    }

    @Override
    public Value getOperand(Operation op, int index) {
        return op.getOperand(index);
    }

    @Override
    public void setOperand(Operation op, int index, Value value) {
        op.setOperand(index, value);
    }

    @Override
    public boolean isSameValue(Value a, Value b) {
        return a == b;
    }

    @Override
    public boolean isSameOperation(Operation a, Operation b) {
        return a == b;
    }

    @Override
    public boolean isSameBlock(Block a, Block b) {
        return a == b;
    }

    @Override
    public @Nullable Block getParentBlock(Operation op) {
        return op.getBlock();
    }

    @Override
    public @Nullable Operation getParentOperation(Operation op) {
        return op.getParentOp();
    }

    @Override
    public @Nullable Operation getParentOperation(Block block) {
        return block.getParentOp();
    }

    @Override
    public void setAttribute(Operation op, String name, Attribute value) {
        OpKey key = op.getKey();
        if (op.getProperty(name) != null || key != null && key.getInherentAttrs().contains(name)) {
            op.setProperty(name, value);
        } else {
            op.setAttr(name, value);
        }
    }

    @Override
    public boolean removeAttribute(Operation op, String name) {
        boolean removedProperty = op.removeProperty(name);
        boolean removedAttr = op.removeAttr(name);
        return removedProperty || removedAttr;
    }

    @Override
    public void moveBefore(Operation op, Operation before) {
        op.moveBefore(before);
    }

    @Override
    public void moveAfter(Operation op, Operation after) {
        op.moveAfter(after);
    }

    @Override
    public void moveBlocks(Region from, Region to) {
        to.takeBody(from);
    }
}
