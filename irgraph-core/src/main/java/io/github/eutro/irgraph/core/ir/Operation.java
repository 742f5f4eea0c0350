package io.github.eutro.irgraph.core.ir;

import io.github.eutro.irgraph.core.attrs.Attribute;
import io.github.eutro.irgraph.core.ext.CommonExts;
import io.github.eutro.irgraph.core.ext.Ext;
import io.github.eutro.irgraph.core.ext.ExtHolder;
import io.github.eutro.irgraph.core.ops.OpKey;
import io.github.eutro.irgraph.core.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.Consumer;

/**
 * An operation: a named node with operands, results, attributes and nested regions.
 * <p>
 * The number of operands, results and regions is fixed when the operation is created.
 * Changing the arity of an operation means building a new one.
 * <p>
 * Attributes come in two flavours: <i>properties</i>, the inherent attributes of the operation,
 * and <i>discardable attributes</i>, which any client may attach. They are printed separately,
 * as {@code <{...}>} and {@code {...}} respectively.
 */
public final class Operation extends ExtHolder {
    private final String name;
    @Nullable
    private final OpKey key;
    private final List<OpOperand> operands;
    private final List<OpResult> results;
    private final List<Region> regions;
    private final SortedMap<String, Attribute> properties = new TreeMap<>();
    private final SortedMap<String, Attribute> attributes = new TreeMap<>();

    private Operation(String name, @Nullable OpKey key, List<Type> resultTypes, List<Value> operands, int numRegions) {
        this.name = name;
        this.key = key;
        List<OpOperand> operandList = new ArrayList<>(operands.size());
        for (int i = 0; i < operands.size(); i++) {
            operandList.add(new OpOperand(this, i, operands.get(i)));
        }
        this.operands = Collections.unmodifiableList(operandList);
        List<OpResult> resultList = new ArrayList<>(resultTypes.size());
        for (int i = 0; i < resultTypes.size(); i++) {
            resultList.add(new OpResult(this, i, resultTypes.get(i)));
        }
        this.results = Collections.unmodifiableList(resultList);
        List<Region> regionList = new ArrayList<>(numRegions);
        for (int i = 0; i < numRegions; i++) {
            Region region = new Region();
            region.attachExt(CommonExts.OWNING_OPERATION, this);
            regionList.add(region);
        }
        this.regions = Collections.unmodifiableList(regionList);
    }

    /**
     * Create a detached operation.
     * <p>
     * Attributes of the state that the key declares inherent are stored as properties.
     *
     * @param state The operation state.
     * @param key   The key of the registered operation with this name, or null if it is unregistered.
     * @return The operation.
     */
    public static Operation create(OperationState state, @Nullable OpKey key) {
        Operation op = new Operation(state.name, key, state.resultTypes, state.operands, state.numRegions);
        op.properties.putAll(state.properties);
        Set<String> inherent = key == null ? Collections.emptySet() : key.getInherentAttrs();
        for (Map.Entry<String, Attribute> entry : state.attributes.entrySet()) {
            if (inherent.contains(entry.getKey())) {
                op.properties.put(entry.getKey(), entry.getValue());
            } else {
                op.attributes.put(entry.getKey(), entry.getValue());
            }
        }
        return op;
    }

    public String getName() {
        return name;
    }

    /**
     * Get the dialect prefix of the name, the part before the first dot.
     *
     * @return The dialect.
     */
    public String getDialect() {
        int dot = name.indexOf('.');
        return dot < 0 ? "" : name.substring(0, dot);
    }

    public @Nullable OpKey getKey() {
        return key;
    }

    public boolean isRegistered() {
        return key != null;
    }

    public boolean isTerminator() {
        return key != null && key.isTerminator();
    }

    public boolean isIsolatedFromAbove() {
        return key != null && key.isIsolatedFromAbove();
    }

    // operands

    public int getNumOperands() {
        return operands.size();
    }

    public Value getOperand(int index) {
        return getOpOperand(index).get();
    }

    public OpOperand getOpOperand(int index) {
        if (index < 0 || index >= operands.size()) {
            throw new IRException("operand index " + index + " out of range for '" + name + "' with " + operands.size() + " operands");
        }
        return operands.get(index);
    }

    public List<OpOperand> getOpOperands() {
        return operands;
    }

    /**
     * Get a snapshot of the values currently used as operands.
     *
     * @return The values, in order.
     */
    public List<Value> getOperands() {
        List<Value> values = new ArrayList<>(operands.size());
        for (OpOperand operand : operands) {
            values.add(operand.get());
        }
        return values;
    }

    public void setOperand(int index, Value value) {
        getOpOperand(index).set(value);
    }

    // results

    public int getNumResults() {
        return results.size();
    }

    public OpResult getResult(int index) {
        if (index < 0 || index >= results.size()) {
            throw new IRException("result index " + index + " out of range for '" + name + "' with " + results.size() + " results");
        }
        return results.get(index);
    }

    public List<OpResult> getResults() {
        return results;
    }

    public List<Type> getResultTypes() {
        List<Type> types = new ArrayList<>(results.size());
        for (OpResult result : results) {
            types.add(result.getType());
        }
        return types;
    }

    public List<Type> getOperandTypes() {
        List<Type> types = new ArrayList<>(operands.size());
        for (OpOperand operand : operands) {
            types.add(operand.get().getType());
        }
        return types;
    }

    // regions

    public int getNumRegions() {
        return regions.size();
    }

    public Region getRegion(int index) {
        return regions.get(index);
    }

    public List<Region> getRegions() {
        return regions;
    }

    // attributes

    public SortedMap<String, Attribute> getProperties() {
        return Collections.unmodifiableSortedMap(properties);
    }

    public @Nullable Attribute getProperty(String name) {
        return properties.get(name);
    }

    public void setProperty(String name, Attribute value) {
        properties.put(name, Objects.requireNonNull(value));
    }

    public boolean removeProperty(String name) {
        return properties.remove(name) != null;
    }

    public SortedMap<String, Attribute> getAttrs() {
        return Collections.unmodifiableSortedMap(attributes);
    }

    public @Nullable Attribute getAttr(String name) {
        return attributes.get(name);
    }

    public void setAttr(String name, Attribute value) {
        attributes.put(name, Objects.requireNonNull(value));
    }

    public boolean removeAttr(String name) {
        return attributes.remove(name) != null;
    }

    /**
     * Look up an attribute by name, in the properties first and then the discardable attributes.
     *
     * @param name The name.
     * @return The attribute, or null.
     */
    public @Nullable Attribute getAttribute(String name) {
        Attribute prop = properties.get(name);
        return prop != null ? prop : attributes.get(name);
    }

    // structure

    public @Nullable Block getBlock() {
        return owner;
    }

    public @Nullable Region getParentRegion() {
        return owner == null ? null : owner.getParent();
    }

    public @Nullable Operation getParentOp() {
        return owner == null ? null : owner.getParentOp();
    }

    /**
     * Whether {@code other} is nested, at any depth, inside one of this operation's regions.
     *
     * @param other The other operation.
     * @return Whether this is a proper ancestor of it.
     */
    public boolean isProperAncestorOf(Operation other) {
        for (Operation it = other.getParentOp(); it != null; it = it.getParentOp()) {
            if (it == this) return true;
        }
        return false;
    }

    public boolean isAncestorOf(Operation other) {
        return other == this || isProperAncestorOf(other);
    }

    /**
     * Visit this operation and every operation nested in it, parents before children,
     * in document order.
     *
     * @param visitor The visitor.
     */
    public void walk(Consumer<Operation> visitor) {
        visitor.accept(this);
        for (Region region : regions) {
            for (Block block : region.getBlocks()) {
                for (Operation op : new ArrayList<>(block.getOperations())) {
                    op.walk(visitor);
                }
            }
        }
    }

    /**
     * Move this operation immediately before another, possibly into a different block.
     *
     * @param other The operation to move before.
     */
    public void moveBefore(Operation other) {
        if (other == this) return;
        Block target = requireBlock(other);
        remove();
        target.getOperations().add(target.indexOf(other), this);
    }

    /**
     * Move this operation immediately after another, possibly into a different block.
     *
     * @param other The operation to move after.
     */
    public void moveAfter(Operation other) {
        if (other == this) return;
        Block target = requireBlock(other);
        remove();
        target.getOperations().add(target.indexOf(other) + 1, this);
    }

    private static Block requireBlock(Operation op) {
        Block block = op.getBlock();
        if (block == null) throw new IRException("'" + op.getName() + "' is not in a block");
        return block;
    }

    /**
     * Detach this operation from its block, if it is in one, without touching its uses.
     */
    public void remove() {
        if (owner != null) {
            owner.getOperations().remove(owner.indexOf(this));
        }
    }

    /**
     * Detach this operation from its block and drop every operand use it, or anything
     * nested in it, holds.
     *
     * @throws IRException If a result of this operation or a nested one is used outside of this operation.
     */
    public void erase() {
        List<Operation> subtree = new ArrayList<>();
        walk(subtree::add);
        for (Operation op : subtree) {
            for (OpResult result : op.results) {
                for (OpOperand use : result.getUses()) {
                    if (!isAncestorOf(use.getOwner())) {
                        throw new IRException("cannot erase '" + name + "': result #" + result.getIndex()
                                + " of '" + op.name + "' is still used by '" + use.getOwner().getName() + "'");
                    }
                }
            }
        }
        for (Operation op : subtree) {
            for (OpOperand operand : op.operands) {
                operand.drop();
            }
        }
        remove();
    }

    @Override
    public String toString() {
        return String.format("%s@%08x", name, System.identityHashCode(this));
    }

    // exts
    private Block owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (Block) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
