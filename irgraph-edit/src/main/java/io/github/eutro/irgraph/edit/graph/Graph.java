package io.github.eutro.irgraph.edit.graph;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A flat projection of a module: its operations, blocks, regions and values,
 * addressed by string ids, and the use edges between them.
 * <p>
 * Operations, blocks and regions form a tree rooted at the module, which
 * itself is not listed among the operations. Ids are only meaningful
 * within one graph; every edit produces a new graph with new ids.
 */
public final class Graph {
    public final String moduleId;
    public final List<OperationInfo> operations;
    public final List<BlockInfo> blocks;
    public final List<RegionInfo> regions;
    public final List<ValueInfo> values;
    public final List<EdgeInfo> edges;

    private final Map<String, OperationInfo> operationsById = new HashMap<>();
    private final Map<String, BlockInfo> blocksById = new HashMap<>();
    private final Map<String, RegionInfo> regionsById = new HashMap<>();
    private final Map<String, ValueInfo> valuesById = new HashMap<>();

    public Graph(
            String moduleId,
            List<OperationInfo> operations,
            List<BlockInfo> blocks,
            List<RegionInfo> regions,
            List<ValueInfo> values,
            List<EdgeInfo> edges
    ) {
        this.moduleId = moduleId;
        this.operations = Collections.unmodifiableList(new ArrayList<>(operations));
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
        this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
        for (OperationInfo op : operations) operationsById.put(op.id, op);
        for (BlockInfo block : blocks) blocksById.put(block.id, block);
        for (RegionInfo region : regions) regionsById.put(region.id, region);
        for (ValueInfo value : values) valuesById.put(value.id, value);
    }

    public @Nullable OperationInfo getOperation(String id) {
        return operationsById.get(id);
    }

    public @Nullable BlockInfo getBlock(String id) {
        return blocksById.get(id);
    }

    public @Nullable RegionInfo getRegion(String id) {
        return regionsById.get(id);
    }

    public @Nullable ValueInfo getValue(String id) {
        return valuesById.get(id);
    }

    /**
     * Find all operations with the given name, in document order.
     *
     * @param name The operation name, like {@code arith.addf}.
     * @return The operations.
     */
    public List<OperationInfo> findOperations(String name) {
        List<OperationInfo> found = new ArrayList<>();
        for (OperationInfo op : operations) {
            if (op.name.equals(name)) found.add(op);
        }
        return found;
    }

    /**
     * Find the single operation with the given name.
     *
     * @param name The operation name.
     * @return The operation.
     * @throws IllegalArgumentException If there is not exactly one such operation.
     */
    public OperationInfo findOperation(String name) {
        List<OperationInfo> found = findOperations(name);
        if (found.size() != 1) {
            throw new IllegalArgumentException("expected exactly one '" + name + "', found " + found.size());
        }
        return found.get(0);
    }

    /**
     * Get the edges into an operation, ordered by operand index.
     *
     * @param opId The id of the operation.
     * @return The edges.
     */
    public List<EdgeInfo> edgesInto(String opId) {
        List<EdgeInfo> into = new ArrayList<>();
        for (EdgeInfo edge : edges) {
            if (edge.toOp.equals(opId)) into.add(edge);
        }
        into.sort(Comparator.comparingInt(e -> e.toOperandIndex));
        return into;
    }

    /**
     * Get the edges out of a value, in document order of their users.
     *
     * @param valueId The id of the value.
     * @return The edges.
     */
    public List<EdgeInfo> edgesFrom(String valueId) {
        List<EdgeInfo> from = new ArrayList<>();
        for (EdgeInfo edge : edges) {
            if (edge.fromValue.equals(valueId)) from.add(edge);
        }
        return from;
    }
}
