package io.github.eutro.irgraph.edit.graph;

import io.github.eutro.irgraph.core.ir.Block;
import io.github.eutro.irgraph.core.ir.Operation;
import io.github.eutro.irgraph.core.ir.Region;
import io.github.eutro.irgraph.core.ir.Value;
import io.github.eutro.irgraph.edit.NotFoundException;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The mapping between the ids of the current graph and the IR entities they stand for.
 * <p>
 * The registry is refilled from scratch by every {@link GraphBuilder#build(Operation, EntityRegistry) build},
 * and its ids are only valid until the next one.
 */
public final class EntityRegistry {
    public static final String OPERATION_PREFIX = "op";
    public static final String BLOCK_PREFIX = "block";
    public static final String REGION_PREFIX = "region";
    public static final String VALUE_PREFIX = "val";

    private final Map<String, Integer> counters = new HashMap<>();

    private final Map<String, Operation> operations = new LinkedHashMap<>();
    private final Map<String, Block> blocks = new LinkedHashMap<>();
    private final Map<String, Region> regions = new LinkedHashMap<>();
    private final Map<String, Value> values = new LinkedHashMap<>();

    private final Map<Operation, String> operationIds = new IdentityHashMap<>();
    private final Map<Block, String> blockIds = new IdentityHashMap<>();
    private final Map<ProducerKey, String> resultIds = new HashMap<>();
    private final Map<ProducerKey, String> argumentIds = new HashMap<>();

    public void clear() {
        counters.clear();
        operations.clear();
        blocks.clear();
        regions.clear();
        values.clear();
        operationIds.clear();
        blockIds.clear();
        resultIds.clear();
        argumentIds.clear();
    }

    private String nextId(String prefix) {
        int n = counters.merge(prefix, 1, Integer::sum) - 1;
        return prefix + "_" + n;
    }

    String registerOperation(Operation op) {
        String id = nextId(OPERATION_PREFIX);
        operations.put(id, op);
        operationIds.put(op, id);
        return id;
    }

    String registerBlock(Block block) {
        String id = nextId(BLOCK_PREFIX);
        blocks.put(id, block);
        blockIds.put(block, id);
        return id;
    }

    String registerRegion(Region region) {
        String id = nextId(REGION_PREFIX);
        regions.put(id, region);
        return id;
    }

    String registerResult(String opId, int index, Value result) {
        String id = registerValue(result);
        resultIds.put(new ProducerKey(opId, index), id);
        return id;
    }

    String registerArgument(String blockId, int index, Value argument) {
        String id = registerValue(argument);
        argumentIds.put(new ProducerKey(blockId, index), id);
        return id;
    }

    String registerValue(Value value) {
        String id = nextId(VALUE_PREFIX);
        values.put(id, value);
        return id;
    }

    @Nullable String resultId(String opId, int index) {
        return resultIds.get(new ProducerKey(opId, index));
    }

    @Nullable String argumentId(String blockId, int index) {
        return argumentIds.get(new ProducerKey(blockId, index));
    }

    public @Nullable String operationId(Operation op) {
        return operationIds.get(op);
    }

    public @Nullable String blockId(Block block) {
        return blockIds.get(block);
    }

    public @Nullable Operation findOperation(String id) {
        return operations.get(id);
    }

    public @Nullable Block findBlock(String id) {
        return blocks.get(id);
    }

    public @Nullable Region findRegion(String id) {
        return regions.get(id);
    }

    public @Nullable Value findValue(String id) {
        return values.get(id);
    }

    public Operation requireOperation(String id) {
        Operation op = operations.get(id);
        if (op == null) throw new NotFoundException("operation", id);
        return op;
    }

    public Block requireBlock(String id) {
        Block block = blocks.get(id);
        if (block == null) throw new NotFoundException("block", id);
        return block;
    }

    public Value requireValue(String id) {
        Value value = values.get(id);
        if (value == null) throw new NotFoundException("value", id);
        return value;
    }

    /**
     * Get the registered values, in registration order.
     *
     * @return An unmodifiable view of the values by id.
     */
    public Map<String, Value> getValues() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Get the registered operations in document order, starting with the module.
     *
     * @return An unmodifiable view of the operations by id.
     */
    public Map<String, Operation> getOperations() {
        return Collections.unmodifiableMap(operations);
    }
}
