package io.github.eutro.irgraph.edit.graph;

import io.github.eutro.irgraph.core.attrs.Attribute;
import io.github.eutro.irgraph.core.backend.IRBackend;
import io.github.eutro.irgraph.core.ir.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Projects a module into a {@link Graph}, registering every entity it finds.
 * <p>
 * Entities are numbered per kind in document order. A block's arguments are
 * registered before its operations, and an operation's results before its
 * nested regions. Operands are resolved once the whole module is registered,
 * so a use may precede its definition.
 */
public final class GraphBuilder {
    private static final Logger LOGGER = LogManager.getLogger();

    private final IRBackend backend;

    public GraphBuilder(IRBackend backend) {
        this.backend = backend;
    }

    /**
     * Build the graph of a module, refilling {@code registry} with its entities.
     *
     * @param module   The module operation.
     * @param registry The registry to fill.
     * @return The graph.
     */
    public Graph build(Operation module, EntityRegistry registry) {
        registry.clear();
        Walk walk = new Walk(registry);
        String moduleId = registry.registerOperation(module);
        walk.walkRegions(module, moduleId);

        ValueResolver resolver = new ValueResolver(registry, backend);
        List<OperationInfo> operations = new ArrayList<>();
        List<EdgeInfo> edges = new ArrayList<>();
        for (PendingOperation pending : walk.operations) {
            Operation op = pending.op;
            List<String> operands = new ArrayList<>();
            for (int i = 0; i < op.getNumOperands(); i++) {
                String valueId = resolver.resolve(backend.getOperand(op, i));
                operands.add(valueId);
                edges.add(new EdgeInfo(valueId, pending.id, i));
            }
            operations.add(new OperationInfo(
                    pending.id,
                    op.getName(),
                    op.getDialect(),
                    attributesOf(op),
                    operands,
                    pending.results,
                    pending.regions,
                    pending.parentBlock,
                    pending.position
            ));
        }

        List<ValueInfo> values = new ArrayList<>();
        for (Map.Entry<String, Value> entry : registry.getValues().entrySet()) {
            values.add(valueInfo(registry, entry.getKey(), entry.getValue()));
        }

        Graph graph = new Graph(moduleId, operations, walk.blocks, walk.regions, values, edges);
        LOGGER.debug("Built graph: {} operations, {} blocks, {} regions, {} values, {} edges",
                operations.size(), walk.blocks.size(), walk.regions.size(), values.size(), edges.size());
        return graph;
    }

    /**
     * Get the attributes of an operation as the graph shows them: properties
     * first, then discardable attributes not shadowed by a property.
     *
     * @param op The operation.
     * @return The attributes.
     */
    static Map<String, AttributeInfo> attributesOf(Operation op) {
        Map<String, AttributeInfo> attributes = new LinkedHashMap<>();
        for (Map.Entry<String, Attribute> entry : op.getProperties().entrySet()) {
            attributes.put(entry.getKey(), attributeInfo(entry.getValue()));
        }
        for (Map.Entry<String, Attribute> entry : op.getAttrs().entrySet()) {
            attributes.putIfAbsent(entry.getKey(), attributeInfo(entry.getValue()));
        }
        return attributes;
    }

    private static AttributeInfo attributeInfo(Attribute attr) {
        return new AttributeInfo(attr.kind(), attr.toString());
    }

    private static ValueInfo valueInfo(EntityRegistry registry, String id, Value value) {
        String type = value.getType().toString();
        if (value instanceof BlockArgument) {
            BlockArgument argument = (BlockArgument) value;
            return new ValueInfo(id, type, ValueInfo.Producer.BLOCK_ARGUMENT,
                    registry.blockId(argument.getOwner()), argument.getIndex());
        }
        OpResult result = (OpResult) value;
        return new ValueInfo(id, type, ValueInfo.Producer.OP_RESULT,
                registry.operationId(result.getOwner()), result.getIndex());
    }

    private static class PendingOperation {
        final Operation op;
        final String id;
        final String parentBlock;
        final int position;
        final List<String> results = new ArrayList<>();
        final List<String> regions = new ArrayList<>();

        PendingOperation(Operation op, String id, String parentBlock, int position) {
            this.op = op;
            this.id = id;
            this.parentBlock = parentBlock;
            this.position = position;
        }
    }

    private static class Walk {
        final EntityRegistry registry;
        final List<PendingOperation> operations = new ArrayList<>();
        final List<BlockInfo> blocks = new ArrayList<>();
        final List<RegionInfo> regions = new ArrayList<>();

        Walk(EntityRegistry registry) {
            this.registry = registry;
        }

        List<String> walkRegions(Operation op, String opId) {
            List<String> regionIds = new ArrayList<>();
            for (Region region : op.getRegions()) {
                regionIds.add(walkRegion(region, opId));
            }
            return regionIds;
        }

        String walkRegion(Region region, String parentOp) {
            String regionId = registry.registerRegion(region);
            // reserve the slot so regions stay in pre-order
            int slot = regions.size();
            regions.add(null);
            List<String> blockIds = new ArrayList<>();
            for (Block block : region.getBlocks()) {
                blockIds.add(walkBlock(block, regionId));
            }
            regions.set(slot, new RegionInfo(regionId, parentOp, blockIds));
            return regionId;
        }

        String walkBlock(Block block, String parentRegion) {
            String blockId = registry.registerBlock(block);
            int slot = blocks.size();
            blocks.add(null);
            List<String> arguments = new ArrayList<>();
            for (BlockArgument argument : block.getArguments()) {
                arguments.add(registry.registerArgument(blockId, argument.getIndex(), argument));
            }
            List<String> opIds = new ArrayList<>();
            List<Operation> ops = block.getOperations();
            for (int i = 0; i < ops.size(); i++) {
                opIds.add(walkOperation(ops.get(i), blockId, i));
            }
            blocks.set(slot, new BlockInfo(blockId, arguments, parentRegion, opIds));
            return blockId;
        }

        String walkOperation(Operation op, String parentBlock, int position) {
            String opId = registry.registerOperation(op);
            PendingOperation pending = new PendingOperation(op, opId, parentBlock, position);
            operations.add(pending);
            for (OpResult result : op.getResults()) {
                pending.results.add(registry.registerResult(opId, result.getIndex(), result));
            }
            pending.regions.addAll(walkRegions(op, opId));
            return opId;
        }
    }
}
