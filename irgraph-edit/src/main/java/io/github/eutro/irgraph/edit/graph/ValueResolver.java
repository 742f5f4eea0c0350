package io.github.eutro.irgraph.edit.graph;

import io.github.eutro.irgraph.core.backend.IRBackend;
import io.github.eutro.irgraph.core.ir.BlockArgument;
import io.github.eutro.irgraph.core.ir.OpResult;
import io.github.eutro.irgraph.core.ir.Value;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Finds the id a value was registered under while building a graph.
 * <p>
 * Values are looked up by their producer first, then by comparing against
 * every registered value. A value that matches neither is registered under
 * a fresh id, so a projection can always be built.
 */
public final class ValueResolver {
    private static final Logger LOGGER = LogManager.getLogger();

    private final EntityRegistry registry;
    private final IRBackend backend;

    public ValueResolver(EntityRegistry registry, IRBackend backend) {
        this.registry = registry;
        this.backend = backend;
    }

    public String resolve(Value value) {
        String id = lookupByProducer(value);
        if (id != null) return id;
        for (Map.Entry<String, Value> entry : registry.getValues().entrySet()) {
            if (backend.isSameValue(entry.getValue(), value)) {
                return entry.getKey();
            }
        }
        id = registry.registerValue(value);
        LOGGER.warn("Value {} of type {} has no registered producer, registered it as {}",
                value, value.getType(), id);
        return id;
    }

    private @Nullable String lookupByProducer(Value value) {
        if (value instanceof OpResult) {
            OpResult result = (OpResult) value;
            String ownerId = registry.operationId(result.getOwner());
            return ownerId == null ? null : registry.resultId(ownerId, result.getIndex());
        } else if (value instanceof BlockArgument) {
            BlockArgument argument = (BlockArgument) value;
            String ownerId = registry.blockId(argument.getOwner());
            return ownerId == null ? null : registry.argumentId(ownerId, argument.getIndex());
        }
        return null;
    }
}
