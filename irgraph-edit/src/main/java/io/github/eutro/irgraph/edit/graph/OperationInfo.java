package io.github.eutro.irgraph.edit.graph;

import java.util.*;

/**
 * An operation in the projected graph.
 */
public final class OperationInfo {
    public final String id;
    public final String name;
    public final String dialect;
    /**
     * The attributes of the operation, properties first, each group sorted by name.
     */
    public final Map<String, AttributeInfo> attributes;
    public final List<String> operands;
    public final List<String> results;
    public final List<String> regions;
    public final String parentBlock;
    /**
     * The index of this operation in its parent block.
     */
    public final int position;

    public OperationInfo(
            String id,
            String name,
            String dialect,
            Map<String, AttributeInfo> attributes,
            List<String> operands,
            List<String> results,
            List<String> regions,
            String parentBlock,
            int position
    ) {
        this.id = id;
        this.name = name;
        this.dialect = dialect;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
        this.parentBlock = parentBlock;
        this.position = position;
    }

    @Override
    public String toString() {
        return id + " (" + name + ")";
    }
}
