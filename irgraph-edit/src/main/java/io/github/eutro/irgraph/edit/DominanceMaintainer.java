package io.github.eutro.irgraph.edit;

import io.github.eutro.irgraph.core.backend.IRBackend;
import io.github.eutro.irgraph.core.ir.Block;
import io.github.eutro.irgraph.core.ir.OpResult;
import io.github.eutro.irgraph.core.ir.Operation;
import io.github.eutro.irgraph.core.ir.Value;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Reorders a block so that operations come after the operations producing their operands.
 * <p>
 * Uses from inside nested regions count as uses by the operation of the block that contains them,
 * so the block of every ancestor of an edited operation is reordered as well.
 * The new order is the topological order of the block that keeps operations
 * as close to their old positions as possible. Blocks with a dependency cycle
 * are left alone, and verification reports the broken uses.
 */
public final class DominanceMaintainer {
    private static final Logger LOGGER = LogManager.getLogger();

    private final IRBackend backend;

    public DominanceMaintainer(IRBackend backend) {
        this.backend = backend;
    }

    /**
     * Make sure the producers in the block of {@code consumer} precede it, and likewise for
     * each operation enclosing {@code consumer} in its own block, reordering blocks where not.
     *
     * @param consumer The operation whose operands may have changed.
     * @return Whether any block was reordered.
     */
    public boolean ensureDominance(Operation consumer) {
        boolean reordered = false;
        for (Operation op = consumer; op != null; op = backend.getParentOperation(op)) {
            Block block = backend.getParentBlock(op);
            if (block == null) break;
            reordered |= reorder(block, op);
        }
        return reordered;
    }

    private boolean reorder(Block block, Operation consumer) {
        List<Operation> ops = new ArrayList<>(block.getOperations());
        Map<Operation, Integer> positions = new IdentityHashMap<>();
        for (int i = 0; i < ops.size(); i++) {
            positions.put(ops.get(i), i);
        }

        int consumerPos = positions.get(consumer);
        boolean ordered = true;
        for (Operation producer : producersIn(block, consumer)) {
            if (positions.get(producer) > consumerPos) {
                ordered = false;
                break;
            }
        }
        if (ordered) return false;

        Map<Operation, Integer> inDegree = new IdentityHashMap<>();
        Map<Operation, List<Operation>> successors = new IdentityHashMap<>();
        for (Operation op : ops) {
            inDegree.put(op, 0);
            successors.put(op, new ArrayList<>());
        }
        for (Operation op : ops) {
            for (Operation producer : producersIn(block, op)) {
                successors.get(producer).add(op);
                inDegree.merge(op, 1, Integer::sum);
            }
        }

        PriorityQueue<Operation> ready = new PriorityQueue<>(Comparator.<Operation>comparingInt(positions::get));
        for (Operation op : ops) {
            if (inDegree.get(op) == 0) ready.add(op);
        }
        List<Operation> sorted = new ArrayList<>(ops.size());
        while (!ready.isEmpty()) {
            Operation op = ready.poll();
            sorted.add(op);
            for (Operation succ : successors.get(op)) {
                if (inDegree.merge(succ, -1, Integer::sum) == 0) {
                    ready.add(succ);
                }
            }
        }
        if (sorted.size() != ops.size()) {
            LOGGER.warn("Dependency cycle among {} operations of block around '{}', not reordering",
                    ops.size() - sorted.size(), consumer.getName());
            return false;
        }

        int moved = 0;
        for (int i = 0; i < sorted.size(); i++) {
            Operation op = sorted.get(i);
            if (i == 0) {
                Operation first = block.getOperations().get(0);
                if (!backend.isSameOperation(op, first)) {
                    backend.moveBefore(op, first);
                    moved++;
                }
            } else {
                Operation prev = sorted.get(i - 1);
                if (block.indexOf(op) != block.indexOf(prev) + 1) {
                    backend.moveAfter(op, prev);
                    moved++;
                }
            }
        }
        LOGGER.debug("Reordered block around '{}', moved {} operations", consumer.getName(), moved);
        return true;
    }

    /**
     * Get the distinct operations of {@code block} that produce values used by {@code op} or
     * anything nested in it.
     */
    private Set<Operation> producersIn(Block block, Operation op) {
        Set<Operation> producers = Collections.newSetFromMap(new IdentityHashMap<>());
        op.walk(nested -> {
            for (Value operand : nested.getOperands()) {
                if (!(operand instanceof OpResult)) continue;
                Operation producer = ancestorIn(block, ((OpResult) operand).getOwner());
                if (producer != null && producer != op) {
                    producers.add(producer);
                }
            }
        });
        return producers;
    }

    private @Nullable Operation ancestorIn(Block block, Operation op) {
        Operation it = op;
        while (it != null) {
            Block parent = backend.getParentBlock(it);
            if (parent != null && backend.isSameBlock(parent, block)) return it;
            it = backend.getParentOperation(it);
        }
        return null;
    }
}
