package io.github.eutro.irgraph.edit;

import io.github.eutro.irgraph.core.attrs.Attribute;
import io.github.eutro.irgraph.core.backend.IRBackend;
import io.github.eutro.irgraph.core.ir.*;
import io.github.eutro.irgraph.core.ops.FuncOps;
import io.github.eutro.irgraph.core.types.Type;
import io.github.eutro.irgraph.edit.graph.EntityRegistry;
import io.github.eutro.irgraph.edit.graph.Graph;
import io.github.eutro.irgraph.edit.graph.GraphBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Applies edits to the module of an {@link EditSession}.
 * <p>
 * Each edit checks the ids and indices it is given before touching anything,
 * throwing {@link NotFoundException} or {@link OutOfRangeException}. It then
 * snapshots the module into the session's history and applies itself. If it
 * fails part way, the snapshot is taken back and restored, the graph is rebuilt,
 * and the original exception is rethrown. Otherwise the graph is rebuilt and
 * returned.
 * <p>
 * Ids from a graph are only valid until the next edit, so callers must use
 * the returned graph for further edits.
 */
public class GraphEditor {
    private static final Logger LOGGER = LogManager.getLogger();

    private final IRBackend backend;
    private final GraphBuilder builder;
    private final OperationRecreator recreator;
    private final DominanceMaintainer dominance;

    public GraphEditor(IRBackend backend) {
        this.backend = backend;
        builder = new GraphBuilder(backend);
        recreator = new OperationRecreator(backend);
        dominance = new DominanceMaintainer(backend);
    }

    public IRBackend getBackend() {
        return backend;
    }

    /**
     * Replace the module of a session, clearing its history.
     * <p>
     * If the text does not parse the session is left as it was.
     *
     * @param session The session.
     * @param text    The module text.
     * @return The graph of the new module.
     */
    public Graph load(EditSession session, String text) {
        Operation module = backend.parse(text);
        session.setModule(module);
        session.getHistory().clear();
        Graph graph = rebuild(session);
        LOGGER.info("Loaded module with {} operations", graph.operations.size());
        return graph;
    }

    /**
     * Print the module of a session.
     *
     * @param session The session.
     * @return The module text.
     */
    public String print(EditSession session) {
        return backend.print(session.requireModule());
    }

    public Graph undo(EditSession session) {
        String current = print(session);
        return restore(session, session.getHistory().undo(current));
    }

    public Graph redo(EditSession session) {
        String current = print(session);
        return restore(session, session.getHistory().redo(current));
    }

    /**
     * Delete and then set attributes of an operation. Each new value is parsed as an attribute.
     *
     * @param session The session.
     * @param opId    The operation.
     * @param updates The attributes to set, as text.
     * @param deletes The names of the attributes to delete.
     * @return The new graph.
     */
    public Graph modifyAttributes(
            EditSession session,
            String opId,
            Map<String, String> updates,
            Collection<String> deletes
    ) {
        Operation op = registry(session).requireOperation(opId);
        return transact(session, "modify attributes of " + opId, () -> {
            for (String name : deletes) {
                backend.removeAttribute(op, name);
            }
            for (Map.Entry<String, String> entry : updates.entrySet()) {
                Attribute value = backend.parseAttribute(entry.getValue());
                backend.setAttribute(op, entry.getKey(), value);
            }
        });
    }

    /**
     * Create an operation in a block.
     * <p>
     * If {@code position} is the index of an operation in the block, the new
     * operation goes before it. Otherwise it goes before the block's terminator,
     * or at the end of the block if it has none.
     *
     * @param session     The session.
     * @param opName      The name of the operation, like {@code arith.addf}.
     * @param resultTypes The result types, as text.
     * @param operandIds  The operands.
     * @param attributes  The attributes, as text.
     * @param blockId     The block to insert into.
     * @param position    The position to insert at, or null.
     * @return The new graph.
     */
    public Graph createOperation(
            EditSession session,
            String opName,
            List<String> resultTypes,
            List<String> operandIds,
            Map<String, String> attributes,
            String blockId,
            @Nullable Integer position
    ) {
        EntityRegistry registry = registry(session);
        Block block = registry.requireBlock(blockId);
        List<Value> operands = new ArrayList<>();
        for (String operandId : operandIds) {
            operands.add(registry.requireValue(operandId));
        }
        return transact(session, "create " + opName + " in " + blockId, () -> {
            OperationState state = new OperationState(opName).addOperands(operands);
            for (String type : resultTypes) {
                state.resultTypes.add(backend.parseType(type));
            }
            for (Map.Entry<String, String> entry : attributes.entrySet()) {
                state.addAttribute(entry.getKey(), backend.parseAttribute(entry.getValue()));
            }
            List<Operation> ops = block.getOperations();
            InsertionPoint where = position != null && position >= 0 && position < ops.size()
                    ? InsertionPoint.before(ops.get(position))
                    : InsertionPoint.atTerminator(block);
            backend.createOperation(state, where);
        });
    }

    /**
     * Delete an operation along with everything that uses its results, transitively.
     *
     * @param session The session.
     * @param opId    The operation.
     * @return The new graph.
     */
    public Graph deleteOperation(EditSession session, String opId) {
        Operation target = requireDeletable(session, opId);
        Operation module = session.requireModule();
        return transact(session, "delete " + opId, () -> {
            List<Operation> order = new ArrayList<>();
            collectConsumersFirst(target, Collections.newSetFromMap(new IdentityHashMap<>()), order);
            for (Operation op : order) {
                // already gone with an erased ancestor
                if (!isInside(op, module)) continue;
                backend.erase(op);
            }
            LOGGER.debug("Deleted {} operations with {}", order.size(), opId);
        });
    }

    /**
     * Delete an operation, dropping its results from the operand lists of their users.
     * The users themselves stay.
     *
     * @param session The session.
     * @param opId    The operation.
     * @return The new graph.
     */
    public Graph deleteOperationSingle(EditSession session, String opId) {
        Operation target = requireDeletable(session, opId);
        return transact(session, "delete " + opId + " alone", () -> {
            Map<Operation, SortedSet<Integer>> consumers = new LinkedHashMap<>();
            for (OpResult result : target.getResults()) {
                for (OpOperand use : result.getUses()) {
                    consumers.computeIfAbsent(use.getOwner(), k -> new TreeSet<>()).add(use.getIndex());
                }
            }
            for (Map.Entry<Operation, SortedSet<Integer>> entry : consumers.entrySet()) {
                Operation consumer = entry.getKey();
                List<Value> operands = new ArrayList<>(consumer.getOperands());
                List<Integer> dropped = new ArrayList<>(entry.getValue());
                Collections.reverse(dropped);
                for (int index : dropped) {
                    operands.remove(index);
                }
                Operation replacement = recreator.recreate(consumer, operands);
                FunctionSignatures.syncReturn(backend, replacement);
            }
            backend.erase(target);
        });
    }

    /**
     * Set an operand of an operation, reordering its block if the new value would be used before it is defined.
     *
     * @param session The session.
     * @param opId    The operation.
     * @param index   The operand index.
     * @param valueId The new operand.
     * @return The new graph.
     */
    public Graph setOperand(EditSession session, String opId, int index, String valueId) {
        EntityRegistry registry = registry(session);
        Operation op = registry.requireOperation(opId);
        checkIndex("operand", index, op.getNumOperands());
        Value value = registry.requireValue(valueId);
        return transact(session, "set operand " + index + " of " + opId, () -> {
            backend.setOperand(op, index, value);
            FunctionSignatures.syncReturn(backend, op);
            dominance.ensureDominance(op);
        });
    }

    public Graph removeOperand(EditSession session, String opId, int index) {
        Operation op = registry(session).requireOperation(opId);
        checkIndex("operand", index, op.getNumOperands());
        return transact(session, "remove operand " + index + " of " + opId, () -> {
            List<Value> operands = new ArrayList<>(op.getOperands());
            operands.remove(index);
            Operation replacement = recreator.recreate(op, operands);
            FunctionSignatures.syncReturn(backend, replacement);
        });
    }

    /**
     * Insert an operand into an operation.
     *
     * @param session  The session.
     * @param opId     The operation.
     * @param valueId  The new operand.
     * @param position The index of the new operand, or null to append it.
     * @return The new graph.
     */
    public Graph addOperand(EditSession session, String opId, String valueId, @Nullable Integer position) {
        EntityRegistry registry = registry(session);
        Operation op = registry.requireOperation(opId);
        Value value = registry.requireValue(valueId);
        int index = position == null ? op.getNumOperands() : position;
        checkIndex("operand position", index, op.getNumOperands() + 1);
        return transact(session, "add operand to " + opId, () -> {
            List<Value> operands = new ArrayList<>(op.getOperands());
            operands.add(index, value);
            Operation replacement = recreator.recreate(op, operands);
            FunctionSignatures.syncReturn(backend, replacement);
            dominance.ensureDominance(replacement);
        });
    }

    /**
     * Return a result of an operation from its enclosing function, adding it to the function's results.
     *
     * @param session     The session.
     * @param opId        The operation.
     * @param resultIndex The result.
     * @return The new graph.
     */
    public Graph addResultToOutput(EditSession session, String opId, int resultIndex) {
        Operation op = registry(session).requireOperation(opId);
        checkIndex("result", resultIndex, op.getNumResults());
        FunctionSignatures.FuncAndReturn found = FunctionSignatures.findFuncAndReturn(backend, op);
        if (found == null) {
            throw new EditFailedException(opId, "not in a " + FunctionSignatures.FUNC
                    + " whose entry block ends in " + FunctionSignatures.RETURN);
        }
        if (FuncOps.getFunctionType(found.func) == null) {
            throw new EditFailedException(opId, "enclosing " + FunctionSignatures.FUNC + " has no valid "
                    + FunctionSignatures.FUNCTION_TYPE);
        }
        return transact(session, "add result " + resultIndex + " of " + opId + " to output", () -> {
            OpResult result = op.getResult(resultIndex);
            List<Value> operands = new ArrayList<>(found.ret.getOperands());
            operands.add(result);
            Operation ret = recreator.recreate(found.ret, operands);
            FunctionSignatures.appendResult(backend, found.func, result.getType());
            dominance.ensureDominance(ret);
        });
    }

    /**
     * Rebuild the graph of a session from its module.
     *
     * @param session The session.
     * @return The graph.
     */
    public Graph rebuild(EditSession session) {
        Graph graph = builder.build(session.requireModule(), session.getRegistry());
        session.setGraph(graph);
        return graph;
    }

    @FunctionalInterface
    private interface Edit {
        void apply();
    }

    private Graph transact(EditSession session, String description, Edit edit) {
        session.getHistory().snapshot(print(session));
        try {
            edit.apply();
        } catch (RuntimeException e) {
            rollback(session, description, e);
            throw e;
        }
        LOGGER.debug("Committed {}", description);
        return rebuild(session);
    }

    private void rollback(EditSession session, String description, RuntimeException cause) {
        LOGGER.warn("Rolling back {}: {}", description, cause.getMessage());
        try {
            String text = session.getHistory().rollbackLatest();
            session.setModule(backend.parse(text));
            rebuild(session);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    private Graph restore(EditSession session, String text) {
        session.setModule(backend.parse(text));
        return rebuild(session);
    }

    private static EntityRegistry registry(EditSession session) {
        session.requireModule();
        return session.getRegistry();
    }

    private Operation requireDeletable(EditSession session, String opId) {
        Operation op = registry(session).requireOperation(opId);
        if (backend.isSameOperation(op, session.requireModule())) {
            throw new EditFailedException(opId, "the module itself cannot be deleted");
        }
        return op;
    }

    private static void checkIndex(String what, int index, int size) {
        if (index < 0 || index >= size) {
            throw new OutOfRangeException(what, index, size);
        }
    }

    /**
     * Add the users of everything {@code op} defines to {@code order}, recursively, followed by {@code op}.
     */
    private static void collectConsumersFirst(Operation op, Set<Operation> seen, List<Operation> order) {
        if (!seen.add(op)) return;
        List<Operation> users = new ArrayList<>();
        op.walk(nested -> {
            for (OpResult result : nested.getResults()) {
                for (OpOperand use : result.getUses()) {
                    if (!op.isAncestorOf(use.getOwner())) {
                        users.add(use.getOwner());
                    }
                }
            }
        });
        for (Operation user : users) {
            collectConsumersFirst(user, seen, order);
        }
        order.add(op);
    }

    private boolean isInside(Operation op, Operation module) {
        Operation it = op;
        while (it != null) {
            if (backend.isSameOperation(it, module)) return true;
            if (backend.getParentBlock(it) == null) return false;
            it = backend.getParentOperation(it);
        }
        return false;
    }
}
