package io.github.eutro.irgraph.edit;

import io.github.eutro.irgraph.core.attrs.TypeAttr;
import io.github.eutro.irgraph.core.backend.IRBackend;
import io.github.eutro.irgraph.core.ir.Block;
import io.github.eutro.irgraph.core.ir.Operation;
import io.github.eutro.irgraph.core.ops.FuncOps;
import io.github.eutro.irgraph.core.types.FunctionType;
import io.github.eutro.irgraph.core.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the {@code function_type} of functions in line with their returns.
 */
public final class FunctionSignatures {
    public static final String FUNC = FuncOps.FUNC.mnemonic;
    public static final String RETURN = FuncOps.RETURN.mnemonic;
    public static final String FUNCTION_TYPE = "function_type";

    private FunctionSignatures() {
    }

    /**
     * A function and the return terminating its entry block.
     */
    public static final class FuncAndReturn {
        public final Operation func;
        public final Operation ret;

        FuncAndReturn(Operation func, Operation ret) {
            this.func = func;
            this.ret = ret;
        }
    }

    /**
     * Find the function containing {@code op}, or {@code op} itself if it is one,
     * along with the return at the end of its entry block.
     *
     * @param backend The backend.
     * @param op      The operation.
     * @return The function and its return, or null if there is no function or its entry block does not end in a return.
     */
    public static @Nullable FuncAndReturn findFuncAndReturn(IRBackend backend, Operation op) {
        Operation func = op;
        while (func != null && !FUNC.equals(func.getName())) {
            func = backend.getParentOperation(func);
        }
        if (func == null || func.getNumRegions() == 0) return null;
        Block entry = func.getRegion(0).getEntryBlock();
        if (entry == null || entry.isEmpty()) return null;
        List<Operation> ops = entry.getOperations();
        Operation last = ops.get(ops.size() - 1);
        if (!RETURN.equals(last.getName())) return null;
        return new FuncAndReturn(func, last);
    }

    /**
     * If {@code op} is the return of a function, set the function's result
     * types to the types of its operands. The input types are kept.
     *
     * @param backend The backend.
     * @param op      The operation, which need not be a return.
     * @return Whether a signature was updated.
     */
    public static boolean syncReturn(IRBackend backend, Operation op) {
        if (!RETURN.equals(op.getName())) return false;
        FuncAndReturn found = findFuncAndReturn(backend, op);
        if (found == null || !backend.isSameOperation(found.ret, op)) return false;
        FunctionType type = FuncOps.getFunctionType(found.func);
        if (type == null) return false;
        setResults(backend, found.func, type, op.getOperandTypes());
        return true;
    }

    /**
     * Append a result type to a function's signature.
     *
     * @param backend The backend.
     * @param func    The function.
     * @param result  The new result type.
     * @throws IllegalStateException If the function has no function type.
     */
    public static void appendResult(IRBackend backend, Operation func, Type result) {
        FunctionType type = FuncOps.getFunctionType(func);
        if (type == null) {
            throw new IllegalStateException("'" + func.getName() + "' has no " + FUNCTION_TYPE);
        }
        List<Type> results = new ArrayList<>(type.results);
        results.add(result);
        setResults(backend, func, type, results);
    }

    private static void setResults(IRBackend backend, Operation func, FunctionType type, List<Type> results) {
        backend.setAttribute(func, FUNCTION_TYPE, new TypeAttr(type.withResults(results)));
    }
}
