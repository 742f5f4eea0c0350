package io.github.eutro.irgraph.core.ops;

import io.github.eutro.irgraph.core.attrs.Attribute;
import io.github.eutro.irgraph.core.attrs.StringAttr;
import io.github.eutro.irgraph.core.attrs.SymbolRefAttr;
import io.github.eutro.irgraph.core.attrs.TypeAttr;
import io.github.eutro.irgraph.core.diag.Diagnostics;
import io.github.eutro.irgraph.core.ext.CommonExts;
import io.github.eutro.irgraph.core.ir.Block;
import io.github.eutro.irgraph.core.ir.Operation;
import io.github.eutro.irgraph.core.ir.Region;
import io.github.eutro.irgraph.core.types.FunctionType;
import io.github.eutro.irgraph.core.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.List;

public class FuncOps {
    public static final OpKey FUNC = new OpKey("func.func",
            "An operation with a name containing a single SSACFG region")
            .withInherentAttrs("sym_name", "function_type", "sym_visibility", "arg_attrs", "res_attrs")
            .withVerifier(FuncOps::verifyFunc);
    public static final OpKey RETURN = new OpKey("func.return",
            "Function return operation")
            .withVerifier(FuncOps::verifyReturn);
    public static final OpKey CALL = new OpKey("func.call",
            "Call operation")
            .withInherentAttrs("callee", "arg_attrs", "res_attrs")
            .withVerifier(FuncOps::verifyCall);

    static {
        CommonExts.markIsolated(FUNC);
        CommonExts.markTerminator(RETURN);
    }

    /**
     * Get the signature of a {@code func.func} operation.
     *
     * @param func The function.
     * @return The signature, or null if the function has no valid {@code function_type}.
     */
    public static @Nullable FunctionType getFunctionType(Operation func) {
        Attribute attr = func.getAttribute("function_type");
        if (attr instanceof TypeAttr && ((TypeAttr) attr).value instanceof FunctionType) {
            return (FunctionType) ((TypeAttr) attr).value;
        }
        return null;
    }

    public static @Nullable String getSymName(Operation op) {
        Attribute attr = op.getAttribute("sym_name");
        return attr instanceof StringAttr ? ((StringAttr) attr).value : null;
    }

    private static void verifyFunc(Operation op, Diagnostics diags) {
        if (!Verifiers.shape(op, 0, 0, 1, diags)) return;
        StringAttr name = Verifiers.requireAttr(op, "sym_name", StringAttr.class, diags);
        TypeAttr typeAttr = Verifiers.requireAttr(op, "function_type", TypeAttr.class, diags);
        if (name == null || typeAttr == null) return;
        if (!(typeAttr.value instanceof FunctionType)) {
            diags.error(op, "attribute 'function_type' failed to satisfy constraint: type attribute of function type");
            return;
        }
        FunctionType type = (FunctionType) typeAttr.value;
        Block entry = op.getRegion(0).getEntryBlock();
        if (entry == null) return; // external declaration
        for (Block block : op.getRegion(0).getBlocks()) {
            if (block.isEmpty()) {
                diags.error(op, "empty block: expect at least a terminator");
            } else if (block.getTerminator() == null) {
                List<Operation> ops = block.getOperations();
                diags.error(op, "block with no terminator, has '%s'", ops.get(ops.size() - 1).getName());
            }
        }
        if (entry.getNumArguments() != type.inputs.size()) {
            diags.error(op, "entry block must have %d arguments to match function signature", type.inputs.size());
            return;
        }
        for (int i = 0; i < type.inputs.size(); i++) {
            Type argType = entry.getArgument(i).getType();
            if (!argType.equals(type.inputs.get(i))) {
                diags.error(op, "type of entry block argument #%d(%s) must match the type of the corresponding argument in function signature(%s)",
                        i, argType, type.inputs.get(i));
            }
        }
    }

    private static void verifyReturn(Operation op, Diagnostics diags) {
        Operation func = op.getParentOp();
        if (func == null || func.getKey() != FUNC) {
            diags.error(op, "expects parent op 'func.func'");
            return;
        }
        FunctionType type = getFunctionType(func);
        if (type == null) return; // reported on the function
        String funcName = getSymName(func);
        List<Type> results = type.results;
        if (op.getNumOperands() != results.size()) {
            diags.error(op, "has %d operands, but enclosing function (@%s) returns %d",
                    op.getNumOperands(), funcName, results.size());
            return;
        }
        for (int i = 0; i < results.size(); i++) {
            Type operandType = op.getOperand(i).getType();
            if (!operandType.equals(results.get(i))) {
                diags.error(op, "type of return operand %d (%s) doesn't match function result type (%s) in function @%s",
                        i, operandType, results.get(i), funcName);
            }
        }
    }

    private static void verifyCall(Operation op, Diagnostics diags) {
        if (!Verifiers.regionCount(op, 0, diags)) return;
        SymbolRefAttr callee = Verifiers.requireAttr(op, "callee", SymbolRefAttr.class, diags);
        if (callee == null || !callee.nested.isEmpty()) return;
        Operation target = lookupFunction(op, callee.root);
        if (target == null) {
            diags.error(op, "'%s' does not reference a valid function", callee.root);
            return;
        }
        FunctionType type = getFunctionType(target);
        if (type == null) return;
        if (!type.inputs.equals(op.getOperandTypes())) {
            diags.error(op, "operand types (%s) do not match callee @%s inputs (%s)",
                    Verifiers.typeList(op.getOperandTypes()), callee.root, Verifiers.typeList(type.inputs));
        }
        if (!type.results.equals(op.getResultTypes())) {
            diags.error(op, "result types (%s) do not match callee @%s results (%s)",
                    Verifiers.typeList(op.getResultTypes()), callee.root, Verifiers.typeList(type.results));
        }
    }

    private static @Nullable Operation lookupFunction(Operation from, String name) {
        for (Operation scope = from.getParentOp(); scope != null; scope = scope.getParentOp()) {
            if (scope.getKey() != BuiltinOps.MODULE) continue;
            for (Region region : scope.getRegions()) {
                for (Block block : region.getBlocks()) {
                    for (Operation op : block.getOperations()) {
                        if (op.getKey() == FUNC && name.equals(getSymName(op))) return op;
                    }
                }
            }
        }
        return null;
    }
}
