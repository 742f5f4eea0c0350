package io.github.eutro.irgraph.core.passes.meta;

import io.github.eutro.irgraph.core.diag.Diagnostics;
import io.github.eutro.irgraph.core.ir.*;
import io.github.eutro.irgraph.core.ops.OpKey;
import io.github.eutro.irgraph.core.ops.OpVerifier;
import io.github.eutro.irgraph.core.passes.IRPass;

import java.util.List;

/**
 * Verifies an operation and everything nested in it.
 * <p>
 * Every operation is checked against the structural rules: its operands must be defined
 * in the IR, must dominate it, and must not cross the boundary of an operation that is
 * isolated from above; terminators must come last in their block. Registered operations
 * are then checked by their {@link OpVerifier}. Unregistered operations get only the structural checks.
 */
public class VerifyIR implements IRPass<Operation, Diagnostics> {
    /**
     * A singleton instance of this pass.
     */
    public static final VerifyIR INSTANCE = new VerifyIR();

    @Override
    public Diagnostics run(Operation root) {
        Diagnostics diags = new Diagnostics();
        verify(root, diags);
        return diags;
    }

    private void verify(Operation op, Diagnostics diags) {
        List<OpOperand> operands = op.getOpOperands();
        for (OpOperand operand : operands) {
            checkOperand(op, operand, diags);
        }
        for (Region region : op.getRegions()) {
            for (Block block : region.getBlocks()) {
                List<Operation> ops = block.getOperations();
                for (int i = 0; i < ops.size(); i++) {
                    Operation nested = ops.get(i);
                    if (nested.isTerminator() && i != ops.size() - 1) {
                        diags.error(nested, "must be the last operation in the parent block");
                    }
                }
            }
        }
        OpKey key = op.getKey();
        if (key != null && key.getVerifier() != null) {
            key.getVerifier().verify(op, diags);
        }
        for (Region region : op.getRegions()) {
            for (Block block : region.getBlocks()) {
                for (Operation nested : block.getOperations()) {
                    verify(nested, diags);
                }
            }
        }
    }

    private void checkOperand(Operation user, OpOperand operand, Diagnostics diags) {
        Value value = operand.get();
        Block defBlock = value.getParentBlock();
        if (defBlock == null) {
            diags.error(user, "operand #%d does not have a definition in the IR", operand.getIndex());
            return;
        }
        // climb to the ancestor of the user that is in the defining block
        Operation cur = user;
        while (cur.getBlock() != defBlock) {
            Block curBlock = cur.getBlock();
            if (curBlock != null && curBlock.getParent() != null && curBlock.getParent() == defBlock.getParent()) {
                if (!defBlock.isEntryBlock()) {
                    diags.error(user, "operand #%d does not dominate this use", operand.getIndex());
                }
                return;
            }
            Operation parent = cur.getParentOp();
            if (parent == null) {
                diags.error(user, "operand #%d does not dominate this use", operand.getIndex());
                return;
            }
            if (parent.isIsolatedFromAbove()) {
                diags.error(user, "using value defined outside the region");
                return;
            }
            cur = parent;
        }
        if (value instanceof OpResult) {
            Operation def = ((OpResult) value).getOwner();
            if (def == cur || defBlock.indexOf(def) > defBlock.indexOf(cur)) {
                diags.error(user, "operand #%d does not dominate this use", operand.getIndex());
            }
        }
    }
}
