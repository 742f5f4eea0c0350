package io.github.eutro.irgraph.core.ops;

import io.github.eutro.irgraph.core.diag.Diagnostics;
import io.github.eutro.irgraph.core.ext.CommonExts;
import io.github.eutro.irgraph.core.ir.Block;
import io.github.eutro.irgraph.core.ir.Operation;
import io.github.eutro.irgraph.core.ir.Region;
import io.github.eutro.irgraph.core.types.IntegerType;
import io.github.eutro.irgraph.core.types.Type;

import java.util.List;

public class ScfOps {
    public static final OpKey IF = new OpKey("scf.if",
            "If-then-else operation")
            .withVerifier(ScfOps::verifyIf);
    public static final OpKey YIELD = new OpKey("scf.yield",
            "Loop yield and termination operation")
            .withVerifier(ScfOps::verifyYield);

    static {
        CommonExts.markTerminator(YIELD);
    }

    private static void verifyIf(Operation op, Diagnostics diags) {
        if (!Verifiers.operandCount(op, 1, diags) || !Verifiers.regionCount(op, 2, diags)) return;
        Type cond = op.getOperand(0).getType();
        if (!cond.equals(IntegerType.I1)) {
            diags.error(op, "operand #0 must be 1-bit signless integer, but got '%s'", cond);
        }
        Region thenRegion = op.getRegion(0);
        Region elseRegion = op.getRegion(1);
        if (thenRegion.getBlocks().size() != 1) {
            diags.error(op, "region #0 ('thenRegion') failed to verify constraint: region with 1 blocks");
            return;
        }
        if (elseRegion.getBlocks().size() > 1) {
            diags.error(op, "region #1 ('elseRegion') failed to verify constraint: region with at most 1 blocks");
            return;
        }
        List<Type> results = op.getResultTypes();
        if (!results.isEmpty() && elseRegion.isEmpty()) {
            diags.error(op, "must have an else block if defining values");
            return;
        }
        for (Region region : op.getRegions()) {
            Block block = region.getEntryBlock();
            if (block == null) continue;
            if (block.getNumArguments() != 0) {
                diags.error(op, "expects regions to have no arguments");
            }
            Operation terminator = block.getTerminator();
            if (terminator == null || terminator.getKey() != YIELD) {
                diags.error(op, "expects regions to end with 'scf.yield'");
                continue;
            }
            if (!terminator.getOperandTypes().equals(results)) {
                diags.error(op, "region yields (%s), but the operation returns (%s)",
                        Verifiers.typeList(terminator.getOperandTypes()), Verifiers.typeList(results));
            }
        }
    }

    private static void verifyYield(Operation op, Diagnostics diags) {
        Operation parent = op.getParentOp();
        if (parent == null || !"scf".equals(parent.getDialect())) {
            diags.error(op, "expects parent op to be an 'scf' operation");
        }
    }
}
