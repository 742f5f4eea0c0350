package io.github.eutro.irgraph.core.ops;

import io.github.eutro.irgraph.core.diag.Diagnostics;
import io.github.eutro.irgraph.core.ext.CommonExts;
import io.github.eutro.irgraph.core.ir.Block;
import io.github.eutro.irgraph.core.ir.Operation;

public class BuiltinOps {
    public static final OpKey MODULE = new OpKey("builtin.module",
            "A top level container operation, holding a single block of operations")
            .withInherentAttrs("sym_name", "sym_visibility")
            .withVerifier(BuiltinOps::verifyModule);

    static {
        CommonExts.markIsolated(MODULE);
    }

    private static void verifyModule(Operation op, Diagnostics diags) {
        if (!Verifiers.shape(op, 0, 0, 1, diags)) return;
        int blocks = op.getRegion(0).getBlocks().size();
        if (blocks > 1) {
            diags.error(op, "expects region #0 to have 0 or 1 blocks, but found %d", blocks);
            return;
        }
        Block body = op.getRegion(0).getEntryBlock();
        if (body != null && body.getNumArguments() != 0) {
            diags.error(op, "expects the body to have no arguments");
        }
    }
}
