package io.github.eutro.irgraph.core.ops;

import io.github.eutro.irgraph.core.diag.Diagnostics;
import io.github.eutro.irgraph.core.ir.Operation;

/**
 * Checks the invariants of one kind of operation, beyond the structural rules every operation obeys.
 */
@FunctionalInterface
public interface OpVerifier {
    /**
     * Verify {@code op}, reporting any problems to {@code diags}.
     *
     * @param op    The operation.
     * @param diags Where to report problems.
     */
    void verify(Operation op, Diagnostics diags);
}
