package io.github.eutro.irgraph.core.backend;

import io.github.eutro.irgraph.core.diag.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of verifying a module: whether it is valid, and every diagnostic emitted on the way.
 */
public final class VerificationResult {
    public final boolean valid;
    public final List<Diagnostic> diagnostics;

    public VerificationResult(boolean valid, List<Diagnostic> diagnostics) {
        this.valid = valid;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }
}
