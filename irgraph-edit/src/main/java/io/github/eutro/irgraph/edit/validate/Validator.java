package io.github.eutro.irgraph.edit.validate;

import io.github.eutro.irgraph.core.backend.IRBackend;
import io.github.eutro.irgraph.core.backend.VerificationResult;
import io.github.eutro.irgraph.core.diag.Diagnostic;
import io.github.eutro.irgraph.core.diag.Severity;
import io.github.eutro.irgraph.core.ir.Operation;
import io.github.eutro.irgraph.edit.EditSession;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks the module of a session.
 * <p>
 * Everything the backend can verify is left to it. Operations it does not
 * know are checked against their signatures in an {@link OpCatalog}, if they
 * have one. Any diagnostic, even a warning, makes the module invalid.
 */
public final class Validator {
    private final IRBackend backend;
    private final OpCatalog catalog;

    public Validator(IRBackend backend, OpCatalog catalog) {
        this.backend = backend;
        this.catalog = catalog;
    }

    public ValidationReport validate(EditSession session) {
        Operation module = session.requireModule();
        VerificationResult result = backend.verify(module);
        List<String> diagnostics = new ArrayList<>();
        for (Diagnostic diagnostic : result.diagnostics) {
            diagnostics.add(diagnostic.format());
        }
        for (Map.Entry<String, Operation> entry : session.getRegistry().getOperations().entrySet()) {
            checkSignature(entry.getKey(), entry.getValue(), diagnostics);
        }
        return new ValidationReport(result.valid && diagnostics.isEmpty(), diagnostics);
    }

    private void checkSignature(String opId, Operation op, List<String> diagnostics) {
        String name = op.getName();
        if (backend.isRegisteredOperation(name)) return;
        OpSignature signature = catalog.signature(name);
        if (signature == null) return;
        int minOperands = signature.minOperands();
        if (op.getNumOperands() < minOperands) {
            diagnostics.add(warning(name, opId,
                    "expected at least " + minOperands + " operands, got " + op.getNumOperands()));
        }
        if (!signature.hasVariadicResults() && op.getNumResults() != signature.numResults) {
            diagnostics.add(warning(name, opId,
                    "expected " + signature.numResults + " results, got " + op.getNumResults()));
        }
    }

    private static String warning(String name, String opId, String message) {
        return new Diagnostic(Severity.WARNING, name + " (" + opId + "): " + message, name).format();
    }
}
