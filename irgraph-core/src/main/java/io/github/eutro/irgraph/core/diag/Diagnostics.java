package io.github.eutro.irgraph.core.diag;

import io.github.eutro.irgraph.core.ir.Operation;
import org.intellij.lang.annotations.PrintFormat;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A collector of {@link Diagnostic diagnostics}.
 * <p>
 * Messages about an operation are prefixed with its quoted name, as in
 * {@code 'func.return' op has 1 operands, but enclosing function (@f) returns 2}.
 */
public final class Diagnostics {
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void emit(Severity severity, @Nullable Operation op, @PrintFormat String format, Object... args) {
        String message = String.format(format, args);
        if (op != null) {
            message = "'" + op.getName() + "' op " + message;
        }
        diagnostics.add(new Diagnostic(severity, message, op == null ? null : op.getName()));
    }

    public void error(@Nullable Operation op, @PrintFormat String format, Object... args) {
        emit(Severity.ERROR, op, format, args);
    }

    public void warning(@Nullable Operation op, @PrintFormat String format, Object... args) {
        emit(Severity.WARNING, op, format, args);
    }

    public void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public boolean hasErrors() {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.severity == Severity.ERROR) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
