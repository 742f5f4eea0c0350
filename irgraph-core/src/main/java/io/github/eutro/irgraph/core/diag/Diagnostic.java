package io.github.eutro.irgraph.core.diag;

import org.jetbrains.annotations.Nullable;

/**
 * A message produced while verifying IR.
 */
public final class Diagnostic {
    public final Severity severity;
    public final String message;
    /**
     * The name of the operation the diagnostic is about, if any.
     */
    @Nullable
    public final String opName;

    public Diagnostic(Severity severity, String message, @Nullable String opName) {
        this.severity = severity;
        this.message = message;
        this.opName = opName;
    }

    /**
     * Format this diagnostic as {@code "SEVERITY: message"}.
     *
     * @return The formatted diagnostic.
     */
    public String format() {
        return severity + ": " + message;
    }

    @Override
    public String toString() {
        return format();
    }
}
