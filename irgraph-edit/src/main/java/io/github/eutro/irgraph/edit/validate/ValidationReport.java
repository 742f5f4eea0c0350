package io.github.eutro.irgraph.edit.validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of validating a module: whether it is valid, and every diagnostic as {@code SEVERITY: message}.
 */
public final class ValidationReport {
    public final boolean valid;
    public final List<String> diagnostics;

    public ValidationReport(boolean valid, List<String> diagnostics) {
        this.valid = valid;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    @Override
    public String toString() {
        return (valid ? "valid" : "invalid") + " " + diagnostics;
    }
}
