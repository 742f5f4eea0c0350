package io.github.eutro.irgraph.edit.notify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fired after a module changed and was validated.
 */
public final class ValidationEvent {
    public final boolean valid;
    public final List<String> diagnostics;

    public ValidationEvent(boolean valid, List<String> diagnostics) {
        this.valid = valid;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }
}
