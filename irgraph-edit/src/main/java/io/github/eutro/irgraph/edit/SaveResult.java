package io.github.eutro.irgraph.edit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The text of a module, with its validation at the time it was saved.
 */
public final class SaveResult {
    public final String text;
    public final boolean valid;
    public final List<String> diagnostics;

    public SaveResult(String text, boolean valid, List<String> diagnostics) {
        this.text = text;
        this.valid = valid;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }
}
