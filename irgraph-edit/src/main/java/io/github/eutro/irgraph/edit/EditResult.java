package io.github.eutro.irgraph.edit;

import io.github.eutro.irgraph.edit.graph.Graph;
import io.github.eutro.irgraph.edit.validate.ValidationReport;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * The graph after an edit, with the validation of the edited module.
 */
public final class EditResult {
    public final Graph graph;
    /**
     * The validation, or null if the service does not validate after edits.
     */
    @Nullable
    public final ValidationReport validation;

    public EditResult(Graph graph, @Nullable ValidationReport validation) {
        this.graph = graph;
        this.validation = validation;
    }

    /**
     * Whether the module is valid. Unvalidated modules count as valid.
     *
     * @return Whether the module is valid.
     */
    public boolean isValid() {
        return validation == null || validation.valid;
    }

    public List<String> getDiagnostics() {
        return validation == null ? Collections.emptyList() : validation.diagnostics;
    }
}
