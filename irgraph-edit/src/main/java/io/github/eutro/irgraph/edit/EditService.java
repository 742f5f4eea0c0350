package io.github.eutro.irgraph.edit;

import io.github.eutro.irgraph.core.backend.DefaultBackend;
import io.github.eutro.irgraph.core.backend.IRBackend;
import io.github.eutro.irgraph.edit.conf.EditorConfig;
import io.github.eutro.irgraph.edit.graph.Graph;
import io.github.eutro.irgraph.edit.history.HistoryManager;
import io.github.eutro.irgraph.edit.notify.ValidationNotifier;
import io.github.eutro.irgraph.edit.validate.*;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A single editing session, with its module validated and the result published after every change.
 * <p>
 * This is the entry point for front ends: each method corresponds to one
 * request, and edits return the new graph along with its validation.
 */
public class EditService {
    private final EditorConfig config;
    private final EditSession session;
    private final GraphEditor editor;
    private final Validator validator;
    private final OpCatalog catalog;
    private final ValidationNotifier notifier = new ValidationNotifier();

    public EditService(EditorConfig config, IRBackend backend, OpCatalog catalog) {
        this.config = config;
        this.catalog = catalog;
        session = new EditSession(config);
        editor = new GraphEditor(backend);
        validator = new Validator(backend, catalog);
    }

    public EditService(EditorConfig config) {
        this(config, new DefaultBackend(), new BuiltinOpCatalog());
    }

    public EditService() {
        this(EditorConfig.fromEnvironment());
    }

    public EditorConfig getConfig() {
        return config;
    }

    public EditSession getSession() {
        return session;
    }

    public ValidationNotifier getNotifier() {
        return notifier;
    }

    public EditResult load(String text) {
        return validated(editor.load(session, text), true);
    }

    /**
     * Get the current module text, validated but without notifying anyone.
     *
     * @return The module text and its validation.
     */
    public SaveResult save() {
        String text = editor.print(session);
        ValidationReport report = validator.validate(session);
        return new SaveResult(text, report.valid, report.diagnostics);
    }

    public Graph getGraph() {
        return session.getGraph();
    }

    public ValidationReport validate() {
        return validator.validate(session);
    }

    public EditResult undo() {
        return validated(editor.undo(session), config.isNotifyOnUndoRedo());
    }

    public EditResult redo() {
        return validated(editor.redo(session), config.isNotifyOnUndoRedo());
    }

    public HistoryStatus historyStatus() {
        HistoryManager history = session.getHistory();
        return new HistoryStatus(history.canUndo(), history.canRedo());
    }

    public EditResult modifyAttributes(String opId, Map<String, String> updates, Collection<String> deletes) {
        return edited(editor.modifyAttributes(session, opId, updates, deletes));
    }

    public EditResult createOperation(
            String opName,
            List<String> resultTypes,
            List<String> operandIds,
            Map<String, String> attributes,
            String blockId,
            @Nullable Integer position
    ) {
        return edited(editor.createOperation(session, opName, resultTypes, operandIds, attributes, blockId, position));
    }

    public EditResult deleteOperation(String opId) {
        return edited(editor.deleteOperation(session, opId));
    }

    public EditResult deleteOperationSingle(String opId) {
        return edited(editor.deleteOperationSingle(session, opId));
    }

    public EditResult setOperand(String opId, int index, String valueId) {
        return edited(editor.setOperand(session, opId, index, valueId));
    }

    public EditResult removeOperand(String opId, int index) {
        return edited(editor.removeOperand(session, opId, index));
    }

    public EditResult addOperand(String opId, String valueId, @Nullable Integer position) {
        return edited(editor.addOperand(session, opId, valueId, position));
    }

    public EditResult addResultToOutput(String opId, int resultIndex) {
        return edited(editor.addResultToOutput(session, opId, resultIndex));
    }

    public List<String> listDialects() {
        return catalog.listDialects();
    }

    public List<OpDescription> listOps(String dialect) {
        return catalog.listOps(dialect);
    }

    /**
     * Get the signature of an operation.
     *
     * @param opName The operation name.
     * @return The signature.
     * @throws NotFoundException If the catalog does not know the operation.
     */
    public OpSignature signature(String opName) {
        OpSignature signature = catalog.signature(opName);
        if (signature == null) throw new NotFoundException("operation signature", opName);
        return signature;
    }

    private EditResult edited(Graph graph) {
        if (!config.isValidateAfterEdit()) {
            return new EditResult(graph, null);
        }
        return validated(graph, true);
    }

    private EditResult validated(Graph graph, boolean publish) {
        ValidationReport report = validator.validate(session);
        if (publish) {
            notifier.publish(report.valid, report.diagnostics);
        }
        return new EditResult(graph, report);
    }
}
