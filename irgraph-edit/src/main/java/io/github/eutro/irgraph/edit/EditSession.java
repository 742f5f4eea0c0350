package io.github.eutro.irgraph.edit;

import io.github.eutro.irgraph.core.ir.Operation;
import io.github.eutro.irgraph.edit.conf.EditorConfig;
import io.github.eutro.irgraph.edit.graph.EntityRegistry;
import io.github.eutro.irgraph.edit.graph.Graph;
import io.github.eutro.irgraph.edit.history.HistoryManager;
import org.jetbrains.annotations.Nullable;

/**
 * The state of one editing session: the loaded module, its current graph and ids, and its history.
 * <p>
 * Sessions are not thread-safe; every call on a session must be serialized by its owner.
 */
public final class EditSession {
    private final HistoryManager history;
    private final EntityRegistry registry = new EntityRegistry();
    @Nullable
    private Operation module;
    @Nullable
    private Graph graph;

    public EditSession() {
        this(EditorConfig.DEFAULT);
    }

    public EditSession(EditorConfig config) {
        history = new HistoryManager(config.getHistoryCapacity());
    }

    public boolean isLoaded() {
        return module != null;
    }

    /**
     * Get the loaded module.
     *
     * @return The module.
     * @throws NoModuleLoadedException If nothing has been loaded.
     */
    public Operation requireModule() {
        if (module == null) throw new NoModuleLoadedException();
        return module;
    }

    /**
     * Get the graph of the loaded module, as of the last load, edit, undo or redo.
     *
     * @return The graph.
     * @throws NoModuleLoadedException If nothing has been loaded.
     */
    public Graph getGraph() {
        if (graph == null) throw new NoModuleLoadedException();
        return graph;
    }

    public EntityRegistry getRegistry() {
        return registry;
    }

    public HistoryManager getHistory() {
        return history;
    }

    void setModule(Operation module) {
        this.module = module;
    }

    void setGraph(Graph graph) {
        this.graph = graph;
    }
}
