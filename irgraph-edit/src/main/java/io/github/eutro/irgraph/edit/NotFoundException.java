package io.github.eutro.irgraph.edit;

/**
 * Thrown when an edit refers to an id that is not in the current graph.
 */
public class NotFoundException extends EditException {
    public final String kind;
    public final String id;

    public NotFoundException(String kind, String id) {
        super(kind + " '" + id + "' not found");
        this.kind = kind;
        this.id = id;
    }
}
