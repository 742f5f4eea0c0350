package io.github.eutro.irgraph.edit.history;

import io.github.eutro.irgraph.edit.EditException;

/**
 * Thrown on an undo or redo with no state to return to.
 */
public class HistoryEmptyException extends EditException {
    public final Direction direction;

    public HistoryEmptyException(Direction direction) {
        super("Nothing to " + direction.verb);
        this.direction = direction;
    }

    public enum Direction {
        UNDO("undo"),
        REDO("redo"),
        ;

        public final String verb;

        Direction(String verb) {
            this.verb = verb;
        }
    }
}
