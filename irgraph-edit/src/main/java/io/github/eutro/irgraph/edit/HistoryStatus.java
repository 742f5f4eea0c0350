package io.github.eutro.irgraph.edit;

public final class HistoryStatus {
    public final boolean canUndo;
    public final boolean canRedo;

    public HistoryStatus(boolean canUndo, boolean canRedo) {
        this.canUndo = canUndo;
        this.canRedo = canRedo;
    }
}
