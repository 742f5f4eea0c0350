package io.github.eutro.irgraph.edit.history;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Bounded undo and redo stacks of whole-module text, stored compressed.
 * <p>
 * When a stack is over capacity its oldest entry is dropped.
 */
public final class HistoryManager {
    private static final Logger LOGGER = LogManager.getLogger();

    private final int capacity;
    // last is most recent
    private final Deque<byte[]> undoStack = new ArrayDeque<>();
    private final Deque<byte[]> redoStack = new ArrayDeque<>();
    @Nullable
    private PendingSnapshot pending;

    public HistoryManager(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("history capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Record the state before an edit. This clears the redo stack.
     *
     * @param text The module text.
     */
    public void snapshot(String text) {
        byte[] entry = compress(text);
        undoStack.addLast(entry);
        byte[] evicted = undoStack.size() > capacity ? undoStack.removeFirst() : null;
        List<byte[]> clearedRedo = new ArrayList<>(redoStack);
        redoStack.clear();
        pending = new PendingSnapshot(entry, evicted, clearedRedo);
        LOGGER.debug("Pushed snapshot ({} bytes compressed, undo depth {})", entry.length, undoStack.size());
    }

    /**
     * Take back the most recent {@link #snapshot(String)}, restoring the stacks to how they were before it.
     *
     * @return The text of the snapshot.
     * @throws IllegalStateException If there was no snapshot since the last undo, redo or clear.
     */
    public String rollbackLatest() {
        PendingSnapshot latest = pending;
        if (latest == null || undoStack.peekLast() != latest.entry) {
            throw new IllegalStateException("no snapshot to roll back");
        }
        pending = null;
        undoStack.removeLast();
        if (latest.evicted != null) {
            undoStack.addFirst(latest.evicted);
        }
        redoStack.addAll(latest.clearedRedo);
        LOGGER.debug("Rolled back snapshot (undo depth {})", undoStack.size());
        return decompress(latest.entry);
    }

    /**
     * Step back one state.
     *
     * @param currentText The current module text, which becomes redoable.
     * @return The text to restore.
     * @throws HistoryEmptyException If there is nothing to undo.
     */
    public String undo(String currentText) {
        if (undoStack.isEmpty()) {
            throw new HistoryEmptyException(HistoryEmptyException.Direction.UNDO);
        }
        pending = null;
        byte[] previous = undoStack.removeLast();
        pushBounded(redoStack, compress(currentText));
        LOGGER.debug("Undo (undo depth {}, redo depth {})", undoStack.size(), redoStack.size());
        return decompress(previous);
    }

    /**
     * Step forward one undone state.
     *
     * @param currentText The current module text, which becomes undoable.
     * @return The text to restore.
     * @throws HistoryEmptyException If there is nothing to redo.
     */
    public String redo(String currentText) {
        if (redoStack.isEmpty()) {
            throw new HistoryEmptyException(HistoryEmptyException.Direction.REDO);
        }
        pending = null;
        byte[] next = redoStack.removeLast();
        pushBounded(undoStack, compress(currentText));
        LOGGER.debug("Redo (undo depth {}, redo depth {})", undoStack.size(), redoStack.size());
        return decompress(next);
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
        pending = null;
        LOGGER.info("History cleared");
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int getUndoDepth() {
        return undoStack.size();
    }

    public int getRedoDepth() {
        return redoStack.size();
    }

    public int getCapacity() {
        return capacity;
    }

    private void pushBounded(Deque<byte[]> stack, byte[] entry) {
        stack.addLast(entry);
        if (stack.size() > capacity) {
            stack.removeFirst();
        }
    }

    private static byte[] compress(String text) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (GZIPOutputStream gos = new GZIPOutputStream(baos)) {
            gos.write(text.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return baos.toByteArray();
    }

    private static String decompress(byte[] data) {
        try (GZIPInputStream gis = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return new String(gis.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static class PendingSnapshot {
        final byte[] entry;
        @Nullable
        final byte[] evicted;
        final List<byte[]> clearedRedo;

        PendingSnapshot(byte[] entry, byte[] evicted, List<byte[]> clearedRedo) {
            this.entry = entry;
            this.evicted = evicted;
            this.clearedRedo = clearedRedo;
        }
    }
}
