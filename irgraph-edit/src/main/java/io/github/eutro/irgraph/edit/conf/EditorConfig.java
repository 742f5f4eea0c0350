package io.github.eutro.irgraph.edit.conf;

import java.util.function.UnaryOperator;

/**
 * Settings for an editing session and the service on top of it.
 */
public final class EditorConfig {
    public static final int DEFAULT_HISTORY_CAPACITY = 50;
    public static final String HISTORY_CAPACITY_PROPERTY = "irgraph.history.capacity";
    public static final String HISTORY_CAPACITY_ENV = "IRGRAPH_HISTORY_CAPACITY";

    public static final EditorConfig DEFAULT = builder().build();

    private final int historyCapacity;
    private final boolean notifyOnUndoRedo;
    private final boolean validateAfterEdit;

    private EditorConfig(Builder builder) {
        historyCapacity = builder.historyCapacity;
        notifyOnUndoRedo = builder.notifyOnUndoRedo;
        validateAfterEdit = builder.validateAfterEdit;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read the configuration from the system property {@value HISTORY_CAPACITY_PROPERTY},
     * or failing that the environment variable {@value HISTORY_CAPACITY_ENV}.
     *
     * @return The config.
     */
    public static EditorConfig fromEnvironment() {
        return fromLookup(System::getProperty, System::getenv);
    }

    static EditorConfig fromLookup(UnaryOperator<String> properties, UnaryOperator<String> environment) {
        Builder builder = builder();
        String capacity = properties.apply(HISTORY_CAPACITY_PROPERTY);
        String source = HISTORY_CAPACITY_PROPERTY;
        if (capacity == null) {
            capacity = environment.apply(HISTORY_CAPACITY_ENV);
            source = HISTORY_CAPACITY_ENV;
        }
        if (capacity != null) {
            builder.setHistoryCapacity(parseCapacity(source, capacity));
        }
        return builder.build();
    }

    private static int parseCapacity(String source, String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(source + " is not a number: '" + text + "'", e);
        }
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    /**
     * Whether undo and redo publish their validation to subscribers, like edits do.
     */
    public boolean isNotifyOnUndoRedo() {
        return notifyOnUndoRedo;
    }

    /**
     * Whether the service validates the module after every edit.
     * If not, results of edits are unvalidated and nothing is published.
     */
    public boolean isValidateAfterEdit() {
        return validateAfterEdit;
    }

    public Builder toBuilder() {
        return builder()
                .setHistoryCapacity(historyCapacity)
                .setNotifyOnUndoRedo(notifyOnUndoRedo)
                .setValidateAfterEdit(validateAfterEdit);
    }

    @Override
    public String toString() {
        return "EditorConfig{" +
                "historyCapacity=" + historyCapacity +
                ", notifyOnUndoRedo=" + notifyOnUndoRedo +
                ", validateAfterEdit=" + validateAfterEdit +
                '}';
    }

    public static class Builder {
        private int historyCapacity = DEFAULT_HISTORY_CAPACITY;
        private boolean notifyOnUndoRedo = true;
        private boolean validateAfterEdit = true;

        public Builder setHistoryCapacity(int historyCapacity) {
            if (historyCapacity < 1) {
                throw new IllegalArgumentException("history capacity must be positive, got " + historyCapacity);
            }
            this.historyCapacity = historyCapacity;
            return this;
        }

        public Builder setNotifyOnUndoRedo(boolean notifyOnUndoRedo) {
            this.notifyOnUndoRedo = notifyOnUndoRedo;
            return this;
        }

        public Builder setValidateAfterEdit(boolean validateAfterEdit) {
            this.validateAfterEdit = validateAfterEdit;
            return this;
        }

        public EditorConfig build() {
            return new EditorConfig(this);
        }
    }
}
