package io.github.eutro.irgraph.edit.validate;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Metadata about the operations an editor can offer, including ones the backend cannot verify.
 */
public interface OpCatalog {
    /**
     * List the known dialects, sorted by name.
     *
     * @return The dialect names.
     */
    List<String> listDialects();

    /**
     * List the operations of a dialect, sorted by name.
     *
     * @param dialect The dialect.
     * @return The operations, empty if the dialect is unknown.
     */
    List<OpDescription> listOps(String dialect);

    /**
     * Get the signature of an operation.
     *
     * @param opName The full name of the operation.
     * @return The signature, or null if the operation is unknown.
     */
    @Nullable OpSignature signature(String opName);
}
