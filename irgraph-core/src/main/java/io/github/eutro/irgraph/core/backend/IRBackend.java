package io.github.eutro.irgraph.core.backend;

import io.github.eutro.irgraph.core.attrs.Attribute;
import io.github.eutro.irgraph.core.ir.*;
import io.github.eutro.irgraph.core.text.IRParseException;
import io.github.eutro.irgraph.core.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * The primitives an IR engine offers for reading, writing and mutating a module.
 * <p>
 * Handles returned by a backend (operations, blocks, values) are only meaningful until
 * the module is reparsed. Callers should compare them with the {@code isSame} methods
 * rather than relying on object identity.
 */
public interface IRBackend {
    /**
     * Parse module text.
     *
     * @param text The text.
     * @return The root {@code builtin.module} operation.
     * @throws IRParseException If the text is malformed.
     */
    Operation parse(String text);

    String print(Operation root);

    VerificationResult verify(Operation root);

    /**
     * Parse a type.
     *
     * @param text The text.
     * @return The type.
     * @throws IRParseException If the text is not a type.
     */
    Type parseType(String text);

    /**
     * Parse an attribute.
     *
     * @param text The text.
     * @return The attribute.
     * @throws IRParseException If the text is not an attribute.
     */
    Attribute parseAttribute(String text);

    boolean isRegisteredOperation(String name);

    /**
     * Create an operation and insert it.
     *
     * @param state The operation state.
     * @param where Where to insert it.
     * @return The operation.
     */
    Operation createOperation(OperationState state, InsertionPoint where);

    /**
     * Erase an operation.
     *
     * @param op The operation.
     * @throws IRException If any of its results are still used outside it.
     */
    void erase(Operation op);

    void replaceAllUsesWith(Value oldValue, Value newValue);

    Value getOperand(Operation op, int index);

    void setOperand(Operation op, int index, Value value);

    boolean isSameValue(Value a, Value b);

    boolean isSameOperation(Operation a, Operation b);

    boolean isSameBlock(Block a, Block b);

    @Nullable Block getParentBlock(Operation op);

    @Nullable Operation getParentOperation(Operation op);

    @Nullable Operation getParentOperation(Block block);

    /**
     * Set an attribute, as a property if the operation has it as one, or its kind declares it
     * inherent, otherwise as a discardable attribute.
     *
     * @param op    The operation.
     * @param name  The name of the attribute.
     * @param value The value.
     */
    void setAttribute(Operation op, String name, Attribute value);

    /**
     * Remove an attribute, whether it is a property or a discardable attribute.
     *
     * @param op   The operation.
     * @param name The name of the attribute.
     * @return Whether anything was removed.
     */
    boolean removeAttribute(Operation op, String name);

    void moveBefore(Operation op, Operation before);

    void moveAfter(Operation op, Operation after);

    /**
     * Move all blocks of one region to the end of another.
     *
     * @param from The region to take blocks from.
     * @param to   The region to add them to.
     */
    void moveBlocks(Region from, Region to);
}
