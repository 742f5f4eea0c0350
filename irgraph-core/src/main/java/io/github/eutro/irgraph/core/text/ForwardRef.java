package io.github.eutro.irgraph.core.text;

import io.github.eutro.irgraph.core.ir.Block;
import io.github.eutro.irgraph.core.ir.Value;
import io.github.eutro.irgraph.core.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * A placeholder for a value that is used before it is defined.
 * Replaced by the real value as soon as the parser sees the definition.
 */
final class ForwardRef extends Value {
    private final String name;

    ForwardRef(Type type, String name) {
        super(type);
        this.name = name;
    }

    @Override
    public @Nullable Block getParentBlock() {
        return null;
    }

    @Override
    public String toString() {
        return "%" + name;
    }
}
