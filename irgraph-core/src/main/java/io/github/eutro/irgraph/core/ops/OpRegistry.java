package io.github.eutro.irgraph.core.ops;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The set of registered operations, by name.
 * <p>
 * Operations whose names are not registered are still allowed in the IR,
 * but are opaque: they have no traits and are not verified.
 */
public final class OpRegistry {
    private final Map<String, OpKey> keys = new TreeMap<>();

    /**
     * Create a registry containing the builtin, func, arith and scf dialects.
     *
     * @return The registry.
     */
    public static OpRegistry builtin() {
        OpRegistry registry = new OpRegistry();
        registry.registerAll(BuiltinOps.MODULE);
        registry.registerAll(FuncOps.FUNC, FuncOps.RETURN, FuncOps.CALL);
        registry.registerAll(
                ArithOps.CONSTANT,
                ArithOps.ADDF, ArithOps.SUBF, ArithOps.MULF, ArithOps.DIVF, ArithOps.NEGF,
                ArithOps.ADDI, ArithOps.SUBI, ArithOps.MULI,
                ArithOps.CMPF, ArithOps.SELECT
        );
        registry.registerAll(ScfOps.IF, ScfOps.YIELD);
        return registry;
    }

    public void register(OpKey key) {
        if (keys.putIfAbsent(key.mnemonic, key) != null) {
            throw new IllegalArgumentException("operation '" + key.mnemonic + "' is already registered");
        }
    }

    public void registerAll(OpKey... keys) {
        for (OpKey key : keys) {
            register(key);
        }
    }

    public @Nullable OpKey lookup(String name) {
        return keys.get(name);
    }

    public boolean isRegistered(String name) {
        return keys.containsKey(name);
    }

    /**
     * Get the registered keys, sorted by name.
     *
     * @return The keys.
     */
    public Collection<OpKey> getKeys() {
        return Collections.unmodifiableCollection(keys.values());
    }
}
