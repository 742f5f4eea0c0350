package io.github.eutro.irgraph.edit.validate;

import io.github.eutro.irgraph.core.ops.OpKey;
import io.github.eutro.irgraph.core.ops.OpRegistry;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A catalog of the operations of an {@link OpRegistry}, to which further dialects can be added.
 */
public final class BuiltinOpCatalog implements OpCatalog {
    private static final Map<String, OpSignature> BUILTIN_SIGNATURES = new HashMap<>();

    static {
        builtin(OpSignature.builder("builtin.module")
                .optionalAttribute("sym_name")
                .optionalAttribute("sym_visibility")
                .regions(1));
        builtin(OpSignature.builder("func.func")
                .attribute("sym_name")
                .attribute("function_type")
                .optionalAttribute("sym_visibility")
                .optionalAttribute("arg_attrs")
                .optionalAttribute("res_attrs")
                .regions(1));
        builtin(OpSignature.builder("func.return")
                .optionalOperand("operands"));
        builtin(OpSignature.builder("func.call")
                .attribute("callee")
                .optionalOperand("operands")
                .optionalAttribute("arg_attrs")
                .optionalAttribute("res_attrs")
                .variadicResults());
        builtin(OpSignature.builder("arith.constant")
                .attribute("value")
                .results(1));
        for (String name : new String[]{"arith.addf", "arith.subf", "arith.mulf", "arith.divf"}) {
            builtin(OpSignature.builder(name)
                    .operand("lhs")
                    .operand("rhs")
                    .optionalAttribute("fastmath")
                    .results(1));
        }
        builtin(OpSignature.builder("arith.negf")
                .operand("operand")
                .optionalAttribute("fastmath")
                .results(1));
        for (String name : new String[]{"arith.addi", "arith.subi", "arith.muli"}) {
            builtin(OpSignature.builder(name)
                    .operand("lhs")
                    .operand("rhs")
                    .optionalAttribute("overflowFlags")
                    .results(1));
        }
        builtin(OpSignature.builder("arith.cmpf")
                .attribute("predicate")
                .operand("lhs")
                .operand("rhs")
                .optionalAttribute("fastmath")
                .results(1));
        builtin(OpSignature.builder("arith.select")
                .operand("condition")
                .operand("true_value")
                .operand("false_value")
                .results(1));
        builtin(OpSignature.builder("scf.if")
                .operand("condition")
                .variadicResults()
                .regions(2));
        builtin(OpSignature.builder("scf.yield")
                .optionalOperand("results"));
    }

    private static void builtin(OpSignature.Builder builder) {
        OpSignature signature = builder.build();
        BUILTIN_SIGNATURES.put(signature.opName, signature);
    }

    private final Map<String, SortedMap<String, OpDescription>> dialects = new TreeMap<>();
    private final Map<String, OpSignature> signatures = new HashMap<>();

    public BuiltinOpCatalog(OpRegistry registry) {
        for (OpKey key : registry.getKeys()) {
            OpSignature signature = BUILTIN_SIGNATURES.get(key.mnemonic);
            if (signature == null) {
                signature = OpSignature.builder(key.mnemonic).variadicResults().build();
            }
            register(key.description, signature);
        }
    }

    public BuiltinOpCatalog() {
        this(OpRegistry.builtin());
    }

    /**
     * Make a dialect known, even if it has no operations yet.
     *
     * @param dialect The dialect name.
     * @return This catalog.
     */
    public BuiltinOpCatalog registerDialect(String dialect) {
        dialects.computeIfAbsent(dialect, k -> new TreeMap<>());
        return this;
    }

    /**
     * Add an operation, replacing any previous entry of the same name.
     *
     * @param description The one-line description.
     * @param signature   The signature.
     * @return This catalog.
     */
    public BuiltinOpCatalog register(String description, OpSignature signature) {
        String name = signature.opName;
        int dot = name.indexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            throw new IllegalArgumentException("operation name '" + name + "' is not of the form 'dialect.op'");
        }
        String dialect = name.substring(0, dot);
        dialects.computeIfAbsent(dialect, k -> new TreeMap<>())
                .put(name, new OpDescription(name, dialect, description));
        signatures.put(name, signature);
        return this;
    }

    @Override
    public List<String> listDialects() {
        return new ArrayList<>(dialects.keySet());
    }

    @Override
    public List<OpDescription> listOps(String dialect) {
        SortedMap<String, OpDescription> ops = dialects.get(dialect);
        return ops == null ? Collections.emptyList() : new ArrayList<>(ops.values());
    }

    @Override
    public @Nullable OpSignature signature(String opName) {
        return signatures.get(opName);
    }
}
