package io.github.eutro.irgraph.core.text;

import io.github.eutro.irgraph.core.attrs.DictionaryAttr;
import io.github.eutro.irgraph.core.attrs.StringAttr;
import io.github.eutro.irgraph.core.ir.*;
import io.github.eutro.irgraph.core.types.FunctionType;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prints IR in the generic form read by {@link IRParser}.
 * <p>
 * Names are assigned in document order, so printing is deterministic, and
 * printing the result of parsing printed text gives back the same text.
 * Results are numbered {@code %0, %1, ...}; entry block arguments of operations that are
 * isolated from above are numbered {@code %arg0, %arg1, ...}, and counting restarts
 * inside each isolated operation.
 */
public final class IRPrinter {
    private static final String INDENT = "  ";

    private final StringBuilder sb = new StringBuilder();
    private final Map<Value, String> valueNames = new IdentityHashMap<>();
    private final Map<Operation, String> resultGroups = new IdentityHashMap<>();
    private final Map<Block, String> blockLabels = new IdentityHashMap<>();

    private IRPrinter() {
    }

    /**
     * Print an operation, including everything nested in it.
     *
     * @param op The operation.
     * @return The text, ending with a newline.
     */
    public static String print(Operation op) {
        IRPrinter printer = new IRPrinter();
        printer.assignNames(op, new Counters());
        printer.printOp(op, 0);
        printer.sb.append('\n');
        return printer.sb.toString();
    }

    private static final class Counters {
        int values;
        int args;
        int blocks;
    }

    private void assignNames(Operation op, Counters counters) {
        int numResults = op.getNumResults();
        if (numResults > 0) {
            String base = "%" + counters.values++;
            resultGroups.put(op, base);
            if (numResults == 1) {
                valueNames.put(op.getResult(0), base);
            } else {
                for (OpResult result : op.getResults()) {
                    valueNames.put(result, base + "#" + result.getIndex());
                }
            }
        }
        boolean isolated = op.isIsolatedFromAbove();
        Counters inner = isolated ? new Counters() : counters;
        for (Region region : op.getRegions()) {
            List<Block> blocks = region.getBlocks();
            for (int i = 0; i < blocks.size(); i++) {
                Block block = blocks.get(i);
                if (i != 0 || block.getNumArguments() != 0 || block.isEmpty()) {
                    blockLabels.put(block, "^bb" + inner.blocks++);
                }
                for (BlockArgument arg : block.getArguments()) {
                    valueNames.put(arg, i == 0 && isolated ? "%arg" + inner.args++ : "%" + inner.values++);
                }
                for (Operation nested : block.getOperations()) {
                    assignNames(nested, inner);
                }
            }
        }
    }

    private String nameOf(Value value) {
        String name = valueNames.get(value);
        return name == null ? "%<<UNKNOWN SSA VALUE>>" : name;
    }

    private void indent(int level) {
        for (int i = 0; i < level; i++) sb.append(INDENT);
    }

    private void printOp(Operation op, int level) {
        indent(level);
        String group = resultGroups.get(op);
        if (group != null) {
            sb.append(group);
            if (op.getNumResults() > 1) sb.append(':').append(op.getNumResults());
            sb.append(" = ");
        }
        StringAttr.quote(sb, op.getName());
        sb.append('(');
        List<OpOperand> operands = op.getOpOperands();
        for (int i = 0; i < operands.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(nameOf(operands.get(i).get()));
        }
        sb.append(')');
        if (!op.getProperties().isEmpty()) {
            sb.append(" <");
            DictionaryAttr.printEntries(sb, op.getProperties());
            sb.append('>');
        }
        if (op.getNumRegions() != 0) {
            sb.append(" (");
            for (int i = 0; i < op.getNumRegions(); i++) {
                if (i != 0) sb.append(", ");
                printRegion(op.getRegion(i), level);
            }
            sb.append(')');
        }
        if (!op.getAttrs().isEmpty()) {
            sb.append(' ');
            DictionaryAttr.printEntries(sb, op.getAttrs());
        }
        sb.append(" : ").append(new FunctionType(op.getOperandTypes(), op.getResultTypes()));
    }

    private void printRegion(Region region, int level) {
        sb.append("{\n");
        for (Block block : region.getBlocks()) {
            String label = blockLabels.get(block);
            if (label != null) {
                indent(level);
                sb.append(label);
                if (block.getNumArguments() != 0) {
                    sb.append('(');
                    for (BlockArgument arg : block.getArguments()) {
                        if (arg.getIndex() != 0) sb.append(", ");
                        sb.append(nameOf(arg)).append(": ").append(arg.getType());
                    }
                    sb.append(')');
                }
                sb.append(":\n");
            }
            for (Operation op : block.getOperations()) {
                printOp(op, level + 1);
                sb.append('\n');
            }
        }
        indent(level);
        sb.append('}');
    }
}
