package io.github.eutro.irgraph.core.ops;

import io.github.eutro.irgraph.core.attrs.Attribute;
import io.github.eutro.irgraph.core.diag.Diagnostics;
import io.github.eutro.irgraph.core.ir.Operation;
import io.github.eutro.irgraph.core.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Checks shared by the operation verifiers. Each returns whether the check passed,
 * so verifiers can stop before looking at operands that are not there.
 */
final class Verifiers {
    private Verifiers() {
    }

    static boolean operandCount(Operation op, int expected, Diagnostics diags) {
        if (op.getNumOperands() != expected) {
            diags.error(op, "expected %d operands, but found %d", expected, op.getNumOperands());
            return false;
        }
        return true;
    }

    static boolean resultCount(Operation op, int expected, Diagnostics diags) {
        if (op.getNumResults() != expected) {
            diags.error(op, "requires %d results, but found %d", expected, op.getNumResults());
            return false;
        }
        return true;
    }

    static boolean regionCount(Operation op, int expected, Diagnostics diags) {
        if (op.getNumRegions() != expected) {
            diags.error(op, "requires %d regions, but found %d", expected, op.getNumRegions());
            return false;
        }
        return true;
    }

    static boolean shape(Operation op, int operands, int results, int regions, Diagnostics diags) {
        return operandCount(op, operands, diags)
                & resultCount(op, results, diags)
                & regionCount(op, regions, diags);
    }

    static <T extends Attribute> @Nullable T requireAttr(Operation op, String name, Class<T> kind, Diagnostics diags) {
        Attribute attr = op.getAttribute(name);
        if (attr == null) {
            diags.error(op, "requires attribute '%s'", name);
            return null;
        }
        if (!kind.isInstance(attr)) {
            diags.error(op, "attribute '%s' failed to satisfy constraint: expected %s attribute, but got %s",
                    name, kindName(kind), attr.kind());
            return null;
        }
        return kind.cast(attr);
    }

    private static String kindName(Class<?> kind) {
        String simple = kind.getSimpleName();
        return simple.endsWith("Attr") ? simple.substring(0, simple.length() - 4) : simple;
    }

    static boolean allSameType(Operation op, Diagnostics diags) {
        Type first = null;
        for (Type type : op.getOperandTypes()) {
            if (first == null) first = type;
            else if (!first.equals(type)) {
                diags.error(op, "requires the same type for all operands and results");
                return false;
            }
        }
        for (Type type : op.getResultTypes()) {
            if (first == null) first = type;
            else if (!first.equals(type)) {
                diags.error(op, "requires the same type for all operands and results");
                return false;
            }
        }
        return true;
    }

    static String typeList(List<Type> types) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < types.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(types.get(i));
        }
        return sb.toString();
    }
}
