package io.github.eutro.irgraph.core.ops;

import io.github.eutro.irgraph.core.attrs.*;
import io.github.eutro.irgraph.core.diag.Diagnostics;
import io.github.eutro.irgraph.core.ir.Operation;
import io.github.eutro.irgraph.core.types.IntegerType;
import io.github.eutro.irgraph.core.types.ShapedType;
import io.github.eutro.irgraph.core.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

public class ArithOps {
    public static final OpKey CONSTANT = new OpKey("arith.constant",
            "Integer or floating point constant")
            .withInherentAttrs("value")
            .withVerifier(ArithOps::verifyConstant);

    public static final OpKey ADDF = floatBinary("arith.addf", "Floating point addition operation");
    public static final OpKey SUBF = floatBinary("arith.subf", "Floating point subtraction operation");
    public static final OpKey MULF = floatBinary("arith.mulf", "Floating point multiplication operation");
    public static final OpKey DIVF = floatBinary("arith.divf", "Floating point division operation");
    public static final OpKey NEGF = new OpKey("arith.negf", "Floating point negation")
            .withInherentAttrs("fastmath")
            .withVerifier((op, diags) -> elementwise(op, 1, true, diags));

    public static final OpKey ADDI = intBinary("arith.addi", "Integer addition operation");
    public static final OpKey SUBI = intBinary("arith.subi", "Integer subtraction operation");
    public static final OpKey MULI = intBinary("arith.muli", "Integer multiplication operation");

    public static final OpKey CMPF = new OpKey("arith.cmpf",
            "Floating-point comparison operation")
            .withInherentAttrs("predicate", "fastmath")
            .withVerifier(ArithOps::verifyCmpf);
    public static final OpKey SELECT = new OpKey("arith.select",
            "Select operation")
            .withVerifier(ArithOps::verifySelect);

    private static OpKey floatBinary(String name, String description) {
        return new OpKey(name, description)
                .withInherentAttrs("fastmath")
                .withVerifier((op, diags) -> elementwise(op, 2, true, diags));
    }

    private static OpKey intBinary(String name, String description) {
        return new OpKey(name, description)
                .withInherentAttrs("overflowFlags")
                .withVerifier((op, diags) -> elementwise(op, 2, false, diags));
    }

    private static void elementwise(Operation op, int arity, boolean isFloat, Diagnostics diags) {
        if (!Verifiers.shape(op, arity, 1, 0, diags)) return;
        if (!Verifiers.allSameType(op, diags)) return;
        Type type = op.getResult(0).getType();
        if (isFloat ? !type.isFloatLike() : !type.isIntegerLike()) {
            diags.error(op, "operand #0 must be %s-like, but got '%s'", isFloat ? "floating-point" : "signless-integer", type);
        }
    }

    private static void verifyConstant(Operation op, Diagnostics diags) {
        if (!Verifiers.shape(op, 0, 1, 0, diags)) return;
        Attribute value = op.getAttribute("value");
        if (value == null) {
            diags.error(op, "requires attribute 'value'");
            return;
        }
        Type valueType = typeOf(value);
        if (valueType == null) {
            diags.error(op, "value must be an integer, float or elements attribute, but got %s", value.kind());
            return;
        }
        Type resultType = op.getResult(0).getType();
        if (!valueType.equals(resultType)) {
            diags.error(op, "value type (%s) does not match result type (%s)", valueType, resultType);
        }
    }

    private static @Nullable Type typeOf(Attribute attr) {
        if (attr instanceof IntegerAttr) return ((IntegerAttr) attr).type;
        if (attr instanceof FloatAttr) return ((FloatAttr) attr).type;
        if (attr instanceof BoolAttr) return IntegerType.I1;
        if (attr instanceof DenseElementsAttr) return ((DenseElementsAttr) attr).type;
        return null;
    }

    private static void verifyCmpf(Operation op, Diagnostics diags) {
        if (!Verifiers.shape(op, 2, 1, 0, diags)) return;
        Verifiers.requireAttr(op, "predicate", IntegerAttr.class, diags);
        Type lhs = op.getOperand(0).getType();
        if (!lhs.equals(op.getOperand(1).getType())) {
            diags.error(op, "requires all operands to have the same type");
            return;
        }
        if (!lhs.isFloatLike()) {
            diags.error(op, "operand #0 must be floating-point-like, but got '%s'", lhs);
            return;
        }
        Type result = op.getResult(0).getType();
        if (!boolLike(result, lhs)) {
            diags.error(op, "result #0 must be bool-like of the operand shape, but got '%s'", result);
        }
    }

    private static boolean boolLike(Type result, Type operand) {
        if (operand instanceof ShapedType) {
            if (!(result instanceof ShapedType)) return false;
            ShapedType rs = (ShapedType) result;
            ShapedType os = (ShapedType) operand;
            return rs.kind == os.kind
                    && Arrays.equals(rs.getShape(), os.getShape())
                    && rs.elementType.equals(IntegerType.I1);
        }
        return result.equals(IntegerType.I1);
    }

    private static void verifySelect(Operation op, Diagnostics diags) {
        if (!Verifiers.shape(op, 3, 1, 0, diags)) return;
        Type cond = op.getOperand(0).getType();
        if (!cond.equals(IntegerType.I1)) {
            diags.error(op, "operand #0 must be bool-like, but got '%s'", cond);
        }
        Type result = op.getResult(0).getType();
        if (!op.getOperand(1).getType().equals(result) || !op.getOperand(2).getType().equals(result)) {
            diags.error(op, "requires the true and false values to have the result type '%s'", result);
        }
    }
}
