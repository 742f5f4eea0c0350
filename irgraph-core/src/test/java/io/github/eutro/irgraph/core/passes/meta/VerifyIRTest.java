package io.github.eutro.irgraph.core.passes.meta;

import io.github.eutro.irgraph.core.Utils;
import io.github.eutro.irgraph.core.diag.Diagnostic;
import io.github.eutro.irgraph.core.diag.Diagnostics;
import io.github.eutro.irgraph.core.diag.Severity;
import io.github.eutro.irgraph.core.ir.Operation;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class VerifyIRTest {
    private static String func(String signature, String args, String body) {
        return "" +
                "\"builtin.module\"() ({\n" +
                "  \"func.func\"() <{function_type = " + signature + ", sym_name = \"f\"}> ({\n" +
                "  ^bb0(" + args + "):\n" +
                body +
                "  }) : () -> ()\n" +
                "}) : () -> ()\n";
    }

    private static List<String> errors(String text) {
        return errors(Utils.parse(text));
    }

    private static List<String> errors(Operation module) {
        Diagnostics diags = VerifyIR.INSTANCE.run(module);
        return diags.getDiagnostics().stream()
                .filter(d -> d.severity == Severity.ERROR)
                .map(d -> d.message)
                .collect(Collectors.toList());
    }

    @Test
    void testValidModule() throws Throwable {
        assertEquals(Collections.emptyList(), errors(Utils.getResourceText("/roundtrip/functions.mlir")));
        assertEquals(Collections.emptyList(), errors(Utils.getResourceText("/roundtrip/regions.mlir")));
        assertEquals(Collections.emptyList(), errors(func("(f32, f32) -> f32", "%a: f32, %b: f32", "" +
                "    %0 = \"arith.addf\"(%a, %b) : (f32, f32) -> f32\n" +
                "    \"func.return\"(%0) : (f32) -> ()\n")));
    }

    @Test
    void testReturnArityMismatch() {
        List<String> errors = errors(func("(f32) -> f32", "%a: f32", "" +
                "    \"func.return\"() : () -> ()\n"));
        assertEquals(Collections.singletonList("'func.return' op has 0 operands, but enclosing function (@f) returns 1"), errors);
    }

    @Test
    void testReturnTypeMismatch() {
        List<String> errors = errors(func("(i32) -> f32", "%a: i32", "" +
                "    \"func.return\"(%a) : (i32) -> ()\n"));
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).contains("type of return operand 0 (i32) doesn't match function result type (f32)"),
                errors.get(0));
    }

    @Test
    void testUseBeforeDefinition() {
        List<String> errors = errors(func("(f32) -> f32", "%a: f32", "" +
                "    %0 = \"arith.addf\"(%1, %a) : (f32, f32) -> f32\n" +
                "    %1 = \"arith.mulf\"(%a, %a) : (f32, f32) -> f32\n" +
                "    \"func.return\"(%0) : (f32) -> ()\n"));
        assertEquals(Collections.singletonList("'arith.addf' op operand #0 does not dominate this use"), errors);
    }

    @Test
    void testTerminatorMustBeLast() {
        List<String> errors = errors(func("(f32) -> f32", "%a: f32", "" +
                "    \"func.return\"(%a) : (f32) -> ()\n" +
                "    \"test.after\"() : () -> ()\n"));
        assertEquals(Arrays.asList(
                "'func.return' op must be the last operation in the parent block",
                "'func.func' op block with no terminator, has 'test.after'"
        ), errors);
    }

    @Test
    void testFunctionBodyNeedsTerminator() {
        List<String> errors = errors(func("(f32) -> f32", "%a: f32", "" +
                "    %0 = \"arith.negf\"(%a) : (f32) -> f32\n"));
        assertEquals(Collections.singletonList("'func.func' op block with no terminator, has 'arith.negf'"), errors);

        Operation module = Utils.parse(func("(f32) -> ()", "%a: f32", "" +
                "    \"func.return\"() : () -> ()\n"));
        assertEquals(Collections.emptyList(), errors(module));
        Utils.findOne(module, "func.return").erase();
        assertEquals(Collections.singletonList("'func.func' op empty block: expect at least a terminator"), errors(module));
    }

    @Test
    void testExternalFunctionHasNoBody() {
        assertEquals(Collections.emptyList(), errors("" +
                "\"func.func\"() <{function_type = (f32) -> f32, sym_name = \"ext\", sym_visibility = \"private\"}> ({\n" +
                "}) : () -> ()\n"));
    }

    @Test
    void testEntryArgumentsMustMatchSignature() {
        List<String> errors = errors(func("(f32) -> ()", "%a: i32", "" +
                "    \"func.return\"() : () -> ()\n"));
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("'func.func' op type of entry block argument #0(i32)"), errors.get(0));
    }

    @Test
    void testElementwiseTypes() {
        List<String> errors = errors(func("(f32, i32) -> f32", "%a: f32, %b: i32", "" +
                "    %0 = \"arith.addf\"(%a, %b) : (f32, i32) -> f32\n" +
                "    \"func.return\"(%0) : (f32) -> ()\n"));
        assertEquals(Collections.singletonList("'arith.addf' op requires the same type for all operands and results"), errors);
    }

    @Test
    void testIsolatedFromAbove() {
        Operation module = Utils.parse("" +
                "%0 = \"test.def\"() : () -> f32\n" +
                "\"func.func\"() <{function_type = (f32) -> f32, sym_name = \"f\"}> ({\n" +
                "^bb0(%a: f32):\n" +
                "  \"func.return\"(%a) : (f32) -> ()\n" +
                "}) : () -> ()\n");
        assertEquals(Collections.emptyList(), errors(module));
        Operation ret = Utils.findOne(module, "func.return");
        ret.setOperand(0, Utils.findOne(module, "test.def").getResult(0));
        assertEquals(Collections.singletonList("'func.return' op using value defined outside the region"), errors(module));
    }

    @Test
    void testUnregisteredOperationsAreOnlyCheckedStructurally() {
        Diagnostics diags = VerifyIR.INSTANCE.run(Utils.parse("" +
                "%0:2 = \"mydialect.pair\"() {anything = 1 : i32} : () -> (i8, f32)\n" +
                "\"mydialect.sink\"(%0#1, %0#0, %0#0) : (f32, i8, i8) -> ()\n"));
        assertTrue(diags.isEmpty());
        assertFalse(diags.hasErrors());
    }

    @Test
    void testDiagnosticFormat() {
        Diagnostics diags = VerifyIR.INSTANCE.run(Utils.parse(func("(f32) -> f32", "%a: f32", "" +
                "    \"func.return\"() : () -> ()\n")));
        Diagnostic diagnostic = diags.getDiagnostics().get(0);
        assertEquals("func.return", diagnostic.opName);
        assertEquals("ERROR: 'func.return' op has 0 operands, but enclosing function (@f) returns 1", diagnostic.format());
    }
}
