package io.github.eutro.irgraph.core.text;

import io.github.eutro.irgraph.core.Utils;
import io.github.eutro.irgraph.core.attrs.StringAttr;
import io.github.eutro.irgraph.core.ir.Block;
import io.github.eutro.irgraph.core.ir.OpResult;
import io.github.eutro.irgraph.core.ir.Operation;
import io.github.eutro.irgraph.core.ops.FuncOps;
import io.github.eutro.irgraph.core.types.FloatType;
import io.github.eutro.irgraph.core.types.FunctionType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IRParserTest {
    private static final String ADD_MUL = "" +
            "\"builtin.module\"() ({\n" +
            "  \"func.func\"() <{function_type = (f32, f32) -> f32, sym_name = \"add_mul\"}> ({\n" +
            "  ^bb0(%arg0: f32, %arg1: f32):\n" +
            "    %0 = \"arith.addf\"(%arg0, %arg1) : (f32, f32) -> f32\n" +
            "    %1 = \"arith.mulf\"(%0, %arg1) : (f32, f32) -> f32\n" +
            "    \"func.return\"(%1) : (f32) -> ()\n" +
            "  }) : () -> ()\n" +
            "}) : () -> ()\n";

    @Test
    void testParsesStructure() {
        Operation module = Utils.parse(ADD_MUL);
        assertEquals("builtin.module", module.getName());
        assertNull(module.getBlock());

        Operation func = Utils.findOne(module, "func.func");
        assertEquals("add_mul", FuncOps.getSymName(func));
        FunctionType type = FuncOps.getFunctionType(func);
        assertNotNull(type);
        assertEquals(FloatType.F32, type.results.get(0));
        // inherent attributes are properties
        assertTrue(func.getAttrs().isEmpty());

        Block entry = func.getRegion(0).getEntryBlock();
        assertNotNull(entry);
        assertEquals(2, entry.getNumArguments());
        assertEquals(3, entry.getOperations().size());

        Operation add = entry.getOperations().get(0);
        Operation mul = entry.getOperations().get(1);
        assertSame(entry.getArgument(0), add.getOperand(0));
        assertSame(add.getResult(0), mul.getOperand(0));
        assertSame(entry.getArgument(1), mul.getOperand(1));
        assertEquals(1, add.getResult(0).getUses().size());
        assertEquals(2, entry.getArgument(1).getUses().size());
        assertTrue(entry.getTerminator() != null && entry.getTerminator().isTerminator());
    }

    @Test
    void testWrapsTopLevelOperationsInModule() {
        Operation module = Utils.parse("" +
                "%0 = \"test.a\"() : () -> i32\n" +
                "\"test.b\"(%0) {name = \"b\"} : (i32) -> ()\n");
        assertEquals("builtin.module", module.getName());
        Block body = module.getRegion(0).getEntryBlock();
        assertNotNull(body);
        assertEquals(2, body.getOperations().size());
        Operation b = body.getOperations().get(1);
        assertFalse(b.isRegistered());
        assertEquals(new StringAttr("b"), b.getAttr("name"));
    }

    @Test
    void testForwardReferencesResolve() {
        Operation module = Utils.parse("" +
                "\"test.graph\"() ({\n" +
                "  \"test.use\"(%later) : (i32) -> ()\n" +
                "  %later = \"test.def\"() : () -> i32\n" +
                "}) : () -> ()\n");
        Operation use = Utils.findOne(module, "test.use");
        Operation def = Utils.findOne(module, "test.def");
        assertSame(def.getResult(0), use.getOperand(0));
        assertEquals(1, def.getResult(0).getUses().size());
    }

    @Test
    void testMultipleResults() {
        Operation module = Utils.parse("" +
                "%p:2 = \"test.pair\"() : () -> (i32, f32)\n" +
                "\"test.use\"(%p#1, %p#0) : (f32, i32) -> ()\n");
        Operation pair = Utils.findOne(module, "test.pair");
        Operation use = Utils.findOne(module, "test.use");
        assertEquals(1, ((OpResult) use.getOperand(0)).getIndex());
        assertSame(pair.getResult(0), use.getOperand(1));
    }

    @Test
    void testUndeclaredValue() {
        IRParseException e = assertThrows(IRParseException.class, () -> Utils.parse(
                "\"test.use\"(%missing) : (i32) -> ()\n"));
        assertTrue(e.getMessage().contains("use of undeclared SSA value name '%missing'"), e.getMessage());
        assertEquals(1, e.line);
        assertEquals(12, e.column);
    }

    @Test
    void testValuesDoNotCrossIsolatedOperations() {
        assertThrows(IRParseException.class, () -> Utils.parse("" +
                "%0 = \"test.def\"() : () -> i32\n" +
                "\"func.func\"() <{sym_name = \"f\", function_type = () -> ()}> ({\n" +
                "  \"test.use\"(%0) : (i32) -> ()\n" +
                "  \"func.return\"() : () -> ()\n" +
                "}) : () -> ()\n"));
    }

    @Test
    void testRedefinition() {
        IRParseException e = assertThrows(IRParseException.class, () -> Utils.parse("" +
                "%0 = \"test.a\"() : () -> i32\n" +
                "%0 = \"test.b\"() : () -> i32\n"));
        assertTrue(e.getMessage().contains("redefinition of SSA value '%0'"), e.getMessage());
        assertEquals(2, e.line);
    }

    @Test
    void testTypeMismatchBetweenUses() {
        IRParseException e = assertThrows(IRParseException.class, () -> Utils.parse("" +
                "%0 = \"test.a\"() : () -> i32\n" +
                "\"test.use\"(%0) : (f32) -> ()\n"));
        assertTrue(e.getMessage().contains("expects different type than prior uses"), e.getMessage());
    }

    @Test
    void testCustomFormRejected() {
        IRParseException e = assertThrows(IRParseException.class, () -> Utils.parse(
                "%0 = arith.constant 1 : i32\n"));
        assertTrue(e.getMessage().contains("only the generic operation form is supported"), e.getMessage());
    }

    @Test
    void testSuccessorsRejected() {
        IRParseException e = assertThrows(IRParseException.class, () -> Utils.parse(
                "\"test.br\"() [^bb1] : () -> ()\n"));
        assertTrue(e.getMessage().contains("successor lists are not supported"), e.getMessage());
    }

    @Test
    void testResultCountMustMatchType() {
        IRParseException e = assertThrows(IRParseException.class, () -> Utils.parse(
                "%0:2 = \"test.a\"() : () -> i32\n"));
        assertTrue(e.getMessage().contains("operation defines 1 results but was provided 2 to bind"), e.getMessage());
    }

    @Test
    void testOperandTypeCountMustMatch() {
        assertThrows(IRParseException.class, () -> Utils.parse("" +
                "%0 = \"test.a\"() : () -> i32\n" +
                "\"test.use\"(%0) : () -> ()\n"));
    }

    @Test
    void testOperationNameNeedsDialect() {
        assertThrows(IRParseException.class, () -> Utils.parse("\"nodialect\"() : () -> ()\n"));
    }
}
