package io.github.eutro.irgraph.core.backend;

import io.github.eutro.irgraph.core.Utils;
import io.github.eutro.irgraph.core.attrs.IntegerAttr;
import io.github.eutro.irgraph.core.attrs.StringAttr;
import io.github.eutro.irgraph.core.attrs.UnitAttr;
import io.github.eutro.irgraph.core.ir.*;
import io.github.eutro.irgraph.core.text.IRParseException;
import io.github.eutro.irgraph.core.types.FloatType;
import io.github.eutro.irgraph.core.types.IntegerType;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultBackendTest {
    private final IRBackend backend = new DefaultBackend();

    @Test
    void testParsePrintVerify() throws Throwable {
        String text = Utils.getResourceText("/roundtrip/functions.mlir");
        Operation module = backend.parse(text);
        assertEquals(text, backend.print(module));
        VerificationResult result = backend.verify(module);
        assertTrue(result.valid);
        assertTrue(result.diagnostics.isEmpty());

        assertThrows(IRParseException.class, () -> backend.parse("\"func.func\"("));
        assertEquals(IntegerType.I32, backend.parseType("i32"));
        assertEquals(IntegerAttr.of(3, IntegerType.I32), backend.parseAttribute("3 : i32"));
    }

    @Test
    void testInvalidModuleVerifiesInvalid() {
        Operation module = backend.parse("" +
                "\"func.func\"() <{function_type = () -> f32, sym_name = \"f\"}> ({\n" +
                "  \"func.return\"() : () -> ()\n" +
                "}) : () -> ()\n");
        VerificationResult result = backend.verify(module);
        assertFalse(result.valid);
        assertEquals(1, result.diagnostics.size());
    }

    @Test
    void testSetAttributeRouting() throws Throwable {
        Operation module = backend.parse(Utils.getResourceText("/roundtrip/functions.mlir"));
        Operation func = Utils.findAll(module, "func.func").get(0);
        Operation mul = Utils.findOne(module, "arith.mulf");

        backend.setAttribute(func, "sym_name", new StringAttr("renamed"));
        assertEquals(new StringAttr("renamed"), func.getProperty("sym_name"));
        assertNull(func.getAttr("sym_name"));

        // inherent but not yet present
        backend.setAttribute(mul, "fastmath", new StringAttr("fast"));
        assertEquals(new StringAttr("fast"), mul.getProperty("fastmath"));

        backend.setAttribute(mul, "note", UnitAttr.INSTANCE);
        assertSame(UnitAttr.INSTANCE, mul.getAttr("note"));
        assertNull(mul.getProperty("note"));

        // unregistered operations keep properties they were parsed with
        Operation custom = backend.parse("\"test.op\"() <{p = 1 : i32}> : () -> ()\n");
        Operation op = Utils.findOne(custom, "test.op");
        backend.setAttribute(op, "p", IntegerAttr.of(2, IntegerType.I32));
        assertEquals(IntegerAttr.of(2, IntegerType.I32), op.getProperty("p"));
        assertTrue(op.getAttrs().isEmpty());
    }

    @Test
    void testRemoveAttribute() {
        Operation module = backend.parse("\"test.op\"() <{p = 1 : i32}> {a = \"x\"} : () -> ()\n");
        Operation op = Utils.findOne(module, "test.op");
        assertTrue(backend.removeAttribute(op, "p"));
        assertTrue(backend.removeAttribute(op, "a"));
        assertFalse(backend.removeAttribute(op, "a"));
        assertTrue(op.getProperties().isEmpty());
        assertTrue(op.getAttrs().isEmpty());
    }

    @Test
    void testCreateAndErase() throws Throwable {
        Operation module = backend.parse(Utils.getResourceText("/roundtrip/functions.mlir"));
        Operation mul = Utils.findOne(module, "arith.mulf");
        Block entry = backend.getParentBlock(mul);
        assertNotNull(entry);
        assertTrue(backend.isRegisteredOperation("arith.mulf"));
        assertFalse(backend.isRegisteredOperation("mydialect.scale"));

        OperationState state = new OperationState("arith.negf")
                .addOperands(Collections.singletonList(backend.getOperand(mul, 0)))
                .addResultTypes(Collections.singletonList(FloatType.F32))
                .addAttribute("fastmath", new StringAttr("fast"));
        Operation neg = backend.createOperation(state, InsertionPoint.atTerminator(entry));
        assertTrue(neg.isRegistered());
        assertEquals(new StringAttr("fast"), neg.getProperty("fastmath"));
        assertEquals(entry.getOperations().size() - 2, entry.indexOf(neg));
        assertTrue(backend.isSameBlock(entry, backend.getParentBlock(neg)));
        assertTrue(backend.isSameOperation(Utils.findAll(module, "func.func").get(0), backend.getParentOperation(neg)));

        backend.setOperand(neg, 0, mul.getResult(0));
        assertTrue(backend.isSameValue(mul.getResult(0), backend.getOperand(neg, 0)));
        assertThrows(IRException.class, () -> backend.erase(mul));

        backend.erase(neg);
        assertNull(backend.getParentBlock(neg));
        Operation ret = entry.getTerminator();
        assertNotNull(ret);
        backend.moveBefore(mul, ret);
        backend.moveAfter(ret, mul);
        assertSame(ret, entry.getTerminator());
    }

    @Test
    void testMoveBlocks() {
        Operation module = backend.parse("" +
                "\"test.from\"() ({\n" +
                "  \"test.a\"() : () -> ()\n" +
                "}, {\n" +
                "}) : () -> ()\n");
        Operation from = Utils.findOne(module, "test.from");
        Block moved = from.getRegion(0).getEntryBlock();
        assertNotNull(moved);
        backend.moveBlocks(from.getRegion(0), from.getRegion(1));
        assertTrue(from.getRegion(0).isEmpty());
        assertSame(moved, from.getRegion(1).getEntryBlock());
        assertSame(from, backend.getParentOperation(moved));
    }
}
