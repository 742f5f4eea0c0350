package io.github.eutro.irgraph.core.ir;

import io.github.eutro.irgraph.core.Utils;
import io.github.eutro.irgraph.core.attrs.StringAttr;
import io.github.eutro.irgraph.core.ext.CommonExts;
import io.github.eutro.irgraph.core.ops.ArithOps;
import io.github.eutro.irgraph.core.types.FloatType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class OperationTest {
    private static final String CHAIN = "" +
            "\"test.graph\"() ({\n" +
            "  %0 = \"test.a\"() : () -> f32\n" +
            "  %1 = \"test.b\"(%0) : (f32) -> f32\n" +
            "  %2 = \"test.c\"(%1, %0) : (f32, f32) -> f32\n" +
            "  \"test.sink\"(%2) : (f32) -> ()\n" +
            "}) : () -> ()\n";

    private static Block body(Operation module) {
        return Utils.findOne(module, "test.graph").getRegion(0).getBlocks().get(0);
    }

    @Test
    void testSetOperandUpdatesUses() {
        Operation module = Utils.parse(CHAIN);
        Operation a = Utils.findOne(module, "test.a");
        Operation b = Utils.findOne(module, "test.b");
        Operation c = Utils.findOne(module, "test.c");
        assertEquals(2, a.getResult(0).getUses().size());

        c.setOperand(1, b.getResult(0));
        assertEquals(1, a.getResult(0).getUses().size());
        assertEquals(2, b.getResult(0).getUses().size());
        assertSame(b.getResult(0), c.getOperand(1));
        assertSame(c, c.getOpOperand(1).getOwner());
        assertEquals(1, c.getOpOperand(1).getIndex());
    }

    @Test
    void testReplaceAllUsesWith() {
        Operation module = Utils.parse(CHAIN);
        Operation a = Utils.findOne(module, "test.a");
        Operation b = Utils.findOne(module, "test.b");
        Operation c = Utils.findOne(module, "test.c");

        a.getResult(0).replaceAllUsesWith(b.getResult(0));
        assertFalse(a.getResult(0).hasUses());
        // b now uses itself, which is still a use
        assertSame(b.getResult(0), b.getOperand(0));
        assertSame(b.getResult(0), c.getOperand(1));
        assertEquals(3, b.getResult(0).getUses().size());
    }

    @Test
    void testEraseWithUsesThrows() {
        Operation module = Utils.parse(CHAIN);
        Operation b = Utils.findOne(module, "test.b");
        IRException e = assertThrows(IRException.class, b::erase);
        assertTrue(e.getMessage().startsWith("cannot erase 'test.b'"), e.getMessage());
        assertSame(body(module), b.getBlock());
    }

    @Test
    void testEraseDropsOperands() {
        Operation module = Utils.parse(CHAIN);
        Operation a = Utils.findOne(module, "test.a");
        Operation sink = Utils.findOne(module, "test.sink");
        Operation c = Utils.findOne(module, "test.c");
        sink.erase();
        assertNull(sink.getBlock());
        assertFalse(c.getResult(0).hasUses());
        c.erase();
        assertEquals(1, a.getResult(0).getUses().size());
        assertEquals(2, body(module).getOperations().size());
    }

    @Test
    void testEraseKeepsUsesWithinSubtree() {
        Operation module = Utils.parse("" +
                "\"test.outer\"() ({\n" +
                "  %0 = \"test.def\"() : () -> i32\n" +
                "  \"test.inner\"() ({\n" +
                "    \"test.use\"(%0) : (i32) -> ()\n" +
                "  }) : () -> ()\n" +
                "}) : () -> ()\n");
        Operation outer = Utils.findOne(module, "test.outer");
        Operation def = Utils.findOne(module, "test.def");
        outer.erase();
        assertFalse(def.getResult(0).hasUses());
        assertTrue(module.getRegion(0).getBlocks().get(0).isEmpty());
    }

    @Test
    void testMoveBeforeAndAfter() {
        Operation module = Utils.parse(CHAIN);
        Block block = body(module);
        Operation a = Utils.findOne(module, "test.a");
        Operation b = Utils.findOne(module, "test.b");
        Operation c = Utils.findOne(module, "test.c");
        Operation sink = Utils.findOne(module, "test.sink");

        a.moveAfter(c);
        assertEquals(Arrays.asList(b, c, a, sink), block.getOperations());
        a.moveBefore(b);
        assertEquals(Arrays.asList(a, b, c, sink), block.getOperations());
        a.moveBefore(a);
        assertEquals(0, block.indexOf(a));
        assertSame(block, a.getBlock());
        // moving keeps uses
        assertEquals(2, a.getResult(0).getUses().size());
    }

    @Test
    void testMoveAcrossBlocks() {
        Operation module = Utils.parse("" +
                "\"test.outer\"() ({\n" +
                "  %0 = \"test.def\"() : () -> i32\n" +
                "  \"test.inner\"() ({\n" +
                "    \"test.use\"(%0) : (i32) -> ()\n" +
                "  }) : () -> ()\n" +
                "}) : () -> ()\n");
        Operation inner = Utils.findOne(module, "test.inner");
        Operation def = Utils.findOne(module, "test.def");
        Operation use = Utils.findOne(module, "test.use");
        def.moveBefore(use);
        assertSame(inner.getRegion(0).getBlocks().get(0), def.getBlock());
        assertSame(inner, def.getParentOp());
        assertTrue(inner.isProperAncestorOf(def));
        assertFalse(def.isAncestorOf(inner));
    }

    @Test
    void testOwnersFollowLists() {
        Operation module = Utils.parse(CHAIN);
        Operation b = Utils.findOne(module, "test.b");
        Block block = b.getBlock();
        assertNotNull(block);
        assertSame(block, b.getExtOrThrow(CommonExts.OWNING_BLOCK));
        b.remove();
        assertNull(b.getBlock());
        assertFalse(b.getExt(CommonExts.OWNING_BLOCK).isPresent());
        block.getOperations().add(0, b);
        assertSame(block, b.getBlock());
        assertEquals(0, block.indexOf(b));
    }

    @Test
    void testInsertionPoints() {
        Operation module = Utils.parse("" +
                "\"func.func\"() <{function_type = () -> (), sym_name = \"f\"}> ({\n" +
                "  \"func.return\"() : () -> ()\n" +
                "}) : () -> ()\n");
        Operation ret = Utils.findOne(module, "func.return");
        Block entry = ret.getBlock();
        assertNotNull(entry);
        assertSame(ret, entry.getTerminator());
        assertThrows(IRException.class, () -> InsertionPoint.atEnd(entry));

        Operation first = Operation.create(new OperationState("test.first"), null);
        InsertionPoint.atTerminator(entry).insert(first);
        Operation second = Operation.create(new OperationState("test.second")
                .addAttribute("name", new StringAttr("second")), null);
        InsertionPoint.before(ret).insert(second);
        assertEquals(Arrays.asList(first, second, ret), entry.getOperations());
        assertEquals(new StringAttr("second"), second.getAttr("name"));

        Operation detached = Operation.create(new OperationState("test.detached"), null);
        assertThrows(IRException.class, () -> InsertionPoint.before(detached));
    }

    @Test
    void testCreateRoutesInherentAttributes() {
        Operation module = Utils.parse(CHAIN);
        Operation a = Utils.findOne(module, "test.a");
        Operation add = Operation.create(new OperationState("arith.addf")
                .addOperands(Arrays.asList(a.getResult(0), a.getResult(0)))
                .addResultTypes(Collections.singletonList(FloatType.F32))
                .addAttribute("fastmath", new StringAttr("fast"))
                .addAttribute("note", new StringAttr("x")), ArithOps.ADDF);
        assertTrue(add.isRegistered());
        assertEquals(new StringAttr("fast"), add.getProperty("fastmath"));
        assertNull(add.getAttr("fastmath"));
        assertEquals(new StringAttr("x"), add.getAttribute("note"));
        assertEquals(4, a.getResult(0).getUses().size());
        assertEquals(Arrays.asList(FloatType.F32, FloatType.F32), add.getOperandTypes());
    }

    @Test
    void testBadOperationName() {
        assertThrows(IRException.class, () -> new OperationState("nodialect"));
        assertThrows(IRException.class, () -> new OperationState("dialect."));
    }
}
