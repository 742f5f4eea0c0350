package io.github.eutro.irgraph.edit;

import io.github.eutro.irgraph.edit.graph.Graph;
import io.github.eutro.irgraph.edit.graph.OperationInfo;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class OperandEditTest {
    @Test
    void testSetOperand() throws Throwable {
        Utils.Loaded loaded = Utils.load("/simple.mlir");
        Graph graph = loaded.editor.setOperand(loaded.session, "op_3", 0, "val_0");
        assertEquals(Arrays.asList("val_0", "val_1"), graph.getOperation("op_3").operands);
        assertTrue(graph.edgesFrom("val_2").isEmpty());
        assertEquals(loaded.text.replace("\"arith.mulf\"(%0, %arg1)", "\"arith.mulf\"(%arg0, %arg1)"), loaded.print());
        assertTrue(loaded.verifies());
    }

    @Test
    void testSetOperandOutOfRange() throws Throwable {
        Utils.Loaded loaded = Utils.load("/simple.mlir");
        OutOfRangeException e = assertThrows(OutOfRangeException.class,
                () -> loaded.editor.setOperand(loaded.session, "op_3", 5, "val_0"));
        assertEquals("operand index 5 out of range [0, 2)", e.getMessage());
        assertThrows(OutOfRangeException.class, () -> loaded.editor.setOperand(loaded.session, "op_3", -1, "val_0"));
        assertThrows(NotFoundException.class, () -> loaded.editor.setOperand(loaded.session, "op_3", 0, "val_42"));
        assertFalse(loaded.session.getHistory().canUndo());
    }

    @Test
    void testSetOperandReordersProducerFirst() throws Throwable {
        Utils.Loaded loaded = Utils.load("/reorder.mlir");
        // negf (op_2) now uses mulf (op_3), which comes after it
        Graph graph = loaded.editor.setOperand(loaded.session, "op_2", 0, "val_2");
        assertEquals("arith.mulf", graph.getOperation("op_2").name);
        OperationInfo neg = graph.getOperation("op_3");
        assertEquals("arith.negf", neg.name);
        assertEquals(Collections.singletonList("val_1"), neg.operands);
        assertTrue(loaded.print().contains("" +
                "    %0 = \"arith.mulf\"(%arg0, %arg0) : (f32, f32) -> f32\n" +
                "    %1 = \"arith.negf\"(%0) : (f32) -> f32\n" +
                "    \"func.return\"(%0) : (f32) -> ()\n"));
        assertTrue(loaded.verifies());
    }

    @Test
    void testNestedUseMovesEnclosingProducerFirst() throws Throwable {
        Utils.Loaded loaded = Utils.load("/nested.mlir");
        Graph created = loaded.editor.createOperation(loaded.session, "arith.negf",
                Collections.singletonList("f32"), Collections.singletonList("val_1"),
                Collections.emptyMap(), "block_1", 1);
        OperationInfo neg = created.findOperation("arith.negf");
        assertEquals(1, neg.position);
        String negResult = neg.results.get(0);

        // the then-branch yield (op_4) now uses negf, which comes after the enclosing scf.if
        Graph graph = loaded.editor.setOperand(loaded.session, "op_4", 0, negResult);
        assertEquals("arith.negf", graph.getOperation("op_2").name);
        assertEquals("scf.if", graph.getOperation("op_3").name);
        String printed = loaded.print();
        assertTrue(printed.contains("" +
                "    %0 = \"arith.negf\"(%arg1) : (f32) -> f32\n" +
                "    %1 = \"scf.if\"(%arg0) ({\n"), printed);
        assertTrue(loaded.verifies());

        loaded.editor.undo(loaded.session);
        assertEquals("scf.if", loaded.session.getGraph().getOperation("op_2").name);
    }

    @Test
    void testSetReturnOperandUpdatesSignature() throws Throwable {
        Utils.Loaded loaded = Utils.load("/nested.mlir");
        loaded.editor.setOperand(loaded.session, "op_7", 0, "val_0");
        String printed = loaded.print();
        assertTrue(printed.contains("function_type = (i1, f32, f32) -> i1"), printed);
        assertTrue(printed.contains("\"func.return\"(%arg0) : (i1) -> ()"), printed);
        assertTrue(loaded.verifies());
    }

    @Test
    void testRemoveOperand() throws Throwable {
        Utils.Loaded loaded = Utils.load("/simple.mlir");
        Graph graph = loaded.editor.removeOperand(loaded.session, "op_3", 1);
        assertEquals(Collections.singletonList("val_2"), graph.getOperation("op_3").operands);
        assertTrue(loaded.print().contains("%1 = \"arith.mulf\"(%0) : (f32) -> f32\n"));
        assertFalse(loaded.verifies());

        OutOfRangeException e = assertThrows(OutOfRangeException.class,
                () -> loaded.editor.removeOperand(loaded.session, "op_3", 1));
        assertEquals(1, e.size);
        assertEquals(1, loaded.session.getHistory().getUndoDepth());
    }

    @Test
    void testRemoveReturnOperandUpdatesSignature() throws Throwable {
        Utils.Loaded loaded = Utils.load("/simple.mlir");
        Graph graph = loaded.editor.removeOperand(loaded.session, "op_4", 0);
        assertTrue(graph.getOperation("op_4").operands.isEmpty());
        assertTrue(loaded.print().contains("function_type = (f32, f32) -> ()"));
        assertTrue(loaded.verifies());
    }

    @Test
    void testAddOperandAppends() throws Throwable {
        Utils.Loaded loaded = Utils.load("/simple.mlir");
        Graph graph = loaded.editor.addOperand(loaded.session, "op_4", "val_2", null);
        assertEquals(Arrays.asList("val_3", "val_2"), graph.getOperation("op_4").operands);
        String printed = loaded.print();
        assertTrue(printed.contains("function_type = (f32, f32) -> (f32, f32)"), printed);
        assertTrue(printed.contains("\"func.return\"(%1, %0) : (f32, f32) -> ()"), printed);
        assertTrue(loaded.verifies());
    }

    @Test
    void testAddOperandAtPosition() throws Throwable {
        Utils.Loaded loaded = Utils.load("/simple.mlir");
        Graph graph = loaded.editor.addOperand(loaded.session, "op_3", "val_0", 0);
        assertEquals(Arrays.asList("val_0", "val_2", "val_1"), graph.getOperation("op_3").operands);
        // uses of the recreated operation follow it
        assertEquals(Collections.singletonList("val_3"), graph.getOperation("op_4").operands);

        OutOfRangeException e = assertThrows(OutOfRangeException.class,
                () -> loaded.editor.addOperand(loaded.session, "op_3", "val_0", 5));
        assertEquals("operand position index 5 out of range [0, 4)", e.getMessage());
    }

    @Test
    void testAddOperandReorders() throws Throwable {
        Utils.Loaded loaded = Utils.load("/reorder.mlir");
        Graph graph = loaded.editor.addOperand(loaded.session, "op_2", "val_2", null);
        assertEquals("arith.mulf", graph.getOperation("op_2").name);
        OperationInfo neg = graph.getOperation("op_3");
        assertEquals("arith.negf", neg.name);
        assertEquals(Arrays.asList("val_0", "val_1"), neg.operands);
    }

    @Test
    void testUndoRedoAreInverse() throws Throwable {
        Utils.Loaded loaded = Utils.load("/simple.mlir");
        loaded.editor.setOperand(loaded.session, "op_3", 0, "val_0");
        String first = loaded.print();
        loaded.editor.removeOperand(loaded.session, "op_4", 0);
        String second = loaded.print();

        loaded.editor.undo(loaded.session);
        assertEquals(first, loaded.print());
        loaded.editor.undo(loaded.session);
        assertEquals(loaded.text, loaded.print());
        loaded.editor.redo(loaded.session);
        assertEquals(first, loaded.print());
        loaded.editor.redo(loaded.session);
        assertEquals(second, loaded.print());
        assertFalse(loaded.session.getHistory().canRedo());
    }
}
