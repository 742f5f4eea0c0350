package io.github.eutro.irgraph.edit;

import io.github.eutro.irgraph.edit.graph.BlockInfo;
import io.github.eutro.irgraph.edit.graph.Graph;
import io.github.eutro.irgraph.edit.graph.OperationInfo;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class DeleteOperationTest {
    private static final String EMPTY_ADD_MUL = "" +
            "\"builtin.module\"() ({\n" +
            "  \"func.func\"() <{function_type = (f32, f32) -> f32, sym_name = \"add_mul\"}> ({\n" +
            "  ^bb0(%arg0: f32, %arg1: f32):\n" +
            "  }) : () -> ()\n" +
            "}) : () -> ()\n";

    @Test
    void testCascadeDeletesTransitiveUsers() throws Throwable {
        Utils.Loaded loaded = Utils.load("/simple.mlir");
        // addf -> mulf -> return
        Graph graph = loaded.editor.deleteOperation(loaded.session, "op_2");
        assertEquals(1, graph.operations.size());
        assertEquals("func.func", graph.operations.get(0).name);
        BlockInfo entry = graph.getBlock("block_1");
        assertNotNull(entry);
        assertTrue(entry.operations.isEmpty());
        assertEquals(2, entry.arguments.size());
        assertTrue(graph.edges.isEmpty());
        assertEquals(EMPTY_ADD_MUL, loaded.print());
    }

    @Test
    void testCascadeStopsAtUnusedResults() throws Throwable {
        Utils.Loaded loaded = Utils.load("/multi_func.mlir");
        // the call and the return using it go, the callee stays
        Graph graph = loaded.editor.deleteOperation(loaded.session, "op_5");
        assertEquals(0, graph.findOperations("func.call").size());
        assertEquals(1, graph.findOperations("func.return").size());
        assertEquals(1, graph.findOperations("arith.mulf").size());
        assertEquals(2, graph.findOperations("func.func").size());
    }

    @Test
    void testCascadeDeletesNestedRegions() throws Throwable {
        Utils.Loaded loaded = Utils.load("/nested.mlir");
        Graph graph = loaded.editor.deleteOperation(loaded.session, "op_2");
        assertEquals(1, graph.operations.size());
        assertEquals(2, graph.regions.size());
        assertEquals(3, graph.values.size());
    }

    @Test
    void testDeleteOperationWithoutResults() throws Throwable {
        Utils.Loaded loaded = Utils.load("/nested.mlir");
        Graph graph = loaded.editor.deleteOperation(loaded.session, "op_6");
        assertEquals(1, graph.findOperations("scf.yield").size());
        assertEquals(6, graph.operations.size());
        assertFalse(loaded.verifies());
    }

    @Test
    void testSingleDeleteDropsOperandsOfUsers() throws Throwable {
        Utils.Loaded loaded = Utils.load("/simple.mlir");
        Graph graph = loaded.editor.deleteOperationSingle(loaded.session, "op_2");
        assertEquals(0, graph.findOperations("arith.addf").size());
        OperationInfo mul = graph.findOperation("arith.mulf");
        assertEquals("op_2", mul.id);
        assertEquals(Collections.singletonList("val_1"), mul.operands);
        assertEquals(Collections.singletonList("val_2"), graph.findOperation("func.return").operands);
        assertEquals(loaded.text
                .replace("    %0 = \"arith.addf\"(%arg0, %arg1) : (f32, f32) -> f32\n", "")
                .replace("%1 = \"arith.mulf\"(%0, %arg1) : (f32, f32) -> f32", "%0 = \"arith.mulf\"(%arg1) : (f32) -> f32")
                .replace("\"func.return\"(%1)", "\"func.return\"(%0)"), loaded.print());
        // mulf now has the wrong number of operands
        assertFalse(loaded.verifies());
    }

    @Test
    void testSingleDeleteUpdatesFunctionSignature() throws Throwable {
        Utils.Loaded loaded = Utils.load("/simple.mlir");
        loaded.editor.deleteOperationSingle(loaded.session, "op_3");
        String printed = loaded.print();
        assertTrue(printed.contains("function_type = (f32, f32) -> ()"), printed);
        assertTrue(printed.contains("    \"func.return\"() : () -> ()\n"), printed);
        assertTrue(loaded.verifies());
    }

    @Test
    void testSingleDeleteOfReturnedValue() throws Throwable {
        Utils.Loaded loaded = Utils.load("/multi_func.mlir");
        // square's mulf is returned, the caller's call stays as it was
        Graph graph = loaded.editor.deleteOperationSingle(loaded.session, "op_2");
        OperationInfo ret = graph.findOperations("func.return").get(0);
        assertTrue(ret.operands.isEmpty());
        assertTrue(loaded.print().contains("<{function_type = (f32) -> (), sym_name = \"square\"}>"));
        assertEquals(1, graph.findOperations("func.call").size());
    }

    @Test
    void testSingleDeleteOfRepeatedOperand() {
        Utils.Loaded loaded = Utils.loadText("" +
                "%0 = \"test.def\"() : () -> i32\n" +
                "\"test.use\"(%0, %0, %0) {tag = \"kept\"} : (i32, i32, i32) -> ()\n");
        Graph graph = loaded.editor.deleteOperationSingle(loaded.session, "op_1");
        OperationInfo use = graph.findOperation("test.use");
        assertEquals("op_1", use.id);
        assertTrue(use.operands.isEmpty());
        assertTrue(use.attributes.containsKey("tag"));
        assertEquals("" +
                "\"builtin.module\"() ({\n" +
                "  \"test.use\"() {tag = \"kept\"} : () -> ()\n" +
                "}) : () -> ()\n", loaded.print());
    }

    @Test
    void testModuleCannotBeDeleted() throws Throwable {
        Utils.Loaded loaded = Utils.load("/simple.mlir");
        EditFailedException e = assertThrows(EditFailedException.class,
                () -> loaded.editor.deleteOperation(loaded.session, "op_0"));
        assertEquals("op_0", e.opId);
        assertThrows(EditFailedException.class, () -> loaded.editor.deleteOperationSingle(loaded.session, "op_0"));
        assertThrows(NotFoundException.class, () -> loaded.editor.deleteOperation(loaded.session, "op_17"));
        assertEquals(loaded.text, loaded.print());
        assertFalse(loaded.session.getHistory().canUndo());
    }

    @Test
    void testUndoCascade() throws Throwable {
        Utils.Loaded loaded = Utils.load("/nested.mlir");
        loaded.editor.deleteOperation(loaded.session, "op_3");
        assertNotEquals(loaded.text, loaded.print());
        Graph graph = loaded.editor.undo(loaded.session);
        assertEquals(loaded.text, loaded.print());
        assertEquals(7, graph.operations.size());
        assertTrue(loaded.session.getHistory().canRedo());
    }
}
