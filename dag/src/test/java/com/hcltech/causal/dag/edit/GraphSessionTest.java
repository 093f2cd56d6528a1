package com.hcltech.causal.dag.edit;

import com.hcltech.causal.common.errorsor.ErrorsOr;
import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.CausalNode;
import com.hcltech.causal.dag.Edge;
import com.hcltech.causal.dag.GraphDescription;
import com.hcltech.causal.dag.validation.StructuralValidator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.hcltech.causal.dag.CausalGraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class GraphSessionTest {

    private static GraphSession session(String graph) {
        return new GraphSession(StructuralValidator.validate(dag(graph).toDescription()).valueOrThrow());
    }

    @Test
    void removeNode_installsANewSnapshot() {
        GraphSession s = session(CONFOUNDED);
        CausalGraph before = s.graph();
        EditResult r = s.removeNode("U").valueOrThrow();
        assertEquals("Removed node: U and 2 connected edges", r.message());
        assertEquals(2, r.edgesRemoved());
        assertEquals(1, r.version());
        assertFalse(s.graph().hasNode("U"));
        assertTrue(before.hasNode("U"));
        assertTrue(r.validation().valid());
    }

    @Test
    void failedEdit_changesNothing() {
        GraphSession s = session(CONFOUNDED);
        assertEquals(ErrorsOr.error("Node Q not found"), s.removeNode("Q"));
        assertEquals(0, s.version());
        assertEquals(0, s.undoDepth());
    }

    @Test
    void undo_restoresThePreviousSnapshot() {
        GraphSession s = session(CONFOUNDED);
        CausalGraph original = s.graph();
        s.removeEdge(Edge.of("U", "Y")).valueOrThrow();
        EditResult undone = s.undo().valueOrThrow();
        assertEquals("Undid remove_edge of U -> Y", undone.message());
        assertSame(original, s.graph());
        assertEquals(2, s.version());
    }

    @Test
    void undo_withNothingToUndo() {
        assertEquals(ErrorsOr.error("No operations to undo"), session(CONFOUNDED).undo());
    }

    @Test
    void undoStack_keepsOnlyTheLastTenEdits() {
        StringBuilder sb = new StringBuilder("X [exposure] Y [outcome]; X -> Y");
        for (int i = 0; i < 12; i++) sb.append("; N").append(i).append(" -> Y");
        GraphSession s = session(sb.toString());
        for (int i = 0; i < 12; i++) s.removeNode("N" + i).valueOrThrow();
        assertEquals(GraphSession.UNDO_DEPTH, s.undoDepth());
        for (int i = 0; i < 10; i++) s.undo().valueOrThrow();
        assertTrue(s.undo().isError());
        assertTrue(s.graph().hasNode("N2"));
        assertFalse(s.graph().hasNode("N1"));
    }

    @Test
    void editThatLeavesACycle_isInstalledWithAnInvalidReport() {
        GraphSession s = GraphSession.open(new GraphDescription(
                List.of(CausalNode.covariate("A"), CausalNode.covariate("B")), List.of(Edge.of("A", "B")))).valueOrThrow();
        EditResult r = s.replace(dag("A -> B -> A").toDescription()).valueOrThrow();
        assertFalse(r.validation().valid());
        assertTrue(s.current().report().hasCycles());
        EditResult fixed = s.removeEdge(Edge.of("B", "A")).valueOrThrow();
        assertTrue(fixed.validation().valid());
    }

    @Test
    void pruneLeaves_canBeUndone() {
        GraphSession s = session(CONFOUNDED + "; Y -> L1; L1 -> L2");
        EditResult r = s.pruneLeaves(true).valueOrThrow();
        assertFalse(s.graph().hasNode("L1"));
        assertTrue(r.message().startsWith("Leaf removal complete."));
        s.undo().valueOrThrow();
        assertTrue(s.graph().hasNode("L2"));
    }

    @Test
    void concurrentReaders_alwaysSeeCompleteSnapshots() throws Exception {
        StringBuilder sb = new StringBuilder("X [exposure] Y [outcome]; X -> Y");
        for (int i = 0; i < 50; i++) sb.append("; N").append(i).append(" -> X; N").append(i).append(" -> Y");
        GraphSession s = session(sb.toString());
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> readers = new ArrayList<>();
            for (int t = 0; t < 3; t++) {
                readers.add(pool.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        CausalGraph g = s.graph();
                        assertEquals(2 * (g.size() - 2) + 1, g.edgeCount());
                    }
                }));
            }
            for (int i = 0; i < 50; i++) s.removeNode("N" + i).valueOrThrow();
            for (Future<?> f : readers) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(2, s.graph().size());
    }
}
