package com.hcltech.causal.dag;

import com.hcltech.causal.common.errorsor.ErrorsOr;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.hcltech.causal.dag.CausalGraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class CausalGraphTest {

    private final CausalGraph confounded = dag(CONFOUNDED);

    @Nested
    class Queries {
        @Test
        void parentsAndChildren_followEdgeDirection() {
            assertEquals(List.of("U"), confounded.parents("X"));
            assertEquals(List.of("Y"), confounded.children("X"));
            assertEquals(List.of("X", "Y"), confounded.children("U"));
        }

        @Test
        void ancestorsAndDescendants_areStrictAndInGraphOrder() {
            CausalGraph g = dag(LONG_BACKDOOR);
            assertEquals(List.of("X", "A", "B", "C"), g.ancestors("Y"));
            assertEquals(List.of("X", "Y", "B", "C"), g.descendants("A"));
            assertTrue(g.descendants("Y").isEmpty());
        }

        @Test
        void roles_comeFromTheDescription() {
            assertEquals(List.of("X"), confounded.exposures());
            assertEquals(List.of("Y"), confounded.outcomes());
            assertEquals(Optional.of(NodeRole.COVARIATE), confounded.role("U"));
            assertEquals(Optional.empty(), confounded.role("nope"));
        }

        @Test
        void degrees() {
            assertEquals(0, confounded.inDegree("U"));
            assertEquals(2, confounded.outDegree("U"));
            assertEquals(2, confounded.inDegree("Y"));
        }

        @Test
        void unknownNode_isRejected() {
            assertThrows(IllegalArgumentException.class, () -> confounded.parents("nope"));
        }
    }

    @Nested
    class Immutability {
        @Test
        void mutatingIndexLevelResults_leavesTheSnapshotUnchanged() {
            CausalGraph g = dag(CONFOUNDED);
            int x = g.indexOf("X");
            int u = g.indexOf("U");

            g.childIndices(u)[0] = u;
            g.parentIndices(x)[0] = g.indexOf("Y");
            g.descendantBits(u).clear();
            g.ancestorBits(g.indexOf("Y")).set(g.indexOf("Y"));

            assertEquals(List.of("X", "Y"), g.children("U"));
            assertEquals(List.of("U"), g.parents("X"));
            assertEquals(List.of("X", "Y"), g.descendants("U"));
            assertEquals(List.of("X", "U"), g.ancestors("Y"));
            assertEquals(2, g.outDegree(u));
            assertEquals(1, g.inDegree(x));
        }
    }

    @Nested
    class Construction {
        @Test
        void duplicateEdge_isRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> graph(List.of(CausalNode.covariate("A"), CausalNode.covariate("B")), "A -> B", "A -> B"));
        }

        @Test
        void orphanEdge_isRejected() {
            assertThrows(IllegalArgumentException.class, () -> graph(List.of(CausalNode.covariate("A")), "A -> B"));
        }

        @Test
        void selfLoop_isRejected() {
            assertThrows(IllegalArgumentException.class, () -> Edge.of("A", "A"));
        }

        @Test
        void blankId_isRejected() {
            assertThrows(IllegalArgumentException.class, () -> CausalNode.covariate(" "));
        }
    }

    @Nested
    class Removal {
        @Test
        void removeNode_removesExactlyTheIncidentEdges() {
            GraphEdit edit = confounded.removeNode("U").valueOrThrow();
            assertEquals(2, edit.edgesRemoved());
            assertEquals(List.of(Edge.of("X", "Y")), edit.after().edges());
            assertFalse(edit.after().hasNode("U"));
            assertEquals("Removed node: U and 2 connected edges", edit.message());
        }

        @Test
        void removeNode_leavesTheOriginalSnapshotUntouched() {
            GraphEdit edit = confounded.removeNode("U").valueOrThrow();
            assertSame(confounded, edit.before());
            assertEquals(3, confounded.edgeCount());
            assertTrue(confounded.hasNode("U"));
        }

        @Test
        void removeNode_invalidatesCachedAncestors() {
            assertEquals(List.of("X", "U"), confounded.ancestors("Y"));
            CausalGraph after = confounded.removeEdge(Edge.of("U", "Y")).valueOrThrow().after()
                    .removeEdge(Edge.of("X", "Y")).valueOrThrow().after();
            assertTrue(after.ancestors("Y").isEmpty());
        }

        @Test
        void removingMissingThings_fails() {
            assertEquals(ErrorsOr.error("Node Q not found"), confounded.removeNode("Q"));
            assertEquals(ErrorsOr.error("No node selected for removal"), confounded.removeNode(""));
            assertEquals(ErrorsOr.error("Edge Y -> X not found"), confounded.removeEdge(Edge.of("Y", "X")));
        }

        @Test
        void removeEdge_removesOneEdge() {
            GraphEdit edit = confounded.removeEdge(Edge.of("U", "Y")).valueOrThrow();
            assertEquals(1, edit.edgesRemoved());
            assertEquals(2, edit.after().edgeCount());
            assertTrue(edit.after().hasNode("U"));
        }
    }
}
