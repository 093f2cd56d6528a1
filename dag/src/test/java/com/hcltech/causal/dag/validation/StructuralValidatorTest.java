package com.hcltech.causal.dag.validation;

import com.hcltech.causal.common.errorsor.ErrorsOr;
import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.CausalNode;
import com.hcltech.causal.dag.Edge;
import com.hcltech.causal.dag.GraphDescription;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.hcltech.causal.dag.CausalGraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class StructuralValidatorTest {

    @Test
    void cleanAcyclicGraph_isValidWithoutMessages() {
        ValidationReport report = StructuralValidator.inspect(dag(BUTTERFLY));
        assertTrue(report.valid());
        assertEquals("valid", report.status());
        assertEquals("Network integrity validated", report.message());
        assertEquals(0, report.fixesApplied());
    }

    @Test
    void orphanedAndDuplicateEdges_areRemovedAndCounted() {
        GraphDescription raw = new GraphDescription(
                List.of(CausalNode.exposure("X"), CausalNode.outcome("Y")),
                List.of(Edge.of("X", "Y"), Edge.of("X", "Y"), Edge.of("X", "Gone"), Edge.of("Gone", "Y")));
        ValidatedGraph validated = StructuralValidator.validate(raw).valueOrThrow();

        assertEquals(List.of(Edge.of("X", "Y")), validated.graph().edges());
        ValidationReport report = validated.report();
        assertTrue(report.valid());
        assertEquals(2, report.orphanedCount());
        assertEquals(1, report.duplicateCount());
        assertEquals(3, report.fixesApplied());
        assertEquals(List.of("Removed 2 orphaned edges", "Removed 1 duplicate edges"), report.messages());
    }

    @Test
    void repeatedNodeIds_keepTheFirst() {
        GraphDescription raw = new GraphDescription(
                List.of(CausalNode.exposure("X"), CausalNode.covariate("X"), CausalNode.outcome("Y")), List.of());
        ValidatedGraph validated = StructuralValidator.validate(raw).valueOrThrow();
        assertEquals(List.of("X", "Y"), validated.graph().ids());
        assertEquals(List.of("X"), validated.graph().exposures());
    }

    @Test
    void missingDescription_isAnError() {
        assertEquals(ErrorsOr.error("Invalid or missing graph description"), StructuralValidator.validate(null));
    }

    @Test
    void triangle_isReportedAsOneCycleOfExactlyItsNodes() {
        ValidationReport report = StructuralValidator.inspect(dag(TRIANGLE_CYCLE));
        assertFalse(report.valid());
        assertTrue(report.hasCycles());
        assertEquals(1, report.cycles().size());
        List<String> cycle = report.cycles().get(0);
        assertEquals(3, cycle.size());
        assertEquals(Set.of("A", "B", "C"), new HashSet<>(cycle));
        assertEquals("A", cycle.get(0));
    }

    @Test
    void cycleThroughExposureAndOutcome_isCritical() {
        ValidationReport report = StructuralValidator.inspect(dag(TRIANGLE_CYCLE));
        assertEquals(1, report.criticalCycles().size());
        assertEquals("critical", report.status());
        assertEquals("Graph contains 1 cycle(s) including 1 involving exposure-outcome relationships", report.message());
    }

    @Test
    void cycleAmongCovariates_isInvalidButNotCritical() {
        ValidationReport report = StructuralValidator.inspect(dag("X [exposure] Y [outcome]; X -> Y; P -> Q -> P"));
        assertEquals("invalid", report.status());
        assertEquals(List.of(List.of("P", "Q")), report.cycles());
        assertTrue(report.criticalCycles().isEmpty());
    }

    @Test
    void separateCycles_areEachReported() {
        CausalGraph g = dag("A -> B -> A; C -> D -> E -> C; B -> C");
        ValidationReport report = StructuralValidator.inspect(g);
        assertEquals(2, report.cycles().size());
        assertEquals(Set.of("A", "B"), new HashSet<>(report.cycles().get(0)));
        assertEquals(Set.of("C", "D", "E"), new HashSet<>(report.cycles().get(1)));
    }

    @Test
    void deepChain_doesNotOverflowTheStack() {
        StringBuilder sb = new StringBuilder("N0");
        for (int i = 1; i < 20_000; i++) sb.append(" -> N").append(i);
        sb.append(" -> N0");
        ValidationReport report = StructuralValidator.inspect(dag(sb.toString()));
        assertEquals(1, report.cycles().size());
        assertEquals(20_000, report.cycles().get(0).size());
    }
}
