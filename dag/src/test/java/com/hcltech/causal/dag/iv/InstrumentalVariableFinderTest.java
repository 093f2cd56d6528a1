package com.hcltech.causal.dag.iv;

import com.hcltech.causal.dag.AnalysisStatus;
import com.hcltech.causal.dag.paths.PathOracle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hcltech.causal.dag.CausalGraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class InstrumentalVariableFinderTest {

    private static InstrumentResult find(String graph) {
        return new InstrumentalVariableFinder(new PathOracle(dag(graph))).find(List.of("X"), List.of("Y"));
    }

    @Test
    void causeOfExposureOnly_isAnInstrument() {
        InstrumentResult r = find("X [exposure] Y [outcome] Z; Z -> X -> Y");
        assertEquals(List.of("Z"), r.instruments());
        assertEquals(1, r.count());
        assertEquals("Found 1 instrumental variable(s)", r.message());
    }

    @Test
    void directEffectOnOutcome_disqualifies() {
        InstrumentResult r = find("X [exposure] Y [outcome] Z; Z -> X -> Y; Z -> Y");
        assertTrue(r.instruments().isEmpty());
        assertEquals("No instrumental variables found", r.message());
    }

    @Test
    void ancestorsOfTheInstrument_qualifyToo() {
        InstrumentResult r = find("X [exposure] Y [outcome] Z0 Z; Z0 -> Z -> X -> Y");
        assertEquals(List.of("Z0", "Z"), r.instruments());
    }

    @Test
    void descendantsOfTheOutcome_areNeverCandidates() {
        InstrumentResult r = find("X [exposure] Y [outcome] Z D; Z -> X -> Y -> D");
        assertEquals(List.of("Z"), r.instruments());
    }

    @Test
    void descendantsOfTheExposure_areNeverCandidates() {
        assertTrue(find("X [exposure] Y [outcome] D; X -> Y; X -> D").instruments().isEmpty());
        assertEquals(List.of("Z"), find("X [exposure] Y [outcome] Z D E; Z -> X -> Y; X -> D -> E").instruments());
    }

    @Test
    void unrelatedNode_isNotAnInstrument() {
        InstrumentResult r = find("X [exposure] Y [outcome] Z Q; Z -> X -> Y");
        assertEquals(List.of("Z"), r.instruments());
    }

    @Test
    void conditioningOnTheExposureOpensTheConfoundingPath_soTheCandidateIsRejected() {
        InstrumentResult r = find("X [exposure] Y [outcome] Z U; Z -> X -> Y; X <- U -> Y");
        assertTrue(r.instruments().isEmpty());
    }

    @Test
    void cyclicGraph_isRejected() {
        InstrumentResult r = new InstrumentalVariableFinder(new PathOracle(dag(TRIANGLE_CYCLE))).find(List.of("A"), List.of("C"));
        assertEquals(AnalysisStatus.CYCLE_DETECTED, r.status());
        assertFalse(r.success());
    }

    @Test
    void missingRoles() {
        InstrumentResult r = new InstrumentalVariableFinder(new PathOracle(dag(CONFOUNDED))).find(List.of(), List.of("Y"));
        assertEquals(AnalysisStatus.MISSING_ROLES, r.status());
    }
}
