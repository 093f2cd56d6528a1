package com.hcltech.causal.dag.bias;

import com.hcltech.causal.dag.AnalysisStatus;
import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.adjust.AdjustmentQuery;
import com.hcltech.causal.dag.adjust.AdjustmentResult;
import com.hcltech.causal.dag.adjust.AdjustmentSetSearch;
import com.hcltech.causal.dag.paths.PathOracle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hcltech.causal.dag.CausalGraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class MBiasDetectorTest {

    private static MBiasReport detect(String graph) {
        CausalGraph g = dag(graph);
        PathOracle oracle = new PathOracle(g);
        AdjustmentResult minimal = new AdjustmentSetSearch(g).search(AdjustmentQuery.of("X", "Y"));
        return new MBiasDetector(oracle).detect(minimal, 1000);
    }

    @Test
    void mStructure_flagsTheCollider() {
        MBiasReport r = detect(M_BIAS);
        assertTrue(r.detected());
        assertEquals(List.of("V"), r.names());
        MBiasVariable v = r.variables().get(0);
        assertEquals(List.of("A", "B"), v.parents());
        assertEquals(List.of("X <- A -> V <- B -> Y"), v.paths());
    }

    @Test
    void flaggedVariable_isInNoMinimalSet() {
        CausalGraph g = dag(M_BIAS);
        AdjustmentResult minimal = new AdjustmentSetSearch(g).search(AdjustmentQuery.of("X", "Y"));
        assertFalse(minimal.variablesInAnySet().contains("V"));
        assertEquals(List.of("V"), new MBiasDetector(new PathOracle(g)).detect(minimal, 1000).names());
    }

    @Test
    void colliderThatIsAlsoNeededForAdjustment_isNotFlagged() {
        MBiasReport r = detect(BUTTERFLY);
        assertFalse(r.detected());
        assertEquals("No M-bias detected", r.message());
    }

    @Test
    void colliderOffTheBackdoorPaths_isNotFlagged() {
        MBiasReport r = detect(CONFOUNDED + "; X -> K <- Y");
        assertFalse(r.detected());
    }

    @Test
    void failedSearch_isPassedThrough() {
        CausalGraph g = dag(TRIANGLE_CYCLE);
        AdjustmentResult minimal = new AdjustmentSetSearch(g).search(AdjustmentQuery.of("A", "C"));
        MBiasReport r = new MBiasDetector(new PathOracle(g)).detect(minimal, 1000);
        assertEquals(AnalysisStatus.CYCLE_DETECTED, r.status());
        assertFalse(r.success());
    }
}
