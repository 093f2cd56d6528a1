package com.hcltech.causal.dag.analysis;

import com.hcltech.causal.dag.AnalysisStatus;
import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.adjust.EffectType;
import com.hcltech.causal.dag.adjust.StopReason;
import com.hcltech.causal.dag.paths.PathKind;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.hcltech.causal.dag.CausalGraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class CausalAnalysisTest {

    private final CausalAnalysis analysis = new CausalAnalysis();

    @Nested
    class FullReport {
        private final AnalysisReport report = analysis.analyse(dag(BUTTERFLY), AnalysisRequest.declared());

        @Test
        void statusAndSummary() {
            assertEquals(AnalysisStatus.OK, report.status());
            assertTrue(report.success());
            assertEquals(new AnalysisSummary(5, true, true, false, true), report.summary());
            assertEquals(EffectType.TOTAL, report.effect());
        }

        @Test
        void variableListing_usesDeclaredRoles() {
            assertEquals(List.of("X"), report.variables().exposures());
            assertEquals(List.of("Y"), report.variables().outcomes());
            assertEquals(List.of("C1", "C2", "C3"), report.variables().covariates());
            assertEquals(5, report.variables().total());
        }

        @Test
        void everySectionIsFilledIn() {
            assertEquals(2, report.adjustment().totalSets());
            assertTrue(report.instruments().success());
            assertTrue(report.mBias().success());
            assertEquals(List.of("C1"), report.butterfly().butterflyVariables());
            assertTrue(report.validation().valid());
        }

        @Test
        void pathList_isClassifiedAndMarkedOpenOrBlocked() {
            PathReport paths = report.paths();
            assertEquals(5, paths.total());
            assertEquals(List.of("C1", "C2"), paths.adjustedFor());
            PathEntry direct = paths.paths().get(0);
            assertEquals("X -> Y", direct.description());
            assertEquals(PathKind.CAUSAL, direct.kind());
            assertTrue(direct.open());
            assertTrue(direct.openAfterAdjustment());

            PathEntry viaCollider = paths.paths().get(4);
            assertEquals("X <- C2 -> C1 <- C3 -> Y", viaCollider.description());
            assertFalse(viaCollider.open());
            assertFalse(viaCollider.openAfterAdjustment());
            assertEquals(List.of("X", "C2", "C1", "C3", "Y"), viaCollider.variables());
            assertEquals(4, viaCollider.length());
            assertEquals(4, paths.openCount());
            assertEquals(1, paths.blockedCount());
        }

        @Test
        void reportedPathLimit_capsThePathList() {
            AnalysisReport limited = analysis.analyse(dag(BUTTERFLY), AnalysisRequest.declared().withReportedPathLimit(2));
            assertEquals(2, limited.paths().total());
            assertTrue(limited.paths().truncated());
            assertEquals(2, limited.adjustment().totalSets());
        }
    }

    @Test
    void explicitRoles_overrideTheDeclaredOnes() {
        AnalysisReport report = analysis.analyse(dag(BUTTERFLY), AnalysisRequest.of("C2", "Y"));
        assertEquals(List.of("C2"), report.variables().exposures());
        assertTrue(report.variables().covariates().contains("X"));
        assertTrue(report.success());
    }

    @Test
    void directEffect_isPassedThrough() {
        AnalysisReport report = analysis.analyse(dag(MEDIATED), AnalysisRequest.declared().withEffect(EffectType.DIRECT));
        assertEquals(List.of("M"), report.adjustment().sets().get(0).variables());
    }

    @Test
    void mBiasScenario() {
        AnalysisReport report = analysis.analyse(dag(M_BIAS), AnalysisRequest.declared());
        assertEquals(List.of("V"), report.mBias().names());
        assertTrue(report.adjustment().sets().stream().noneMatch(s -> s.variables().contains("V")));
    }

    @Test
    void unidentifiable_isASuccessfulFinding() {
        AnalysisReport report = analysis.analyse(dag(REVERSED), AnalysisRequest.declared());
        assertEquals(AnalysisStatus.UNIDENTIFIABLE, report.status());
        assertTrue(report.success());
    }

    @Test
    void cancelledAnalysis_ofADenseGraph_returnsPromptlyWithTruncatedSections() {
        AnalysisReport report = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> analysis.analyse(dag(cliqueBehindExposure(12)), AnalysisRequest.declared(), () -> true));
        assertEquals(StopReason.CANCELLED, report.adjustment().stopReason());
        assertTrue(report.paths().truncated());
        assertTrue(report.mBias().truncated());
        assertEquals(List.of("X -> Y"), report.paths().paths().stream().map(PathEntry::description).toList());
    }

    @Nested
    class Failures {
        @Test
        void missingGraph() {
            AnalysisReport report = analysis.analyse(null, AnalysisRequest.declared());
            assertEquals(AnalysisStatus.INVALID_GRAPH, report.status());
            assertFalse(report.success());
            assertFalse(report.summary().analysisPossible());
            assertEquals(AnalysisStatus.INVALID_GRAPH, report.adjustment().status());
        }

        @Test
        void unknownOverride() {
            AnalysisReport report = analysis.analyse(dag(CONFOUNDED), AnalysisRequest.of("X", "Ghost"));
            assertEquals(AnalysisStatus.INVALID_GRAPH, report.status());
            assertEquals("Variable(s) not in graph: Ghost", report.message());
        }

        @Test
        void noOutcome() {
            AnalysisReport report = analysis.analyse(dag("X [exposure] A; X -> A"), AnalysisRequest.declared());
            assertEquals(AnalysisStatus.MISSING_ROLES, report.status());
            assertTrue(report.summary().hasExposures());
            assertFalse(report.summary().hasOutcomes());
            assertFalse(report.summary().analysisPossible());
        }

        @Test
        void cycle_blocksTheAnalysis() {
            CausalGraph g = dag(TRIANGLE_CYCLE);
            AnalysisReport report = analysis.analyse(g, AnalysisRequest.declared());
            assertEquals(AnalysisStatus.CYCLE_DETECTED, report.status());
            assertTrue(report.summary().hasCycles());
            assertFalse(report.summary().analysisPossible());
            assertEquals(1, report.validation().cycles().size());
            assertTrue(report.adjustment().sets().isEmpty());
            assertEquals(AnalysisStatus.CYCLE_DETECTED, report.butterfly().status());
        }

        @Test
        void sameVariableAsExposureAndOutcome() {
            AnalysisReport report = analysis.analyse(dag(CONFOUNDED), AnalysisRequest.of("X", "X"));
            assertEquals(AnalysisStatus.INVALID_GRAPH, report.status());
        }
    }
}
