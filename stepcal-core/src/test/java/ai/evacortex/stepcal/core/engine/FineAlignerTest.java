/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.engine;

import ai.evacortex.stepcal.core.AlignmentTransform;
import ai.evacortex.stepcal.core.Profile;
import ai.evacortex.stepcal.core.StaircaseTestUtils;
import ai.evacortex.stepcal.core.exceptions.AlignmentCancelledException;
import ai.evacortex.stepcal.core.exceptions.AlignmentRefinementException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Fine alignment")
class FineAlignerTest {

    private static final FineSearchOptions OPTIONS = new FineSearchOptions(20, 1, 0);
    private static final double CELL_SLACK = 1e-9;

    private final Profile cal = StaircaseTestUtils.referenceCalibration();
    private final Profile meas = StaircaseTestUtils.referenceMeasurement(GridAlignerTest.STRETCH, GridAlignerTest.SHIFT, 2.0, 0.5);
    private final FineAligner aligner = new FineAligner();

    private RoughAlignment rough() {
        return new GridAligner().align(cal, StaircaseTestUtils.TRANSITIONS, meas, GridAlignerTest.OPTIONS,
                CancellationToken.none());
    }

    @Test
    void refinementStaysNearKnownTransform() {
        RoughAlignment rough = rough();
        FineAlignment fine = aligner.refine(cal, StaircaseTestUtils.TRANSITIONS, meas, rough, OPTIONS, CancellationToken.none());

        QualityMatrix q = rough.quality();
        double stretchStep = q.stretchAt(1) - q.stretchAt(0);
        double shiftStep = q.shiftAt(1) - q.shiftAt(0);
        assertEquals(GridAlignerTest.STRETCH, fine.transform().stretch(), stretchStep + CELL_SLACK);
        assertEquals(GridAlignerTest.SHIFT, fine.transform().shift(), shiftStep + CELL_SLACK);

        assertEquals(20, fine.candidates().size());
        for (CandidateCost c : fine.candidates()) {
            assertFalse(FineAligner.ranksAbove(c, fine.best()), "no candidate may rank above the best one");
        }
        assertEquals(4, fine.best().transitionsInside());
        assertTrue(Double.isFinite(fine.cost()));
    }

    @ParameterizedTest(name = "stretch={0}, shift={1}, noise={2}")
    @CsvSource({
            "1.0,   0.0,  0.02",
            "1.033, -0.44, 0.05",
            "1.02,  0.3,  0.02"
    })
    void noisyMeasurementIsRecoveredWithinOneCell(double stretch, double shift, double noise) {
        Profile noisy = StaircaseTestUtils.withNoise(
                StaircaseTestUtils.referenceMeasurement(stretch, shift, 2.0, 0.5), noise, 7L);
        RoughAlignment rough = new GridAligner().align(cal, StaircaseTestUtils.TRANSITIONS, noisy,
                GridAlignerTest.OPTIONS, CancellationToken.none());
        FineAlignment fine = aligner.refine(cal, StaircaseTestUtils.TRANSITIONS, noisy, rough,
                new FineSearchOptions(50, 1, 0), CancellationToken.none());

        QualityMatrix q = rough.quality();
        double stretchStep = q.stretchAt(1) - q.stretchAt(0);
        double shiftStep = q.shiftAt(1) - q.shiftAt(0);
        assertEquals(stretch, fine.transform().stretch(), stretchStep + CELL_SLACK);
        assertEquals(shift, fine.transform().shift(), shiftStep + CELL_SLACK);
    }

    @Test
    void candidateDroppingTransitionsNeverOutranks() {
        AlignmentTransform truth = new AlignmentTransform(GridAlignerTest.STRETCH, GridAlignerTest.SHIFT);
        FineAligner.Score full = FineAligner.score(cal, StaircaseTestUtils.TRANSITIONS, meas, truth, OPTIONS);
        FineAligner.Score partial = FineAligner.score(cal, StaircaseTestUtils.TRANSITIONS, meas,
                new AlignmentTransform(1.0, 6.5), OPTIONS);
        assertEquals(4, full.transitions());
        assertEquals(2, partial.transitions());

        CandidateCost all = new CandidateCost(0, 0, truth, 1.0, 4, 0.5);
        CandidateCost fewer = new CandidateCost(0, 1, new AlignmentTransform(1.0, 6.5), 1.0, 2, 1e-6);
        assertTrue(FineAligner.ranksAbove(all, fewer));
        assertFalse(FineAligner.ranksAbove(fewer, all));

        CandidateCost cheaper = new CandidateCost(1, 0, truth, 1.0, 4, 0.25);
        assertTrue(FineAligner.ranksAbove(cheaper, all));
        assertFalse(FineAligner.ranksAbove(all, all), "equal candidates keep the earlier one");
    }

    @Test
    void candidatesComeOutBestQualityFirst() {
        QualityMatrix q = new QualityMatrix(new double[][]{{1.0, 3.0}, {3.0, 2.0}},
                new double[]{1.0, 1.1}, new double[]{0.0, 0.5}, 0L);
        List<int[]> cells = FineAligner.topCells(q, 3);
        assertArrayEquals(new int[]{0, 1}, cells.get(0));
        assertArrayEquals(new int[]{1, 0}, cells.get(1));
        assertArrayEquals(new int[]{1, 1}, cells.get(2));
        assertEquals(3.0, q.get(0, 1), "extraction must work on a copy");
        assertEquals(4, FineAligner.topCells(q, 50).size());
    }

    @Test
    void candidateWithoutOverlapCostsInfinity() {
        FineAligner.Score score = FineAligner.score(cal, StaircaseTestUtils.TRANSITIONS, meas,
                new AlignmentTransform(1.0, 50.0), OPTIONS);
        assertEquals(Double.POSITIVE_INFINITY, score.cost());
    }

    @Test
    void candidateWithoutInnerTransitionCostsInfinity() {
        FineAligner.Score score = FineAligner.score(cal, StaircaseTestUtils.TRANSITIONS, meas,
                new AlignmentTransform(1.0, 9.5), OPTIONS);
        assertEquals(Double.POSITIVE_INFINITY, score.cost());
        assertEquals(0, score.transitions());
    }

    @Test
    void matrixFromOtherProfilesIsRejected() {
        RoughAlignment rough = rough();
        Profile other = StaircaseTestUtils.referenceMeasurement(1.0, 0.0, 2.0, 0.5);
        assertThrows(AlignmentRefinementException.class,
                () -> aligner.refine(cal, StaircaseTestUtils.TRANSITIONS, other, rough, OPTIONS, CancellationToken.none()));
    }

    @Test
    void cancelledTokenStopsRefinement() {
        RoughAlignment rough = rough();
        CancellationToken token = CancellationToken.create();
        token.cancel();
        assertThrows(AlignmentCancelledException.class,
                () -> aligner.refine(cal, StaircaseTestUtils.TRANSITIONS, meas, rough, OPTIONS, token));
    }
}
