/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.engine;

import ai.evacortex.stepcal.core.CalibrationKind;
import ai.evacortex.stepcal.core.Profile;
import ai.evacortex.stepcal.core.exceptions.AmbiguousAnchorsException;
import ai.evacortex.stepcal.core.exceptions.DegenerateInputException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnchorPointSetTest {

    private static final double[] MEASURED = {2.0, 1.0, 3.0};
    private static final double[] CALIBRATION = {17.0, 16.0, 18.0};
    private static final double[] POSITIONS = {0.5, 1.5, 2.5};

    @Test
    void resistivityAnchorsAscend() {
        AnchorPointSet set = AnchorPointSet.of(MEASURED, CALIBRATION, POSITIONS, new CalibrationKind.Resistivity());
        assertArrayEquals(new double[]{16.0, 17.0, 18.0}, set.calibration());
        assertArrayEquals(new double[]{1.0, 2.0, 3.0}, set.measured(), "measured values must follow their anchors");
        assertArrayEquals(new double[]{1.5, 0.5, 2.5}, set.positions());
    }

    @Test
    void chargeCarrierAnchorsDescend() {
        AnchorPointSet set = AnchorPointSet.of(MEASURED, CALIBRATION, POSITIONS, new CalibrationKind.ChargeCarrier("n"));
        assertArrayEquals(new double[]{18.0, 17.0, 16.0}, set.calibration());
        assertArrayEquals(new double[]{3.0, 2.0, 1.0}, set.measured());
    }

    @Test
    void duplicateCalibrationValuesAreRejected() {
        AmbiguousAnchorsException e = assertThrows(AmbiguousAnchorsException.class, () -> AnchorPointSet.of(
                new double[]{1, 2, 3}, new double[]{5, 6, 5}, new double[]{0, 1, 2}, new CalibrationKind.Custom("a.u.")));
        assertEquals(5.0, e.getDuplicateValue());
    }

    @Test
    void needsTwoAnchors() {
        assertThrows(DegenerateInputException.class, () -> AnchorPointSet.of(
                new double[]{1}, new double[]{5}, new double[]{0}, new CalibrationKind.Resistivity()));
    }

    @Test
    void matchReadsMeasurementAtAnchorPositions() {
        Profile meas = new Profile(new double[]{0, 1, 2, 3}, new double[]{10, 20, 30, 40});
        List<Anchor> anchors = List.of(
                new Anchor(2.9, 7.0, AnchorType.PLATEAU),
                new Anchor(0.2, 9.0, AnchorType.PLATEAU));
        AnchorPointSet set = AnchorPointSet.match(anchors, meas, new CalibrationKind.Resistivity());
        assertArrayEquals(new double[]{7.0, 9.0}, set.calibration());
        assertArrayEquals(new double[]{40.0, 10.0}, set.measured());
    }
}
