/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core;

import ai.evacortex.stepcal.core.exceptions.DegenerateInputException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProfileTest {

    @Test
    void rejectsMismatchedShortAndNonFiniteInput() {
        assertThrows(DegenerateInputException.class, () -> new Profile(new double[]{0, 1}, new double[]{0}));
        assertThrows(DegenerateInputException.class, () -> new Profile(new double[]{0}, new double[]{0}));
        assertThrows(DegenerateInputException.class, () -> new Profile(new double[]{0, 1}, new double[]{0, Double.NaN}));
        assertThrows(DegenerateInputException.class,
                () -> new Profile(new double[]{0, Double.POSITIVE_INFINITY}, new double[]{0, 1}));
    }

    @Test
    void copiesArraysOnConstructionAndAccess() {
        double[] x = {0.0, 1.0, 2.0};
        double[] y = {5.0, 6.0, 7.0};
        Profile p = new Profile(x, y);
        x[0] = 99.0;
        p.y()[1] = 99.0;
        assertEquals(0.0, p.xAt(0), "constructor must copy positions");
        assertEquals(6.0, p.yAt(1), "accessor must return a copy");
    }

    @Test
    void fromColumnsReadsPositionValuePairs() {
        Profile p = Profile.fromColumns(new double[][]{{0.0, 3.0}, {0.5, 2.0}, {1.0, 1.0}});
        assertArrayEquals(new double[]{0.0, 0.5, 1.0}, p.x());
        assertArrayEquals(new double[]{3.0, 2.0, 1.0}, p.y());
        assertThrows(DegenerateInputException.class, () -> Profile.fromColumns(new double[][]{{0.0}, {1.0, 2.0}}));
    }

    @Test
    void rangeHelpersIgnoreDirection() {
        Profile p = new Profile(new double[]{4.0, 3.0, 1.0}, new double[]{1.0, -2.0, 3.0});
        assertFalse(p.isIncreasing());
        assertEquals(1.0, p.minX());
        assertEquals(4.0, p.maxX());
        assertEquals(3.0, p.span(), 1e-12);
        assertEquals(-2.0, p.minY());
        assertEquals(3.0, p.maxY());
    }
}
