/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.math;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PeakFinderTest {

    @Test
    void findsLocalMaximaAboveFloor() {
        double[] s = {0, 5, 0, 1, 0, 7, 0};
        assertArrayEquals(new int[]{1, 3, 5}, PeakFinder.findPeaks(s, 0.5, 1));
        assertArrayEquals(new int[]{1, 5}, PeakFinder.findPeaks(s, 2.0, 1));
    }

    @Test
    void flatTopReportsItsMiddle() {
        double[] s = {0, 2, 2, 2, 0};
        assertArrayEquals(new int[]{2}, PeakFinder.findPeaks(s, 0.0, 1));
    }

    @Test
    void closePeaksKeepTheHighest() {
        double[] s = {0, 4, 0, 6, 0, 0, 0, 3, 0};
        assertArrayEquals(new int[]{3, 7}, PeakFinder.findPeaks(s, 0.0, 3));
    }

    @Test
    void equalPeaksKeepTheLeftmostOfEachRun() {
        double[] s = new double[400_000];
        for (int i = 1; i < s.length; i += 2) {
            s[i] = 1.0;
        }
        int[] peaks = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> PeakFinder.findPeaks(s, 0.5, 50));
        assertEquals(8000, peaks.length);
        assertEquals(1, peaks[0]);
        assertEquals(51, peaks[1]);
        assertEquals(399_951, peaks[peaks.length - 1]);
    }

    @Test
    void suppressionReachesAcrossSeveralNeighbours() {
        double[] s = {0, 2, 0, 3, 0, 9, 0, 3, 0, 2, 0, 5, 0};
        assertArrayEquals(new int[]{5, 11}, PeakFinder.findPeaks(s, 0.0, 5));
    }

    @Test
    void endpointsAreNeverPeaks() {
        double[] s = {9, 1, 0, 1, 9};
        assertEquals(0, PeakFinder.findPeaks(s, 0.0, 1).length);
    }
}
