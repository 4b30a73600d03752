/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.math;

import ai.evacortex.stepcal.core.AlignmentTransform;
import ai.evacortex.stepcal.core.Profile;
import ai.evacortex.stepcal.core.ProfilePair;
import ai.evacortex.stepcal.core.Window;
import ai.evacortex.stepcal.core.exceptions.DegenerateInputException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProfileOpsTest {

    private static Profile ramp(double from, double to, int n) {
        double[] x = ProfileOps.linspace(from, to, n);
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            y[i] = 10.0 + i;
        }
        return new Profile(x, y);
    }

    @Test
    void cropKeepsSamplesInsideWindowInEitherBoundOrder() {
        Profile p = ramp(0.0, 10.0, 11);
        Profile a = ProfileOps.crop(p, new Window(2.0, 5.0), false);
        Profile b = ProfileOps.crop(p, new Window(5.0, 2.0), false);
        assertArrayEquals(new double[]{2.0, 3.0, 4.0, 5.0}, a.x(), 1e-12);
        assertArrayEquals(new double[]{12.0, 13.0, 14.0, 15.0}, a.y(), 1e-12);
        assertEquals(a, b, "window bounds must be sorted before use");
    }

    @Test
    void cropAndFlipAreIdempotent() {
        Profile p = ramp(0.0, 10.0, 101);
        Window w = new Window(3.3, 7.7);
        Profile once = ProfileOps.crop(p, w, false);
        assertEquals(once, ProfileOps.crop(once, w, false), "cropping twice must equal cropping once");
        assertEquals(p, ProfileOps.flip(ProfileOps.flip(p)), "double flip must restore the profile");
        assertEquals(ProfileOps.flip(once), ProfileOps.crop(p, w, true), "flipped crop must reverse the crop");
    }

    @Test
    void cropWithoutMatchReturnsProfileUnchanged() {
        Profile p = ramp(0.0, 1.0, 5);
        assertSame(p, ProfileOps.crop(p, new Window(5.0, 6.0), false));
    }

    @Test
    void cropToSingleSampleIsDegenerate() {
        Profile p = ramp(0.0, 10.0, 11);
        assertThrows(DegenerateInputException.class, () -> ProfileOps.crop(p, new Window(4.9, 5.1), false));
    }

    @Test
    void nearestIndexPrefersFirstOnTies() {
        double[] values = {0.0, 1.0, 2.0, 3.0};
        assertEquals(1, ProfileOps.nearestIndex(values, 1.5));
        assertEquals(3, ProfileOps.nearestIndex(values, 42.0));
        assertEquals(2, ProfileOps.nearest(values, 0.0, 2, 3).index(), "lookup must stay inside the range");
    }

    @Test
    void commonRangeTrimKeepsOverlapAndDirection() {
        Profile cal = ProfileOps.flip(ramp(0.0, 10.0, 11));
        Profile meas = ramp(5.0, 15.0, 21);
        ProfilePair pair = ProfileOps.commonRangeTrim(cal, meas);

        assertFalse(pair.calibration().isIncreasing(), "calibration must keep its direction");
        assertEquals(10.0, pair.calibration().first(), 1e-12);
        assertEquals(5.0, pair.calibration().last(), 1e-12);
        assertEquals(5.0, pair.measurement().first(), 1e-12);
        assertEquals(10.0, pair.measurement().last(), 1e-12);
        assertEquals(11, pair.measurement().size());
    }

    @Test
    void commonRangeTrimWithoutOverlapIsDegenerate() {
        assertThrows(DegenerateInputException.class,
                () -> ProfileOps.commonRangeTrim(ramp(0.0, 1.0, 5), ramp(2.0, 3.0, 5)));
    }

    @Test
    void interpolateHandlesDecreasingAbscissaAndClamps() {
        double[] xp = {3.0, 2.0, 1.0};
        double[] fp = {30.0, 20.0, 10.0};
        double[] out = ProfileOps.interpolate(xp, fp, new double[]{0.0, 1.5, 2.0, 2.25, 9.0});
        assertArrayEquals(new double[]{10.0, 15.0, 20.0, 22.5, 30.0}, out, 1e-12);
    }

    @Test
    void counterpartReadsValueAtNearestPosition() {
        Profile meas = ramp(0.0, 4.0, 5);
        assertArrayEquals(new double[]{11.0, 14.0, 10.0}, ProfileOps.counterpart(meas, new double[]{1.2, 3.9, -7.0}), 1e-12);
    }

    @Test
    void transformMovesPositionsOnly() {
        Profile p = ramp(0.0, 2.0, 3);
        Profile t = ProfileOps.transform(p, new AlignmentTransform(2.0, 1.0));
        assertArrayEquals(new double[]{1.0, 3.0, 5.0}, t.x(), 1e-12);
        assertArrayEquals(p.y(), t.y(), 1e-12);
        assertArrayEquals(new double[]{0.0, 1.0, 2.0}, p.x(), 1e-12, "input must not change");
    }
}
