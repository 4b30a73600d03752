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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Array utilities shared by every stage. None of the methods mutate their arguments.
 */
public final class ProfileOps {

    private static final Logger log = LoggerFactory.getLogger(ProfileOps.class);

    private ProfileOps() {}

    /**
     * Keeps the samples whose position lies inside {@code window}, optionally reversing the
     * result. A window that matches no sample leaves the profile unchanged.
     */
    public static Profile crop(Profile profile, Window window, boolean flipped) {
        Objects.requireNonNull(profile, "profile must not be null");
        Objects.requireNonNull(window, "window must not be null");

        double lo = window.lower();
        double hi = window.upper();
        int n = profile.size();
        int count = 0;
        for (int i = 0; i < n; i++) {
            double p = profile.xAt(i);
            if (p >= lo && p <= hi) count++;
        }
        if (count == 0) {
            log.warn("Window [{}, {}] selects no sample of {}; profile left unchanged", lo, hi, profile);
            return profile;
        }

        double[] x = new double[count];
        double[] y = new double[count];
        int k = 0;
        for (int i = 0; i < n; i++) {
            double p = profile.xAt(i);
            if (p >= lo && p <= hi) {
                x[k] = p;
                y[k] = profile.yAt(i);
                k++;
            }
        }
        if (count < 2) {
            throw new DegenerateInputException("window [" + lo + ", " + hi + "] keeps a single sample");
        }
        Profile cropped = new Profile(x, y);
        return flipped ? flip(cropped) : cropped;
    }

    public static Profile flip(Profile profile) {
        return new Profile(reverse(profile.x()), reverse(profile.y()));
    }

    public static Profile transform(Profile profile, AlignmentTransform transform) {
        return new Profile(transform.apply(profile.x()), profile.y());
    }

    /**
     * Index of the element of {@code values} closest to {@code target}; ties go to the first
     * occurrence.
     */
    public static NearestPoint nearest(double[] values, double target) {
        return nearest(values, target, 0, values.length - 1);
    }

    public static int nearestIndex(double[] values, double target) {
        return nearest(values, target).index();
    }

    /**
     * Nearest lookup restricted to the inclusive index range {@code [from, to]}.
     */
    public static NearestPoint nearest(double[] values, double target, int from, int to) {
        if (values.length == 0) {
            throw new DegenerateInputException("nearest lookup on an empty array");
        }
        int lo = Math.max(0, Math.min(from, to));
        int hi = Math.min(values.length - 1, Math.max(from, to));
        int best = lo;
        double bestDist = Math.abs(values[lo] - target);
        for (int i = lo + 1; i <= hi; i++) {
            double d = Math.abs(values[i] - target);
            if (d < bestDist) {
                bestDist = d;
                best = i;
            }
        }
        return new NearestPoint(best, values[best]);
    }

    /**
     * Trims both profiles to the position interval they share. Each profile keeps its own
     * direction; the slice runs between the indices nearest to the interval ends.
     *
     * @throws DegenerateInputException if the profiles do not overlap
     */
    public static ProfilePair commonRangeTrim(Profile calibration, Profile measurement) {
        double lo = Math.max(calibration.minX(), measurement.minX());
        double hi = Math.min(calibration.maxX(), measurement.maxX());
        if (!(hi > lo)) {
            throw new DegenerateInputException("profiles do not overlap: [" + calibration.minX() + ", "
                    + calibration.maxX() + "] vs [" + measurement.minX() + ", " + measurement.maxX() + "]");
        }
        return new ProfilePair(slice(calibration, lo, hi), slice(measurement, lo, hi));
    }

    private static Profile slice(Profile profile, double lo, double hi) {
        double[] x = profile.x();
        int a = nearestIndex(x, lo);
        int b = nearestIndex(x, hi);
        int from = Math.min(a, b);
        int to = Math.max(a, b);
        if (to - from < 1) {
            throw new DegenerateInputException("common range keeps fewer than 2 samples of " + profile);
        }
        return new Profile(Arrays.copyOfRange(x, from, to + 1), Arrays.copyOfRange(profile.y(), from, to + 1));
    }

    /**
     * For each requested position, the value of {@code source} at its nearest position.
     */
    public static double[] counterpart(Profile source, double[] positions) {
        double[] x = source.x();
        double[] out = new double[positions.length];
        for (int i = 0; i < positions.length; i++) {
            out[i] = source.yAt(nearestIndex(x, positions[i]));
        }
        return out;
    }

    /**
     * Piecewise linear interpolation of {@code (xp, fp)} at {@code x}. {@code xp} may be
     * increasing or decreasing; queries outside its range take the boundary value.
     */
    public static double[] interpolate(double[] xp, double[] fp, double[] x) {
        if (xp.length != fp.length || xp.length == 0) {
            throw new IllegalArgumentException("xp and fp must be non-empty and of equal length");
        }
        double[] ax = xp;
        double[] af = fp;
        if (xp.length > 1 && xp[xp.length - 1] < xp[0]) {
            ax = reverse(xp);
            af = reverse(fp);
        }
        int n = ax.length;
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double q = x[i];
            if (q <= ax[0]) {
                out[i] = af[0];
            } else if (q >= ax[n - 1]) {
                out[i] = af[n - 1];
            } else {
                int j = Arrays.binarySearch(ax, q);
                if (j >= 0) {
                    out[i] = af[j];
                } else {
                    int hi = -j - 1;
                    int lo = hi - 1;
                    double w = (q - ax[lo]) / (ax[hi] - ax[lo]);
                    out[i] = af[lo] + w * (af[hi] - af[lo]);
                }
            }
        }
        return out;
    }

    public static double interpolate(double[] xp, double[] fp, double x) {
        return interpolate(xp, fp, new double[]{x})[0];
    }

    public static double[] linspace(double start, double end, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive");
        }
        double[] out = new double[count];
        if (count == 1) {
            out[0] = start;
            return out;
        }
        double step = (end - start) / (count - 1);
        for (int i = 0; i < count; i++) {
            out[i] = start + i * step;
        }
        out[count - 1] = end;
        return out;
    }

    public static double[] diff(double[] values) {
        if (values.length < 2) return new double[0];
        double[] out = new double[values.length - 1];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[i + 1] - values[i];
        }
        return out;
    }

    public static double[] reverse(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[values.length - 1 - i];
        }
        return out;
    }
}
