/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.engine;

import ai.evacortex.stepcal.core.Profile;
import ai.evacortex.stepcal.core.exceptions.ConfigurationException;
import ai.evacortex.stepcal.core.math.PeakFinder;
import ai.evacortex.stepcal.core.math.ProfileOps;
import ai.evacortex.stepcal.core.math.SavitzkyGolay;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Locates the {@code stepCount - 1} transitions of a staircase profile.
 *
 * <p>The transitions are the sharpest peaks of the normalised absolute first difference.
 * When too few peaks are found the search is repeated once without smoothing; if that still
 * fails, evenly spaced positions are synthesised so that a result is always produced.
 * Surplus peaks are removed lowest first, one at a time.</p>
 */
public final class StepDetector {

    private static final Logger log = LoggerFactory.getLogger(StepDetector.class);

    static final double HEIGHT_PERCENTILE = 15.0;

    private record DerivativeSignal(double[] magnitude, double[] positions) {}

    /**
     * @param segment        staircase segment
     * @param stepCount      number of plateaus N; N - 1 transitions are returned
     * @param minSpacing     expected minimum transition spacing in position units
     * @param smoothingWidth smoothing window; values below 2 disable smoothing
     * @return the transitions, or empty if the segment has zero position span
     */
    public Optional<StepDetection> detect(Profile segment, int stepCount, double minSpacing, int smoothingWidth) {
        if (stepCount < 1) {
            throw new ConfigurationException("step count must be at least 1, got " + stepCount);
        }
        double span = segment.span();
        if (span == 0.0) {
            log.warn("Step detection skipped: segment {} has zero span", segment);
            return Optional.empty();
        }
        int expected = stepCount - 1;
        if (expected == 0) {
            return Optional.of(new StepDetection(new double[0], false, 0));
        }

        int width = effectiveWidth(smoothingWidth, segment.size());
        List<double[]> peaks = findTransitions(segment, minSpacing, width);
        int found = peaks.size();
        if (found < expected && width != 1) {
            log.debug("Found {} of {} transitions with width {}, retrying unsmoothed", found, expected, width);
            peaks = findTransitions(segment, minSpacing, 1);
            found = peaks.size();
        }

        if (found < expected) {
            double[] synthetic = fallbackPositions(segment, expected, minSpacing);
            log.warn("Only {} of {} transitions detected; using evenly spaced fallback {}",
                    found, expected, Arrays.toString(synthetic));
            return Optional.of(new StepDetection(synthetic, true, found));
        }

        while (peaks.size() > expected) {
            int weakest = 0;
            for (int i = 1; i < peaks.size(); i++) {
                if (peaks.get(i)[1] < peaks.get(weakest)[1]) weakest = i;
            }
            peaks.remove(weakest);
        }

        double[] positions = new double[expected];
        for (int i = 0; i < expected; i++) {
            positions[i] = peaks.get(i)[0];
        }
        log.debug("Detected transitions {} ({} peaks before pruning)", Arrays.toString(positions), found);
        return Optional.of(new StepDetection(positions, false, found));
    }

    /**
     * Each entry is {position, amplitude}, in segment order.
     */
    private List<double[]> findTransitions(Profile segment, double minSpacing, int width) {
        DerivativeSignal signal = derivative(segment, width);
        List<double[]> out = new ArrayList<>();
        double[] magnitude = signal.magnitude();
        if (magnitude.length < 3) {
            return out;
        }
        double density = (segment.size() - 1) / segment.span();
        int minDistance = (int) Math.max(1, Math.round(minSpacing * density));
        double floor = new Percentile().evaluate(magnitude, HEIGHT_PERCENTILE);

        for (int idx : PeakFinder.findPeaks(magnitude, floor, minDistance)) {
            out.add(new double[]{signal.positions()[idx], magnitude[idx]});
        }
        return out;
    }

    private static DerivativeSignal derivative(Profile segment, int width) {
        double[] y = segment.y();
        double[] x = segment.x();
        double[] smoothed = width > 1 ? SavitzkyGolay.smooth(y, width, 1) : y;
        double[] d = ProfileOps.diff(smoothed);

        int nonZero = 0;
        double minAbs = Double.POSITIVE_INFINITY;
        for (double v : d) {
            if (v != 0.0) {
                nonZero++;
                minAbs = Math.min(minAbs, Math.abs(v));
            }
        }
        double[] magnitude = new double[nonZero];
        double[] positions = new double[nonZero];
        int k = 0;
        for (int i = 0; i < d.length; i++) {
            if (d[i] != 0.0) {
                magnitude[k] = Math.abs(d[i]) / minAbs;
                positions[k] = 0.5 * (x[i] + x[i + 1]);
                k++;
            }
        }
        return new DerivativeSignal(magnitude, positions);
    }

    static double[] fallbackPositions(Profile segment, int expected, double minSpacing) {
        double span = segment.span();
        double extent = minSpacing > 0.0 ? Math.min(span, minSpacing * expected) : span;
        double direction = segment.isIncreasing() ? 1.0 : -1.0;
        double[] out = new double[expected];
        for (int i = 0; i < expected; i++) {
            out[i] = segment.first() + direction * extent * (i + 1) / expected;
        }
        return out;
    }

    private static int effectiveWidth(int requested, int length) {
        if (requested <= 1) return 1;
        int width = requested % 2 == 0 ? requested + 1 : requested;
        int maxOdd = length % 2 == 0 ? length - 1 : length;
        return Math.max(1, Math.min(width, maxOdd));
    }
}
