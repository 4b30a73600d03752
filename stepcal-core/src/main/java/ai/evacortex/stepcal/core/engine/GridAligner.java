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
import ai.evacortex.stepcal.core.exceptions.DegenerateInputException;
import ai.evacortex.stepcal.core.math.ProfileOps;
import ai.evacortex.stepcal.core.math.SavitzkyGolay;
import ai.evacortex.stepcal.core.util.HashingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exhaustive search for the stretch and shift that move the calibration transitions onto
 * the strongest slopes of the measurement.
 *
 * <p>For every grid cell the transformed transition positions are rounded onto a uniform axis
 * carrying the smoothed absolute derivative of the measurement; the cell's quality is the
 * sum of the derivative at those points. Transitions falling outside the measurement add
 * nothing.</p>
 */
public final class GridAligner {

    private static final Logger log = LoggerFactory.getLogger(GridAligner.class);

    static final int MAX_AXIS_POINTS = Math.max(16, Integer.getInteger("stepcal.grid.maxAxisPoints", 1_000_000));

    public RoughAlignment align(Profile calibration,
                                double[] steps,
                                Profile measurement,
                                GridSearchOptions options,
                                CancellationToken token) {
        if (steps.length == 0) {
            throw new DegenerateInputException("no calibration transitions to align");
        }
        if (options.filterWidth() > 1) {
            SavitzkyGolay.validate(measurement.size(), options.filterWidth(), options.filterOrder());
        }

        double[] stretches = ProfileOps.linspace(options.minStretch(), options.maxStretch(), options.stretchResolution());
        double[] shifts = shiftAxis(calibration, steps, measurement, stretches, options);

        double a = measurement.minX();
        double b = measurement.maxX();
        double shiftStep = shifts.length > 1
                ? (shifts[shifts.length - 1] - shifts[0]) / (shifts.length - 1)
                : (b - a) / (measurement.size() - 1);
        double[] axis = searchAxis(a, b, shiftStep, measurement.size());
        double axisStep = (b - a) / (axis.length - 1);
        double[] slope = ProfileOps.interpolate(derivativePositions(measurement),
                derivativeMagnitude(measurement, options), axis);
        log.debug("Grid {}x{}, shifts [{}, {}], axis {} points", stretches.length, shifts.length,
                shifts[0], shifts[shifts.length - 1], axis.length);

        double[][] quality = new double[stretches.length][shifts.length];
        double best = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < stretches.length; i++) {
            token.throwIfCancelled("grid alignment");
            double m = stretches[i];
            for (int j = 0; j < shifts.length; j++) {
                double t = shifts[j];
                double q = 0.0;
                for (double s : steps) {
                    double p = m * s + t;
                    if (p < a || p > b) continue;
                    int idx = (int) Math.round((p - a) / axisStep);
                    q += slope[Math.min(idx, slope.length - 1)];
                }
                quality[i][j] = q;
                if (q > best) best = q;
            }
        }

        double sumM = 0.0;
        double sumT = 0.0;
        int ties = 0;
        for (int i = 0; i < stretches.length; i++) {
            for (int j = 0; j < shifts.length; j++) {
                if (quality[i][j] == best) {
                    sumM += stretches[i];
                    sumT += shifts[j];
                    ties++;
                }
            }
        }
        AlignmentTransform optimum = new AlignmentTransform(sumM / ties, sumT / ties);
        long fingerprint = HashingUtil.fingerprint(calibration, measurement, steps);
        log.info("Rough alignment: stretch={}, shift={}, quality={} ({} tied cells)",
                optimum.stretch(), optimum.shift(), best, ties);
        return new RoughAlignment(new QualityMatrix(quality, stretches, shifts, fingerprint), optimum, best, ties);
    }

    /**
     * Shifts for which the transformed transitions lie inside the measurement for some stretch.
     * When the transitions are wider than the measurement, any overlap is accepted instead.
     * The widened search uses the whole calibration extent and accepts any overlap.
     */
    static double[] shiftAxis(Profile calibration, double[] steps, Profile measurement,
                              double[] stretches, GridSearchOptions options) {
        double a = measurement.minX();
        double b = measurement.maxX();
        double lowRef;
        double highRef;
        if (options.widen()) {
            lowRef = calibration.minX();
            highRef = calibration.maxX();
        } else {
            lowRef = Double.POSITIVE_INFINITY;
            highRef = Double.NEGATIVE_INFINITY;
            for (double s : steps) {
                lowRef = Math.min(lowRef, s);
                highRef = Math.max(highRef, s);
            }
        }

        double containLo = Double.POSITIVE_INFINITY;
        double containHi = Double.NEGATIVE_INFINITY;
        double overlapLo = Double.POSITIVE_INFINITY;
        double overlapHi = Double.NEGATIVE_INFINITY;
        for (double m : stretches) {
            containLo = Math.min(containLo, a - m * lowRef);
            containHi = Math.max(containHi, b - m * highRef);
            overlapLo = Math.min(overlapLo, a - m * highRef);
            overlapHi = Math.max(overlapHi, b - m * lowRef);
        }
        if (options.widen() || containLo > containHi) {
            return ProfileOps.linspace(overlapLo, overlapHi, options.shiftResolution());
        }
        return ProfileOps.linspace(containLo, containHi, options.shiftResolution());
    }

    private static double[] searchAxis(double a, double b, double step, int samples) {
        int count = step > 0.0 ? (int) Math.min(Integer.MAX_VALUE - 1L, Math.round((b - a) / step) + 1) : samples;
        count = Math.max(count, samples);
        count = Math.min(count, Math.max(MAX_AXIS_POINTS, samples));
        return ProfileOps.linspace(a, b, count);
    }

    private static double[] derivativePositions(Profile measurement) {
        double[] x = measurement.x();
        double[] mid = new double[x.length - 1];
        for (int i = 0; i < mid.length; i++) {
            mid[i] = 0.5 * (x[i] + x[i + 1]);
        }
        return mid;
    }

    private static double[] derivativeMagnitude(Profile measurement, GridSearchOptions options) {
        double[] y = options.filterWidth() > 1
                ? SavitzkyGolay.smooth(measurement.y(), options.filterWidth(), options.filterOrder())
                : measurement.y();
        double[] d = ProfileOps.diff(y);
        for (int i = 0; i < d.length; i++) {
            d[i] = Math.abs(d[i]);
        }
        return d;
    }
}
