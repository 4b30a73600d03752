/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.engine;

import ai.evacortex.stepcal.core.exceptions.DegenerateInputException;

import java.util.Arrays;

/**
 * Smooth monotone map from measured values to calibration values.
 *
 * <p>The offsets define the measured anchor boundaries: {@code B_0 = p_0} and
 * {@code B_i = B_(i-1) + s * |p_i|} with {@code s} the sign of the summed offsets after the
 * first. Between neighbouring boundaries the map follows the straight line through
 * {@code (B_i, c_i)} and {@code (B_(i+1), c_(i+1))}; beyond the outer boundaries the first and
 * last lines are extended. The pieces are blended with tanh gates whose width is a fixed
 * fraction of the narrowest boundary gap, so the gates always sum to one.</p>
 */
public final class CalibrationModel {

    private final double[] offsets;
    private final double[] targets;
    private final double steepness;
    private final double[] boundaries;
    private final double sign;
    private final double gain;

    CalibrationModel(double[] offsets, double[] targets, double steepness) {
        if (offsets.length != targets.length) {
            throw new IllegalArgumentException("offsets and targets must have equal length");
        }
        if (offsets.length < 2) {
            throw new DegenerateInputException("a calibration model needs at least 2 anchors");
        }
        this.offsets = offsets.clone();
        this.targets = targets.clone();
        this.steepness = steepness;
        this.sign = direction(offsets);
        if (sign == 0.0) {
            throw new DegenerateInputException("measured anchors do not change: " + Arrays.toString(offsets));
        }
        this.boundaries = boundaries(offsets, sign);
        this.gain = steepness / minGap(offsets);
    }

    public double apply(double value) {
        return evaluate(boundaries, targets, sign, gain, value);
    }

    public double[] apply(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = apply(values[i]);
        }
        return out;
    }

    /**
     * Applies the map to every element of a 2D field; the result has the same shape.
     */
    public double[][] applyField(double[][] field) {
        double[][] out = new double[field.length][];
        for (int r = 0; r < field.length; r++) {
            out[r] = apply(field[r]);
        }
        return out;
    }

    /**
     * Same boundaries, different calibration values. No refit.
     */
    public CalibrationModel withTargets(double[] newTargets) {
        if (newTargets.length != targets.length) {
            throw new IllegalArgumentException("expected " + targets.length + " targets, got " + newTargets.length);
        }
        return new CalibrationModel(offsets, newTargets, steepness);
    }

    /** Measured value of every anchor, cumulative and in the direction of the fitted sign. */
    public double[] fittedMeasurementAnchors() {
        return boundaries.clone();
    }

    public double[] offsets() {
        return offsets.clone();
    }

    public double[] targets() {
        return targets.clone();
    }

    public double sign() {
        return sign;
    }

    public int size() {
        return targets.length;
    }

    static double evaluate(double[] offsets, double[] targets, double steepness, double value) {
        double s = direction(offsets);
        double gap = minGap(offsets);
        if (s == 0.0 || gap == 0.0) {
            return Double.NaN;
        }
        return evaluate(boundaries(offsets, s), targets, s, steepness / gap, value);
    }

    private static double evaluate(double[] b, double[] c, double s, double k, double v) {
        int n = b.length;
        double[] gate = new double[n];
        for (int i = 0; i < n; i++) {
            gate[i] = Math.tanh(k * s * (v - b[i]));
        }
        double f = 0.5 * (1.0 - gate[0]) * ramp(b, c, 0, v);
        for (int i = 0; i < n - 1; i++) {
            f += 0.5 * (gate[i] - gate[i + 1]) * ramp(b, c, i, v);
        }
        f += 0.5 * (1.0 + gate[n - 1]) * ramp(b, c, n - 2, v);
        return f;
    }

    private static double ramp(double[] b, double[] c, int i, double v) {
        return c[i] + (c[i + 1] - c[i]) * (v - b[i]) / (b[i + 1] - b[i]);
    }

    private static double direction(double[] offsets) {
        double sum = 0.0;
        for (int i = 1; i < offsets.length; i++) {
            sum += offsets[i];
        }
        return Math.signum(sum);
    }

    private static double[] boundaries(double[] offsets, double s) {
        double[] b = new double[offsets.length];
        b[0] = offsets[0];
        for (int i = 1; i < offsets.length; i++) {
            b[i] = b[i - 1] + s * Math.abs(offsets[i]);
        }
        return b;
    }

    private static double minGap(double[] offsets) {
        double gap = Double.POSITIVE_INFINITY;
        for (int i = 1; i < offsets.length; i++) {
            gap = Math.min(gap, Math.abs(offsets[i]));
        }
        return gap;
    }

    @Override
    public String toString() {
        return "CalibrationModel{anchors=" + Arrays.toString(boundaries) + ", targets=" + Arrays.toString(targets) + '}';
    }
}
