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
import ai.evacortex.stepcal.core.math.ProfileOps;

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Matched (measured, calibration) anchor values, ordered by calibration value in the
 * direction of the calibration kind.
 */
public final class AnchorPointSet {

    private final double[] measured;
    private final double[] calibration;
    private final double[] positions;

    private AnchorPointSet(double[] measured, double[] calibration, double[] positions) {
        this.measured = measured;
        this.calibration = calibration;
        this.positions = positions;
    }

    /**
     * Pairs every anchor with the measurement value at the nearest measurement position.
     *
     * @throws AmbiguousAnchorsException if two anchors carry the same calibration value
     */
    public static AnchorPointSet match(List<Anchor> anchors, Profile measurement, CalibrationKind kind) {
        double[] values = anchors.stream().mapToDouble(Anchor::value).toArray();
        double[] pos = anchors.stream().mapToDouble(Anchor::position).toArray();
        double[] meas = ProfileOps.counterpart(measurement, pos);
        return of(meas, values, pos, kind);
    }

    public static AnchorPointSet of(double[] measured, double[] calibration, double[] positions, CalibrationKind kind) {
        if (measured.length != calibration.length || positions.length != calibration.length) {
            throw new IllegalArgumentException("anchor arrays must have equal length");
        }
        if (calibration.length < 2) {
            throw new DegenerateInputException("at least 2 anchors are required, got " + calibration.length);
        }
        Set<Double> seen = new HashSet<>();
        for (double c : calibration) {
            if (!seen.add(c)) {
                throw new AmbiguousAnchorsException(c);
            }
        }

        Comparator<Integer> byValue = Comparator.comparingDouble(i -> calibration[i]);
        if (kind.descending()) byValue = byValue.reversed();
        int[] order = IntStream.range(0, calibration.length).boxed().sorted(byValue).mapToInt(Integer::intValue).toArray();

        double[] m = new double[order.length];
        double[] c = new double[order.length];
        double[] p = new double[order.length];
        for (int i = 0; i < order.length; i++) {
            m[i] = measured[order[i]];
            c[i] = calibration[order[i]];
            p[i] = positions[order[i]];
        }
        return new AnchorPointSet(m, c, p);
    }

    public double[] measured() {
        return measured.clone();
    }

    public double[] calibration() {
        return calibration.clone();
    }

    public double[] positions() {
        return positions.clone();
    }

    public int size() {
        return calibration.length;
    }

    @Override
    public String toString() {
        return "AnchorPointSet{measured=" + Arrays.toString(measured)
                + ", calibration=" + Arrays.toString(calibration) + '}';
    }
}
