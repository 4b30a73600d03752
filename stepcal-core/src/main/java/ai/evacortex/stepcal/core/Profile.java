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

import java.util.Arrays;
import java.util.Objects;

/**
 * A one-dimensional profile: positions {@code x} and values {@code y} of equal length.
 *
 * <p>Positions are monotonic, either increasing or decreasing. Both arrays are copied on
 * construction and on access, so no caller can alias the internal state.</p>
 */
public final class Profile {

    private final double[] x;
    private final double[] y;

    public Profile(double[] x, double[] y) {
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(y, "y must not be null");
        if (x.length != y.length) {
            throw new DegenerateInputException("position/value length mismatch: " + x.length + " vs " + y.length);
        }
        if (x.length < 2) {
            throw new DegenerateInputException("a profile needs at least 2 points, got " + x.length);
        }
        for (int i = 0; i < x.length; i++) {
            if (!Double.isFinite(x[i]) || !Double.isFinite(y[i])) {
                throw new DegenerateInputException("non-finite sample at index " + i);
            }
        }
        this.x = x.clone();
        this.y = y.clone();
    }

    /**
     * Builds a profile from an {@code n x 2} column array as delivered by file import.
     */
    public static Profile fromColumns(double[][] columns) {
        Objects.requireNonNull(columns, "columns must not be null");
        double[] x = new double[columns.length];
        double[] y = new double[columns.length];
        for (int i = 0; i < columns.length; i++) {
            if (columns[i] == null || columns[i].length < 2) {
                throw new DegenerateInputException("row " + i + " does not hold two columns");
            }
            x[i] = columns[i][0];
            y[i] = columns[i][1];
        }
        return new Profile(x, y);
    }

    public double[] x() {
        return x.clone();
    }

    public double[] y() {
        return y.clone();
    }

    public int size() {
        return x.length;
    }

    public double xAt(int i) {
        return x[i];
    }

    public double yAt(int i) {
        return y[i];
    }

    public double first() {
        return x[0];
    }

    public double last() {
        return x[x.length - 1];
    }

    public double minX() {
        return Math.min(first(), last());
    }

    public double maxX() {
        return Math.max(first(), last());
    }

    public double span() {
        return maxX() - minX();
    }

    public double minY() {
        return Arrays.stream(y).min().orElseThrow();
    }

    public double maxY() {
        return Arrays.stream(y).max().orElseThrow();
    }

    public boolean isIncreasing() {
        return last() >= first();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Profile)) return false;
        Profile other = (Profile) obj;
        return Arrays.equals(x, other.x) && Arrays.equals(y, other.y);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(x) * 31 + Arrays.hashCode(y);
    }

    @Override
    public String toString() {
        return String.format("Profile[n=%d, x=%.4g..%.4g]", x.length, first(), last());
    }
}
