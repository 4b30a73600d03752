/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.engine;

/**
 * Coarse alignment quality indexed by {@code [stretchIndex][shiftIndex]}.
 * Carries the fingerprint of the profiles and steps it was computed from.
 */
public final class QualityMatrix {

    private final double[][] values;
    private final double[] stretches;
    private final double[] shifts;
    private final long fingerprint;

    QualityMatrix(double[][] values, double[] stretches, double[] shifts, long fingerprint) {
        this.values = values;
        this.stretches = stretches;
        this.shifts = shifts;
        this.fingerprint = fingerprint;
    }

    public double get(int stretchIndex, int shiftIndex) {
        return values[stretchIndex][shiftIndex];
    }

    public int rows() {
        return stretches.length;
    }

    public int columns() {
        return shifts.length;
    }

    public double stretchAt(int index) {
        return stretches[index];
    }

    public double shiftAt(int index) {
        return shifts[index];
    }

    public double[] stretches() {
        return stretches.clone();
    }

    public double[] shifts() {
        return shifts.clone();
    }

    public long fingerprint() {
        return fingerprint;
    }

    public double[][] copyValues() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }
}
