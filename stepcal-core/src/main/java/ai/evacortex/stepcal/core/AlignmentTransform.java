/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core;

/**
 * Affine map {@code x' = m * x + t} applied to the calibration position axis.
 *
 * @param stretch multiplier m
 * @param shift   offset t
 */
public record AlignmentTransform(double stretch, double shift) {

    public static AlignmentTransform identity() {
        return new AlignmentTransform(1.0, 0.0);
    }

    public double apply(double position) {
        return stretch * position + shift;
    }

    public double[] apply(double[] positions) {
        double[] out = new double[positions.length];
        for (int i = 0; i < positions.length; i++) {
            out[i] = stretch * positions[i] + shift;
        }
        return out;
    }
}
