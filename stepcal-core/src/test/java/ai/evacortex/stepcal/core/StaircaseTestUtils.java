/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core;

import ai.evacortex.stepcal.core.math.ProfileOps;

import java.util.Random;

/**
 * Utility class for creating synthetic staircase {@link Profile} instances for testing.
 */
public class StaircaseTestUtils {

    /** Transitions of the reference staircase used across tests. */
    public static final double[] TRANSITIONS = {2.0, 4.0, 6.0, 8.0};

    /** Decade levels of the reference staircase, one per plateau. */
    public static final double[] LEVELS = {1.0, 0.0, -1.0, -2.0, -3.0};

    /**
     * Staircase whose steps are tanh edges of the given width.
     *
     * @param from        first position
     * @param to          last position
     * @param samples     number of samples
     * @param transitions transition centres in ascending order
     * @param levels      plateau values, one more than transitions
     * @param width       tanh edge width
     */
    public static Profile smoothStaircase(double from, double to, int samples,
                                          double[] transitions, double[] levels, double width) {
        double[] x = ProfileOps.linspace(from, to, samples);
        double[] y = new double[samples];
        for (int i = 0; i < samples; i++) {
            double v = levels[0];
            for (int k = 0; k < transitions.length; k++) {
                v += (levels[k + 1] - levels[k]) * 0.5 * (1.0 + Math.tanh((x[i] - transitions[k]) / width));
            }
            y[i] = v;
        }
        return new Profile(x, y);
    }

    /**
     * Staircase with ideal jumps: a sample takes the level of the plateau its position falls in.
     */
    public static Profile sharpStaircase(double from, double to, int samples, double[] transitions, double[] levels) {
        double[] x = ProfileOps.linspace(from, to, samples);
        double[] y = new double[samples];
        for (int i = 0; i < samples; i++) {
            int k = 0;
            while (k < transitions.length && x[i] > transitions[k]) k++;
            y[i] = levels[k];
        }
        return new Profile(x, y);
    }

    /**
     * Adds uniform noise in {@code [-amplitude, amplitude]} to the values.
     */
    public static Profile withNoise(Profile profile, double amplitude, long seed) {
        Random r = new Random(seed);
        double[] y = profile.y();
        for (int i = 0; i < y.length; i++) {
            y[i] += (2.0 * r.nextDouble() - 1.0) * amplitude;
        }
        return new Profile(profile.x(), y);
    }

    /**
     * Reference calibration: {@link #LEVELS} over {@code [0, 10]}, 1001 samples, edge width 0.05.
     */
    public static Profile referenceCalibration() {
        return smoothStaircase(0.0, 10.0, 1001, TRANSITIONS, LEVELS, 0.05);
    }

    /**
     * Measurement of the reference staircase seen through {@code x' = stretch * x + shift} with
     * values {@code offset + gain * level}, sampled over {@code [0, 11]} with 1101 samples.
     */
    public static Profile referenceMeasurement(double stretch, double shift, double offset, double gain) {
        double[] transitions = new double[TRANSITIONS.length];
        for (int i = 0; i < transitions.length; i++) {
            transitions[i] = stretch * TRANSITIONS[i] + shift;
        }
        double[] levels = new double[LEVELS.length];
        for (int i = 0; i < levels.length; i++) {
            levels[i] = offset + gain * LEVELS[i];
        }
        return smoothStaircase(0.0, 11.0, 1101, transitions, levels, 0.05 * stretch);
    }
}
