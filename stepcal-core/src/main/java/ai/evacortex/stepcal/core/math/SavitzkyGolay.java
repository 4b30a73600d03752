/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.math;

import ai.evacortex.stepcal.core.exceptions.ConfigurationException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Savitzky–Golay smoothing: a polynomial of degree {@code order} is least-squares fitted to
 * every odd-length window and evaluated at its centre. The first and last half windows are
 * evaluated on the polynomial fitted to the first and last full window.
 */
public final class SavitzkyGolay {

    private SavitzkyGolay() {}

    /**
     * @param window odd window length, at most {@code values.length}
     * @param order  polynomial degree, strictly smaller than {@code window}
     * @throws ConfigurationException if the window/order combination is invalid for the data
     */
    public static double[] smooth(double[] values, int window, int order) {
        validate(values.length, window, order);
        if (window == 1) {
            return values.clone();
        }

        int half = window / 2;
        RealMatrix pinv = pseudoInverse(window, order);
        double[] centre = pinv.getRow(0);

        int n = values.length;
        double[] out = new double[n];
        for (int i = half; i < n - half; i++) {
            double acc = 0.0;
            for (int j = 0; j < window; j++) {
                acc += centre[j] * values[i - half + j];
            }
            out[i] = acc;
        }

        double[] head = coefficients(pinv, values, 0, window);
        for (int i = 0; i < half; i++) {
            out[i] = evaluate(head, i - half);
        }
        double[] tail = coefficients(pinv, values, n - window, window);
        for (int i = n - half; i < n; i++) {
            out[i] = evaluate(tail, i - (n - 1 - half));
        }
        return out;
    }

    public static void validate(int length, int window, int order) {
        if (window < 1 || window % 2 == 0) {
            throw new ConfigurationException("filter width must be a positive odd number, got " + window);
        }
        if (order < 0 || (window > 1 && order >= window)) {
            throw new ConfigurationException("filter order " + order + " must be below filter width " + window);
        }
        if (window > length) {
            throw new ConfigurationException("filter width " + window + " exceeds segment length " + length);
        }
    }

    /**
     * Rows are polynomial coefficients c_0..c_order, columns the window samples.
     */
    private static RealMatrix pseudoInverse(int window, int order) {
        int half = window / 2;
        double[][] design = new double[window][order + 1];
        for (int i = 0; i < window; i++) {
            double r = i - half;
            double pow = 1.0;
            for (int j = 0; j <= order; j++) {
                design[i][j] = pow;
                pow *= r;
            }
        }
        RealMatrix a = MatrixUtils.createRealMatrix(design);
        return new QRDecomposition(a).getSolver().getInverse();
    }

    private static double[] coefficients(RealMatrix pinv, double[] values, int from, int window) {
        double[] slice = new double[window];
        System.arraycopy(values, from, slice, 0, window);
        return pinv.operate(slice);
    }

    private static double evaluate(double[] coefficients, double r) {
        double acc = 0.0;
        for (int j = coefficients.length - 1; j >= 0; j--) {
            acc = acc * r + coefficients[j];
        }
        return acc;
    }
}
