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
import ai.evacortex.stepcal.core.exceptions.FitDivergenceException;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Fits the anchor offsets of a {@link CalibrationModel} to (measured, calibration) samples
 * with Levenberg-Marquardt, starting from the matched measurement anchors.
 */
public final class CalibrationCurveFitter {

    private static final Logger log = LoggerFactory.getLogger(CalibrationCurveFitter.class);

    static final double STEEPNESS = Double.parseDouble(System.getProperty("stepcal.model.steepness", "200"));
    static final int MAX_EVALUATIONS = Math.max(100, Integer.getInteger("stepcal.fit.maxEvaluations", 10_000));

    private static final double TOLERANCE = 1.0E-12;
    private static final double DIFF_STEP = Math.sqrt(Math.ulp(1.0));

    private final double steepness;

    public CalibrationCurveFitter() {
        this(STEEPNESS);
    }

    public CalibrationCurveFitter(double steepness) {
        if (!(steepness > 0.0) || Double.isInfinite(steepness)) {
            throw new IllegalArgumentException("steepness must be positive and finite, got " + steepness);
        }
        this.steepness = steepness;
    }

    /**
     * Model built straight from the anchors, without fitting.
     */
    public CalibrationModel initialModel(AnchorPointSet anchors) {
        return new CalibrationModel(initialGuess(anchors.measured()), anchors.calibration(), steepness);
    }

    /**
     * @param anchors     matched anchors, ordered by calibration direction
     * @param measured    measured value of every sample
     * @param calibration calibration value of every sample
     * @throws FitDivergenceException if the optimiser fails or produces non-finite offsets
     */
    public CalibrationModel fit(AnchorPointSet anchors, double[] measured, double[] calibration) {
        if (measured.length != calibration.length) {
            throw new IllegalArgumentException("measured and calibration samples must have equal length");
        }
        if (measured.length < anchors.size()) {
            throw new DegenerateInputException(measured.length + " samples cannot constrain " + anchors.size() + " anchors");
        }
        double[] targets = anchors.calibration();
        CalibrationModel initial = initialModel(anchors);
        double[] start = initial.offsets();
        log.debug("Fitting {} anchors to {} samples from {}", anchors.size(), measured.length, initial);

        MultivariateJacobianFunction model = point -> jacobian(point.toArray(), targets, measured);
        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(start)
                .target(calibration)
                .model(model)
                .lazyEvaluation(false)
                .maxEvaluations(MAX_EVALUATIONS)
                .maxIterations(MAX_EVALUATIONS)
                .build();
        LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer()
                .withCostRelativeTolerance(TOLERANCE)
                .withParameterRelativeTolerance(TOLERANCE);

        LeastSquaresOptimizer.Optimum optimum;
        try {
            optimum = optimizer.optimize(problem);
        } catch (MathIllegalStateException | MathIllegalArgumentException | MathArithmeticException e) {
            throw new FitDivergenceException(e.getMessage(), e);
        }

        double[] fitted = optimum.getPoint().toArray();
        for (double p : fitted) {
            if (!Double.isFinite(p)) {
                throw new FitDivergenceException("non-finite offsets " + Arrays.toString(fitted));
            }
        }
        if (!Double.isFinite(optimum.getRMS())) {
            throw new FitDivergenceException("non-finite residual");
        }
        CalibrationModel result;
        try {
            result = new CalibrationModel(fitted, targets, steepness);
        } catch (DegenerateInputException e) {
            throw new FitDivergenceException("fitted anchors collapsed", e);
        }
        log.debug("Fit finished after {} iterations, {} evaluations, rms={}",
                optimum.getIterations(), optimum.getEvaluations(), optimum.getRMS());
        log.info("Fitted measurement anchors {}", Arrays.toString(result.fittedMeasurementAnchors()));
        return result;
    }

    /**
     * First measured anchor followed by the consecutive differences.
     */
    static double[] initialGuess(double[] measuredAnchors) {
        double[] p = new double[measuredAnchors.length];
        p[0] = measuredAnchors[0];
        for (int i = 1; i < p.length; i++) {
            p[i] = measuredAnchors[i] - measuredAnchors[i - 1];
        }
        return p;
    }

    private Pair<RealVector, RealMatrix> jacobian(double[] params, double[] targets, double[] measured) {
        double[] base = values(params, targets, measured);
        double scale = 0.0;
        for (double p : params) scale = Math.max(scale, Math.abs(p));
        scale = Math.max(scale, 1.0E-300);

        double[][] jac = new double[measured.length][params.length];
        for (int j = 0; j < params.length; j++) {
            double[] shifted = params.clone();
            double h = DIFF_STEP * Math.max(Math.abs(params[j]), scale);
            shifted[j] += h;
            double[] moved = values(shifted, targets, measured);
            for (int i = 0; i < measured.length; i++) {
                jac[i][j] = (moved[i] - base[i]) / h;
            }
        }
        return new Pair<>(MatrixUtils.createRealVector(base), MatrixUtils.createRealMatrix(jac));
    }

    private double[] values(double[] params, double[] targets, double[] measured) {
        double[] out = new double[measured.length];
        for (int i = 0; i < measured.length; i++) {
            out[i] = CalibrationModel.evaluate(params, targets, steepness, measured[i]);
        }
        return out;
    }
}
