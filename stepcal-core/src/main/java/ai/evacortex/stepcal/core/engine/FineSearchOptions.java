/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.engine;

import ai.evacortex.stepcal.core.exceptions.ConfigurationException;

/**
 * @param candidates     number of best grid cells re-evaluated
 * @param smoothingWidth smoothing width of the resampled calibration before spline fitting
 * @param smoothingOrder smoothing polynomial order
 */
public record FineSearchOptions(int candidates, int smoothingWidth, int smoothingOrder) {

    public FineSearchOptions {
        if (candidates < 1) {
            throw new ConfigurationException("fine candidate count must be positive, got " + candidates);
        }
    }
}
