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

/**
 * @param quality     full quality matrix
 * @param optimum     mean transform over all cells sharing the best quality
 * @param bestQuality highest quality value
 * @param tiedCells   number of cells that share the best quality
 */
public record RoughAlignment(QualityMatrix quality, AlignmentTransform optimum, double bestQuality, int tiedCells) {
}
