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
 * Transition positions found in a staircase segment, in segment order.
 *
 * @param positions   transition positions in the segment's position units
 * @param fallback    {@code true} when too few peaks were found and the positions were synthesised
 * @param peaksFound  number of peaks seen by the last detection attempt, before pruning
 */
public record StepDetection(double[] positions, boolean fallback, int peaksFound) {

    public StepDetection {
        positions = positions.clone();
    }

    @Override
    public double[] positions() {
        return positions.clone();
    }

    public int count() {
        return positions.length;
    }
}
