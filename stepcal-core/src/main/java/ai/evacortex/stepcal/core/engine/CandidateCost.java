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
 * One re-evaluated grid cell. {@code cost} is {@code +Infinity} and {@code transitionsInside}
 * zero when fewer than two plateaus fall inside the overlap of the two profiles.
 */
public record CandidateCost(int stretchIndex,
                            int shiftIndex,
                            AlignmentTransform transform,
                            double quality,
                            int transitionsInside,
                            double cost) {
}
