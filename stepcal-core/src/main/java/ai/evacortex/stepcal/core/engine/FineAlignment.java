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

import java.util.List;

/**
 * @param best       candidate keeping the most transitions inside, lowest cost among those
 * @param candidates every evaluated candidate in extraction order
 */
public record FineAlignment(CandidateCost best, List<CandidateCost> candidates) {

    public FineAlignment {
        candidates = List.copyOf(candidates);
    }

    public AlignmentTransform transform() {
        return best.transform();
    }

    public double cost() {
        return best.cost();
    }
}
