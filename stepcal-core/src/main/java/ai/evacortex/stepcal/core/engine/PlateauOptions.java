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
 * Anchor placement options.
 *
 * @param includeStartEdge add the first sample of the segment as an extra anchor
 * @param includeEndEdge   add the last sample of the segment as an extra anchor
 * @param subdivisions     number of intermediate anchors inserted after anchor {@code i};
 *                         missing entries count as zero
 */
public record PlateauOptions(boolean includeStartEdge, boolean includeEndEdge, int[] subdivisions) {

    public PlateauOptions {
        subdivisions = subdivisions == null ? new int[0] : subdivisions.clone();
        for (int s : subdivisions) {
            if (s < 0) {
                throw new IllegalArgumentException("subdivision count must be non-negative, got " + s);
            }
        }
    }

    public static PlateauOptions plateausOnly() {
        return new PlateauOptions(false, false, new int[0]);
    }

    @Override
    public int[] subdivisions() {
        return subdivisions.clone();
    }

    public int subdivisionsAfter(int anchorIndex) {
        return anchorIndex < subdivisions.length ? subdivisions[anchorIndex] : 0;
    }
}
