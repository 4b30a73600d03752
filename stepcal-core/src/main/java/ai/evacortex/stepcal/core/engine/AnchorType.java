/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.engine;

public enum AnchorType {
    /** Centre of a detected plateau. */
    PLATEAU,
    /** Literal first or last sample of the segment. */
    EDGE,
    /** Value inserted between two neighbouring anchors. */
    INTERMEDIATE,
    /** Value supplied by the user. */
    MANUAL
}
