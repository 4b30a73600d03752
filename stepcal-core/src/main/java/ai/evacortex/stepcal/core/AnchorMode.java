/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core;

public enum AnchorMode {
    /** Anchors at plateau centres, optional edges and subdivisions. */
    AUTOMATIC,
    /** User supplied calibration values. */
    MANUAL
}
