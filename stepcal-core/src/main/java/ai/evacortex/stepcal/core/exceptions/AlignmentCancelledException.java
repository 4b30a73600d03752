/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.exceptions;

public class AlignmentCancelledException extends RuntimeException {
    public AlignmentCancelledException(String stage) {
        super("Alignment cancelled during " + stage);
    }
}
