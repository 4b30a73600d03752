/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.exceptions;

public class AlignmentRefinementException extends RuntimeException {
    public AlignmentRefinementException(String message) {
        super("Fine alignment aborted: " + message);
    }

    public AlignmentRefinementException(String message, Throwable cause) {
        super("Fine alignment aborted: " + message, cause);
    }
}
