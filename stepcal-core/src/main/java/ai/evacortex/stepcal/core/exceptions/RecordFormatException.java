/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.exceptions;

public class RecordFormatException extends RuntimeException {
    public RecordFormatException(String message) {
        super("Invalid calibration record: " + message);
    }

    public RecordFormatException(String message, Throwable cause) {
        super("Invalid calibration record: " + message, cause);
    }
}
