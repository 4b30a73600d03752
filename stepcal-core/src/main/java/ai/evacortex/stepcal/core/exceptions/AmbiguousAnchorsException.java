/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.exceptions;

/**
 * Thrown when two anchors share the same calibration value. The fit direction is then
 * undefined and the anchor configuration has to be changed by the caller.
 */
public class AmbiguousAnchorsException extends RuntimeException {

    private final double duplicateValue;

    public AmbiguousAnchorsException(double duplicateValue) {
        super("Duplicate calibration anchor value: " + duplicateValue
                + ". Exclude flat edges and/or reduce the number of anchors.");
        this.duplicateValue = duplicateValue;
    }

    public double getDuplicateValue() {
        return duplicateValue;
    }
}
