/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.engine;

import java.util.Objects;

/**
 * A calibration point: the position where {@code value} was read from the calibration profile.
 */
public record Anchor(double position, double value, AnchorType type) {

    public Anchor {
        Objects.requireNonNull(type, "type must not be null");
    }
}
