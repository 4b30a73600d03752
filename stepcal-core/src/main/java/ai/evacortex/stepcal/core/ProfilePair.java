/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core;

import java.util.Objects;

/**
 * Calibration and measurement profiles handled together, e.g. after trimming both to
 * their common position range.
 */
public record ProfilePair(Profile calibration, Profile measurement) {
    public ProfilePair {
        Objects.requireNonNull(calibration, "calibration must not be null");
        Objects.requireNonNull(measurement, "measurement must not be null");
    }
}
