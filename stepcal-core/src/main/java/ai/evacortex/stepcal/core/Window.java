/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core;

/**
 * Active sub-range of a {@link Profile} in position units. Bounds may be given in either order.
 */
public record Window(double low, double high) {

    public static Window of(Profile profile) {
        return new Window(profile.minX(), profile.maxX());
    }

    public double lower() {
        return Math.min(low, high);
    }

    public double upper() {
        return Math.max(low, high);
    }

    public Window clampTo(Profile profile) {
        double lo = Math.max(lower(), profile.minX());
        double hi = Math.min(upper(), profile.maxX());
        return new Window(lo, hi);
    }

    public boolean contains(double position) {
        return position >= lower() && position <= upper();
    }
}
