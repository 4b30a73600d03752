/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.engine;

import ai.evacortex.stepcal.core.exceptions.ConfigurationException;

/**
 * Parameters of the exhaustive (stretch, shift) search.
 *
 * @param minStretchPercent lower stretch bound, percent relative to 1
 * @param maxStretchPercent upper stretch bound, percent relative to 1
 * @param stretchResolution number of stretch values
 * @param shiftResolution   number of shift values
 * @param widen             search every shift where the whole calibration overlaps the measurement
 * @param filterWidth       smoothing width of the measurement derivative, below 2 disables smoothing
 * @param filterOrder       smoothing polynomial order
 */
public record GridSearchOptions(double minStretchPercent,
                                double maxStretchPercent,
                                int stretchResolution,
                                int shiftResolution,
                                boolean widen,
                                int filterWidth,
                                int filterOrder) {

    public GridSearchOptions {
        if (stretchResolution < 1 || shiftResolution < 1) {
            throw new ConfigurationException("resolutions must be positive");
        }
        if (minStretchPercent > maxStretchPercent) {
            throw new ConfigurationException("stretch window is inverted: " + minStretchPercent + " > " + maxStretchPercent);
        }
        if (1.0 + minStretchPercent / 100.0 <= 0.0) {
            throw new ConfigurationException("stretch must stay positive, min is " + minStretchPercent + "%");
        }
    }

    public double minStretch() {
        return 1.0 + minStretchPercent / 100.0;
    }

    public double maxStretch() {
        return 1.0 + maxStretchPercent / 100.0;
    }
}
