/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.exceptions;

import ai.evacortex.stepcal.core.PipelineStage;

public class PipelineStateException extends RuntimeException {
    public PipelineStateException(PipelineStage required, PipelineStage current) {
        super("Stage " + required + " required, pipeline is at " + current);
    }
}
