/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core;

import ai.evacortex.stepcal.core.engine.Anchor;
import ai.evacortex.stepcal.core.engine.AnchorPointSet;
import ai.evacortex.stepcal.core.engine.CalibrationModel;
import ai.evacortex.stepcal.core.engine.FineAlignment;
import ai.evacortex.stepcal.core.engine.RoughAlignment;
import ai.evacortex.stepcal.core.engine.StepDetection;

import java.util.List;
import java.util.Objects;

/**
 * Outputs of the completed pipeline stages. Fields of stages that have not run are
 * {@code null}; replacing a stage's output drops everything downstream of it.
 *
 * @param config             settings the outputs were computed with
 * @param profiles           cropped and oriented calibration and measurement
 * @param steps              transitions of the prepared calibration
 * @param rough              grid search result
 * @param fine               refined alignment
 * @param anchors            calibration anchors on the aligned calibration
 * @param anchorPoints       anchors matched with measured values
 * @param samples            aligned (measured, calibration) pairs the model was fitted to
 * @param initialModel       model built from the anchors before fitting
 * @param model              fitted model
 * @param concentrationModel fitted model re-targeted to carrier concentration, if converted
 */
public record AlignmentResult(AlignmentConfig config,
                              ProfilePair profiles,
                              StepDetection steps,
                              RoughAlignment rough,
                              FineAlignment fine,
                              List<Anchor> anchors,
                              AnchorPointSet anchorPoints,
                              FitSamples samples,
                              CalibrationModel initialModel,
                              CalibrationModel model,
                              CalibrationModel concentrationModel) {

    public record FitSamples(double[] measured, double[] calibration) {
        public FitSamples {
            measured = measured.clone();
            calibration = calibration.clone();
        }

        @Override
        public double[] measured() {
            return measured.clone();
        }

        @Override
        public double[] calibration() {
            return calibration.clone();
        }
    }

    public AlignmentResult {
        Objects.requireNonNull(config, "config must not be null");
        anchors = anchors == null ? null : List.copyOf(anchors);
    }

    public static AlignmentResult empty(AlignmentConfig config) {
        return new AlignmentResult(config, null, null, null, null, null, null, null, null, null, null);
    }

    public static AlignmentResult imported(AlignmentConfig config, ProfilePair profiles, StepDetection steps) {
        return new AlignmentResult(config, profiles, steps, null, null, null, null, null, null, null, null);
    }

    public AlignmentResult withRough(RoughAlignment rough) {
        return new AlignmentResult(config, profiles, steps, rough, null, null, null, null, null, null, null);
    }

    public AlignmentResult withFine(FineAlignment fine) {
        return new AlignmentResult(config, profiles, steps, rough, fine, null, null, null, null, null, null);
    }

    public AlignmentResult withFit(List<Anchor> anchors, AnchorPointSet anchorPoints, FitSamples samples,
                                   CalibrationModel initialModel, CalibrationModel model) {
        return new AlignmentResult(config, profiles, steps, rough, fine, anchors, anchorPoints, samples,
                initialModel, model, null);
    }

    public AlignmentResult withConcentrationModel(CalibrationModel concentrationModel) {
        return new AlignmentResult(config, profiles, steps, rough, fine, anchors, anchorPoints, samples,
                initialModel, model, concentrationModel);
    }

    public PipelineStage stage() {
        if (model != null) return PipelineStage.FITTED;
        if (fine != null) return PipelineStage.FINE_ALIGNED;
        if (rough != null) return PipelineStage.ROUGH_ALIGNED;
        if (profiles != null) return PipelineStage.IMPORTED;
        return PipelineStage.NOT_STARTED;
    }

    /** Transform of the best available alignment, identity before the grid search. */
    public AlignmentTransform bestTransform() {
        if (fine != null) return fine.transform();
        if (rough != null) return rough.optimum();
        return AlignmentTransform.identity();
    }
}
