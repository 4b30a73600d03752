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
import ai.evacortex.stepcal.core.engine.CalibrationCurveFitter;
import ai.evacortex.stepcal.core.engine.CalibrationModel;
import ai.evacortex.stepcal.core.engine.CancellationToken;
import ai.evacortex.stepcal.core.engine.FineAligner;
import ai.evacortex.stepcal.core.engine.FineAlignment;
import ai.evacortex.stepcal.core.engine.GridAligner;
import ai.evacortex.stepcal.core.engine.PlateauEstimator;
import ai.evacortex.stepcal.core.engine.RoughAlignment;
import ai.evacortex.stepcal.core.engine.StepDetection;
import ai.evacortex.stepcal.core.engine.StepDetector;
import ai.evacortex.stepcal.core.exceptions.ConfigurationException;
import ai.evacortex.stepcal.core.exceptions.DegenerateInputException;
import ai.evacortex.stepcal.core.exceptions.PipelineStateException;
import ai.evacortex.stepcal.core.math.ProfileOps;
import ai.evacortex.stepcal.core.physics.PhysicsConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Runs the calibration stages in order: import, rough alignment, fine alignment, fit.
 *
 * <p>Every stage reads the current {@link AlignmentResult} and, on success, replaces it with a
 * new one. A stage that throws leaves the previous result and stage in place. Importing new
 * profiles or changing the configuration discards all alignment and fit results.</p>
 *
 * <p>Not thread-safe; cancellation tokens may be cancelled from other threads.</p>
 */
public final class CalibrationPipeline {

    private static final Logger log = LoggerFactory.getLogger(CalibrationPipeline.class);

    private final StepDetector stepDetector;
    private final PlateauEstimator plateauEstimator;
    private final GridAligner gridAligner;
    private final FineAligner fineAligner;
    private final CalibrationCurveFitter fitter;

    private Profile rawCalibration;
    private Profile rawMeasurement;
    private AlignmentResult result;

    public CalibrationPipeline(AlignmentConfig config) {
        this(config, new CalibrationCurveFitter());
    }

    public CalibrationPipeline(AlignmentConfig config, CalibrationCurveFitter fitter) {
        this.stepDetector = new StepDetector();
        this.plateauEstimator = new PlateauEstimator();
        this.gridAligner = new GridAligner();
        this.fineAligner = new FineAligner();
        this.fitter = Objects.requireNonNull(fitter, "fitter must not be null");
        this.result = AlignmentResult.empty(Objects.requireNonNull(config, "config must not be null"));
    }

    public PipelineStage stage() {
        return result.stage();
    }

    public boolean isCompleted(PipelineStage stage) {
        return result.stage().isAtLeast(stage);
    }

    public AlignmentResult result() {
        return result;
    }

    public AlignmentConfig config() {
        return result.config();
    }

    /**
     * Replaces the configuration. Imported profiles are prepared again under the new settings.
     */
    public AlignmentResult configure(AlignmentConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        if (rawCalibration != null) {
            result = prepare(config, rawCalibration, rawMeasurement);
        } else {
            result = AlignmentResult.empty(config);
        }
        return result;
    }

    public AlignmentResult importProfiles(Profile calibration, Profile measurement) {
        Objects.requireNonNull(calibration, "calibration must not be null");
        Objects.requireNonNull(measurement, "measurement must not be null");
        AlignmentResult next = prepare(result.config(), calibration, measurement);
        rawCalibration = calibration;
        rawMeasurement = measurement;
        result = next;
        return result;
    }

    public AlignmentResult roughAlign(CancellationToken token) {
        require(PipelineStage.IMPORTED);
        AlignmentConfig config = result.config();
        ProfilePair profiles = result.profiles();
        RoughAlignment rough = gridAligner.align(profiles.calibration(), result.steps().positions(),
                profiles.measurement(), config.gridOptions(), token);
        result = result.withRough(rough);
        return result;
    }

    public AlignmentResult fineAlign(CancellationToken token) {
        require(PipelineStage.ROUGH_ALIGNED);
        AlignmentConfig config = result.config();
        ProfilePair profiles = result.profiles();
        FineAlignment fine = fineAligner.refine(profiles.calibration(), result.steps().positions(),
                profiles.measurement(), result.rough(), config.fineOptions(), token);
        result = result.withFine(fine);
        return result;
    }

    public AlignmentResult fit() {
        require(PipelineStage.FINE_ALIGNED);
        AlignmentConfig config = result.config();
        AlignmentTransform transform = result.fine().transform();
        ProfilePair trimmed = ProfileOps.commonRangeTrim(
                ProfileOps.transform(result.profiles().calibration(), transform), result.profiles().measurement());
        Profile calibration = trimmed.calibration();
        Profile measurement = trimmed.measurement();

        List<Anchor> anchors;
        if (config.anchorMode() == AnchorMode.MANUAL) {
            anchors = plateauEstimator.locateManual(calibration, config.manualAnchors());
        } else {
            double[] transitions = transitionsInside(calibration, transform.apply(result.steps().positions()));
            anchors = plateauEstimator.estimate(calibration, transitions, config.plateauOptions());
        }
        AnchorPointSet points = AnchorPointSet.match(anchors, measurement, config.calibrationKind());
        double[] measured = ProfileOps.counterpart(measurement, calibration.x());

        CalibrationModel initial = fitter.initialModel(points);
        CalibrationModel model = fitter.fit(points, measured, calibration.y());
        result = result.withFit(anchors, points,
                new AlignmentResult.FitSamples(measured, calibration.y()), initial, model);
        log.info("Calibration fitted with {} anchors under {}", points.size(), transform);
        return result;
    }

    /**
     * Re-targets the fitted resistivity model to carrier concentration with the configured
     * dopant's mobility model.
     */
    public AlignmentResult convertToConcentration() {
        require(PipelineStage.FITTED);
        AlignmentConfig config = result.config();
        if (!config.calibrationKind().convertibleToConcentration()) {
            throw new ConfigurationException(config.calibrationKind().label() + " calibrations cannot be converted");
        }
        PhysicsConverter converter = new PhysicsConverter(config.dopant());
        double[] targets = result.model().targets();
        double[] converted = config.logScale()
                ? converter.log10ResistivityToLog10Concentration(targets)
                : converter.resistivityToConcentration(targets);
        result = result.withConcentrationModel(result.model().withTargets(converted));
        log.info("Converted anchors to {} concentration: {}", config.dopant().symbol(), Arrays.toString(converted));
        return result;
    }

    /**
     * Import followed by every stage up to the fit.
     */
    public AlignmentResult run(Profile calibration, Profile measurement, CancellationToken token) {
        importProfiles(calibration, measurement);
        roughAlign(token);
        fineAlign(token);
        return fit();
    }

    private AlignmentResult prepare(AlignmentConfig config, Profile calibration, Profile measurement) {
        Profile cal = ProfileOps.crop(calibration, windowOrWhole(config.calibrationWindow(), calibration),
                config.calibrationFlipped());
        Profile meas = ProfileOps.crop(measurement, windowOrWhole(config.measurementWindow(), measurement),
                config.measurementFlipped());
        StepDetection steps = stepDetector.detect(cal, config.stepCount(), config.minStepDistance(),
                        config.stepSmoothingWidth())
                .orElseThrow(() -> new DegenerateInputException("calibration profile has zero span"));
        log.info("Imported calibration ({} samples) and measurement ({} samples); {} transitions{}",
                cal.size(), meas.size(), steps.count(), steps.fallback() ? " (fallback)" : "");
        return AlignmentResult.imported(config, new ProfilePair(cal, meas), steps);
    }

    private static Window windowOrWhole(Window window, Profile profile) {
        return window != null ? window : Window.of(profile);
    }

    /**
     * Transitions strictly inside the profile's position range, in the profile's direction.
     */
    private static double[] transitionsInside(Profile profile, double[] transitions) {
        double lo = profile.minX();
        double hi = profile.maxX();
        double[] inside = Arrays.stream(transitions).filter(p -> p > lo && p < hi).sorted().toArray();
        return profile.isIncreasing() ? inside : ProfileOps.reverse(inside);
    }

    private void require(PipelineStage stage) {
        if (!result.stage().isAtLeast(stage)) {
            throw new PipelineStateException(stage, result.stage());
        }
    }
}
