/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core;

import ai.evacortex.stepcal.core.engine.FineSearchOptions;
import ai.evacortex.stepcal.core.engine.GridSearchOptions;
import ai.evacortex.stepcal.core.engine.PlateauOptions;
import ai.evacortex.stepcal.core.exceptions.ConfigurationException;
import ai.evacortex.stepcal.core.physics.Dopant;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable settings of one calibration run.
 *
 * <p>Windows may be {@code null}, meaning the whole profile.</p>
 */
public record AlignmentConfig(
        int smoothingWidth,             // derivative filter width, odd
        int smoothingOrder,             // derivative filter polynomial order
        int stepSmoothingWidth,         // smoothing before step detection, below 2 disables it
        double minStretchPercent,
        double maxStretchPercent,
        int shiftResolution,
        int stretchResolution,
        boolean widenSearchArea,        // whole calibration extent instead of the step extent
        int fineCandidates,
        int stepCount,                  // number of plateaus
        double minStepDistance,         // position units
        boolean includeStartEdge,
        boolean includeEndEdge,
        int[] subdivisions,
        Dopant dopant,
        AnchorMode anchorMode,
        double[] manualAnchors,
        Window calibrationWindow,
        boolean calibrationFlipped,
        Window measurementWindow,
        boolean measurementFlipped,
        CalibrationKind calibrationKind,
        boolean logScale                // profile values are decades
) {

    public AlignmentConfig {
        subdivisions = subdivisions == null ? new int[0] : subdivisions.clone();
        manualAnchors = manualAnchors == null ? new double[0] : manualAnchors.clone();
        Objects.requireNonNull(dopant, "dopant must not be null");
        Objects.requireNonNull(anchorMode, "anchorMode must not be null");
        Objects.requireNonNull(calibrationKind, "calibrationKind must not be null");

        if (smoothingWidth < 1 || smoothingWidth % 2 == 0) {
            throw new ConfigurationException("smoothing width must be a positive odd number, got " + smoothingWidth);
        }
        if (smoothingOrder < 0 || (smoothingWidth > 1 && smoothingOrder >= smoothingWidth)) {
            throw new ConfigurationException("smoothing order " + smoothingOrder + " does not fit width " + smoothingWidth);
        }
        if (stepSmoothingWidth < 0) {
            throw new ConfigurationException("step smoothing width must not be negative");
        }
        if (stepCount < 2) {
            throw new ConfigurationException("at least 2 plateaus are required, got " + stepCount);
        }
        if (minStepDistance < 0.0) {
            throw new ConfigurationException("minimum step distance must not be negative");
        }
        if (anchorMode == AnchorMode.MANUAL && manualAnchors.length < 2) {
            throw new ConfigurationException("manual anchor mode needs at least 2 anchors");
        }
        for (int s : subdivisions) {
            if (s < 0) throw new ConfigurationException("subdivision counts must not be negative");
        }
        // the remaining ranges are checked by the option records
        gridOptions(minStretchPercent, maxStretchPercent, stretchResolution, shiftResolution,
                widenSearchArea, smoothingWidth, smoothingOrder);
        new FineSearchOptions(fineCandidates, smoothingWidth, smoothingOrder);
    }

    public static AlignmentConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    @Override
    public int[] subdivisions() {
        return subdivisions.clone();
    }

    @Override
    public double[] manualAnchors() {
        return manualAnchors.clone();
    }

    public GridSearchOptions gridOptions() {
        return gridOptions(minStretchPercent, maxStretchPercent, stretchResolution, shiftResolution,
                widenSearchArea, smoothingWidth, smoothingOrder);
    }

    public FineSearchOptions fineOptions() {
        return new FineSearchOptions(fineCandidates, smoothingWidth, smoothingOrder);
    }

    public PlateauOptions plateauOptions() {
        return new PlateauOptions(includeStartEdge, includeEndEdge, subdivisions);
    }

    private static GridSearchOptions gridOptions(double minPct, double maxPct, int stretchRes, int shiftRes,
                                                 boolean widen, int width, int order) {
        return new GridSearchOptions(minPct, maxPct, stretchRes, shiftRes, widen, width, order);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlignmentConfig that)) return false;
        return smoothingWidth == that.smoothingWidth
                && smoothingOrder == that.smoothingOrder
                && stepSmoothingWidth == that.stepSmoothingWidth
                && Double.compare(minStretchPercent, that.minStretchPercent) == 0
                && Double.compare(maxStretchPercent, that.maxStretchPercent) == 0
                && shiftResolution == that.shiftResolution
                && stretchResolution == that.stretchResolution
                && widenSearchArea == that.widenSearchArea
                && fineCandidates == that.fineCandidates
                && stepCount == that.stepCount
                && Double.compare(minStepDistance, that.minStepDistance) == 0
                && includeStartEdge == that.includeStartEdge
                && includeEndEdge == that.includeEndEdge
                && Arrays.equals(subdivisions, that.subdivisions)
                && dopant == that.dopant
                && anchorMode == that.anchorMode
                && Arrays.equals(manualAnchors, that.manualAnchors)
                && Objects.equals(calibrationWindow, that.calibrationWindow)
                && calibrationFlipped == that.calibrationFlipped
                && Objects.equals(measurementWindow, that.measurementWindow)
                && measurementFlipped == that.measurementFlipped
                && calibrationKind.equals(that.calibrationKind)
                && logScale == that.logScale;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(smoothingWidth, smoothingOrder, stepSmoothingWidth, minStretchPercent,
                maxStretchPercent, shiftResolution, stretchResolution, widenSearchArea, fineCandidates, stepCount,
                minStepDistance, includeStartEdge, includeEndEdge, dopant, anchorMode, calibrationWindow,
                calibrationFlipped, measurementWindow, measurementFlipped, calibrationKind, logScale);
        result = 31 * result + Arrays.hashCode(subdivisions);
        result = 31 * result + Arrays.hashCode(manualAnchors);
        return result;
    }

    @Override
    public String toString() {
        return "AlignmentConfig{stretch=[" + minStretchPercent + "%, " + maxStretchPercent + "%]"
                + ", resolution=" + stretchResolution + "x" + shiftResolution
                + ", steps=" + stepCount + ", minStepDistance=" + minStepDistance
                + ", filter=" + smoothingWidth + "/" + smoothingOrder
                + ", anchors=" + anchorMode + ", kind=" + calibrationKind.label()
                + ", dopant=" + dopant.symbol() + '}';
    }

    public static final class Builder {
        private int smoothingWidth = 3;
        private int smoothingOrder = 1;
        private int stepSmoothingWidth = 3;
        private double minStretchPercent = -5.0;
        private double maxStretchPercent = 5.0;
        private int shiftResolution = 1000;
        private int stretchResolution = 1000;
        private boolean widenSearchArea = false;
        private int fineCandidates = 50;
        private int stepCount = 5;
        private double minStepDistance = 0.3;
        private boolean includeStartEdge = false;
        private boolean includeEndEdge = false;
        private int[] subdivisions = new int[0];
        private Dopant dopant = Dopant.B;
        private AnchorMode anchorMode = AnchorMode.AUTOMATIC;
        private double[] manualAnchors = new double[0];
        private Window calibrationWindow;
        private boolean calibrationFlipped = false;
        private Window measurementWindow;
        private boolean measurementFlipped = false;
        private CalibrationKind calibrationKind = new CalibrationKind.Resistivity();
        private boolean logScale = true;

        private Builder() {}

        private Builder(AlignmentConfig c) {
            this.smoothingWidth = c.smoothingWidth;
            this.smoothingOrder = c.smoothingOrder;
            this.stepSmoothingWidth = c.stepSmoothingWidth;
            this.minStretchPercent = c.minStretchPercent;
            this.maxStretchPercent = c.maxStretchPercent;
            this.shiftResolution = c.shiftResolution;
            this.stretchResolution = c.stretchResolution;
            this.widenSearchArea = c.widenSearchArea;
            this.fineCandidates = c.fineCandidates;
            this.stepCount = c.stepCount;
            this.minStepDistance = c.minStepDistance;
            this.includeStartEdge = c.includeStartEdge;
            this.includeEndEdge = c.includeEndEdge;
            this.subdivisions = c.subdivisions;
            this.dopant = c.dopant;
            this.anchorMode = c.anchorMode;
            this.manualAnchors = c.manualAnchors;
            this.calibrationWindow = c.calibrationWindow;
            this.calibrationFlipped = c.calibrationFlipped;
            this.measurementWindow = c.measurementWindow;
            this.measurementFlipped = c.measurementFlipped;
            this.calibrationKind = c.calibrationKind;
            this.logScale = c.logScale;
        }

        public Builder smoothing(int width, int order) {
            this.smoothingWidth = width;
            this.smoothingOrder = order;
            return this;
        }

        public Builder stepSmoothingWidth(int width) {
            this.stepSmoothingWidth = width;
            return this;
        }

        public Builder stretchWindow(double minPercent, double maxPercent) {
            this.minStretchPercent = minPercent;
            this.maxStretchPercent = maxPercent;
            return this;
        }

        public Builder resolution(int stretch, int shift) {
            this.stretchResolution = stretch;
            this.shiftResolution = shift;
            return this;
        }

        public Builder widenSearchArea(boolean widen) {
            this.widenSearchArea = widen;
            return this;
        }

        public Builder fineCandidates(int count) {
            this.fineCandidates = count;
            return this;
        }

        public Builder steps(int count, double minDistance) {
            this.stepCount = count;
            this.minStepDistance = minDistance;
            return this;
        }

        public Builder edges(boolean start, boolean end) {
            this.includeStartEdge = start;
            this.includeEndEdge = end;
            return this;
        }

        public Builder subdivisions(int... counts) {
            this.subdivisions = counts.clone();
            return this;
        }

        public Builder dopant(Dopant dopant) {
            this.dopant = dopant;
            return this;
        }

        public Builder automaticAnchors() {
            this.anchorMode = AnchorMode.AUTOMATIC;
            return this;
        }

        public Builder manualAnchors(double... values) {
            this.anchorMode = AnchorMode.MANUAL;
            this.manualAnchors = values.clone();
            return this;
        }

        public Builder calibrationWindow(Window window, boolean flipped) {
            this.calibrationWindow = window;
            this.calibrationFlipped = flipped;
            return this;
        }

        public Builder measurementWindow(Window window, boolean flipped) {
            this.measurementWindow = window;
            this.measurementFlipped = flipped;
            return this;
        }

        public Builder calibrationKind(CalibrationKind kind) {
            this.calibrationKind = kind;
            return this;
        }

        public Builder logScale(boolean logScale) {
            this.logScale = logScale;
            return this;
        }

        public AlignmentConfig build() {
            return new AlignmentConfig(smoothingWidth, smoothingOrder, stepSmoothingWidth, minStretchPercent,
                    maxStretchPercent, shiftResolution, stretchResolution, widenSearchArea, fineCandidates, stepCount,
                    minStepDistance, includeStartEdge, includeEndEdge, subdivisions, dopant, anchorMode,
                    manualAnchors, calibrationWindow, calibrationFlipped, measurementWindow, measurementFlipped,
                    calibrationKind, logScale);
        }
    }
}
