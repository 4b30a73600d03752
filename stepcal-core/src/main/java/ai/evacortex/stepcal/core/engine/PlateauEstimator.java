/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.engine;

import ai.evacortex.stepcal.core.Profile;
import ai.evacortex.stepcal.core.exceptions.DegenerateInputException;
import ai.evacortex.stepcal.core.math.NearestPoint;
import ai.evacortex.stepcal.core.math.ProfileOps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns transition positions into calibration anchors.
 *
 * <p>Plateau anchors sit at the midpoints between consecutive boundaries, where the boundaries
 * are the segment start, the transitions and the segment end. Edge anchors, when requested,
 * are added in front of and behind them. Subdivision anchors are spaced evenly in value
 * between two neighbouring anchors and located among the samples that lie between them.</p>
 */
public final class PlateauEstimator {

    private static final Logger log = LoggerFactory.getLogger(PlateauEstimator.class);

    public List<Anchor> estimate(Profile segment, double[] transitions, PlateauOptions options) {
        double[] x = segment.x();
        double[] y = segment.y();

        double[] boundaries = new double[transitions.length + 2];
        boundaries[0] = segment.first();
        System.arraycopy(transitions, 0, boundaries, 1, transitions.length);
        boundaries[boundaries.length - 1] = segment.last();

        List<Anchor> base = new ArrayList<>();
        List<Integer> indices = new ArrayList<>();
        if (options.includeStartEdge()) {
            base.add(new Anchor(x[0], y[0], AnchorType.EDGE));
            indices.add(0);
        }
        for (int i = 0; i + 1 < boundaries.length; i++) {
            double centre = 0.5 * (boundaries[i] + boundaries[i + 1]);
            int idx = ProfileOps.nearestIndex(x, centre);
            base.add(new Anchor(centre, y[idx], AnchorType.PLATEAU));
            indices.add(idx);
        }
        if (options.includeEndEdge()) {
            base.add(new Anchor(x[x.length - 1], y[y.length - 1], AnchorType.EDGE));
            indices.add(x.length - 1);
        }

        List<Anchor> out = new ArrayList<>();
        for (int i = 0; i < base.size(); i++) {
            Anchor current = base.get(i);
            out.add(current);
            int count = options.subdivisionsAfter(i);
            if (count == 0 || i + 1 >= base.size()) continue;

            Anchor next = base.get(i + 1);
            double start = current.value();
            double height = Math.abs(next.value() - start);
            double sign = Math.signum(next.value() - start);
            for (int j = 0; j < count; j++) {
                double target = start + (j + 1) * sign * height / (count + 1);
                NearestPoint hit = ProfileOps.nearest(y, target, indices.get(i), indices.get(i + 1));
                out.add(new Anchor(x[hit.index()], target, AnchorType.INTERMEDIATE));
            }
        }
        log.debug("Estimated {} anchors from {} transitions", out.size(), transitions.length);
        return List.copyOf(out);
    }

    /**
     * Places user supplied calibration values at the position of the closest calibration sample.
     */
    public List<Anchor> locateManual(Profile calibration, double[] values) {
        if (values.length == 0) {
            throw new DegenerateInputException("no manual anchors supplied");
        }
        double[] x = calibration.x();
        double[] y = calibration.y();
        List<Anchor> out = new ArrayList<>(values.length);
        for (double v : values) {
            int idx = ProfileOps.nearestIndex(y, v);
            out.add(new Anchor(x[idx], v, AnchorType.MANUAL));
        }
        return List.copyOf(out);
    }
}
