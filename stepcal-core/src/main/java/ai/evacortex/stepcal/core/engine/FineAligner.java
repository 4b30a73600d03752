/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.engine;

import ai.evacortex.stepcal.core.AlignmentTransform;
import ai.evacortex.stepcal.core.Profile;
import ai.evacortex.stepcal.core.ProfilePair;
import ai.evacortex.stepcal.core.exceptions.AlignmentRefinementException;
import ai.evacortex.stepcal.core.exceptions.DegenerateInputException;
import ai.evacortex.stepcal.core.math.ProfileOps;
import ai.evacortex.stepcal.core.math.SavitzkyGolay;
import ai.evacortex.stepcal.core.util.HashingUtil;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeMap;

/**
 * Re-ranks the best cells of a {@link QualityMatrix} by how well the calibration explains the
 * jumps of the measurement across plateau boundaries.
 *
 * <p>For a candidate transform the measurement is mapped onto calibration values through the
 * plateau anchors, split into plateau segments and interpolated per segment. Around every
 * boundary between two segments, from halfway back to the left plateau centre to halfway on
 * to the right one, the rise of the segment splines above the left centre is compared with
 * the rise of a spline through the calibration resampled onto the measurement positions.
 * The cost of a candidate is the mean squared difference, averaged over its boundaries.</p>
 *
 * <p>Candidates keeping more transitions inside the common range rank first, so dropping a
 * boundary never pays. Among equal counts the lowest cost wins; ties go to the earlier
 * candidate.</p>
 */
public final class FineAligner {

    private static final Logger log = LoggerFactory.getLogger(FineAligner.class);

    public FineAlignment refine(Profile calibration,
                                double[] steps,
                                Profile measurement,
                                RoughAlignment rough,
                                FineSearchOptions options,
                                CancellationToken token) {
        QualityMatrix quality = rough.quality();
        if (HashingUtil.fingerprint(calibration, measurement, steps) != quality.fingerprint()) {
            throw new AlignmentRefinementException("quality matrix was computed from different profiles");
        }

        List<CandidateCost> evaluated = new ArrayList<>();
        CandidateCost best = null;
        for (int[] cell : topCells(quality, options.candidates())) {
            token.throwIfCancelled("fine alignment");
            AlignmentTransform transform = new AlignmentTransform(quality.stretchAt(cell[0]), quality.shiftAt(cell[1]));
            Score score = score(calibration, steps, measurement, transform, options);
            CandidateCost candidate = new CandidateCost(cell[0], cell[1], transform,
                    quality.get(cell[0], cell[1]), score.transitions(), score.cost());
            evaluated.add(candidate);
            if (best == null || ranksAbove(candidate, best)) {
                best = candidate;
            }
        }

        if (best == null || Double.isInfinite(best.cost())) {
            throw new AlignmentRefinementException("no candidate keeps two plateaus inside the common range");
        }
        log.info("Fine alignment: stretch={}, shift={}, cost={}, transitions={} (best of {})",
                best.transform().stretch(), best.transform().shift(), best.cost(),
                best.transitionsInside(), evaluated.size());
        return new FineAlignment(best, evaluated);
    }

    static boolean ranksAbove(CandidateCost a, CandidateCost b) {
        if (a.transitionsInside() != b.transitionsInside()) {
            return a.transitionsInside() > b.transitionsInside();
        }
        return a.cost() < b.cost();
    }

    /**
     * Repeatedly takes the maximum of a copy of the matrix and removes it. Equal values are
     * taken in row-major order.
     */
    static List<int[]> topCells(QualityMatrix quality, int count) {
        double[][] values = quality.copyValues();
        int limit = Math.min(count, quality.rows() * quality.columns());
        List<int[]> out = new ArrayList<>(limit);
        for (int n = 0; n < limit; n++) {
            int bi = 0;
            int bj = 0;
            double bv = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < values.length; i++) {
                for (int j = 0; j < values[i].length; j++) {
                    if (values[i][j] > bv) {
                        bv = values[i][j];
                        bi = i;
                        bj = j;
                    }
                }
            }
            out.add(new int[]{bi, bj});
            values[bi][bj] = Double.NEGATIVE_INFINITY;
        }
        return out;
    }

    /**
     * Boundary mismatch of one candidate. An unusable candidate scores zero transitions and
     * an infinite cost.
     */
    record Score(int transitions, double cost) {
        static final Score UNUSABLE = new Score(0, Double.POSITIVE_INFINITY);
    }

    static Score score(Profile calibration, double[] steps, Profile measurement,
                       AlignmentTransform transform, FineSearchOptions options) {
        ProfilePair trimmed;
        try {
            trimmed = ProfileOps.commonRangeTrim(ProfileOps.transform(calibration, transform), measurement);
        } catch (DegenerateInputException e) {
            log.debug("Candidate {} leaves no overlap: {}", transform, e.getMessage());
            return Score.UNUSABLE;
        }
        Profile cal = trimmed.calibration();
        Profile meas = trimmed.measurement();
        if (!meas.isIncreasing()) {
            meas = ProfileOps.flip(meas);
        }

        double lo = Math.max(cal.minX(), meas.minX());
        double hi = Math.min(cal.maxX(), meas.maxX());
        double[] inside = Arrays.stream(transform.apply(steps))
                .filter(p -> p > lo && p < hi)
                .sorted()
                .toArray();
        if (inside.length < 1) {
            return Score.UNUSABLE;
        }

        double[] mx = meas.x();
        double[] my = meas.y();
        int n = mx.length;
        if (n < 3) {
            return Score.UNUSABLE;
        }

        double[] bounds = new double[inside.length + 2];
        bounds[0] = lo;
        System.arraycopy(inside, 0, bounds, 1, inside.length);
        bounds[bounds.length - 1] = hi;
        int segments = bounds.length - 1;
        int[] centres = new int[segments];
        double[] measAnchor = new double[segments];
        double[] calAnchor = new double[segments];
        double[] cx = cal.x();
        double[] cy = cal.y();
        for (int k = 0; k < segments; k++) {
            double centre = 0.5 * (bounds[k] + bounds[k + 1]);
            centres[k] = ProfileOps.nearestIndex(mx, centre);
            measAnchor[k] = my[centres[k]];
            calAnchor[k] = cy[ProfileOps.nearestIndex(cx, centre)];
        }
        double[][] map = anchorMap(measAnchor, calAnchor);

        double[] mapped = ProfileOps.interpolate(map[0], map[1], my);
        double calMin = cal.minY();
        double calMax = cal.maxY();
        try {
            PolynomialSplineFunction reference = calibrationSpline(cx, cy, mx, options);

            int[] starts = new int[segments + 1];
            starts[0] = 0;
            for (int k = 1; k < segments; k++) {
                starts[k] = firstIndexAtOrAbove(mx, inside[k - 1]);
            }
            starts[segments] = n;

            PolynomialSplineFunction[] local = new PolynomialSplineFunction[segments];
            for (int k = 0; k < segments; k++) {
                int from = starts[k];
                int to = Math.max(from, starts[k + 1]);
                if (to - from < 2) {
                    to = Math.min(n, from + 2);
                    from = Math.max(0, to - 2);
                }
                local[k] = segmentSpline(mx, mapped, from, to);
            }

            double total = 0.0;
            for (int k = 1; k < segments; k++) {
                int left = centres[k - 1];
                int boundary = starts[k];
                int right = Math.max(boundary, centres[k]);
                int from = Math.min(boundary, left + (boundary - left) / 2);
                int to = boundary + (right - boundary) / 2;
                double localBase = valueAt(local[k - 1], mx[left]);
                double refBase = clip(reference.value(mx[left]), calMin, calMax);
                double sum = 0.0;
                for (int i = from; i <= to; i++) {
                    PolynomialSplineFunction owner = i < boundary ? local[k - 1] : local[k];
                    double rise = valueAt(owner, mx[i]) - localBase;
                    double refRise = clip(reference.value(mx[i]), calMin, calMax) - refBase;
                    double d = rise - refRise;
                    sum += d * d;
                }
                total += sum / (to - from + 1);
            }
            return new Score(inside.length, total / inside.length);
        } catch (MathIllegalArgumentException e) {
            throw new AlignmentRefinementException("spline construction failed for " + transform, e);
        }
    }

    /**
     * Sorted unique measured anchor values and the mean calibration value of each.
     */
    private static double[][] anchorMap(double[] measured, double[] calibration) {
        TreeMap<Double, double[]> grouped = new TreeMap<>();
        for (int i = 0; i < measured.length; i++) {
            double[] acc = grouped.computeIfAbsent(measured[i], k -> new double[2]);
            acc[0] += calibration[i];
            acc[1] += 1.0;
        }
        double[] xs = new double[grouped.size()];
        double[] fs = new double[grouped.size()];
        int i = 0;
        for (var e : grouped.entrySet()) {
            xs[i] = e.getKey();
            fs[i] = e.getValue()[0] / e.getValue()[1];
            i++;
        }
        return new double[][]{xs, fs};
    }

    private static PolynomialSplineFunction calibrationSpline(double[] cx, double[] cy, double[] mx,
                                                              FineSearchOptions options) {
        double[] resampled = ProfileOps.interpolate(cx, cy, mx);
        int width = options.smoothingWidth();
        int maxOdd = mx.length % 2 == 0 ? mx.length - 1 : mx.length;
        width = Math.min(width % 2 == 0 ? width + 1 : width, maxOdd);
        if (width > 1 && options.smoothingOrder() < width) {
            resampled = SavitzkyGolay.smooth(resampled, width, options.smoothingOrder());
        }
        return new SplineInterpolator().interpolate(mx, resampled);
    }

    private static PolynomialSplineFunction segmentSpline(double[] x, double[] y, int from, int to) {
        double[] xs = Arrays.copyOfRange(x, from, to);
        double[] ys = Arrays.copyOfRange(y, from, to);
        if (xs.length < 3) {
            return new LinearInterpolator().interpolate(xs, ys);
        }
        return new SplineInterpolator().interpolate(xs, ys);
    }

    /**
     * Evaluates a segment spline, holding its end values outside the knot range.
     */
    private static double valueAt(PolynomialSplineFunction f, double x) {
        double[] knots = f.getKnots();
        return f.value(clip(x, knots[0], knots[knots.length - 1]));
    }

    private static int firstIndexAtOrAbove(double[] increasing, double value) {
        int idx = Arrays.binarySearch(increasing, value);
        return idx >= 0 ? idx : -idx - 1;
    }

    private static double clip(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
