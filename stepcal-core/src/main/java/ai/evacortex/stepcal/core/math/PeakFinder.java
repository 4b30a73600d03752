/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.math;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Local maxima search on a sampled signal.
 */
public final class PeakFinder {

    private PeakFinder() {}

    /**
     * Returns peak indices in ascending order.
     *
     * <p>A peak is a sample (or the middle of a flat run) strictly higher than its left
     * neighbour and higher than its right neighbour. Peaks below {@code minHeight} are
     * dropped. Among peaks closer than {@code minDistance} samples only the highest survives.</p>
     */
    public static int[] findPeaks(double[] signal, double minHeight, int minDistance) {
        List<Integer> candidates = new ArrayList<>();
        int n = signal.length;
        int i = 1;
        while (i < n - 1) {
            if (signal[i - 1] < signal[i]) {
                int ahead = i + 1;
                while (ahead < n - 1 && signal[ahead] == signal[i]) {
                    ahead++;
                }
                if (signal[ahead] < signal[i]) {
                    int peak = (i + ahead - 1) / 2;
                    if (signal[peak] >= minHeight) {
                        candidates.add(peak);
                    }
                    i = ahead;
                    continue;
                }
            }
            i++;
        }

        if (minDistance <= 1 || candidates.size() < 2) {
            return candidates.stream().mapToInt(Integer::intValue).toArray();
        }

        int[] peaks = candidates.stream().mapToInt(Integer::intValue).toArray();
        Integer[] byHeight = new Integer[peaks.length];
        for (int k = 0; k < peaks.length; k++) {
            byHeight[k] = k;
        }
        Arrays.sort(byHeight, Comparator.<Integer>comparingDouble(k -> signal[peaks[k]]).reversed());
        boolean[] removed = new boolean[peaks.length];
        List<Integer> kept = new ArrayList<>();
        for (int k : byHeight) {
            if (removed[k]) continue;
            kept.add(peaks[k]);
            // peaks is ascending: stop at the first neighbour minDistance or more away
            for (int q = k - 1; q >= 0 && peaks[k] - peaks[q] < minDistance; q--) {
                removed[q] = true;
            }
            for (int q = k + 1; q < peaks.length && peaks[q] - peaks[k] < minDistance; q++) {
                removed[q] = true;
            }
        }
        return kept.stream().mapToInt(Integer::intValue).sorted().toArray();
    }
}
