/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.physics;

import ai.evacortex.stepcal.core.math.ProfileOps;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.util.Objects;

/**
 * Converts between carrier concentration and resistivity with the Masetti mobility model.
 *
 * <p>The forward direction is closed form: {@code rho = 1 / (q · N · mu(N))}. The inverse is
 * a lookup table of {@value #TABLE_SIZE} log-spaced concentrations spanning
 * {@code [0.5 · minN, 2 · maxN]}, interpolated in log-log space. Resistivities are clamped to
 * {@code [rho(maxN), rho(minN)]} before lookup, so out-of-range input maps to the boundary
 * concentration instead of being extrapolated.</p>
 */
public final class PhysicsConverter {

    public static final double ELEMENTARY_CHARGE = 1.6E-19;
    public static final double DEFAULT_MIN_N = 1E14;
    public static final double DEFAULT_MAX_N = 1E22;

    static final int TABLE_SIZE = 1000;

    private record TableKey(Dopant dopant, double minN, double maxN) {}

    private record LookupTable(double[] log10Rho, double[] log10N, double rhoLow, double rhoHigh) {}

    private static final LoadingCache<TableKey, LookupTable> TABLES = Caffeine.newBuilder()
            .maximumSize(32)
            .build(PhysicsConverter::buildTable);

    private final Dopant dopant;
    private final double minN;
    private final double maxN;

    public PhysicsConverter(Dopant dopant) {
        this(dopant, DEFAULT_MIN_N, DEFAULT_MAX_N);
    }

    public PhysicsConverter(Dopant dopant, double minN, double maxN) {
        this.dopant = Objects.requireNonNull(dopant, "dopant must not be null");
        if (!(minN > 0.0) || !(maxN > minN)) {
            throw new IllegalArgumentException("Concentration range must satisfy 0 < minN < maxN");
        }
        this.minN = minN;
        this.maxN = maxN;
    }

    public static PhysicsConverter forSymbol(String symbol) {
        return new PhysicsConverter(Dopant.fromSymbol(symbol));
    }

    public Dopant dopant() {
        return dopant;
    }

    public double mobility(double n) {
        return dopant.mobility(n);
    }

    public double concentrationToResistivity(double n) {
        return 1.0 / (n * dopant.mobility(n) * ELEMENTARY_CHARGE);
    }

    public double[] concentrationToResistivity(double[] n) {
        double[] out = new double[n.length];
        for (int i = 0; i < n.length; i++) {
            out[i] = concentrationToResistivity(n[i]);
        }
        return out;
    }

    public double resistivityToConcentration(double rho) {
        return resistivityToConcentration(new double[]{rho})[0];
    }

    public double[] resistivityToConcentration(double[] rho) {
        LookupTable table = TABLES.get(new TableKey(dopant, minN, maxN));
        double[] logRho = new double[rho.length];
        for (int i = 0; i < rho.length; i++) {
            double clamped = Math.max(table.rhoLow(), Math.min(table.rhoHigh(), rho[i]));
            logRho[i] = Math.log10(clamped);
        }
        double[] logN = ProfileOps.interpolate(table.log10Rho(), table.log10N(), logRho);
        double[] out = new double[logN.length];
        for (int i = 0; i < logN.length; i++) {
            out[i] = Math.pow(10.0, logN[i]);
        }
        return out;
    }

    /**
     * Decade-valued variant used on calibration data stored as {@code log10(rho)}.
     */
    public double[] log10ResistivityToLog10Concentration(double[] log10Rho) {
        double[] rho = new double[log10Rho.length];
        for (int i = 0; i < rho.length; i++) {
            rho[i] = Math.pow(10.0, log10Rho[i]);
        }
        double[] n = resistivityToConcentration(rho);
        for (int i = 0; i < n.length; i++) {
            n[i] = Math.log10(n[i]);
        }
        return n;
    }

    private static LookupTable buildTable(TableKey key) {
        double lo = Math.log10(key.minN() * 0.5);
        double hi = Math.log10(key.maxN() * 2.0);
        double[] logN = ProfileOps.linspace(lo, hi, TABLE_SIZE);
        double[] logRho = new double[TABLE_SIZE];
        PhysicsConverter probe = new PhysicsConverter(key.dopant(), key.minN(), key.maxN());
        for (int i = 0; i < TABLE_SIZE; i++) {
            logRho[i] = Math.log10(probe.concentrationToResistivity(Math.pow(10.0, logN[i])));
        }
        double rhoLow = probe.concentrationToResistivity(key.maxN());
        double rhoHigh = probe.concentrationToResistivity(key.minN());
        return new LookupTable(logRho, logN, rhoLow, rhoHigh);
    }
}
