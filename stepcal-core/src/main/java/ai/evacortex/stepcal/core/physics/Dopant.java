/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.physics;

import ai.evacortex.stepcal.core.exceptions.ConfigurationException;

import java.util.Locale;

/**
 * Dopant species with their Masetti mobility parameters (mobilities in cm²/Vs,
 * concentrations in cm⁻³).
 */
public enum Dopant {

    AS("As", 52.2, 1417, 43.4, 9.68E16, 3.43E20, 0.680, 2.00, 0.0),
    P("P", 68.5, 1414, 56.1, 9.20E16, 3.41E20, 0.711, 1.98, 0.0),
    B("B", 44.9, 470.5, 29, 2.23E17, 6.1E20, 0.719, 2.00, 9.23E16);

    private final String symbol;
    private final double mu0;
    private final double muMax;
    private final double mu1;
    private final double cr;
    private final double cs;
    private final double alpha;
    private final double beta;
    private final double pc;

    Dopant(String symbol, double mu0, double muMax, double mu1,
           double cr, double cs, double alpha, double beta, double pc) {
        this.symbol = symbol;
        this.mu0 = mu0;
        this.muMax = muMax;
        this.mu1 = mu1;
        this.cr = cr;
        this.cs = cs;
        this.alpha = alpha;
        this.beta = beta;
        this.pc = pc;
    }

    public static Dopant fromSymbol(String symbol) {
        if (symbol != null) {
            String s = symbol.trim().toUpperCase(Locale.ROOT);
            for (Dopant d : values()) {
                if (d.symbol.toUpperCase(Locale.ROOT).equals(s)) return d;
            }
        }
        throw new ConfigurationException("dopant type must be B, P or As, got '" + symbol + "'");
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Masetti mobility at concentration {@code n}. Acceptors carry the additional
     * {@code exp(-Pc/N)} term on the low-concentration mobility.
     */
    public double mobility(double n) {
        double lattice = 1.0 + Math.pow(n / cr, alpha);
        double clustering = mu1 / (1.0 + Math.pow(cs / n, beta));
        if (pc > 0.0) {
            return mu0 * Math.exp(-pc / n) + muMax / lattice - clustering;
        }
        return mu0 + (muMax - mu0) / lattice - clustering;
    }
}
