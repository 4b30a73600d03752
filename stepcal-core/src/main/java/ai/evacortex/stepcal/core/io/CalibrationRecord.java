/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.io;

import ai.evacortex.stepcal.core.AlignmentConfig;
import ai.evacortex.stepcal.core.AlignmentResult;
import ai.evacortex.stepcal.core.CalibrationKind;
import ai.evacortex.stepcal.core.PipelineStage;
import ai.evacortex.stepcal.core.engine.CalibrationModel;
import ai.evacortex.stepcal.core.exceptions.PipelineStateException;
import ai.evacortex.stepcal.core.util.HashingUtil;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Persisted outcome of one calibration, version {@value #VERSION}.
 *
 * @param ident        {@code dd/MM/yyyy HH:mm} creation time, {@code F}, data path
 * @param sample       calibration sample name
 * @param dopant       dopant symbol
 * @param carrier      carrier type of charge-carrier calibrations, otherwise {@code null}
 * @param setting      calibration setting code (1 carrier, 2 resistivity, 3 custom)
 * @param dat          aligned {measured, calibration} pairs the model was fitted to
 * @param quality      best coarse alignment quality
 * @param initialGuess initial model offsets
 * @param res          resistivity anchors, empty unless the calibration is a resistivity one
 * @param cc           concentration anchors, empty when unknown
 * @param meas         fitted measured anchors
 * @param version      record layout version
 * @param contentId    MD5 over the numeric content
 */
public record CalibrationRecord(String ident,
                                String sample,
                                String dopant,
                                String carrier,
                                int setting,
                                double[][] dat,
                                double quality,
                                double[] initialGuess,
                                double[] res,
                                double[] cc,
                                double[] meas,
                                String version,
                                String contentId) {

    public static final String VERSION = "v0.5";

    private static final DateTimeFormatter IDENT_TIME = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm");

    public CalibrationRecord {
        Objects.requireNonNull(ident, "ident must not be null");
        Objects.requireNonNull(version, "version must not be null");
    }

    public static CalibrationRecord from(AlignmentResult result, String sample, String dataPath, LocalDateTime createdAt) {
        if (result.stage() != PipelineStage.FITTED) {
            throw new PipelineStateException(PipelineStage.FITTED, result.stage());
        }
        AlignmentConfig config = result.config();
        CalibrationKind kind = config.calibrationKind();
        CalibrationModel model = result.model();

        double[] measured = result.samples().measured();
        double[] calibration = result.samples().calibration();
        double[][] dat = new double[measured.length][];
        for (int i = 0; i < measured.length; i++) {
            dat[i] = new double[]{measured[i], calibration[i]};
        }

        double[] res = new double[0];
        double[] cc = new double[0];
        String carrier = null;
        if (kind instanceof CalibrationKind.Resistivity) {
            res = model.targets();
            if (result.concentrationModel() != null) {
                cc = result.concentrationModel().targets();
            }
        } else if (kind instanceof CalibrationKind.ChargeCarrier chargeCarrier) {
            cc = model.targets();
            carrier = chargeCarrier.carrierType();
        }

        double[] initialGuess = result.initialModel().offsets();
        double[] fitted = model.fittedMeasurementAnchors();
        String contentId = HashingUtil.computeContentHash(measured, calibration, initialGuess, res, cc, fitted);
        String ident = createdAt.format(IDENT_TIME) + "F" + dataPath;
        return new CalibrationRecord(ident, sample, config.dopant().symbol(), carrier, kind.settingCode(), dat,
                result.rough().bestQuality(), initialGuess, res, cc, fitted, VERSION, contentId);
    }
}
