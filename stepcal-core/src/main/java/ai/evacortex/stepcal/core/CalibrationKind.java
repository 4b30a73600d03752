/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * Physical quantity recorded by the calibration profile.
 *
 * <p>The kind fixes the direction in which anchors are ordered: concentration falls as the
 * measured resistance rises, so charge-carrier calibrations are ordered by descending value,
 * resistivity and custom quantities by ascending value.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CalibrationKind.ChargeCarrier.class, name = "charge-carrier"),
        @JsonSubTypes.Type(value = CalibrationKind.Resistivity.class, name = "resistivity"),
        @JsonSubTypes.Type(value = CalibrationKind.Custom.class, name = "custom")
})
public sealed interface CalibrationKind
        permits CalibrationKind.ChargeCarrier, CalibrationKind.Resistivity, CalibrationKind.Custom {

    boolean descending();

    String unit();

    String label();

    /** Setting code used by persisted calibration records (1, 2 or 3). */
    int settingCode();

    default boolean convertibleToConcentration() {
        return false;
    }

    record ChargeCarrier(String carrierType) implements CalibrationKind {
        public ChargeCarrier {
            Objects.requireNonNull(carrierType, "carrierType must not be null");
        }

        @Override
        public boolean descending() {
            return true;
        }

        @Override
        public String unit() {
            return "cm^-3";
        }

        @Override
        public String label() {
            return carrierType + " charge carrier concentration";
        }

        @Override
        public int settingCode() {
            return 1;
        }
    }

    record Resistivity() implements CalibrationKind {
        @Override
        public boolean descending() {
            return false;
        }

        @Override
        public String unit() {
            return "Ohm cm";
        }

        @Override
        public String label() {
            return "SRP measured resistivity";
        }

        @Override
        public int settingCode() {
            return 2;
        }

        @Override
        public boolean convertibleToConcentration() {
            return true;
        }
    }

    record Custom(String denomination) implements CalibrationKind {
        public Custom {
            Objects.requireNonNull(denomination, "denomination must not be null");
        }

        @Override
        public boolean descending() {
            return false;
        }

        @Override
        public String unit() {
            return "";
        }

        @Override
        public String label() {
            return denomination;
        }

        @Override
        public int settingCode() {
            return 3;
        }
    }
}
