/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.io;

import ai.evacortex.stepcal.core.exceptions.RecordFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CalibrationRecordCodecTest {

    private final CalibrationRecordCodec codec = new CalibrationRecordCodec();

    private static CalibrationRecord sample(String version) {
        return new CalibrationRecord("04/03/2025 05:06F/data/run1.csv", "S1", "B", "n", 1,
                new double[][]{{0.5, 1e15}, {1.0, 1e17}}, 3.25,
                new double[]{0.5, 0.5}, new double[0], new double[]{1e15, 1e17},
                new double[]{0.52, 1.01}, version, "abc");
    }

    private static void assertSameContent(CalibrationRecord expected, CalibrationRecord actual) {
        assertEquals(expected.ident(), actual.ident());
        assertEquals(expected.sample(), actual.sample());
        assertEquals(expected.dopant(), actual.dopant());
        assertEquals(expected.carrier(), actual.carrier());
        assertEquals(expected.setting(), actual.setting());
        assertEquals(expected.dat().length, actual.dat().length);
        for (int i = 0; i < expected.dat().length; i++) {
            assertArrayEquals(expected.dat()[i], actual.dat()[i], 0.0);
        }
        assertEquals(expected.quality(), actual.quality());
        assertArrayEquals(expected.initialGuess(), actual.initialGuess(), 0.0);
        assertArrayEquals(expected.res(), actual.res(), 0.0);
        assertArrayEquals(expected.cc(), actual.cc(), 0.0);
        assertArrayEquals(expected.meas(), actual.meas(), 0.0);
        assertEquals(expected.version(), actual.version());
        assertEquals(expected.contentId(), actual.contentId());
    }

    @Test
    void jsonKeepsEveryField() {
        CalibrationRecord record = sample(CalibrationRecord.VERSION);
        String json = codec.toJson(record);
        assertTrue(json.contains("\"version\" : \"v0.5\""));
        assertSameContent(record, codec.fromJson(json));
    }

    @Test
    void otherVersionsAreRejected() {
        String json = codec.toJson(sample("v0.4"));
        RecordFormatException e = assertThrows(RecordFormatException.class, () -> codec.fromJson(json));
        assertTrue(e.getMessage().contains("v0.4"));
    }

    @Test
    void malformedJsonIsRejected() {
        assertThrows(RecordFormatException.class, () -> codec.fromJson("{\"ident\": "));
    }

    @Test
    void recordsRoundTripThroughFiles(@TempDir Path dir) {
        CalibrationRecord record = sample(CalibrationRecord.VERSION);
        Path file = dir.resolve("nested").resolve("s1.json");
        codec.write(file, record);
        assertSameContent(record, codec.read(file));
    }

    @Test
    void missingFileIsReported(@TempDir Path dir) {
        assertThrows(RecordFormatException.class, () -> codec.read(dir.resolve("absent.json")));
    }
}
