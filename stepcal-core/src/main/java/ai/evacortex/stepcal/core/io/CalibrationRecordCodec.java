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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * JSON form of {@link CalibrationRecord}. Only records of version {@value CalibrationRecord#VERSION}
 * are read.
 */
public class CalibrationRecordCodec {

    private final ObjectMapper mapper;

    public CalibrationRecordCodec() {
        this.mapper = new ObjectMapper();
    }

    public String toJson(CalibrationRecord record) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new RecordFormatException("failed to serialise " + record.ident(), e);
        }
    }

    public CalibrationRecord fromJson(String json) {
        try {
            return checkVersion(mapper.readValue(json, CalibrationRecord.class));
        } catch (JsonProcessingException e) {
            throw new RecordFormatException(e.getOriginalMessage(), e);
        }
    }

    public void write(Path path, CalibrationRecord record) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, record);
            }
        } catch (IOException e) {
            throw new RecordFormatException("failed to write " + path, e);
        }
    }

    public CalibrationRecord read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return checkVersion(mapper.readValue(in, CalibrationRecord.class));
        } catch (IOException e) {
            throw new RecordFormatException("failed to read " + path, e);
        }
    }

    private static CalibrationRecord checkVersion(CalibrationRecord record) {
        if (!CalibrationRecord.VERSION.equals(record.version())) {
            throw new RecordFormatException("unsupported version " + record.version()
                    + ", expected " + CalibrationRecord.VERSION);
        }
        return record;
    }
}
