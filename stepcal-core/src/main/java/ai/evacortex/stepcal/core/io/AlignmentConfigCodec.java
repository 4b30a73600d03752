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
import ai.evacortex.stepcal.core.exceptions.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON form of {@link AlignmentConfig}. Fields missing from the input keep their default value.
 */
public class AlignmentConfigCodec {

    private final ObjectMapper mapper;

    public AlignmentConfigCodec() {
        this.mapper = new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public String toJson(AlignmentConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("failed to serialise " + config, e);
        }
    }

    public AlignmentConfig fromJson(String json) {
        try {
            JsonNode given = mapper.readTree(json);
            if (given == null || !given.isObject()) {
                throw new ConfigurationException("expected a JSON object");
            }
            ObjectNode merged = mapper.valueToTree(AlignmentConfig.defaults());
            merged.setAll((ObjectNode) given);
            return mapper.treeToValue(merged, AlignmentConfig.class);
        } catch (JsonProcessingException e) {
            if (e.getCause() instanceof ConfigurationException ce) {
                throw ce;
            }
            throw new ConfigurationException(e.getOriginalMessage(), e);
        }
    }
}
