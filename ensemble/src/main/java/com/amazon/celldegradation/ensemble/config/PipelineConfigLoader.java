/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.celldegradation.ensemble.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.celldegradation.config.DetectorType;
import com.amazon.celldegradation.config.SmoothingMethod;
import com.amazon.celldegradation.exceptions.InvalidParameterException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * Reads a {@link PipelineConfig} from JSON. Keys are snake_case
 * ({@code smoothing_method}, {@code detector_configs}, {@code consensus_quorum},
 * {@code top_n}, ...), enum values are case insensitive, method and detector
 * names accept their usual aliases ("Savitzky-Golay", "LOF", ...), and unknown
 * keys are rejected. Malformed documents surface as
 * {@link InvalidParameterException}.
 */
public class PipelineConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "/default-pipeline.json";

    private final ObjectMapper mapper;

    public PipelineConfigLoader() {
        SimpleModule module = new SimpleModule("celldegradation");
        module.addDeserializer(SmoothingMethod.class, new SmoothingMethodDeserializer());
        module.addDeserializer(DetectorType.class, new DetectorTypeDeserializer());
        mapper = JsonMapper.builder().propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES).addModule(module).build();
    }

    public PipelineConfig fromJson(String json) {
        try {
            return mapper.readValue(json, PipelineConfig.class);
        } catch (JsonProcessingException e) {
            throw new InvalidParameterException("invalid pipeline configuration: " + e.getOriginalMessage(), e);
        }
    }

    public PipelineConfig load(InputStream input) throws IOException {
        try {
            return mapper.readValue(input, PipelineConfig.class);
        } catch (JsonProcessingException e) {
            throw new InvalidParameterException("invalid pipeline configuration: " + e.getOriginalMessage(), e);
        }
    }

    public PipelineConfig load(Path path) throws IOException {
        log.info("loading pipeline configuration from {}", path);
        try (InputStream input = Files.newInputStream(path)) {
            return load(input);
        }
    }

    /**
     * the configuration bundled with this module
     */
    public PipelineConfig loadDefault() throws IOException {
        try (InputStream input = PipelineConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new IOException("missing resource " + DEFAULT_RESOURCE);
            }
            return load(input);
        }
    }

    public String toJson(PipelineConfig config) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
    }

    static class SmoothingMethodDeserializer extends StdDeserializer<SmoothingMethod> {

        SmoothingMethodDeserializer() {
            super(SmoothingMethod.class);
        }

        @Override
        public SmoothingMethod deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            String text = parser.getValueAsString();
            SmoothingMethod method = SmoothingMethod.fromString(text);
            if (method == null) {
                return (SmoothingMethod) context.handleWeirdStringValue(SmoothingMethod.class, text,
                        "unknown smoothing method");
            }
            return method;
        }
    }

    static class DetectorTypeDeserializer extends StdDeserializer<DetectorType> {

        DetectorTypeDeserializer() {
            super(DetectorType.class);
        }

        @Override
        public DetectorType deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            String text = parser.getValueAsString();
            DetectorType type = DetectorType.fromString(text);
            if (type == null) {
                return (DetectorType) context.handleWeirdStringValue(DetectorType.class, text,
                        "unknown detector type");
            }
            return type;
        }
    }
}
