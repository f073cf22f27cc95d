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

package com.anomalydiagnostics.serialize;

import java.io.UncheckedIOException;

import lombok.Getter;
import lombok.Setter;

import com.anomalydiagnostics.returntypes.DiagnosticsResult;
import com.anomalydiagnostics.state.DiagnosticsResultMapper;
import com.anomalydiagnostics.state.DiagnosticsResultState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

/**
 * {@link DiagnosticsResult} serialization. Internally we use the
 * {@link DiagnosticsResultMapper} class to convert a result into a
 * corresponding state object, and we use
 * <a href="https://github.com/FasterXML/jackson">Jackson</a> to write the
 * state object as a JSON string. Property names are written in snake case so
 * that row fields carry the same names as the columns of the delimited output.
 * The object mapper is exposed so users can customize the output further.
 */
@Getter
public class DiagnosticsResultSerDe {

    private final DiagnosticsResultMapper mapper;
    private final ObjectMapper objectMapper;

    @Setter
    private boolean prettyPrint = false;

    /**
     * Constructor instantiating objects for default serialization.
     */
    public DiagnosticsResultSerDe() {
        this(new DiagnosticsResultMapper(), defaultObjectMapper());
    }

    /**
     * Create a SerDe instance using the provided mappers.
     *
     * @param mapper       A DiagnosticsResultMapper instance, used to convert a
     *                     result to a corresponding state object.
     * @param objectMapper An ObjectMapper that will be used to generate JSON for
     *                     a given {@link DiagnosticsResultState} object.
     */
    public DiagnosticsResultSerDe(DiagnosticsResultMapper mapper, ObjectMapper objectMapper) {
        this.mapper = mapper;
        this.objectMapper = objectMapper;
    }

    /**
     * @return an object mapper writing snake case property names and ignoring
     *         properties it does not know when reading
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return objectMapper;
    }

    /**
     * Serializes a result to a JSON string.
     *
     * @param result a detection result
     * @return a json string serialized from the result
     */
    public String toJson(DiagnosticsResult result) {
        DiagnosticsResultState state = mapper.toState(result);
        try {
            if (prettyPrint) {
                return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(state);
            }
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("unable to write diagnostics result as JSON", e);
        }
    }

    /**
     * Deserializes a JSON string written by {@link #toJson} back into a result.
     * Failures read back carry their error type and message but no cause.
     *
     * @param json a json string serialized from a result
     * @return the result
     */
    public DiagnosticsResult fromJson(String json) {
        DiagnosticsResultState state;
        try {
            state = objectMapper.readValue(json, DiagnosticsResultState.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("unable to read diagnostics result from JSON", e);
        }
        return mapper.toModel(state);
    }
}
