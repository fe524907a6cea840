/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.palantir.billing.serde;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.io.ByteStreams;
import com.palantir.billing.RequestBody;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.LinkedHashMap;
import java.util.OptionalLong;
import javax.annotation.Nullable;

/** JSON encoding of request payloads and decoding of response bodies. */
public final class Encodings {

    public static final String JSON_CONTENT_TYPE = "application/json";

    private static final ObjectMapper JSON_MAPPER = configure(new ObjectMapper());

    private Encodings() {}

    /**
     * Serializes {@code payload} as a JSON object. A {@code null} or empty payload produces {@code {}}, a top-level
     * sequence produces an object keyed by index, and values which do not serialize to a JSON object or array
     * are rejected.
     */
    public static RequestBody jsonObject(@Nullable Object payload) {
        ObjectNode object = toObjectNode(payload);
        try {
            return new JsonRequestBody(JSON_MAPPER.writeValueAsBytes(object));
        } catch (JsonProcessingException e) {
            throw new SafeIllegalArgumentException("Failed to serialize request payload", e);
        }
    }

    /**
     * Decodes a JSON response body into plain Java values: maps (in document order), lists, strings, numbers and
     * booleans. An empty body decodes to an empty map. The stream is closed.
     */
    public static Object decode(InputStream body) throws IOException {
        try (InputStream input = body) {
            byte[] bytes = ByteStreams.toByteArray(input);
            if (isBlank(bytes)) {
                return new LinkedHashMap<String, Object>();
            }
            Object value = JSON_MAPPER.readValue(bytes, Object.class);
            return value == null ? new LinkedHashMap<String, Object>() : value;
        }
    }

    static ObjectNode toObjectNode(@Nullable Object payload) {
        if (payload == null) {
            return JSON_MAPPER.createObjectNode();
        }
        JsonNode tree = JSON_MAPPER.valueToTree(payload);
        if (tree == null || tree.isNull() || tree.isMissingNode()) {
            return JSON_MAPPER.createObjectNode();
        }
        if (tree.isObject()) {
            return (ObjectNode) tree;
        }
        if (tree.isArray()) {
            ObjectNode indexed = JSON_MAPPER.createObjectNode();
            ArrayNode array = (ArrayNode) tree;
            for (int i = 0; i < array.size(); i++) {
                indexed.set(Integer.toString(i), array.get(i));
            }
            return indexed;
        }
        throw new SafeIllegalArgumentException(
                "Request payload must serialize to a JSON object", SafeArg.of("nodeType", tree.getNodeType()));
    }

    private static boolean isBlank(byte[] bytes) {
        for (byte b : bytes) {
            if (!Character.isWhitespace(b)) {
                return false;
            }
        }
        return true;
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        // Request bodies own their output stream lifecycle
        return mapper.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private static final class JsonRequestBody implements RequestBody {
        private final byte[] content;

        JsonRequestBody(byte[] content) {
            this.content = content;
        }

        @Override
        public void writeTo(OutputStream output) throws IOException {
            output.write(content);
        }

        @Override
        public String contentType() {
            return JSON_CONTENT_TYPE;
        }

        @Override
        public boolean repeatable() {
            return true;
        }

        @Override
        public OptionalLong contentLength() {
            return OptionalLong.of(content.length);
        }

        @Override
        public void close() {}

        @Override
        public String toString() {
            return "JsonRequestBody{contentLength=" + content.length + '}';
        }
    }
}
