/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.cqrs.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import org.elasticsoftware.cqrs.events.CloudEvent;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Produces a {@code CloudEvent<JsonNode>}; the payload is converted to the handler's type at dispatch time.
 * Top level attributes that are not CloudEvents context attributes end up in {@link CloudEvent#extensions()}.
 */
@SuppressWarnings("rawtypes")
public class CloudEventDeserializer extends StdDeserializer<CloudEvent> {
    public CloudEventDeserializer() {
        super(CloudEvent.class);
    }

    @Override
    public CloudEvent deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = ctxt.readTree(p);
        if (!node.isObject()) {
            return ctxt.reportInputMismatch(CloudEvent.class, "CloudEvent must be a JSON object");
        }
        String type = text(node, "type");
        if (type == null) {
            return ctxt.reportInputMismatch(CloudEvent.class, "Missing required CloudEvent attribute 'type'");
        }
        String subject = text(node, "subject");
        if (subject == null) {
            return ctxt.reportInputMismatch(CloudEvent.class, "Missing required CloudEvent attribute 'subject'");
        }
        Map<String, Object> extensions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!CloudEvent.CONTEXT_ATTRIBUTES.contains(field.getKey())) {
                extensions.put(field.getKey(), ctxt.readTreeAsValue(field.getValue(), Object.class));
            }
        }
        JsonNode data = node.get("data");
        return new CloudEvent<>(
                text(node, "id"),
                text(node, "source"),
                type,
                subject,
                parseTime(ctxt, text(node, "time")),
                text(node, "specversion"),
                data == null || data.isNull() ? null : data,
                extensions);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Instant parseTime(DeserializationContext ctxt, String time) throws IOException {
        if (time == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(time).toInstant();
        } catch (DateTimeParseException e) {
            return ctxt.reportInputMismatch(CloudEvent.class, "Invalid CloudEvent time '%s'", time);
        }
    }
}
