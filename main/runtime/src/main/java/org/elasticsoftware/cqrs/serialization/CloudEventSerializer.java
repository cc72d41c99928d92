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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.elasticsoftware.cqrs.events.CloudEvent;

import java.io.IOException;
import java.util.Map;

@SuppressWarnings("rawtypes")
public class CloudEventSerializer extends StdSerializer<CloudEvent> {

    public CloudEventSerializer() {
        super(CloudEvent.class);
    }

    @Override
    public void serialize(CloudEvent event, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("specversion", event.specversion() != null ? event.specversion() : CloudEvent.SPEC_VERSION);
        writeIfPresent(gen, "id", event.id());
        writeIfPresent(gen, "source", event.source());
        gen.writeStringField("type", event.type());
        gen.writeStringField("subject", event.subject());
        if (event.time() != null) {
            gen.writeStringField("time", event.time().toString());
        }
        // extension attributes live next to the context attributes
        for (Object entry : event.extensions().entrySet()) {
            Map.Entry<?, ?> extension = (Map.Entry<?, ?>) entry;
            gen.writeFieldName(extension.getKey().toString());
            provider.defaultSerializeValue(extension.getValue(), gen);
        }
        if (event.data() != null) {
            gen.writeFieldName("data");
            provider.defaultSerializeValue(event.data(), gen);
        }
        gen.writeEndObject();
    }

    private static void writeIfPresent(JsonGenerator gen, String name, String value) throws IOException {
        if (value != null) {
            gen.writeStringField(name, value);
        }
    }
}
