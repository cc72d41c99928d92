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

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import org.elasticsoftware.cqrs.events.CloudEvent;

/**
 * Reads and writes {@link CloudEvent}s in the CloudEvents 1.0 structured JSON format.
 */
public class CloudEventsModule extends SimpleModule {
    public CloudEventsModule() {
        super("CloudEvents", Version.unknownVersion());
        addSerializer(new CloudEventSerializer());
        addDeserializer(CloudEvent.class, new CloudEventDeserializer());
    }
}
