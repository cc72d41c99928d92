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

package org.elasticsoftware.cqrs.runtime;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

public final class EngineSettings {
    public static final String DEFAULT_SOURCE = "CQRS_DEFAULTSOURCE";
    private final AtomicReference<String> source;
    private final UnmatchedTypePolicy unknownCommandPolicy;
    private final UnmatchedTypePolicy unmatchedEventPolicy;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public EngineSettings(String source,
                          UnmatchedTypePolicy unknownCommandPolicy,
                          UnmatchedTypePolicy unmatchedEventPolicy,
                          Clock clock,
                          Supplier<String> idGenerator) {
        this.source = new AtomicReference<>(Objects.requireNonNull(source, "source is required"));
        this.unknownCommandPolicy = Objects.requireNonNull(unknownCommandPolicy);
        this.unmatchedEventPolicy = Objects.requireNonNull(unmatchedEventPolicy);
        this.clock = Objects.requireNonNull(clock);
        this.idGenerator = Objects.requireNonNull(idGenerator);
    }

    public EngineSettings(String source,
                          UnmatchedTypePolicy unknownCommandPolicy,
                          UnmatchedTypePolicy unmatchedEventPolicy) {
        this(source, unknownCommandPolicy, unmatchedEventPolicy, Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_SOURCE, UnmatchedTypePolicy.IGNORE, UnmatchedTypePolicy.IGNORE);
    }

    public String getSource() {
        return source.get();
    }

    public void setSource(String source) {
        this.source.set(Objects.requireNonNull(source, "source is required"));
    }

    public UnmatchedTypePolicy getUnknownCommandPolicy() {
        return unknownCommandPolicy;
    }

    public UnmatchedTypePolicy getUnmatchedEventPolicy() {
        return unmatchedEventPolicy;
    }

    public Clock getClock() {
        return clock;
    }

    public String nextId() {
        return idGenerator.get();
    }
}
