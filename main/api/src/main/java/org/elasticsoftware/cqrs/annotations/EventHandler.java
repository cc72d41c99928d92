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

package org.elasticsoftware.cqrs.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The method must accept {@code (CloudEvent<T> event, Object state)} and return either {@code void} or a
 * {@code CompletionStage<Void>}. Event handlers are not scoped by the enclosing {@link DomainContext}.
 * <p>
 * Several handlers for the same event type within one bean are invoked in the alphabetical order of their
 * method names, not in source order. Java reflection does not expose the declaration order.
 */
@Target({ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface EventHandler {
    String value();

    /**
     * The class the event payload is converted to before the handler is invoked.
     */
    Class<?> dataClass() default Object.class;
}
