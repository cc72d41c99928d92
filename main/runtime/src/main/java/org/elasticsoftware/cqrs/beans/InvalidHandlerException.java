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

package org.elasticsoftware.cqrs.beans;

import org.elasticsoftware.cqrs.CqrsException;
import org.elasticsoftware.cqrs.registry.HandlerKind;

import java.lang.reflect.Method;

public class InvalidHandlerException extends CqrsException {
    private final HandlerKind handlerKind;

    public InvalidHandlerException(HandlerKind handlerKind, String context, String type, Method method, String reason) {
        super(handlerKind.getDisplayName() + " method " + method.getDeclaringClass().getSimpleName() + "." + method.getName()
                + " is invalid: " + reason, context, type);
        this.handlerKind = handlerKind;
    }

    public HandlerKind getHandlerKind() {
        return handlerKind;
    }
}
