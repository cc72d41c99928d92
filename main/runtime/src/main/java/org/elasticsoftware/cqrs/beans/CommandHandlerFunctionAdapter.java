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

import org.elasticsoftware.cqrs.commands.CommandHandlerFunction;
import org.elasticsoftware.cqrs.events.CloudEvent;

import java.lang.reflect.Method;
import java.util.stream.Stream;

public class CommandHandlerFunctionAdapter<C, S> extends HandlerMethodAdapter implements CommandHandlerFunction<C, S> {

    public CommandHandlerFunctionAdapter(Object bean, Method method) {
        super(bean, method);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Stream<CloudEvent<?>> apply(C command, S state) {
        return (Stream<CloudEvent<?>>) invoke(command, state);
    }
}
