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

/**
 * What to do when a command type has no handler, or an event type has no state rebuilder in the context
 * being replayed.
 */
public enum UnmatchedTypePolicy {
    /**
     * Skip silently. Unknown commands yield no state, unknown events leave the state unchanged.
     */
    IGNORE,
    /**
     * Skip, but log a warning.
     */
    WARN,
    /**
     * Fail the dispatch.
     */
    FAIL
}
