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

package org.elasticsoftware.eventflow.handlers;

/**
 * Handles one inbound message against the current state of a stream. The handler declares events
 * through {@link HandlerContext#append} and does not commit them itself. After a version conflict the
 * whole handler runs again against freshly loaded state, so it must not cause externally visible
 * side effects, use {@link HandlerContext#publish} which is only released after a successful commit.
 */
@FunctionalInterface
public interface MessageHandler<M, S> {
    void handle(M message, HandlerContext<S> context) throws Exception;
}
