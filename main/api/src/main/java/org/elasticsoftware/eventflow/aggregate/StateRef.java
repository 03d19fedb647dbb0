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

package org.elasticsoftware.eventflow.aggregate;

/**
 * A loaded state together with the sequence number of the last event applied to it. The version is
 * the precondition of exactly one commit attempt, a retry needs a freshly loaded reference.
 */
public record StateRef<S>(String streamId, S state, long version) {
    public static final long NO_EVENTS = 0L;

    public boolean isNew() {
        return version == NO_EVENTS;
    }
}
