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

import org.elasticsoftware.eventflow.annotations.DomainEventInfo;
import org.elasticsoftware.eventflow.events.DomainEvent;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DomainEventTypeTest {
    @DomainEventInfo(type = "AccountCreated", version = 2)
    record AccountCreatedEvent(String accountId) implements DomainEvent {
    }

    record UnannotatedEvent(String accountId) implements DomainEvent {
    }

    @Test
    void testTypeFromAnnotation() {
        DomainEventType<AccountCreatedEvent> type = DomainEventType.of(AccountCreatedEvent.class);

        assertEquals("AccountCreated", type.typeName());
        assertEquals(2, type.version());
        assertEquals(AccountCreatedEvent.class, type.typeClass());
    }

    @Test
    void testMissingAnnotationIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DomainEventType.of(UnannotatedEvent.class));
    }

    @Test
    void testNewStreamHasNoEvents() {
        assertTrue(new StateRef<>("123", "state", StateRef.NO_EVENTS).isNew());
        assertFalse(new StateRef<>("123", "state", 3L).isNew());
    }
}
