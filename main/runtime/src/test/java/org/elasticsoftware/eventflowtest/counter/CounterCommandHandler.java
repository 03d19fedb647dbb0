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

package org.elasticsoftware.eventflowtest.counter;

import org.elasticsoftware.eventflow.handlers.HandlerContext;
import org.elasticsoftware.eventflow.handlers.MessageHandler;

public class CounterCommandHandler implements MessageHandler<CounterCommand, CounterState> {
    @Override
    public void handle(CounterCommand command, HandlerContext<CounterState> context) {
        if (command.delta() == 0) {
            return;
        }
        if (command.delta() > 0) {
            context.append(new IncrementedEvent(command.delta()));
        } else {
            context.append(new DecrementedEvent(-command.delta()));
        }
        context.publish(new CounterChanged(context.streamId(), context.state().total() + command.delta()));
    }
}
