/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.weave.workflow.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans events out to registered listeners in registration order.
 */
public class WorkflowEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowEventPublisher.class);

    private final List<WorkflowEventListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(WorkflowEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public boolean removeListener(WorkflowEventListener listener) {
        return listeners.remove(listener);
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public void publish(WorkflowEvent event) {
        logger.debug("Publishing {} for instance {}{}", event.type(), event.instanceId(),
                event.taskId() != null ? " task " + event.taskId() : "");
        for (WorkflowEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Workflow event listener failed on {} for instance {}: {}",
                        event.type(), event.instanceId(), e.getMessage());
            }
        }
    }
}
