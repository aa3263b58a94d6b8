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

package dev.mars.taskflow.workflow;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Broadcast channel for the lifecycle events of one workflow run.
 *
 * <p>Create one publisher per run. {@link #publish(TaskEvent)} delivers to every
 * listener in subscription order before returning, and calls are serialised so that
 * listeners never observe concurrent deliveries even when tasks run in parallel.
 * A listener that throws is logged and skipped; the remaining listeners still receive
 * the event and the run is unaffected.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class TaskEventPublisher {

    private static final Logger logger = Logger.getLogger(TaskEventPublisher.class.getName());

    private final List<TaskEventListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(TaskEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    /**
     * @return true if the listener was subscribed
     */
    public boolean unsubscribe(TaskEventListener listener) {
        return listeners.remove(listener);
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public synchronized void publish(TaskEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        for (TaskEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Event listener failed on " + event + ": " + e.getMessage());
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Listener exception details for " + event, e);
                }
            }
        }
    }
}
