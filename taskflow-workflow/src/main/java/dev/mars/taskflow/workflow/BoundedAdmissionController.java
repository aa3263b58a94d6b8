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

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Lock-guarded admission controller with a fixed number of slots.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class BoundedAdmissionController implements AdmissionController {

    private static final Logger logger = Logger.getLogger(BoundedAdmissionController.class.getName());

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Set<String>> runningByRun = new LinkedHashMap<>();
    private int runningCount;
    private int capacity;

    public BoundedAdmissionController(int capacity) {
        this.capacity = requirePositive(capacity);
    }

    @Override
    public boolean tryAcquire(String runId, String taskId) {
        lock.lock();
        try {
            Set<String> running = runningByRun.computeIfAbsent(runId, key -> new LinkedHashSet<>());
            if (running.contains(taskId)) {
                logger.fine("Admission refused for " + taskId + " in run " + runId + ": already running");
                return false;
            }
            if (runningCount >= capacity) {
                logger.fine("Admission refused for " + taskId + ": " + runningCount + "/" + capacity + " slots in use");
                if (running.isEmpty()) {
                    runningByRun.remove(runId);
                }
                return false;
            }
            running.add(taskId);
            runningCount++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(String runId, String taskId) {
        lock.lock();
        try {
            Set<String> running = runningByRun.get(runId);
            if (running != null && running.remove(taskId)) {
                runningCount--;
                if (running.isEmpty()) {
                    runningByRun.remove(runId);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getRunningCount() {
        lock.lock();
        try {
            return runningCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getCapacity() {
        lock.lock();
        try {
            return capacity;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> getRunningTasks() {
        lock.lock();
        try {
            Set<String> ids = new LinkedHashSet<>();
            runningByRun.values().forEach(ids::addAll);
            return Set.copyOf(ids);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setCapacity(int capacity) {
        int validated = requirePositive(capacity);
        lock.lock();
        try {
            this.capacity = validated;
        } finally {
            lock.unlock();
        }
        logger.info("Admission capacity set to " + validated);
    }

    private static int requirePositive(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1, got " + capacity);
        }
        return capacity;
    }

    @Override
    public String toString() {
        return "BoundedAdmissionController{running=" + getRunningCount() + ", capacity=" + getCapacity() + '}';
    }
}
