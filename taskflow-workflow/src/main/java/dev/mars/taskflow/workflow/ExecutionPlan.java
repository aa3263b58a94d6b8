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
import java.util.stream.Collectors;

/**
 * Dry-run view of a validated workflow: the waves in which its tasks become ready.
 * Tasks within a wave do not depend on each other.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ExecutionPlan {

    private final List<List<String>> batches;
    private final ExecutionMode executionMode;

    public ExecutionPlan(List<List<String>> batches, ExecutionMode executionMode) {
        this.batches = batches.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
        this.executionMode = executionMode;
    }

    public List<List<String>> getBatches() {
        return batches;
    }

    public int getBatchCount() {
        return batches.size();
    }

    public int getTaskCount() {
        return batches.stream().mapToInt(List::size).sum();
    }

    /**
     * @return the size of the widest wave
     */
    public int getMaxParallelism() {
        return batches.stream().mapToInt(List::size).max().orElse(0);
    }

    /**
     * @return the mode the engine would run the workflow in
     */
    public ExecutionMode getExecutionMode() {
        return executionMode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ExecutionPlan{mode=").append(executionMode);
        for (int i = 0; i < batches.size(); i++) {
            sb.append(", batch ").append(i + 1).append('=').append(batches.get(i));
        }
        return sb.append('}').toString();
    }
}
