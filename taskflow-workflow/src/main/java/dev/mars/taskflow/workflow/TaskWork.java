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

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * The unit of work behind a task: a zero-argument operation that starts the work and
 * returns a stage completing with its payload, or failing.
 * Throwing from {@link #execute()} counts as a failed attempt, the same as returning a
 * stage that completes exceptionally.
 *
 * @param <T> the payload type
 */
@FunctionalInterface
public interface TaskWork<T> {

    CompletionStage<T> execute() throws Exception;

    /**
     * Adapts blocking code. The callable runs on the executor's work thread, so it is
     * still raced against the task timeout.
     */
    static <T> TaskWork<T> fromCallable(Callable<T> callable) {
        return () -> CompletableFuture.completedFuture(callable.call());
    }
}
