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

import java.util.*;

/**
 * Represents the dependency graph of the tasks in one workflow.
 * Provides structural validation, cycle detection with the offending path, reverse edges
 * and the waves of tasks that can run side by side.
 *
 * <p>All traversals follow the input order of the tasks and of each task's dependency
 * list, so results (including which cycle is reported first) are deterministic.</p>
 */
public class DependencyGraph {

    private final List<String> taskIds;
    private final Map<String, List<String>> dependencies;
    private final List<String> duplicateIds;

    public DependencyGraph(List<Task> tasks) {
        Objects.requireNonNull(tasks, "Tasks cannot be null");
        this.taskIds = new ArrayList<>();
        this.dependencies = new LinkedHashMap<>();
        this.duplicateIds = new ArrayList<>();

        for (Task task : tasks) {
            String id = task.getId();
            if (dependencies.containsKey(id)) {
                if (!duplicateIds.contains(id)) {
                    duplicateIds.add(id);
                }
                continue;
            }
            taskIds.add(id);
            dependencies.put(id, task.getDependencies());
        }
    }

    /**
     * @return distinct task ids in input order
     */
    public List<String> getTaskIds() {
        return List.copyOf(taskIds);
    }

    public List<String> getDependencies(String taskId) {
        return dependencies.getOrDefault(taskId, List.of());
    }

    /**
     * Gets the tasks that depend directly on the given one, in input order.
     *
     * @param taskId the id of the task
     * @return ids of the direct dependents
     */
    public List<String> getDependents(String taskId) {
        List<String> dependents = new ArrayList<>();
        for (String id : taskIds) {
            if (dependencies.get(id).contains(taskId) && !id.equals(taskId)) {
                dependents.add(id);
            }
        }
        return dependents;
    }

    /**
     * Validates the graph: unique ids, dependencies that exist, no self references and
     * no cycles.
     *
     * @return validation result
     */
    public ValidationResult validate() {
        ValidationResult result = new ValidationResult();

        for (String duplicate : duplicateIds) {
            result.addTaskError(duplicate, "tasks." + duplicate + ".id", "Duplicate task id: " + duplicate);
        }

        // Check for missing and self dependencies
        for (String id : taskIds) {
            for (String dependency : dependencies.get(id)) {
                if (id.equals(dependency)) {
                    result.addTaskError(id, "tasks." + id + ".dependencies", "Task " + id + " cannot depend on itself");
                } else if (!dependencies.containsKey(dependency)) {
                    result.addTaskError(id, "tasks." + id + ".dependencies",
                            "Task " + id + " depends on non-existent task " + dependency);
                }
            }
        }

        findCycle().ifPresent(cycle ->
                result.addError("dependencies", "Circular dependency detected: " + String.join(" -> ", cycle)));

        return result;
    }

    /**
     * Validates the graph and throws on the first problem found.
     *
     * @throws WorkflowValidationException carrying every issue and, for a cycle, its path
     */
    public void requireValid() throws WorkflowValidationException {
        ValidationResult result = validate();
        if (!result.isValid()) {
            throw new WorkflowValidationException(result.getErrors(), findCycle().orElse(List.of()));
        }
    }

    /**
     * Finds the first dependency cycle by depth-first search.
     * Self references and references to unknown tasks are ignored here; {@link #validate()}
     * reports them separately.
     *
     * @return the cycle as a path closed by its first id (e.g. {@code [a, b, a]}), or empty
     */
    public Optional<List<String>> findCycle() {
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        List<String> path = new ArrayList<>();

        for (String id : taskIds) {
            if (!visited.contains(id)) {
                List<String> cycle = visit(id, visited, onStack, path);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    public boolean hasCycles() {
        return findCycle().isPresent();
    }

    /**
     * Groups the tasks into waves: every task's dependencies lie in earlier waves, and
     * tasks within a wave keep their input order.
     *
     * @return list of execution batches
     * @throws WorkflowValidationException if the graph is not valid
     */
    public List<List<String>> getExecutionBatches() throws WorkflowValidationException {
        requireValid();

        // Kahn's algorithm, one wave per pass
        Map<String, Integer> inDegree = new HashMap<>();
        for (String id : taskIds) {
            inDegree.put(id, dependencies.get(id).size());
        }

        List<List<String>> batches = new ArrayList<>();
        Set<String> processed = new HashSet<>();
        while (processed.size() < taskIds.size()) {
            List<String> batch = new ArrayList<>();
            for (String id : taskIds) {
                if (!processed.contains(id) && inDegree.get(id) == 0) {
                    batch.add(id);
                }
            }
            if (batch.isEmpty()) {
                throw new WorkflowValidationException("Circular dependency detected - cannot create execution batches");
            }
            processed.addAll(batch);
            for (String id : batch) {
                for (String dependent : getDependents(id)) {
                    inDegree.put(dependent, inDegree.get(dependent) - 1);
                }
            }
            batches.add(batch);
        }
        return batches;
    }

    private List<String> visit(String id, Set<String> visited, Set<String> onStack, List<String> path) {
        visited.add(id);
        onStack.add(id);
        path.add(id);

        for (String dependency : dependencies.get(id)) {
            if (dependency.equals(id) || !dependencies.containsKey(dependency)) {
                continue;
            }
            if (onStack.contains(dependency)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                cycle.add(dependency);
                return cycle;
            }
            if (!visited.contains(dependency)) {
                List<String> cycle = visit(dependency, visited, onStack, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }

        onStack.remove(id);
        path.remove(path.size() - 1);
        return null;
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
               "tasks=" + taskIds +
               ", dependencies=" + dependencies +
               '}';
    }
}
