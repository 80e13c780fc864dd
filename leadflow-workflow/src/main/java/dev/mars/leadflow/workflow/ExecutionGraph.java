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


package dev.mars.leadflow.workflow;

import dev.mars.leadflow.workflow.exceptions.GraphException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only step graph of a {@link WorkflowSpec}. Successor and predecessor
 * adjacency, declaration indices, the entry step and a topological order are all
 * computed once, when the graph is built.
 * <p>
 * A graph can only be obtained through {@link #build(WorkflowSpec)}, which rejects
 * duplicate ids, references to unknown steps, cycles, a missing or ambiguous entry
 * step and steps that cannot be reached from the entry. Use
 * {@link #validate(WorkflowSpec)} to get the same checks as a report instead.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-01
 * @version 1.0
 */
public final class ExecutionGraph {

    private enum Colour { UNVISITED, IN_PROGRESS, DONE }

    private final WorkflowSpec spec;
    private final Map<String, StepSpec> steps;
    private final Map<String, Integer> declarationIndex;
    private final Map<String, List<String>> successors;
    private final Map<String, List<String>> predecessors;
    private final String entryStepId;
    private final List<String> topologicalOrder;
    private final List<GraphError> warnings;

    private ExecutionGraph(WorkflowSpec spec, List<GraphError> warnings) {
        this.spec = spec;
        this.steps = indexSteps(spec);
        this.declarationIndex = new HashMap<>();
        int index = 0;
        for (String stepId : steps.keySet()) {
            declarationIndex.put(stepId, index++);
        }
        this.successors = buildSuccessors(steps);
        this.predecessors = buildPredecessors(steps, successors);
        this.entryStepId = findEntryCandidates(steps, predecessors).get(0);
        this.topologicalOrder = Collections.unmodifiableList(computeTopologicalOrder());
        this.warnings = List.copyOf(warnings);
    }

    /**
     * Builds the graph, or fails with every structural error found.
     *
     * @param spec the workflow to analyse
     * @return the validated graph
     * @throws GraphException if the step graph is invalid
     */
    public static ExecutionGraph build(WorkflowSpec spec) throws GraphException {
        Objects.requireNonNull(spec, "Workflow spec cannot be null");
        ValidationResult result = validate(spec);
        if (!result.isValid()) {
            throw new GraphException(spec.getName(), result.getErrors());
        }
        return new ExecutionGraph(spec, result.getWarnings());
    }

    /**
     * Runs the structural checks without throwing.
     *
     * @param spec the workflow to analyse
     * @return errors and warnings; never null
     */
    public static ValidationResult validate(WorkflowSpec spec) {
        Objects.requireNonNull(spec, "Workflow spec cannot be null");
        ValidationResult result = new ValidationResult();

        Set<String> seen = new HashSet<>();
        Set<String> reported = new HashSet<>();
        for (StepSpec step : spec.getSteps()) {
            if (!seen.add(step.getId()) && reported.add(step.getId())) {
                result.addError(GraphError.duplicateStep(step.getId()));
            }
        }

        Map<String, StepSpec> steps = indexSteps(spec);
        if (steps.isEmpty()) {
            result.addError(GraphError.noEntry());
            return result;
        }

        for (StepSpec step : steps.values()) {
            for (String next : step.getNextSteps()) {
                if (!steps.containsKey(next)) {
                    result.addError(GraphError.unknownStep(next, step.getId(), "next_steps"));
                }
            }
            for (InputBinding binding : step.getInputs()) {
                if (binding.isStepOutput() && !steps.containsKey(binding.getSourceStepId())) {
                    result.addError(GraphError.unknownStep(binding.getSourceStepId(), step.getId(),
                            "inputs." + binding.getTargetKey()));
                }
            }
        }

        Map<String, List<String>> successors = buildSuccessors(steps);
        Map<String, List<String>> predecessors = buildPredecessors(steps, successors);

        detectCycles(steps, successors, result);

        List<String> entries = findEntryCandidates(steps, predecessors);
        if (entries.isEmpty()) {
            result.addError(GraphError.noEntry());
        } else if (entries.size() > 1) {
            result.addError(GraphError.ambiguousEntry(entries));
        } else {
            String entry = entries.get(0);
            Set<String> reachable = collect(entry, successors);
            for (String stepId : steps.keySet()) {
                if (!reachable.contains(stepId)) {
                    result.addError(GraphError.unreachableStep(stepId, entry));
                }
            }
        }

        for (StepSpec step : steps.values()) {
            Set<String> ancestors = null;
            for (InputBinding binding : step.getInputs()) {
                String source = binding.getSourceStepId();
                if (!binding.isStepOutput() || !steps.containsKey(source)) {
                    continue;
                }
                if (ancestors == null) {
                    ancestors = collect(step.getId(), predecessors);
                    ancestors.remove(step.getId());
                }
                if (!ancestors.contains(source)) {
                    result.addWarning(GraphError.unorderedBinding(step.getId(), binding.getTargetKey(), source));
                }
            }
        }

        return result;
    }

    private static Map<String, StepSpec> indexSteps(WorkflowSpec spec) {
        Map<String, StepSpec> steps = new LinkedHashMap<>();
        for (StepSpec step : spec.getSteps()) {
            steps.putIfAbsent(step.getId(), step);
        }
        return steps;
    }

    private static Map<String, List<String>> buildSuccessors(Map<String, StepSpec> steps) {
        Map<String, List<String>> successors = new HashMap<>();
        for (StepSpec step : steps.values()) {
            Set<String> targets = new LinkedHashSet<>();
            for (String next : step.getNextSteps()) {
                if (steps.containsKey(next)) {
                    targets.add(next);
                }
            }
            successors.put(step.getId(), List.copyOf(targets));
        }
        return successors;
    }

    // Predecessor lists follow declaration order because steps are visited in that order.
    private static Map<String, List<String>> buildPredecessors(Map<String, StepSpec> steps,
                                                               Map<String, List<String>> successors) {
        Map<String, List<String>> predecessors = new HashMap<>();
        for (String stepId : steps.keySet()) {
            predecessors.put(stepId, new ArrayList<>());
        }
        for (String stepId : steps.keySet()) {
            for (String next : successors.get(stepId)) {
                predecessors.get(next).add(stepId);
            }
        }
        predecessors.replaceAll((id, list) -> List.copyOf(list));
        return predecessors;
    }

    private static List<String> findEntryCandidates(Map<String, StepSpec> steps,
                                                    Map<String, List<String>> predecessors) {
        List<String> entries = new ArrayList<>();
        for (String stepId : steps.keySet()) {
            if (predecessors.get(stepId).isEmpty()) {
                entries.add(stepId);
            }
        }
        return entries;
    }

    private static void detectCycles(Map<String, StepSpec> steps, Map<String, List<String>> successors,
                                     ValidationResult result) {
        Map<String, Colour> colours = new HashMap<>();
        for (String stepId : steps.keySet()) {
            colours.put(stepId, Colour.UNVISITED);
        }
        Deque<String> path = new ArrayDeque<>();
        for (String stepId : steps.keySet()) {
            if (colours.get(stepId) == Colour.UNVISITED) {
                visit(stepId, successors, colours, path, result);
            }
        }
    }

    // Iterative depth-first search: one successor iterator per step on the current path.
    private static void visit(String start, Map<String, List<String>> successors, Map<String, Colour> colours,
                              Deque<String> path, ValidationResult result) {
        Deque<Iterator<String>> pending = new ArrayDeque<>();
        colours.put(start, Colour.IN_PROGRESS);
        path.addLast(start);
        pending.push(successors.get(start).iterator());

        while (!pending.isEmpty()) {
            Iterator<String> next = pending.peek();
            if (!next.hasNext()) {
                pending.pop();
                colours.put(path.removeLast(), Colour.DONE);
                continue;
            }
            String stepId = next.next();
            Colour colour = colours.get(stepId);
            if (colour == Colour.IN_PROGRESS) {
                result.addError(GraphError.cycleDetected(cyclePath(path, stepId)));
            } else if (colour == Colour.UNVISITED) {
                colours.put(stepId, Colour.IN_PROGRESS);
                path.addLast(stepId);
                pending.push(successors.get(stepId).iterator());
            }
        }
    }

    private static List<String> cyclePath(Deque<String> path, String reentered) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String stepId : path) {
            if (stepId.equals(reentered)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(stepId);
            }
        }
        cycle.add(reentered);
        return cycle;
    }

    /**
     * All steps reachable from {@code start} along {@code edges}, including {@code start}.
     */
    private static Set<String> collect(String start, Map<String, List<String>> edges) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        visited.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : edges.getOrDefault(current, List.of())) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return visited;
    }

    // Kahn's algorithm with a FIFO queue; steps released together are queued in declaration order.
    private List<String> computeTopologicalOrder() {
        Map<String, Integer> remaining = new HashMap<>();
        for (Map.Entry<String, List<String>> entry : predecessors.entrySet()) {
            remaining.put(entry.getKey(), entry.getValue().size());
        }
        Deque<String> queue = new ArrayDeque<>();
        queue.add(entryStepId);
        List<String> order = new ArrayList<>();
        while (!queue.isEmpty()) {
            String current = queue.poll();
            order.add(current);
            List<String> released = new ArrayList<>();
            for (String next : successors.get(current)) {
                int count = remaining.merge(next, -1, Integer::sum);
                if (count == 0) {
                    released.add(next);
                }
            }
            released.sort(declarationOrder());
            queue.addAll(released);
        }
        return order;
    }

    public WorkflowSpec getSpec() {
        return spec;
    }

    public String getWorkflowName() {
        return spec.getName();
    }

    public String getEntryStepId() {
        return entryStepId;
    }

    public StepSpec getStep(String stepId) {
        StepSpec step = steps.get(stepId);
        if (step == null) {
            throw new IllegalArgumentException("Unknown step: " + stepId);
        }
        return step;
    }

    /**
     * @return step ids in declaration order
     */
    public List<String> getStepIds() {
        return List.copyOf(steps.keySet());
    }

    public List<StepSpec> getSteps() {
        return List.copyOf(steps.values());
    }

    public int size() {
        return steps.size();
    }

    public List<String> getSuccessors(String stepId) {
        getStep(stepId);
        return successors.get(stepId);
    }

    public List<String> getPredecessors(String stepId) {
        getStep(stepId);
        return predecessors.get(stepId);
    }

    public int getDeclarationIndex(String stepId) {
        getStep(stepId);
        return declarationIndex.get(stepId);
    }

    /**
     * Comparator ordering step ids by their position in the workflow document.
     */
    public Comparator<String> declarationOrder() {
        return Comparator.comparingInt(this::getDeclarationIndex);
    }

    /**
     * @return every step exactly once, each after all of its predecessors
     */
    public List<String> getTopologicalOrder() {
        return topologicalOrder;
    }

    /**
     * Non-fatal findings, such as bindings that read from a step which is not upstream.
     */
    public List<GraphError> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "ExecutionGraph{" +
               "workflow='" + spec.getName() + '\'' +
               ", entry='" + entryStepId + '\'' +
               ", steps=" + steps.keySet() +
               ", successors=" + successors +
               '}';
    }
}
