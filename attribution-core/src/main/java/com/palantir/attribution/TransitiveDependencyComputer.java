/*
 * (c) Copyright 2025 Palantir Technologies Inc. All rights reserved.
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

package com.palantir.attribution;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.palantir.attribution.datamodel.Target;
import com.palantir.attribution.datamodel.TargetAddress;
import com.palantir.attribution.datamodel.graph.DependencyEdge;
import com.palantir.attribution.datamodel.graph.TargetGraph;
import com.palantir.attribution.datamodel.graph.TransitiveDependencyMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes, for every target of the graph, all the targets it depends on transitively.
 *
 * Targets are sorted so that dependencies come first, then each target's set is accumulated from the sets of its
 *   direct dependencies, which are already complete at that point.
 *
 * Derived targets are handled separately: their own dependencies are registered directly against their entry, and
 *   never merged into the outer target, since they may depend back on the outer target. Such back-edges make the
 *   graph cyclic. Cycles never fail the computation: the traversal stops at the back-edge, which is reported in
 *   {@link TransitiveDependencyMap#cycleEdges()}, and the closure at that point may be incomplete.
 */
public final class TransitiveDependencyComputer {
    private static final Logger log = LoggerFactory.getLogger(TransitiveDependencyComputer.class);

    private enum VisitState {
        UNVISITED,
        IN_PROGRESS,
        DONE,
    }

    private final TargetGraph graph;
    // Arena of all addressable targets, everything below is indexed by position in it
    private final List<Target> nodes;
    private final Map<TargetAddress, Integer> indexByAddress = new HashMap<>();
    private final int[][] dependencyIndices;

    private TransitiveDependencyComputer(TargetGraph graph) {
        this.graph = graph;
        this.nodes = ImmutableList.copyOf(graph.addressableTargets());

        for (int i = 0; i < nodes.size(); i++) {
            indexByAddress.put(nodes.get(i).address(), i);
        }
        this.dependencyIndices = new int[nodes.size()][];
        for (int i = 0; i < nodes.size(); i++) {
            dependencyIndices[i] = nodes.get(i).dependencies().stream()
                    .mapToInt(indexByAddress::get)
                    .toArray();
        }
    }

    public static TransitiveDependencyMap compute(TargetGraph graph) {
        return new TransitiveDependencyComputer(graph).compute();
    }

    private TransitiveDependencyMap compute() {
        List<DependencyEdge> cycleEdges = new ArrayList<>();
        List<Integer> sorted = sortDependenciesFirst(cycleEdges);

        List<Set<Target>> results = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            results.add(null);
        }

        // Iterate in dependency order, to accumulate the transitive dependencies of each target
        for (int node : sorted) {
            Set<Target> transitiveDependencies = resultFor(results, node);
            for (int dependency : dependencyIndices[node]) {
                if (dependency != node) {
                    Set<Target> dependencyResult = results.get(dependency);
                    if (dependencyResult != null) {
                        transitiveDependencies.addAll(dependencyResult);
                    }
                }
                transitiveDependencies.add(nodes.get(dependency));
            }

            for (Target derived : nodes.get(node).derivedTargets()) {
                Set<Target> derivedDependencies = resultFor(results, indexOf(derived));
                derivedDependencies.addAll(graph.dependenciesOf(derived));
            }
        }

        for (DependencyEdge cycleEdge : cycleEdges) {
            log.debug("Dependency cycle through {}, transitive dependencies may be incomplete", cycleEdge);
        }

        ImmutableMap.Builder<Target, ImmutableSet<Target>> dependenciesByTarget = ImmutableMap.builder();
        for (int i = 0; i < nodes.size(); i++) {
            if (results.get(i) != null) {
                dependenciesByTarget.put(nodes.get(i), ImmutableSet.copyOf(results.get(i)));
            }
        }
        TransitiveDependencyMap dependencyMap = TransitiveDependencyMap.builder()
                .dependenciesByTarget(dependenciesByTarget.buildOrThrow())
                .cycleEdges(cycleEdges)
                .build();
        log.info(
                "Computed transitive dependencies of {} targets ({} cycle edges)",
                dependencyMap.dependenciesByTarget().size(),
                cycleEdges.size());
        return dependencyMap;
    }

    private int indexOf(Target target) {
        return indexByAddress.get(target.address());
    }

    private static Set<Target> resultFor(List<Set<Target>> results, int node) {
        Set<Target> result = results.get(node);
        if (result == null) {
            result = new LinkedHashSet<>();
            results.set(node, result);
        }
        return result;
    }

    /**
     * Iterative depth-first post-order over the targets in play, following dependency edges. Reaching a target that
     * is still in progress means we've found a back-edge: it's recorded and not followed.
     */
    private List<Integer> sortDependenciesFirst(List<DependencyEdge> cycleEdges) {
        VisitState[] states = new VisitState[nodes.size()];
        Arrays.fill(states, VisitState.UNVISITED);
        int[] nextDependency = new int[nodes.size()];
        List<Integer> sorted = new ArrayList<>(nodes.size());
        Deque<Integer> stack = new ArrayDeque<>();

        for (Target root : graph.targets()) {
            int rootIndex = indexOf(root);
            if (states[rootIndex] != VisitState.UNVISITED) {
                continue;
            }
            states[rootIndex] = VisitState.IN_PROGRESS;
            stack.push(rootIndex);

            while (!stack.isEmpty()) {
                int node = stack.peek();
                if (nextDependency[node] < dependencyIndices[node].length) {
                    int dependency = dependencyIndices[node][nextDependency[node]++];
                    switch (states[dependency]) {
                        case UNVISITED:
                            states[dependency] = VisitState.IN_PROGRESS;
                            stack.push(dependency);
                            break;
                        case IN_PROGRESS:
                            cycleEdges.add(DependencyEdge.of(
                                    nodes.get(node).address(), nodes.get(dependency).address()));
                            break;
                        case DONE:
                            break;
                        default:
                            throw new IllegalStateException("Unknown visit state: " + states[dependency]);
                    }
                } else {
                    stack.pop();
                    states[node] = VisitState.DONE;
                    sorted.add(node);
                }
            }
        }
        return sorted;
    }
}
