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

package com.palantir.attribution.datamodel.graph;

import com.google.common.collect.ImmutableSet;
import com.palantir.attribution.datamodel.Target;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.immutables.value.Value;

/**
 * Every target of the graph mapped to all the targets it depends on, transitively.
 */
@Value.Immutable
public interface TransitiveDependencyMap {

    Map<Target, ImmutableSet<Target>> dependenciesByTarget();

    /**
     * Back-edges at which the traversal found a target still being processed. The closure of the targets on such a
     *   cycle may be incomplete.
     */
    List<DependencyEdge> cycleEdges();

    default Set<Target> transitiveDependencies(Target target) {
        return dependenciesByTarget().getOrDefault(target, ImmutableSet.of());
    }

    static TransitiveDependencyMap empty() {
        return builder().build();
    }

    static ImmutableTransitiveDependencyMap.Builder builder() {
        return ImmutableTransitiveDependencyMap.builder();
    }
}
