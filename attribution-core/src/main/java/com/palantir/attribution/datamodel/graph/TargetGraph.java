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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.palantir.attribution.datamodel.Target;
import com.palantir.attribution.datamodel.TargetAddress;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The targets in play for the current invocation, and the dependency edges between them.
 *
 * Derived targets (see {@link Target#derivedTargets()}) are addressable and may be depended upon, but they are only
 *   part of {@link #targets()} if the build graph lists them at the top level too.
 */
public final class TargetGraph {
    private final ImmutableList<Target> targets;
    private final ImmutableMap<TargetAddress, Target> targetsByAddress;

    private TargetGraph(ImmutableList<Target> targets, ImmutableMap<TargetAddress, Target> targetsByAddress) {
        this.targets = targets;
        this.targetsByAddress = targetsByAddress;
    }

    public static TargetGraph of(Iterable<Target> targets) {
        ImmutableList<Target> topLevel = ImmutableList.copyOf(targets);
        Map<TargetAddress, Target> byAddress = new LinkedHashMap<>();
        for (Target target : topLevel) {
            index(target, byAddress);
        }

        for (Target target : byAddress.values()) {
            for (TargetAddress dependency : target.dependencies()) {
                Preconditions.checkArgument(
                        byAddress.containsKey(dependency),
                        "Target %s depends on unknown target %s",
                        target.address(),
                        dependency);
            }
        }
        return new TargetGraph(topLevel, ImmutableMap.copyOf(byAddress));
    }

    public static TargetGraph of(Target... targets) {
        return of(List.of(targets));
    }

    private static void index(Target target, Map<TargetAddress, Target> byAddress) {
        Target existing = byAddress.putIfAbsent(target.address(), target);
        if (existing != null) {
            return;
        }
        for (Target derived : target.derivedTargets()) {
            index(derived, byAddress);
        }
    }

    /**
     * Targets in play for this invocation, in the order the build graph enumerated them.
     */
    public List<Target> targets() {
        return targets;
    }

    /**
     * Every addressable target: the targets in play and their derived targets.
     */
    public Collection<Target> addressableTargets() {
        return targetsByAddress.values();
    }

    public Optional<Target> find(TargetAddress address) {
        return Optional.ofNullable(targetsByAddress.get(address));
    }

    public Target get(TargetAddress address) {
        return find(address).orElseThrow(() -> new IllegalArgumentException("Unknown target: " + address));
    }

    public List<Target> dependenciesOf(Target target) {
        return target.dependencies().stream().map(this::get).collect(ImmutableList.toImmutableList());
    }
}
