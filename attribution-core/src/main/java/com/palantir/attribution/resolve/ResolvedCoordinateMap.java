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

package com.palantir.attribution.resolve;

import com.google.common.collect.ImmutableSet;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Answers which archives a module of a {@link ResolutionReport} brings in: its own archive plus the archives of every
 *   module it transitively depends on.
 *
 * Results are memoized per module, so overlapping subgraphs are only walked once. A module reachable through
 *   several paths (a diamond) contributes its archive once. Not thread-safe: one instance serves one index build.
 */
public final class ResolvedCoordinateMap {
    private final ResolutionReport report;
    private final Map<ModuleRef, ImmutableSet<Path>> archivesByRef = new HashMap<>();

    public ResolvedCoordinateMap(ResolutionReport report) {
        this.report = report;
    }

    public Set<ModuleRef> modules() {
        return report.modulesByRef().keySet();
    }

    public ImmutableSet<Path> transitiveArchives(ModuleRef ref) {
        return collect(ref, new HashMap<>(), new int[] {Integer.MAX_VALUE});
    }

    /**
     * Depth-first walk. {@code openDepths} holds the modules on the current path; reaching one of them again closes a
     *   cycle, which contributes nothing. A result is only memoized if no cycle below it closes above it, since it
     *   would otherwise miss the archives of the modules still open.
     */
    private ImmutableSet<Path> collect(ModuleRef ref, Map<ModuleRef, Integer> openDepths, int[] lowestOpenDepth) {
        ImmutableSet<Path> memoized = archivesByRef.get(ref);
        if (memoized != null) {
            return memoized;
        }

        Integer openDepth = openDepths.get(ref);
        if (openDepth != null) {
            lowestOpenDepth[0] = Math.min(lowestOpenDepth[0], openDepth);
            return ImmutableSet.of();
        }

        ResolvedModule module = report.modulesByRef().get(ref);
        if (module == null) {
            // Evicted or otherwise unresolved module
            return ImmutableSet.of();
        }

        int depth = openDepths.size();
        openDepths.put(ref, depth);
        int[] subtreeLowestOpenDepth = {Integer.MAX_VALUE};

        ImmutableSet.Builder<Path> archives = ImmutableSet.builder();
        module.artifact().ifPresent(archives::add);
        for (ModuleRef dependency : module.dependencies()) {
            archives.addAll(collect(dependency, openDepths, subtreeLowestOpenDepth));
        }
        openDepths.remove(ref);

        ImmutableSet<Path> result = archives.build();
        if (subtreeLowestOpenDepth[0] >= depth) {
            archivesByRef.put(ref, result);
        }
        lowestOpenDepth[0] = Math.min(lowestOpenDepth[0], subtreeLowestOpenDepth[0]);
        return result;
    }
}
