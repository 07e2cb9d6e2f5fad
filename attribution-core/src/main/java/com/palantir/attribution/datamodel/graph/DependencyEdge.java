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

import com.palantir.attribution.datamodel.TargetAddress;

/**
 * A dependency edge from a target to one of its dependencies.
 */
public record DependencyEdge(TargetAddress from, TargetAddress to) {
    public static DependencyEdge of(TargetAddress from, TargetAddress to) {
        return new DependencyEdge(from, to);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
