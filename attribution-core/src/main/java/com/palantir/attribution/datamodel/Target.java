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

package com.palantir.attribution.datamodel;

import com.google.common.base.Preconditions;
import java.util.List;
import org.immutables.value.Value;

/**
 * A node of the build graph.
 *
 * Identity is the {@link #address()} alone: every other attribute is auxiliary, and two snapshots of the same target
 *   compare equal.
 */
@Value.Immutable
public interface Target {

    TargetAddress address();

    TargetKind kind();

    /**
     * Declared sources, relative to the build root.
     */
    @Value.Auxiliary
    List<String> sources();

    @Value.Auxiliary
    List<TargetAddress> dependencies();

    /**
     * Only set on {@link TargetKind#LIBRARY} targets.
     */
    @Value.Auxiliary
    List<LibraryReference> libraryReferences();

    /**
     * Only set on {@link TargetKind#DERIVED_WRAPPER} targets.
     */
    @Value.Auxiliary
    List<Target> derivedTargets();

    @Value.Check
    default void check() {
        Preconditions.checkState(
                libraryReferences().isEmpty() || kind() == TargetKind.LIBRARY,
                "Only library targets can declare library references: %s",
                address());
        Preconditions.checkState(
                derivedTargets().isEmpty() || kind() == TargetKind.DERIVED_WRAPPER,
                "Only derived wrapper targets can carry derived targets: %s",
                address());
    }

    static ImmutableTarget.Builder builder() {
        return ImmutableTarget.builder();
    }

    static ImmutableTarget.Builder builder(String address, TargetKind kind) {
        return ImmutableTarget.builder().address(TargetAddress.of(address)).kind(kind);
    }
}
