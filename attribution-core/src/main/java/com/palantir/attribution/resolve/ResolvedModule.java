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

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * A module of a resolution report, with the archive it resolved to and its direct edges in the resolved graph.
 */
@Value.Immutable
public interface ResolvedModule {

    ModuleRef ref();

    /**
     * Empty for modules without an archive, e.g. pom-only modules.
     */
    Optional<Path> artifact();

    List<ModuleRef> dependencies();

    static ImmutableResolvedModule.Builder builder() {
        return ImmutableResolvedModule.builder();
    }
}
