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

import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;

/**
 * Maps the real path of a resolved archive to the symlink under which the resolve step materialized it.
 *
 * The live mapping is shared with concurrently running build phases, so it is only ever read through an immutable
 *   {@link #snapshot()}.
 */
@FunctionalInterface
public interface SymlinkMap {

    ImmutableMap<Path, Path> snapshot();

    static SymlinkMap empty() {
        return ImmutableMap::of;
    }
}
