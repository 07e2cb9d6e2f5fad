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

import java.util.OptionalLong;
import org.immutables.value.Value;

@Value.Immutable
public interface AttributionConfiguration {
    /**
     * Skips the analysis entirely: every index is empty.
     */
    @Value.Default
    default boolean skip() {
        return false;
    }

    /**
     * Suffix of the files and archive entries that are considered compiled artifacts.
     */
    @Value.Default
    default String classfileSuffix() {
        return ".class";
    }

    /**
     * Bounds the number of archive listings kept in memory. Unbounded by default, which guarantees every archive is
     * read at most once per invocation.
     */
    OptionalLong archiveCacheMaximumSize();

    /**
     * When the distribution exposes none of the legacy class path properties (Java 9 and later), index the classes of
     * the running JDK's system modules as bootstrap classes instead.
     */
    @Value.Default
    default boolean includePlatformModules() {
        return true;
    }

    static AttributionConfiguration defaults() {
        return builder().build();
    }

    static ImmutableAttributionConfiguration.Builder builder() {
        return ImmutableAttributionConfiguration.builder();
    }
}
