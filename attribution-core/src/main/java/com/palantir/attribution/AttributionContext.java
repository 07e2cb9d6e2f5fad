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

import com.palantir.attribution.datamodel.CompiledOutputManifest;
import com.palantir.attribution.datamodel.graph.TargetGraph;
import com.palantir.attribution.resolve.ResolutionReport;
import com.palantir.attribution.resolve.SymlinkMap;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Everything the attribution engine consumes from the surrounding build for a single invocation.
 */
@Value.Immutable
public interface AttributionContext {

    /**
     * Root that target sources are relative to.
     */
    Path buildRoot();

    TargetGraph targetGraph();

    @Value.Default
    default CompiledOutputManifest compiledOutputs() {
        return CompiledOutputManifest.empty();
    }

    /**
     * Empty if no resolution ran during this invocation, in which case no archive-derived ownership is registered.
     */
    Optional<List<ResolutionReport>> resolutionReports();

    @Value.Default
    default SymlinkMap symlinkMap() {
        return SymlinkMap.empty();
    }

    @Value.Default
    default DistributionLocator distributionLocator() {
        return DistributionLocator.current();
    }

    static ImmutableAttributionContext.Builder builder() {
        return ImmutableAttributionContext.builder();
    }
}
