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

import java.util.List;
import java.util.Map;
import org.immutables.value.Value;

/**
 * The outcome of resolving external libraries for one invocation: every resolved module keyed by its reference,
 *   in resolution order.
 */
@Value.Immutable
public interface ResolutionReport {

    Map<ModuleRef, ResolvedModule> modulesByRef();

    static ResolutionReport of(Iterable<? extends ResolvedModule> modules) {
        ImmutableResolutionReport.Builder builder = ImmutableResolutionReport.builder();
        for (ResolvedModule module : modules) {
            builder.putModulesByRef(module.ref(), module);
        }
        return builder.build();
    }

    static ResolutionReport of(ResolvedModule... modules) {
        return of(List.of(modules));
    }
}
