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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.List;
import javax.annotation.Nullable;
import org.immutables.value.Value;

/**
 * On-disk shape of a resolution report, as read by {@link JsonResolutionReports}.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableReportDocument.class)
@JsonIgnoreProperties(ignoreUnknown = true)
interface ReportDocument {

    List<ReportModule> modules();

    @Value.Immutable
    @JsonDeserialize(as = ImmutableReportModuleId.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    interface ReportModuleId {
        String org();

        String name();

        @Value.Default
        default String rev() {
            return "";
        }

        default ModuleRef toRef() {
            return ModuleRef.of(org(), name(), rev());
        }
    }

    @Value.Immutable
    @JsonDeserialize(as = ImmutableReportModule.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    interface ReportModule extends ReportModuleId {
        /**
         * Path of the resolved archive, relative paths being relative to the report's directory.
         */
        @Nullable
        String artifact();

        List<ReportModuleId> dependencies();
    }
}
