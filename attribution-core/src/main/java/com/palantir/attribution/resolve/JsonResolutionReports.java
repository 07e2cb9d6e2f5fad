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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.google.common.collect.ImmutableList;
import com.palantir.attribution.AttributionException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads {@link ResolutionReport}s written by the resolve step, in the following format:
 * <pre>
 * {
 *   "modules": [
 *     {
 *       "org": "acme", "name": "widgets", "rev": "1.0",
 *       "artifact": "jars/widgets-1.0.jar",
 *       "dependencies": [{"org": "acme", "name": "gears", "rev": "2.1"}]
 *     }
 *   ]
 * }
 * </pre>
 */
public final class JsonResolutionReports {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new GuavaModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public static ResolutionReport read(Path reportFile) {
        ReportDocument document;
        try {
            document = MAPPER.readValue(reportFile.toFile(), ReportDocument.class);
        } catch (IOException e) {
            throw new AttributionException("Failed to read resolution report", reportFile, e);
        }

        Path reportDirectory = reportFile.toAbsolutePath().getParent();
        ImmutableList.Builder<ResolvedModule> modules = ImmutableList.builder();
        for (ReportDocument.ReportModule module : document.modules()) {
            ImmutableResolvedModule.Builder resolved = ResolvedModule.builder().ref(module.toRef());
            if (module.artifact() != null) {
                resolved.artifact(reportDirectory.resolve(module.artifact()).normalize());
            }
            for (ReportDocument.ReportModuleId dependency : module.dependencies()) {
                resolved.addDependencies(dependency.toRef());
            }
            modules.add(resolved.build());
        }
        return ResolutionReport.of(modules.build());
    }

    public static List<ResolutionReport> readAll(List<Path> reportFiles) {
        return reportFiles.stream().map(JsonResolutionReports::read).collect(ImmutableList.toImmutableList());
    }

    private JsonResolutionReports() {}
}
