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

import static org.assertj.core.api.Assertions.assertThat;

import com.google.common.collect.ImmutableMap;
import com.palantir.attribution.datamodel.CompiledOutput;
import com.palantir.attribution.datamodel.CompiledOutputManifest;
import com.palantir.attribution.datamodel.LibraryReference;
import com.palantir.attribution.datamodel.Target;
import com.palantir.attribution.datamodel.TargetAddress;
import com.palantir.attribution.datamodel.TargetKind;
import com.palantir.attribution.datamodel.graph.TargetGraph;
import com.palantir.attribution.resolve.ModuleRef;
import com.palantir.attribution.resolve.ResolutionReport;
import com.palantir.attribution.resolve.ResolvedModule;
import com.palantir.attribution.resolve.SharedSymlinkMap;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class DependencyAttributionTest {

    @TempDir
    public Path tempDir;

    private Target libCore;
    private Target app;
    private AttributionContext context;

    @BeforeEach
    public void beforeEach() throws IOException {
        Path buildRoot = Files.createDirectories(tempDir.resolve("buildroot"));
        Path widgetsJar = TestArchives.writeJar(tempDir.resolve("cache/widgets.jar"), "com/acme/Widget.class");
        SharedSymlinkMap symlinks = new SharedSymlinkMap();
        symlinks.put(widgetsJar.toRealPath(), widgetsJar);

        libCore = Target.builder("lib-core", TargetKind.SOURCE)
                .addSources("src/A.java")
                .build();
        app = Target.builder("app", TargetKind.LIBRARY)
                .addDependencies(TargetAddress.of("lib-core"))
                .addLibraryReferences(LibraryReference.of("acme", "widgets"))
                .build();

        context = AttributionContext.builder()
                .buildRoot(buildRoot)
                .targetGraph(TargetGraph.of(app, libCore))
                .compiledOutputs(CompiledOutputManifest.builder()
                        .putOutputs(libCore, CompiledOutput.of(tempDir.resolve("out/lib-core"), "A.class"))
                        .build())
                .resolutionReports(List.of(ResolutionReport.of(ResolvedModule.builder()
                        .ref(ModuleRef.of("acme", "widgets", "1.0"))
                        .artifact(widgetsJar)
                        .build())))
                .symlinkMap(symlinks)
                .distributionLocator(DistributionLocator.of(ImmutableMap.of()))
                .build();
    }

    @Test
    public void testAttributesSourcesOutputsAndArchives() {
        DependencyAttribution attribution = DependencyAttribution.create(context);

        assertThat(attribution.fileOwnershipIndex().ownersOf(context.buildRoot().resolve("src/A.java")))
                .containsExactly(libCore);
        assertThat(attribution.fileOwnershipIndex().ownersOf("A.class")).containsExactly(libCore);
        assertThat(attribution.fileOwnershipIndex().ownersOf("com/acme/Widget.class"))
                .containsExactly(app);
        assertThat(attribution.transitiveDependencies().transitiveDependencies(app))
                .contains(libCore);
    }

    @Test
    public void testIndexesAreComputedOnce() {
        DependencyAttribution attribution = DependencyAttribution.create(context);

        assertThat(attribution.fileOwnershipIndex()).isSameAs(attribution.fileOwnershipIndex());
        assertThat(attribution.transitiveDependencies()).isSameAs(attribution.transitiveDependencies());
        assertThat(attribution.bootstrapClassfiles()).isSameAs(attribution.bootstrapClassfiles());
    }

    @Test
    public void testSkippedAttributionHasEmptyIndexes() {
        DependencyAttribution attribution = DependencyAttribution.create(
                context, AttributionConfiguration.builder().skip(true).build());

        assertThat(attribution.fileOwnershipIndex().isEmpty()).isTrue();
        assertThat(attribution.transitiveDependencies().dependenciesByTarget()).isEmpty();
        assertThat(attribution.bootstrapClassfiles()).isEmpty();
    }
}
