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

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;

public class ResolvedCoordinateMapTest {
    private static final ModuleRef APP = ModuleRef.of("acme", "app", "1.0");
    private static final ModuleRef LEFT = ModuleRef.of("acme", "left", "1.0");
    private static final ModuleRef RIGHT = ModuleRef.of("acme", "right", "1.0");
    private static final ModuleRef BASE = ModuleRef.of("acme", "base", "1.0");

    @Test
    public void testDiamondContributesSharedArchiveOnce() {
        ResolvedCoordinateMap coordinates = new ResolvedCoordinateMap(ResolutionReport.of(
                module(APP, LEFT, RIGHT), module(LEFT, BASE), module(RIGHT, BASE), module(BASE)));

        assertThat(coordinates.transitiveArchives(APP))
                .containsExactly(jar(APP), jar(LEFT), jar(BASE), jar(RIGHT));
        assertThat(coordinates.transitiveArchives(RIGHT)).containsExactly(jar(RIGHT), jar(BASE));
        assertThat(coordinates.transitiveArchives(BASE)).containsExactly(jar(BASE));
    }

    @Test
    public void testCyclesTerminateWithEveryArchiveOfTheCycle() {
        ResolvedCoordinateMap coordinates =
                new ResolvedCoordinateMap(ResolutionReport.of(module(LEFT, RIGHT), module(RIGHT, LEFT, BASE), module(BASE)));

        assertThat(coordinates.transitiveArchives(LEFT)).containsExactlyInAnyOrder(jar(LEFT), jar(RIGHT), jar(BASE));
        assertThat(coordinates.transitiveArchives(RIGHT)).containsExactlyInAnyOrder(jar(LEFT), jar(RIGHT), jar(BASE));
    }

    @Test
    public void testUnresolvedModulesContributeNothing() {
        ResolvedCoordinateMap coordinates = new ResolvedCoordinateMap(ResolutionReport.of(module(APP, BASE)));

        assertThat(coordinates.modules()).containsExactly(APP);
        assertThat(coordinates.transitiveArchives(APP)).containsExactly(jar(APP));
        assertThat(coordinates.transitiveArchives(BASE)).isEmpty();
    }

    @Test
    public void testModulesWithoutArchiveStillBringTheirDependencies() {
        ResolvedModule bom = ResolvedModule.builder().ref(APP).addDependencies(BASE).build();
        ResolvedCoordinateMap coordinates = new ResolvedCoordinateMap(ResolutionReport.of(bom, module(BASE)));

        assertThat(coordinates.transitiveArchives(APP)).containsExactly(jar(BASE));
    }

    private static ResolvedModule module(ModuleRef ref, ModuleRef... dependencies) {
        return ResolvedModule.builder()
                .ref(ref)
                .artifact(jar(ref))
                .addDependencies(dependencies)
                .build();
    }

    private static Path jar(ModuleRef ref) {
        return Paths.get("/cache", ref.org(), ref.name() + "-" + ref.rev() + ".jar");
    }
}
