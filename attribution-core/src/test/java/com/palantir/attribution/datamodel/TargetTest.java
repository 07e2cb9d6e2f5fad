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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class TargetTest {

    @Test
    public void testEqualityIsByAddress() {
        Target before = Target.builder("lib-core", TargetKind.SOURCE)
                .addSources("src/A.java")
                .build();
        Target after = Target.builder("lib-core", TargetKind.SOURCE)
                .addSources("src/A.java", "src/B.java")
                .addDependencies(TargetAddress.of("util"))
                .build();

        assertThat(before).isEqualTo(after);
        assertThat(before.hashCode()).isEqualTo(after.hashCode());
        assertThat(before).isNotEqualTo(Target.builder("lib-util", TargetKind.SOURCE).build());

        Set<Target> targets = new HashSet<>();
        targets.add(before);
        assertThat(targets).contains(after);
    }

    @Test
    public void testLibraryReferencesOnlyOnLibraries() {
        assertThatThrownBy(() -> Target.builder("lib-core", TargetKind.SOURCE)
                        .addLibraryReferences(LibraryReference.of("acme", "widgets"))
                        .build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("lib-core");
    }

    @Test
    public void testDerivedTargetsOnlyOnWrappers() {
        Target derived = Target.builder("lib-scala:java-sources", TargetKind.SOURCE).build();

        assertThatThrownBy(() -> Target.builder("lib-scala", TargetKind.SOURCE)
                        .addDerivedTargets(derived)
                        .build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("lib-scala");
    }

    @Test
    public void testBlankAddress() {
        assertThatThrownBy(() -> TargetAddress.of(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testStringForms() {
        assertThat(TargetAddress.of("src/java/com/acme:lib-core")).hasToString("src/java/com/acme:lib-core");
        assertThat(LibraryReference.of("acme", "widgets")).hasToString("acme:widgets");
        assertThat(CompiledOutput.of(Paths.get("/out"), "com/acme/A.class").absolutePath())
                .isEqualTo(Paths.get("/out/com/acme/A.class"));
    }
}
