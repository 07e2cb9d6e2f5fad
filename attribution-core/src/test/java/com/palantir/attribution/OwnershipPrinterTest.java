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

import com.palantir.attribution.datamodel.Target;
import com.palantir.attribution.datamodel.TargetKind;
import com.palantir.attribution.datamodel.graph.FileOwnershipIndex;
import org.junit.jupiter.api.Test;

public class OwnershipPrinterTest {
    private static final Target FORK = Target.builder("widgets-fork", TargetKind.SOURCE).build();
    private static final Target WIDGETS = Target.builder("3rdparty:widgets", TargetKind.LIBRARY).build();
    private static final Target ALL = Target.builder("3rdparty:all", TargetKind.LIBRARY).build();

    @Test
    public void testSingleOwnersAreNotReported() {
        FileOwnershipIndex index = FileOwnershipIndex.builder()
                .register("com/acme/Widget.class", FORK)
                .build();

        assertThat(OwnershipPrinter.outputAmbiguousOwnership(index)).isEqualTo("Every file has a single owner.\n");
    }

    @Test
    public void testAmbiguousFilesAreGroupedByCanonicalOwner() {
        FileOwnershipIndex index = FileOwnershipIndex.builder()
                .register("com/acme/Widget.class", FORK)
                .register("com/acme/Gadget.class", FORK)
                .register("com/acme/Gear.class", WIDGETS)
                .register("com/acme/Single.class", WIDGETS)
                .register("com/acme/Widget.class", WIDGETS)
                .register("com/acme/Widget.class", ALL)
                .register("com/acme/Gadget.class", ALL)
                .register("com/acme/Gear.class", ALL)
                .build();

        assertThat(OwnershipPrinter.outputAmbiguousOwnership(index))
                .isEqualTo(
                        """
                        3 files are provided by several targets. \
                        The first target listed for each file is considered its canonical owner.

                        Owned by: 3rdparty:widgets
                          \\- com/acme/Gear.class
                              \\- Also provided by: 3rdparty:all

                        Owned by: widgets-fork
                          |- com/acme/Gadget.class
                          |   \\- Also provided by: 3rdparty:all
                          \\- com/acme/Widget.class
                              \\- Also provided by: 3rdparty:widgets, 3rdparty:all

                        """);
    }
}
