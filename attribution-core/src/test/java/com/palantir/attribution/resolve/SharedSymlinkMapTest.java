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

import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

public class SharedSymlinkMapTest {

    @Test
    public void testSnapshotIsNotAffectedByLaterUpdates() {
        SharedSymlinkMap symlinks = new SharedSymlinkMap();
        symlinks.put(Paths.get("/cache/a.jar"), Paths.get("/links/a.jar"));

        ImmutableMap<Path, Path> snapshot = symlinks.snapshot();
        symlinks.putAll(ImmutableMap.of(Paths.get("/cache/b.jar"), Paths.get("/links/b.jar")));

        assertThat(snapshot).containsOnlyKeys(Paths.get("/cache/a.jar"));
        assertThat(symlinks.snapshot()).containsOnlyKeys(Paths.get("/cache/a.jar"), Paths.get("/cache/b.jar"));
    }

    @Test
    public void testConcurrentWritersAndReaders() throws Exception {
        SharedSymlinkMap symlinks = new SharedSymlinkMap();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int writer = 0; writer < 4; writer++) {
                int offset = writer * 100;
                futures.add(executor.submit(() -> {
                    for (int i = offset; i < offset + 100; i++) {
                        symlinks.put(Paths.get("/cache/" + i + ".jar"), Paths.get("/links/" + i + ".jar"));
                        assertThat(symlinks.snapshot()).containsKey(Paths.get("/cache/" + i + ".jar"));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(symlinks.snapshot()).hasSize(400);
    }
}
