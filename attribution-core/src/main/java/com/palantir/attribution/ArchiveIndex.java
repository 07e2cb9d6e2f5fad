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

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * Lists the compiled artifacts (class files) contained in archives.
 *
 * Listings are cached per archive path, so an archive is opened once and each later call re-derives its result from
 *   the cached listing. An archive that can't be read fails the whole attribution.
 */
public final class ArchiveIndex {
    private final String classfileSuffix;
    private final LoadingCache<Path, ImmutableList<String>> entriesByArchive;

    public ArchiveIndex() {
        this(AttributionConfiguration.defaults());
    }

    public ArchiveIndex(AttributionConfiguration configuration) {
        this.classfileSuffix = configuration.classfileSuffix();
        Caffeine<Object, Object> builder = Caffeine.newBuilder();
        configuration.archiveCacheMaximumSize().ifPresent(builder::maximumSize);
        this.entriesByArchive = builder.build(this::listEntries);
    }

    /**
     * Returns the names of the class file entries of the archive, e.g. {@code com/acme/Widget.class}.
     *
     * @throws AttributionException if the archive can't be opened or is corrupt
     */
    public ImmutableList<String> entries(Path archive) {
        return entriesByArchive.get(archive.toAbsolutePath().normalize());
    }

    @VisibleForTesting
    ImmutableList<String> listEntries(Path archive) {
        try (JarFile jarFile = new JarFile(archive.toFile())) {
            return jarFile.stream()
                    .map(JarEntry::getName)
                    .filter(name -> name.endsWith(classfileSuffix))
                    .collect(ImmutableList.toImmutableList());
        } catch (IOException e) {
            throw new AttributionException("Failed to list entries of archive", archive, e);
        }
    }
}
