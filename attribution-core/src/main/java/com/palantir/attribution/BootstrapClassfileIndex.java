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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The class files provided by the platform itself rather than by any target, so they can be excluded from
 *   attribution.
 *
 * Note: the legacy class path properties assume HotSpot, or some JVM that supports {@code sun.boot.class.path}.
 */
public final class BootstrapClassfileIndex {
    private static final Logger log = LoggerFactory.getLogger(BootstrapClassfileIndex.class);

    static final String BOOT_CLASS_PATH = "sun.boot.class.path";
    static final String ENDORSED_DIRS = "java.endorsed.dirs";
    static final String EXTENSION_DIRS = "java.ext.dirs";
    private static final ImmutableList<String> LEGACY_CLASS_PATH_PROPERTIES =
            ImmutableList.of(ENDORSED_DIRS, BOOT_CLASS_PATH, EXTENSION_DIRS);

    private static final Splitter PATH_SPLITTER =
            Splitter.on(File.pathSeparatorChar).omitEmptyStrings().trimResults();

    private final DistributionLocator distributionLocator;
    private final ArchiveIndex archiveIndex;
    private final AttributionConfiguration configuration;
    private final Supplier<ImmutableSet<String>> classfiles = Suppliers.memoize(this::computeClassfiles);

    public BootstrapClassfileIndex(
            DistributionLocator distributionLocator,
            ArchiveIndex archiveIndex,
            AttributionConfiguration configuration) {
        this.distributionLocator = distributionLocator;
        this.archiveIndex = archiveIndex;
        this.configuration = configuration;
    }

    /**
     * Names of all bootstrap class files, e.g. {@code java/lang/Object.class}. Computed once.
     */
    public ImmutableSet<String> classfiles() {
        return classfiles.get();
    }

    public boolean isBootstrapClassfile(String classfile) {
        return classfiles().contains(classfile);
    }

    private ImmutableSet<String> computeClassfiles() {
        Map<String, String> systemProperties = distributionLocator.systemProperties();
        if (LEGACY_CLASS_PATH_PROPERTIES.stream().noneMatch(systemProperties::containsKey)) {
            if (configuration.includePlatformModules() && distributionLocator.isCurrentRuntime()) {
                log.debug("No legacy class path exposed, using the system modules of the running JDK");
                return PlatformModules.classfiles(configuration.classfileSuffix());
            }
            log.debug("No legacy class path exposed by the distribution, no bootstrap classes known");
            return ImmutableSet.of();
        }

        ImmutableSet.Builder<String> bootstrapClassfiles = ImmutableSet.builder();
        for (Path archive : findBootstrapArchives()) {
            bootstrapClassfiles.addAll(archiveIndex.entries(archive));
        }
        return bootstrapClassfiles.build();
    }

    /**
     * Returns the bootstrap archives in classloading order: overrides, then the boot class path, then extensions.
     * Overrides and extensions must be jars, loose class files there are not seen by the JVM. Loose class directories
     * on the boot class path are left out as only regular files are kept.
     */
    @VisibleForTesting
    List<Path> findBootstrapArchives() {
        List<Path> overrideJars = findJarsInDirectories(pathProperty(ENDORSED_DIRS));
        List<Path> bootClassPath = pathProperty(BOOT_CLASS_PATH);
        List<Path> extensionJars = findJarsInDirectories(pathProperty(EXTENSION_DIRS));

        return Stream.of(overrideJars, bootClassPath, extensionJars)
                .flatMap(List::stream)
                .filter(Files::isRegularFile)
                .collect(ImmutableList.toImmutableList());
    }

    private List<Path> pathProperty(String key) {
        String value = distributionLocator.systemProperties().getOrDefault(key, "");
        return PATH_SPLITTER.splitToStream(value).map(Paths::get).collect(ImmutableList.toImmutableList());
    }

    private static List<Path> findJarsInDirectories(List<Path> directories) {
        ImmutableList.Builder<Path> jars = ImmutableList.builder();
        for (Path directory : directories) {
            if (!Files.isDirectory(directory)) {
                continue;
            }
            try (Stream<Path> files = Files.list(directory)) {
                files.filter(file -> file.getFileName().toString().endsWith(".jar"))
                        .sorted()
                        .forEach(jars::add);
            } catch (IOException e) {
                throw new AttributionException("Failed to list bootstrap directory", directory, e);
            }
        }
        return jars.build();
    }
}
