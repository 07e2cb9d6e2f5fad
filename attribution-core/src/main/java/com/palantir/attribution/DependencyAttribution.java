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

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableSet;
import com.palantir.attribution.datamodel.graph.FileOwnershipIndex;
import com.palantir.attribution.datamodel.graph.TransitiveDependencyMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for downstream dependency analysis: holds the attribution indexes of a single build invocation.
 *
 * Each index is computed on first access, at most once, and is immutable afterwards. Nothing is kept across
 *   invocations: create a new instance for each one.
 */
public final class DependencyAttribution {
    private static final Logger log = LoggerFactory.getLogger(DependencyAttribution.class);

    private final AttributionContext context;
    private final AttributionConfiguration configuration;
    private final ArchiveIndex archiveIndex;
    private final BootstrapClassfileIndex bootstrapClassfileIndex;

    private final Supplier<FileOwnershipIndex> fileOwnershipIndex = Suppliers.memoize(this::computeFileOwnershipIndex);
    private final Supplier<TransitiveDependencyMap> transitiveDependencies =
            Suppliers.memoize(this::computeTransitiveDependencies);

    private DependencyAttribution(AttributionContext context, AttributionConfiguration configuration) {
        this.context = context;
        this.configuration = configuration;
        this.archiveIndex = new ArchiveIndex(configuration);
        this.bootstrapClassfileIndex =
                new BootstrapClassfileIndex(context.distributionLocator(), archiveIndex, configuration);
    }

    public static DependencyAttribution create(AttributionContext context) {
        return create(context, AttributionConfiguration.defaults());
    }

    public static DependencyAttribution create(AttributionContext context, AttributionConfiguration configuration) {
        if (configuration.skip()) {
            log.info("Dependency attribution is skipped, all indexes will be empty");
        }
        return new DependencyAttribution(context, configuration);
    }

    /**
     * Maps every known source file, class file and archive entry to the targets owning it.
     *
     * @throws AttributionException if an archive that should be indexed can't be read
     */
    public FileOwnershipIndex fileOwnershipIndex() {
        return fileOwnershipIndex.get();
    }

    /**
     * Class files provided by the platform rather than by any target.
     */
    public ImmutableSet<String> bootstrapClassfiles() {
        if (configuration.skip()) {
            return ImmutableSet.of();
        }
        return bootstrapClassfileIndex.classfiles();
    }

    public TransitiveDependencyMap transitiveDependencies() {
        return transitiveDependencies.get();
    }

    public ArchiveIndex archiveIndex() {
        return archiveIndex;
    }

    private FileOwnershipIndex computeFileOwnershipIndex() {
        if (configuration.skip()) {
            return FileOwnershipIndex.empty();
        }
        return new FileOwnershipIndexer(archiveIndex).index(context);
    }

    private TransitiveDependencyMap computeTransitiveDependencies() {
        if (configuration.skip()) {
            return TransitiveDependencyMap.empty();
        }
        return TransitiveDependencyComputer.compute(context.targetGraph());
    }
}
