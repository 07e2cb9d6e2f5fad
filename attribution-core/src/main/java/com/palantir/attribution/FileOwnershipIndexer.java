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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.palantir.attribution.datamodel.CompiledOutput;
import com.palantir.attribution.datamodel.LibraryReference;
import com.palantir.attribution.datamodel.Target;
import com.palantir.attribution.datamodel.graph.FileOwnershipIndex;
import com.palantir.attribution.resolve.ModuleRef;
import com.palantir.attribution.resolve.ResolutionReport;
import com.palantir.attribution.resolve.ResolvedCoordinateMap;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link FileOwnershipIndex}: which targets produced each source file, class file and archive entry.
 *
 * Registration happens in a single pass whose order is the precedence contract of the index:
 *   - declared sources, attributed to their target (derived sources to the outer target)
 *   - compiled outputs, under both their relative and absolute paths
 *   - class files of resolved archives, attributed to every library target declaring the coordinate
 * so a direct producer always comes before any library that also provides the same class file.
 */
public final class FileOwnershipIndexer {
    private static final Logger log = LoggerFactory.getLogger(FileOwnershipIndexer.class);

    private final ArchiveIndex archiveIndex;

    public FileOwnershipIndexer(ArchiveIndex archiveIndex) {
        this.archiveIndex = archiveIndex;
    }

    public FileOwnershipIndex index(AttributionContext context) {
        FileOwnershipIndex.Builder index = FileOwnershipIndex.builder();

        // Multiple library targets can provide the same (org, name)
        SetMultimap<LibraryReference, Target> librariesByReference = LinkedHashMultimap.create();

        log.debug("Mapping sources...");
        Path buildRoot = context.buildRoot();
        for (Target target : context.targetGraph().targets()) {
            switch (target.kind()) {
                case SOURCE:
                case GENERATED:
                    registerSources(index, buildRoot, target, target);
                    break;
                case DERIVED_WRAPPER:
                    registerSources(index, buildRoot, target, target);
                    // Generated sources of another language belong to the target consuming them
                    for (Target derived : target.derivedTargets()) {
                        registerSources(index, buildRoot, derived, target);
                    }
                    break;
                case LIBRARY:
                    for (LibraryReference reference : target.libraryReferences()) {
                        librariesByReference.put(reference, target);
                    }
                    break;
                default:
                    throw new IllegalStateException("Unknown target kind: " + target.kind());
            }
        }

        log.debug("Mapping classes...");
        context.compiledOutputs().outputs().forEach((target, output) -> registerOutput(index, target, output));

        log.debug("Mapping jars...");
        registerArchives(index, context, librariesByReference);

        FileOwnershipIndex ownershipIndex = index.build();
        log.info("Attributed {} files to targets", ownershipIndex.size());
        return ownershipIndex;
    }

    private static void registerSources(FileOwnershipIndex.Builder index, Path buildRoot, Target sources, Target owner) {
        for (String source : sources.sources()) {
            index.register(buildRoot.resolve(source), owner);
        }
    }

    private static void registerOutput(FileOwnershipIndex.Builder index, Target target, CompiledOutput output) {
        index.register(output.relativePath(), target);
        index.register(output.absolutePath(), target);
    }

    private void registerArchives(
            FileOwnershipIndex.Builder index,
            AttributionContext context,
            SetMultimap<LibraryReference, Target> librariesByReference) {
        Optional<List<ResolutionReport>> reports = context.resolutionReports();
        if (reports.isEmpty()) {
            log.debug("No resolution performed in this invocation, skipping archive attribution");
            return;
        }

        // The live map is shared with the resolve phases, from here on we only use this copy
        ImmutableMap<Path, Path> symlinks = context.symlinkMap().snapshot();

        for (ResolutionReport report : reports.get()) {
            ResolvedCoordinateMap coordinates = new ResolvedCoordinateMap(report);
            for (ModuleRef ref : coordinates.modules()) {
                Set<Target> libraries = librariesByReference.get(ref.libraryReference());
                if (libraries.isEmpty()) {
                    continue;
                }
                // These targets provide all the archives of ref, and all the ones ref transitively depends on
                for (Path archive : coordinates.transitiveArchives(ref)) {
                    Path symlink = symlinks.get(realPath(archive));
                    if (symlink == null) {
                        log.debug("Resolved archive {} was not materialized, skipping it", archive);
                        continue;
                    }
                    for (String classfile : archiveIndex.entries(symlink)) {
                        for (Target library : libraries) {
                            index.register(classfile, library);
                        }
                    }
                }
            }
        }
    }

    @VisibleForTesting
    static Path realPath(Path archive) {
        try {
            return archive.toRealPath();
        } catch (NoSuchFileException e) {
            return archive.toAbsolutePath().normalize();
        } catch (IOException e) {
            throw new AttributionException("Failed to resolve the real path of archive", archive, e);
        }
    }
}
