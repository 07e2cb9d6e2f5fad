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

package com.palantir.attribution.datamodel.graph;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.palantir.attribution.datamodel.Target;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a file identifier (absolute source path, class file path, relative class file path or archive entry name) to
 *   the targets that own it.
 *
 * Owners are kept in registration order: the value is usually a singleton, since a source or class file belongs to a
 *   single target, but an archive entry may be provided (transitively or not) by several library targets. Whatever
 *   registered first is the canonical owner, so direct owners always come before archive-derived ones.
 */
public final class FileOwnershipIndex {
    private static final FileOwnershipIndex EMPTY = new FileOwnershipIndex(ImmutableSetMultimap.of());

    private final ImmutableSetMultimap<String, Target> ownersByFile;

    private FileOwnershipIndex(ImmutableSetMultimap<String, Target> ownersByFile) {
        this.ownersByFile = ownersByFile;
    }

    public static FileOwnershipIndex empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ImmutableSet<Target> ownersOf(String file) {
        return ownersByFile.get(file);
    }

    public ImmutableSet<Target> ownersOf(Path file) {
        return ownersOf(file.toString());
    }

    public Optional<Target> canonicalOwner(String file) {
        return ownersOf(file).stream().findFirst();
    }

    public Optional<Target> canonicalOwner(Path file) {
        return canonicalOwner(file.toString());
    }

    public Set<String> files() {
        return ownersByFile.keySet();
    }

    /**
     * Files owned by more than one target, with their owners in precedence order.
     */
    public Map<String, Set<Target>> ambiguousFiles() {
        ImmutableMap.Builder<String, Set<Target>> ambiguous = ImmutableMap.builder();
        for (Map.Entry<String, Collection<Target>> entry : ownersByFile.asMap().entrySet()) {
            if (entry.getValue().size() > 1) {
                ambiguous.put(entry.getKey(), ImmutableSet.copyOf(entry.getValue()));
            }
        }
        return ambiguous.buildOrThrow();
    }

    public ImmutableSetMultimap<String, Target> asMultimap() {
        return ownersByFile;
    }

    public int size() {
        return ownersByFile.keySet().size();
    }

    public boolean isEmpty() {
        return ownersByFile.isEmpty();
    }

    @Override
    public String toString() {
        return "FileOwnershipIndex{" + size() + " files}";
    }

    /**
     * Accumulates owners per file. Registering a file again adds an owner rather than replacing the existing ones.
     */
    public static final class Builder {
        private final SetMultimap<String, Target> ownersByFile = LinkedHashMultimap.create();

        private Builder() {}

        public Builder register(String file, Target owner) {
            ownersByFile.put(file, owner);
            return this;
        }

        public Builder register(Path file, Target owner) {
            return register(file.toString(), owner);
        }

        public FileOwnershipIndex build() {
            return new FileOwnershipIndex(ImmutableSetMultimap.copyOf(ownersByFile));
        }
    }
}
