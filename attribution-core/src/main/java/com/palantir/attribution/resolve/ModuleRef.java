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

import com.fasterxml.jackson.annotation.JsonValue;
import com.palantir.attribution.datamodel.LibraryReference;
import java.util.Objects;

/**
 * A concrete module of a resolution report: an (org, name) coordinate at a resolved revision.
 */
public record ModuleRef(String org, String name, String rev) {
    public ModuleRef {
        Objects.requireNonNull(org, "org");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rev, "rev");
    }

    public static ModuleRef of(String org, String name, String rev) {
        return new ModuleRef(org, name, rev);
    }

    public LibraryReference libraryReference() {
        return LibraryReference.of(org, name);
    }

    @JsonValue
    @Override
    public String toString() {
        return rev.isEmpty() ? org + ":" + name : org + ":" + name + ":" + rev;
    }
}
