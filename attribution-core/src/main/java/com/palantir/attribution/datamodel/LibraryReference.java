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

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;

/**
 * Symbolic (organization, name) coordinate of an externally resolved library. The revision is deliberately not
 * part of it: every resolved revision of the coordinate is attributed to the targets declaring it.
 */
public record LibraryReference(String org, String name) {
    public LibraryReference {
        Objects.requireNonNull(org, "org");
        Objects.requireNonNull(name, "name");
    }

    public static LibraryReference of(String org, String name) {
        return new LibraryReference(org, name);
    }

    @JsonValue
    @Override
    public String toString() {
        return org + ":" + name;
    }
}
