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
import com.google.common.base.Preconditions;
import java.util.Objects;

/**
 * Unique identifier of a target in the build graph, e.g. {@code src/java/com/acme:lib-core}.
 */
public record TargetAddress(String address) implements Comparable<TargetAddress> {
    public TargetAddress {
        Objects.requireNonNull(address, "address");
        Preconditions.checkArgument(!address.isBlank(), "Target address must not be blank");
    }

    public static TargetAddress of(String address) {
        return new TargetAddress(address);
    }

    @Override
    public int compareTo(TargetAddress other) {
        return address.compareTo(other.address);
    }

    @JsonValue
    @Override
    public String toString() {
        return address;
    }
}
