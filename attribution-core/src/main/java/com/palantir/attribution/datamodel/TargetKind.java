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

/**
 * The closed set of target variants the attribution algorithms know how to handle.
 */
public enum TargetKind {
    /** Compiles its own declared sources, which it owns. */
    SOURCE,

    /** Aggregates externally resolved libraries through {@link Target#libraryReferences()}. */
    LIBRARY,

    /**
     * Compiles its own sources and also carries {@link Target#derivedTargets()}: generated sources in another
     * language whose files are attributed to this (outer) target.
     */
    DERIVED_WRAPPER,

    /** Produces code from declared inputs, e.g. protobuf definitions; owns its declared sources like {@link #SOURCE}. */
    GENERATED,
    ;
}
