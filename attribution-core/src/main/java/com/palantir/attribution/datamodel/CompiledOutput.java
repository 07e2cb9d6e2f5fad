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

import java.nio.file.Path;
import java.util.Objects;

/**
 * A compiled artifact, e.g. {@code com/acme/Widget.class}, together with the output directory it was written to.
 *
 * Both are kept separate since downstream consumers refer to class files by either form.
 */
public record CompiledOutput(Path outputDirectory, String relativePath) {
    public CompiledOutput {
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(relativePath, "relativePath");
    }

    public Path absolutePath() {
        return outputDirectory.resolve(relativePath);
    }

    public static CompiledOutput of(Path outputDirectory, String relativePath) {
        return new CompiledOutput(outputDirectory, relativePath);
    }
}
