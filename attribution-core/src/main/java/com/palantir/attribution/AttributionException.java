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

import java.nio.file.Path;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Raised when attribution cannot be computed at all, e.g. because an archive is unreadable or corrupt.
 *
 * This is distinct from a build failure: the build itself may be fine, but no index is produced for this invocation.
 */
public final class AttributionException extends RuntimeException {
    @Nullable
    private final Path file;

    public AttributionException(String message, Path file, Throwable cause) {
        super(message + ": " + file, cause);
        this.file = file;
    }

    public AttributionException(String message, Throwable cause) {
        super(message, cause);
        this.file = null;
    }

    /**
     * The file that could not be read, if the failure is tied to one.
     */
    public Optional<Path> file() {
        return Optional.ofNullable(file);
    }
}
