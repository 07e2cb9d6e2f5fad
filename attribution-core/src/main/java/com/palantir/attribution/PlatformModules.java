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

import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.lang.module.ModuleFinder;
import java.lang.module.ModuleReader;
import java.lang.module.ModuleReference;
import java.util.Comparator;
import java.util.List;

/**
 * Lists the class files of the running JDK's system modules. Only used on Java 9 and later, where the boot class path
 *   no longer exists.
 */
final class PlatformModules {
    private static final String MODULE_INFO = "module-info.class";

    static ImmutableSet<String> classfiles(String classfileSuffix) {
        ImmutableSet.Builder<String> classfiles = ImmutableSet.builder();
        List<ModuleReference> moduleReferences = ModuleFinder.ofSystem().findAll().stream()
                .sorted(Comparator.comparing(reference -> reference.descriptor().name()))
                .toList();

        for (ModuleReference moduleReference : moduleReferences) {
            String moduleName = moduleReference.descriptor().name();
            try (ModuleReader reader = moduleReference.open()) {
                reader.list()
                        .filter(name -> name.endsWith(classfileSuffix))
                        .filter(name -> !name.equals(MODULE_INFO))
                        .forEach(classfiles::add);
            } catch (IOException e) {
                throw new AttributionException("Failed to read platform module " + moduleName, e);
            }
        }
        return classfiles.build();
    }

    private PlatformModules() {}
}
