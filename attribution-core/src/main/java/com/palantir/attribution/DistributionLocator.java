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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Locates the Java distribution the build runs against, through its system properties.
 */
@FunctionalInterface
public interface DistributionLocator {
    String JAVA_HOME = "java.home";

    Map<String, String> systemProperties();

    /**
     * Whether this describes the JVM we are running in, whose modules can be read directly.
     */
    default boolean isCurrentRuntime() {
        String javaHome = systemProperties().get(JAVA_HOME);
        return javaHome != null && Objects.equals(javaHome, System.getProperty(JAVA_HOME));
    }

    static DistributionLocator current() {
        Properties properties = System.getProperties();
        ImmutableMap.Builder<String, String> systemProperties = ImmutableMap.builder();
        for (String name : properties.stringPropertyNames()) {
            systemProperties.put(name, properties.getProperty(name));
        }
        return of(systemProperties.buildOrThrow());
    }

    static DistributionLocator of(Map<String, String> systemProperties) {
        ImmutableMap<String, String> copy = ImmutableMap.copyOf(systemProperties);
        return () -> copy;
    }
}
