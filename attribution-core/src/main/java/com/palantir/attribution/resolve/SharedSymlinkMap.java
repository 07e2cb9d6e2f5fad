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

import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.concurrent.GuardedBy;

/**
 * {@link SymlinkMap} that resolve phases write into while other phases read it. The lock is only held for the
 *   duration of a single update or copy.
 */
public final class SharedSymlinkMap implements SymlinkMap {
    private final Lock lock = new ReentrantLock();

    @GuardedBy("lock")
    private final Map<Path, Path> symlinksByRealPath = new HashMap<>();

    public void put(Path realPath, Path symlink) {
        lock.lock();
        try {
            symlinksByRealPath.put(realPath, symlink);
        } finally {
            lock.unlock();
        }
    }

    public void putAll(Map<Path, Path> symlinks) {
        lock.lock();
        try {
            symlinksByRealPath.putAll(symlinks);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ImmutableMap<Path, Path> snapshot() {
        lock.lock();
        try {
            return ImmutableMap.copyOf(symlinksByRealPath);
        } finally {
            lock.unlock();
        }
    }
}
