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

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.SortedSetMultimap;
import com.google.common.collect.TreeMultimap;
import com.palantir.attribution.datamodel.Target;
import com.palantir.attribution.datamodel.graph.FileOwnershipIndex;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public final class OwnershipPrinter {
    private static final String BRANCH = "  |- ";
    private static final String LAST_BRANCH = "  \\- ";
    private static final String CONTINUATION = "  |   ";
    private static final String LAST_CONTINUATION = "      ";

    /**
     * This outputs the files owned by several targets, in the following format:
     *  "canonical owner"
     *    |- "file"
     *    |   \- Also provided by: "other owner", "other owner"
     *    \- "file"
     *        \- Also provided by: "other owner"
     *  etc...
     */
    public static String outputAmbiguousOwnership(FileOwnershipIndex index) {
        Map<String, Set<Target>> ambiguousFiles = ImmutableSortedMap.copyOf(index.ambiguousFiles());
        if (ambiguousFiles.isEmpty()) {
            return "Every file has a single owner.\n";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(ambiguousFiles.size() + " files are provided by several targets. ");
        sb.append("The first target listed for each file is considered its canonical owner.\n\n");

        // Both owners and their files come out sorted, which keeps the report stable across runs
        SortedSetMultimap<String, String> filesByCanonicalOwner = TreeMultimap.create();
        ambiguousFiles.forEach((file, owners) -> filesByCanonicalOwner.put(canonicalName(owners), file));

        filesByCanonicalOwner.asMap().forEach((owner, files) -> {
            sb.append("Owned by: " + owner + "\n");
            outputFiles(sb, files, ambiguousFiles);
            sb.append("\n");
        });

        return sb.toString();
    }

    private static void outputFiles(StringBuilder sb, Collection<String> files, Map<String, Set<Target>> ownersByFile) {
        Iterator<String> iterator = files.iterator();
        while (iterator.hasNext()) {
            String file = iterator.next();
            boolean isLastFile = !iterator.hasNext();
            String otherOwners = ownersByFile.get(file).stream()
                    .skip(1)
                    .map(target -> target.address().toString())
                    .collect(Collectors.joining(", "));

            sb.append((isLastFile ? LAST_BRANCH : BRANCH) + file + "\n");
            sb.append((isLastFile ? LAST_CONTINUATION : CONTINUATION) + "\\- Also provided by: " + otherOwners + "\n");
        }
    }

    private static String canonicalName(Set<Target> owners) {
        return owners.iterator().next().address().toString();
    }

    private OwnershipPrinter() {
        // cannot instantiate
    }
}
