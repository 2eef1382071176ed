// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.sigfile.java.load;

import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import java.util.Map;
import net.sigfile.java.tree.Root;

/** Parses a batch of sources, skipping the ones that fail to parse. */
public final class TreeLoader {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private TreeLoader() {}

  /**
   * Parses each of {@code sources}, a map from file name to text, and returns the trees that were
   * built, by file name, in the iteration order of {@code sources}. Failures are logged.
   */
  public static ImmutableMap<String, Root> loadAll(
      SourceParser parser, Map<String, String> sources) {
    ImmutableMap.Builder<String, Root> trees = ImmutableMap.builder();
    int failed = 0;
    for (Map.Entry<String, String> source : sources.entrySet()) {
      Root tree = parser.parse(source.getKey(), source.getValue());
      if (tree == null) {
        logger.atWarning().log("%s: could not be parsed, skipping", source.getKey());
        failed++;
        continue;
      }
      trees.put(source.getKey(), tree);
    }
    logger.atFine().log("loaded %d of %d sources", sources.size() - failed, sources.size());
    return trees.buildOrThrow();
  }
}
