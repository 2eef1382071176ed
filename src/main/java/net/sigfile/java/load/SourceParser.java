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

import javax.annotation.Nullable;
import net.sigfile.java.tree.Root;

/**
 * Builds a declaration tree from the text of a source file. Implementations live outside this
 * library.
 */
public interface SourceParser {

  /**
   * Parses {@code text}, read from {@code filename}, and returns its tree, or null if the text
   * could not be parsed. Nodes of the returned tree should carry locations in {@code filename}.
   */
  @Nullable
  Root parse(String filename, String text);
}
