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
package net.sigfile.java.rewrite;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import net.sigfile.java.tree.Root;

/** The outcome of {@link Merger#merge}: a combined tree and the conflicts found building it. */
@AutoValue
public abstract class MergeResult {

  public abstract Root tree();

  public abstract ImmutableList<Conflict> conflicts();

  public final boolean hasConflicts() {
    return !conflicts().isEmpty();
  }

  static MergeResult create(Root tree, ImmutableList<Conflict> conflicts) {
    return new AutoValue_MergeResult(tree, conflicts);
  }
}
