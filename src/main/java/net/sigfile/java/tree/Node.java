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
package net.sigfile.java.tree;

import javax.annotation.Nullable;

/**
 * Base class of every element of a declaration tree: statements, comments, parameters and
 * signatures.
 */
public abstract class Node {

  @Nullable private Location location;

  Node(@Nullable Location location) {
    this.location = location;
  }

  /** Returns the source span of this node, or null if it was not read from a file. */
  @Nullable
  public final Location getLocation() {
    return location;
  }

  public final void setLocation(@Nullable Location location) {
    this.location = location;
  }

  /**
   * Implements the double dispatch by invoking into the node specific <code>visit</code> method of
   * the {@link NodeVisitor}
   *
   * @param visitor the {@link NodeVisitor} instance to dispatch to.
   */
  public abstract void accept(NodeVisitor visitor);

  /** Returns the canonical text of this node, as rendered with the default printer options. */
  @Override
  public String toString() {
    return Printer.render(this);
  }
}
