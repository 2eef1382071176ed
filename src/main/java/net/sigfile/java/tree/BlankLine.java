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
 * A non-semantic statement that renders as exactly one empty line. Consecutive blank lines are
 * never collapsed by the printer.
 */
public final class BlankLine extends Stmt {

  public BlankLine() {
    this(null);
  }

  public BlankLine(@Nullable Location location) {
    super(Kind.BLANK_LINE, location);
  }

  /** A blank line has no name of its own; it reports the name of its enclosing scope. */
  @Override
  public String qualifiedName() {
    return parentQualifiedName();
  }

  @Override
  public BlankLine copy() {
    return withCommonPartsOf(new BlankLine());
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
