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
 * The synthetic top scope of a declaration tree. It is never printed as a header; its comments are
 * the header comments of the file. A tree lives exactly as long as its root.
 */
public final class Root extends Scope {

  public Root() {
    this(null);
  }

  public Root(@Nullable Location location) {
    super(Kind.ROOT, "<root>", location);
  }

  /** The root's qualified name is always the empty string. */
  @Override
  public String qualifiedName() {
    return "";
  }

  @Override
  public Root emptyCopy() {
    return withCommonPartsOf(new Root());
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
