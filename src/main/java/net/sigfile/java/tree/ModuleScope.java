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

/** A {@code module Name} declaration. */
public final class ModuleScope extends Scope {

  public ModuleScope(String name) {
    this(name, null);
  }

  public ModuleScope(String name, @Nullable Location location) {
    super(Kind.MODULE, name, location);
  }

  @Override
  public ModuleScope emptyCopy() {
    return withCommonPartsOf(new ModuleScope(getName()));
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
