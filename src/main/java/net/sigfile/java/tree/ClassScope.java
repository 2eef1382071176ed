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
 * A {@code class Name < Superclass} declaration. The superclass is raw text and optional.
 *
 * <p>Typed structs and enums are classes whose superclass is {@link #T_STRUCT} or {@link
 * #T_ENUM}.
 */
public final class ClassScope extends Scope {

  public static final String T_STRUCT = "::T::Struct";
  public static final String T_ENUM = "::T::Enum";

  @Nullable private String superclass;

  public ClassScope(String name) {
    this(name, null, null);
  }

  public ClassScope(String name, @Nullable String superclass) {
    this(name, superclass, null);
  }

  public ClassScope(String name, @Nullable String superclass, @Nullable Location location) {
    super(Kind.CLASS, name, location);
    this.superclass = superclass;
  }

  @Nullable
  public String getSuperclass() {
    return superclass;
  }

  public void setSuperclass(@Nullable String superclass) {
    this.superclass = superclass;
  }

  @Override
  public ClassScope emptyCopy() {
    return withCommonPartsOf(new ClassScope(getName(), superclass));
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
