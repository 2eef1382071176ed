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

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * A generic type member declaration, {@code Name = type_member} or {@code Name = type_template}.
 * The right-hand side is raw text and may carry a block, as in {@code type_member { ... }}.
 */
public final class TypeMember extends Send {

  public static final String TYPE_MEMBER = "type_member";
  public static final String TYPE_TEMPLATE = "type_template";

  private final String name;

  public TypeMember(String name, String value) {
    this(name, value, null);
  }

  public TypeMember(String name, String value, @Nullable Location location) {
    super(Kind.TYPE_MEMBER, value, ImmutableList.of(), null, location);
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public String getValue() {
    return getMethod();
  }

  /** Type members are named like constants. */
  @Override
  public String qualifiedName() {
    return qualify(name);
  }

  @Override
  public TypeMember copy() {
    return withCommonPartsOf(new TypeMember(name, getValue()));
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
