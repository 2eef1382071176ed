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

/** A constant declaration, {@code Name} or {@code Name = value}. The value is raw text. */
public final class Const extends Stmt {

  private final String name;
  @Nullable private final String value;

  public Const(String name, @Nullable String value) {
    this(name, value, null);
  }

  public Const(String name, @Nullable String value, @Nullable Location location) {
    super(Kind.CONST, location);
    this.name = name;
    this.value = value;
  }

  public String getName() {
    return name;
  }

  @Nullable
  public String getValue() {
    return value;
  }

  @Override
  public String qualifiedName() {
    return qualify(name);
  }

  @Override
  public Const copy() {
    return withCommonPartsOf(new Const(name, value));
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
