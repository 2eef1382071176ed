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
import java.util.List;
import javax.annotation.Nullable;

/** An {@code include}, {@code extend} or {@code prepend} of one or more modules. */
public final class Mixin extends Send {

  /** The mixin call. */
  public enum Type {
    INCLUDE("include"),
    EXTEND("extend"),
    PREPEND("prepend");

    private final String keyword;

    Type(String keyword) {
      this.keyword = keyword;
    }

    public String keyword() {
      return keyword;
    }
  }

  private final Type type;

  public Mixin(Type type, List<String> names, @Nullable Location location) {
    super(Kind.MIXIN, type.keyword(), names, null, location);
    this.type = type;
  }

  public static Mixin include(String... names) {
    return new Mixin(Type.INCLUDE, ImmutableList.copyOf(names), null);
  }

  public static Mixin extend(String... names) {
    return new Mixin(Type.EXTEND, ImmutableList.copyOf(names), null);
  }

  public static Mixin prepend(String... names) {
    return new Mixin(Type.PREPEND, ImmutableList.copyOf(names), null);
  }

  public Type getType() {
    return type;
  }

  /** Returns the names of the mixed-in modules. */
  public List<String> getNames() {
    return getArgs();
  }

  @Override
  public Mixin copy() {
    return withCommonPartsOf(new Mixin(type, getArgs(), null));
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
