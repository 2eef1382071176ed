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
 * A type-system helper call rendered with a bang and no arguments: {@code abstract!}, {@code
 * interface!}, {@code sealed!}, or any custom {@code name!}.
 */
public final class Helper extends Send {

  public static final String ABSTRACT = "abstract";
  public static final String INTERFACE = "interface";
  public static final String SEALED = "sealed";

  private final String name;

  public Helper(String name) {
    this(name, null);
  }

  public Helper(String name, @Nullable Location location) {
    super(Kind.HELPER, name + "!", ImmutableList.of(), null, location);
    this.name = name;
  }

  /** Returns the helper name without the bang. */
  public String getName() {
    return name;
  }

  @Override
  public Helper copy() {
    return withCommonPartsOf(new Helper(name));
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
