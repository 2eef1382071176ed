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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import javax.annotation.Nullable;

/** The {@code enums do A = new; B = new end} block of a typed enum class. */
public final class EnumsBlock extends Send {

  public EnumsBlock(String... names) {
    this(ImmutableList.copyOf(names), null);
  }

  public EnumsBlock(List<String> names, @Nullable Location location) {
    super(Kind.ENUMS_BLOCK, "enums", names, null, location);
  }

  public List<String> getNames() {
    return getArgs();
  }

  @CanIgnoreReturnValue
  public EnumsBlock addName(String name) {
    addArg(name);
    return this;
  }

  @Override
  public EnumsBlock copy() {
    return withCommonPartsOf(new EnumsBlock(getArgs(), null));
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
