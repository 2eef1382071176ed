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

/**
 * A {@code Name = ::Struct.new(:a, :b)} declaration, optionally followed by a block whose body
 * holds the struct's own methods.
 */
public final class StructScope extends Scope {

  private final ImmutableList<String> members;
  private final boolean keywordInit;

  public StructScope(String name, List<String> members) {
    this(name, members, false, null);
  }

  public StructScope(
      String name, List<String> members, boolean keywordInit, @Nullable Location location) {
    super(Kind.STRUCT, name, location);
    this.members = ImmutableList.copyOf(members);
    this.keywordInit = keywordInit;
  }

  /** Returns the member names, without the leading colon. */
  public ImmutableList<String> getMembers() {
    return members;
  }

  public boolean isKeywordInit() {
    return keywordInit;
  }

  @Override
  public StructScope emptyCopy() {
    return withCommonPartsOf(new StructScope(getName(), members, keywordInit, null));
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
