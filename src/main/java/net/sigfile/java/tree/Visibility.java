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
 * A {@code public}, {@code protected} or {@code private} marker changing the visibility of the
 * declarations that follow it in the same body.
 */
public final class Visibility extends Send {

  /** A visibility level, also used as the prefix of individual methods and attributes. */
  public enum Level {
    PUBLIC("public"),
    PROTECTED("protected"),
    PRIVATE("private");

    private final String keyword;

    Level(String keyword) {
      this.keyword = keyword;
    }

    public String keyword() {
      return keyword;
    }
  }

  private final Level level;

  public Visibility(Level level) {
    this(level, null);
  }

  public Visibility(Level level, @Nullable Location location) {
    super(Kind.VISIBILITY, level.keyword(), ImmutableList.of(), null, location);
    this.level = level;
  }

  public Level getLevel() {
    return level;
  }

  @Override
  public Visibility copy() {
    return withCommonPartsOf(new Visibility(level));
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
