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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A comment attached to a statement or parameter. The text excludes the leading {@code #} and may
 * span several lines; each embedded line is rendered as its own {@code #} line.
 */
public final class Comment extends Node {

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');

  private final String text;

  public Comment(String text) {
    this(text, null);
  }

  public Comment(String text, @Nullable Location location) {
    super(location);
    this.text = text;
  }

  public String getText() {
    return text;
  }

  /**
   * Returns the lines of this comment with trailing whitespace removed. A single trailing newline
   * does not start a new line, and an empty comment has no lines at all.
   */
  public ImmutableList<String> getLines() {
    String body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    if (body.isEmpty()) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    for (String line : LINE_SPLITTER.split(body)) {
      lines.add(line.stripTrailing());
    }
    return lines.build();
  }

  /** Returns true if this comment reads exactly {@code text}, ignoring surrounding whitespace. */
  public boolean hasText(String text) {
    return this.text.strip().equals(text);
  }

  Comment copy() {
    return new Comment(text, getLocation());
  }

  static ImmutableList<String> linesOf(List<Comment> comments) {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    for (Comment comment : comments) {
      lines.addAll(comment.getLines());
    }
    return lines.build();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
