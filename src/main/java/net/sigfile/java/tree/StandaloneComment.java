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

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;

/**
 * A comment that stands in a scope body on its own rather than documenting a declaration, such as
 * a comment at the end of a body or one set off from the next declaration by blank lines. It
 * renders at the indentation of the body.
 */
public final class StandaloneComment extends Stmt {

  private final Comment comment;

  public StandaloneComment(String text) {
    this(text, null);
  }

  public StandaloneComment(String text, @Nullable Location location) {
    super(Kind.COMMENT, location);
    this.comment = new Comment(checkNotNull(text), location);
  }

  public Comment getComment() {
    return comment;
  }

  public String getText() {
    return comment.getText();
  }

  /** A standalone comment has no name of its own; it reports the name of its enclosing scope. */
  @Override
  public String qualifiedName() {
    return parentQualifiedName();
  }

  @Override
  public StandaloneComment copy() {
    return withCommonPartsOf(new StandaloneComment(getText()));
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
