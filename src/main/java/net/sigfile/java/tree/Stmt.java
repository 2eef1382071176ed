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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Base class for all statements of a declaration tree.
 *
 * <p>A statement owns its comments and belongs to at most one {@link Scope}. The link to the
 * enclosing scope is a back-reference maintained exclusively by {@link Scope}; it is null while
 * the statement is unattached.
 */
public abstract class Stmt extends Node {

  /**
   * Kind of the statement. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public enum Kind {
    ROOT,
    MODULE,
    CLASS,
    SINGLETON_CLASS,
    STRUCT,
    CONST,
    DEF,
    ATTR,
    SEND,
    MIXIN,
    VISIBILITY,
    HELPER,
    MIXES_IN_CLASS_METHODS,
    TYPE_MEMBER,
    STRUCT_FIELD,
    ENUMS_BLOCK,
    BLANK_LINE,
    COMMENT,
  }

  // Materialize kind as a field so its accessor can be non-virtual.
  private final Kind kind;
  private final List<Comment> comments = new ArrayList<>();
  @Nullable private Scope parent;

  Stmt(Kind kind, @Nullable Location location) {
    super(location);
    this.kind = kind;
  }

  /**
   * Kind of the statement. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public final Kind kind() {
    return kind;
  }

  /** Returns the scope whose body holds this statement, or null if it is unattached. */
  @Nullable
  public final Scope getParent() {
    return parent;
  }

  // Only Scope may call this.
  final void setParent(@Nullable Scope parent) {
    this.parent = parent;
  }

  public final List<Comment> getComments() {
    return Collections.unmodifiableList(comments);
  }

  @CanIgnoreReturnValue
  public final Stmt addComment(Comment comment) {
    comments.add(comment);
    return this;
  }

  @CanIgnoreReturnValue
  public final Stmt addComments(Iterable<Comment> comments) {
    for (Comment comment : comments) {
      addComment(comment);
    }
    return this;
  }

  /** Returns true if one of the comments of this statement reads exactly {@code text}. */
  public final boolean hasComment(String text) {
    for (Comment comment : comments) {
      if (comment.hasText(text)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the fully path-prefixed name of this statement, derived from the chain of enclosing
   * scopes. The root scope contributes the empty string.
   */
  public abstract String qualifiedName();

  /**
   * Returns a deep copy of this statement: comments, location and, for scopes, the whole body. The
   * copy is unattached.
   */
  public abstract Stmt copy();

  /** Copies the comments and location of this statement to {@code copy}, and returns it. */
  final <T extends Stmt> T withCommonPartsOf(T copy) {
    copy.setLocation(getLocation());
    for (Comment comment : comments) {
      copy.addComment(comment.copy());
    }
    return copy;
  }

  /** Returns the qualified name of the enclosing scope, or the empty string if there is none. */
  final String parentQualifiedName() {
    return parent == null ? "" : parent.qualifiedName();
  }

  /**
   * Joins {@code name} to the qualified name of the enclosing scope with {@code ::}. A name that
   * already starts with {@code ::} is absolute and returned as is.
   */
  final String qualify(String name) {
    if (name.startsWith("::")) {
      return name;
    }
    String prefix = parentQualifiedName();
    return prefix.isEmpty() ? name : prefix + "::" + name;
  }
}
