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
 * Syntax node for a method parameter, either in a {@code def} parameter list or in the {@code
 * params(...)} operation of a signature.
 *
 * <p>The seven concrete kinds form a closed family; the type and default value are raw text.
 */
public abstract class Param extends Node {

  /** The parameter kinds, in the order the host language requires them to be declared. */
  public enum Kind {
    REQUIRED,
    OPTIONAL,
    REST,
    KEYWORD,
    KEYWORD_OPTIONAL,
    KEYWORD_REST,
    BLOCK,
  }

  private final Kind kind;
  private final String name;
  @Nullable private final String type;
  private final List<Comment> comments = new ArrayList<>();

  private Param(Kind kind, String name, @Nullable String type, @Nullable Location location) {
    super(location);
    this.kind = kind;
    this.name = name;
    this.type = type;
  }

  public final Kind kind() {
    return kind;
  }

  public final String getName() {
    return name;
  }

  /** Returns the type annotation, or null if the parameter is untyped. */
  @Nullable
  public final String getType() {
    return type;
  }

  /** Returns the default value, or null for parameters that cannot have one. */
  @Nullable
  public String getDefaultValue() {
    return null;
  }

  public final List<Comment> getComments() {
    return Collections.unmodifiableList(comments);
  }

  @CanIgnoreReturnValue
  public final Param addComment(Comment comment) {
    comments.add(comment);
    return this;
  }

  /** Returns a copy of this parameter with the same kind, name and default but a new type. */
  public abstract Param withType(@Nullable String type);

  final Param copy() {
    Param copy = withType(type);
    copy.setLocation(getLocation());
    for (Comment comment : comments) {
      copy.addComment(comment.copy());
    }
    return copy;
  }

  @Override
  public final void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /** A mandatory positional parameter, {@code a}. */
  public static final class Required extends Param {
    public Required(String name) {
      this(name, null);
    }

    public Required(String name, @Nullable String type) {
      super(Kind.REQUIRED, name, type, null);
    }

    @Override
    public Required withType(@Nullable String type) {
      return new Required(getName(), type);
    }
  }

  /** An optional positional parameter, {@code b = 42}. */
  public static final class Optional extends Param {
    private final String defaultValue;

    public Optional(String name, String defaultValue) {
      this(name, defaultValue, null);
    }

    public Optional(String name, String defaultValue, @Nullable String type) {
      super(Kind.OPTIONAL, name, type, null);
      this.defaultValue = defaultValue;
    }

    @Override
    public String getDefaultValue() {
      return defaultValue;
    }

    @Override
    public Optional withType(@Nullable String type) {
      return new Optional(getName(), defaultValue, type);
    }
  }

  /** A splat parameter, {@code *c}. */
  public static final class Rest extends Param {
    public Rest(String name) {
      this(name, null);
    }

    public Rest(String name, @Nullable String type) {
      super(Kind.REST, name, type, null);
    }

    @Override
    public Rest withType(@Nullable String type) {
      return new Rest(getName(), type);
    }
  }

  /** A mandatory keyword parameter, {@code d:}. */
  public static final class Keyword extends Param {
    public Keyword(String name) {
      this(name, null);
    }

    public Keyword(String name, @Nullable String type) {
      super(Kind.KEYWORD, name, type, null);
    }

    @Override
    public Keyword withType(@Nullable String type) {
      return new Keyword(getName(), type);
    }
  }

  /** An optional keyword parameter, {@code e: 'bar'}. */
  public static final class KeywordOptional extends Param {
    private final String defaultValue;

    public KeywordOptional(String name, String defaultValue) {
      this(name, defaultValue, null);
    }

    public KeywordOptional(String name, String defaultValue, @Nullable String type) {
      super(Kind.KEYWORD_OPTIONAL, name, type, null);
      this.defaultValue = defaultValue;
    }

    @Override
    public String getDefaultValue() {
      return defaultValue;
    }

    @Override
    public KeywordOptional withType(@Nullable String type) {
      return new KeywordOptional(getName(), defaultValue, type);
    }
  }

  /** A double-splat parameter, {@code **f}. */
  public static final class KeywordRest extends Param {
    public KeywordRest(String name) {
      this(name, null);
    }

    public KeywordRest(String name, @Nullable String type) {
      super(Kind.KEYWORD_REST, name, type, null);
    }

    @Override
    public KeywordRest withType(@Nullable String type) {
      return new KeywordRest(getName(), type);
    }
  }

  /** A block parameter, {@code &g}. */
  public static final class Block extends Param {
    public Block(String name) {
      this(name, null);
    }

    public Block(String name, @Nullable String type) {
      super(Kind.BLOCK, name, type, null);
    }

    @Override
    public Block withType(@Nullable String type) {
      return new Block(getName(), type);
    }
  }
}
