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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One builder operation of a {@link Sig} chain, such as {@code abstract}, {@code params(...)} or
 * {@code returns(...)}. The eight concrete kinds form a closed family.
 */
public abstract class SigOp {

  /** Kind of the operation. */
  public enum Kind {
    ABSTRACT,
    OVERRIDE,
    OVERRIDABLE,
    TYPE_PARAMETERS,
    PARAMS,
    RETURNS,
    VOID,
    CHECKED,
  }

  private final Kind kind;

  private SigOp(Kind kind) {
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  abstract SigOp copy();

  /** A modifier without arguments: {@code abstract}, {@code override} or {@code overridable}. */
  public static final class Modifier extends SigOp {
    private Modifier(Kind kind) {
      super(kind);
    }

    public static Modifier abstractMethod() {
      return new Modifier(Kind.ABSTRACT);
    }

    public static Modifier override() {
      return new Modifier(Kind.OVERRIDE);
    }

    public static Modifier overridable() {
      return new Modifier(Kind.OVERRIDABLE);
    }

    /** Returns the builder method name, for example {@code override}. */
    public String keyword() {
      switch (kind()) {
        case ABSTRACT:
          return "abstract";
        case OVERRIDE:
          return "override";
        default:
          return "overridable";
      }
    }

    @Override
    Modifier copy() {
      return new Modifier(kind());
    }
  }

  /** {@code type_parameters(:U, :V)}. Names are stored without the leading colon. */
  public static final class TypeParameters extends SigOp {
    private final List<String> names;

    public TypeParameters(List<String> names) {
      super(Kind.TYPE_PARAMETERS);
      this.names = new ArrayList<>(names);
    }

    public List<String> getNames() {
      return Collections.unmodifiableList(names);
    }

    void add(String name) {
      names.add(name);
    }

    @Override
    TypeParameters copy() {
      return new TypeParameters(names);
    }
  }

  /** {@code params(a: A, b: B)}. Each parameter carries its type and, optionally, comments. */
  public static final class Params extends SigOp {
    private final List<Param> params;

    public Params(List<Param> params) {
      super(Kind.PARAMS);
      this.params = new ArrayList<>(params);
    }

    public List<Param> getParams() {
      return Collections.unmodifiableList(params);
    }

    void add(Param param) {
      params.add(param);
    }

    @Override
    Params copy() {
      List<Param> copies = new ArrayList<>();
      for (Param param : params) {
        copies.add(param.copy());
      }
      return new Params(copies);
    }
  }

  /** {@code returns(Type)}. */
  public static final class Returns extends SigOp {
    private final String type;

    public Returns(String type) {
      super(Kind.RETURNS);
      this.type = type;
    }

    public String getType() {
      return type;
    }

    @Override
    Returns copy() {
      return this;
    }
  }

  /** {@code void}. */
  public static final class Void extends SigOp {
    public Void() {
      super(Kind.VOID);
    }

    @Override
    Void copy() {
      return this;
    }
  }

  /** {@code checked(:level)}. The level is stored without the leading colon. */
  public static final class Checked extends SigOp {
    private final String level;

    public Checked(String level) {
      super(Kind.CHECKED);
      this.level = level;
    }

    public String getLevel() {
      return level;
    }

    @Override
    Checked copy() {
      return this;
    }
  }

  static ImmutableList<SigOp> copyAll(List<SigOp> ops) {
    ImmutableList.Builder<SigOp> copies = ImmutableList.builder();
    for (SigOp op : ops) {
      copies.add(op.copy());
    }
    return copies.build();
  }
}
