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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A signature preceding a method or attribute declaration: an ordered chain of {@link SigOp}
 * builder operations.
 *
 * <p>The printer renders the operations grouped by kind (type parameters, params, modifiers,
 * return, checked level), keeping modifiers in the order they were added. A signature without a
 * return operation renders as {@code void}.
 */
public final class Sig extends Node {

  /** The type used by placeholder signatures. */
  public static final String UNTYPED = "T.untyped";

  private final List<SigOp> ops = new ArrayList<>();

  public Sig() {
    this((Location) null);
  }

  public Sig(@Nullable Location location) {
    super(location);
  }

  /**
   * Creates a signature with a {@code params} operation listing {@code params} (unless empty) and
   * a return operation for {@code returnType} (unless null). A return type of {@code void} becomes
   * a {@link SigOp.Void}.
   */
  public static Sig of(List<? extends Param> params, @Nullable String returnType) {
    Sig sig = new Sig();
    for (Param param : params) {
      sig.addParam(param.copy());
    }
    if (returnType != null) {
      sig.setReturnType(returnType);
    }
    return sig;
  }

  public List<SigOp> getOps() {
    return Collections.unmodifiableList(ops);
  }

  @CanIgnoreReturnValue
  public Sig add(SigOp op) {
    ops.add(op);
    return this;
  }

  /** Appends a parameter to the {@code params} operation, creating it if needed. */
  @CanIgnoreReturnValue
  public Sig addParam(Param param) {
    SigOp.Params existing = find(SigOp.Params.class);
    if (existing == null) {
      ops.add(new SigOp.Params(ImmutableList.of(param)));
    } else {
      existing.add(param);
    }
    return this;
  }

  /** Appends a name to the {@code type_parameters} operation, creating it if needed. */
  @CanIgnoreReturnValue
  public Sig addTypeParameter(String name) {
    SigOp.TypeParameters existing = find(SigOp.TypeParameters.class);
    if (existing == null) {
      ops.add(new SigOp.TypeParameters(ImmutableList.of(name)));
    } else {
      existing.add(name);
    }
    return this;
  }

  /** Replaces any return operation; {@code void} becomes {@link SigOp.Void}. */
  @CanIgnoreReturnValue
  public Sig setReturnType(String type) {
    ops.removeIf(op -> op.kind() == SigOp.Kind.RETURNS || op.kind() == SigOp.Kind.VOID);
    ops.add(type.equals("void") ? new SigOp.Void() : new SigOp.Returns(type));
    return this;
  }

  /** Replaces any {@code checked} operation. */
  @CanIgnoreReturnValue
  public Sig setChecked(String level) {
    ops.removeIf(op -> op.kind() == SigOp.Kind.CHECKED);
    ops.add(new SigOp.Checked(level));
    return this;
  }

  @CanIgnoreReturnValue
  public Sig markAbstract() {
    return addModifier(SigOp.Modifier.abstractMethod());
  }

  @CanIgnoreReturnValue
  public Sig markOverride() {
    return addModifier(SigOp.Modifier.override());
  }

  @CanIgnoreReturnValue
  public Sig markOverridable() {
    return addModifier(SigOp.Modifier.overridable());
  }

  private Sig addModifier(SigOp.Modifier modifier) {
    if (!has(modifier.kind())) {
      ops.add(modifier);
    }
    return this;
  }

  public boolean has(SigOp.Kind kind) {
    for (SigOp op : ops) {
      if (op.kind() == kind) {
        return true;
      }
    }
    return false;
  }

  /** Returns the parameters of the {@code params} operation, or an empty list. */
  public List<Param> getParams() {
    SigOp.Params params = find(SigOp.Params.class);
    return params == null ? ImmutableList.of() : params.getParams();
  }

  /** Returns the type parameter names, or an empty list. */
  public List<String> getTypeParameters() {
    SigOp.TypeParameters typeParameters = find(SigOp.TypeParameters.class);
    return typeParameters == null ? ImmutableList.of() : typeParameters.getNames();
  }

  /** Returns the modifiers in the order they were added. */
  public ImmutableList<SigOp.Modifier> getModifiers() {
    ImmutableList.Builder<SigOp.Modifier> modifiers = ImmutableList.builder();
    for (SigOp op : ops) {
      if (op instanceof SigOp.Modifier) {
        modifiers.add((SigOp.Modifier) op);
      }
    }
    return modifiers.build();
  }

  /** Returns the declared return type, or null if the signature returns void. */
  @Nullable
  public String getReturnType() {
    SigOp.Returns returns = find(SigOp.Returns.class);
    return returns == null ? null : returns.getType();
  }

  @Nullable
  public String getChecked() {
    SigOp.Checked checked = find(SigOp.Checked.class);
    return checked == null ? null : checked.getLevel();
  }

  /** Returns true if any parameter of the {@code params} operation carries a comment. */
  public boolean hasParamComments() {
    for (Param param : getParams()) {
      if (!param.getComments().isEmpty()) {
        return true;
      }
    }
    return false;
  }

  @Nullable
  private <T extends SigOp> T find(Class<T> type) {
    for (SigOp op : ops) {
      if (type.isInstance(op)) {
        return type.cast(op);
      }
    }
    return null;
  }

  public Sig copy() {
    Sig copy = new Sig(getLocation());
    copy.ops.addAll(SigOp.copyAll(ops));
    return copy;
  }

  static ImmutableList<Sig> copyAll(List<Sig> sigs) {
    ImmutableList.Builder<Sig> copies = ImmutableList.builder();
    for (Sig sig : sigs) {
      copies.add(sig.copy());
    }
    return copies.build();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
