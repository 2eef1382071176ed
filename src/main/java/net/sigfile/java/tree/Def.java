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
 * A method declaration, {@code def [self.]name(params); end}, with the signatures that precede it.
 *
 * <p>If any parameter given to the constructor carries a type, or a return type is given, one
 * signature is synthesized from those types.
 */
public final class Def extends Stmt {

  private final String name;
  private final boolean singleton;
  private final List<Param> params;
  @Nullable private final String returnType;
  private final List<Sig> sigs = new ArrayList<>();
  @Nullable private Visibility.Level visibility;

  public Def(String name) {
    this(name, false, ImmutableList.of(), null, null);
  }

  public Def(String name, boolean singleton) {
    this(name, singleton, ImmutableList.of(), null, null);
  }

  public Def(
      String name,
      boolean singleton,
      List<? extends Param> params,
      @Nullable String returnType,
      @Nullable Location location) {
    super(Kind.DEF, location);
    this.name = name;
    this.singleton = singleton;
    this.params = new ArrayList<>(params);
    this.returnType = returnType;
    if (returnType != null || params.stream().anyMatch(p -> p.getType() != null)) {
      sigs.add(Sig.of(params, returnType));
    }
  }

  // Copy constructor: no signature is synthesized.
  private Def(String name, boolean singleton, @Nullable String returnType) {
    super(Kind.DEF, null);
    this.name = name;
    this.singleton = singleton;
    this.params = new ArrayList<>();
    this.returnType = returnType;
  }

  public String getName() {
    return name;
  }

  /** Returns true for a method defined on the singleton ({@code def self.name}). */
  public boolean isSingleton() {
    return singleton;
  }

  public List<Param> getParams() {
    return Collections.unmodifiableList(params);
  }

  @CanIgnoreReturnValue
  public Def addParam(Param param) {
    params.add(param);
    return this;
  }

  /** Returns the return type given at construction, or null. */
  @Nullable
  public String getReturnType() {
    return returnType;
  }

  public List<Sig> getSigs() {
    return Collections.unmodifiableList(sigs);
  }

  @CanIgnoreReturnValue
  public Def addSig(Sig sig) {
    sigs.add(sig);
    return this;
  }

  /** Returns the visibility prefix, or null if the method is printed without one. */
  @Nullable
  public Visibility.Level getVisibility() {
    return visibility;
  }

  @CanIgnoreReturnValue
  public Def setVisibility(@Nullable Visibility.Level visibility) {
    this.visibility = visibility;
    return this;
  }

  /** Returns true if any parameter carries a comment, forcing a multi-line parameter list. */
  public boolean hasParamComments() {
    for (Param param : params) {
      if (!param.getComments().isEmpty()) {
        return true;
      }
    }
    return false;
  }

  /** Returns a placeholder signature typing every parameter and the result as {@code T.untyped}. */
  public Sig templateSig() {
    Sig sig = new Sig();
    for (Param param : params) {
      sig.addParam(param.withType(Sig.UNTYPED));
    }
    return sig.setReturnType(Sig.UNTYPED);
  }

  /** Joins the enclosing scope's name with {@code #name}, or {@code ::name} for singletons. */
  @Override
  public String qualifiedName() {
    return parentQualifiedName() + (singleton ? "::" : "#") + name;
  }

  @Override
  public Def copy() {
    Def copy = withCommonPartsOf(new Def(name, singleton, returnType));
    for (Param param : params) {
      copy.params.add(param.copy());
    }
    copy.sigs.addAll(Sig.copyAll(sigs));
    copy.visibility = visibility;
    return copy;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
