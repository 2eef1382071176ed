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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * An {@code attr_reader}, {@code attr_writer} or {@code attr_accessor} declaration, with the
 * signatures that precede it.
 */
public final class Attr extends Send {

  /** The accessor call. */
  public enum Access {
    READER("attr_reader"),
    WRITER("attr_writer"),
    ACCESSOR("attr_accessor");

    private final String keyword;

    Access(String keyword) {
      this.keyword = keyword;
    }

    public String keyword() {
      return keyword;
    }
  }

  private final Access access;
  private final List<Sig> sigs = new ArrayList<>();
  @Nullable private Visibility.Level visibility;

  /**
   * Creates an attribute declaration for {@code names} (without leading colons). If {@code type} is
   * given, a signature is synthesized: readers return it, writers take it and return void, and
   * accessors take and return it.
   */
  public Attr(
      Access access, List<String> names, @Nullable String type, @Nullable Location location) {
    super(Kind.ATTR, access.keyword(), names, null, location);
    checkArgument(!names.isEmpty(), "an attribute declaration needs at least one name");
    this.access = access;
    if (type != null) {
      Sig sig = new Sig();
      if (access != Access.READER) {
        sig.addParam(new Param.Required(names.get(0), type));
      }
      sigs.add(sig.setReturnType(access == Access.WRITER ? "void" : type));
    }
  }

  public static Attr reader(String... names) {
    return new Attr(Access.READER, List.of(names), null, null);
  }

  public static Attr writer(String... names) {
    return new Attr(Access.WRITER, List.of(names), null, null);
  }

  public static Attr accessor(String... names) {
    return new Attr(Access.ACCESSOR, List.of(names), null, null);
  }

  public Access getAccess() {
    return access;
  }

  /** Returns the attribute names, without leading colons. */
  public List<String> getNames() {
    return getArgs();
  }

  public List<Sig> getSigs() {
    return Collections.unmodifiableList(sigs);
  }

  @CanIgnoreReturnValue
  public Attr addSig(Sig sig) {
    sigs.add(sig);
    return this;
  }

  @Nullable
  public Visibility.Level getVisibility() {
    return visibility;
  }

  @CanIgnoreReturnValue
  public Attr setVisibility(@Nullable Visibility.Level visibility) {
    this.visibility = visibility;
    return this;
  }

  /** Returns a placeholder signature typing the attribute as {@code T.untyped}. */
  public Sig templateSig() {
    Sig sig = new Sig();
    if (access != Access.READER) {
      for (String name : getNames()) {
        sig.addParam(new Param.Required(name, Sig.UNTYPED));
      }
    }
    return sig.setReturnType(access == Access.WRITER ? "void" : Sig.UNTYPED);
  }

  @Override
  public Attr copy() {
    Attr copy = withCommonPartsOf(new Attr(access, getNames(), null, null));
    copy.sigs.addAll(Sig.copyAll(sigs));
    copy.visibility = visibility;
    return copy;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
