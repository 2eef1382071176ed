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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A call statement in a scope body: {@code method arg1, arg2}, with raw-text arguments and an
 * optional raw-text trailing block.
 *
 * <p>Mixins, visibility markers, type-system helpers, typed struct fields, enum blocks and
 * attribute accessors are all sends; each has its own subclass and {@link Stmt.Kind}.
 */
public class Send extends Stmt {

  private static final Joiner ARG_JOINER = Joiner.on(',');

  private final String method;
  private final List<String> args;
  @Nullable private final String block;

  public Send(String method, List<String> args) {
    this(method, args, null, null);
  }

  public Send(
      String method, List<String> args, @Nullable String block, @Nullable Location location) {
    this(Kind.SEND, method, args, block, location);
  }

  Send(
      Kind kind,
      String method,
      List<String> args,
      @Nullable String block,
      @Nullable Location location) {
    super(kind, location);
    this.method = method;
    this.args = new ArrayList<>(args);
    this.block = block;
  }

  public final String getMethod() {
    return method;
  }

  public final List<String> getArgs() {
    return Collections.unmodifiableList(args);
  }

  /** Returns the raw text of the trailing block, or null if there is none. */
  @Nullable
  public final String getBlock() {
    return block;
  }

  final void addArg(String arg) {
    args.add(arg);
  }

  /** Returns {@code method(arg,arg)}, the form used to order and identify sends. */
  public final String callText() {
    return method + "(" + ARG_JOINER.join(args) + ")";
  }

  /** Joins the enclosing scope's name with {@code .method(arg,arg)}. */
  @Override
  public String qualifiedName() {
    return parentQualifiedName() + "." + callText();
  }

  @Override
  public Send copy() {
    return withCommonPartsOf(new Send(method, ImmutableList.copyOf(args), block, null));
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
