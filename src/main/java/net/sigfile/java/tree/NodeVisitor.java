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

import java.util.List;

/**
 * A visitor over the nodes of a declaration tree.
 *
 * <p>Every concrete node class has an abstract {@code visit()} overload here, so a subclass fails
 * to compile unless it handles all of them. Callers should enter through {@link #visit(Node)},
 * which dispatches on the runtime class of the node.
 *
 * <p>Traversal into scope bodies, signatures and comments is left to the subclass.
 */
public abstract class NodeVisitor {

  /** Entrypoint for visiting a node. Clients should avoid calling node-specific overloads. */
  public final void visit(Node node) {
    // Double-dispatch pattern.
    node.accept(this);
  }

  // ==== Miscellaneous node types ====

  public abstract void visit(Comment node);

  public abstract void visit(Param node);

  public abstract void visit(Sig node);

  // ==== Scopes ====

  public abstract void visit(Root node);

  public abstract void visit(ModuleScope node);

  public abstract void visit(ClassScope node);

  public abstract void visit(SingletonClassScope node);

  public abstract void visit(StructScope node);

  // ==== Declarations ====

  public abstract void visit(Const node);

  public abstract void visit(Def node);

  public abstract void visit(BlankLine node);

  public abstract void visit(StandaloneComment node);

  // ==== Sends ====

  public abstract void visit(Send node);

  public abstract void visit(Attr node);

  public abstract void visit(Mixin node);

  public abstract void visit(Visibility node);

  public abstract void visit(Helper node);

  public abstract void visit(MixesInClassMethods node);

  public abstract void visit(TypeMember node);

  public abstract void visit(StructField node);

  public abstract void visit(EnumsBlock node);

  // ==== Helpers for sequences of nodes ====

  /** Visits a sequence of nodes in order. */
  public final void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }
}
