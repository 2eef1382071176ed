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
package net.sigfile.java.validate;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;
import java.util.List;
import net.sigfile.java.tree.Root;
import net.sigfile.java.tree.Scope;
import net.sigfile.java.tree.Stmt;

/**
 * All declarations of a set of trees, by qualified name, in encounter order. Blank lines,
 * standalone comments and visibility markers are not declarations and are left out.
 */
public final class DeclarationIndex {

  private final ImmutableList<Root> trees;
  private final ImmutableList<Stmt> all;
  private final ImmutableListMultimap<String, Stmt> declarations;

  private DeclarationIndex(ImmutableList<Root> trees, ImmutableList<Stmt> all) {
    this.trees = trees;
    this.all = all;
    this.declarations = Multimaps.index(all, Stmt::qualifiedName);
  }

  public static DeclarationIndex of(List<Root> trees) {
    ImmutableList.Builder<Stmt> all = ImmutableList.builder();
    for (Root tree : trees) {
      addBody(all, tree);
    }
    return new DeclarationIndex(ImmutableList.copyOf(trees), all.build());
  }

  private static void addBody(ImmutableList.Builder<Stmt> all, Scope scope) {
    for (Stmt child : scope.getBody()) {
      if (!isDeclaration(child)) {
        continue;
      }
      all.add(child);
      if (child instanceof Scope) {
        addBody(all, (Scope) child);
      }
    }
  }

  private static boolean isDeclaration(Stmt node) {
    switch (node.kind()) {
      case BLANK_LINE:
      case COMMENT:
      case VISIBILITY:
        return false;
      default:
        return true;
    }
  }

  public ImmutableList<Root> getTrees() {
    return trees;
  }

  /** Returns the declarations named {@code qualifiedName}, in encounter order. */
  public ImmutableList<Stmt> get(String qualifiedName) {
    return declarations.get(qualifiedName);
  }

  public ImmutableListMultimap<String, Stmt> asMultimap() {
    return declarations;
  }

  /** Returns every declaration, in encounter order. */
  public ImmutableList<Stmt> all() {
    return all;
  }
}
