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
package net.sigfile.java.rewrite;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.sigfile.java.tree.ClassScope;
import net.sigfile.java.tree.Comment;
import net.sigfile.java.tree.Def;
import net.sigfile.java.tree.Node;
import net.sigfile.java.tree.Printer;
import net.sigfile.java.tree.PrinterOptions;
import net.sigfile.java.tree.Root;
import net.sigfile.java.tree.Scope;
import net.sigfile.java.tree.StandaloneComment;
import net.sigfile.java.tree.Stmt;
import net.sigfile.java.tree.StructScope;
import net.sigfile.java.tree.Visibility;

/**
 * Combines several trees into one.
 *
 * <p>Scopes with the same qualified name are unified: their comments are combined and their bodies
 * merged recursively. Other declarations with the same qualified name are unified when they are
 * structurally identical (ignoring comments and locations); otherwise the first one wins and a
 * {@link Conflict} is recorded. Declarations are otherwise kept in encounter order, and a method
 * or attribute keeps the visibility it had in its input: visibility markers are emitted in the
 * merged body where the visibility changes. The input trees are not modified.
 */
public final class Merger {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  // Declarations already present in each scope of the merged tree, by qualified name.
  private final Map<Scope, Map<String, Stmt>> index = new IdentityHashMap<>();
  private final ImmutableList.Builder<Conflict> conflicts = ImmutableList.builder();

  private Merger() {}

  public static MergeResult merge(List<Root> trees) {
    Merger merger = new Merger();
    Root merged = new Root();
    for (Root tree : trees) {
      merger.unionComments(merged, tree);
      merger.mergeBody(merged, tree);
    }
    ImmutableList<Conflict> found = merger.conflicts.build();
    for (Conflict conflict : found) {
      logger.atWarning().log("merge conflict: %s", conflict);
    }
    logger.atFine().log("merged %d trees with %d conflicts", trees.size(), found.size());
    return MergeResult.create(merged, found);
  }

  private void mergeBody(Scope into, Scope from) {
    Map<String, Stmt> existing = index.computeIfAbsent(into, Merger::indexOf);
    // Visibility in effect at the current position of the input body.
    Visibility.Level visibility = Visibility.Level.PUBLIC;
    for (Stmt child : from.getBody()) {
      switch (child.kind()) {
        case BLANK_LINE:
          continue;
        case VISIBILITY:
          visibility = ((Visibility) child).getLevel();
          continue;
        case COMMENT:
          mergeComment(into, (StandaloneComment) child);
          continue;
        default:
          break;
      }
      String key = keyOf(child);
      Stmt previous = existing.get(key);
      if (previous == null) {
        existing.put(key, add(into, child, visibility));
      } else if (previous instanceof Scope && child instanceof Scope) {
        mergeScope((Scope) previous, (Scope) child);
      } else if (previous instanceof Scope || child instanceof Scope) {
        report(
            Conflict.Kind.DECLARATION_MISMATCH,
            previous,
            child,
            describe(previous) + " redeclared as " + describe(child));
      } else {
        mergeDeclaration(previous, child, visibility);
      }
    }
  }

  private Stmt add(Scope into, Stmt child, Visibility.Level visibility) {
    if (child instanceof Scope) {
      Scope scope = ((Scope) child).emptyCopy();
      into.attach(scope);
      mergeBody(scope, (Scope) child);
      return scope;
    }
    if (hasVisibility(child) && visibilityAtEnd(into) != visibility) {
      into.attach(new Visibility(visibility));
    }
    Stmt copy = child.copy();
    into.attach(copy);
    return copy;
  }

  private void mergeComment(Scope into, StandaloneComment comment) {
    String text = comment.getText().strip();
    for (Stmt child : into.getBody()) {
      if (child.kind() == Stmt.Kind.COMMENT
          && ((StandaloneComment) child).getComment().hasText(text)) {
        return;
      }
    }
    into.attach(comment.copy());
  }

  private void mergeScope(Scope previous, Scope scope) {
    if (previous.kind() != scope.kind()) {
      report(
          Conflict.Kind.SCOPE_KIND_MISMATCH,
          previous,
          scope,
          describe(previous) + " reopened as " + describe(scope));
      return;
    }
    if (previous instanceof ClassScope) {
      ClassScope first = (ClassScope) previous;
      String superclass = ((ClassScope) scope).getSuperclass();
      if (first.getSuperclass() == null) {
        first.setSuperclass(superclass);
      } else if (superclass != null && !superclass.equals(first.getSuperclass())) {
        report(
            Conflict.Kind.SUPERCLASS_MISMATCH,
            previous,
            scope,
            String.format(
                "superclass %s does not match %s", superclass, first.getSuperclass()));
      }
    } else if (previous instanceof StructScope) {
      StructScope first = (StructScope) previous;
      StructScope second = (StructScope) scope;
      if (!first.getMembers().equals(second.getMembers())
          || first.isKeywordInit() != second.isKeywordInit()) {
        report(
            Conflict.Kind.DECLARATION_MISMATCH,
            previous,
            scope,
            "struct members " + second.getMembers() + " do not match " + first.getMembers());
      }
    }
    unionComments(previous, scope);
    mergeBody(previous, scope);
  }

  private void mergeDeclaration(Stmt previous, Stmt child, Visibility.Level visibility) {
    String first = StructuralPrinter.structure(previous);
    String second = StructuralPrinter.structure(child);
    if (first.equals(second)) {
      Visibility.Level before = visibilityOf(previous);
      if (hasVisibility(previous) && before != visibility) {
        report(
            Conflict.Kind.SIGNATURE_MISMATCH,
            previous,
            child,
            String.format(
                "declared %s, but %s before", visibility.keyword(), before.keyword()));
        return;
      }
      unionComments(previous, child);
      return;
    }
    Conflict.Kind kind;
    switch (previous.kind()) {
      case CONST:
        kind =
            child.kind() == Stmt.Kind.CONST
                ? Conflict.Kind.CONST_VALUE_MISMATCH
                : Conflict.Kind.DECLARATION_MISMATCH;
        break;
      case DEF:
      case ATTR:
        kind =
            child.kind() == previous.kind()
                ? Conflict.Kind.SIGNATURE_MISMATCH
                : Conflict.Kind.DECLARATION_MISMATCH;
        break;
      default:
        kind = Conflict.Kind.DECLARATION_MISMATCH;
        break;
    }
    report(
        kind, previous, child, "'" + second.strip() + "' does not match '" + first.strip() + "'");
  }

  private void unionComments(Stmt into, Stmt from) {
    for (Comment comment : from.getComments()) {
      if (!into.hasComment(comment.getText().strip())) {
        into.addComment(new Comment(comment.getText(), comment.getLocation()));
      }
    }
  }

  private void report(Conflict.Kind kind, Stmt first, Stmt second, String message) {
    conflicts.add(
        Conflict.create(
            kind, keyOf(first), first.getLocation(), second.getLocation(), message));
  }

  private static Map<String, Stmt> indexOf(Scope scope) {
    Map<String, Stmt> byName = new LinkedHashMap<>();
    for (Stmt child : scope.getBody()) {
      if (child.kind() != Stmt.Kind.BLANK_LINE
          && child.kind() != Stmt.Kind.COMMENT
          && child.kind() != Stmt.Kind.VISIBILITY) {
        byName.putIfAbsent(keyOf(child), child);
      }
    }
    return byName;
  }

  /** Returns true if a visibility marker above {@code node} applies to it. */
  private static boolean hasVisibility(Stmt node) {
    return node.kind() == Stmt.Kind.ATTR
        || (node.kind() == Stmt.Kind.DEF && !((Def) node).isSingleton());
  }

  private static Visibility.Level visibilityAtEnd(Scope scope) {
    List<Stmt> body = scope.getBody();
    for (int i = body.size() - 1; i >= 0; i--) {
      if (body.get(i).kind() == Stmt.Kind.VISIBILITY) {
        return ((Visibility) body.get(i)).getLevel();
      }
    }
    return Visibility.Level.PUBLIC;
  }

  /** Returns the visibility set by the last marker above {@code node} in its scope. */
  private static Visibility.Level visibilityOf(Stmt node) {
    Visibility.Level level = Visibility.Level.PUBLIC;
    for (Stmt sibling : node.getParent().getBody()) {
      if (sibling == node) {
        break;
      }
      if (sibling.kind() == Stmt.Kind.VISIBILITY) {
        level = ((Visibility) sibling).getLevel();
      }
    }
    return level;
  }

  // "::A" and "A" name the same top-level constant.
  private static String keyOf(Stmt node) {
    String name = node.qualifiedName();
    return name.startsWith("::") ? name.substring(2) : name;
  }

  private static String describe(Stmt node) {
    return node.kind().name().toLowerCase(Locale.ROOT).replace('_', ' ');
  }

  /** Renders a declaration without its comments and locations, for structural comparison. */
  private static final class StructuralPrinter extends Printer {

    private StructuralPrinter(StringBuilder out) {
      super(out, PrinterOptions.DEFAULT);
    }

    static String structure(Node node) {
      StringBuilder buf = new StringBuilder();
      new StructuralPrinter(buf).visit(node);
      return buf.toString();
    }

    @Override
    protected void printComments(Stmt node) {}

    @Override
    protected void printLocation(Node node) {}
  }
}
