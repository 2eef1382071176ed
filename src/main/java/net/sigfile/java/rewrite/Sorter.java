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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import net.sigfile.java.tree.Const;
import net.sigfile.java.tree.Def;
import net.sigfile.java.tree.Scope;
import net.sigfile.java.tree.Send;
import net.sigfile.java.tree.Stmt;
import net.sigfile.java.tree.TypeMember;

/**
 * Canonicalizes the order of declarations within each scope, in place.
 *
 * <p>Children are ordered by rank (mixins, helpers and other calls first, then nested scopes and
 * constants, then attributes, then methods) and, within a rank, by name. The sort is stable and
 * does not move declarations across visibility markers, which would change their visibility.
 * Standalone comments move together with the declaration that follows them, and comments with no
 * following declaration stay at the end of their section. Blank lines are dropped from the bodies
 * it reorders; {@link Grouper} puts separators back.
 *
 * <p>Sorting an already sorted tree leaves it unchanged.
 */
public final class Sorter {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final Comparator<Stmt> ORDER =
      Comparator.comparingInt(Sorter::rank).thenComparing(Sorter::sortName);

  private Sorter() {}

  /** Sorts the body of {@code scope} and of every scope nested in it. */
  public static void sort(Scope scope) {
    for (Stmt child : scope.getBody()) {
      if (child instanceof Scope) {
        sort((Scope) child);
      }
    }
    int dropped = scope.detachIf(child -> child.kind() == Stmt.Kind.BLANK_LINE);

    List<Stmt> sorted = new ArrayList<>();
    List<Entry> section = new ArrayList<>();
    List<Stmt> pendingComments = new ArrayList<>();
    for (Stmt child : scope.getBody()) {
      if (child.kind() == Stmt.Kind.COMMENT) {
        pendingComments.add(child);
      } else if (child.kind() == Stmt.Kind.VISIBILITY) {
        flush(section, pendingComments, sorted);
        sorted.add(child);
      } else {
        section.add(new Entry(ImmutableList.copyOf(pendingComments), child));
        pendingComments.clear();
      }
    }
    flush(section, pendingComments, sorted);

    // Re-attaching moves each child to the end of the body, leaving it in sorted order.
    scope.attachAll(ImmutableList.copyOf(sorted));
    logger.atFinest().log(
        "sorted %d declarations of '%s', dropped %d blank lines",
        sorted.size(), scope.qualifiedName(), dropped);
  }

  private static void flush(List<Entry> section, List<Stmt> trailingComments, List<Stmt> sorted) {
    section.sort(Comparator.comparing((Entry entry) -> entry.declaration, ORDER));
    for (Entry entry : section) {
      sorted.addAll(entry.leadingComments);
      sorted.add(entry.declaration);
    }
    sorted.addAll(trailingComments);
    section.clear();
    trailingComments.clear();
  }

  private static int rank(Stmt node) {
    switch (node.kind()) {
      case MIXIN:
      case HELPER:
      case MIXES_IN_CLASS_METHODS:
      case TYPE_MEMBER:
      case STRUCT_FIELD:
      case ENUMS_BLOCK:
      case VISIBILITY:
      case SEND:
        return 0;
      case MODULE:
      case CLASS:
      case SINGLETON_CLASS:
      case STRUCT:
      case CONST:
        return 1;
      case ATTR:
        return 2;
      case DEF:
        return 3;
      case ROOT:
      case BLANK_LINE:
      case COMMENT:
        break;
    }
    throw new IllegalStateException("cannot rank " + node.kind());
  }

  private static String sortName(Stmt node) {
    if (node instanceof Scope) {
      return ((Scope) node).getName();
    } else if (node instanceof Const) {
      return ((Const) node).getName();
    } else if (node instanceof Def) {
      return ((Def) node).getName();
    } else if (node instanceof TypeMember) {
      return ((TypeMember) node).getName();
    } else if (node instanceof Send) {
      return ((Send) node).callText();
    }
    throw new IllegalStateException("cannot name " + node.kind());
  }

  /** A declaration and the standalone comments directly above it. */
  private static final class Entry {
    final ImmutableList<Stmt> leadingComments;
    final Stmt declaration;

    Entry(ImmutableList<Stmt> leadingComments, Stmt declaration) {
      this.leadingComments = leadingComments;
      this.declaration = declaration;
    }
  }
}
