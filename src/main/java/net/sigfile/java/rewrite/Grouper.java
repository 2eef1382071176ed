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

import com.google.common.collect.Sets;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import net.sigfile.java.tree.Attr;
import net.sigfile.java.tree.BlankLine;
import net.sigfile.java.tree.Def;
import net.sigfile.java.tree.Root;
import net.sigfile.java.tree.Scope;
import net.sigfile.java.tree.Stmt;

/**
 * Normalizes the blank lines separating declarations, in place:
 *
 * <ul>
 *   <li>contiguous methods without signatures are not separated by blank lines;
 *   <li>a method or attribute with at least one signature is preceded by exactly one blank line;
 *   <li>adjacent top-level scopes are separated by exactly one blank line.
 * </ul>
 *
 * <p>Other blank lines are left as they are. Grouping an already grouped tree leaves it unchanged.
 */
public final class Grouper {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private Grouper() {}

  /** Groups the body of {@code scope} and of every scope nested in it. */
  public static void group(Scope scope) {
    groupBody(scope);
    for (Stmt child : scope.getBody()) {
      if (child instanceof Scope) {
        group((Scope) child);
      }
    }
  }

  private static void groupBody(Scope scope) {
    List<Stmt> grouped = new ArrayList<>();
    List<Stmt> pending = new ArrayList<>();
    Stmt previous = null;
    for (Stmt child : scope.getBody()) {
      if (child.kind() == Stmt.Kind.BLANK_LINE) {
        pending.add(child);
        continue;
      }
      int wanted = separation(scope, previous, child, pending.size());
      for (int i = 0; i < wanted; i++) {
        grouped.add(i < pending.size() ? pending.get(i) : new BlankLine());
      }
      grouped.add(child);
      pending.clear();
      previous = child;
    }
    grouped.addAll(pending);

    Set<Stmt> kept = Sets.newIdentityHashSet();
    kept.addAll(grouped);
    int removed = scope.detachIf(child -> !kept.contains(child));
    scope.attachAll(grouped);
    logger.atFinest().log(
        "grouped '%s': %d blank lines removed", scope.qualifiedName(), removed);
  }

  /** Returns how many blank lines should separate {@code child} from {@code previous}. */
  private static int separation(
      Scope scope, @Nullable Stmt previous, Stmt child, int current) {
    if (previous == null) {
      return current;
    }
    if (hasSigs(child)) {
      return 1;
    }
    if (isSiglessDef(previous) && isSiglessDef(child)) {
      return 0;
    }
    if (scope instanceof Root && previous instanceof Scope && child instanceof Scope) {
      return 1;
    }
    return current;
  }

  private static boolean hasSigs(Stmt node) {
    if (node instanceof Def) {
      return !((Def) node).getSigs().isEmpty();
    }
    if (node instanceof Attr) {
      return !((Attr) node).getSigs().isEmpty();
    }
    return false;
  }

  private static boolean isSiglessDef(Stmt node) {
    return node instanceof Def && ((Def) node).getSigs().isEmpty();
  }
}
