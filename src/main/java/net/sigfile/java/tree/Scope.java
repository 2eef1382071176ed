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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndex;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;
import javax.annotation.Nullable;

/**
 * A named statement owning an ordered body of child statements.
 *
 * <p>All changes to parent/child links go through this class. Attaching a statement that belongs
 * to another scope moves it: it is first removed from the previous body, then appended here, so a
 * statement is never listed in two bodies. If the previous parent does not actually list the
 * statement, the tree is corrupt and a {@link StructuralFaultException} is thrown.
 *
 * <p>Trees are not synchronized; concurrent mutation must be serialized by the caller.
 */
public abstract class Scope extends Stmt {

  private final String name;
  private final List<Stmt> body = new ArrayList<>();

  Scope(Kind kind, String name, @Nullable Location location) {
    super(kind, location);
    this.name = checkNotNull(name);
  }

  public final String getName() {
    return name;
  }

  /** Returns an unmodifiable view of the body. */
  public final List<Stmt> getBody() {
    return Collections.unmodifiableList(body);
  }

  public final boolean isEmpty() {
    return body.isEmpty();
  }

  /** Appends {@code child} to the body, detaching it from its previous parent if any. */
  @CanIgnoreReturnValue
  public final Scope attach(Stmt child) {
    checkAdoptable(child);
    release(child);
    adopt(body.size(), child);
    return this;
  }

  /** Appends each of {@code children} in turn. */
  @CanIgnoreReturnValue
  public final Scope attachAll(Iterable<? extends Stmt> children) {
    for (Stmt child : children) {
      attach(child);
    }
    return this;
  }

  /**
   * Inserts {@code child} at {@code index} of the body, detaching it from its previous parent
   * first. The index is interpreted after the detachment.
   */
  public final void insert(int index, Stmt child) {
    checkAdoptable(child);
    checkPositionIndex(index, child.getParent() == this ? body.size() - 1 : body.size());
    release(child);
    adopt(index, child);
  }

  /** Removes {@code child} from the body and leaves it unattached. */
  public final void detach(Stmt child) {
    checkArgument(child.getParent() == this, "%s is not a child of %s", child.kind(), name);
    release(child);
  }

  /** Detaches every child matching {@code filter}, and returns how many were removed. */
  @CanIgnoreReturnValue
  public final int detachIf(Predicate<? super Stmt> filter) {
    int removed = 0;
    for (Iterator<Stmt> it = body.iterator(); it.hasNext(); ) {
      Stmt child = it.next();
      if (filter.test(child)) {
        it.remove();
        child.setParent(null);
        removed++;
      }
    }
    return removed;
  }

  /** Reorders the body with a stable sort. Ownership is unaffected. */
  public final void sortBody(Comparator<? super Stmt> order) {
    body.sort(order);
  }

  // Checked before the child is released, so a rejected move leaves both parents unchanged.
  private void checkAdoptable(Stmt child) {
    checkNotNull(child);
    checkArgument(!(child instanceof Root), "the root scope cannot be attached");
    for (Scope s = this; s != null; s = s.getParent()) {
      checkArgument(s != child, "attaching %s to %s would create a cycle", child.kind(), name);
    }
  }

  private void adopt(int index, Stmt child) {
    child.setParent(this);
    body.add(index, child);
  }

  private static void release(Stmt child) {
    checkNotNull(child);
    Scope previous = child.getParent();
    if (previous == null) {
      return;
    }
    if (!previous.body.remove(child)) {
      throw new StructuralFaultException(
          String.format(
              "%s claims parent %s, which does not list it",
              child.qualifiedName(), previous.qualifiedName()));
    }
    child.setParent(null);
  }

  @Override
  public String qualifiedName() {
    return qualify(name);
  }

  /** Returns an unattached copy of this scope with its comments and location but an empty body. */
  public abstract Scope emptyCopy();

  @Override
  public final Scope copy() {
    Scope copy = emptyCopy();
    for (Stmt child : body) {
      copy.attach(child.copy());
    }
    return copy;
  }
}
