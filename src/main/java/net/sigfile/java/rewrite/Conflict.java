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

import com.google.auto.value.AutoValue;
import javax.annotation.Nullable;
import net.sigfile.java.tree.Location;

/** A pair of declarations with the same qualified name that could not be unified. */
@AutoValue
public abstract class Conflict {

  /** What disagreed between the two declarations. */
  public enum Kind {
    /** A module reopened as a class, or the reverse. */
    SCOPE_KIND_MISMATCH,
    SUPERCLASS_MISMATCH,
    CONST_VALUE_MISMATCH,
    /** Two methods or attributes with different parameters, signatures or modifiers. */
    SIGNATURE_MISMATCH,
    DECLARATION_MISMATCH,
  }

  public abstract Kind kind();

  public abstract String qualifiedName();

  /** Location of the declaration kept in the merged tree. */
  @Nullable
  public abstract Location firstLocation();

  /** Location of the declaration that was dropped. */
  @Nullable
  public abstract Location secondLocation();

  public abstract String message();

  static Conflict create(
      Kind kind,
      String qualifiedName,
      @Nullable Location firstLocation,
      @Nullable Location secondLocation,
      String message) {
    return new AutoValue_Conflict(kind, qualifiedName, firstLocation, secondLocation, message);
  }

  @Override
  public final String toString() {
    StringBuilder buf = new StringBuilder();
    buf.append(kind()).append(' ').append(qualifiedName()).append(": ").append(message());
    if (firstLocation() != null) {
      buf.append(" (first at ").append(firstLocation()).append(')');
    }
    if (secondLocation() != null) {
      buf.append(" (second at ").append(secondLocation()).append(')');
    }
    return buf.toString();
  }
}
